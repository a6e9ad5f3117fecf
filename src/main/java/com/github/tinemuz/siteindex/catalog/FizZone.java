/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.siteindex.catalog;

/**
 * Coarse Forest Inventory Zone classification.
 *
 * <p>Zones A to C are coastal and D to L interior; any other code is unknown.
 * Codes are case sensitive.</p>
 */
public enum FizZone {
    UNKNOWN(0),
    COAST(1),
    INTERIOR(2);

    private final int code;

    FizZone(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static FizZone of(char fiz) {
        if (fiz >= 'A' && fiz <= 'C') {
            return COAST;
        }
        if (fiz >= 'D' && fiz <= 'L') {
            return INTERIOR;
        }
        return UNKNOWN;
    }
}
