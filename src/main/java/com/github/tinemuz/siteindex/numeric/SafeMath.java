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
package com.github.tinemuz.siteindex.numeric;

/**
 * Domain-guarded {@code pow} and {@code log}.
 *
 * <p>Several fitted equations raise or log {@code siteIndex - breastHeight};
 * at or below zero these return a fixed floor instead of NaN. The log floor
 * is {@code log(0.00001)} and must stay that value for results to match
 * historical outputs.</p>
 */
public final class SafeMath {
    private static final double LOG_FLOOR = Math.log(0.00001);

    private SafeMath() {}

    /** {@code x^y}, or 0 when {@code x <= 0}. */
    public static double ppow(double x, double y) {
        return x <= 0.0 ? 0.0 : Math.pow(x, y);
    }

    /** {@code ln(x)}, or {@code ln(0.00001)} when {@code x <= 0}. */
    public static double llog(double x) {
        return x <= 0.0 ? LOG_FLOOR : Math.log(x);
    }
}
