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
package com.github.tinemuz.siteindex;

import java.util.Optional;

/**
 * Reasons a conversion can fail.
 *
 * <p>Each kind carries the negative number historically returned in place of
 * a height, age or site index, so callers that test the sign of a result keep
 * working through {@link SiteIndexResult#toLegacy()}.</p>
 */
public enum ErrorKind {
    /** Site index below breast height, or height below breast height for a breast-height age. */
    SITE_INDEX_TOO_LOW(-1),
    /** Growth-intercept breast-height age under 0.5 years. */
    BELOW_MINIMUM_GI_AGE(-2),
    /** Growth-intercept breast-height age beyond the fitted range. */
    ABOVE_MAXIMUM_GI_AGE(-3),
    /** No answer: a solver left its bounds, or the curve is undefined for the inputs. */
    NO_CONVERGENCE(-4),
    /** Curve index not known or not enabled. */
    UNKNOWN_CURVE(-5),
    /** Site class other than G, M, P or L. */
    UNKNOWN_SITE_CLASS(-6),
    /** FIZ code needed but not recognised. */
    UNKNOWN_FIZ(-7),
    /** Species code string not recognised. */
    UNKNOWN_SPECIES_CODE(-8),
    /** Total age requested from a growth-intercept curve. */
    TOTAL_AGE_UNSUPPORTED_FOR_GI(-9),
    /** Species known but without the requested data. */
    UNKNOWN_SPECIES(-10),
    /** Age conversion between two types that has no rule. */
    UNSUPPORTED_AGE_TYPE_COMBINATION(-11),
    /** Establishment type not recognised. */
    UNKNOWN_ESTABLISHMENT(-12);

    private final int code;

    ErrorKind(int code) {
        this.code = code;
    }

    /** Legacy sentinel value. */
    public int code() {
        return code;
    }

    public static Optional<ErrorKind> fromCode(int code) {
        for (ErrorKind kind : values()) {
            if (kind.code == code) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
