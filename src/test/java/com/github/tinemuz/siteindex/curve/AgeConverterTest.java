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
package com.github.tinemuz.siteindex.curve;

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.siteindex.AgeType;
import com.github.tinemuz.siteindex.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AgeConverterTest {

    @Test
    @DisplayName("Curves fitted from the half year subtract half a year")
    void halfYearOffset() {
        assertTrue(AgeConverter.usesHalfYearOffset(Curve.SS_NIGH));
        assertTrue(AgeConverter.usesHalfYearOffset(Curve.SW_GOUDIE_PLAAC));
        assertFalse(AgeConverter.usesHalfYearOffset(Curve.SW_GOUDIE_PLA));
        assertFalse(AgeConverter.usesHalfYearOffset(Curve.FDC_BRUCE));

        assertEquals(17.0, AgeConverter.convert(Curve.SS_NIGH, 10, AgeType.BREAST, AgeType.TOTAL, 7.5).value());
        assertEquals(10.0, AgeConverter.convert(Curve.SS_NIGH, 17, AgeType.TOTAL, AgeType.BREAST, 7.5).value());
        assertEquals(17.5, AgeConverter.convert(Curve.FDC_BRUCE, 10, AgeType.BREAST, AgeType.TOTAL, 7.5).value());
    }

    @Test
    @DisplayName("Ages before breast height clamp to zero")
    void clamp() {
        assertEquals(0.0, AgeConverter.convert(Curve.FDC_BRUCE, 2, AgeType.TOTAL, AgeType.BREAST, 7.5).value());
    }

    @Test
    @DisplayName("Identity conversions are rejected")
    void identity() {
        assertTrue(AgeConverter.convert(Curve.SS_NIGH, 10, AgeType.TOTAL, AgeType.TOTAL, 7.5)
                .is(ErrorKind.UNSUPPORTED_AGE_TYPE_COMBINATION));
    }

    @Test
    @DisplayName("Null arguments are programming errors")
    void nulls() {
        assertThrows(NullPointerException.class,
                () -> AgeConverter.convert(null, 10, AgeType.TOTAL, AgeType.BREAST, 7.5));
    }
}
