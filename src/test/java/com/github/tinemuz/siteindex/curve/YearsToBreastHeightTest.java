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

import com.github.tinemuz.siteindex.ErrorKind;
import com.github.tinemuz.siteindex.SiteIndexResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class YearsToBreastHeightTest {

    @Nested
    @DisplayName("Formulas")
    class FormulaTests {

        @Test
        @DisplayName("Published equations")
        void values() {
            assertEquals(13.25 - 30 / 6.096, YearsToBreastHeight.compute(Curve.FDC_BRUCE, 30).value(), 1e-12);
            assertEquals(2 + 0.55 + 69.4 / 20, YearsToBreastHeight.compute(Curve.PLI_THROWER, 20).value(), 1e-12);
            assertEquals(1.331 + 38.56 / 25, YearsToBreastHeight.compute(Curve.AT_NIGH, 25).value(), 1e-12);
            assertEquals(24.44 * Math.pow(20 - 9.051, -0.394),
                    YearsToBreastHeight.compute(Curve.FDC_NIGHTA, 20).value(), 1e-12);
        }

        @Test
        @DisplayName("Clamped at the curve's minimum")
        void clamps() {
            assertEquals(1.0, YearsToBreastHeight.compute(Curve.SS_NIGH, 70).value());
            assertEquals(5.0, YearsToBreastHeight.compute(Curve.BA_NIGH, 40).value());
        }

        @ParameterizedTest
        @ValueSource(doubles = {10, 20, 30, 40})
        @DisplayName("Every height-age curve gives a positive value")
        void everyCurve(double si) {
            for (Curve c : Curve.values()) {
                if (c.isGrowthIntercept()) continue;
                SiteIndexResult r = YearsToBreastHeight.compute(c, si);
                assertTrue(r.isOk(), c + " failed with " + r.error());
                assertTrue(Double.isFinite(r.value()) && r.value() > 0, c + " gave " + r.value());
            }
        }
    }

    @Nested
    @DisplayName("Errors")
    class ErrorTests {

        @Test
        @DisplayName("Site index below breast height")
        void tooLow() {
            assertTrue(YearsToBreastHeight.compute(Curve.SS_NIGH, 1.2).is(ErrorKind.SITE_INDEX_TOO_LOW));
        }

        @Test
        @DisplayName("Growth intercept curves have no total age")
        void growthIntercept() {
            assertTrue(YearsToBreastHeight.compute(Curve.SW_NIGHGI, 20).is(ErrorKind.TOTAL_AGE_UNSUPPORTED_FOR_GI));
        }

        @Test
        @DisplayName("Juvenile curves below their fitted range")
        void juvenileRange() {
            assertTrue(YearsToBreastHeight.compute(Curve.FDC_NIGHTA, 9.0).is(ErrorKind.NO_CONVERGENCE));
            assertTrue(YearsToBreastHeight.compute(Curve.PLI_NIGHTA98, 9.0).is(ErrorKind.NO_CONVERGENCE));
        }

        @Test
        @DisplayName("Rounding passes errors through")
        void roundedErrors() {
            assertTrue(YearsToBreastHeight.rounded(Curve.FDC_NIGHTA, 9.0).is(ErrorKind.NO_CONVERGENCE));
            assertEquals(ErrorKind.NO_CONVERGENCE.code(), YearsToBreastHeight.rounded(Curve.FDC_NIGHTA, 9.0).toLegacy());
        }
    }

    @Test
    @DisplayName("Rounding moves onto the half-year grid")
    void rounded() {
        assertEquals(8.5, YearsToBreastHeight.rounded(Curve.FDC_BRUCE, 30).value());
        assertEquals(1.5, YearsToBreastHeight.rounded(Curve.SS_NIGH, 70).value());
    }
}
