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
import com.github.tinemuz.siteindex.EstimationMode;
import com.github.tinemuz.siteindex.SiteIndexResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SiteIndexEstimatorTest {

    private static final double SI_TOLERANCE = 0.01; // m

    @Nested
    @DisplayName("Iteration")
    class IterationTests {

        @Test
        @DisplayName("Recovers the site index used to compute the height")
        void recovers() {
            double y2bh = YearsToBreastHeight.compute(Curve.HWI_NIGH, 17).value();
            double h = HeightEvaluator.height(Curve.HWI_NIGH, 35, AgeType.BREAST, 17, y2bh, 0.5).value();
            double si = SiteIndexEstimator.estimate(Curve.HWI_NIGH, 35, AgeType.BREAST, h, EstimationMode.ITERATE)
                    .value();
            assertEquals(17.0, si, SI_TOLERANCE);
        }

        @Test
        @DisplayName("Site index stays at or above breast height")
        void lowerLimit() {
            double si = SiteIndexEstimator.estimate(Curve.SS_NIGH, 50, AgeType.BREAST, 1.31, EstimationMode.ITERATE)
                    .value();
            assertTrue(si >= 1.3 - 1e-4, "site index " + si);
        }

        @Test
        @DisplayName("Candidates below the years-to-breast-height range keep the search going")
        void belowBreastHeightTimingRange() {
            double y2bh = YearsToBreastHeight.compute(Curve.PLI_NIGHTA98, 10.5).value();
            double h = HeightEvaluator.height(Curve.PLI_NIGHTA98, 10, AgeType.TOTAL, 10.5, y2bh, 0.5).value();
            assertEquals(0.598, h, 0.001);
            assertTrue(YearsToBreastHeight.compute(Curve.PLI_NIGHTA98, 6.25).is(ErrorKind.NO_CONVERGENCE));

            SiteIndexResult si = SiteIndexEstimator.estimate(Curve.PLI_NIGHTA98, 10, AgeType.TOTAL, h,
                    EstimationMode.ITERATE);
            assertTrue(si.isOk(), "got " + si);
            assertEquals(10.5, si.value(), SI_TOLERANCE);
        }

        @Test
        @DisplayName("Heights no site index can reach fail")
        void tooTall() {
            assertTrue(SiteIndexEstimator.estimate(Curve.SS_NIGH, 50, AgeType.BREAST, 2000, EstimationMode.ITERATE)
                    .is(ErrorKind.NO_CONVERGENCE));
            assertTrue(SiteIndexEstimator.estimate(Curve.SS_NIGH, 50, AgeType.BREAST, 0.0, EstimationMode.ITERATE)
                    .is(ErrorKind.NO_CONVERGENCE));
        }
    }

    @Nested
    @DisplayName("Direct estimation")
    class DirectTests {

        @Test
        @DisplayName("Linear curves invert exactly")
        void linear() {
            for (Curve c : new Curve[] {Curve.PLI_MILNER, Curve.FDI_MILNER, Curve.PY_MILNER, Curve.LW_MILNER,
                    Curve.FDI_VDP_MONT, Curve.FDI_VDP_WASH, Curve.FDC_COCHRAN}) {
                double h = HeightEvaluator.height(c, 45, AgeType.BREAST, 24, 8.5, 0.5).value();
                double si = SiteIndexEstimator.estimate(c, 45, AgeType.BREAST, h, EstimationMode.DIRECT).value();
                assertEquals(24.0, si, 1e-6, c.name());
            }
        }

        @Test
        @DisplayName("Total ages and other curves fall back to iteration")
        void fallback() {
            double y2bh = YearsToBreastHeight.compute(Curve.SS_NIGH, 21).value();
            double h = HeightEvaluator.height(Curve.SS_NIGH, 60, AgeType.TOTAL, 21, y2bh, 0.5).value();
            assertEquals(
                    SiteIndexEstimator.estimate(Curve.SS_NIGH, 60, AgeType.TOTAL, h, EstimationMode.ITERATE).value(),
                    SiteIndexEstimator.estimate(Curve.SS_NIGH, 60, AgeType.TOTAL, h, EstimationMode.DIRECT).value());
        }
    }

    @Nested
    @DisplayName("Growth intercept")
    class GrowthInterceptTests {

        @Test
        @DisplayName("Each growth intercept curve is anchored on a height-age curve")
        void anchors() {
            for (Curve c : Curve.values()) {
                if (c.isGrowthIntercept()) {
                    assertFalse(GrowthIntercept.anchorOf(c).isGrowthIntercept(), c.name());
                } else {
                    assertThrows(IllegalArgumentException.class, () -> GrowthIntercept.anchorOf(c));
                }
            }
        }

        @Test
        @DisplayName("Site index agrees with the anchor curve")
        void matchesAnchor() {
            double gi = GrowthIntercept.siteIndexFromHeight(Curve.SW_NIGHGI99, 15, 6).value();
            double anchored = SiteIndexEstimator.estimate(Curve.SW_GOUDIE_PLAAC, 15, AgeType.BREAST, 6,
                    EstimationMode.ITERATE).value();
            assertEquals(anchored, gi, 1e-12);
        }

        @Test
        @DisplayName("Height from site index inverts site index from height")
        void heightFromSiteIndex() {
            double h = GrowthIntercept.heightFromSiteIndex(Curve.FDI_NIGHGI, 12, 19).value();
            assertEquals(19.0, GrowthIntercept.siteIndexFromHeight(Curve.FDI_NIGHGI, 12, h).value(), 0.011);
        }
    }
}
