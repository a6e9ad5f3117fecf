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
import com.github.tinemuz.siteindex.SiteIndexResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class HeightEvaluatorTest {

    private static final double HEIGHT_TOLERANCE = 1e-9; // m
    // normalised y2bh: juvenile before total age 6, adult after 8
    private static final double SPLICE_Y2BH = 6.5;

    private static double totalAgeHeight(Curve curve, double tage, double si) {
        return HeightEvaluator.height(curve, tage, AgeType.TOTAL, si, SPLICE_Y2BH, 0.5).value();
    }

    private static double breastAgeHeight(Curve curve, double bhage, double si) {
        return HeightEvaluator.height(curve, bhage, AgeType.BREAST, si, 3.5, 0.5).value();
    }

    @Nested
    @DisplayName("Inputs")
    class InputTests {

        @Test
        @DisplayName("Years to breast height is moved onto the half-year grid")
        void y2bhNormalised() {
            double a = HeightEvaluator.height(Curve.SS_NIGH, 5, AgeType.TOTAL, 25, 7.1, 0.5).value();
            double b = HeightEvaluator.height(Curve.SS_NIGH, 5, AgeType.TOTAL, 25, 7.9, 0.5).value();
            assertEquals(a, b, HEIGHT_TOLERANCE);
        }

        @Test
        @DisplayName("Total age zero is height zero")
        void zeroAge() {
            assertEquals(0.0, HeightEvaluator.height(Curve.SS_NIGH, 0, AgeType.TOTAL, 25, 7.5, 0.5).value());
        }

        @Test
        @DisplayName("Below breast height the ramp reaches breast height at y2bh")
        void ramp() {
            // SW_GOUDIE_PLA has no half-year offset: breast-height age 0 is total age y2bh
            double h = HeightEvaluator.height(Curve.SW_GOUDIE_PLA, 7.5, AgeType.TOTAL, 20, 7.5, 0.5).value();
            assertEquals(1.3, h, 1e-6);
            double half = HeightEvaluator.height(Curve.SW_GOUDIE_PLA, 3.75, AgeType.TOTAL, 20, 7.5, 0.5).value();
            assertEquals(1.3 / 4, half, 1e-9);
        }

        @Test
        @DisplayName("Null curve is a programming error")
        void nullCurve() {
            assertThrows(NullPointerException.class,
                    () -> HeightEvaluator.height(null, 5, AgeType.TOTAL, 25, 7.5, 0.5));
        }
    }

    @Nested
    @DisplayName("Special cases")
    class SpecialCaseTests {

        @Test
        @DisplayName("Juvenile curves have no answer past their age limit")
        void juvenileLimit() {
            assertTrue(HeightEvaluator.height(Curve.PLI_NIGHTA98, 10, AgeType.TOTAL, 20, 5.5, 0.5).isOk());
            assertTrue(HeightEvaluator.height(Curve.PLI_NIGHTA98, 16, AgeType.TOTAL, 20, 5.5, 0.5)
                    .is(ErrorKind.NO_CONVERGENCE));
            assertTrue(HeightEvaluator.height(Curve.SW_NIGHTA2004, 21, AgeType.TOTAL, 20, 5.5, 0.5)
                    .is(ErrorKind.NO_CONVERGENCE));
        }

        @Test
        @DisplayName("High site index at young age interpolates from a stable age")
        void instabilityGuard() {
            double si = 70;
            double stableAge = (si - 60) / 1.667 + 0.1;
            double stable = HeightEvaluator.height(Curve.HWC_WILEY, stableAge, AgeType.BREAST, si, 2.5, 0.5).value();
            double young = HeightEvaluator.height(Curve.HWC_WILEY, 2, AgeType.BREAST, si, 2.5, 0.5).value();
            assertEquals(1.37 + (stable - 1.37) * 2 / stableAge, young, HEIGHT_TOLERANCE);
        }

        @Test
        @DisplayName("Hu-Garcia passes through site index at breast-height age 50")
        void huGarcia() {
            SiteIndexResult h = HeightEvaluator.height(Curve.SW_HU_GARCIA, 50, AgeType.BREAST, 20, 9.5, 0.5);
            assertEquals(20.0, h.value(), 0.001);
        }

        @Test
        @DisplayName("Growth intercept curves take breast-height ages only")
        void growthInterceptTotalAge() {
            assertTrue(HeightEvaluator.height(Curve.SW_NIGHGI2004, 20, AgeType.TOTAL, 18, 5.5, 0.5)
                    .is(ErrorKind.TOTAL_AGE_UNSUPPORTED_FOR_GI));
            assertTrue(HeightEvaluator.height(Curve.SW_NIGHGI2004, 20, AgeType.BREAST, 18, 5.5, 0.5).isOk());
        }

        @Test
        @DisplayName("Site index equal to breast height is too low")
        void siteIndexAtBreastHeight() {
            assertTrue(HeightEvaluator.height(Curve.SS_NIGH, 50, AgeType.BREAST, 1.3, 7.5, 0.5)
                    .is(ErrorKind.SITE_INDEX_TOO_LOW));
            assertTrue(HeightEvaluator.height(Curve.FDC_BRUCE, 50, AgeType.BREAST, 1.37, 7.5, 0.5)
                    .is(ErrorKind.SITE_INDEX_TOO_LOW));
            assertTrue(HeightEvaluator.height(Curve.FDC_BRUCE, 50, AgeType.BREAST, 1.35, 7.5, 0.5).isOk());
        }
    }

    @Nested
    @DisplayName("Spliced curves")
    class SpliceTests {

        @ParameterizedTest(name = "{0} at total age {4}")
        @CsvSource({
            "SW_GOUDNIGH, SW_NIGHTA, SW_GOUDIE_PLAAC, 25, 1",
            "SW_GOUDNIGH, SW_NIGHTA, SW_GOUDIE_PLAAC, 25, 4",
            "SW_GOUDNIGH, SW_NIGHTA, SW_GOUDIE_PLAAC, 25, 5.99",
            "PLI_THROWNIGH, PLI_NIGHTA98, PLI_THROWER, 22, 1",
            "PLI_THROWNIGH, PLI_NIGHTA98, PLI_THROWER, 22, 4",
            "PLI_THROWNIGH, PLI_NIGHTA98, PLI_THROWER, 22, 5.99"
        })
        @DisplayName("Before y2bh - 0.5 the juvenile curve applies")
        void juvenile(Curve spliced, Curve juvenile, Curve adult, double si, double tage) {
            assertEquals(totalAgeHeight(juvenile, tage, si), totalAgeHeight(spliced, tage, si), HEIGHT_TOLERANCE);
        }

        @ParameterizedTest(name = "{0} at total age {4}")
        @CsvSource({
            "SW_GOUDNIGH, SW_NIGHTA, SW_GOUDIE_PLAAC, 25, 8.01",
            "SW_GOUDNIGH, SW_NIGHTA, SW_GOUDIE_PLAAC, 25, 15",
            "SW_GOUDNIGH, SW_NIGHTA, SW_GOUDIE_PLAAC, 25, 80",
            "PLI_THROWNIGH, PLI_NIGHTA98, PLI_THROWER, 22, 8.01",
            "PLI_THROWNIGH, PLI_NIGHTA98, PLI_THROWER, 22, 15",
            "PLI_THROWNIGH, PLI_NIGHTA98, PLI_THROWER, 22, 80"
        })
        @DisplayName("After y2bh + 1.5 the adult curve applies")
        void adult(Curve spliced, Curve juvenile, Curve adult, double si, double tage) {
            assertEquals(totalAgeHeight(adult, tage, si), totalAgeHeight(spliced, tage, si), HEIGHT_TOLERANCE);
        }

        @ParameterizedTest(name = "{0} at total age {4}")
        @CsvSource({
            "SW_GOUDNIGH, SW_NIGHTA, SW_GOUDIE_PLAAC, 25, 6",
            "SW_GOUDNIGH, SW_NIGHTA, SW_GOUDIE_PLAAC, 25, 6.5",
            "SW_GOUDNIGH, SW_NIGHTA, SW_GOUDIE_PLAAC, 25, 7",
            "SW_GOUDNIGH, SW_NIGHTA, SW_GOUDIE_PLAAC, 25, 8",
            "PLI_THROWNIGH, PLI_NIGHTA98, PLI_THROWER, 22, 6",
            "PLI_THROWNIGH, PLI_NIGHTA98, PLI_THROWER, 22, 7.5",
            "PLI_THROWNIGH, PLI_NIGHTA98, PLI_THROWER, 22, 8"
        })
        @DisplayName("Between the thresholds the two curves are interpolated")
        void band(Curve spliced, Curve juvenile, Curve adult, double si, double tage) {
            double start = totalAgeHeight(juvenile, SPLICE_Y2BH - 0.5, si);
            double end = totalAgeHeight(adult, SPLICE_Y2BH + 1.5, si);
            double expected = start + (end - start) * (tage - (SPLICE_Y2BH - 0.5)) / 2.0;
            assertEquals(expected, totalAgeHeight(spliced, tage, si), HEIGHT_TOLERANCE);
        }

        @ParameterizedTest(name = "{0} at total age {2}")
        @CsvSource({
            "SW_GOUDNIGH, SW_GOUDIE_PLAAC, 10", "SW_GOUDNIGH, SW_GOUDIE_PLAAC, 40",
            "PLI_THROWNIGH, PLI_THROWER, 10", "PLI_THROWNIGH, PLI_THROWER, 40"
        })
        @DisplayName("Low site indices use the adult curve alone")
        void lowSite(Curve spliced, Curve adult, double tage) {
            assertEquals(totalAgeHeight(adult, tage, 15), totalAgeHeight(spliced, tage, 15), HEIGHT_TOLERANCE);
        }

        @Test
        @DisplayName("Bruce-Nigh joins Bruce's equation at total age 50")
        void bruceNighJoin() {
            double si = 30;
            double y2bh = 13.25 - si / 6.096;
            double x2 = HeightEvaluator.bruceExponent(si);
            double x3 = Math.pow(50.0 + y2bh - 0.5, x2);
            double x4 = Math.log(1.372 / si) / (Math.pow(y2bh - 0.5, x2) - x3);

            for (double tage : new double[] {50, 60, 90}) {
                double bruce = si * Math.exp(x4 * (Math.pow(tage, x2) - x3));
                assertEquals(bruce, totalAgeHeight(Curve.FDC_BRUCENIGH, tage, si), 1e-9, "total age " + tage);
            }
            double before = totalAgeHeight(Curve.FDC_BRUCENIGH, 49.999, si);
            double at = totalAgeHeight(Curve.FDC_BRUCENIGH, 50, si);
            assertEquals(at, before, 0.001);
        }

        @Test
        @DisplayName("Bruce-Nigh follows Nigh's juvenile form before total age 50")
        void bruceNighJuvenile() {
            double si = 30;
            double c = -0.0123 + 0.00158 * si;
            // h = c t^2.037 k^t with one k for every age below 50
            double k20 = Math.pow(totalAgeHeight(Curve.FDC_BRUCENIGH, 20, si) / (c * Math.pow(20, 2.037)), 1.0 / 20);
            double k40 = Math.pow(totalAgeHeight(Curve.FDC_BRUCENIGH, 40, si) / (c * Math.pow(40, 2.037)), 1.0 / 40);
            assertEquals(k20, k40, 1e-9);
            assertEquals(totalAgeHeight(Curve.FDC_BRUCENIGH, 50, si), c * Math.pow(50, 2.037) * Math.pow(k20, 50),
                    1e-6);
        }
    }

    @Nested
    @DisplayName("Instability guards")
    class GuardTests {

        /** Kurucz cedar height without any guard, valid below breast-height age 50. */
        private double kuruczCedar(double si, double bhage) {
            double x1 = 2500.0 / (si - 1.3);
            double x2 = -3.11785 + 0.05027 * x1;
            double x3 = -0.02465 + 0.01411 * x1;
            double x4 = 0.00174 + 0.000097667 * x1;
            return 1.3 + bhage * bhage / (x2 + x3 * bhage + x4 * bhage * bhage);
        }

        /** Kurucz amabilis height without any guard, with its young-age correction. */
        private double kuruczAmabilis(double si, double bhage) {
            double x1 = 2500.0 / (si - 1.3);
            double x2 = -2.34655 + 0.0565 * x1;
            double x3 = -0.42007 + 0.01687 * x1;
            double x4 = 0.00934 + 0.00004 * x1;
            double h = 1.3 + bhage * bhage / (x2 + x3 * bhage + x4 * bhage * bhage);
            if (bhage < 50.0 && bhage * h < 1695.3) {
                double shift = 0.45773 - 0.00027 * bhage * h;
                if (shift > 0.0) {
                    h -= shift;
                }
            }
            return h;
        }

        private double harring(double si, double tage) {
            double si20 = Math.pow(si, 1.5) / 8.0;
            double x1 = 18.1622 + 0.7953 * si20;
            double x2 = 0.00194 - 0.002441 * si20;
            return si20 + x1 * Math.pow(1.0 - Math.exp(x2 * tage), 0.9198)
                    - x1 * Math.pow(1.0 - Math.exp(x2 * 20), 0.9198);
        }

        // si 50: guarded while bhage < (50 - 43) / 1.667 = 4.199
        @ParameterizedTest(name = "breast-height age {0}")
        @CsvSource({"1", "2.5", "4.19"})
        @DisplayName("Kurucz cedar interpolates from its stable age at young ages")
        void cedarGuarded(double bhage) {
            double stableAge = (50 - 43) / 1.667 + 0.1;
            double stable = breastAgeHeight(Curve.CWC_KURUCZ, stableAge, 50);
            assertEquals(kuruczCedar(50, stableAge), stable, HEIGHT_TOLERANCE);
            assertEquals(1.3 + (stable - 1.3) * bhage / stableAge, breastAgeHeight(Curve.CWC_KURUCZ, bhage, 50),
                    HEIGHT_TOLERANCE);
        }

        @ParameterizedTest(name = "breast-height age {0}")
        @CsvSource({"4.21", "10", "40"})
        @DisplayName("Kurucz cedar uses its equation past the guard")
        void cedarUnguarded(double bhage) {
            assertEquals(kuruczCedar(50, bhage), breastAgeHeight(Curve.CWC_KURUCZ, bhage, 50), HEIGHT_TOLERANCE);
        }

        // si 70: guarded while bhage < (70 - 60) / 1.667 = 5.999
        @ParameterizedTest(name = "breast-height age {0}")
        @CsvSource({"1", "3", "5.99"})
        @DisplayName("Kurucz amabilis interpolates from its stable age at young ages")
        void amabilisGuarded(double bhage) {
            double stableAge = (70 - 60) / 1.667 + 0.1;
            double stable = breastAgeHeight(Curve.BA_KURUCZ82, stableAge, 70);
            assertEquals(kuruczAmabilis(70, stableAge), stable, HEIGHT_TOLERANCE);
            assertEquals(1.3 + (stable - 1.3) * bhage / stableAge, breastAgeHeight(Curve.BA_KURUCZ82, bhage, 70),
                    HEIGHT_TOLERANCE);
        }

        @ParameterizedTest(name = "breast-height age {0}")
        @CsvSource({"6.01", "12", "45"})
        @DisplayName("Kurucz amabilis uses its equation past the guard")
        void amabilisUnguarded(double bhage) {
            assertEquals(kuruczAmabilis(70, bhage), breastAgeHeight(Curve.BA_KURUCZ82, bhage, 70),
                    HEIGHT_TOLERANCE);
        }

        // si 60: guarded while total age < (60 - 45) / 2.5 = 6
        @ParameterizedTest(name = "total age {0}")
        @CsvSource({"1", "3", "5.9"})
        @DisplayName("Harrington alder interpolates from its stable age at young ages")
        void alderGuarded(double tage) {
            double stableAge = (60 - 45) / 2.5 + 0.1;
            double stable = totalAgeHeight(Curve.DR_HARRING, stableAge, 60);
            assertEquals(harring(60, stableAge), stable, HEIGHT_TOLERANCE);
            assertEquals(stable * tage / stableAge, totalAgeHeight(Curve.DR_HARRING, tage, 60), HEIGHT_TOLERANCE);
        }

        @ParameterizedTest(name = "total age {0}")
        @CsvSource({"6.1", "15", "40"})
        @DisplayName("Harrington alder uses its equation past the guard")
        void alderUnguarded(double tage) {
            assertEquals(harring(60, tage), totalAgeHeight(Curve.DR_HARRING, tage, 60), HEIGHT_TOLERANCE);
        }
    }
}
