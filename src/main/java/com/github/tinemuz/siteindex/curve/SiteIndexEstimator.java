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

import static com.github.tinemuz.siteindex.numeric.SafeMath.ppow;
import static java.lang.Math.exp;
import static java.lang.Math.log;

import com.github.tinemuz.siteindex.AgeType;
import com.github.tinemuz.siteindex.ErrorKind;
import com.github.tinemuz.siteindex.EstimationMode;
import com.github.tinemuz.siteindex.SiteIndexResult;
import com.github.tinemuz.siteindex.numeric.Bisection;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Site index from age and height.
 *
 * <p>In {@link EstimationMode#ITERATE} mode the height evaluator is searched on
 * site index, using the curve's own years to breast height at each candidate.
 * {@link EstimationMode#DIRECT} solves the curve's equation for site index
 * where it is linear in site index and the age is a breast-height age, and
 * otherwise searches as well. A candidate below the range of the curve's
 * years to breast height counts as a zero height, so the search moves up.</p>
 */
public final class SiteIndexEstimator {
    private static final double FEET = 0.3048;
    private static final double MAX_SITE_INDEX = 999.0;

    private SiteIndexEstimator() {}

    public static SiteIndexResult estimate(
            Curve curve, double age, AgeType ageType, double height, EstimationMode mode) {
        Objects.requireNonNull(curve, "curve");
        Objects.requireNonNull(ageType, "ageType");
        Objects.requireNonNull(mode, "mode");
        if (curve.isGrowthIntercept()) {
            if (ageType == AgeType.TOTAL) {
                return SiteIndexResult.error(ErrorKind.TOTAL_AGE_UNSUPPORTED_FOR_GI);
            }
            return GrowthIntercept.siteIndexFromHeight(curve, age, height);
        }
        if (height < 0.0001) {
            return SiteIndexResult.error(ErrorKind.NO_CONVERGENCE);
        }
        if (mode == EstimationMode.DIRECT && ageType == AgeType.BREAST) {
            OptionalDouble direct = solveLinear(curve, age, height);
            if (direct.isPresent()) {
                double si = direct.getAsDouble();
                if (!(si >= 1.3 && si <= MAX_SITE_INDEX)) {
                    return SiteIndexResult.error(ErrorKind.NO_CONVERGENCE);
                }
                return SiteIndexResult.of(si);
            }
        }
        return byIteration(curve, age, ageType, height);
    }

    static SiteIndexResult byIteration(Curve curve, double age, AgeType ageType, double height) {
        Bisection.Search search = Bisection.Search.from(25.0, 12.5)
                .tolerance(0.001)
                .stepFloor(0.00001)
                .upperBound(MAX_SITE_INDEX)
                .repairBelow(1.3);
        return Bisection.solve(si -> {
            SiteIndexResult y2bh = YearsToBreastHeight.compute(curve, si);
            // below the site indices the curve's years to breast height cover
            if (y2bh.is(ErrorKind.NO_CONVERGENCE)) {
                return SiteIndexResult.of(0.0);
            }
            return y2bh.flatMap(y -> HeightEvaluator.height(curve, age, ageType, si, y, 0.5));
        }, height, search);
    }

    /** Closed-form site index for curves whose height is linear in it, above breast height only. */
    private static OptionalDouble solveLinear(Curve curve, double bhage, double height) {
        double hf = height / FEET;
        double x1;
        double x2;
        switch (curve) {
            case FDC_COCHRAN:
                if (bhage <= 0.0) break;
                x1 = exp(-0.37496 + 1.36164 * log(bhage) - 0.00243434 * ppow(log(bhage), 4));
                x2 = -0.2828 + 1.87947 * Math.pow(1 - exp(-0.022399 * bhage), 0.966998);
                return feet((hf - 4.5 - x1) / x2 + 84.47);
            case PLI_MILNER:
                if (bhage <= 0.0) break;
                return milner(hf, bhage, 96.93, 0.01955, 1.216, 1.41, 0.02656, 1.297, 59.6);
            case FDI_MILNER:
                if (bhage <= 0.0) break;
                return milner(hf, bhage, 114.6, 0.01462, 1.179, 1.703, 0.02214, 1.321, 57.3);
            case PY_MILNER:
                if (bhage <= 0.0) break;
                return milner(hf, bhage, 121.4, 0.01756, 1.483, 1.189, 0.05799, 2.63, 59.6);
            case LW_MILNER:
                if (bhage <= 0.0) break;
                return milner(hf, bhage, 127.8, 0.01655, 1.196, 1.289, 0.03211, 1.047, 69.0);
            case FDI_VDP_MONT:
                if (bhage <= 0.0) break;
                return feet(4.5 + (hf - 4.5) * (1 + exp(5.479 - 1.4016 * log(bhage))) / 1.9965);
            case FDI_VDP_WASH:
                if (bhage <= 0.0) break;
                return feet(4.5 + (hf - 4.5) * (1 + exp(6.0678 - 1.6085 * log(bhage))) / 1.79897);
            case DR_NIGH: {
                if (bhage <= 0.5) break;
                double si25 = 1.3 + (height - 1.3) * (1 + exp(3.6 - 1.24 * log(bhage - 0.5))) / 1.693;
                return OptionalDouble.of((si25 - 0.3094) / 0.7616);
            }
            default:
                break;
        }
        return OptionalDouble.empty();
    }

    private static OptionalDouble milner(
            double hf, double bhage, double a1, double k1, double p1, double a2, double k2, double p2, double base) {
        double x1 = a1 * Math.pow(1 - exp(-k1 * bhage), p1);
        double x2 = a2 * Math.pow(1 - exp(-k2 * bhage), p2);
        return feet((hf - 4.5 - x1) / x2 + base);
    }

    private static OptionalDouble feet(double siteIndexFeet) {
        return OptionalDouble.of(siteIndexFeet * FEET);
    }
}
