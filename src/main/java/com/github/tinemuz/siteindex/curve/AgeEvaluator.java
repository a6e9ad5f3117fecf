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

import static com.github.tinemuz.siteindex.numeric.SafeMath.llog;
import static com.github.tinemuz.siteindex.numeric.SafeMath.ppow;
import static java.lang.Math.exp;
import static java.lang.Math.log;

import com.github.tinemuz.siteindex.AgeType;
import com.github.tinemuz.siteindex.ErrorKind;
import com.github.tinemuz.siteindex.SiteIndexResult;
import com.github.tinemuz.siteindex.numeric.Bisection;
import java.util.Objects;

/**
 * Age at which a tree of a given site index reaches a height.
 *
 * <p>Bruce, Hu-Garcia, Wiley and the Goudie curves are solved for age in
 * closed form. Growth-intercept curves scan breast-height ages. Every other
 * curve searches the height evaluator on total age.</p>
 */
public final class AgeEvaluator {
    static final double MAX_AGE = 999.0;

    private AgeEvaluator() {}

    /**
     * Age at which height {@code height} is reached.
     *
     * @param curve     curve to invert
     * @param height    target height (m)
     * @param ageType   how the returned age is counted
     * @param siteIndex site index (m)
     * @param y2bh      years to breast height
     * @return the age, or the error that prevented it
     */
    public static SiteIndexResult age(Curve curve, double height, AgeType ageType, double siteIndex, double y2bh) {
        Objects.requireNonNull(curve, "curve");
        Objects.requireNonNull(ageType, "ageType");
        if (height < 1.3) {
            if (ageType == AgeType.BREAST) {
                return SiteIndexResult.error(ErrorKind.SITE_INDEX_TOO_LOW);
            }
            if (height <= 0.0001) {
                return SiteIndexResult.of(0.0);
            }
        }
        if (siteIndex < 1.3) {
            return SiteIndexResult.error(ErrorKind.SITE_INDEX_TOO_LOW);
        }

        switch (curve) {
            case FDC_BRUCE:
                return bruce(height, ageType, siteIndex);
            case SW_HU_GARCIA:
                return HuGarcia.q(siteIndex, HuGarcia.REFERENCE_AGE).flatMap(q -> {
                    double age = HuGarcia.breastHeightAge(q, height);
                    return bounded(ageType == AgeType.TOTAL ? age + y2bh : age);
                });
            case HWC_WILEY:
                return wiley(curve, height, ageType, siteIndex, y2bh);
            case PLI_GOUDIE_DRY:
                return goudie(height, ageType, siteIndex, y2bh, -1.00726, 7.81498, -1.28517);
            case PLI_GOUDIE_WET:
                return goudie(height, ageType, siteIndex, y2bh, -0.935, 7.81498, -1.28517);
            case SS_GOUDIE:
                return goudie(height, ageType, siteIndex, y2bh, -1.5282, 11.0605, -1.5108);
            case SW_GOUDIE_PLA:
            case SW_GOUDIE_NAT:
                return goudie(height, ageType, siteIndex, y2bh, -1.2866, 9.7936, -1.4661);
            default:
                if (curve.isGrowthIntercept()) {
                    return GrowthIntercept.ageFromHeight(curve, height, ageType, siteIndex);
                }
                return iterate(curve, height, ageType, siteIndex, y2bh);
        }
    }

    /**
     * Search on total age for the age at which the height evaluator reaches
     * {@code height}. Ages the curve reports as undefined count as a height
     * of 1000 m; after 100 of them the search gives up.
     */
    static SiteIndexResult iterate(Curve curve, double height, AgeType ageType, double siteIndex, double y2bh) {
        SiteIndexResult seed = HeightEvaluator.height(curve, 25.0, AgeType.TOTAL, siteIndex, y2bh, 0.5);
        if (seed.isError() && !seed.is(ErrorKind.NO_CONVERGENCE)) {
            return seed;
        }
        Bisection.Search search = Bisection.Search.from(25.0, 12.5)
                .tolerance(0.005)
                .stepFloor(0.00001)
                .upperBound(MAX_AGE)
                .overflowAs(1000.0, 100);
        SiteIndexResult total = Bisection.solve(
                age -> HeightEvaluator.height(curve, age, AgeType.TOTAL, siteIndex, y2bh, 0.5), height, search);
        if (total.isError() || ageType == AgeType.TOTAL) {
            return total;
        }
        return AgeConverter.convert(curve, total.value(), AgeType.TOTAL, AgeType.BREAST, y2bh);
    }

    private static SiteIndexResult bruce(double height, AgeType ageType, double si) {
        double y2bh = 13.25 - si / 6.096;
        double x2 = HeightEvaluator.bruceExponent(si);
        double x3 = ppow(50.0 + y2bh, x2);
        double x4 = llog(1.372 / si) / (ppow(y2bh, x2) - x3);
        double x1 = llog(height / si) / x4 + x3;
        if (x1 < 0) {
            return SiteIndexResult.error(ErrorKind.NO_CONVERGENCE);
        }
        double age = ppow(x1, 1 / x2);
        if (ageType == AgeType.BREAST) {
            age -= y2bh;
        }
        return bounded(age);
    }

    private static SiteIndexResult wiley(Curve curve, double height, AgeType ageType, double si, double y2bh) {
        SiteIndexResult result;
        if (height / 0.3048 < 4.5) {
            double age = y2bh * ppow(height / 1.37, 0.5);
            if (ageType == AgeType.BREAST) {
                age -= y2bh;
            }
            result = SiteIndexResult.of(Math.max(age, 0.0));
        } else {
            double x1 = 2500 / (si / 0.3048 - 4.5);
            double x2 = -1.7307 + 0.1394 * x1;
            double x3 = -0.0616 + 0.0137 * x1;
            double x4 = 0.00192428 + 0.00007024 * x1;
            double d = 4.5 - height / 0.3048;
            double a = 1 + d * x4;
            double b = d * x3;
            double c = d * x2;
            double root = ppow(b * b - 4 * a * c, 0.5);
            if (root == 0.0) {
                return SiteIndexResult.error(ErrorKind.NO_CONVERGENCE);
            }
            double age = (-b + root) / (2 * a);
            if (ageType == AgeType.TOTAL) {
                age += y2bh;
            }
            if (age < 0 || age > MAX_AGE) {
                return SiteIndexResult.error(ErrorKind.NO_CONVERGENCE);
            }
            result = SiteIndexResult.of(age);
        }
        // the quadratic is poor in the first ten years
        if (result.value() > 0 && result.value() < 10) {
            return iterate(curve, height, ageType, si, y2bh);
        }
        return result;
    }

    private static SiteIndexResult goudie(
            double height, AgeType ageType, double si, double y2bh, double x1, double x2, double x3) {
        double age;
        if (height < 1.3) {
            age = y2bh * ppow(height / 1.3, 0.5);
            if (ageType == AgeType.BREAST) {
                age -= y2bh;
            }
            return SiteIndexResult.of(Math.max(age, 0.0));
        }
        double a = (si - 1.3) * (1 + exp(x2 + x1 * llog(si - 1.3) + x3 * log(50.0)));
        double b = x2 + x1 * llog(si - 1.3);
        age = exp((llog(a / (height - 1.3) - 1) - b) / x3);
        if (ageType == AgeType.TOTAL) {
            age += y2bh;
        }
        return bounded(age);
    }

    private static SiteIndexResult bounded(double age) {
        if (Double.isNaN(age) || age > MAX_AGE) {
            return SiteIndexResult.error(ErrorKind.NO_CONVERGENCE);
        }
        return SiteIndexResult.of(Math.max(age, 0.0));
    }
}
