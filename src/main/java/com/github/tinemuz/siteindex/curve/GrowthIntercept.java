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

import static com.github.tinemuz.siteindex.curve.Curve.*;

import com.github.tinemuz.siteindex.AgeType;
import com.github.tinemuz.siteindex.ErrorKind;
import com.github.tinemuz.siteindex.EstimationMode;
import com.github.tinemuz.siteindex.SiteIndexResult;
import com.github.tinemuz.siteindex.numeric.Bisection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Growth-intercept curves.
 *
 * <p>A growth-intercept curve gives site index from breast-height age and
 * height, for breast-height ages 0.5 to 50. Each curve here is anchored on its
 * species' default height-age curve: the site index for a given age and
 * height is the one whose height-age curve passes through that point. Height
 * from site index and age from height are then found by searching on that
 * relation. None of these curves has a total-age form.</p>
 */
public final class GrowthIntercept {
    private static final Logger log = LoggerFactory.getLogger(GrowthIntercept.class);

    static final double MIN_AGE = 0.5;
    static final double MAX_AGE = 50.0;
    private static final int SCAN_LIMIT = 100;

    private static final Map<Curve, Curve> ANCHOR = new EnumMap<>(Curve.class);

    static {
        ANCHOR.put(BA_NIGHGI, BA_NIGH);
        ANCHOR.put(BL_THROWERGI, BL_CHENAC);
        ANCHOR.put(CWI_NIGHGI, CWI_NIGH);
        ANCHOR.put(FDC_NIGHGI, FDC_BRUCEAC);
        ANCHOR.put(FDI_NIGHGI, FDI_THROWERAC);
        ANCHOR.put(HWC_NIGHGI, HWC_WILEYAC);
        ANCHOR.put(HWC_NIGHGI99, HWC_WILEYAC);
        ANCHOR.put(HWI_NIGHGI, HWI_NIGH);
        ANCHOR.put(LW_NIGHGI, LW_NIGH);
        ANCHOR.put(PLI_NIGHGI97, PLI_THROWER);
        ANCHOR.put(PY_NIGHGI, PY_NIGH);
        ANCHOR.put(SE_NIGHGI, SE_NIGH);
        ANCHOR.put(SS_NIGHGI, SS_NIGH);
        ANCHOR.put(SS_NIGHGI99, SS_NIGH);
        ANCHOR.put(SW_NIGHGI, SW_GOUDIE_PLAAC);
        ANCHOR.put(SW_NIGHGI99, SW_GOUDIE_PLAAC);
        ANCHOR.put(SW_NIGHGI2004, SW_GOUDIE_PLAAC);
    }

    private GrowthIntercept() {}

    /** Height-age curve a growth-intercept curve is anchored on. */
    static Curve anchorOf(Curve curve) {
        Curve anchor = ANCHOR.get(curve);
        if (anchor == null) {
            throw new IllegalArgumentException(curve + " is not a growth-intercept curve");
        }
        return anchor;
    }

    /**
     * Site index from breast-height age and height.
     *
     * @return site index, {@link ErrorKind#BELOW_MINIMUM_GI_AGE} under age 0.5,
     *         {@link ErrorKind#ABOVE_MAXIMUM_GI_AGE} over age 50
     */
    public static SiteIndexResult siteIndexFromHeight(Curve curve, double bhAge, double height) {
        Objects.requireNonNull(curve, "curve");
        if (bhAge < MIN_AGE) {
            return SiteIndexResult.error(ErrorKind.BELOW_MINIMUM_GI_AGE);
        }
        if (bhAge > MAX_AGE) {
            return SiteIndexResult.error(ErrorKind.ABOVE_MAXIMUM_GI_AGE);
        }
        return SiteIndexEstimator.byIteration(anchorOf(curve), bhAge, AgeType.BREAST, height);
    }

    /**
     * Height at breast-height age {@code bhAge} for a site index.
     *
     * <p>Searches on height, starting at the site index (at least 1.3 m), until
     * the implied site index is within 0.01 m of the one given. Heights are
     * kept at or above breast height throughout.</p>
     */
    public static SiteIndexResult heightFromSiteIndex(Curve curve, double bhAge, double siteIndex) {
        Objects.requireNonNull(curve, "curve");
        if (bhAge < MIN_AGE) {
            return SiteIndexResult.error(ErrorKind.BELOW_MINIMUM_GI_AGE);
        }
        double seed = Math.max(siteIndex, 1.3);
        Bisection.Search search = Bisection.Search.from(seed, seed / 2)
                .tolerance(0.01)
                .stepFloor(0.00001)
                .upperBound(999.0)
                .repairBelow(1.3);
        return Bisection.solve(h -> siteIndexFromHeight(curve, bhAge, h), siteIndex, search);
    }

    /**
     * Breast-height age at which a tree of site index {@code siteIndex} reaches
     * {@code height}.
     *
     * <p>Scans whole breast-height ages from 1 upward, since the implied site
     * index need not be monotone in age, and keeps the closest match. A best
     * match on the first or last age scanned that is more than 1 m off means
     * the inputs are outside the curve's range.</p>
     */
    public static SiteIndexResult ageFromHeight(Curve curve, double height, AgeType ageType, double siteIndex) {
        Objects.requireNonNull(curve, "curve");
        if (ageType == AgeType.TOTAL) {
            return SiteIndexResult.error(ErrorKind.TOTAL_AGE_UNSUPPORTED_FOR_GI);
        }
        int best = 1;
        int last = 1;
        double minDiff = 999;
        for (int age = 1; age < SCAN_LIMIT; age++) {
            SiteIndexResult estimate =
                    SiteIndexEstimator.estimate(curve, age, AgeType.BREAST, height, EstimationMode.DIRECT);
            if (estimate.is(ErrorKind.ABOVE_MAXIMUM_GI_AGE)) {
                break;
            }
            last = age;
            if (estimate.isError()) {
                continue;
            }
            double diff = Math.abs(estimate.value() - siteIndex);
            if (diff < minDiff) {
                minDiff = diff;
                best = age;
            }
        }
        if ((best == 1 || best == last) && minDiff > 1) {
            log.debug("{}: no age in 1..{} gives site index {} at height {} (closest off by {})",
                    curve, last, siteIndex, height, minDiff);
            return SiteIndexResult.error(ErrorKind.NO_CONVERGENCE);
        }
        return SiteIndexResult.of(best);
    }
}
