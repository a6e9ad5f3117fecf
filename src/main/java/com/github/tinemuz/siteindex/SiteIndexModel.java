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

import com.github.tinemuz.siteindex.catalog.CurveCatalog;
import com.github.tinemuz.siteindex.catalog.Establishment;
import com.github.tinemuz.siteindex.catalog.FizZone;
import com.github.tinemuz.siteindex.catalog.Species;
import com.github.tinemuz.siteindex.catalog.SpeciesCatalog;
import com.github.tinemuz.siteindex.curve.AgeConverter;
import com.github.tinemuz.siteindex.curve.AgeEvaluator;
import com.github.tinemuz.siteindex.curve.Curve;
import com.github.tinemuz.siteindex.curve.HeightEvaluator;
import com.github.tinemuz.siteindex.curve.SiteIndexEstimator;
import com.github.tinemuz.siteindex.curve.YearsToBreastHeight;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Site index curves for British Columbia tree species: conversions between
 * age, height and site index.
 *
 * <p>Curves are addressed by their stable integer index. Every conversion
 * returns a {@code double}; a negative value is the {@link ErrorKind#code()}
 * of the failure. For a typed result use the engine classes in
 * {@code com.github.tinemuz.siteindex.curve} directly.</p>
 *
 * <p>Heights are in metres, ages in years, site index is height at breast
 * height age 50 (total age 100 for a few curves). Tables load lazily on first
 * use; call {@link #preload()} to load them up front. All methods are
 * thread-safe.</p>
 */
public final class SiteIndexModel {
    private static final Logger log = LoggerFactory.getLogger(SiteIndexModel.class);

    public static final int AGE_TOTAL = 0;
    public static final int AGE_BREAST = 1;

    public static final int EST_ITERATE = 0;
    public static final int EST_DIRECT = 1;

    private SiteIndexModel() {
    }

    /** Load the curve and species tables now rather than on first use. */
    public static void preload() {
        CurveCatalog.preload();
        SpeciesCatalog.preload();
    }

    /**
     * Convert an age between total and breast-height counting.
     *
     * @param y2bh years from germination to breast height
     */
    public static double ageToAge(int curve, double age1, int age1Type, int age2Type, double y2bh) {
        return withCurve(curve, c -> {
            Optional<AgeType> from = AgeType.fromCode(age1Type);
            Optional<AgeType> to = AgeType.fromCode(age2Type);
            if (from.isEmpty() || to.isEmpty()) {
                return SiteIndexResult.error(ErrorKind.UNSUPPORTED_AGE_TYPE_COMBINATION);
            }
            return AgeConverter.convert(c, age1, from.get(), to.get(), y2bh);
        });
    }

    /**
     * Height at an age on a curve.
     *
     * @param y2bh years to breast height, normally from {@link #yearsToBreastHeight}
     * @param pi proportion of the growing season elapsed, 0..1; used by a few curves
     */
    public static double indexToHeight(int curve, double age, int ageType, double siteIndex, double y2bh, double pi) {
        return withCurve(curve, c -> AgeType.fromCode(ageType)
                .map(t -> HeightEvaluator.height(c, age, t, siteIndex, y2bh, pi))
                .orElseGet(SiteIndexModel::badAgeType));
    }

    /** Age at which a stand of the given site index reaches a height. */
    public static double indexToAge(int curve, double height, int ageType, double siteIndex, double y2bh) {
        return withCurve(curve, c -> AgeType.fromCode(ageType)
                .map(t -> AgeEvaluator.age(c, height, t, siteIndex, y2bh))
                .orElseGet(SiteIndexModel::badAgeType));
    }

    /**
     * Site index from an age and height.
     *
     * @param estimation {@link #EST_DIRECT} for a closed-form inverse where the
     *                   curve has one; any other value iterates
     */
    public static double heightToIndex(int curve, double age, int ageType, double height, int estimation) {
        EstimationMode mode = estimation == EST_DIRECT ? EstimationMode.DIRECT : EstimationMode.ITERATE;
        return withCurve(curve, c -> AgeType.fromCode(ageType)
                .map(t -> SiteIndexEstimator.estimate(c, age, t, height, mode))
                .orElseGet(SiteIndexModel::badAgeType));
    }

    /** Years from germination to breast height. */
    public static double yearsToBreastHeight(int curve, double siteIndex) {
        return withCurve(curve, c -> YearsToBreastHeight.compute(c, siteIndex));
    }

    /** {@link #yearsToBreastHeight} truncated to a whole year plus one half. */
    public static double yearsToBreastHeightRounded(int curve, double siteIndex) {
        return withCurve(curve, c -> YearsToBreastHeight.rounded(c, siteIndex));
    }

    /**
     * Equations a curve provides, as bits: 1 height from site index, 2 site
     * index from height, 4 years to breast height, 8 growth intercept.
     */
    public static int curveUse(int curve) {
        CurveCatalog catalog = CurveCatalog.defaults();
        return catalog.resolve(curve)
                .map(c -> catalog.info(c).mask())
                .orElse(ErrorKind.UNKNOWN_CURVE.code());
    }

    /**
     * Typical site index of a species on a site class.
     *
     * @param siteClass one of G, M, P, L
     * @param fiz Forest Inventory Zone, needed for species that differ between coast and interior
     */
    public static double classToIndex(String species, char siteClass, char fiz) {
        return SpeciesCatalog.defaults().classToIndex(species, siteClass, fiz).toLegacy();
    }

    /** 0 unknown, 1 coast, 2 interior. */
    public static int fizCheck(char fiz) {
        return FizZone.of(fiz).code();
    }

    /** Site index on one species expressed for another. */
    public static double siteIndexToSiteIndex(String fromSpecies, double siteIndex, String toSpecies) {
        return SpeciesCatalog.defaults().siteIndexToSiteIndex(fromSpecies, siteIndex, toSpecies).toLegacy();
    }

    /** Default curve index for a species, or a negative error code. */
    public static int defaultCurve(String species) {
        return curveIndex(species, Species::defaultCurve);
    }

    /** Default growth-intercept curve index for a species, or a negative error code. */
    public static int defaultGiCurve(String species) {
        return curveIndex(species, Species::defaultGiCurve);
    }

    /**
     * Default curve index for a species given how the stand was established
     * (0 natural, 1 plantation). Species with a single default ignore it.
     */
    public static int defaultCurveForEstablishment(String species, int establishment) {
        Optional<Species> sp = SpeciesCatalog.defaults().find(species);
        if (sp.isEmpty()) {
            return ErrorKind.UNKNOWN_SPECIES_CODE.code();
        }
        if (!sp.get().hasEstablishmentDefaults()) {
            return curveIndex(species, Species::defaultCurve);
        }
        Optional<Establishment> est = Establishment.fromCode(establishment);
        if (est.isEmpty()) {
            return ErrorKind.UNKNOWN_ESTABLISHMENT.code();
        }
        return curveIndex(species, s -> s.defaultCurve(est.get()));
    }

    private static int curveIndex(String species, Function<Species, Optional<Curve>> pick) {
        Optional<Species> sp = SpeciesCatalog.defaults().find(species);
        if (sp.isEmpty()) {
            return ErrorKind.UNKNOWN_SPECIES_CODE.code();
        }
        return pick.apply(sp.get())
                .filter(CurveCatalog.defaults()::isEnabled)
                .map(Curve::index)
                .orElse(ErrorKind.NO_CONVERGENCE.code());
    }

    private static double withCurve(int index, Function<Curve, SiteIndexResult> op) {
        Optional<Curve> curve = CurveCatalog.defaults().resolve(index);
        if (curve.isEmpty()) {
            log.debug("Unknown or disabled curve index {}", index);
            return ErrorKind.UNKNOWN_CURVE.code();
        }
        return op.apply(curve.get()).toLegacy();
    }

    private static SiteIndexResult badAgeType() {
        return SiteIndexResult.error(ErrorKind.UNSUPPORTED_AGE_TYPE_COMBINATION);
    }
}
