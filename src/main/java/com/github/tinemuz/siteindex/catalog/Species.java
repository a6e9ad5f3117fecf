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
package com.github.tinemuz.siteindex.catalog;

import com.github.tinemuz.siteindex.ErrorKind;
import com.github.tinemuz.siteindex.SiteIndexResult;
import com.github.tinemuz.siteindex.curve.Curve;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A tree species and its catalog defaults.
 */
public final class Species {
    private final String code;
    private final String name;
    private final Curve defaultCurve;
    private final Curve defaultGiCurve;
    private final double[] classIndex;
    private final double[] coastalClassIndex;
    private final Map<Establishment, Curve> byEstablishment;

    Species(String code, String name, Curve defaultCurve, Curve defaultGiCurve,
            double[] classIndex, double[] coastalClassIndex, Map<Establishment, Curve> byEstablishment) {
        this.code = code;
        this.name = name;
        this.defaultCurve = defaultCurve;
        this.defaultGiCurve = defaultGiCurve;
        this.classIndex = classIndex;
        this.coastalClassIndex = coastalClassIndex;
        this.byEstablishment = byEstablishment.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(byEstablishment));
    }

    public String code() {
        return code;
    }

    public String name() {
        return name;
    }

    public Optional<Curve> defaultCurve() {
        return Optional.ofNullable(defaultCurve);
    }

    public Optional<Curve> defaultGiCurve() {
        return Optional.ofNullable(defaultGiCurve);
    }

    /** Whether the default curve depends on how the stand was established. */
    public boolean hasEstablishmentDefaults() {
        return !byEstablishment.isEmpty();
    }

    public Optional<Curve> defaultCurve(Establishment establishment) {
        if (byEstablishment.isEmpty()) {
            return defaultCurve();
        }
        return Optional.ofNullable(byEstablishment.get(establishment));
    }

    /**
     * Typical site index of a site class. Species with a coastal column need a
     * known zone.
     */
    public SiteIndexResult siteIndexFor(SiteClass siteClass, FizZone zone) {
        if (classIndex == null) {
            return SiteIndexResult.error(ErrorKind.UNKNOWN_SPECIES);
        }
        if (coastalClassIndex == null) {
            return SiteIndexResult.of(classIndex[siteClass.ordinal()]);
        }
        switch (zone) {
            case COAST:
                return SiteIndexResult.of(coastalClassIndex[siteClass.ordinal()]);
            case INTERIOR:
                return SiteIndexResult.of(classIndex[siteClass.ordinal()]);
            default:
                return SiteIndexResult.error(ErrorKind.UNKNOWN_FIZ);
        }
    }

    @Override
    public String toString() {
        return code + " (" + name + ")";
    }
}
