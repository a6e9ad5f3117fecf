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

import com.github.tinemuz.siteindex.curve.Curve;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Descriptive metadata of one curve.
 */
public final class CurveInfo {

    /** Equations a curve provides. Codes add up to the catalog's equations column. */
    public enum Equation {
        HEIGHT(1),
        SITE_INDEX(2),
        YEARS_TO_BREAST_HEIGHT(4),
        GROWTH_INTERCEPT(8);

        private final int bit;

        Equation(int bit) {
            this.bit = bit;
        }

        public int bit() {
            return bit;
        }

        static Set<Equation> decode(int mask) {
            Set<Equation> set = EnumSet.noneOf(Equation.class);
            for (Equation e : values()) {
                if ((mask & e.bit) != 0) {
                    set.add(e);
                }
            }
            return set;
        }
    }

    public final Curve curve;
    public final String species;
    public final double breastHeight;
    public final Set<Equation> equations;
    public final String citation;

    CurveInfo(Curve curve, String species, double breastHeight, Set<Equation> equations, String citation) {
        this.curve = curve;
        this.species = species;
        this.breastHeight = breastHeight;
        this.equations = Collections.unmodifiableSet(EnumSet.copyOf(equations));
        this.citation = citation;
    }

    public String code() {
        return curve.name();
    }

    public boolean provides(Equation equation) {
        return equations.contains(equation);
    }

    /** Sum of the {@link Equation} bits, as in the catalog's equations column. */
    public int mask() {
        int mask = 0;
        for (Equation e : equations) {
            mask |= e.bit;
        }
        return mask;
    }

    @Override
    public String toString() {
        return curve.name() + " (" + species + ", " + citation + ")";
    }
}
