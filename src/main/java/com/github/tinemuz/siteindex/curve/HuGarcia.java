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

import com.github.tinemuz.siteindex.SiteIndexResult;
import com.github.tinemuz.siteindex.numeric.Bisection;

/**
 * Hu and Garcia (2010) white spruce model.
 *
 * <p>Height depends on breast-height age through a single shape parameter
 * {@code q}, which is found from site index by searching for the {@code q}
 * whose curve passes through site index at breast-height age 50.</p>
 */
final class HuGarcia {
    static final double REFERENCE_AGE = 50.0;
    /** Largest q searched; its asymptote is about 3000 m. */
    static final double MAX_Q = 100.0;

    private HuGarcia() {}

    /** Shape parameter for a site index, or NO_CONVERGENCE past {@link #MAX_Q}. */
    static SiteIndexResult q(double siteIndex, double bhAge) {
        Bisection.Search search = Bisection.Search.from(0.02, 0.01)
                .tolerance(0.0000001)
                .stepFloor(0.0000001)
                .upperBound(MAX_Q)
                .clampAtOrBelow(0.0, 0.0000001)
                .fullFirstReversal();
        return Bisection.solve(q -> SiteIndexResult.of(height(q, bhAge)), siteIndex, search);
    }

    static double height(double q, double bhAge) {
        double a = asymptote(q);
        return a * Math.pow(1 - (1 - Math.pow(1.3 / a, 0.5829)) * Math.exp(-q * (bhAge - 0.5)), 1.71556);
    }

    static double breastHeightAge(double q, double height) {
        double a = asymptote(q);
        return 0.5 - 1 / q * Math.log((1 - Math.pow(height / a, 0.5829)) / (1 - Math.pow(1.3 / a, 0.5829)));
    }

    private static double asymptote(double q) {
        return 283.9 * Math.pow(q, 0.5137);
    }
}
