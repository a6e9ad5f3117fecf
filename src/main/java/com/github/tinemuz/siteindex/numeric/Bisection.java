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
package com.github.tinemuz.siteindex.numeric;

import com.github.tinemuz.siteindex.ErrorKind;
import com.github.tinemuz.siteindex.SiteIndexResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Halve-and-flip search for {@code x} such that {@code f(x)} is within a
 * tolerance of a target.
 *
 * <p>Starting at a seed, the candidate moves by a step. Whenever the
 * evaluated value crosses the target the step is halved and its sign
 * flipped. The search stops when the value is within tolerance, or when the
 * step shrinks below a floor (the current candidate is then accepted). It
 * fails with {@link ErrorKind#NO_CONVERGENCE} once the candidate passes an
 * upper bound. The objective is assumed to increase with {@code x}.</p>
 *
 * <p>Errors returned by the objective abort the search and are returned
 * unchanged, except {@link ErrorKind#NO_CONVERGENCE} when
 * {@link Search#overflowAs} is set: such evaluations are then scored as that
 * value and counted, and the search fails once the count is reached.</p>
 */
public final class Bisection {
    private static final Logger log = LoggerFactory.getLogger(Bisection.class);

    private Bisection() {}

    /** Function being searched; may fail with an error. */
    @FunctionalInterface
    public interface Objective {
        SiteIndexResult evaluate(double x);
    }

    /** How the candidate is kept above a lower limit. */
    public enum LowerBound {
        /** No lower limit. */
        NONE,
        /** Undo the step that crossed the limit and halve it. */
        REPAIR,
        /** Replace a candidate at or below the limit with a fixed value. */
        CLAMP
    }

    /** Search parameters. Mutable builder, not shared between threads. */
    public static final class Search {
        private final double seed;
        private final double step;
        private double tolerance = 1e-5;
        private double stepFloor = 1e-5;
        private double upperBound = Double.POSITIVE_INFINITY;
        private LowerBound lowerPolicy = LowerBound.NONE;
        private double lowerLimit;
        private double clampValue;
        private double overflowValue = Double.NaN;
        private int overflowLimit;
        private boolean halveFirstReversal = true;

        private Search(double seed, double step) {
            this.seed = seed;
            this.step = step;
        }

        public static Search from(double seed, double step) {
            return new Search(seed, step);
        }

        public Search tolerance(double tolerance) {
            this.tolerance = tolerance;
            return this;
        }

        public Search stepFloor(double stepFloor) {
            this.stepFloor = stepFloor;
            return this;
        }

        /** Fail once the candidate exceeds {@code bound}. */
        public Search upperBound(double bound) {
            this.upperBound = bound;
            return this;
        }

        /** Undo and halve any step that takes the candidate below {@code limit}. */
        public Search repairBelow(double limit) {
            this.lowerPolicy = LowerBound.REPAIR;
            this.lowerLimit = limit;
            return this;
        }

        /** Replace a candidate at or below {@code limit} with {@code value}. */
        public Search clampAtOrBelow(double limit, double value) {
            this.lowerPolicy = LowerBound.CLAMP;
            this.lowerLimit = limit;
            this.clampValue = value;
            return this;
        }

        /** Turn back by the full step, not half of it, when the seed already overshoots. */
        public Search fullFirstReversal() {
            this.halveFirstReversal = false;
            return this;
        }

        /** Score NO_CONVERGENCE evaluations as {@code value}; fail after {@code limit} of them. */
        public Search overflowAs(double value, int limit) {
            this.overflowValue = value;
            this.overflowLimit = limit;
            return this;
        }
    }

    /**
     * Run the search.
     *
     * @param f      objective, increasing in {@code x}
     * @param target value sought
     * @param s      search parameters
     * @return the accepted candidate, or the error that stopped the search
     */
    public static SiteIndexResult solve(Objective f, double target, Search s) {
        double x = s.seed;
        double step = s.step;
        int overflows = 0;
        boolean first = true;

        while (true) {
            SiteIndexResult result = f.evaluate(x);
            double y;
            if (result.isError()) {
                if (result.is(ErrorKind.NO_CONVERGENCE) && !Double.isNaN(s.overflowValue)) {
                    y = s.overflowValue;
                    if (++overflows == s.overflowLimit) {
                        log.debug("Search gave up after {} out-of-range evaluations near x={}", overflows, x);
                        return SiteIndexResult.error(ErrorKind.NO_CONVERGENCE);
                    }
                } else {
                    return result;
                }
            } else {
                y = result.value();
            }

            if (Math.abs(y - target) > s.tolerance) {
                double divisor = first && !s.halveFirstReversal ? 1.0 : 2.0;
                if (y > target) {
                    if (step > 0) step = -step / divisor;
                } else {
                    if (step < 0) step = -step / divisor;
                }
                first = false;
                x += step;
                if (s.lowerPolicy == LowerBound.CLAMP && x <= s.lowerLimit) {
                    x = s.clampValue;
                }
            } else {
                break;
            }

            if (Math.abs(step) < s.stepFloor) {
                break;
            }
            if (x > s.upperBound) {
                log.debug("Search passed upper bound {} (target {})", s.upperBound, target);
                return SiteIndexResult.error(ErrorKind.NO_CONVERGENCE);
            }
            if (s.lowerPolicy == LowerBound.REPAIR && x < s.lowerLimit) {
                x += Math.abs(step);
                step /= 2.0;
            }
        }
        return SiteIndexResult.of(x);
    }
}
