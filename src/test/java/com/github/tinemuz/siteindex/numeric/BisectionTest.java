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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.siteindex.ErrorKind;
import com.github.tinemuz.siteindex.SiteIndexResult;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BisectionTest {

    @Nested
    @DisplayName("Convergence")
    class ConvergenceTests {

        @Test
        @DisplayName("Finds the root of an increasing function")
        void increasing() {
            SiteIndexResult r = Bisection.solve(x -> SiteIndexResult.of(x * x), 2.0,
                    Bisection.Search.from(1.0, 0.5).tolerance(1e-9).stepFloor(1e-12));
            assertEquals(Math.sqrt(2), r.value(), 1e-6);
        }

        @Test
        @DisplayName("Stops as soon as the seed is within tolerance")
        void seedAccepted() {
            AtomicInteger calls = new AtomicInteger();
            SiteIndexResult r = Bisection.solve(x -> {
                calls.incrementAndGet();
                return SiteIndexResult.of(x);
            }, 25.0, Bisection.Search.from(25.0, 12.5).tolerance(0.001));
            assertEquals(25.0, r.value());
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("An overshooting seed turns back by half the step, or the full step when asked")
        void firstReversal() {
            List<Double> halved = new ArrayList<>();
            Bisection.solve(x -> {
                halved.add(x);
                return SiteIndexResult.of(x);
            }, 0.5, Bisection.Search.from(1.0, 1.0).tolerance(1e-9));
            assertEquals(List.of(1.0, 0.5), halved);

            List<Double> full = new ArrayList<>();
            Bisection.solve(x -> {
                full.add(x);
                return SiteIndexResult.of(x);
            }, 0.5, Bisection.Search.from(1.0, 1.0).tolerance(1e-9).fullFirstReversal());
            assertEquals(List.of(1.0, 0.0, 0.5), full);
        }

        @Test
        @DisplayName("Later reversals halve the step even when the first keeps it")
        void laterReversalsHalve() {
            List<Double> seen = new ArrayList<>();
            // climbs from below, so the first reversal is an ordinary one
            Bisection.solve(x -> {
                seen.add(x);
                return SiteIndexResult.of(x);
            }, 1.5, Bisection.Search.from(0.0, 1.0).tolerance(1e-9).fullFirstReversal());
            assertEquals(List.of(0.0, 1.0, 2.0, 1.5), seen);
        }

        @Test
        @DisplayName("Accepts the candidate once the step falls below the floor")
        void stepFloor() {
            // a flat objective never comes within tolerance
            SiteIndexResult r = Bisection.solve(x -> SiteIndexResult.of(x < 10 ? 0 : 100), 50,
                    Bisection.Search.from(0, 4).tolerance(1e-6).stepFloor(1e-3));
            assertTrue(r.isOk());
            assertEquals(10.0, r.value(), 0.01);
        }
    }

    @Nested
    @DisplayName("Bounds")
    class BoundTests {

        @Test
        @DisplayName("Passing the upper bound fails")
        void upperBound() {
            SiteIndexResult r = Bisection.solve(x -> SiteIndexResult.of(0), 1.0,
                    Bisection.Search.from(1, 10).upperBound(100));
            assertTrue(r.is(ErrorKind.NO_CONVERGENCE));
        }

        @Test
        @DisplayName("Repair keeps candidates at or above the limit")
        void repair() {
            SiteIndexResult r = Bisection.solve(x -> {
                assertTrue(x >= 1.3, "candidate below limit: " + x);
                return SiteIndexResult.of(x);
            }, 0.5, Bisection.Search.from(25, 12.5).tolerance(0.001).stepFloor(1e-5).repairBelow(1.3));
            assertTrue(r.isOk());
            assertEquals(1.3, r.value(), 0.01);
        }

        @Test
        @DisplayName("Clamp replaces candidates at or below the limit")
        void clamp() {
            SiteIndexResult r = Bisection.solve(x -> {
                assertTrue(x > 0, "candidate not positive: " + x);
                return SiteIndexResult.of(x);
            }, 1e-9, Bisection.Search.from(0.02, 0.01).tolerance(1e-7).stepFloor(1e-7).clampAtOrBelow(0, 1e-7));
            assertTrue(r.isOk());
        }
    }

    @Nested
    @DisplayName("Objective errors")
    class ErrorTests {

        @Test
        @DisplayName("Errors abort the search unchanged")
        void propagate() {
            SiteIndexResult r = Bisection.solve(x -> SiteIndexResult.error(ErrorKind.SITE_INDEX_TOO_LOW), 1,
                    Bisection.Search.from(1, 1));
            assertTrue(r.is(ErrorKind.SITE_INDEX_TOO_LOW));
        }

        @Test
        @DisplayName("Out-of-range evaluations can be scored and counted")
        void overflow() {
            // undefined above 40; the search overshoots into that region on the way to 39
            SiteIndexResult r = Bisection.solve(
                    x -> x > 40 ? SiteIndexResult.error(ErrorKind.NO_CONVERGENCE) : SiteIndexResult.of(x), 39,
                    Bisection.Search.from(25, 12.5).tolerance(0.005).overflowAs(1000, 100));
            assertEquals(39.0, r.value(), 0.005);
        }

        @Test
        @DisplayName("Too many out-of-range evaluations fail")
        void overflowLimit() {
            AtomicInteger calls = new AtomicInteger();
            SiteIndexResult r = Bisection.solve(x -> {
                calls.incrementAndGet();
                return SiteIndexResult.error(ErrorKind.NO_CONVERGENCE);
            }, 30, Bisection.Search.from(25, 12.5).stepFloor(0).overflowAs(1000, 100));
            assertTrue(r.is(ErrorKind.NO_CONVERGENCE));
            assertEquals(100, calls.get());
        }
    }
}
