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

import java.util.Objects;
import java.util.function.DoubleFunction;
import java.util.function.DoubleUnaryOperator;

/**
 * Outcome of a conversion: either a value (height, age or site index) or an
 * {@link ErrorKind}.
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public final class SiteIndexResult {
    private final double value;
    private final ErrorKind error;

    private SiteIndexResult(double value, ErrorKind error) {
        this.value = value;
        this.error = error;
    }

    public static SiteIndexResult of(double value) {
        return new SiteIndexResult(value, null);
    }

    public static SiteIndexResult error(ErrorKind error) {
        return new SiteIndexResult(Double.NaN, Objects.requireNonNull(error, "error"));
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isError() {
        return error != null;
    }

    /**
     * The computed value.
     *
     * @throws IllegalStateException if this result is an error
     */
    public double value() {
        if (error != null) {
            throw new IllegalStateException("No value, conversion failed with " + error);
        }
        return value;
    }

    /** The failure, or {@code null} when this result carries a value. */
    public ErrorKind error() {
        return error;
    }

    public boolean is(ErrorKind kind) {
        return error == kind;
    }

    public SiteIndexResult map(DoubleUnaryOperator fn) {
        return error == null ? of(fn.applyAsDouble(value)) : this;
    }

    public SiteIndexResult flatMap(DoubleFunction<SiteIndexResult> fn) {
        return error == null ? fn.apply(value) : this;
    }

    /** Value, or the legacy negative sentinel of the error. */
    public double toLegacy() {
        return error == null ? value : error.code();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SiteIndexResult)) return false;
        SiteIndexResult other = (SiteIndexResult) o;
        return error == other.error
                && (error != null || Double.compare(value, other.value) == 0);
    }

    @Override
    public int hashCode() {
        return error != null ? error.hashCode() : Double.hashCode(value);
    }

    @Override
    public String toString() {
        return error == null ? "SiteIndexResult[" + value + "]" : "SiteIndexResult[" + error + "]";
    }
}
