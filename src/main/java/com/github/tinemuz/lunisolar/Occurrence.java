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
package com.github.tinemuz.lunisolar;

import java.util.Locale;
import java.util.function.DoubleUnaryOperator;

/**
 * Outcome of an event search: either a value (a moment, a duration or a
 * fixed date) or the reason there is none.
 *
 * <p>{@link Status#NO_OCCURRENCE} is a legitimate astronomical answer, for
 * example no sunrise during the polar night. {@link Status#NOT_CONVERGED}
 * means an iterative search ran out of budget before settling; callers may
 * treat it differently from a genuine non-occurrence.</p>
 */
public final class Occurrence {
    /** Kind of outcome. */
    public enum Status {
        OCCURRED,
        NO_OCCURRENCE,
        NOT_CONVERGED
    }

    private static final Occurrence NONE = new Occurrence(Status.NO_OCCURRENCE, Double.NaN);
    private static final Occurrence UNRESOLVED = new Occurrence(Status.NOT_CONVERGED, Double.NaN);

    private final Status status;
    private final double value;

    private Occurrence(Status status, double value) {
        this.status = status;
        this.value = value;
    }

    /**
     * An outcome carrying a value.
     *
     * @throws IllegalArgumentException if the value is NaN or infinite
     */
    public static Occurrence of(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Occurrence value must be finite: " + value);
        }
        return new Occurrence(Status.OCCURRED, value);
    }

    /** The event does not happen. */
    public static Occurrence none() {
        return NONE;
    }

    /** The search gave up before converging. */
    public static Occurrence notConverged() {
        return UNRESOLVED;
    }

    public Status status() {
        return status;
    }

    public boolean isPresent() {
        return status == Status.OCCURRED;
    }

    /**
     * The carried value.
     *
     * @throws IllegalStateException if there is no value
     */
    public double value() {
        if (!isPresent()) {
            throw new IllegalStateException("No value for outcome " + status);
        }
        return value;
    }

    /** The fixed date (day count) containing the carried value. */
    public long fixedDate() {
        return (long) Math.floor(value());
    }

    public double orElse(double other) {
        return isPresent() ? value : other;
    }

    /** Apply {@code fn} to the value; absent outcomes pass through unchanged. */
    public Occurrence map(DoubleUnaryOperator fn) {
        return isPresent() ? of(fn.applyAsDouble(value)) : this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Occurrence)) return false;
        Occurrence other = (Occurrence) o;
        return status == other.status && Double.compare(value, other.value) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * status.hashCode() + Double.hashCode(value);
    }

    @Override
    public String toString() {
        return isPresent()
                ? String.format(Locale.ENGLISH, "Occurrence[%.8f]", value)
                : "Occurrence[" + status + "]";
    }
}
