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

import static com.github.tinemuz.lunisolar.Angles.mod;
import static com.github.tinemuz.lunisolar.Angles.mod3;

import java.util.OptionalLong;
import java.util.function.DoublePredicate;
import java.util.function.DoubleUnaryOperator;
import java.util.function.LongPredicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Numeric inversion of the position models.
 *
 * <p>All searches are bounded: bisections stop after {@link #MAX_BISECTIONS}
 * halvings and integer scans after a caller-supplied number of steps.</p>
 */
public final class RootFinder {
    private static final Logger log = LoggerFactory.getLogger(RootFinder.class);

    /** Bracket width, in days, at which angular inversion stops. */
    public static final double ANGULAR_PRECISION = 1e-5;

    /** Largest residual, in degrees, accepted as a crossing of the target. */
    public static final double ANGULAR_TOLERANCE = 0.01;

    static final int MAX_BISECTIONS = 200;

    private RootFinder() {}

    /**
     * Moment in [a, b] at which the angular function {@code f} passes
     * {@code target} (mod 360).
     *
     * <p>{@code f} must increase through the target exactly once in the
     * bracket. The search bisects on the sign of the residual
     * {@code mod(f(x) - target, 360) < 180}.</p>
     *
     * @return the crossing, {@code a} itself if {@code f(a)} is already within
     *     {@link #ANGULAR_TOLERANCE} of the target, or {@link Occurrence#notConverged()}
     *     if the bracket does not contain a crossing
     * @throws IllegalArgumentException if the bracket is not finite or reversed
     */
    public static Occurrence invertAngular(DoubleUnaryOperator f, double target, double a, double b) {
        Occurrence x = bisect(a, b, t -> mod(f.applyAsDouble(t) - target, 360.0) < 180.0, ANGULAR_PRECISION);
        if (!x.isPresent()) {
            // f(a) already sits on the target
            double atStart = Math.abs(mod3(f.applyAsDouble(a) - target, -180.0, 180.0));
            return atStart <= ANGULAR_TOLERANCE ? Occurrence.of(a) : x;
        }
        double residual = Math.abs(mod3(f.applyAsDouble(x.value()) - target, -180.0, 180.0));
        if (residual > ANGULAR_TOLERANCE) {
            log.debug("No crossing of {} in [{}, {}]; residual {} degrees", target, a, b, residual);
            return Occurrence.notConverged();
        }
        return x;
    }

    /**
     * Point where {@code predicate} switches from false to true within [lo, hi],
     * found by bisection until the bracket is narrower than {@code tolerance}.
     *
     * <p>The predicate must be false at {@code lo} and true at {@code hi}; the
     * bracket then holds at least one switch and the result is within
     * {@code tolerance} of one of them.</p>
     *
     * @return midpoint of the final bracket, or {@link Occurrence#notConverged()}
     *     if the bracket does not straddle a switch or the iteration cap is reached
     * @throws IllegalArgumentException if the bracket is not finite or reversed,
     *     or the tolerance is not positive
     */
    public static Occurrence bisect(double lo, double hi, DoublePredicate predicate, double tolerance) {
        if (!Double.isFinite(lo) || !Double.isFinite(hi) || lo > hi) {
            throw new IllegalArgumentException("Invalid bracket [" + lo + ", " + hi + "]");
        }
        if (!(tolerance > 0.0)) {
            throw new IllegalArgumentException("Tolerance must be positive: " + tolerance);
        }
        if (predicate.test(lo) || !predicate.test(hi)) {
            log.debug("Bracket [{}, {}] does not straddle a switch", lo, hi);
            return Occurrence.notConverged();
        }
        for (int i = 0; i < MAX_BISECTIONS; i++) {
            double mid = (lo + hi) / 2.0;
            if (hi - lo < tolerance) {
                return Occurrence.of(mid);
            }
            if (predicate.test(mid)) {
                hi = mid;
            } else {
                lo = mid;
            }
        }
        log.debug("Bisection did not narrow below {} after {} steps", tolerance, MAX_BISECTIONS);
        return Occurrence.notConverged();
    }

    /**
     * Smallest k in [start, start + maxSteps) with {@code predicate(k)}.
     *
     * @return k, or empty if the scan was exhausted
     */
    public static OptionalLong next(long start, LongPredicate predicate, int maxSteps) {
        for (long k = start; k < start + maxSteps; k++) {
            if (predicate.test(k)) return OptionalLong.of(k);
        }
        return OptionalLong.empty();
    }

    /**
     * Last k in a run of successes starting at {@code start}: the largest k
     * such that {@code predicate} holds for every value in [start, k].
     * Returns {@code start - 1} if the predicate fails at {@code start}.
     *
     * @return k, or empty if the run was still unbroken after {@code maxSteps}
     */
    public static OptionalLong last(long start, LongPredicate predicate, int maxSteps) {
        for (long k = start; k < start + maxSteps; k++) {
            if (!predicate.test(k)) return OptionalLong.of(k - 1);
        }
        return OptionalLong.empty();
    }
}
