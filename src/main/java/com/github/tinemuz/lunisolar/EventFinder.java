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
import static com.github.tinemuz.lunisolar.Angles.poly;
import static com.github.tinemuz.lunisolar.Angles.sin;
import static com.github.tinemuz.lunisolar.EphemerisCorrection.J2000;

import java.util.OptionalLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moments of solar and lunar events: seasons, new moons and lunar phases.
 *
 * <p>Moments are universal time. Searches return an {@link Occurrence};
 * {@link #nthNewMoon(long)} and {@link #lunarPhase(double)} are closed form.</p>
 */
public final class EventFinder {
    private static final Logger log = LoggerFactory.getLogger(EventFinder.class);

    /** Equinox to equinox, in days. */
    public static final double MEAN_TROPICAL_YEAR = 365.242189;

    /** New moon to new moon, in days. */
    public static final double MEAN_SYNODIC_MONTH = 29.530588861;

    // Index of the new moon of 2000-01-06 counted from the new moon of January 11, 1
    private static final long J2000_LUNATION = 24_724L;
    private static final double LUNATIONS_PER_CENTURY = 1236.85;

    // A year of lunations; the index estimate is never off by more than one
    private static final int MAX_LUNATION_SCAN = 12;

    private EventFinder() {}

    /**
     * First moment at or after {@code moment} when the solar longitude is
     * {@code lambda} degrees.
     */
    public static Occurrence solarLongitudeAfter(double lambda, double moment) {
        double rate = MEAN_TROPICAL_YEAR / 360.0;
        double tau = moment + rate * mod(lambda - SolarModel.solarLongitude(moment), 360.0);
        double a = Math.max(moment, tau - 5);
        double b = tau + 5;
        return RootFinder.invertAngular(SolarModel::solarLongitude, lambda, a, b);
    }

    /** First moment at or after {@code moment} at which {@code season} begins. */
    public static Occurrence seasonAfter(Season season, double moment) {
        return solarLongitudeAfter(season.solarLongitude(), moment);
    }

    /**
     * Approximate moment at or before {@code moment} when the solar longitude
     * last passed {@code lambda} degrees. Two steps of the mean rate, no search.
     */
    public static double estimatePriorSolarLongitude(double lambda, double moment) {
        double rate = MEAN_TROPICAL_YEAR / 360.0;
        double tau = moment - rate * mod(SolarModel.solarLongitude(moment) - lambda, 360.0);
        double delta = mod3(SolarModel.solarLongitude(tau) - lambda, -180.0, 180.0);
        return Math.min(moment, tau - rate * delta);
    }

    /**
     * Moment of the {@code n}-th new moon after (or before, for negative n)
     * the new moon of January 11, 1.
     *
     * <p>Meeus, "Astronomical Algorithms", corrected 2nd edn., 2005,
     * chapter 49: a mean-lunation polynomial plus periodic corrections,
     * converted from dynamical to universal time.</p>
     */
    public static double nthNewMoon(long n) {
        double k = n - J2000_LUNATION;
        double c = k / LUNATIONS_PER_CENTURY;
        double approx = J2000 + poly(c, 5.09766, MEAN_SYNODIC_MONTH * LUNATIONS_PER_CENTURY,
                0.00015437, -0.000000150, 0.00000000073);
        double e = poly(c, 1, -0.002516, -0.0000074);
        double solarAnomaly = poly(c, 2.5534, 29.10535670 * LUNATIONS_PER_CENTURY, -0.0000014, -0.00000011);
        double lunarAnomaly = poly(c, 201.5643, 385.81693528 * LUNATIONS_PER_CENTURY, 0.0107582,
                0.00001238, -0.000000058);
        double moonArgument = poly(c, 160.7108, 390.67050284 * LUNATIONS_PER_CENTURY, -0.0016118,
                -0.00000227, 0.000000011);
        double omega = poly(c, 124.7746, -1.56375588 * LUNATIONS_PER_CENTURY, 0.0020672, 0.00000215);

        // Columns: coefficient, power of E, solar anomaly, lunar anomaly, moon argument
        double correction = -0.00017 * sin(omega) + SeriesEvaluator.sum(
                SeriesTables.get(SeriesTables.NEW_MOON),
                t -> t[0] * Math.pow(e, t[1])
                        * sin(t[2] * solarAnomaly + t[3] * lunarAnomaly + t[4] * moonArgument));
        double extra = 0.000325 * sin(poly(c, 299.77, 132.8475848, -0.009173));
        // Columns: phase, rate per lunation, amplitude
        double additional = SeriesEvaluator.sum(
                SeriesTables.get(SeriesTables.NEW_MOON_PLANETARY),
                t -> t[2] * sin(t[0] + t[1] * k));
        return EphemerisCorrection.universalFromDynamical(approx + correction + extra + additional);
    }

    /**
     * Lunar phase angle in degrees [0, 360): 0 new moon, 90 first quarter,
     * 180 full moon, 270 last quarter.
     *
     * <p>The difference of the two longitude series can disagree with the
     * new-moon series by a hair around 0/360. When the two readings are more
     * than half a turn apart, the value implied by the nearest tabulated new
     * moon wins, so the phase stays monotonic through new moon.</p>
     */
    public static double lunarPhase(double moment) {
        double phi = mod(LunarModel.lunarLongitude(moment) - SolarModel.solarLongitude(moment), 360.0);
        double t0 = nthNewMoon(0);
        long n = Math.round((moment - t0) / MEAN_SYNODIC_MONTH);
        double phiPrime = 360.0 * mod((moment - nthNewMoon(n)) / MEAN_SYNODIC_MONTH, 1.0);
        return Math.abs(phi - phiPrime) > 180.0 ? phiPrime : phi;
    }

    /** Last moment at or before {@code moment} when the lunar phase was {@code phi} degrees. */
    public static Occurrence lunarPhaseAtOrBefore(double phi, double moment) {
        double tau = moment - MEAN_SYNODIC_MONTH / 360.0 * mod(lunarPhase(moment) - phi, 360.0);
        double a = tau - 2;
        double b = Math.min(moment, tau + 2);
        return RootFinder.invertAngular(EventFinder::lunarPhase, phi, a, b);
    }

    /** First moment at or after {@code moment} when the lunar phase is {@code phi} degrees. */
    public static Occurrence lunarPhaseAtOrAfter(double phi, double moment) {
        double tau = moment + MEAN_SYNODIC_MONTH / 360.0 * mod(phi - lunarPhase(moment), 360.0);
        double a = Math.max(moment, tau - 2);
        double b = tau + 2;
        return RootFinder.invertAngular(EventFinder::lunarPhase, phi, a, b);
    }

    /** First moment at or after {@code moment} of the principal phase {@code phase}. */
    public static Occurrence moonPhaseAtOrAfter(MoonPhase phase, double moment) {
        return lunarPhaseAtOrAfter(phase.phaseAngle(), moment);
    }

    /** Moment of the last new moon strictly before {@code moment}. */
    public static Occurrence newMoonBefore(double moment) {
        long n = estimateLunation(moment);
        OptionalLong k = RootFinder.last(n - 1, i -> nthNewMoon(i) < moment, MAX_LUNATION_SCAN);
        return lunation(k, moment);
    }

    /** Moment of the first new moon at or after {@code moment}. */
    public static Occurrence newMoonAtOrAfter(double moment) {
        long n = estimateLunation(moment);
        OptionalLong k = RootFinder.next(n, i -> nthNewMoon(i) >= moment, MAX_LUNATION_SCAN);
        return lunation(k, moment);
    }

    private static long estimateLunation(double moment) {
        double t0 = nthNewMoon(0);
        return Math.round((moment - t0) / MEAN_SYNODIC_MONTH - lunarPhase(moment) / 360.0);
    }

    private static Occurrence lunation(OptionalLong k, double moment) {
        if (k.isEmpty()) {
            log.debug("New moon scan around {} exhausted {} lunations", moment, MAX_LUNATION_SCAN);
            return Occurrence.notConverged();
        }
        return Occurrence.of(nthNewMoon(k.getAsLong()));
    }
}
