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

import static com.github.tinemuz.lunisolar.Angles.angle;
import static com.github.tinemuz.lunisolar.Angles.arccos;
import static com.github.tinemuz.lunisolar.Angles.arcsin;
import static com.github.tinemuz.lunisolar.Angles.cos;
import static com.github.tinemuz.lunisolar.Angles.hours;
import static com.github.tinemuz.lunisolar.Angles.mod;
import static com.github.tinemuz.lunisolar.Angles.mod3;
import static com.github.tinemuz.lunisolar.Angles.seconds;
import static com.github.tinemuz.lunisolar.Angles.sin;
import static com.github.tinemuz.lunisolar.Angles.tan;
import static com.github.tinemuz.lunisolar.TimeConversion.localFromApparent;
import static com.github.tinemuz.lunisolar.TimeConversion.standardFromLocal;
import static com.github.tinemuz.lunisolar.TimeConversion.standardFromUniversal;
import static com.github.tinemuz.lunisolar.TimeConversion.universalFromLocal;
import static com.github.tinemuz.lunisolar.TimeConversion.universalFromStandard;

import java.util.OptionalLong;
import java.util.function.DoublePredicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rising, setting and twilight times of the sun and moon, and the temporal
 * (proportional) hours derived from them.
 *
 * <p>Day-based methods take a fixed date and return standard time at the
 * location. When the event does not happen that day (polar day or night, a
 * day the moon skips) the result is {@link Occurrence#none()}.</p>
 */
public final class RiseSetEngine {
    private static final Logger log = LoggerFactory.getLogger(RiseSetEngine.class);

    /** Apparent semi-diameter of the sun and the moon, degrees. */
    static final double SEMI_DIAMETER = angle(0, 16, 0);

    private static final double EARTH_RADIUS_M = 6.372e6;

    // Successive depression estimates closer than this are converged
    private static final double DEPRESSION_CONVERGENCE = seconds(30);

    static final int MAX_DEPRESSION_ITERATIONS = 32;

    // Moon crossings are resolved to a minute
    private static final double CROSSING_RESOLUTION = hours(1.0 / 60);

    // Step of the fallback scan over the civil day
    private static final double SCAN_STEP = hours(0.5);

    // Keeps the offset estimate finite at the poles
    private static final double MIN_COLATITUDE = 1.0;

    private RiseSetEngine() {}

    /**
     * Sine of the angle between the sun's position at local moment
     * {@code moment} and its position when its depression is {@code alpha}.
     * Outside [-1, 1] when that depression is not reached.
     */
    public static double sineOffset(double moment, Location location, double alpha) {
        double phi = location.latitude;
        double universal = universalFromLocal(moment, location);
        double delta = SolarModel.declination(universal, 0, SolarModel.solarLongitude(universal));
        return tan(phi) * tan(delta) + sin(alpha) / (cos(delta) * cos(phi));
    }

    /**
     * One estimate of the local moment near {@code moment} when the sun's
     * depression is {@code alpha} degrees (negative above the horizon).
     *
     * @param early true for the morning event, false for the evening one
     */
    public static Occurrence approxMomentOfDepression(
            double moment, Location location, double alpha, boolean early) {
        double sineOffset = sineOffset(moment, location, alpha);
        double date = Math.floor(moment);
        double alternate;
        if (alpha >= 0) {
            alternate = early ? date : date + 1;
        } else {
            alternate = date + hours(12);
        }
        double value = Math.abs(sineOffset) > 1 ? sineOffset(alternate, location, alpha) : sineOffset;
        if (Math.abs(value) > 1) {
            return Occurrence.none();
        }
        double offset = mod3(arcsin(value) / 360.0, hours(-12), hours(12));
        double apparent = date + (early ? hours(6) - offset : hours(18) + offset);
        return Occurrence.of(localFromApparent(apparent, location));
    }

    /**
     * Local moment near {@code approx} when the sun's depression is
     * {@code alpha} degrees, refined until two estimates agree within 30
     * seconds.
     *
     * @return the moment, {@link Occurrence#none()} if the depression is never
     *     reached, or {@link Occurrence#notConverged()} if the estimates keep moving
     */
    public static Occurrence momentOfDepression(
            double approx, Location location, double alpha, boolean early) {
        double estimate = approx;
        for (int i = 0; i < MAX_DEPRESSION_ITERATIONS; i++) {
            Occurrence next = approxMomentOfDepression(estimate, location, alpha, early);
            if (!next.isPresent() || Math.abs(estimate - next.value()) < DEPRESSION_CONVERGENCE) {
                return next;
            }
            estimate = next.value();
        }
        log.debug("Depression {} at {} did not converge near {}", alpha, location, approx);
        return Occurrence.notConverged();
    }

    /** Standard time in the morning of {@code date} when the sun's depression is {@code alpha}. */
    public static Occurrence dawn(long date, Location location, double alpha) {
        return momentOfDepression(date + hours(6), location, alpha, true)
                .map(local -> standardFromLocal(local, location));
    }

    /** Standard time in the evening of {@code date} when the sun's depression is {@code alpha}. */
    public static Occurrence dusk(long date, Location location, double alpha) {
        return momentOfDepression(date + hours(18), location, alpha, false)
                .map(local -> standardFromLocal(local, location));
    }

    /**
     * Refraction at the horizon plus the dip of the horizon seen from the
     * location's elevation, in degrees.
     */
    public static double refraction(Location location) {
        double h = Math.max(0, location.elevation);
        double dip = arccos(EARTH_RADIUS_M / (EARTH_RADIUS_M + h));
        return angle(0, 34, 0) + dip + angle(0, 0, 19) * Math.sqrt(h);
    }

    /** Standard time of sunrise (upper limb on the horizon) on {@code date}. */
    public static Occurrence sunrise(long date, Location location) {
        return dawn(date, location, refraction(location) + SEMI_DIAMETER);
    }

    /** Standard time of sunset (upper limb on the horizon) on {@code date}. */
    public static Occurrence sunset(long date, Location location) {
        return dusk(date, location, refraction(location) + SEMI_DIAMETER);
    }

    /**
     * Observed altitude of the moon's upper limb in degrees, including
     * parallax, refraction and the location's elevation.
     */
    public static double observedLunarAltitude(double moment, Location location) {
        return LunarModel.topocentricLunarAltitude(moment, location) + refraction(location) + SEMI_DIAMETER;
    }

    /** Standard time of moonrise on {@code date}, or none if the moon does not rise that day. */
    public static Occurrence moonrise(long date, Location location) {
        double t = universalFromStandard(date, location);
        boolean waning = EventFinder.lunarPhase(t) > 180;
        double offset = horizonOffset(t, location);
        double approx;
        if (waning && offset > 0) {
            approx = t + 1 - offset;
        } else if (waning) {
            approx = t - offset;
        } else {
            approx = t + 0.5 + offset;
        }
        return crossingOnDay(t, approx, location, true).map(ut -> standardFromUniversal(ut, location));
    }

    /** Standard time of moonset on {@code date}, or none if the moon does not set that day. */
    public static Occurrence moonset(long date, Location location) {
        double t = universalFromStandard(date, location);
        boolean waxing = EventFinder.lunarPhase(t) < 180;
        double offset = horizonOffset(t, location);
        double approx;
        if (waxing && offset > 0) {
            approx = t + offset;
        } else if (waxing) {
            approx = t + 1 + offset;
        } else {
            approx = t - offset + 0.5;
        }
        return crossingOnDay(t, approx, location, false).map(ut -> standardFromUniversal(ut, location));
    }

    /**
     * Length of a daytime temporal hour (a twelfth of sunrise to sunset) on
     * {@code date}, in days.
     */
    public static Occurrence daytimeTemporalHour(long date, Location location) {
        Occurrence rise = sunrise(date, location);
        Occurrence set = sunset(date, location);
        if (!rise.isPresent() || !set.isPresent()) {
            return Occurrence.none();
        }
        return Occurrence.of((set.value() - rise.value()) / 12.0);
    }

    /**
     * Length of a nighttime temporal hour (a twelfth of sunset on
     * {@code date} to sunrise on the next day), in days.
     */
    public static Occurrence nighttimeTemporalHour(long date, Location location) {
        Occurrence set = sunset(date, location);
        Occurrence rise = sunrise(date + 1, location);
        if (!rise.isPresent() || !set.isPresent()) {
            return Occurrence.none();
        }
        return Occurrence.of((rise.value() - set.value()) / 12.0);
    }

    /**
     * Standard time of temporal moment {@code moment}, where 6:00 is sunrise
     * and 18:00 is sunset and each half of the day is divided into twelve
     * equal hours.
     */
    public static Occurrence standardFromSundial(double moment, Location location) {
        long date = (long) Math.floor(moment);
        double hour = 24 * mod(moment, 1.0);
        if (hour >= 6 && hour <= 18) {
            Occurrence h = daytimeTemporalHour(date, location);
            if (!h.isPresent()) return h;
            return sunrise(date, location).map(rise -> rise + (hour - 6) * h.value());
        }
        if (hour < 6) {
            Occurrence h = nighttimeTemporalHour(date - 1, location);
            if (!h.isPresent()) return h;
            return sunset(date - 1, location).map(set -> set + (hour + 6) * h.value());
        }
        Occurrence h = nighttimeTemporalHour(date, location);
        if (!h.isPresent()) return h;
        return sunset(date, location).map(set -> set + (hour - 18) * h.value());
    }

    // Fraction of a day the moon needs to reach the horizon from its current altitude
    private static double horizonOffset(double t, Location location) {
        double altitude = observedLunarAltitude(t, location);
        double colatitude = Math.max(90 - Math.abs(location.latitude), MIN_COLATITUDE);
        return altitude / (4 * colatitude);
    }

    /**
     * Universal moment in [start, start + 1) where the moon's upper limb
     * crosses the horizon in the given direction. The bracket around
     * {@code approx} is tried first; when it holds no crossing inside the day
     * the day itself is scanned in {@link #SCAN_STEP} steps.
     */
    private static Occurrence crossingOnDay(double start, double approx, Location location, boolean rising) {
        DoublePredicate past = x -> rising
                ? observedLunarAltitude(x, location) > 0
                : observedLunarAltitude(x, location) < 0;
        Occurrence crossing = RootFinder.bisect(approx - hours(6), approx + hours(6), past, CROSSING_RESOLUTION);
        if (!crossing.isPresent() || crossing.value() < start || crossing.value() >= start + 1) {
            int steps = (int) Math.round(1.0 / SCAN_STEP);
            OptionalLong k = RootFinder.next(
                    0, i -> !past.test(start + i * SCAN_STEP) && past.test(start + (i + 1) * SCAN_STEP), steps);
            if (k.isEmpty()) {
                return Occurrence.none();
            }
            double lo = start + k.getAsLong() * SCAN_STEP;
            crossing = RootFinder.bisect(lo, lo + SCAN_STEP, past, CROSSING_RESOLUTION);
        }
        return crossing;
    }
}
