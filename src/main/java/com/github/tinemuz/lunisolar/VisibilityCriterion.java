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

import static com.github.tinemuz.lunisolar.Angles.arccos;
import static com.github.tinemuz.lunisolar.Angles.cos;

import java.util.OptionalLong;

/**
 * Visibility of the young crescent moon and the search for phasis, the first
 * evening on which it can be seen.
 *
 * <p>Visibility follows S. K. Shaukat's criterion. It is not intended for
 * high elevations or polar regions.</p>
 */
public final class VisibilityCriterion {

    /** Sun depression, in degrees, at which the crescent is best looked for. */
    static final double BEST_VIEW_DEPRESSION = 4.5;

    static final double MIN_ARC_OF_LIGHT = 10.6;
    static final double MAX_ARC_OF_LIGHT = 90.0;
    static final double MIN_LUNAR_ALTITUDE = 4.1;

    // Two lunations bound every phasis scan
    static final int MAX_SCAN_DAYS = (int) Math.ceil(2 * EventFinder.MEAN_SYNODIC_MONTH);

    private VisibilityCriterion() {}

    /** Angular separation of the sun and the moon at {@code moment}, degrees [0, 180]. */
    public static double arcOfLight(double moment) {
        return arccos(cos(LunarModel.lunarLatitude(moment)) * cos(EventFinder.lunarPhase(moment)));
    }

    /**
     * Universal time at which to look for the crescent on the evening of
     * {@code date}: dusk at 4.5° depression, or the following midnight if the
     * sun never gets that low.
     */
    public static double simpleBestView(long date, Location location) {
        Occurrence dark = RiseSetEngine.dusk(date, location, BEST_VIEW_DEPRESSION);
        double best = dark.isPresent() ? dark.value() : date + 1;
        return TimeConversion.universalFromStandard(best, location);
    }

    /**
     * Shaukat's criterion for a likely sighting of the crescent on the eve of
     * {@code date} (the evening of the previous day) at {@code location}.
     */
    public static boolean shaukatCriterion(long date, Location location) {
        double t = simpleBestView(date - 1, location);
        double phase = EventFinder.lunarPhase(t);
        double altitude = LunarModel.lunarAltitude(t, location);
        double arcOfLight = arcOfLight(t);
        return phase > 0 && phase < 90
                && arcOfLight >= MIN_ARC_OF_LIGHT && arcOfLight <= MAX_ARC_OF_LIGHT
                && altitude > MIN_LUNAR_ALTITUDE;
    }

    /** Whether the crescent may be visible on the eve of {@code date}. */
    public static boolean visibleCrescent(long date, Location location) {
        return shaukatCriterion(date, location);
    }

    /**
     * Closest fixed date on or before {@code date} on the eve of which the
     * crescent first became visible at {@code location}.
     */
    public static Occurrence phasisOnOrBefore(long date, Location location) {
        Occurrence newMoon = EventFinder.lunarPhaseAtOrBefore(0, date);
        if (!newMoon.isPresent()) return newMoon;
        long moon = newMoon.fixedDate();
        long age = date - moon;
        long start = age <= 3 && !visibleCrescent(date, location) ? moon - 30 : moon;
        return firstVisible(start, location);
    }

    /**
     * Closest fixed date on or after {@code date} on the eve of which the
     * crescent first became visible at {@code location}.
     */
    public static Occurrence phasisOnOrAfter(long date, Location location) {
        Occurrence newMoon = EventFinder.lunarPhaseAtOrBefore(0, date);
        if (!newMoon.isPresent()) return newMoon;
        long moon = newMoon.fixedDate();
        long age = date - moon;
        long start = age >= 4 && visibleCrescent(date - 1, location) ? moon + 29 : date;
        return firstVisible(start, location);
    }

    private static Occurrence firstVisible(long start, Location location) {
        OptionalLong day = RootFinder.next(start, d -> visibleCrescent(d, location), MAX_SCAN_DAYS);
        return day.isPresent() ? Occurrence.of(day.getAsLong()) : Occurrence.none();
    }
}
