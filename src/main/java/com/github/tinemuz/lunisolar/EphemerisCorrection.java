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

import static com.github.tinemuz.lunisolar.Angles.hours;
import static com.github.tinemuz.lunisolar.Angles.poly;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dynamical time minus universal time (ΔT) and the time scales built on it.
 *
 * <p>ΔT is a piecewise polynomial selected by civil year: Meeus'
 * "Astronomical Algorithms" for 1600-1986 and the NASA eclipse web site
 * polynomials elsewhere. Adjacent pieces do not meet exactly at their
 * boundary years; the published pieces are kept as they are.</p>
 */
public final class EphemerisCorrection {
    private static final Logger log = LoggerFactory.getLogger(EphemerisCorrection.class);

    /** Noon at the start of Gregorian year 2000, as a moment. */
    public static final double J2000 = 730_120.0 + hours(12);

    private static final double SECONDS_PER_DAY = 86_400.0;
    private static final double DAYS_PER_CENTURY = 36_525.0;
    private static final CivilCalendar CALENDAR = ProlepticGregorianCalendar.INSTANCE;
    private static volatile boolean warnedOutsideTabulatedRange = false;

    private EphemerisCorrection() {}

    /**
     * ΔT = dynamical time minus universal time, in days, for the civil year
     * containing {@code moment}.
     */
    public static double deltaT(double moment) {
        int year = CALENDAR.yearFromFixed((long) Math.floor(moment));
        double c = CALENDAR.dateDifference(1900, 1, 1, year, 7, 1) / DAYS_PER_CENTURY;
        double y2000 = year - 2000;
        double y1700 = year - 1700;
        double y1600 = year - 1600;
        double y1000 = (year - 1000) / 100.0;
        double y0 = year / 100.0;
        double y1820 = (year - 1820) / 100.0;

        if (year >= 2051 && year <= 2150) {
            return (-20 + 32 * y1820 * y1820 - 0.5628 * (2150 - year)) / SECONDS_PER_DAY;
        }
        if (year >= 2006 && year <= 2050) {
            return poly(y2000, 62.92, 0.32217, 0.005589) / SECONDS_PER_DAY;
        }
        if (year >= 1987 && year <= 2005) {
            return poly(y2000, 63.86, 0.3345, -0.060374, 0.0017275, 0.000651814, 0.00002373599)
                    / SECONDS_PER_DAY;
        }
        if (year >= 1900 && year <= 1986) {
            // Already in days
            return poly(c, -0.00002, 0.000297, 0.025184, -0.181133, 0.553040, -0.861938,
                    0.677066, -0.212591);
        }
        if (year >= 1800 && year <= 1899) {
            return poly(c, -0.000009, 0.003844, 0.083563, 0.865736, 4.867575, 15.845535,
                    31.332267, 38.291999, 28.316289, 11.636204, 2.043794);
        }
        if (year >= 1700 && year <= 1799) {
            return poly(y1700, 8.118780842, -0.005092142, 0.003336121, -0.0000266484)
                    / SECONDS_PER_DAY;
        }
        if (year >= 1600 && year <= 1699) {
            return poly(y1600, 120, -0.9808, -0.01532, 0.000140272128) / SECONDS_PER_DAY;
        }
        if (year >= 500 && year <= 1599) {
            return poly(y1000, 1574.2, -556.01, 71.23472, 0.319781, -0.8503463, -0.005050998,
                    0.0083572073) / SECONDS_PER_DAY;
        }
        if (year > -500 && year < 500) {
            return poly(y0, 10583.6, -1014.41, 33.78311, -5.952053, -0.1798452, 0.022174192,
                    0.0090316521) / SECONDS_PER_DAY;
        }
        warnOutsideTabulatedRange(year);
        return poly(y1820, -20, 0, 32) / SECONDS_PER_DAY;
    }

    /** Dynamical time at universal moment {@code moment}. */
    public static double dynamicalFromUniversal(double moment) {
        return moment + deltaT(moment);
    }

    /** Universal time at dynamical moment {@code moment}. */
    public static double universalFromDynamical(double moment) {
        return moment - deltaT(moment);
    }

    /** Julian centuries of dynamical time since J2000 at universal moment {@code moment}. */
    public static double julianCenturies(double moment) {
        return (dynamicalFromUniversal(moment) - J2000) / DAYS_PER_CENTURY;
    }

    private static void warnOutsideTabulatedRange(int year) {
        if (warnedOutsideTabulatedRange) return;
        synchronized (EphemerisCorrection.class) {
            if (!warnedOutsideTabulatedRange) {
                warnedOutsideTabulatedRange = true;
                log.warn(
                        "Year {} is outside the tabulated delta-T range (-499..2150); "
                                + "using the long-term parabola, accuracy degrades",
                        year);
            }
        }
    }
}
