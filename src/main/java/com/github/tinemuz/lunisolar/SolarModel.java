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
import static com.github.tinemuz.lunisolar.Angles.arcsin;
import static com.github.tinemuz.lunisolar.Angles.arctan;
import static com.github.tinemuz.lunisolar.Angles.cos;
import static com.github.tinemuz.lunisolar.Angles.hours;
import static com.github.tinemuz.lunisolar.Angles.mod;
import static com.github.tinemuz.lunisolar.Angles.poly;
import static com.github.tinemuz.lunisolar.Angles.sin;
import static com.github.tinemuz.lunisolar.Angles.tan;
import static com.github.tinemuz.lunisolar.EphemerisCorrection.J2000;
import static com.github.tinemuz.lunisolar.EphemerisCorrection.julianCenturies;

/**
 * Position of the sun and the slowly varying quantities of the Earth's
 * orientation: obliquity, nutation, aberration, precession and sidereal time.
 *
 * <p>Every method takes a universal-time moment. Longitudes are in [0, 360);
 * the equation of time is a signed fraction of a day.</p>
 */
public final class SolarModel {

    /** Fixed-star to fixed-star period, in days. */
    public static final double MEAN_SIDEREAL_YEAR = 365.25636;

    // 1e-6 radian in degrees, the unit of the solar longitude series
    private static final double MICRORADIAN_DEG = 0.000005729577951308232;

    private SolarModel() {}

    /**
     * Apparent geocentric longitude of the sun in degrees, [0, 360).
     *
     * <p>Bretagnon and Simon, "Planetary Programs and Tables from -4000 to
     * +2800", corrected for aberration and nutation.</p>
     */
    public static double solarLongitude(double moment) {
        double c = julianCenturies(moment);
        double series = SeriesEvaluator.sum(
                SeriesTables.get(SeriesTables.SOLAR_LONGITUDE),
                term -> term[0] * sin(term[1] + term[2] * c));
        double lambda = 282.7771834 + 36000.76953744 * c + MICRORADIAN_DEG * series;
        return mod(lambda + aberration(moment) + nutation(moment), 360.0);
    }

    /** Obliquity of the ecliptic in degrees. */
    public static double obliquity(double moment) {
        double c = julianCenturies(moment);
        return angle(23, 26, 21.448)
                + poly(c, 0, angle(0, 0, -46.8150), angle(0, 0, -0.00059), angle(0, 0, 0.001813));
    }

    /**
     * Equation of time (apparent minus mean solar time) as a fraction of a
     * day, saturated to [-12 h, 12 h]. Meeus, p. 185.
     */
    public static double equationOfTime(double moment) {
        double c = julianCenturies(moment);
        double lambda = poly(c, 280.46645, 36000.76983, 0.0003032);
        double anomaly = poly(c, 357.52910, 35999.05030, -0.0001559, -0.00000048);
        double eccentricity = poly(c, 0.016708617, -0.000042037, -0.0000001236);
        double y = Math.pow(tan(obliquity(moment) / 2.0), 2);
        double equation = (1.0 / (2.0 * Math.PI))
                * (y * sin(2 * lambda)
                        - 2 * eccentricity * sin(anomaly)
                        + 4 * eccentricity * y * sin(anomaly) * cos(2 * lambda)
                        - 0.5 * y * y * sin(4 * lambda)
                        - 1.25 * eccentricity * eccentricity * sin(2 * anomaly));
        return Math.signum(equation) * Math.min(Math.abs(equation), hours(12));
    }

    /** Longitudinal nutation in degrees. */
    public static double nutation(double moment) {
        double c = julianCenturies(moment);
        double a = poly(c, 124.90, -1934.134, 0.002063);
        double b = poly(c, 201.11, 72001.5377, 0.00057);
        return -0.004778 * sin(a) - 0.0003667 * sin(b);
    }

    /** Aberration in degrees. */
    public static double aberration(double moment) {
        double c = julianCenturies(moment);
        return 0.0000974 * cos(177.63 + 35999.01848 * c) - 0.005575;
    }

    /**
     * General precession in longitude since J2000, in degrees [0, 360).
     * Meeus, pp. 136-137.
     */
    public static double precession(double moment) {
        double c = julianCenturies(moment);
        double eta = mod(
                poly(c, 0, angle(0, 0, 47.0029), angle(0, 0, -0.03302), angle(0, 0, 0.000060)),
                360.0);
        double bigP = mod(poly(c, 174.876384, angle(0, 0, -869.8089), angle(0, 0, 0.03536)), 360.0);
        double p = mod(
                poly(c, 0, angle(0, 0, 5029.0966), angle(0, 0, 1.11113), angle(0, 0, 0.000006)),
                360.0);
        double arg = arctan(cos(eta) * sin(bigP), cos(bigP));
        return mod(p + bigP - arg, 360.0);
    }

    /**
     * Mean sidereal time as an hour angle in degrees, [0, 360). Meeus, p. 88.
     * Uses the universal moment directly, without ΔT.
     */
    public static double siderealFromMoment(double moment) {
        double c = (moment - J2000) / 36525.0;
        return mod(poly(c, 280.46061837, 36525 * 360.98564736629, 0.000387933, -1.0 / 38710000), 360.0);
    }

    /** Sidereal longitude of the sun in the default ({@link SiderealFrame#LAHIRI}) frame. */
    public static double siderealSolarLongitude(double moment) {
        return siderealSolarLongitude(moment, SiderealFrame.LAHIRI);
    }

    /** Sidereal longitude of the sun in degrees [0, 360), measured in {@code frame}. */
    public static double siderealSolarLongitude(double moment, SiderealFrame frame) {
        return mod(
                solarLongitude(moment) - precession(moment) - nutation(moment) + frame.startAngle(),
                360.0);
    }

    /**
     * Declination in degrees [-90, 90] of an object at ecliptic latitude
     * {@code beta} and longitude {@code lambda}.
     */
    public static double declination(double moment, double beta, double lambda) {
        double epsilon = obliquity(moment);
        return arcsin(sin(beta) * cos(epsilon) + cos(beta) * sin(epsilon) * sin(lambda));
    }

    /**
     * Right ascension in degrees [0, 360) of an object at ecliptic latitude
     * {@code beta} and longitude {@code lambda}.
     */
    public static double rightAscension(double moment, double beta, double lambda) {
        double epsilon = obliquity(moment);
        return arctan(sin(lambda) * cos(epsilon) - tan(beta) * sin(epsilon), cos(lambda));
    }
}
