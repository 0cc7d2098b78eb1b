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

import static com.github.tinemuz.lunisolar.Angles.arcsin;
import static com.github.tinemuz.lunisolar.Angles.cos;
import static com.github.tinemuz.lunisolar.Angles.mod;
import static com.github.tinemuz.lunisolar.Angles.mod3;
import static com.github.tinemuz.lunisolar.Angles.poly;
import static com.github.tinemuz.lunisolar.Angles.sin;
import static com.github.tinemuz.lunisolar.EphemerisCorrection.julianCenturies;

/**
 * Position of the moon, adapted from Meeus, "Astronomical Algorithms",
 * 2nd edn., chapter 47.
 *
 * <p>The mean elements take Julian centuries; everything else takes a
 * universal-time moment. Periodic terms involving the sun's anomaly are
 * damped by the eccentricity factor E raised to |M multiplier|.</p>
 */
public final class LunarModel {

    /** Mean Earth-moon distance of the distance series, in meters. */
    static final double MEAN_DISTANCE_M = 385_000_560.0;

    private static final double EARTH_EQUATORIAL_RADIUS_M = 6_378_140.0;

    private LunarModel() {}

    /** Mean longitude of the moon, degrees [0, 360). */
    public static double meanLunarLongitude(double c) {
        return mod(poly(c, 218.3164477, 481267.88123421, -0.0015786, 1.0 / 538841, -1.0 / 65194000), 360.0);
    }

    /** Mean elongation of the moon from the sun, degrees [0, 360). */
    public static double lunarElongation(double c) {
        return mod(poly(c, 297.8501921, 445267.1114034, -0.0018819, 1.0 / 545868, -1.0 / 113065000), 360.0);
    }

    /** Mean anomaly of the sun, degrees [0, 360). */
    public static double solarAnomaly(double c) {
        return mod(poly(c, 357.5291092, 35999.0502909, -0.0001536, 1.0 / 24490000), 360.0);
    }

    /** Mean anomaly of the moon, degrees [0, 360). */
    public static double lunarAnomaly(double c) {
        return mod(poly(c, 134.9633964, 477198.8675055, 0.0087414, 1.0 / 69699, -1.0 / 14712000), 360.0);
    }

    /** Moon's argument of latitude (distance from the ascending node), degrees [0, 360). */
    public static double moonNode(double c) {
        return mod(poly(c, 93.2720950, 483202.0175233, -0.0036539, -1.0 / 3526000, 1.0 / 863310000), 360.0);
    }

    /** Geocentric ecliptic longitude of the moon, degrees [0, 360). */
    public static double lunarLongitude(double moment) {
        double c = julianCenturies(moment);
        double meanLongitude = meanLunarLongitude(c);
        MeanElements el = MeanElements.at(c);
        double correction = 1e-6 * SeriesEvaluator.sum(
                SeriesTables.get(SeriesTables.LUNAR_LONGITUDE),
                term -> el.damped(term) * sin(el.argument(term)));
        double venus = 3958e-6 * sin(119.75 + c * 131.849);
        double jupiter = 318e-6 * sin(53.09 + c * 479264.29);
        double flatEarth = 1962e-6 * sin(meanLongitude - el.node);
        return mod(
                meanLongitude + correction + venus + jupiter + flatEarth + SolarModel.nutation(moment),
                360.0);
    }

    /** Geocentric ecliptic latitude of the moon, signed degrees. */
    public static double lunarLatitude(double moment) {
        double c = julianCenturies(moment);
        double meanLongitude = meanLunarLongitude(c);
        MeanElements el = MeanElements.at(c);
        double beta = 1e-6 * SeriesEvaluator.sum(
                SeriesTables.get(SeriesTables.LUNAR_LATITUDE),
                term -> el.damped(term) * sin(el.argument(term)));
        double venus = 175e-6
                * (sin(119.75 + c * 131.849 + el.node) + sin(119.75 + c * 131.849 - el.node));
        double flatEarth = -2235e-6 * sin(meanLongitude)
                + 127e-6 * sin(meanLongitude - el.lunarAnomaly)
                - 115e-6 * sin(meanLongitude + el.lunarAnomaly);
        double extra = 382e-6 * sin(313.45 + c * 481266.484);
        return beta + venus + flatEarth + extra;
    }

    /** Distance between the centers of the Earth and the moon, in meters. */
    public static double lunarDistance(double moment) {
        double c = julianCenturies(moment);
        MeanElements el = MeanElements.at(c);
        double correction = SeriesEvaluator.sum(
                SeriesTables.get(SeriesTables.LUNAR_DISTANCE),
                term -> el.damped(term) * cos(el.argument(term)));
        return MEAN_DISTANCE_M + correction;
    }

    /**
     * Geocentric altitude of the moon above the horizon at {@code location},
     * signed degrees, ignoring parallax and refraction.
     */
    public static double lunarAltitude(double moment, Location location) {
        double lambda = lunarLongitude(moment);
        double beta = lunarLatitude(moment);
        double alpha = SolarModel.rightAscension(moment, beta, lambda);
        double delta = SolarModel.declination(moment, beta, lambda);
        double theta0 = SolarModel.siderealFromMoment(moment);
        double hourAngle = mod(theta0 + location.longitude - alpha, 360.0);
        double altitude = arcsin(
                sin(location.latitude) * sin(delta)
                        + cos(location.latitude) * cos(delta) * cos(hourAngle));
        return mod3(altitude, -180.0, 180.0);
    }

    /** Parallax of the moon at {@code location}, degrees. */
    public static double lunarParallax(double moment, Location location) {
        double geocentric = lunarAltitude(moment, location);
        double ratio = EARTH_EQUATORIAL_RADIUS_M / lunarDistance(moment);
        return arcsin(ratio * cos(geocentric));
    }

    /**
     * Altitude of the moon as seen from the surface at {@code location},
     * signed degrees, ignoring refraction.
     */
    public static double topocentricLunarAltitude(double moment, Location location) {
        return lunarAltitude(moment, location) - lunarParallax(moment, location);
    }

    // Fundamental arguments shared by the three periodic series.
    // Series columns: coefficient, elongation, solar anomaly, lunar anomaly, node
    private static final class MeanElements {
        final double elongation;
        final double solarAnomaly;
        final double lunarAnomaly;
        final double node;
        final double eccentricity;

        private MeanElements(double c) {
            this.elongation = lunarElongation(c);
            this.solarAnomaly = solarAnomaly(c);
            this.lunarAnomaly = lunarAnomaly(c);
            this.node = moonNode(c);
            this.eccentricity = poly(c, 1, -0.002516, -0.0000074);
        }

        static MeanElements at(double c) {
            return new MeanElements(c);
        }

        double argument(double[] term) {
            return term[1] * elongation + term[2] * solarAnomaly + term[3] * lunarAnomaly + term[4] * node;
        }

        double damped(double[] term) {
            return term[0] * Math.pow(eccentricity, Math.abs(term[2]));
        }
    }
}
