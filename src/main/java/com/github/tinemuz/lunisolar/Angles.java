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

/**
 * Degree-based trigonometry and the small numeric helpers shared by the
 * solar and lunar models.
 *
 * <p>All angles are in degrees. Inverse functions clamp their argument to
 * [-1, 1] so that rounding just outside the domain never yields NaN.</p>
 */
final class Angles {
    private static final double SECONDS_PER_DAY = 86_400.0;

    private Angles() {}

    static double sin(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    static double cos(double degrees) {
        return Math.cos(Math.toRadians(degrees));
    }

    static double tan(double degrees) {
        return Math.tan(Math.toRadians(degrees));
    }

    /** Arcsine in degrees, signed in [-90, 90]. */
    static double arcsin(double x) {
        return Math.toDegrees(Math.asin(clampUnit(x)));
    }

    /** Arccosine in degrees, in [0, 180]. */
    static double arccos(double x) {
        return Math.toDegrees(Math.acos(clampUnit(x)));
    }

    /**
     * Angle in degrees of the point (x, y), normalized to [0, 360).
     * The quadrant follows the signs of both arguments.
     */
    static double arctan(double y, double x) {
        return mod(Math.toDegrees(Math.atan2(y, x)), 360.0);
    }

    /**
     * Floor modulus: the result has the sign of the divisor. Used to bring
     * longitudes and phases into [0, 360) and times of day into [0, 1).
     */
    static double mod(double dividend, double divisor) {
        double r = dividend - divisor * Math.floor(dividend / divisor);
        // Rounding of the quotient can leave r a hair outside the range, or on the divisor itself
        if (divisor > 0 ? r < 0 : r > 0) r += divisor;
        return r == divisor ? 0.0 : r;
    }

    /** Shift x into the half-open range [low, high). */
    static double mod3(double x, double low, double high) {
        if (low == high) return x;
        double r = low + mod(x - low, high - low);
        return r == high ? low : r;
    }

    /** Evaluate a polynomial with coefficients in ascending order (Horner). */
    static double poly(double x, double... coefficients) {
        double result = 0.0;
        for (int i = coefficients.length - 1; i >= 0; i--) {
            result = result * x + coefficients[i];
        }
        return result;
    }

    /** Degrees from sexagesimal degrees, arc minutes and arc seconds. */
    static double angle(double degrees, double arcMinutes, double arcSeconds) {
        return degrees + (arcMinutes + arcSeconds / 60.0) / 60.0;
    }

    /** Hours as a fraction of a day. */
    static double hours(double hours) {
        return hours / 24.0;
    }

    /** Seconds as a fraction of a day. */
    static double seconds(double seconds) {
        return seconds / SECONDS_PER_DAY;
    }

    private static double clampUnit(double x) {
        return Math.max(-1.0, Math.min(1.0, x));
    }
}
