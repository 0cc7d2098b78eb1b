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

/**
 * Shifts between the time scales used by the event searches.
 *
 * <ul>
 *   <li>universal: mean solar time at Greenwich</li>
 *   <li>local: mean solar time at the observer's meridian</li>
 *   <li>standard: civil clock time of the observer's zone</li>
 *   <li>apparent: sundial time, local time corrected by the equation of time</li>
 * </ul>
 *
 * All moments are in days; every conversion is a closed-form shift.
 */
public final class TimeConversion {

    private TimeConversion() {}

    /** Difference between local mean time and UT at longitude {@code longitude}, in days. */
    public static double zoneFromLongitude(double longitude) {
        return longitude / 360.0;
    }

    public static double universalFromLocal(double localMoment, Location location) {
        return localMoment - zoneFromLongitude(location.longitude);
    }

    public static double localFromUniversal(double universalMoment, Location location) {
        return universalMoment + zoneFromLongitude(location.longitude);
    }

    public static double standardFromUniversal(double universalMoment, Location location) {
        return universalMoment + location.zone;
    }

    public static double universalFromStandard(double standardMoment, Location location) {
        return standardMoment - location.zone;
    }

    public static double standardFromLocal(double localMoment, Location location) {
        return standardFromUniversal(universalFromLocal(localMoment, location), location);
    }

    public static double localFromStandard(double standardMoment, Location location) {
        return localFromUniversal(universalFromStandard(standardMoment, location), location);
    }

    /** Local mean time of sundial moment {@code apparentMoment}. */
    public static double localFromApparent(double apparentMoment, Location location) {
        return apparentMoment
                - SolarModel.equationOfTime(universalFromLocal(apparentMoment, location));
    }

    /** Sundial time of local mean moment {@code localMoment}. */
    public static double apparentFromLocal(double localMoment, Location location) {
        return localMoment + SolarModel.equationOfTime(universalFromLocal(localMoment, location));
    }

    public static double universalFromApparent(double apparentMoment, Location location) {
        return universalFromLocal(localFromApparent(apparentMoment, location), location);
    }

    /** Universal time of true (sundial) midnight starting fixed date {@code date}. */
    public static double midnight(long date, Location location) {
        return universalFromApparent(date, location);
    }

    /** Universal time of true (sundial) noon on fixed date {@code date}. */
    public static double midday(long date, Location location) {
        return universalFromApparent(date + hours(12), location);
    }
}
