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

/**
 * Observer position on the Earth's surface together with the offset of its
 * standard time zone.
 *
 * <p>Latitude and longitude are geographic degrees (north and east positive),
 * elevation is meters above sea level and the zone is stored as a fraction of
 * a day so it can be added to moments directly.</p>
 */
public final class Location {
    private static final double MAX_ZONE_HOURS = 14.0;

    /** Latitude in degrees, north positive, in [-90, 90]. */
    public final double latitude;

    /** Longitude in degrees, east positive, in (-180, 180]. */
    public final double longitude;

    /** Elevation above sea level in meters, never negative. */
    public final double elevation;

    /** Standard time zone offset from universal time, in days. */
    public final double zone;

    private Location(double latitude, double longitude, double elevation, double zone) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.elevation = elevation;
        this.zone = zone;
    }

    /**
     * Create a location.
     *
     * @param latitudeDeg     latitude in degrees, [-90, 90]
     * @param longitudeDeg    longitude in degrees, (-180, 180]
     * @param elevationMeters elevation in meters, zero or more
     * @param zoneHours       standard time offset from UT in hours, [-14, 14]
     * @return the location
     * @throws IllegalArgumentException if any value is out of range or not finite
     */
    public static Location of(
            double latitudeDeg, double longitudeDeg, double elevationMeters, double zoneHours) {
        if (!(latitudeDeg >= -90.0 && latitudeDeg <= 90.0)) {
            throw new IllegalArgumentException("Latitude out of range [-90, 90]: " + latitudeDeg);
        }
        if (!(longitudeDeg > -180.0 && longitudeDeg <= 180.0)) {
            throw new IllegalArgumentException(
                    "Longitude out of range (-180, 180]: " + longitudeDeg);
        }
        if (!(elevationMeters >= 0.0) || Double.isInfinite(elevationMeters)) {
            throw new IllegalArgumentException("Elevation must be finite and >= 0: " + elevationMeters);
        }
        if (!(Math.abs(zoneHours) <= MAX_ZONE_HOURS)) {
            throw new IllegalArgumentException("Zone offset out of range [-14, 14] h: " + zoneHours);
        }
        return new Location(latitudeDeg, longitudeDeg, elevationMeters, zoneHours / 24.0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Location)) return false;
        Location other = (Location) o;
        return Double.compare(latitude, other.latitude) == 0
                && Double.compare(longitude, other.longitude) == 0
                && Double.compare(elevation, other.elevation) == 0
                && Double.compare(zone, other.zone) == 0;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(latitude);
        result = 31 * result + Double.hashCode(longitude);
        result = 31 * result + Double.hashCode(elevation);
        return 31 * result + Double.hashCode(zone);
    }

    @Override
    public String toString() {
        return String.format(
                Locale.ENGLISH,
                "Location[%.6f, %.6f, %.1f m, UT%+.2f h]",
                latitude,
                longitude,
                elevation,
                zone * 24.0);
    }
}
