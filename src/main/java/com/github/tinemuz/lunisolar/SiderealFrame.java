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
 * Origin of a sidereal zodiac, expressed as the angle added to tropical
 * longitudes once precession and nutation are removed.
 */
public final class SiderealFrame {

    /**
     * Frame in which the sidereal and tropical zodiacs were 23°15' apart on
     * 1956-03-21 (Lahiri).
     */
    public static final SiderealFrame LAHIRI =
            fromReferenceMoment(
                    ProlepticGregorianCalendar.INSTANCE.fixedFromDate(1956, 3, 21),
                    Angles.angle(23, 15, 0));

    private final double startAngle;

    private SiderealFrame(double startAngle) {
        this.startAngle = startAngle;
    }

    /**
     * Frame whose origin lagged the tropical origin by {@code offset} degrees
     * at {@code reference}.
     */
    public static SiderealFrame fromReferenceMoment(double reference, double offset) {
        return new SiderealFrame(
                SolarModel.precession(reference) + SolarModel.nutation(reference) - offset);
    }

    /** Offset in degrees added to precession-free longitudes. */
    public double startAngle() {
        return startAngle;
    }

    @Override
    public String toString() {
        return String.format(Locale.ENGLISH, "SiderealFrame[%.9f]", startAngle);
    }
}
