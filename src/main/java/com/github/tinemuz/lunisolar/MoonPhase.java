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

/** The four principal phases of the moon. */
public enum MoonPhase {
    NEW_MOON(0.0),
    FIRST_QUARTER(90.0),
    FULL_MOON(180.0),
    LAST_QUARTER(270.0);

    private final double phaseAngle;

    MoonPhase(double phaseAngle) {
        this.phaseAngle = phaseAngle;
    }

    /** Lunar phase angle (moon minus sun longitude), in degrees. */
    public double phaseAngle() {
        return phaseAngle;
    }

    /**
     * Principal phase nearest to {@code phaseAngle} degrees, e.g. for picking
     * the icon of a calendar day.
     */
    public static MoonPhase nearest(double phaseAngle) {
        int index = (int) Math.round(Angles.mod(phaseAngle, 360.0) / 90.0) % 4;
        return values()[index];
    }
}
