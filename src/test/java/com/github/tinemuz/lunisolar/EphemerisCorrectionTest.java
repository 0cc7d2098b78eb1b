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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class EphemerisCorrectionTest {

    @Nested
    @DisplayName("Delta T")
    class DeltaTTests {

        @ParameterizedTest(name = "year {0}")
        @CsvSource({
            "-1000, 0.294301851851852",
            "0, 0.122495370370370",
            "1000, 0.0182199074074074",
            "1620, 0.00110391408592593",
            "1750, 0.000148997988912037",
            "1850, 8.46125409483985e-5",
            "1950, 0.000333060352490062",
            "1990, 0.000658502789351852",
            "2020, 0.000828692129629630",
            "2100, 0.00234652777777778",
            "3000, 0.0513388888888889"
        })
        @DisplayName("Matches the published polynomial for each range")
        void deltaTByYear(int year, double expectedDays) {
            double moment = fixed(year, 6, 1);
            assertEquals(expectedDays, EphemerisCorrection.deltaT(moment), Math.abs(expectedDays) * 1e-9 + 1e-12);
        }

        @Test
        @DisplayName("Depends only on the civil year")
        void constantWithinYear() {
            assertEquals(
                    EphemerisCorrection.deltaT(fixed(2020, 1, 1)),
                    EphemerisCorrection.deltaT(fixed(2020, 12, 31) + 0.99),
                    0.0);
        }

        @Test
        @DisplayName("Far outside the tabulated range the long-term parabola still gives a value")
        void fallbackRange() {
            double dt = EphemerisCorrection.deltaT(fixed(-3000, 1, 1));
            assertFinite(dt, "deltaT(-3000)");
            assertTrue(dt > 0.5, "ΔT in -3000 is over half a day");
            // Second call logs nothing new but still returns the same value
            assertEquals(dt, EphemerisCorrection.deltaT(fixed(-3000, 1, 1)), 0.0);
        }
    }

    @Nested
    @DisplayName("Dynamical time")
    class DynamicalTests {

        @Test
        @DisplayName("J2000 is noon on 2000-01-01")
        void j2000() {
            assertEquals(730120.5, EphemerisCorrection.J2000, 0.0);
        }

        @Test
        @DisplayName("Julian centuries at J2000 is ΔT over a century")
        void julianCenturiesAtJ2000() {
            assertEquals(2.0236e-8, EphemerisCorrection.julianCenturies(EphemerisCorrection.J2000), 1e-11);
        }

        @Test
        @DisplayName("Dynamical time is universal time plus ΔT")
        void dynamicalFromUniversal() {
            double t = fixed(2024, 3, 20) + 0.25;
            assertEquals(t + EphemerisCorrection.deltaT(t), EphemerisCorrection.dynamicalFromUniversal(t), 1e-12);
            assertEquals(t, EphemerisCorrection.universalFromDynamical(
                    EphemerisCorrection.dynamicalFromUniversal(t)), 1e-9);
        }
    }

    private static double fixed(int year, int month, int day) {
        return ProlepticGregorianCalendar.INSTANCE.fixedFromDate(year, month, day);
    }

    private static void assertFinite(double value, String message) {
        assertFalse(Double.isNaN(value), message + " is NaN");
        assertFalse(Double.isInfinite(value), message + " is infinite");
    }
}
