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

import com.github.tinemuz.lunisolar.Occurrence.Status;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RiseSetEngineTest {

    private static final double SUN_TOLERANCE = 1e-4; // days, under 9 seconds
    private static final double MOON_TOLERANCE = 2e-3; // days, under 3 minutes
    private static final double HORIZON_TOLERANCE = 0.1; // degrees of lunar altitude

    private static final Location EQUATOR = Location.of(0, 0, 0, 0);
    private static final Location PARIS = Location.of(48.8566, 2.3522, 35, 1);
    private static final Location TROMSO = Location.of(69.6492, 18.9553, 0, 1);
    private static final Location ALERT = Location.of(82.5, -62.3, 0, -4);
    private static final Location SYDNEY = Location.of(-33.8688, 151.2093, 0, 10);
    private static final Location NEW_YORK = Location.of(40.7128, -74.006, 10, -5);
    private static final Location HELSINKI = Location.of(60.1699, 24.9384, 0, 2);
    private static final Location NORTH_POLE = Location.of(90, 0, 0, 0);

    private static final long MARCH_EQUINOX_2024 = 738965L;
    private static final long JUNE_SOLSTICE_2024 = 739058L;
    private static final long DECEMBER_SOLSTICE_2024 = 739241L;

    @Nested
    @DisplayName("Sunrise and sunset")
    class SunTests {

        @Test
        @DisplayName("Equator at the March equinox")
        void equator() {
            assertEquals(738965.252800013, valueOf(RiseSetEngine.sunrise(MARCH_EQUINOX_2024, EQUATOR)), SUN_TOLERANCE);
            assertEquals(738965.757325595, valueOf(RiseSetEngine.sunset(MARCH_EQUINOX_2024, EQUATOR)), SUN_TOLERANCE);
        }

        @Test
        @DisplayName("Equinox sunrise and sunset at the equator straddle true noon evenly")
        void equatorSymmetry() {
            double noon = TimeConversion.standardFromUniversal(
                    TimeConversion.midday(MARCH_EQUINOX_2024, EQUATOR), EQUATOR);
            double morning = noon - valueOf(RiseSetEngine.sunrise(MARCH_EQUINOX_2024, EQUATOR));
            double afternoon = valueOf(RiseSetEngine.sunset(MARCH_EQUINOX_2024, EQUATOR)) - noon;
            assertEquals(morning, afternoon, 5.0 / 1440);
            assertEquals(0.25, morning, 0.01);
        }

        @Test
        @DisplayName("Paris at the June solstice")
        void paris() {
            assertEquals(739058.198144411, valueOf(RiseSetEngine.sunrise(JUNE_SOLSTICE_2024, PARIS)), SUN_TOLERANCE);
            assertEquals(739058.874779629, valueOf(RiseSetEngine.sunset(JUNE_SOLSTICE_2024, PARIS)), SUN_TOLERANCE);
        }

        @Test
        @DisplayName("Elevation brings sunrise earlier")
        void elevation() {
            Location sea = Location.of(48.8566, 2.3522, 0, 1);
            double atSea = valueOf(RiseSetEngine.sunrise(JUNE_SOLSTICE_2024, sea));
            assertEquals(739058.1993386211, atSea, SUN_TOLERANCE);
            assertTrue(valueOf(RiseSetEngine.sunrise(JUNE_SOLSTICE_2024, PARIS)) < atSea);
        }

        @Test
        @DisplayName("Sydney at the December solstice")
        void sydney() {
            assertEquals(739241.1950603938, valueOf(RiseSetEngine.sunrise(DECEMBER_SOLSTICE_2024, SYDNEY)), SUN_TOLERANCE);
            assertEquals(739241.7956055892, valueOf(RiseSetEngine.sunset(DECEMBER_SOLSTICE_2024, SYDNEY)), SUN_TOLERANCE);
        }

        @Test
        @DisplayName("Tromsø has a sunrise at the equinox but none at either solstice")
        void tromso() {
            assertEquals(738965.237285182, valueOf(RiseSetEngine.sunrise(MARCH_EQUINOX_2024, TROMSO)), SUN_TOLERANCE);
            assertEquals(738965.752413599, valueOf(RiseSetEngine.sunset(MARCH_EQUINOX_2024, TROMSO)), SUN_TOLERANCE);
            assertEquals(Status.NO_OCCURRENCE, RiseSetEngine.sunrise(JUNE_SOLSTICE_2024, TROMSO).status());
            assertEquals(Status.NO_OCCURRENCE, RiseSetEngine.sunset(JUNE_SOLSTICE_2024, TROMSO).status());
            assertEquals(Status.NO_OCCURRENCE, RiseSetEngine.sunrise(DECEMBER_SOLSTICE_2024, TROMSO).status());
            assertEquals(Status.NO_OCCURRENCE, RiseSetEngine.sunset(DECEMBER_SOLSTICE_2024, TROMSO).status());
        }

        @Test
        @DisplayName("Polar day and polar night at Alert")
        void alert() {
            assertFalse(RiseSetEngine.sunrise(JUNE_SOLSTICE_2024, ALERT).isPresent());
            assertFalse(RiseSetEngine.sunset(DECEMBER_SOLSTICE_2024, ALERT).isPresent());
            assertFalse(RiseSetEngine.dawn(DECEMBER_SOLSTICE_2024, ALERT, 6).isPresent());
        }

        @Test
        @DisplayName("Sunrise precedes sunset and both fall on the requested day")
        void ordering() {
            for (long date = 738886; date < 739252; date += 11) {
                double rise = valueOf(RiseSetEngine.sunrise(date, PARIS));
                double set = valueOf(RiseSetEngine.sunset(date, PARIS));
                assertTrue(date <= rise && rise < set && set < date + 1, "day " + date);
            }
        }
    }

    @Nested
    @DisplayName("Twilight")
    class TwilightTests {

        @Test
        @DisplayName("No astronomical twilight in Paris at midsummer")
        void noAstronomicalDawn() {
            assertEquals(Status.NO_OCCURRENCE, RiseSetEngine.dawn(JUNE_SOLSTICE_2024, PARIS, 18).status());
        }

        @Test
        @DisplayName("Civil dusk in Paris at midsummer")
        void civilDusk() {
            double dusk = valueOf(RiseSetEngine.dusk(JUNE_SOLSTICE_2024, PARIS, 6));
            assertEquals(739058.903211125, dusk, SUN_TOLERANCE);
            assertTrue(dusk > valueOf(RiseSetEngine.sunset(JUNE_SOLSTICE_2024, PARIS)));
        }

        @Test
        @DisplayName("Sine offset leaves [-1, 1] when the depression is never reached")
        void sineOffset() {
            double local = TimeConversion.localFromStandard(JUNE_SOLSTICE_2024 + 0.25, PARIS);
            assertTrue(Math.abs(RiseSetEngine.sineOffset(local, PARIS, 18)) > 1);
            assertTrue(Math.abs(RiseSetEngine.sineOffset(local, PARIS, 0.8)) <= 1);
        }

        @Test
        @DisplayName("Refraction includes the dip of the horizon")
        void refraction() {
            assertEquals(0.566666666666667, RiseSetEngine.refraction(EQUATOR), 1e-12);
            assertEquals(0.787793836187859, RiseSetEngine.refraction(PARIS), 1e-9);
        }
    }

    @Nested
    @DisplayName("Temporal hours")
    class TemporalHourTests {

        @Test
        @DisplayName("Daytime and nighttime hours in Paris at midsummer")
        void parisHours() {
            assertEquals(0.0563862681641088, valueOf(RiseSetEngine.daytimeTemporalHour(JUNE_SOLSTICE_2024, PARIS)), 1e-5);
            assertEquals(0.0269616445584688, valueOf(RiseSetEngine.nighttimeTemporalHour(JUNE_SOLSTICE_2024, PARIS)), 1e-5);
        }

        @Test
        @DisplayName("Sundial noon, early morning and late evening")
        void standardFromSundial() {
            assertEquals(739058.536462020, valueOf(RiseSetEngine.standardFromSundial(739058.5, PARIS)), SUN_TOLERANCE);
            assertEquals(739058.101094043, valueOf(RiseSetEngine.standardFromSundial(739058.1, PARIS)), SUN_TOLERANCE);
            assertEquals(739058.971841549, valueOf(RiseSetEngine.standardFromSundial(739058.9, PARIS)), SUN_TOLERANCE);
        }

        @Test
        @DisplayName("Sundial 6:00 and 18:00 are sunrise and sunset")
        void sundialEndpoints() {
            assertEquals(
                    valueOf(RiseSetEngine.sunrise(JUNE_SOLSTICE_2024, PARIS)),
                    valueOf(RiseSetEngine.standardFromSundial(JUNE_SOLSTICE_2024 + 0.25, PARIS)),
                    1e-9);
            assertEquals(
                    valueOf(RiseSetEngine.sunset(JUNE_SOLSTICE_2024, PARIS)),
                    valueOf(RiseSetEngine.standardFromSundial(JUNE_SOLSTICE_2024 + 0.75, PARIS)),
                    1e-9);
        }

        @Test
        @DisplayName("No temporal hours without a sunrise")
        void polarDay() {
            assertFalse(RiseSetEngine.daytimeTemporalHour(JUNE_SOLSTICE_2024, TROMSO).isPresent());
            assertFalse(RiseSetEngine.standardFromSundial(JUNE_SOLSTICE_2024 + 0.5, TROMSO).isPresent());
        }
    }

    @Nested
    @DisplayName("Moonrise and moonset")
    class MoonTests {

        @Test
        @DisplayName("Paris on January 25, 2024, the night of the full moon")
        void paris() {
            assertEquals(738910.709183428, valueOf(RiseSetEngine.moonrise(738910, PARIS)), MOON_TOLERANCE);
            assertEquals(738910.373245928, valueOf(RiseSetEngine.moonset(738910, PARIS)), MOON_TOLERANCE);
            // Still waxing at the start of the day, so the moon sets in the morning and rises in the evening
            assertTrue(EventFinder.lunarPhase(TimeConversion.universalFromStandard(738910, PARIS)) < 180);
            assertTrue(valueOf(RiseSetEngine.moonset(738910, PARIS)) < valueOf(RiseSetEngine.moonrise(738910, PARIS)));
        }

        @Test
        @DisplayName("New York on January 25, 2024")
        void newYork() {
            assertEquals(738910.705028239, valueOf(RiseSetEngine.moonrise(738910, NEW_YORK)), MOON_TOLERANCE);
            assertEquals(738910.315868082, valueOf(RiseSetEngine.moonset(738910, NEW_YORK)), MOON_TOLERANCE);
        }

        @Test
        @DisplayName("The moon skips a rise on January 3, 2024 in Paris")
        void skippedMoonrise() {
            assertEquals(738887.9939613598, valueOf(RiseSetEngine.moonrise(738887, PARIS)), MOON_TOLERANCE);
            assertEquals(Status.NO_OCCURRENCE, RiseSetEngine.moonrise(738888, PARIS).status());
            assertEquals(738888.5128709335, valueOf(RiseSetEngine.moonset(738888, PARIS)), MOON_TOLERANCE);
            assertEquals(738889.0404582196, valueOf(RiseSetEngine.moonrise(738889, PARIS)), MOON_TOLERANCE);
        }

        @Test
        @DisplayName("The moon skips a set on January 16, 2024 in Paris")
        void skippedMoonset() {
            assertEquals(738900.9466526833, valueOf(RiseSetEngine.moonset(738900, PARIS)), MOON_TOLERANCE);
            assertEquals(Status.NO_OCCURRENCE, RiseSetEngine.moonset(738901, PARIS).status());
            assertEquals(738902.003389123, valueOf(RiseSetEngine.moonset(738902, PARIS)), MOON_TOLERANCE);
        }

        @Test
        @DisplayName("Every moonrise and moonset of 2024 in Paris is on the horizon and on its day")
        void parisYear() {
            assertYearOnHorizon(PARIS);
        }

        @Test
        @DisplayName("Every moonrise and moonset of 2024 in Helsinki is on the horizon and on its day")
        void helsinkiYear() {
            assertYearOnHorizon(HELSINKI);
        }

        @Test
        @DisplayName("Days where the first bracket misses the crossing")
        void bracketMissesCrossing() {
            assertEquals(739059.9228515625, valueOf(RiseSetEngine.moonrise(739059, PARIS)), MOON_TOLERANCE);
            assertEquals(739208.4847005209, valueOf(RiseSetEngine.moonset(739208, PARIS)), MOON_TOLERANCE);
        }

        @Test
        @DisplayName("At the North Pole the moon rises about once a sidereal month")
        void northPole() {
            int rises = 0;
            for (long date = 738886; date < 738946; date++) {
                Occurrence rise = RiseSetEngine.moonrise(date, NORTH_POLE);
                if (rise.isPresent()) {
                    rises++;
                    assertEquals(0.0, RiseSetEngine.observedLunarAltitude(rise.value(), NORTH_POLE), HORIZON_TOLERANCE);
                }
            }
            assertEquals(2, rises);
            assertEquals(738901.4527994792, valueOf(RiseSetEngine.moonrise(738901, NORTH_POLE)), MOON_TOLERANCE);
        }

        @Test
        @DisplayName("Observed altitude adds refraction and semi-diameter to the topocentric altitude")
        void observedAltitude() {
            assertEquals(5.94530048084972, RiseSetEngine.observedLunarAltitude(738910.3, PARIS), 1e-7);
        }
    }

    private static void assertYearOnHorizon(Location location) {
        int rises = 0;
        int sets = 0;
        for (long date = 738886; date < 738886 + 366; date++) {
            Occurrence rise = RiseSetEngine.moonrise(date, location);
            Occurrence set = RiseSetEngine.moonset(date, location);
            if (rise.isPresent()) {
                rises++;
                assertOnHorizon(rise.value(), date, location, "moonrise");
            }
            if (set.isPresent()) {
                sets++;
                assertOnHorizon(set.value(), date, location, "moonset");
            }
        }
        // About one day in thirty has no rise, and likewise no set
        assertTrue(rises >= 350, "moonrises in 2024: " + rises);
        assertTrue(sets >= 350, "moonsets in 2024: " + sets);
    }

    private static void assertOnHorizon(double standard, long date, Location location, String event) {
        assertTrue(standard >= date && standard < date + 1, event + " on " + date + " falls on its day");
        double ut = TimeConversion.universalFromStandard(standard, location);
        assertEquals(0.0, RiseSetEngine.observedLunarAltitude(ut, location), HORIZON_TOLERANCE,
                event + " on " + date);
    }

    private static double valueOf(Occurrence occurrence) {
        assertTrue(occurrence.isPresent(), "expected an occurrence but got " + occurrence);
        return occurrence.value();
    }
}
