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

class VisibilityCriterionTest {

    private static final Location MECCA = Location.of(21.4225, 39.8262, 298, 3);
    private static final Location CAIRO = Location.of(30.0444, 31.2357, 23, 2);

    @Nested
    @DisplayName("Arc of light")
    class ArcOfLightTests {

        @Test
        @DisplayName("Sun-moon elongation two days after new moon")
        void arcOfLight() {
            assertEquals(21.1961341576112, VisibilityCriterion.arcOfLight(738898), 1e-6);
        }

        @Test
        @DisplayName("Always within [0, 180]")
        void range() {
            for (double t = 738800; t < 739200; t += 1.7) {
                double arc = VisibilityCriterion.arcOfLight(t);
                assertTrue(arc >= 0 && arc <= 180, "arc of light at " + t);
            }
        }
    }

    @Nested
    @DisplayName("Crescent visibility")
    class CrescentTests {

        @Test
        @DisplayName("Best viewing time in Mecca on the evening of March 11, 2024")
        void simpleBestView() {
            assertEquals(738956.655974721, VisibilityCriterion.simpleBestView(738956, MECCA), 1e-4);
        }

        @Test
        @DisplayName("Crescent is first seen in Mecca on the eve of March 12, 2024")
        void visibleCrescent() {
            assertTrue(VisibilityCriterion.visibleCrescent(738957, MECCA));
            assertFalse(VisibilityCriterion.visibleCrescent(738956, MECCA));
            assertEquals(
                    VisibilityCriterion.shaukatCriterion(738957, MECCA),
                    VisibilityCriterion.visibleCrescent(738957, MECCA));
        }
    }

    @Nested
    @DisplayName("Phasis")
    class PhasisTests {

        @Test
        @DisplayName("Phasis either side of March 15, 2024 in Mecca")
        void mecca() {
            assertEquals(Occurrence.of(738957), VisibilityCriterion.phasisOnOrBefore(738960, MECCA));
            assertEquals(Occurrence.of(738986), VisibilityCriterion.phasisOnOrAfter(738960, MECCA));
        }

        @Test
        @DisplayName("Phasis after April 1, 2024 in Cairo")
        void cairo() {
            assertEquals(Occurrence.of(738986), VisibilityCriterion.phasisOnOrAfter(738977, CAIRO));
        }

        @Test
        @DisplayName("Phasis brackets the date")
        void bracketsDate() {
            for (long date = 738900; date < 739100; date += 17) {
                long before = VisibilityCriterion.phasisOnOrBefore(date, MECCA).fixedDate();
                long after = VisibilityCriterion.phasisOnOrAfter(date, MECCA).fixedDate();
                assertTrue(before <= date && date <= after, "phasis around " + date);
                assertTrue(after - before <= 31, "one month between phases around " + date);
            }
        }

        @Test
        @DisplayName("Phasis is the first visible evening of its month")
        void firstVisibleEvening() {
            for (long phasis : new long[] {738928, 738986, 739045}) {
                assertEquals(Occurrence.of(phasis), VisibilityCriterion.phasisOnOrAfter(phasis, MECCA));
                assertTrue(VisibilityCriterion.visibleCrescent(phasis, MECCA));
                assertFalse(VisibilityCriterion.visibleCrescent(phasis - 1, MECCA));
            }
        }
    }
}
