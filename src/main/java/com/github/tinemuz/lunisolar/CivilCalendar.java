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
 * Conversion between civil dates and fixed day counts.
 *
 * <p>Fixed day 1 is the first day of year 1 of the proleptic Gregorian
 * calendar. The astronomy only needs the year of a fixed date and the
 * number of days between two civil dates; everything else about calendars is
 * the caller's business.</p>
 */
public interface CivilCalendar {

    /** Fixed day count of the given civil date. */
    long fixedFromDate(int year, int month, int day);

    /** Civil year containing the fixed date. */
    int yearFromFixed(long fixedDate);

    /** Number of days from the first civil date to the second. */
    default long dateDifference(int fromYear, int fromMonth, int fromDay, int toYear, int toMonth, int toDay) {
        return fixedFromDate(toYear, toMonth, toDay) - fixedFromDate(fromYear, fromMonth, fromDay);
    }
}
