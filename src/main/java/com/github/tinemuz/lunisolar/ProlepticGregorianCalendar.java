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

import java.time.LocalDate;

/**
 * {@link CivilCalendar} backed by {@link LocalDate}, which already uses the
 * proleptic Gregorian calendar with astronomical year numbering (year 0 is
 * 1 BCE).
 */
public final class ProlepticGregorianCalendar implements CivilCalendar {
    public static final ProlepticGregorianCalendar INSTANCE = new ProlepticGregorianCalendar();

    // Fixed day number of 1970-01-01, the LocalDate epoch day 0
    private static final long UNIX_EPOCH_FIXED = 719_163L;

    private ProlepticGregorianCalendar() {}

    @Override
    public long fixedFromDate(int year, int month, int day) {
        return LocalDate.of(year, month, day).toEpochDay() + UNIX_EPOCH_FIXED;
    }

    @Override
    public int yearFromFixed(long fixedDate) {
        return toLocalDate(fixedDate).getYear();
    }

    /** Civil date of a fixed day count. */
    public LocalDate toLocalDate(long fixedDate) {
        return LocalDate.ofEpochDay(fixedDate - UNIX_EPOCH_FIXED);
    }

    /** Fixed day count of a civil date. */
    public long fixedFromLocalDate(LocalDate date) {
        return date.toEpochDay() + UNIX_EPOCH_FIXED;
    }
}
