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

import java.util.Collections;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Summation of empirical trigonometric series.
 *
 * <p>Every position model in this library is a sum over a table of terms,
 * each term a coefficient times the sine or cosine of a linear combination of
 * phase angles. The term function receives one row at a time; the row
 * array is a scratch buffer reused between terms and must not be retained.</p>
 */
public final class SeriesEvaluator {

    private SeriesEvaluator() {}

    /** Σ term(row) over all rows of {@code table}. */
    public static double sum(SeriesTable table, ToDoubleFunction<double[]> term) {
        double[] row = new double[table.width()];
        double total = 0.0;
        for (int i = 0; i < table.size(); i++) {
            table.copyRow(i, row);
            total += term.applyAsDouble(row);
        }
        return total;
    }

    /**
     * Σ term(row) where row i is made of the i-th element of each column.
     * Goes through {@link SeriesTable#ofColumns} and the table summation.
     *
     * @throws IllegalArgumentException if no columns are given or their lengths differ
     */
    static double sum(ToDoubleFunction<double[]> term, double[]... columns) {
        List<String> names = Collections.nCopies(columns.length, "term");
        return sum(SeriesTable.ofColumns("columns", names, columns), term);
    }

    static int commonLength(double[]... columns) {
        if (columns.length == 0) {
            throw new IllegalArgumentException("At least one column is required");
        }
        int length = columns[0].length;
        for (int j = 1; j < columns.length; j++) {
            if (columns[j].length != length) {
                throw new IllegalArgumentException(
                        "Column " + j + " has " + columns[j].length
                                + " entries, expected " + length);
            }
        }
        return length;
    }
}
