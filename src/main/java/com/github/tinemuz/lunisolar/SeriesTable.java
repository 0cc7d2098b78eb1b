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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable table of periodic-series terms: one row per term, one column per
 * coefficient or argument multiplier. Every row has the same width.
 */
public final class SeriesTable {
    private final String name;
    private final List<String> columns;
    private final double[][] rows;

    private SeriesTable(String name, List<String> columns, double[][] rows) {
        this.name = name;
        this.columns = columns;
        this.rows = rows;
    }

    /**
     * Build a table from rows.
     *
     * @throws IllegalArgumentException if there are no columns or a row's width
     *     differs from the number of columns
     */
    public static SeriesTable ofRows(String name, List<String> columns, List<double[]> rows) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Series '" + name + "' declares no columns");
        }
        double[][] copy = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            double[] row = rows.get(i);
            if (row.length != columns.size()) {
                throw new IllegalArgumentException(
                        "Series '" + name + "' row " + i + " has " + row.length
                                + " values, expected " + columns.size());
            }
            copy[i] = row.clone();
        }
        return new SeriesTable(
                name, Collections.unmodifiableList(new ArrayList<>(columns)), copy);
    }

    /**
     * Build a table from parallel columns, e.g. a coefficient array and its
     * multiplier arrays.
     *
     * @throws IllegalArgumentException if the columns have different lengths
     */
    static SeriesTable ofColumns(String name, List<String> columnNames, double[]... columns) {
        if (columnNames.size() != columns.length) {
            throw new IllegalArgumentException(
                    "Series '" + name + "' has " + columns.length + " columns but "
                            + columnNames.size() + " names");
        }
        int length = SeriesEvaluator.commonLength(columns);
        List<double[]> rows = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            double[] row = new double[columns.length];
            for (int j = 0; j < columns.length; j++) row[j] = columns[j][i];
            rows.add(row);
        }
        return ofRows(name, columnNames, rows);
    }

    public List<String> columns() {
        return columns;
    }

    /** Number of terms. */
    public int size() {
        return rows.length;
    }

    /** Number of values per term. */
    public int width() {
        return columns.size();
    }

    public double value(int row, int column) {
        return rows[row][column];
    }

    // Copies one row into a caller-owned buffer so the table stays immutable
    void copyRow(int row, double[] target) {
        System.arraycopy(rows[row], 0, target, 0, target.length);
    }

    @Override
    public String toString() {
        return "SeriesTable[" + name + ", " + rows.length + " x " + columns + "]";
    }
}
