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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of the series tables used by the solar and lunar models.
 *
 * <p>Tables are read from the classpath resource {@code lunisolar-series.txt}
 * on first use. The file is a sequence of blocks:</p>
 *
 * <pre>
 * # comment
 * series lunar-latitude sine elongation solar-anomaly lunar-anomaly node
 *   5128122  0  0  0  1
 *   ...
 * end
 * </pre>
 *
 * <p>Call {@link #preload()} once at startup to surface a missing or broken
 * resource early.</p>
 */
public final class SeriesTables {
    private static final Logger log = LoggerFactory.getLogger(SeriesTables.class);

    static final String RESOURCE = "lunisolar-series.txt";

    public static final String SOLAR_LONGITUDE = "solar-longitude";
    public static final String LUNAR_LONGITUDE = "lunar-longitude";
    public static final String LUNAR_LATITUDE = "lunar-latitude";
    public static final String LUNAR_DISTANCE = "lunar-distance";
    public static final String NEW_MOON = "new-moon";
    public static final String NEW_MOON_PLANETARY = "new-moon-planetary";

    private static final List<String> REQUIRED =
            List.of(SOLAR_LONGITUDE, LUNAR_LONGITUDE, LUNAR_LATITUDE, LUNAR_DISTANCE,
                    NEW_MOON, NEW_MOON_PLANETARY);

    private static volatile boolean loaded = false;
    private static Map<String, SeriesTable> tables;

    private SeriesTables() {}

    /**
     * The table registered under {@code name}.
     *
     * @throws IllegalStateException if the resource cannot be loaded
     * @throws IllegalArgumentException if no table has that name
     */
    public static SeriesTable get(String name) {
        ensureLoaded();
        SeriesTable table = tables.get(name);
        if (table == null) {
            throw new IllegalArgumentException("Unknown series table: " + name);
        }
        return table;
    }

    /** Load the tables now rather than on first use. */
    public static void preload() {
        ensureLoaded();
        log.debug("Loaded {} series tables from {}", tables.size(), RESOURCE);
    }

    private static void ensureLoaded() {
        if (loaded) return;
        synchronized (SeriesTables.class) {
            if (loaded) return;
            tables = loadFromResource();
            loaded = true;
        }
    }

    private static Map<String, SeriesTable> loadFromResource() {
        InputStream in = SeriesTables.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (in == null) {
            log.error("Series file '{}' not found on classpath", RESOURCE);
            throw new IllegalStateException("Series file '" + RESOURCE + "' not found on classpath");
        }
        Map<String, SeriesTable> parsed;
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            parsed = parse(reader);
        } catch (IOException e) {
            log.error("Failed to read series file", e);
            throw new IllegalStateException("Failed to read series file " + RESOURCE, e);
        } catch (RuntimeException e) {
            log.error("Failed to parse series file", e);
            throw new IllegalStateException("Failed to parse series file " + RESOURCE, e);
        }
        for (String name : REQUIRED) {
            if (!parsed.containsKey(name)) {
                log.error("Series file '{}' has no '{}' block", RESOURCE, name);
                throw new IllegalStateException("Series file " + RESOURCE + " lacks block " + name);
            }
        }
        return parsed;
    }

    /**
     * Parse series blocks from {@code source}. Blank lines and lines starting
     * with {@code #} are skipped.
     *
     * @throws IllegalArgumentException on a malformed block or row
     */
    static Map<String, SeriesTable> parse(Reader source) throws IOException {
        Map<String, SeriesTable> result = new LinkedHashMap<>();
        BufferedReader br = new BufferedReader(source);
        String name = null;
        List<String> columns = null;
        List<double[]> rows = null;
        int lineNo = 0;
        String line;
        while ((line = br.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] toks = line.split("\\s+");
            if (toks[0].equals("series")) {
                if (name != null) {
                    throw new IllegalArgumentException(
                            "Line " + lineNo + ": series '" + name + "' is not closed");
                }
                if (toks.length < 3) {
                    throw new IllegalArgumentException(
                            "Line " + lineNo + ": series header needs a name and columns");
                }
                name = toks[1];
                columns = Arrays.asList(toks).subList(2, toks.length);
                rows = new ArrayList<>();
            } else if (toks[0].equals("end")) {
                if (name == null) {
                    throw new IllegalArgumentException("Line " + lineNo + ": 'end' outside a series");
                }
                if (result.put(name, SeriesTable.ofRows(name, columns, rows)) != null) {
                    throw new IllegalArgumentException(
                            "Line " + lineNo + ": duplicate series '" + name + "'");
                }
                name = null;
            } else {
                if (name == null) {
                    throw new IllegalArgumentException("Line " + lineNo + ": data outside a series");
                }
                if (toks.length != columns.size()) {
                    throw new IllegalArgumentException(
                            "Line " + lineNo + ": series '" + name + "' row has " + toks.length
                                    + " values, expected " + columns.size());
                }
                double[] row = new double[toks.length];
                for (int i = 0; i < toks.length; i++) {
                    try {
                        row[i] = Double.parseDouble(toks[i]);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException(
                                "Line " + lineNo + ": not a number '" + toks[i] + "'", e);
                    }
                }
                rows.add(row);
            }
        }
        if (name != null) {
            throw new IllegalArgumentException("Series '" + name + "' is not closed at end of input");
        }
        return Collections.unmodifiableMap(result);
    }
}
