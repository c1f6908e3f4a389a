/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


package io.rasterscan.io;

import io.rasterscan.core.model.CounterVector;
import io.rasterscan.core.model.Palette;
import io.rasterscan.core.model.Pixel;

import java.io.PrintStream;

/// Formats per-palette-entry match counts.
///
/// ```
/// Search Results:
/// ** ( 10, 10, 10) = 2
/// ```
public final class SearchReport {

    /// Heading printed before the per-entry lines.
    public static final String HEADER = "Search Results:";

    private SearchReport() {
    }

    /// Prints the report, one line per palette entry in palette order.
    /// @param out destination stream
    /// @param palette the searched colors
    /// @param counters the merged counts for the palette
    public static void print(PrintStream out, Palette palette, CounterVector counters) {
        out.print(format(palette, counters));
        out.flush();
    }

    /// @param palette the searched colors
    /// @param counters the merged counts for the palette
    /// @return the full report with a trailing newline per line
    /// @throws IllegalArgumentException if the counters do not match the palette size
    public static String format(Palette palette, CounterVector counters) {
        if (palette.size() != counters.size()) {
            throw new IllegalArgumentException(
                "Counter size mismatch. Expected: " + palette.size() + ", Got: " + counters.size());
        }
        StringBuilder sb = new StringBuilder(HEADER).append(System.lineSeparator());
        for (int i = 0; i < palette.size(); i++) {
            sb.append(formatLine(palette.get(i), counters.get(i))).append(System.lineSeparator());
        }
        return sb.toString();
    }

    /// @param color a palette entry
    /// @param count the number of matches for it
    /// @return one report line
    public static String formatLine(Pixel color, long count) {
        StringBuilder sb = new StringBuilder("** ");
        PixelGridPrinter.appendRgb(sb, color.red(), color.green(), color.blue());
        return sb.append(" = ").append(count).toString();
    }
}
