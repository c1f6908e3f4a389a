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

import io.rasterscan.core.model.PixelGrid;

import java.io.PrintStream;

/// Debug dump of a grid, one text line per row.
public final class PixelGridPrinter {

    private PixelGridPrinter() {
    }

    /// @param out destination stream
    /// @param grid the grid to print, padding included
    public static void print(PrintStream out, PixelGrid grid) {
        for (int line = 0; line < grid.lines(); line++) {
            out.println(formatRow(grid.row(line)));
        }
    }

    /// @param row an interleaved row
    /// @return `(RRR,GGG,BBB) ` for each pixel
    public static String formatRow(int[] row) {
        StringBuilder sb = new StringBuilder(row.length * 5);
        for (int i = 0; i + 2 < row.length; i += PixelGrid.CHANNELS) {
            appendRgb(sb, row[i], row[i + 1], row[i + 2]).append(' ');
        }
        return sb.toString();
    }

    /// Appends `(RRR,GGG,BBB)` with each channel padded by {@link #appendChannel}.
    static StringBuilder appendRgb(StringBuilder sb, int red, int green, int blue) {
        sb.append('(');
        appendChannel(sb, red).append(',');
        appendChannel(sb, green).append(',');
        return appendChannel(sb, blue).append(')');
    }

    /// Left pads a channel with one space below 100 and another below 10. Negative
    /// values always get both spaces, so `-5` prints as `  -5`.
    /// @param sb destination
    /// @param value the channel value
    /// @return `sb`
    static StringBuilder appendChannel(StringBuilder sb, int value) {
        if (value < 100) {
            sb.append(' ');
        }
        if (value < 10) {
            sb.append(' ');
        }
        return sb.append(value);
    }
}
