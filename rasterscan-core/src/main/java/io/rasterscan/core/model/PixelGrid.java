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

package io.rasterscan.core.model;

import java.util.Arrays;

/// The two dimensional pixel buffer for one image.
///
/// Each row is stored as an interleaved `int[]` of `linesize * 3` values
/// (`r0, g0, b0, r1, g1, b1, ...`). All rows have the same length, so a grid
/// built from a pixel count that does not divide evenly by the line size gets
/// a zero-padded trailing row.
///
/// ```
///  line 0: [r g b][r g b][r g b] ... linesize pixels
///  line 1: [r g b][r g b][r g b] ...
///  ...
///  line L: [r g b][r g b][0 0 0] ... zero padded
/// ```
///
/// The grid has no behavior beyond accessors. Rows are handed out by reference
/// so that a row worker can mutate its row in place without copying.
public final class PixelGrid {

    /// Number of int channels stored per pixel.
    public static final int CHANNELS = 3;

    private final int lines;
    private final int linesize;
    private final int[][] rows;

    private PixelGrid(int lines, int linesize) {
        this.lines = lines;
        this.linesize = linesize;
        this.rows = new int[lines][linesize * CHANNELS];
    }

    /// Allocates a zero-filled grid able to hold `pixelCount` pixels split into
    /// lines of `linesize`.
    ///
    /// @param pixelCount the number of real pixels the grid must hold
    /// @param linesize the requested line size, or 0 to put every pixel on one line
    /// @return a zero-filled grid
    /// @throws IllegalArgumentException if either argument is negative
    public static PixelGrid allocate(long pixelCount, int linesize) {
        if (pixelCount < 0) {
            throw new IllegalArgumentException("Pixel count must not be negative: " + pixelCount);
        }
        if (linesize < 0) {
            throw new IllegalArgumentException("Line size must not be negative: " + linesize);
        }
        if (linesize == 0) {
            return new PixelGrid(1, checkedInt(pixelCount));
        }
        long lines = (pixelCount + linesize - 1) / linesize;
        return new PixelGrid(checkedInt(lines), linesize);
    }

    /// Builds a grid from a flat pixel sequence.
    /// @param pixels the pixels in row-major order
    /// @param linesize the line size, or 0 for a single line
    /// @return a grid holding the pixels, zero padded at the end
    public static PixelGrid of(Pixel[] pixels, int linesize) {
        PixelGrid grid = allocate(pixels.length, linesize);
        for (int i = 0; i < pixels.length; i++) {
            grid.set(i / grid.linesize, i % grid.linesize, pixels[i]);
        }
        return grid;
    }

    private static int checkedInt(long value) {
        if (value > Integer.MAX_VALUE / CHANNELS) {
            throw new IllegalArgumentException("Grid dimension too large: " + value);
        }
        return (int) value;
    }

    /// @return the number of rows
    public int lines() {
        return lines;
    }

    /// @return the number of pixels per row
    public int linesize() {
        return linesize;
    }

    /// @return the total pixel count including padding
    public long length() {
        return (long) lines * linesize;
    }

    /// Returns the live interleaved storage of one row.
    /// @param line the row index
    /// @return the row storage, not a copy
    public int[] row(int line) {
        return rows[line];
    }

    /// @param line the row index
    /// @param p the pixel index within the row
    /// @return the current value of the pixel
    public Pixel pixel(int line, int p) {
        return Pixel.of(rows[line], p);
    }

    /// Overwrites one pixel.
    /// @param line the row index
    /// @param p the pixel index within the row
    /// @param pixel the new value
    public void set(int line, int p, Pixel pixel) {
        int[] row = rows[line];
        int base = p * CHANNELS;
        row[base] = pixel.red();
        row[base + 1] = pixel.green();
        row[base + 2] = pixel.blue();
    }

    /// @return a deep copy of this grid
    public PixelGrid copy() {
        PixelGrid copy = new PixelGrid(lines, linesize);
        for (int l = 0; l < lines; l++) {
            System.arraycopy(rows[l], 0, copy.rows[l], 0, rows[l].length);
        }
        return copy;
    }

    /// @param other the grid to compare with
    /// @return true if both grids have the same shape and identical channel values
    public boolean contentEquals(PixelGrid other) {
        if (other == null || other.lines != lines || other.linesize != linesize) {
            return false;
        }
        for (int l = 0; l < lines; l++) {
            if (!Arrays.equals(rows[l], other.rows[l])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "PixelGrid{lines=" + lines + ", linesize=" + linesize + "}";
    }
}
