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

package io.rasterscan.core.exec;

import io.rasterscan.core.model.AtomicCounterVector;
import io.rasterscan.core.model.CounterVector;
import io.rasterscan.core.model.Palette;
import io.rasterscan.core.model.PixelGrid;
import io.rasterscan.core.search.MatchCounter;
import io.rasterscan.core.transform.BleedFilter;
import io.rasterscan.core.transform.ColorTransform;

/// The complete per-row unit of work.
///
/// For each pixel, strictly left to right:
///
/// ```
/// search original -> bleed -> greyscale + XOR -> search final
/// ```
///
/// Rows never read each other, so any number of rows may run this concurrently
/// as long as each row is owned by one thread.
public final class RowPipeline {

    /// Receives the channels of a pixel at a search point.
    @FunctionalInterface
    public interface PixelSearch {
        /// @param red the red channel
        /// @param green the green channel
        /// @param blue the blue channel
        void search(int red, int green, int blue);
    }

    private RowPipeline() {
    }

    /// Processes one row with matches counted into a private counter.
    /// @param row the interleaved row storage, mutated in place
    /// @param palette the search set
    /// @param counter the caller's private counter
    public static void processRow(int[] row, Palette palette, CounterVector counter) {
        if (palette.size() == 0) {
            processRow(row, (r, g, b) -> { });
        } else {
            processRow(row, (r, g, b) -> MatchCounter.count(palette, r, g, b, counter));
        }
    }

    /// Processes one row with matches counted atomically into a shared counter.
    /// @param row the interleaved row storage, mutated in place
    /// @param palette the search set
    /// @param counter the shared counter
    public static void processRow(int[] row, Palette palette, AtomicCounterVector counter) {
        processRow(row, (r, g, b) -> MatchCounter.count(palette, r, g, b, counter));
    }

    /// Processes one row, handing both search points of every pixel to `search`.
    /// @param row the interleaved row storage, mutated in place
    /// @param search the search callback
    public static void processRow(int[] row, PixelSearch search) {
        int pixels = row.length / PixelGrid.CHANNELS;
        for (int p = 0, base = 0; p < pixels; p++, base += PixelGrid.CHANNELS) {
            search.search(row[base], row[base + 1], row[base + 2]);
            transformPixel(row, p);
            search.search(row[base], row[base + 1], row[base + 2]);
        }
    }

    /// Bleeds then color transforms a single pixel. Every pixel to the left of `p`
    /// in the same row must already have been transformed.
    /// @param row the interleaved row storage
    /// @param p the pixel index
    public static void transformPixel(int[] row, int p) {
        BleedFilter.apply(row, p);
        ColorTransform.apply(row, p);
    }

    /// @param lines number of rows
    /// @return the row order `0, 1, ..., lines - 1`
    public static int[] identityOrder(int lines) {
        int[] order = new int[lines];
        for (int i = 0; i < lines; i++) {
            order[i] = i;
        }
        return order;
    }
}
