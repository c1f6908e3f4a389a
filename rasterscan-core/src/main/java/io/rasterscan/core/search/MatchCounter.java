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

package io.rasterscan.core.search;

import io.rasterscan.core.model.AtomicCounterVector;
import io.rasterscan.core.model.CounterVector;
import io.rasterscan.core.model.Palette;

/// Exact RGB match counting against a palette.
///
/// Every palette index whose triple equals the probed triple is incremented, so
/// duplicate palette entries each get the match. The scan is `O(paletteSize)` per
/// call and can be restricted to an index tile `[from, to)` so several workers can
/// share one pixel's search.
public final class MatchCounter {

    private MatchCounter() {
    }

    /// Counts matches over the whole palette.
    /// @param palette the search set
    /// @param red the probed red channel
    /// @param green the probed green channel
    /// @param blue the probed blue channel
    /// @param counter the private counter to increment
    /// @return the number of matches found
    public static int count(Palette palette, int red, int green, int blue, CounterVector counter) {
        return count(palette, red, green, blue, counter, 0, palette.size());
    }

    /// Counts matches over one tile of palette indices.
    /// @param palette the search set
    /// @param red the probed red channel
    /// @param green the probed green channel
    /// @param blue the probed blue channel
    /// @param counter the private counter to increment
    /// @param from first index, inclusive
    /// @param to last index, exclusive
    /// @return the number of matches found
    public static int count(Palette palette, int red, int green, int blue, CounterVector counter, int from, int to) {
        int matches = 0;
        for (int i = from; i < to; i++) {
            if (palette.matches(i, red, green, blue)) {
                counter.increment(i);
                matches++;
            }
        }
        return matches;
    }

    /// Counts matches with one atomic increment per match on a shared counter.
    /// @param palette the search set
    /// @param red the probed red channel
    /// @param green the probed green channel
    /// @param blue the probed blue channel
    /// @param counter the shared counter
    /// @return the number of matches found
    public static int count(Palette palette, int red, int green, int blue, AtomicCounterVector counter) {
        int matches = 0;
        for (int i = 0, size = palette.size(); i < size; i++) {
            if (palette.matches(i, red, green, blue)) {
                counter.increment(i);
                matches++;
            }
        }
        return matches;
    }
}
