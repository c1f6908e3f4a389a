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

import io.rasterscan.core.model.CounterVector;
import io.rasterscan.core.model.Palette;
import io.rasterscan.core.model.PixelGrid;

import java.util.List;

/// A swappable strategy that distributes the per-row pipeline over threads.
///
/// Every implementation must leave the grid and produce counts identical to
/// running {@link RowPipeline#processRow} on each row in turn on one thread. Only
/// the set of operations that may run concurrently differs between strategies.
public interface RowDispatcher {

    /// Searches, bleeds and transforms every pixel of the grid in place.
    ///
    /// When this returns every worker has finished and the returned partial
    /// counters are no longer written by any thread.
    ///
    /// @param grid the grid to transform
    /// @param palette the search set
    /// @param rowOrder the order rows are handed out in, a permutation of `0..lines-1`
    /// @return the partial counters produced by the workers, each sized to the palette
    /// @throws PipelineException if any worker fails
    List<CounterVector> dispatch(PixelGrid grid, Palette palette, int[] rowOrder);

    /// @return the strategy this dispatcher implements
    DispatchStrategy strategy();

    /// @return the number of worker threads used
    int threads();
}
