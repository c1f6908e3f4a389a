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
import io.rasterscan.core.search.ReductionMerge;

import java.util.List;

/// Row-parallel dispatch where every match is an atomic increment on one shared
/// counter.
///
/// Contended. The verify matrix compares the private-counter strategies
/// against it to catch lost or doubled updates.
public final class AtomicRowDispatcher implements RowDispatcher {

    private final DispatchConfig config;

    /// @param config thread count and chunk schedule
    public AtomicRowDispatcher(DispatchConfig config) {
        this.config = config;
    }

    @Override
    public List<CounterVector> dispatch(PixelGrid grid, Palette palette, int[] rowOrder) {
        int workers = config.threads();
        AtomicCounterVector shared = new AtomicCounterVector(palette.size());
        ChunkSchedule.WorkClaimer claimer =
            config.schedule().newClaimer(rowOrder.length, workers, config.chunk());

        WorkerTeam.run("atomic", workers, worker -> () -> {
            ChunkSchedule.WorkRange range;
            while ((range = claimer.next(worker)) != null) {
                for (int i = range.start(); i < range.end(); i++) {
                    WorkerTeam.checkCancelled("atomic");
                    RowPipeline.processRow(grid.row(rowOrder[i]), palette, shared);
                }
            }
            return null;
        });
        return List.of(ReductionMerge.snapshot(shared));
    }

    @Override
    public DispatchStrategy strategy() {
        return DispatchStrategy.ATOMIC;
    }

    @Override
    public int threads() {
        return config.threads();
    }
}
