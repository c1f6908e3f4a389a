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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Row-parallel dispatch over a fixed team of workers.
 *
 * <pre>{@code
 * ┌───────────────────────────────────────────────────────────┐
 * │ rows claimed per ChunkSchedule (static, dynamic, guided)  │
 * │                                                           │
 * │  Worker 0         Worker 1         ...   Worker N-1       │
 * │  rows 0-7         rows 8-15              rows ...         │
 * │  search/bleed/    search/bleed/          search/bleed/    │
 * │  transform/search transform/search       transform/search │
 * │  private counter  private counter        private counter  │
 * └───────────────────────────────────────────────────────────┘
 *          ↓ join (single barrier)
 *     partial counters returned for merge
 * }</pre>
 *
 * <p>A worker owns each row it claims end to end, so the left-to-right bleed dependency is
 * honoured on that worker's thread. Counters are never shared during the hot path.
 */
public final class RowParallelDispatcher implements RowDispatcher {

    private static final Logger logger = LogManager.getLogger(RowParallelDispatcher.class);

    private final DispatchConfig config;

    /**
     * @param config thread count and chunk schedule
     */
    public RowParallelDispatcher(DispatchConfig config) {
        this.config = config;
    }

    @Override
    public List<CounterVector> dispatch(PixelGrid grid, Palette palette, int[] rowOrder) {
        int workers = config.threads();
        ChunkSchedule.WorkClaimer claimer =
            config.schedule().newClaimer(rowOrder.length, workers, config.chunk());
        logger.debug("Dispatching {} rows over {} workers ({} schedule, chunk {})",
            rowOrder.length, workers, config.schedule(), config.chunk());

        return WorkerTeam.run("rows", workers, worker -> () -> {
            CounterVector local = new CounterVector(palette.size());
            int rows = 0;
            ChunkSchedule.WorkRange range;
            while ((range = claimer.next(worker)) != null) {
                for (int i = range.start(); i < range.end(); i++) {
                    WorkerTeam.checkCancelled("rows");
                    RowPipeline.processRow(grid.row(rowOrder[i]), palette, local);
                }
                rows += range.size();
            }
            logger.trace("Worker {} processed {} rows", worker, rows);
            return local;
        });
    }

    @Override
    public DispatchStrategy strategy() {
        return DispatchStrategy.ROWS;
    }

    @Override
    public int threads() {
        return config.threads();
    }
}
