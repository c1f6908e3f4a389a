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
import io.rasterscan.core.search.ReductionMerge;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;

/**
 * Drives one pipeline run over a grid with an injected {@link RowDispatcher}.
 *
 * <h2>Run phases</h2>
 *
 * <pre>{@code
 * ┌──────────────────────────────────────────────────────────────┐
 * │ INIT          validate grid, palette and row order           │
 * └──────────────────────────────────────────────────────────────┘
 *          ↓
 * ┌──────────────────────────────────────────────────────────────┐
 * │ ROW_DISPATCH  per row: search original -> bleed ->           │
 * │               transform -> search final, on the dispatcher's │
 * │               workers, into private counters                 │
 * └──────────────────────────────────────────────────────────────┘
 *          ↓ all workers joined
 * ┌──────────────────────────────────────────────────────────────┐
 * │ MERGE         sum partial counters on this thread            │
 * └──────────────────────────────────────────────────────────────┘
 *          ↓
 *        DONE   (or FAILED from any phase)
 * }</pre>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * ParallelExecutor executor = ParallelExecutor.of(
 *     DispatchStrategy.ROWS,
 *     DispatchConfig.withThreads(8).withSchedule(ChunkSchedule.DYNAMIC, 4));
 * PipelineResult result = executor.run(grid, palette);
 * long hits = result.counters().get(0);
 * }</pre>
 *
 * <p>An executor may be reused for several runs one after another; it is not safe to run
 * it from two threads at once.
 */
public final class ParallelExecutor {

    private static final Logger logger = LogManager.getLogger(ParallelExecutor.class);

    private final RowDispatcher dispatcher;
    private volatile RunState state = RunState.INIT;

    /**
     * @param dispatcher the dispatch strategy to run rows with
     */
    public ParallelExecutor(RowDispatcher dispatcher) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("Dispatcher cannot be null");
        }
        this.dispatcher = dispatcher;
    }

    /**
     * @param strategy the dispatch strategy
     * @param config worker and chunking configuration
     * @return an executor for the strategy
     */
    public static ParallelExecutor of(DispatchStrategy strategy, DispatchConfig config) {
        return new ParallelExecutor(strategy.create(config));
    }

    /**
     * Runs the pipeline over every row in natural order.
     *
     * @param grid the grid to transform in place
     * @param palette the search set
     * @return the merged counters and run statistics
     * @throws PipelineException if a worker fails
     */
    public PipelineResult run(PixelGrid grid, Palette palette) {
        return run(grid, palette, RowPipeline.identityOrder(grid.lines()));
    }

    /**
     * Runs the pipeline handing rows to the dispatcher in the given order.
     *
     * @param grid the grid to transform in place
     * @param palette the search set
     * @param rowOrder a permutation of {@code 0..lines-1}
     * @return the merged counters and run statistics
     * @throws IllegalArgumentException if the row order is not a permutation of the grid's rows
     * @throws PipelineException if a worker fails
     */
    public PipelineResult run(PixelGrid grid, Palette palette, int[] rowOrder) {
        transition(RunState.INIT);
        long start = System.nanoTime();
        try {
            validateRowOrder(grid, rowOrder);
            transition(RunState.ROW_DISPATCH);
            logger.info("Processing {} rows of {} pixels against {} palette entries ({}, {} threads)",
                grid.lines(), grid.linesize(), palette.size(),
                dispatcher.strategy().name().toLowerCase(), dispatcher.threads());
            List<CounterVector> partials = dispatcher.dispatch(grid, palette, rowOrder);

            transition(RunState.MERGE);
            CounterVector merged = ReductionMerge.merge(partials, palette.size());

            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            transition(RunState.DONE);
            logger.info("Merged {} partial counters, {} matches in {} ms",
                partials.size(), merged.total(), elapsed.toMillis());
            return new PipelineResult(merged, dispatcher.strategy(), dispatcher.threads(),
                partials.size(), elapsed);
        } catch (RuntimeException | Error e) {
            RunState failedIn = state;
            transition(RunState.FAILED);
            logger.error("Pipeline run failed during {}: {}", failedIn, e.getMessage());
            throw e;
        }
    }

    /**
     * @return the state of the current or most recent run
     */
    public RunState state() {
        return state;
    }

    /**
     * @return the dispatcher this executor runs with
     */
    public RowDispatcher dispatcher() {
        return dispatcher;
    }

    private void transition(RunState next) {
        logger.debug("{} -> {}", state, next);
        state = next;
    }

    private static void validateRowOrder(PixelGrid grid, int[] rowOrder) {
        if (rowOrder.length != grid.lines()) {
            throw new IllegalArgumentException(
                "Row order has " + rowOrder.length + " entries for " + grid.lines() + " rows");
        }
        boolean[] seen = new boolean[grid.lines()];
        for (int line : rowOrder) {
            if (line < 0 || line >= seen.length || seen[line]) {
                throw new IllegalArgumentException("Row order is not a permutation of the grid's rows");
            }
            seen[line] = true;
        }
    }
}
