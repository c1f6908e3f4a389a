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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;

/**
 * One self-contained task per row on a {@link ForkJoinPool}.
 *
 * <p>Each task allocates its own counter, processes its row left to right, then merges
 * the counter into the run's master under the master's lock. The dispatching thread waits
 * for every task before returning the master, so the merge is complete when the run
 * enters its merge phase. Tasks may execute in any order. When a task fails, the queued
 * tasks are cancelled and the dispatcher waits for the running ones before it throws.
 */
public final class TaskPerRowDispatcher implements RowDispatcher {

    private static final Logger logger = LogManager.getLogger(TaskPerRowDispatcher.class);

    private final DispatchConfig config;

    /**
     * @param config thread count; the chunk schedule is not used by this strategy
     */
    public TaskPerRowDispatcher(DispatchConfig config) {
        this.config = config;
    }

    @Override
    public List<CounterVector> dispatch(PixelGrid grid, Palette palette, int[] rowOrder) {
        CounterVector master = new CounterVector(palette.size());
        ForkJoinPool pool = new ForkJoinPool(config.threads());
        List<ForkJoinTask<?>> tasks = new ArrayList<>(rowOrder.length);
        try {
            for (int line : rowOrder) {
                tasks.add(pool.submit(() -> {
                    CounterVector local = new CounterVector(palette.size());
                    RowPipeline.processRow(grid.row(line), palette, local);
                    ReductionMerge.accumulate(master, local);
                }));
            }
            logger.debug("Enqueued {} row tasks on {} workers", tasks.size(), config.threads());

            // drain: every task must finish before the master is read
            for (ForkJoinTask<?> task : tasks) {
                task.get();
            }
        } catch (ExecutionException e) {
            WorkerTeam.cancel(pool, "tasks");
            throw new PipelineException("row task failed: " + e.getCause(), e.getCause());
        } catch (InterruptedException e) {
            WorkerTeam.cancel(pool, "tasks");
            Thread.currentThread().interrupt();
            throw new PipelineException("Interrupted while waiting for row tasks", e);
        } finally {
            pool.shutdown();
        }
        return List.of(master);
    }

    @Override
    public DispatchStrategy strategy() {
        return DispatchStrategy.TASKS;
    }

    @Override
    public int threads() {
        return config.threads();
    }
}
