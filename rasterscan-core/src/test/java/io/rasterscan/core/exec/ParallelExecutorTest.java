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
import io.rasterscan.core.model.Pixel;
import io.rasterscan.core.model.PixelGrid;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParallelExecutorTest {

    private static final Palette PALETTE = Palette.of(new Pixel(10, 10, 10));

    private static PixelGrid sampleGrid() {
        return PixelGrid.of(new Pixel[]{
            new Pixel(10, 10, 10), new Pixel(200, 50, 0), new Pixel(10, 10, 10), new Pixel(1, 2, 3)
        }, 2);
    }

    @Test
    void successfulRunEndsDone() {
        ParallelExecutor executor = ParallelExecutor.of(DispatchStrategy.ROWS, DispatchConfig.withThreads(2));
        assertThat(executor.state()).isEqualTo(RunState.INIT);

        PipelineResult result = executor.run(sampleGrid(), PALETTE);

        assertThat(executor.state()).isEqualTo(RunState.DONE);
        assertThat(result.threads()).isEqualTo(2);
        assertThat(result.partials()).isEqualTo(2);
        assertThat(result.elapsed()).isGreaterThanOrEqualTo(Duration.ZERO);
    }

    @Test
    void dispatcherSeesRowDispatchAndMergeFollows() {
        List<RunState> observed = new ArrayList<>();
        ParallelExecutor[] holder = new ParallelExecutor[1];
        RowDispatcher recording = new RowDispatcher() {
            @Override
            public List<CounterVector> dispatch(PixelGrid grid, Palette palette, int[] rowOrder) {
                observed.add(holder[0].state());
                return List.of(CounterVector.of(3), CounterVector.of(4));
            }

            @Override
            public DispatchStrategy strategy() {
                return DispatchStrategy.ROWS;
            }

            @Override
            public int threads() {
                return 2;
            }
        };
        holder[0] = new ParallelExecutor(recording);

        PipelineResult result = holder[0].run(sampleGrid(), PALETTE);

        assertThat(observed).containsExactly(RunState.ROW_DISPATCH);
        assertThat(result.counters()).isEqualTo(CounterVector.of(7));
    }

    @Test
    void workerFailureMovesToFailed() {
        RowDispatcher failing = new RowDispatcher() {
            @Override
            public List<CounterVector> dispatch(PixelGrid grid, Palette palette, int[] rowOrder) {
                return WorkerTeam.run("failing", 3, worker -> () -> {
                    if (worker == 1) {
                        throw new OutOfMemoryError("partial counter");
                    }
                    return new CounterVector(palette.size());
                });
            }

            @Override
            public DispatchStrategy strategy() {
                return DispatchStrategy.ROWS;
            }

            @Override
            public int threads() {
                return 3;
            }
        };
        ParallelExecutor executor = new ParallelExecutor(failing);

        assertThatThrownBy(() -> executor.run(sampleGrid(), PALETTE))
            .isInstanceOf(PipelineException.class)
            .hasCauseInstanceOf(OutOfMemoryError.class);
        assertThat(executor.state()).isEqualTo(RunState.FAILED);
    }

    @Test
    void mismatchedPartialsFailDuringMerge() {
        RowDispatcher wrongSize = new RowDispatcher() {
            @Override
            public List<CounterVector> dispatch(PixelGrid grid, Palette palette, int[] rowOrder) {
                return List.of(new CounterVector(palette.size() + 1));
            }

            @Override
            public DispatchStrategy strategy() {
                return DispatchStrategy.SEQUENTIAL;
            }

            @Override
            public int threads() {
                return 1;
            }
        };
        ParallelExecutor executor = new ParallelExecutor(wrongSize);

        assertThatThrownBy(() -> executor.run(sampleGrid(), PALETTE))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(executor.state()).isEqualTo(RunState.FAILED);
    }

    @Test
    void executorCanBeReused() {
        ParallelExecutor executor = ParallelExecutor.of(DispatchStrategy.TASKS, DispatchConfig.withThreads(2));
        CounterVector first = executor.run(sampleGrid(), PALETTE).counters();
        CounterVector second = executor.run(sampleGrid(), PALETTE).counters();
        assertThat(second).isEqualTo(first);
        assertThat(executor.state()).isEqualTo(RunState.DONE);
    }

    @Test
    void rowOrderMustBeAPermutation() {
        ParallelExecutor executor = ParallelExecutor.of(DispatchStrategy.ROWS, DispatchConfig.withThreads(2));
        executor.run(sampleGrid(), PALETTE);
        assertThat(executor.state()).isEqualTo(RunState.DONE);

        assertThatThrownBy(() -> executor.run(sampleGrid(), PALETTE, new int[]{0}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(executor.state()).isEqualTo(RunState.FAILED);
        assertThatThrownBy(() -> executor.run(sampleGrid(), PALETTE, new int[]{1, 1}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> executor.run(sampleGrid(), PALETTE, new int[]{0, 2}))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(executor.state()).isEqualTo(RunState.FAILED);
    }

    @Test
    void invalidConfigurationIsRejected() {
        assertThatThrownBy(() -> DispatchConfig.withThreads(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DispatchConfig.withThreads(2).withSchedule(ChunkSchedule.DYNAMIC, -1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DispatchConfig.withThreads(2).withTileSize(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ParallelExecutor(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void workerTeamReturnsOneResultPerWorker() {
        List<Integer> results = WorkerTeam.run("ids", 5, worker -> () -> worker);
        assertThat(results).containsExactlyInAnyOrder(0, 1, 2, 3, 4);
    }

    @Test
    void workerTeamWrapsTheFirstFailure() {
        assertThatThrownBy(() -> WorkerTeam.run("boom", 4, worker -> () -> {
            if (worker == 2) {
                throw new IllegalStateException("worker 2");
            }
            return worker;
        }))
            .isInstanceOf(PipelineException.class)
            .hasRootCauseInstanceOf(IllegalStateException.class)
            .hasMessageContaining("boom worker failed");
    }

    @Test
    void workerTeamStopsTheOtherWorkersBeforeThrowing() {
        AtomicInteger running = new AtomicInteger();
        assertThatThrownBy(() -> WorkerTeam.run("cancel", 3, worker -> () -> {
            if (worker == 0) {
                Thread.sleep(50);
                throw new IllegalStateException("worker 0");
            }
            running.incrementAndGet();
            try {
                while (true) {
                    WorkerTeam.checkCancelled("cancel");
                    Thread.onSpinWait();
                }
            } finally {
                running.decrementAndGet();
            }
        }))
            .isInstanceOf(PipelineException.class)
            .hasRootCauseInstanceOf(IllegalStateException.class);
        assertThat(running).hasValue(0);
    }
}
