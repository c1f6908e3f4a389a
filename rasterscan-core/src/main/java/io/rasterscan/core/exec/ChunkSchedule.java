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

import java.util.concurrent.atomic.AtomicInteger;

/**
 * How a loop of {@code total} iterations is split into chunks and handed to workers.
 *
 * <table>
 *   <caption>Chunking policies</caption>
 *   <tr><th>Schedule</th><th>Claiming</th><th>Default chunk</th></tr>
 *   <tr><td>static</td><td>chunk {@code k} belongs to worker {@code k % workers}</td><td>{@code ceil(total / workers)}</td></tr>
 *   <tr><td>dynamic</td><td>next chunk from a shared cursor</td><td>1</td></tr>
 *   <tr><td>guided</td><td>{@code max(chunk, ceil(remaining / workers))} from a shared cursor</td><td>1</td></tr>
 *   <tr><td>auto</td><td>same as guided</td><td>1</td></tr>
 * </table>
 *
 * <p>Every iteration is handed out exactly once regardless of policy.
 */
public enum ChunkSchedule {
    STATIC,
    DYNAMIC,
    GUIDED,
    AUTO;

    /**
     * A range of iterations {@code [start, end)}.
     *
     * @param start first iteration, inclusive
     * @param end last iteration, exclusive
     */
    public record WorkRange(int start, int end) {
        public int size() {
            return end - start;
        }
    }

    /**
     * Hands out chunks of one loop. Implementations are safe for concurrent use by the
     * workers of one team, each calling with its own worker id.
     */
    public interface WorkClaimer {
        /**
         * @param worker the calling worker's id in {@code [0, workers)}
         * @return the next range for this worker, or null when the loop is exhausted
         */
        WorkRange next(int worker);
    }

    /**
     * Creates a claimer for one loop.
     *
     * @param total number of iterations
     * @param workers number of workers that will claim
     * @param chunk requested chunk size, or 0 for the policy default
     * @return a fresh claimer
     */
    public WorkClaimer newClaimer(int total, int workers, int chunk) {
        if (workers < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1: " + workers);
        }
        if (chunk < 0) {
            throw new IllegalArgumentException("Chunk size must not be negative: " + chunk);
        }
        switch (this) {
            case STATIC:
                return new StaticClaimer(total, workers, chunk > 0 ? chunk : Math.max(1, ceilDiv(total, workers)));
            case DYNAMIC:
                return new DynamicClaimer(total, chunk > 0 ? chunk : 1);
            case GUIDED:
            case AUTO:
            default:
                return new GuidedClaimer(total, workers, chunk > 0 ? chunk : 1);
        }
    }

    static int ceilDiv(int a, int b) {
        return (a + b - 1) / b;
    }

    private static final class StaticClaimer implements WorkClaimer {
        private final int total;
        private final int workers;
        private final int chunk;
        private final int[] nextChunk;

        StaticClaimer(int total, int workers, int chunk) {
            this.total = total;
            this.workers = workers;
            this.chunk = chunk;
            this.nextChunk = new int[workers];
            for (int w = 0; w < workers; w++) {
                nextChunk[w] = w;
            }
        }

        // each worker only touches its own slot
        @Override
        public WorkRange next(int worker) {
            long start = (long) nextChunk[worker] * chunk;
            if (start >= total) {
                return null;
            }
            nextChunk[worker] += workers;
            return new WorkRange((int) start, (int) Math.min(total, start + chunk));
        }
    }

    private static final class DynamicClaimer implements WorkClaimer {
        private final int total;
        private final int chunk;
        private final AtomicInteger cursor = new AtomicInteger();

        DynamicClaimer(int total, int chunk) {
            this.total = total;
            this.chunk = chunk;
        }

        @Override
        public WorkRange next(int worker) {
            int start = cursor.getAndAccumulate(chunk, (cur, c) -> cur >= total ? cur : cur + c);
            if (start >= total) {
                return null;
            }
            return new WorkRange(start, Math.min(total, start + chunk));
        }
    }

    private static final class GuidedClaimer implements WorkClaimer {
        private final int total;
        private final int workers;
        private final int minChunk;
        private final AtomicInteger cursor = new AtomicInteger();

        GuidedClaimer(int total, int workers, int minChunk) {
            this.total = total;
            this.workers = workers;
            this.minChunk = minChunk;
        }

        @Override
        public WorkRange next(int worker) {
            while (true) {
                int start = cursor.get();
                if (start >= total) {
                    return null;
                }
                int size = Math.max(minChunk, ceilDiv(total - start, workers));
                int end = (int) Math.min(total, (long) start + size);
                if (cursor.compareAndSet(start, end)) {
                    return new WorkRange(start, end);
                }
            }
        }
    }
}
