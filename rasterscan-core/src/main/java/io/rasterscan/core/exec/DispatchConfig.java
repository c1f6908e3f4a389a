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

/// Worker pool sizing and chunking for a {@link RowDispatcher}.
///
/// @param threads number of worker threads, at least 1
/// @param schedule how rows or palette tiles are split among workers
/// @param chunk chunk size handed to the schedule, 0 for the schedule's default
/// @param tileSize palette indices per tile for the index-tiled strategy
public record DispatchConfig(int threads, ChunkSchedule schedule, int chunk, int tileSize) {

    /// Default palette tile size.
    public static final int DEFAULT_TILE_SIZE = 1024;

    /// Validates the configuration.
    public DispatchConfig {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1: " + threads);
        }
        if (schedule == null) {
            throw new IllegalArgumentException("Schedule cannot be null");
        }
        if (chunk < 0) {
            throw new IllegalArgumentException("Chunk size must not be negative: " + chunk);
        }
        if (tileSize < 1) {
            throw new IllegalArgumentException("Tile size must be at least 1: " + tileSize);
        }
    }

    /// @return a single-threaded static configuration
    public static DispatchConfig sequential() {
        return new DispatchConfig(1, ChunkSchedule.STATIC, 0, DEFAULT_TILE_SIZE);
    }

    /// @param threads number of worker threads
    /// @return a configuration with the given thread count and the default schedule
    public static DispatchConfig withThreads(int threads) {
        return new DispatchConfig(threads, ChunkSchedule.STATIC, 0, DEFAULT_TILE_SIZE);
    }

    /// @param schedule the chunk schedule
    /// @param chunk the chunk size, 0 for default
    /// @return a copy with a different schedule
    public DispatchConfig withSchedule(ChunkSchedule schedule, int chunk) {
        return new DispatchConfig(threads, schedule, chunk, tileSize);
    }

    /// @param tileSize palette indices per tile
    /// @return a copy with a different tile size
    public DispatchConfig withTileSize(int tileSize) {
        return new DispatchConfig(threads, schedule, chunk, tileSize);
    }
}
