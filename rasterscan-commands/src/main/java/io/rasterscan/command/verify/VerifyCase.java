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


package io.rasterscan.command.verify;

import io.rasterscan.core.exec.ChunkSchedule;
import io.rasterscan.core.exec.DispatchConfig;
import io.rasterscan.core.exec.DispatchStrategy;

/// One cell of the verify matrix.
///
/// @param strategy the dispatch strategy under test
/// @param threads worker count
/// @param schedule chunk schedule
/// @param chunk chunk size, 0 for the schedule's default
public record VerifyCase(DispatchStrategy strategy, int threads, ChunkSchedule schedule, int chunk) {

    /// @param tileSize palette tile size for the tiled strategy
    /// @return the dispatch configuration for this case
    public DispatchConfig toConfig(int tileSize) {
        return new DispatchConfig(threads, schedule, chunk, tileSize);
    }

    /// @return a compact label such as `rows threads=4 schedule=dynamic chunk=64`
    public String label() {
        return strategy.name().toLowerCase() + " threads=" + threads
            + " schedule=" + schedule.name().toLowerCase()
            + " chunk=" + (chunk == 0 ? "default" : String.valueOf(chunk));
    }
}
