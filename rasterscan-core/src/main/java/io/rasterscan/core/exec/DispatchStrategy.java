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

/// The interchangeable ways of distributing pipeline work.
public enum DispatchStrategy {
    /// One thread, rows in order. The reference every other strategy must match.
    SEQUENTIAL("single thread, rows in order"),
    /// Rows chunked over a fixed team with private counters merged after the join.
    ROWS("row-parallel with private counters"),
    /// One fork-join task per row, each merging its own counter on completion.
    TASKS("task per row with guarded merge"),
    /// Rows in order on one logical thread, palette searches split into tiles over a team.
    TILED("index-tiled searches with phase barriers"),
    /// Row-parallel with one atomic increment per match on a shared counter.
    ATOMIC("row-parallel with contended atomic counters");

    private final String description;

    DispatchStrategy(String description) {
        this.description = description;
    }

    /// @return a short description of the strategy
    public String description() {
        return description;
    }

    /// @param config worker and chunking configuration
    /// @return a dispatcher for this strategy
    public RowDispatcher create(DispatchConfig config) {
        switch (this) {
            case SEQUENTIAL:
                return new SequentialDispatcher();
            case ROWS:
                return new RowParallelDispatcher(config);
            case TASKS:
                return new TaskPerRowDispatcher(config);
            case TILED:
                return new IndexTiledDispatcher(config);
            case ATOMIC:
                return new AtomicRowDispatcher(config);
            default:
                throw new IllegalStateException("Unknown strategy: " + this);
        }
    }
}
