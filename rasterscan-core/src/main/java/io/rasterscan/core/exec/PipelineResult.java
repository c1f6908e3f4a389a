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

import java.time.Duration;

/// The outcome of a completed pipeline run.
///
/// @param counters the merged match counts, indexed by palette entry
/// @param strategy the strategy that produced them
/// @param threads number of worker threads used
/// @param partials number of partial counters that were merged
/// @param elapsed wall-clock time from dispatch to merged result
public record PipelineResult(
    CounterVector counters,
    DispatchStrategy strategy,
    int threads,
    int partials,
    Duration elapsed
) {
}
