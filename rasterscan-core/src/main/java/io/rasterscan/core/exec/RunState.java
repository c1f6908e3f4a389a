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

/// Lifecycle of one {@link ParallelExecutor} run.
///
/// ```
/// INIT -> ROW_DISPATCH -> MERGE -> DONE
///              \            \
///               +------------+--> FAILED
/// ```
public enum RunState {
    /// Nothing dispatched yet.
    INIT,
    /// Workers are searching, bleeding and transforming rows.
    ROW_DISPATCH,
    /// All workers have finished; partial counters are being summed.
    MERGE,
    /// The grid is transformed and the counters are final.
    DONE,
    /// A worker or the dispatching thread failed; the run has no result.
    FAILED
}
