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

/// A fatal failure of a pipeline run.
///
/// Raised when any worker fails (including allocation failure of its private
/// counter) or when the dispatching thread is interrupted. The remaining workers
/// of the run are cancelled before this is thrown; there is no partial result.
public class PipelineException extends RuntimeException {

    /// @param message what failed
    /// @param cause the first underlying failure
    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    /// @param message what failed
    public PipelineException(String message) {
        super(message);
    }
}
