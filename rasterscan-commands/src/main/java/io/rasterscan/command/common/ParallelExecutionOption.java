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


package io.rasterscan.command.common;

import picocli.CommandLine;

/**
 * Shared parallel execution options.
 * Provides standard {@code --parallel} and {@code --threads} options for commands
 * that run the pipeline on a worker team.
 */
public class ParallelExecutionOption {

    @CommandLine.Option(
        names = {"-p", "--parallel"},
        description = "Enable parallel processing (auto-sizes based on available CPU cores)"
    )
    private boolean parallel = false;

    @CommandLine.Option(
        names = {"--threads"},
        description = "Number of worker threads (default: 1, or all but one core with --parallel)"
    )
    private Integer explicitThreads;

    /**
     * Resolves the worker count.
     * An explicit {@code --threads} wins; {@code --parallel} leaves one core free.
     *
     * @return the thread count to run with
     */
    public int getThreadCount() {
        if (explicitThreads != null) {
            return explicitThreads;
        } else if (parallel) {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        } else {
            return 1;
        }
    }

    /**
     * Validates that an explicit thread count is positive.
     *
     * @param spec the command spec used to report the error
     * @throws CommandLine.ParameterException if {@code --threads} is less than 1
     */
    public void validate(CommandLine.Model.CommandSpec spec) {
        if (explicitThreads != null && explicitThreads < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --threads must be at least 1, got " + explicitThreads);
        }
    }
}
