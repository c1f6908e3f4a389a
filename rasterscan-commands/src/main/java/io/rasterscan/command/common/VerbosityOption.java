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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * Provides standard {@code -v/--verbose} and {@code -q/--quiet} flags for controlling
 * command output verbosity.
 */
public class VerbosityOption {

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Enable verbose output"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Suppress all output except errors"
    )
    private boolean quiet = false;

    /**
     * Checks if normal (non-verbose, non-quiet) output should be shown.
     *
     * @return true if normal output should be shown
     */
    public boolean showNormalOutput() {
        return !quiet;
    }

    /**
     * Checks if verbose messages should be shown.
     *
     * @return true if verbose messages should be shown
     */
    public boolean showVerbose() {
        return verbose && !quiet;
    }

    /**
     * Validates the flags and raises the {@code io.rasterscan} log level to DEBUG when
     * verbose output was requested.
     *
     * @param spec the command spec used to report the error
     * @throws CommandLine.ParameterException if both verbose and quiet are enabled
     */
    public void apply(CommandLine.Model.CommandSpec spec) {
        if (verbose && quiet) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: Cannot specify both --verbose and --quiet options");
        }
        if (verbose) {
            Configurator.setLevel("io.rasterscan", Level.DEBUG);
        }
    }
}
