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

import io.rasterscan.core.exec.ChunkSchedule;
import picocli.CommandLine;

/**
 * Shared chunk schedule options.
 * Provides {@code --schedule} and {@code --chunk} for commands that split rows or palette
 * tiles among workers.
 */
public class ScheduleOption {

    @CommandLine.Option(
        names = {"--schedule"},
        description = "Chunk schedule: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "STATIC"
    )
    private ChunkSchedule schedule = ChunkSchedule.STATIC;

    @CommandLine.Option(
        names = {"--chunk"},
        description = "Chunk size handed to the schedule, 0 for the schedule's default (default: ${DEFAULT-VALUE})",
        defaultValue = "0"
    )
    private int chunk = 0;

    /**
     * @return the selected schedule
     */
    public ChunkSchedule getSchedule() {
        return schedule;
    }

    /**
     * @return the chunk size, 0 meaning the schedule's default
     */
    public int getChunk() {
        return chunk;
    }

    /**
     * Validates the chunk size.
     *
     * @param spec the command spec used to report the error
     * @throws CommandLine.ParameterException if the chunk size is negative
     */
    public void validate(CommandLine.Model.CommandSpec spec) {
        if (chunk < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --chunk must not be negative, got " + chunk);
        }
    }
}
