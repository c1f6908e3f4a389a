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
import io.rasterscan.core.exec.DispatchStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerifyMatrixConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void emptyDocumentUsesDefaults() {
        VerifyMatrixConfig config = VerifyMatrixConfig.load(new StringReader("{}"));
        assertThat(config.getStrategies()).isEqualTo(VerifyMatrixConfig.DEFAULT_STRATEGIES);
        assertThat(config.getThreads()).isEqualTo(VerifyMatrixConfig.DEFAULT_THREADS);
        assertThat(config.getSchedules()).containsExactly(ChunkSchedule.values());
        assertThat(config.getChunks()).isEqualTo(VerifyMatrixConfig.DEFAULT_CHUNKS);
        assertThat(config.isStopOnTestcaseFail()).isFalse();
    }

    @Test
    void parsesSnakeCaseMatrixWithNullChunk() {
        String json = "{\n"
            + "  \"matrix\": {\n"
            + "    \"strategies\": [\"rows\", \"Tiled\"],\n"
            + "    \"threads\": [2, 16],\n"
            + "    \"schedules\": [\"guided\"],\n"
            + "    \"chunks\": [null, 64]\n"
            + "  },\n"
            + "  \"behaviour\": {\"stop_on_testcase_fail\": true}\n"
            + "}";
        VerifyMatrixConfig config = VerifyMatrixConfig.load(new StringReader(json));

        assertThat(config.getStrategies()).containsExactly(DispatchStrategy.ROWS, DispatchStrategy.TILED);
        assertThat(config.getThreads()).containsExactly(2, 16);
        assertThat(config.getSchedules()).containsExactly(ChunkSchedule.GUIDED);
        assertThat(config.getChunks()).containsExactly(0, 64);
        assertThat(config.isStopOnTestcaseFail()).isTrue();
    }

    @Test
    void unknownScheduleIsRejected() {
        assertThatThrownBy(() -> VerifyMatrixConfig.load(
            new StringReader("{\"matrix\": {\"schedules\": [\"runtime\"]}}")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("runtime");
    }

    @Test
    void nonPositiveThreadCountIsRejected() {
        assertThatThrownBy(() -> VerifyMatrixConfig.load(new StringReader("{\"matrix\": {\"threads\": [0]}}")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void savedConfigLoadsBack() throws IOException {
        Path file = tempDir.resolve("matrix.json");
        new VerifyMatrixConfig()
            .setStrategies("tasks")
            .setThreads(3)
            .setSchedules("dynamic", "static")
            .setChunks(null, 8)
            .setStopOnTestcaseFail(true)
            .saveToFile(file);

        VerifyMatrixConfig loaded = VerifyMatrixConfig.loadFromFile(file);
        assertThat(loaded.getStrategies()).containsExactly(DispatchStrategy.TASKS);
        assertThat(loaded.getThreads()).containsExactly(3);
        assertThat(loaded.getSchedules()).containsExactly(ChunkSchedule.DYNAMIC, ChunkSchedule.STATIC);
        assertThat(loaded.getChunks()).containsExactly(0, 8);
        assertThat(loaded.isStopOnTestcaseFail()).isTrue();
    }
}
