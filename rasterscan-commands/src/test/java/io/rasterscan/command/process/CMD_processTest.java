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


package io.rasterscan.command.process;

import io.rasterscan.command.CMD_rasterscan;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class CMD_processTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outContent = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errContent = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private Path writeRaw(String name, int... values) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (int value : values) {
            buffer.putInt(value);
        }
        Path file = tempDir.resolve(name);
        Files.write(file, buffer.array());
        return file;
    }

    private static int[] readRaw(Path file) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(Files.readAllBytes(file)).order(ByteOrder.LITTLE_ENDIAN);
        int[] values = new int[buffer.remaining() / Integer.BYTES];
        buffer.asIntBuffer().get(values);
        return values;
    }

    @Test
    public void testTransformsAndCountsSamplePixels() throws IOException {
        Path input = writeRaw("input.raw", 10, 10, 10, 200, 50, 0, 10, 10, 10);
        Path search = writeRaw("search.raw", 10, 10, 10);
        Path output = tempDir.resolve("output.raw");

        int exitCode = CMD_rasterscan.commandLine().execute(
            "process", input.toString(), output.toString(), search.toString(), "--line-size", "0");

        assertThat(exitCode).isZero();
        assertThat(readRaw(output)).containsExactly(7, 7, 7, 55, 55, 55, 28, 28, 28);

        String out = outContent.toString();
        assertThat(out).contains(
            "Loading file " + input,
            "Loaded file with 3 pixels, a line length of 3 and a line count of 1.",
            "Loading file " + search,
            "Found 1 search term pixels",
            "Processing Bleeding, Greyscale, XOR and Searching",
            "Saving file " + output,
            "Search Results:",
            "** ( 10, 10, 10) = 2");
    }

    @Test
    public void testStrategiesWriteIdenticalFiles() throws IOException {
        int[] values = new int[3 * 250];
        for (int i = 0; i < values.length; i++) {
            values[i] = (i * 31 + 7) % 40;
        }
        Path input = writeRaw("input.raw", values);
        Path search = writeRaw("search.raw", 7, 7, 7, 10, 10, 10, 0, 0, 0);

        Path rows = tempDir.resolve("rows.raw");
        Path tiled = tempDir.resolve("tiled.raw");
        Path sequential = tempDir.resolve("sequential.raw");
        assertThat(CMD_rasterscan.commandLine().execute("process", input.toString(), sequential.toString(),
            search.toString(), "--strategy", "sequential", "--line-size", "16")).isZero();
        assertThat(CMD_rasterscan.commandLine().execute("process", input.toString(), rows.toString(),
            search.toString(), "--threads", "4", "--schedule", "dynamic", "--chunk", "2", "--line-size", "16")).isZero();
        assertThat(CMD_rasterscan.commandLine().execute("process", input.toString(), tiled.toString(),
            search.toString(), "--strategy", "TILED", "--threads", "3", "--tile-size", "2", "--line-size", "16")).isZero();

        assertThat(Files.readAllBytes(rows)).isEqualTo(Files.readAllBytes(sequential));
        assertThat(Files.readAllBytes(tiled)).isEqualTo(Files.readAllBytes(sequential));
    }

    @Test
    public void testMissingArgumentsIsUsageError() {
        int exitCode = CMD_rasterscan.commandLine().execute("process", "only-one.raw");
        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    public void testInvalidThreadCountIsUsageError() throws IOException {
        Path input = writeRaw("input.raw", 1, 2, 3);
        int exitCode = CMD_rasterscan.commandLine().execute("process", input.toString(),
            tempDir.resolve("out.raw").toString(), input.toString(), "--threads", "0");
        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    public void testMissingInputFileIsIoError() {
        Path missing = tempDir.resolve("missing.raw");
        int exitCode = CMD_rasterscan.commandLine().execute("process", missing.toString(),
            tempDir.resolve("out.raw").toString(), missing.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(errContent.toString()).contains("Error: ").contains("missing.raw");
    }

    @Test
    public void testQuietPrintsOnlyTheReport() throws IOException {
        Path input = writeRaw("input.raw", 10, 10, 10);
        Path search = writeRaw("search.raw", 10, 10, 10);
        int exitCode = CMD_rasterscan.commandLine().execute("process", input.toString(),
            tempDir.resolve("out.raw").toString(), search.toString(), "-q", "--line-size", "0");

        assertThat(exitCode).isZero();
        assertThat(outContent.toString()).doesNotContain("Loading file").contains("** ( 10, 10, 10) = 1");
    }
}
