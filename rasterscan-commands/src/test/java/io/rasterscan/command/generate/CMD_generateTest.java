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


package io.rasterscan.command.generate;

import io.rasterscan.command.CMD_rasterscan;
import io.rasterscan.core.model.Palette;
import io.rasterscan.core.model.Pixel;
import io.rasterscan.core.model.PixelGrid;
import io.rasterscan.io.ImageStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

public class CMD_generateTest {

    @TempDir
    Path tempDir;

    private PrintStream originalOut;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        System.setOut(new PrintStream(new ByteArrayOutputStream()));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    @Test
    public void testSameSeedSameImage() throws IOException {
        Path first = tempDir.resolve("a.raw");
        Path second = tempDir.resolve("b.raw");
        assertThat(CMD_rasterscan.commandLine().execute("generate", first.toString(), "--pixels", "500", "--seed", "3"))
            .isZero();
        assertThat(CMD_rasterscan.commandLine().execute("generate", second.toString(), "--pixels", "500", "--seed", "3"))
            .isZero();

        assertThat(Files.size(first)).isEqualTo(500L * ImageStore.PIXEL_RECORD_BYTES);
        assertThat(Files.readAllBytes(second)).isEqualTo(Files.readAllBytes(first));
    }

    @Test
    public void testChannelsStayInRange() {
        Path image = tempDir.resolve("image.raw");
        assertThat(CMD_rasterscan.commandLine().execute("generate", image.toString(), "-n", "300")).isZero();

        PixelGrid grid = ImageStore.load(image, 0);
        for (int value : grid.row(0)) {
            assertThat(value).isBetween(0, CMD_generate.CHANNEL_BOUND - 1);
        }
    }

    @Test
    public void testPaletteIsSampledFromTheImage() {
        Path image = tempDir.resolve("image.raw");
        Path search = tempDir.resolve("search.raw");
        int exitCode = CMD_rasterscan.commandLine().execute("generate", image.toString(),
            "--pixels", "200", "--palette", search.toString(), "--palette-size", "5");
        assertThat(exitCode).isZero();

        Set<Pixel> pixels = new HashSet<>(Palette.fromGrid(ImageStore.load(image, 0)).entries());
        Palette palette = ImageStore.loadPalette(search);
        assertThat(palette.size()).isEqualTo(5);
        assertThat(pixels).containsAll(palette.entries());
    }

    @Test
    public void testNegativePixelCountIsUsageError() {
        int exitCode = CMD_rasterscan.commandLine().execute("generate",
            tempDir.resolve("x.raw").toString(), "--pixels", "-1");
        assertThat(exitCode).isEqualTo(2);
    }
}
