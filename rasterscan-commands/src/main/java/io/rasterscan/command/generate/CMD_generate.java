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

import io.rasterscan.core.model.Palette;
import io.rasterscan.core.model.Pixel;
import io.rasterscan.core.model.PixelGrid;
import io.rasterscan.io.ImageStore;
import io.rasterscan.io.ImageStoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;

/// Write a random raw image, and optionally a palette sampled from it.
///
/// ## Usage
///
/// ```bash
/// rasterscan generate input.raw --pixels 100000 --seed 7
/// rasterscan generate input.raw --pixels 100000 --palette search.raw --palette-size 16
/// ```
///
/// Channels are drawn uniformly from `[0, 255)`. The same seed always produces the same files.
@CommandLine.Command(
    name = "generate",
    header = "Generate a random raw image",
    description = "Writes a random raw image and optionally a search palette sampled from it.",
    exitCodeList = {
        "0: Success",
        "1: Error writing files",
        "2: Invalid arguments"
    }
)
public class CMD_generate implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_generate.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 1;

    /// Exclusive upper bound of generated channel values.
    public static final int CHANNEL_BOUND = 255;

    @CommandLine.Parameters(index = "0", description = "Raw image to write")
    private Path outputPath;

    @CommandLine.Option(
        names = {"-n", "--pixels"},
        description = "Number of pixels to generate (default: ${DEFAULT-VALUE})",
        defaultValue = "10000"
    )
    private long pixels = 10_000;

    @CommandLine.Option(
        names = {"--seed"},
        description = "Random seed (default: ${DEFAULT-VALUE})",
        defaultValue = "1"
    )
    private long seed = 1;

    @CommandLine.Option(
        names = {"--palette"},
        description = "Also write a palette sampled from the generated image to this file"
    )
    private Path palettePath;

    @CommandLine.Option(
        names = {"--palette-size"},
        description = "Number of palette colors to sample (default: ${DEFAULT-VALUE})",
        defaultValue = "8"
    )
    private int paletteSize = 8;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        if (pixels < 0 || pixels > Integer.MAX_VALUE / PixelGrid.CHANNELS) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --pixels must be between 0 and " + Integer.MAX_VALUE / PixelGrid.CHANNELS);
        }
        if (paletteSize < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --palette-size must not be negative, got " + paletteSize);
        }
        if (palettePath != null && pixels == 0 && paletteSize > 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: cannot sample a palette from an empty image");
        }

        Random random = new Random(seed);
        Pixel[] image = new Pixel[(int) pixels];
        for (int i = 0; i < image.length; i++) {
            image[i] = new Pixel(random.nextInt(CHANNEL_BOUND), random.nextInt(CHANNEL_BOUND),
                random.nextInt(CHANNEL_BOUND));
        }

        try {
            ImageStore.save(outputPath, PixelGrid.of(image, 0));
            System.out.println("Wrote " + image.length + " pixels to " + outputPath);

            if (palettePath != null) {
                List<Pixel> sampled = new ArrayList<>(paletteSize);
                for (int i = 0; i < paletteSize; i++) {
                    sampled.add(image[random.nextInt(image.length)]);
                }
                ImageStore.savePalette(palettePath, Palette.of(sampled));
                System.out.println("Wrote " + sampled.size() + " palette colors to " + palettePath);
            }
            return EXIT_SUCCESS;
        } catch (ImageStoreException e) {
            logger.debug("generate failed", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }
}
