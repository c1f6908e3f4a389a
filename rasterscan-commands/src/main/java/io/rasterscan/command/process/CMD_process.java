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

import io.rasterscan.command.common.ParallelExecutionOption;
import io.rasterscan.command.common.ScheduleOption;
import io.rasterscan.command.common.VerbosityOption;
import io.rasterscan.core.exec.DispatchConfig;
import io.rasterscan.core.exec.DispatchStrategy;
import io.rasterscan.core.exec.ParallelExecutor;
import io.rasterscan.core.exec.PipelineException;
import io.rasterscan.core.exec.PipelineResult;
import io.rasterscan.core.model.Palette;
import io.rasterscan.core.model.PixelGrid;
import io.rasterscan.io.ImageStore;
import io.rasterscan.io.ImageStoreException;
import io.rasterscan.io.PixelGridPrinter;
import io.rasterscan.io.SearchReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Bleed, greyscale and XOR an image while counting palette matches before and after.
///
/// ## Usage
///
/// ```bash
/// rasterscan process input.raw output.raw search.raw
/// rasterscan process input.raw output.raw search.raw --strategy tiled --threads 8 --schedule dynamic --chunk 4
/// ```
///
/// The output file is bit-identical for every strategy, schedule and thread count.
@CommandLine.Command(
    name = "process",
    header = "Transform an image and count palette matches",
    description = "Runs bleed, greyscale and XOR over every pixel of a raw image, counting how often "
        + "each palette color occurs in the original and the transformed pixels.",
    exitCodeList = {
        "0: Success",
        "1: Error reading or writing files, or a worker failed",
        "2: Invalid arguments"
    }
)
public class CMD_process implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_process.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 1;

    /// Default number of pixels per row.
    public static final int DEFAULT_LINE_SIZE = 1000;

    @CommandLine.Parameters(index = "0", description = "Raw image to read")
    private Path inputPath;

    @CommandLine.Parameters(index = "1", description = "Raw image to write")
    private Path outputPath;

    @CommandLine.Parameters(index = "2", description = "Raw file holding the search palette")
    private Path palettePath;

    @CommandLine.Option(
        names = {"-s", "--strategy"},
        description = "Dispatch strategy: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "ROWS"
    )
    private DispatchStrategy strategy = DispatchStrategy.ROWS;

    @CommandLine.Option(
        names = {"--line-size"},
        description = "Pixels per row, 0 for a single row (default: ${DEFAULT-VALUE})",
        defaultValue = "" + DEFAULT_LINE_SIZE
    )
    private int lineSize = DEFAULT_LINE_SIZE;

    @CommandLine.Option(
        names = {"--tile-size"},
        description = "Palette indices per tile for the tiled strategy (default: ${DEFAULT-VALUE})",
        defaultValue = "" + DispatchConfig.DEFAULT_TILE_SIZE
    )
    private int tileSize = DispatchConfig.DEFAULT_TILE_SIZE;

    @CommandLine.Option(
        names = {"--print-image"},
        description = "Print the transformed image to stdout"
    )
    private boolean printImage = false;

    @CommandLine.Mixin
    private ParallelExecutionOption parallelExecutionOption = new ParallelExecutionOption();

    @CommandLine.Mixin
    private ScheduleOption scheduleOption = new ScheduleOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private void validateOptions() {
        verbosityOption.apply(spec);
        parallelExecutionOption.validate(spec);
        scheduleOption.validate(spec);
        if (lineSize < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --line-size must not be negative, got " + lineSize);
        }
        if (tileSize < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --tile-size must be at least 1, got " + tileSize);
        }
    }

    @Override
    public Integer call() {
        validateOptions();
        DispatchConfig config = new DispatchConfig(
            parallelExecutionOption.getThreadCount(),
            scheduleOption.getSchedule(),
            scheduleOption.getChunk(),
            tileSize);

        try {
            status("Loading file " + inputPath);
            PixelGrid grid = ImageStore.load(inputPath, lineSize);
            status(String.format("Loaded file with %d pixels, a line length of %d and a line count of %d.",
                grid.length(), grid.linesize(), grid.lines()));

            status("Loading file " + palettePath);
            Palette palette = ImageStore.loadPalette(palettePath);
            status("Found " + palette.size() + " search term pixels");

            status("Processing Bleeding, Greyscale, XOR and Searching");
            PipelineResult result = ParallelExecutor.of(strategy, config).run(grid, palette);
            if (verbosityOption.showVerbose()) {
                System.out.printf("Processed with %s on %d threads in %d ms%n",
                    strategy.name().toLowerCase(), result.threads(), result.elapsed().toMillis());
            }

            if (printImage) {
                PixelGridPrinter.print(System.out, grid);
            }

            status("Saving file " + outputPath);
            ImageStore.save(outputPath, grid);

            SearchReport.print(System.out, palette, result.counters());
            return EXIT_SUCCESS;
        } catch (ImageStoreException | PipelineException e) {
            logger.debug("process failed", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private void status(String message) {
        if (verbosityOption.showNormalOutput()) {
            System.out.println(message);
        }
    }
}
