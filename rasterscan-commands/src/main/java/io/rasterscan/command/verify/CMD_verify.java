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

import io.rasterscan.command.common.VerbosityOption;
import io.rasterscan.command.process.CMD_process;
import io.rasterscan.core.exec.ChunkSchedule;
import io.rasterscan.core.exec.DispatchConfig;
import io.rasterscan.core.exec.DispatchStrategy;
import io.rasterscan.core.exec.ParallelExecutor;
import io.rasterscan.core.exec.PipelineException;
import io.rasterscan.core.exec.PipelineResult;
import io.rasterscan.core.model.Palette;
import io.rasterscan.core.model.PixelGrid;
import io.rasterscan.io.ImageStore;
import io.rasterscan.io.ImageStoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.Callable;

/// Check every strategy, thread count, schedule and chunk size against the sequential baseline.
///
/// The baseline is a sequential run over a copy of the input. Each case then runs over
/// its own fresh copy; it passes when the MD5 of the encoded output image and every
/// palette counter equal the baseline's.
///
/// ## Usage
///
/// ```bash
/// rasterscan verify input.raw search.raw
/// rasterscan verify input.raw search.raw --strategies rows,tiled --thread-counts 1,4,16 --results results.csv
/// rasterscan verify input.raw search.raw --config matrix.json --stop-on-fail
/// ```
///
/// Matrix axes given on the command line override the same axes from `--config`.
@CommandLine.Command(
    name = "verify",
    header = "Verify parallel strategies against the sequential baseline",
    description = "Runs the sequential baseline, then every combination of strategy, thread count, "
        + "schedule and chunk size, comparing the output image MD5 and the match counters.",
    exitCodeList = {
        "0: Every case matched the baseline",
        "1: A case mismatched, a worker failed, or a file could not be read",
        "2: Invalid arguments"
    }
)
public class CMD_verify implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_verify.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_FAILURE = 1;

    /// Header line of the results CSV.
    public static final String CSV_HEADER = "strategy,threads,schedule,chunk,md5_ok,counters_ok,time_ms";

    @CommandLine.Parameters(index = "0", description = "Raw image to read")
    private Path inputPath;

    @CommandLine.Parameters(index = "1", description = "Raw file holding the search palette")
    private Path palettePath;

    @CommandLine.Option(
        names = {"--config"},
        description = "JSON file describing the test matrix"
    )
    private Path configPath;

    @CommandLine.Option(
        names = {"--strategies"},
        split = ",",
        description = "Strategies to test: ${COMPLETION-CANDIDATES}"
    )
    private List<DispatchStrategy> strategies;

    @CommandLine.Option(
        names = {"--thread-counts"},
        split = ",",
        description = "Thread counts to test"
    )
    private List<Integer> threadCounts;

    @CommandLine.Option(
        names = {"--schedules"},
        split = ",",
        description = "Schedules to test: ${COMPLETION-CANDIDATES}"
    )
    private List<ChunkSchedule> schedules;

    @CommandLine.Option(
        names = {"--chunks"},
        split = ",",
        description = "Chunk sizes to test, 0 for the schedule's default"
    )
    private List<Integer> chunks;

    @CommandLine.Option(
        names = {"--results"},
        description = "CSV file to append one row per case to"
    )
    private Path resultsPath;

    @CommandLine.Option(
        names = {"--stop-on-fail"},
        description = "Stop at the first case that does not match"
    )
    private boolean stopOnFail = false;

    @CommandLine.Option(
        names = {"--line-size"},
        description = "Pixels per row, 0 for a single row (default: ${DEFAULT-VALUE})",
        defaultValue = "" + CMD_process.DEFAULT_LINE_SIZE
    )
    private int lineSize = CMD_process.DEFAULT_LINE_SIZE;

    @CommandLine.Option(
        names = {"--tile-size"},
        description = "Palette indices per tile for the tiled strategy (default: ${DEFAULT-VALUE})",
        defaultValue = "" + DispatchConfig.DEFAULT_TILE_SIZE
    )
    private int tileSize = DispatchConfig.DEFAULT_TILE_SIZE;

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        verbosityOption.apply(spec);
        if (lineSize < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --line-size must not be negative, got " + lineSize);
        }
        if (tileSize < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: --tile-size must be at least 1, got " + tileSize);
        }
        List<VerifyCase> cases = buildCases(loadMatrix());

        try {
            PixelGrid source = ImageStore.load(inputPath, lineSize);
            Palette palette = ImageStore.loadPalette(palettePath);

            PixelGrid baselineGrid = source.copy();
            PipelineResult baseline = ParallelExecutor.of(DispatchStrategy.SEQUENTIAL,
                DispatchConfig.sequential().withTileSize(tileSize)).run(baselineGrid, palette);
            String baselineMd5 = md5(ImageStore.encode(baselineGrid));
            status(String.format("Baseline: %d pixels, %d palette entries, md5=%s, matches=%d",
                source.length(), palette.size(), baselineMd5, baseline.counters().total()));

            int failures = 0;
            int run = 0;
            for (VerifyCase testCase : cases) {
                VerifyOutcome outcome = runCase(testCase, source, palette, baselineMd5, baseline);
                run++;
                report(outcome);
                if (!outcome.passed()) {
                    failures++;
                    if (stopOnFail) {
                        break;
                    }
                }
            }
            status(String.format("%d of %d cases matched the baseline", run - failures, cases.size()));
            return failures == 0 ? EXIT_SUCCESS : EXIT_FAILURE;
        } catch (ImageStoreException | IOException e) {
            logger.debug("verify failed", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private VerifyMatrixConfig loadMatrix() {
        VerifyMatrixConfig config;
        try {
            config = configPath != null ? VerifyMatrixConfig.loadFromFile(configPath) : VerifyMatrixConfig.defaults();
        } catch (IOException | IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Error: cannot load matrix config " + configPath + ": " + e.getMessage(), e);
        }
        if (config.isStopOnTestcaseFail()) {
            stopOnFail = true;
        }
        return config;
    }

    private List<VerifyCase> buildCases(VerifyMatrixConfig config) {
        List<DispatchStrategy> strategyAxis = strategies != null ? strategies : config.getStrategies();
        List<Integer> threadAxis = threadCounts != null ? threadCounts : config.getThreads();
        List<ChunkSchedule> scheduleAxis = schedules != null ? schedules : config.getSchedules();
        List<Integer> chunkAxis = chunks != null ? chunks : config.getChunks();

        for (int threads : threadAxis) {
            if (threads < 1) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                    "Error: thread counts must be at least 1, got " + threads);
            }
        }
        for (int chunk : chunkAxis) {
            if (chunk < 0) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                    "Error: chunk sizes must not be negative, got " + chunk);
            }
        }

        List<VerifyCase> cases = new ArrayList<>();
        for (DispatchStrategy strategy : strategyAxis) {
            for (int threads : threadAxis) {
                for (ChunkSchedule schedule : scheduleAxis) {
                    for (int chunk : chunkAxis) {
                        cases.add(new VerifyCase(strategy, threads, schedule, chunk));
                    }
                }
            }
        }
        logger.debug("Verify matrix has {} cases", cases.size());
        return cases;
    }

    private VerifyOutcome runCase(VerifyCase testCase, PixelGrid source, Palette palette,
                                  String baselineMd5, PipelineResult baseline) {
        PixelGrid grid = source.copy();
        long start = System.nanoTime();
        try {
            PipelineResult result = ParallelExecutor.of(testCase.strategy(), testCase.toConfig(tileSize))
                .run(grid, palette);
            long timeMs = (System.nanoTime() - start) / 1_000_000L;
            boolean md5Ok = baselineMd5.equals(md5(ImageStore.encode(grid)));
            boolean countersOk = baseline.counters().equals(result.counters());
            return new VerifyOutcome(testCase, md5Ok, countersOk, timeMs);
        } catch (PipelineException e) {
            logger.warn("Case {} counted as a mismatch after a worker failure", testCase.label());
            return new VerifyOutcome(testCase, false, false, (System.nanoTime() - start) / 1_000_000L);
        }
    }

    private void report(VerifyOutcome outcome) throws IOException {
        String line = String.format("[%s] %s md5=%s counters=%s %d ms",
            outcome.passed() ? "PASS" : "FAIL",
            outcome.testCase().label(),
            outcome.md5Ok() ? "ok" : "MISMATCH",
            outcome.countersOk() ? "ok" : "MISMATCH",
            outcome.timeMs());
        if (outcome.passed()) {
            status(line);
        } else {
            System.out.println(line);
        }
        if (resultsPath != null) {
            appendCsv(outcome);
        }
    }

    private void appendCsv(VerifyOutcome outcome) throws IOException {
        boolean writeHeader = !Files.exists(resultsPath) || Files.size(resultsPath) == 0;
        try (BufferedWriter writer = Files.newBufferedWriter(resultsPath,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            if (writeHeader) {
                writer.write(CSV_HEADER);
                writer.newLine();
            }
            writer.write(outcome.toCsvRow());
            writer.newLine();
        }
    }

    private void status(String message) {
        if (verbosityOption.showNormalOutput()) {
            System.out.println(message);
        }
    }

    /// @param data bytes to digest
    /// @return the lowercase hex MD5 of the bytes
    static String md5(byte[] data) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("MD5").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available", e);
        }
    }
}
