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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.rasterscan.core.exec.ChunkSchedule;
import io.rasterscan.core.exec.DispatchStrategy;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * JSON-serializable test matrix for the {@code verify} command.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "matrix": {
 *     "strategies": ["rows", "tasks", "tiled"],
 *     "threads": [1, 2, 4, 8],
 *     "schedules": ["static", "dynamic", "guided", "auto"],
 *     "chunks": [null, 64, 256, 1024]      // null means the schedule's default
 *   },
 *   "behaviour": {
 *     "stop_on_testcase_fail": false
 *   }
 * }
 * }</pre>
 *
 * <p>Every field is optional. Absent lists fall back to the defaults shown above.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * VerifyMatrixConfig config = VerifyMatrixConfig.loadFromFile(Path.of("matrix.json"));
 * List<DispatchStrategy> strategies = config.getStrategies();
 * }</pre>
 */
public class VerifyMatrixConfig {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .create();

    /** Strategies tried when none are configured. */
    public static final List<DispatchStrategy> DEFAULT_STRATEGIES =
        List.of(DispatchStrategy.ROWS, DispatchStrategy.TASKS, DispatchStrategy.TILED);

    /** Thread counts tried when none are configured. */
    public static final List<Integer> DEFAULT_THREADS = List.of(1, 2, 4, 8);

    /** Schedules tried when none are configured. */
    public static final List<ChunkSchedule> DEFAULT_SCHEDULES = List.of(ChunkSchedule.values());

    /** Chunk sizes tried when none are configured, 0 being the schedule's default. */
    public static final List<Integer> DEFAULT_CHUNKS = List.of(0, 64, 256, 1024);

    @SerializedName("matrix")
    private Matrix matrix;

    @SerializedName("behaviour")
    private Behaviour behaviour;

    /**
     * The axes of the test matrix.
     */
    public static class Matrix {
        @SerializedName("strategies")
        private List<String> strategies;

        @SerializedName("threads")
        private List<Integer> threads;

        @SerializedName("schedules")
        private List<String> schedules;

        @SerializedName("chunks")
        private List<Integer> chunks;
    }

    /**
     * How the run reacts to mismatches.
     */
    public static class Behaviour {
        @SerializedName("stop_on_testcase_fail")
        private Boolean stopOnTestcaseFail;
    }

    /**
     * Loads a matrix from a JSON file.
     *
     * @param path the JSON file
     * @return the parsed configuration
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the JSON is malformed or names unknown values
     */
    public static VerifyMatrixConfig loadFromFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return load(reader);
        }
    }

    /**
     * Loads a matrix from a JSON reader.
     *
     * @param reader the JSON source
     * @return the parsed configuration
     * @throws IllegalArgumentException if the JSON is malformed or names unknown values
     */
    public static VerifyMatrixConfig load(Reader reader) {
        VerifyMatrixConfig config;
        try {
            config = GSON.fromJson(reader, VerifyMatrixConfig.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid verify matrix JSON: " + e.getMessage(), e);
        }
        if (config == null) {
            config = new VerifyMatrixConfig();
        }
        config.validate();
        return config;
    }

    /**
     * Writes this configuration as JSON.
     *
     * @param path the file to create or overwrite
     * @throws IOException if the file cannot be written
     */
    public void saveToFile(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            GSON.toJson(this, writer);
        }
    }

    /**
     * @return a configuration with every axis at its default
     */
    public static VerifyMatrixConfig defaults() {
        return new VerifyMatrixConfig();
    }

    private void validate() {
        getStrategies();
        getSchedules();
        for (Integer threads : getThreads()) {
            if (threads == null || threads < 1) {
                throw new IllegalArgumentException("Invalid thread count: " + threads);
            }
        }
        for (int chunk : getChunks()) {
            if (chunk < 0) {
                throw new IllegalArgumentException("Invalid chunk: " + chunk);
            }
        }
    }

    /**
     * @return the strategies to compare against the sequential baseline
     */
    public List<DispatchStrategy> getStrategies() {
        if (matrix == null || isEmpty(matrix.strategies)) {
            return DEFAULT_STRATEGIES;
        }
        List<DispatchStrategy> result = new ArrayList<>();
        for (String name : matrix.strategies) {
            result.add(parseEnum(DispatchStrategy.class, name, "strategy"));
        }
        return result;
    }

    /**
     * @return the thread counts to try
     */
    public List<Integer> getThreads() {
        if (matrix == null || isEmpty(matrix.threads)) {
            return DEFAULT_THREADS;
        }
        return matrix.threads;
    }

    /**
     * @return the schedules to try
     */
    public List<ChunkSchedule> getSchedules() {
        if (matrix == null || isEmpty(matrix.schedules)) {
            return DEFAULT_SCHEDULES;
        }
        List<ChunkSchedule> result = new ArrayList<>();
        for (String name : matrix.schedules) {
            result.add(parseEnum(ChunkSchedule.class, name, "schedule"));
        }
        return result;
    }

    /**
     * @return the chunk sizes to try, a JSON null becoming 0
     */
    public List<Integer> getChunks() {
        if (matrix == null || isEmpty(matrix.chunks)) {
            return DEFAULT_CHUNKS;
        }
        List<Integer> result = new ArrayList<>();
        for (Integer chunk : matrix.chunks) {
            result.add(chunk == null ? 0 : chunk);
        }
        return result;
    }

    /**
     * @return true if the run should stop at the first mismatching case
     */
    public boolean isStopOnTestcaseFail() {
        return behaviour != null && Boolean.TRUE.equals(behaviour.stopOnTestcaseFail);
    }

    /**
     * @param strategies strategy names
     * @return this configuration
     */
    public VerifyMatrixConfig setStrategies(String... strategies) {
        matrix().strategies = Arrays.asList(strategies);
        return this;
    }

    /**
     * @param threads thread counts
     * @return this configuration
     */
    public VerifyMatrixConfig setThreads(Integer... threads) {
        matrix().threads = Arrays.asList(threads);
        return this;
    }

    /**
     * @param schedules schedule names
     * @return this configuration
     */
    public VerifyMatrixConfig setSchedules(String... schedules) {
        matrix().schedules = Arrays.asList(schedules);
        return this;
    }

    /**
     * @param chunks chunk sizes, null for the schedule's default
     * @return this configuration
     */
    public VerifyMatrixConfig setChunks(Integer... chunks) {
        matrix().chunks = Arrays.asList(chunks);
        return this;
    }

    /**
     * @param stop whether to stop at the first mismatching case
     * @return this configuration
     */
    public VerifyMatrixConfig setStopOnTestcaseFail(boolean stop) {
        if (behaviour == null) {
            behaviour = new Behaviour();
        }
        behaviour.stopOnTestcaseFail = stop;
        return this;
    }

    private Matrix matrix() {
        if (matrix == null) {
            matrix = new Matrix();
        }
        return matrix;
    }

    private static boolean isEmpty(List<?> values) {
        return values == null || values.isEmpty();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String name, String what) {
        if (name == null) {
            throw new IllegalArgumentException("Invalid " + what + ": null");
        }
        try {
            return Enum.valueOf(type, name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + what + ": '" + name + "'", e);
        }
    }
}
