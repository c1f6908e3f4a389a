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


package io.rasterscan.io;

import io.rasterscan.core.model.Palette;
import io.rasterscan.core.model.Pixel;
import io.rasterscan.core.model.PixelGrid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/// Reader and writer for headerless raw pixel files.
///
/// Every pixel is one fixed width record of three little-endian signed ints:
///
/// ```
/// +-----------+-----------+-----------+
/// | red (4B)  | green (4B)| blue (4B) |   x pixel count
/// +-----------+-----------+-----------+
/// ```
///
/// The pixel count is `fileSize / 12`. A trailing partial record is ignored.
/// Saving writes every row of the grid, including the zero padding of the last
/// row, so a saved file may hold more pixels than the file it was loaded from.
public final class ImageStore {

    private static final Logger logger = LogManager.getLogger(ImageStore.class);

    /// Size in bytes of one pixel record.
    public static final int PIXEL_RECORD_BYTES = PixelGrid.CHANNELS * Integer.BYTES;

    private ImageStore() {
    }

    /// Loads a raw pixel file into a grid.
    ///
    /// @param path the file to read
    /// @param lineSize the line size of the grid, or 0 for a single line
    /// @return the loaded grid, zero padded to whole rows
    /// @throws ImageStoreException if the file cannot be read
    /// @throws IllegalArgumentException if the line size is negative
    public static PixelGrid load(Path path, int lineSize) {
        if (lineSize < 0) {
            throw new IllegalArgumentException("Line size must not be negative: " + lineSize);
        }
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long fileSize = channel.size();
            long pixels = pixelCount(fileSize);
            if (fileSize % PIXEL_RECORD_BYTES != 0) {
                logger.warn("Ignoring {} trailing bytes of partial pixel record in {}",
                    fileSize % PIXEL_RECORD_BYTES, path);
            }

            PixelGrid grid = PixelGrid.allocate(pixels, lineSize);
            long remaining = pixels;
            for (int line = 0; line < grid.lines() && remaining > 0; line++) {
                int count = (int) Math.min(remaining, grid.linesize());
                readRow(channel, path, grid.row(line), count);
                remaining -= count;
            }
            logger.debug("Loaded {} pixels from {} into {}", pixels, path, grid);
            return grid;
        } catch (IOException e) {
            throw new ImageStoreException("Failed to read pixel file: " + path, e);
        }
    }

    /// Loads a raw pixel file as a search palette, in file order.
    ///
    /// @param path the file to read
    /// @return the palette
    /// @throws ImageStoreException if the file cannot be read
    public static Palette loadPalette(Path path) {
        return Palette.fromGrid(load(path, 0));
    }

    /// Writes every row of the grid, including any padding, in row-major order.
    ///
    /// @param path the file to create or truncate
    /// @param grid the grid to write
    /// @throws ImageStoreException if the file cannot be written
    public static void save(Path path, PixelGrid grid) {
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(path))) {
            write(out, grid);
        } catch (IOException e) {
            throw new ImageStoreException("Failed to write pixel file: " + path, e);
        }
        logger.debug("Saved {} to {}", grid, path);
    }

    /// Writes a palette as a single-line pixel file.
    ///
    /// @param path the file to create or truncate
    /// @param palette the palette entries to write
    /// @throws ImageStoreException if the file cannot be written
    public static void savePalette(Path path, Palette palette) {
        PixelGrid grid = PixelGrid.of(palette.entries().toArray(new Pixel[0]), 0);
        save(path, grid);
    }

    /// Encodes the grid exactly as {@link #save(Path, PixelGrid)} would write it.
    ///
    /// @param grid the grid to encode
    /// @return the raw bytes
    public static byte[] encode(PixelGrid grid) {
        long size = grid.length() * PIXEL_RECORD_BYTES;
        if (size > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Grid too large to encode in memory: " + grid);
        }
        ByteBuffer buffer = ByteBuffer.allocate((int) size).order(ByteOrder.LITTLE_ENDIAN);
        for (int line = 0; line < grid.lines(); line++) {
            for (int value : grid.row(line)) {
                buffer.putInt(value);
            }
        }
        return buffer.array();
    }

    /// @param fileSize size of a raw pixel file in bytes
    /// @return the number of whole pixel records it holds
    public static long pixelCount(long fileSize) {
        return fileSize / PIXEL_RECORD_BYTES;
    }

    private static void readRow(FileChannel channel, Path path, int[] row, int count) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(count * PIXEL_RECORD_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) < 0) {
                throw new IOException("Unexpected end of file in " + path);
            }
        }
        buffer.flip();
        buffer.asIntBuffer().get(row, 0, count * PixelGrid.CHANNELS);
    }

    private static void write(OutputStream out, PixelGrid grid) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(grid.linesize() * PIXEL_RECORD_BYTES)
            .order(ByteOrder.LITTLE_ENDIAN);
        for (int line = 0; line < grid.lines(); line++) {
            buffer.clear();
            buffer.asIntBuffer().put(grid.row(line));
            out.write(buffer.array(), 0, buffer.capacity());
        }
    }
}
