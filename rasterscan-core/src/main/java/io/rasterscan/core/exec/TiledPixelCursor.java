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

package io.rasterscan.core.exec;

import io.rasterscan.core.model.PixelGrid;

/// Phase state machine for the index-tiled team.
///
/// {@link #advance()} is the barrier action: it runs on exactly one thread while
/// every worker is parked at the barrier, and performs the single-threaded step
/// of the next phase.
///
/// ```
///            ┌──────────────────────────────────────────────┐
///            ▼                                              │
///   CAPTURE_ORIGINAL ──▶ SEARCH_ORIGINAL ──▶ TRANSFORM ──▶ SEARCH_FINAL
///   (single: probe =     (team: tiles)      (single: bleed,  (team: tiles)
///    pixel, next pixel)                      transform,
///                                            probe = pixel)
/// ```
///
/// The probe and the tile claimer are written only by the barrier action and read
/// only between barriers, so the barrier publishes them to every worker.
final class TiledPixelCursor {

    enum Phase {
        CAPTURE_ORIGINAL,
        SEARCH_ORIGINAL,
        TRANSFORM,
        SEARCH_FINAL
    }

    private final PixelGrid grid;
    private final int[] rowOrder;
    private final ChunkSchedule schedule;
    private final int tiles;
    private final int workers;
    private final int chunk;

    private long step = -1;
    private Phase phase = Phase.CAPTURE_ORIGINAL;
    private volatile int probeRed;
    private volatile int probeGreen;
    private volatile int probeBlue;
    private volatile ChunkSchedule.WorkClaimer claimer;

    TiledPixelCursor(PixelGrid grid, int[] rowOrder, ChunkSchedule schedule, int tiles, int workers, int chunk) {
        this.grid = grid;
        this.rowOrder = rowOrder;
        this.schedule = schedule;
        this.tiles = tiles;
        this.workers = workers;
        this.chunk = chunk;
    }

    /// @return the number of pixels the team walks
    long totalPixels() {
        return (long) rowOrder.length * grid.linesize();
    }

    /// Runs the single-threaded step that leads into the next search phase.
    void advance() {
        switch (phase) {
            case CAPTURE_ORIGINAL:
            case SEARCH_FINAL:
                phase = Phase.CAPTURE_ORIGINAL;
                step++;
                capture();
                phase = Phase.SEARCH_ORIGINAL;
                break;
            case SEARCH_ORIGINAL:
                phase = Phase.TRANSFORM;
                RowPipeline.transformPixel(currentRow(), currentPixel());
                capture();
                phase = Phase.SEARCH_FINAL;
                break;
            default:
                throw new IllegalStateException("Unknown phase: " + phase);
        }
        claimer = schedule.newClaimer(tiles, workers, chunk);
    }

    private void capture() {
        int[] row = currentRow();
        int base = currentPixel() * PixelGrid.CHANNELS;
        probeRed = row[base];
        probeGreen = row[base + 1];
        probeBlue = row[base + 2];
    }

    private int[] currentRow() {
        return grid.row(rowOrder[(int) (step / grid.linesize())]);
    }

    private int currentPixel() {
        return (int) (step % grid.linesize());
    }

    int probeRed() {
        return probeRed;
    }

    int probeGreen() {
        return probeGreen;
    }

    int probeBlue() {
        return probeBlue;
    }

    ChunkSchedule.WorkClaimer claimer() {
        return claimer;
    }
}
