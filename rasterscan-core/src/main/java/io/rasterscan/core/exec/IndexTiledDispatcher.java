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

import io.rasterscan.core.model.CounterVector;
import io.rasterscan.core.model.Palette;
import io.rasterscan.core.model.PixelGrid;
import io.rasterscan.core.search.MatchCounter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.concurrent.CyclicBarrier;

/**
 * Index-tiled, phase-parallel dispatch.
 *
 * <p>Pixels are visited strictly in row order by the whole team in lockstep. The palette
 * search for each pixel is split into tiles of {@code tileSize} indices, and the tiles are
 * claimed by the workers according to the configured {@link ChunkSchedule}. A
 * {@link CyclicBarrier} separates the phases; its barrier action runs the single-threaded
 * steps of {@link TiledPixelCursor}:
 *
 * <pre>{@code
 *   per pixel:
 *     barrier  -> capture original value           (one thread)
 *     search original value over claimed tiles    (all workers)
 *     barrier  -> bleed, transform, capture final  (one thread)
 *     search final value over claimed tiles       (all workers)
 * }</pre>
 *
 * <p>The next pixel's capture cannot start until every worker has reached the barrier,
 * so no worker ever reads a probe that is being rewritten. Each worker counts into its own
 * counter; the partial counters are merged once after the team finishes. A failed worker
 * resets the barrier, which releases every parked worker with a
 * {@link java.util.concurrent.BrokenBarrierException}. Grid writes only happen in the
 * barrier action, so once the team has stopped the grid is no longer touched.
 */
public final class IndexTiledDispatcher implements RowDispatcher {

    private static final Logger logger = LogManager.getLogger(IndexTiledDispatcher.class);

    private final DispatchConfig config;

    /**
     * @param config team size, tile schedule and tile size
     */
    public IndexTiledDispatcher(DispatchConfig config) {
        this.config = config;
    }

    @Override
    public List<CounterVector> dispatch(PixelGrid grid, Palette palette, int[] rowOrder) {
        int workers = config.threads();
        int tileSize = config.tileSize();
        int tiles = ChunkSchedule.ceilDiv(palette.size(), tileSize);

        TiledPixelCursor cursor = new TiledPixelCursor(
            grid, rowOrder, config.schedule(), tiles, workers, config.chunk());
        CyclicBarrier barrier = new CyclicBarrier(workers, cursor::advance);
        long pixels = cursor.totalPixels();
        logger.debug("Walking {} pixels with {} workers over {} tiles of {} indices",
            pixels, workers, tiles, tileSize);

        return WorkerTeam.run("tiles", workers, worker -> () -> {
            try {
                CounterVector local = new CounterVector(palette.size());
                for (long step = 0; step < pixels; step++) {
                    barrier.await();
                    searchTiles(cursor, palette, tileSize, worker, local);
                    barrier.await();
                    searchTiles(cursor, palette, tileSize, worker, local);
                }
                return local;
            } catch (RuntimeException | Error e) {
                // release the workers parked at the barrier
                barrier.reset();
                throw e;
            }
        });
    }

    private static void searchTiles(TiledPixelCursor cursor, Palette palette, int tileSize,
                                    int worker, CounterVector local) {
        int red = cursor.probeRed();
        int green = cursor.probeGreen();
        int blue = cursor.probeBlue();
        ChunkSchedule.WorkClaimer claimer = cursor.claimer();
        ChunkSchedule.WorkRange range;
        while ((range = claimer.next(worker)) != null) {
            int from = range.start() * tileSize;
            int to = (int) Math.min(palette.size(), (long) range.end() * tileSize);
            MatchCounter.count(palette, red, green, blue, local, from, to);
        }
    }

    @Override
    public DispatchStrategy strategy() {
        return DispatchStrategy.TILED;
    }

    @Override
    public int threads() {
        return config.threads();
    }
}
