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

import io.rasterscan.core.model.Palette;
import io.rasterscan.core.model.Pixel;
import io.rasterscan.core.model.PixelGrid;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// A worker that fails mid-run must stop the whole team before the dispatcher throws.
class DispatcherFailureTest {

    private static final int LINES = 600;
    private static final int LINESIZE = 300;

    private static PixelGrid largeGrid() {
        Random random = new Random(99);
        Pixel[] pixels = new Pixel[LINES * LINESIZE];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = new Pixel(random.nextInt(255), random.nextInt(255), random.nextInt(255));
        }
        return PixelGrid.of(pixels, LINESIZE);
    }

    private static Palette widePalette() {
        List<Pixel> entries = new ArrayList<>();
        for (int i = 0; i < 256; i++) {
            entries.add(new Pixel(i, i, i));
        }
        return Palette.of(entries);
    }

    /// Row 1 is handed out second and points past the grid, so its worker fails at once
    /// while the others still have most of their rows ahead of them.
    private static int[] orderWithBadSecondRow() {
        int[] order = RowPipeline.identityOrder(LINES);
        order[1] = LINES + 99_999;
        return order;
    }

    @ParameterizedTest
    @EnumSource(value = DispatchStrategy.class, names = {"ROWS", "TASKS", "TILED", "ATOMIC"})
    void gridIsNotWrittenAfterDispatchThrows(DispatchStrategy strategy) throws InterruptedException {
        PixelGrid grid = largeGrid();
        RowDispatcher dispatcher = strategy.create(
            DispatchConfig.withThreads(2).withSchedule(ChunkSchedule.STATIC, 1).withTileSize(16));

        assertThatThrownBy(() -> dispatcher.dispatch(grid, widePalette(), orderWithBadSecondRow()))
            .isInstanceOf(PipelineException.class);

        PixelGrid afterFailure = grid.copy();
        Thread.sleep(300);
        assertThat(grid.contentEquals(afterFailure))
            .as("%s workers kept writing the grid after the failure", strategy)
            .isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = DispatchStrategy.class, names = {"ROWS", "TASKS", "TILED", "ATOMIC"})
    void failureOnTheFirstRowReleasesEveryWorker(DispatchStrategy strategy) {
        RowDispatcher dispatcher = strategy.create(DispatchConfig.withThreads(3).withTileSize(1));
        PixelGrid grid = PixelGrid.of(new Pixel[]{
            new Pixel(1, 2, 3), new Pixel(4, 5, 6), new Pixel(7, 8, 9), new Pixel(10, 11, 12)
        }, 2);
        Palette palette = Palette.of(new Pixel(1, 2, 3), new Pixel(4, 5, 6), new Pixel(7, 8, 9));

        assertThatThrownBy(() -> dispatcher.dispatch(grid, palette, new int[]{7, 0}))
            .isInstanceOf(PipelineException.class)
            .hasMessageContaining("failed");
    }
}
