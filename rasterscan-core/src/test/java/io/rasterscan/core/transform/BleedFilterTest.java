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


package io.rasterscan.core.transform;

import io.rasterscan.core.model.Pixel;
import io.rasterscan.core.model.PixelGrid;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BleedFilterTest {

    @Test
    void firstPixelIsUnchanged() {
        int[] row = {200, 50, 0, 10, 10, 10};
        BleedFilter.apply(row, 0);
        assertThat(row).containsExactly(200, 50, 0, 10, 10, 10);
        assertThat(BleedFilter.windowLength(0)).isZero();
    }

    @Test
    void windowGrowsUpToTenPixels() {
        for (int p = 1; p < 10; p++) {
            assertThat(BleedFilter.windowLength(p)).isEqualTo(p);
            assertThat(BleedFilter.windowStart(p)).isZero();
        }
        assertThat(BleedFilter.windowLength(10)).isEqualTo(10);
        assertThat(BleedFilter.windowStart(10)).isZero();
        assertThat(BleedFilter.windowLength(11)).isEqualTo(10);
        assertThat(BleedFilter.windowStart(11)).isEqualTo(1);
        assertThat(BleedFilter.windowLength(500)).isEqualTo(10);
    }

    @Test
    void movesAThirdOfTheWayTowardTheWindowMean() {
        int[] row = {7, 7, 7, 200, 50, 0};
        BleedFilter.apply(row, 1);
        // 200 + (7 - 200) / 3 = 136, 50 + (7 - 50) / 3 = 36, 0 + 7 / 3 = 2
        assertThat(Pixel.of(row, 1)).isEqualTo(new Pixel(136, 36, 2));
    }

    @Test
    void pixelsBeyondTheWindowDoNotContribute() {
        int[] row = new int[12 * PixelGrid.CHANNELS];
        // pixel 0 is outside the window of pixel 11 and would pull the mean up
        row[0] = 900;
        row[1] = 900;
        row[2] = 900;
        for (int p = 1; p < 11; p++) {
            row[p * 3] = 30;
            row[p * 3 + 1] = 30;
            row[p * 3 + 2] = 30;
        }
        BleedFilter.apply(row, 11);
        assertThat(Pixel.of(row, 11)).isEqualTo(new Pixel(10, 10, 10));
    }

    @Test
    void meanAndStepTruncate() {
        int[] row = {1, 1, 1, 2, 2, 2, 0, 0, 0};
        BleedFilter.apply(row, 2);
        // mean (1 + 2) / 2 = 1, step (1 - 0) / 3 = 0
        assertThat(Pixel.of(row, 2)).isEqualTo(Pixel.ZERO);
    }
}
