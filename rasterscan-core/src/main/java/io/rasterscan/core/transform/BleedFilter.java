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

import io.rasterscan.core.model.PixelGrid;

/// Left-to-right bleed blur within one row.
///
/// For pixel `p > 0` the window is `[max(0, p - 10), p)`. Each channel moves a
/// third of the way toward the window's integer mean:
///
/// ```
/// mean = sum(window) / windowLength          (int division)
/// value = value + (mean - value) / 3          (int division, truncates toward zero)
/// ```
///
/// The window holds the current values of the pixels to the left, which in a
/// left-to-right pass are already bled and color transformed. This is a strict
/// sequential dependency: pixel `p` must not be processed before every pixel to
/// its left in the same row.
public final class BleedFilter {

    /// Maximum number of pixels to the left that contribute to the mean.
    public static final int WINDOW = 10;

    private BleedFilter() {
    }

    /// @param p the pixel index within its row
    /// @return the number of pixels averaged for the pixel, 0 for the first pixel
    public static int windowLength(int p) {
        return p - windowStart(p);
    }

    /// @param p the pixel index within its row
    /// @return the first index of the averaging window
    public static int windowStart(int p) {
        return Math.max(0, p - WINDOW);
    }

    /// Bleeds pixel `p` of an interleaved row in place.
    /// @param row the interleaved row storage
    /// @param p the pixel index
    public static void apply(int[] row, int p) {
        if (p == 0) {
            return;
        }
        int start = windowStart(p);
        int len = p - start;

        int rav = 0;
        int gav = 0;
        int bav = 0;
        for (int i = start * PixelGrid.CHANNELS, end = p * PixelGrid.CHANNELS; i < end; i += PixelGrid.CHANNELS) {
            rav += row[i];
            gav += row[i + 1];
            bav += row[i + 2];
        }
        rav /= len;
        gav /= len;
        bav /= len;

        int base = p * PixelGrid.CHANNELS;
        row[base] += (rav - row[base]) / 3;
        row[base + 1] += (gav - row[base + 1]) / 3;
        row[base + 2] += (bav - row[base + 2]) / 3;
    }
}
