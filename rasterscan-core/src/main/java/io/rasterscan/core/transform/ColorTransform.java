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

/// Greyscale followed by XOR, applied to a single pixel.
public final class ColorTransform {

    /// The constant every channel is XORed with after greyscale.
    public static final int XOR_VALUE = 13;

    private ColorTransform() {
    }

    /// Replaces each channel of pixel `p` with `((r + g + b) / 3) ^ 13`.
    /// @param row the interleaved row storage
    /// @param p the pixel index
    public static void apply(int[] row, int p) {
        int base = p * PixelGrid.CHANNELS;
        int grey = greyscale(row[base], row[base + 1], row[base + 2]);
        int value = grey ^ XOR_VALUE;
        row[base] = value;
        row[base + 1] = value;
        row[base + 2] = value;
    }

    /// @param red the red channel
    /// @param green the green channel
    /// @param blue the blue channel
    /// @return the truncating integer mean of the channels
    public static int greyscale(int red, int green, int blue) {
        return (red + green + blue) / 3;
    }
}
