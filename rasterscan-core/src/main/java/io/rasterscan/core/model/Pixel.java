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

package io.rasterscan.core.model;

/// A single red, green, blue triple.
///
/// Channel values are logically 8 bit but no range is enforced, so values outside
/// `[0,255]` read from a raw file are carried through unchanged.
///
/// @param red the red channel
/// @param green the green channel
/// @param blue the blue channel
public record Pixel(int red, int green, int blue) {

    /// The all-zero pixel used to pad trailing rows.
    public static final Pixel ZERO = new Pixel(0, 0, 0);

    /// Reads the pixel at index `p` of an interleaved row.
    /// @param row the interleaved row
    /// @param p the pixel index within the row
    /// @return the pixel value
    public static Pixel of(int[] row, int p) {
        int base = p * PixelGrid.CHANNELS;
        return new Pixel(row[base], row[base + 1], row[base + 2]);
    }
}
