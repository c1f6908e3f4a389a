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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// The ordered search set of target colors.
///
/// Entry order defines counter indices and report order. Channels are held in
/// three parallel arrays so the search loop touches only primitive memory.
/// Instances are immutable once built.
public final class Palette {

    private final int[] reds;
    private final int[] greens;
    private final int[] blues;

    private Palette(int[] reds, int[] greens, int[] blues) {
        this.reds = reds;
        this.greens = greens;
        this.blues = blues;
    }

    /// @param entries the palette entries in counter order
    /// @return a palette holding the entries
    public static Palette of(List<Pixel> entries) {
        int size = entries.size();
        int[] r = new int[size];
        int[] g = new int[size];
        int[] b = new int[size];
        for (int i = 0; i < size; i++) {
            Pixel pixel = entries.get(i);
            r[i] = pixel.red();
            g[i] = pixel.green();
            b[i] = pixel.blue();
        }
        return new Palette(r, g, b);
    }

    /// @param entries the palette entries in counter order
    /// @return a palette holding the entries
    public static Palette of(Pixel... entries) {
        return of(List.of(entries));
    }

    /// Takes every pixel of a grid in row-major order, padding included.
    /// @param grid a grid loaded from a search file
    /// @return a palette of the grid's pixels
    public static Palette fromGrid(PixelGrid grid) {
        List<Pixel> entries = new ArrayList<>((int) grid.length());
        for (int l = 0; l < grid.lines(); l++) {
            for (int p = 0; p < grid.linesize(); p++) {
                entries.add(grid.pixel(l, p));
            }
        }
        return of(entries);
    }

    /// @return an empty palette
    public static Palette empty() {
        return of(Collections.emptyList());
    }

    /// @return the number of entries
    public int size() {
        return reds.length;
    }

    /// @param index the entry index
    /// @return the entry at the index
    public Pixel get(int index) {
        return new Pixel(reds[index], greens[index], blues[index]);
    }

    /// @param index the entry index
    /// @param red the red channel to test
    /// @param green the green channel to test
    /// @param blue the blue channel to test
    /// @return true if the entry at the index has exactly these channel values
    public boolean matches(int index, int red, int green, int blue) {
        return reds[index] == red && greens[index] == green && blues[index] == blue;
    }

    /// @return the entries in order
    public List<Pixel> entries() {
        List<Pixel> list = new ArrayList<>(reds.length);
        for (int i = 0; i < reds.length; i++) {
            list.add(get(i));
        }
        return Collections.unmodifiableList(list);
    }
}
