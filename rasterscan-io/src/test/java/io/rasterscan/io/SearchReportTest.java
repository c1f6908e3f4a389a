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

import io.rasterscan.core.model.CounterVector;
import io.rasterscan.core.model.Palette;
import io.rasterscan.core.model.Pixel;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchReportTest {

    @Test
    void channelsArePaddedToThreeColumns() {
        assertThat(SearchReport.formatLine(new Pixel(10, 10, 10), 2)).isEqualTo("** ( 10, 10, 10) = 2");
        assertThat(SearchReport.formatLine(new Pixel(255, 0, 7), 12345)).isEqualTo("** (255,  0,  7) = 12345");
    }

    @Test
    void negativeChannelsTakeBothPaddingSpaces() {
        assertThat(SearchReport.formatLine(new Pixel(-5, -50, 7), 1)).isEqualTo("** (  -5,  -50,  7) = 1");
        assertThat(SearchReport.formatLine(new Pixel(1234, 99, -100), 0)).isEqualTo("** (1234, 99,  -100) = 0");
    }

    @Test
    void printsHeaderThenOneLinePerEntry() {
        Palette palette = Palette.of(new Pixel(1, 2, 3), new Pixel(100, 200, 250));
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        SearchReport.print(new PrintStream(bytes, true, StandardCharsets.UTF_8), palette, CounterVector.of(4, 0));

        assertThat(bytes.toString(StandardCharsets.UTF_8).lines()).containsExactly(
            "Search Results:",
            "** (  1,  2,  3) = 4",
            "** (100,200,250) = 0");
    }

    @Test
    void counterSizeMustMatchPalette() {
        assertThatThrownBy(() -> SearchReport.format(Palette.of(new Pixel(1, 1, 1)), CounterVector.of(1, 2)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void gridRowsPrintAsTriples() {
        assertThat(PixelGridPrinter.formatRow(new int[]{7, 7, 7, 55, 55, 55}))
            .isEqualTo("(  7,  7,  7) ( 55, 55, 55) ");
        assertThat(PixelGridPrinter.formatRow(new int[]{-1, 300, 9}))
            .isEqualTo("(  -1,300,  9) ");
    }
}
