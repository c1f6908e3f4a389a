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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ColorTransformTest {

    @Test
    void greyscaleThenXor() {
        int[] row = {136, 36, 2};
        ColorTransform.apply(row, 0);
        // (136 + 36 + 2) / 3 = 58, 58 ^ 13 = 55
        assertThat(Pixel.of(row, 0)).isEqualTo(new Pixel(55, 55, 55));
    }

    @Test
    void onlyTheAddressedPixelChanges() {
        int[] row = {10, 10, 10, 1, 2, 3};
        ColorTransform.apply(row, 1);
        assertThat(row).containsExactly(10, 10, 10, 2 ^ ColorTransform.XOR_VALUE, 2 ^ 13, 2 ^ 13);
    }

    @Test
    void greyscaleTruncates() {
        assertThat(ColorTransform.greyscale(1, 1, 0)).isZero();
        assertThat(ColorTransform.greyscale(255, 255, 254)).isEqualTo(254);
    }
}
