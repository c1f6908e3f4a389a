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

import java.util.List;

/// Processes rows one after another on the calling thread.
public final class SequentialDispatcher implements RowDispatcher {

    @Override
    public List<CounterVector> dispatch(PixelGrid grid, Palette palette, int[] rowOrder) {
        CounterVector counter = new CounterVector(palette.size());
        for (int line : rowOrder) {
            RowPipeline.processRow(grid.row(line), palette, counter);
        }
        return List.of(counter);
    }

    @Override
    public DispatchStrategy strategy() {
        return DispatchStrategy.SEQUENTIAL;
    }

    @Override
    public int threads() {
        return 1;
    }
}
