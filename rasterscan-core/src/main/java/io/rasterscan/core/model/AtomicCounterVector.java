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

import java.util.concurrent.atomic.AtomicLongArray;

/// Shared match counts updated with one atomic increment per match.
///
/// This is the contended accumulation style. It is only used as a reference to
/// check that private-accumulate-then-merge strategies count the same totals.
public final class AtomicCounterVector {

    private final AtomicLongArray counts;

    /// @param size the palette size
    public AtomicCounterVector(int size) {
        this.counts = new AtomicLongArray(size);
    }

    /// @param index the palette index to increment
    public void increment(int index) {
        counts.incrementAndGet(index);
    }

    /// @param index the palette index
    /// @return the current count
    public long get(int index) {
        return counts.get(index);
    }

    /// @return the number of palette indices
    public int size() {
        return counts.length();
    }
}
