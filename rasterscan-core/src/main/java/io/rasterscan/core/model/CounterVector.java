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

import java.util.Arrays;

/// Match counts indexed by palette entry.
///
/// A CounterVector is not thread safe. Workers each own a private instance for
/// the duration of their unit of work; the authoritative vector of a run is only
/// written by the merge step.
public final class CounterVector {

    private final long[] counts;

    /// @param size the palette size
    public CounterVector(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Counter size must not be negative: " + size);
        }
        this.counts = new long[size];
    }

    /// @param counts initial counts, copied
    /// @return a vector holding the counts
    public static CounterVector of(long... counts) {
        CounterVector vector = new CounterVector(counts.length);
        System.arraycopy(counts, 0, vector.counts, 0, counts.length);
        return vector;
    }

    /// @param index the palette index to increment
    public void increment(int index) {
        counts[index]++;
    }

    /// @param index the palette index to add to
    /// @param delta the amount to add
    public void add(int index, long delta) {
        counts[index] += delta;
    }

    /// @param index the palette index
    /// @return the count at the index
    public long get(int index) {
        return counts[index];
    }

    /// @return the number of palette indices
    public int size() {
        return counts.length;
    }

    /// @return the sum over all indices
    public long total() {
        long total = 0;
        for (long count : counts) {
            total += count;
        }
        return total;
    }

    /// @return a copy of the counts
    public long[] toArray() {
        return counts.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CounterVector)) return false;
        return Arrays.equals(counts, ((CounterVector) o).counts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        return Arrays.toString(counts);
    }
}
