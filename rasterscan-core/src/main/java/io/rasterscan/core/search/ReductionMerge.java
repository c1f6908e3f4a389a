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

package io.rasterscan.core.search;

import io.rasterscan.core.model.AtomicCounterVector;
import io.rasterscan.core.model.CounterVector;

import java.util.Collection;

/**
 * Combines worker-private partial counters into one authoritative vector.
 *
 * <p>Two merge styles are offered:
 * <ul>
 *   <li>{@link #merge(Collection, int)} sums all partials on the calling thread. It must only
 *   be called after every producer has been joined.</li>
 *   <li>{@link #accumulate(CounterVector, CounterVector)} adds one partial into a shared master
 *   while holding the master's monitor, so workers can merge at their own completion.</li>
 * </ul>
 *
 * <p>Addition is commutative and associative, so the merged result does not depend on the
 * order partials arrive in.
 */
public final class ReductionMerge {

    private ReductionMerge() {
    }

    /**
     * Sums partial counters after a join.
     *
     * @param partials the worker-private counters
     * @param size the palette size
     * @return a new vector with {@code merged[i] = sum(partial[i])}
     * @throws IllegalArgumentException if a partial has a different size
     */
    public static CounterVector merge(Collection<CounterVector> partials, int size) {
        CounterVector merged = new CounterVector(size);
        for (CounterVector partial : partials) {
            addInto(merged, partial);
        }
        return merged;
    }

    /**
     * Adds one partial counter into a shared master under the master's lock.
     *
     * @param master the shared counter
     * @param partial a finished worker-private counter
     * @throws IllegalArgumentException if the sizes differ
     */
    public static void accumulate(CounterVector master, CounterVector partial) {
        synchronized (master) {
            addInto(master, partial);
        }
    }

    /**
     * Copies the final state of a contended counter. Callers must have joined all writers.
     *
     * @param shared the atomically updated counter
     * @return a plain vector with the same counts
     */
    public static CounterVector snapshot(AtomicCounterVector shared) {
        CounterVector vector = new CounterVector(shared.size());
        for (int i = 0; i < shared.size(); i++) {
            vector.add(i, shared.get(i));
        }
        return vector;
    }

    private static void addInto(CounterVector target, CounterVector partial) {
        if (partial.size() != target.size()) {
            throw new IllegalArgumentException(
                "Counter size mismatch. Expected: " + target.size() + ", Got: " + partial.size());
        }
        for (int i = 0; i < partial.size(); i++) {
            long count = partial.get(i);
            if (count != 0) {
                target.add(i, count);
            }
        }
    }
}
