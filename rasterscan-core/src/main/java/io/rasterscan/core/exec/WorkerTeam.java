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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/// Runs a fixed team of workers for one pipeline run and joins them.
///
/// The pool lives only for the duration of {@link #run}. Results are collected in
/// completion order; the first failing worker cancels the rest of the team with
/// an interrupt and surfaces as a {@link PipelineException} once every worker has
/// stopped.
final class WorkerTeam {

    private static final Logger logger = LogManager.getLogger(WorkerTeam.class);

    static final long TERMINATION_TIMEOUT_SECONDS = 30;

    private WorkerTeam() {
    }

    /// @param name short team name used for thread names and messages
    /// @param workers number of workers
    /// @param factory creates the body of worker `w`
    /// @param <T> worker result type
    /// @return one result per worker, in completion order
    static <T> List<T> run(String name, int workers, IntFunction<Callable<T>> factory) {
        ExecutorService pool = Executors.newFixedThreadPool(workers, threadFactory(name));
        ExecutorCompletionService<T> completion = new ExecutorCompletionService<>(pool);
        try {
            for (int w = 0; w < workers; w++) {
                completion.submit(factory.apply(w));
            }
            List<T> results = new ArrayList<>(workers);
            for (int i = 0; i < workers; i++) {
                results.add(completion.take().get());
            }
            pool.shutdown();
            return results;
        } catch (ExecutionException e) {
            cancel(pool, name);
            logger.debug("{} worker failed, cancelled team of {}", name, workers);
            throw new PipelineException(name + " worker failed: " + e.getCause(), e.getCause());
        } catch (InterruptedException e) {
            cancel(pool, name);
            Thread.currentThread().interrupt();
            throw new PipelineException("Interrupted while waiting for " + name + " workers", e);
        } catch (RuntimeException | Error e) {
            cancel(pool, name);
            throw e;
        }
    }

    /// Throws if the calling worker's team has been cancelled. Workers call this
    /// before each row or chunk so that no row is started after the run has failed.
    ///
    /// @param name short team name used in the message
    /// @throws CancellationException if the current thread has been interrupted
    static void checkCancelled(String name) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException(name + " worker cancelled");
        }
    }

    /// Interrupts every worker and waits until none of them is still running, so the
    /// grid is no longer written once the failure reaches the caller.
    static void cancel(ExecutorService pool, String name) {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("{} workers still running {}s after cancellation", name,
                    TERMINATION_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static ThreadFactory threadFactory(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "rasterscan-" + name + "-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
