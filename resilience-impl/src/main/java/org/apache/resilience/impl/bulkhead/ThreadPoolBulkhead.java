/*
 *  Licensed to the Apache Software Foundation (ASF) under one
 *  or more contributor license agreements.  See the NOTICE file
 *  distributed with this work for additional information
 *  regarding copyright ownership.  The ASF licenses this file
 *  to you under the Apache License, Version 2.0 (the
 *  "License"); you may not use this file except in compliance
 *  with the License.  You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing,
 *  software distributed under the License is distributed on an
 *  "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 *  KIND, either express or implied.  See the License for the
 *  specific language governing permissions and limitations
 *  under the License.
 */

package org.apache.resilience.impl.bulkhead;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.apache.resilience.api.CallContext;
import org.apache.resilience.api.ContextualCallable;
import org.apache.resilience.exception.BulkheadFullException;
import org.apache.resilience.impl.metrics.ResilienceMetrics;
import org.apache.resilience.impl.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bulkhead running tasks on its own fixed set of workers, with a bounded backlog. Submitting
 * never blocks: a full backlog rejects the task with {@link BulkheadFullException}.
 */
public class ThreadPoolBulkhead implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ThreadPoolBulkhead.class);

    static final int DEFAULT_MAX_WORKERS = 10;
    static final int DEFAULT_MAX_QUEUE = 100;

    private final String name;
    private final BlockingQueue<Runnable> workQueue;
    private final ThreadPoolExecutor threadPoolExecutor;

    private final ResilienceMetrics.Counter callsAccepted;
    private final ResilienceMetrics.Counter callsRejected;

    public ThreadPoolBulkhead(final String name) {
        this(name, DEFAULT_MAX_WORKERS, DEFAULT_MAX_QUEUE);
    }

    public ThreadPoolBulkhead(final String name, final int maxWorkers, final int maxQueue) {
        this(name, maxWorkers, maxQueue, ResilienceMetrics.noop());
    }

    /**
     * Non-positive sizes fall back to 10 workers and a backlog of 100 tasks.
     */
    public ThreadPoolBulkhead(final String name, final int maxWorkers, final int maxQueue,
                              final ResilienceMetrics metrics) {
        this.name = name;
        final int workers = maxWorkers <= 0 ? DEFAULT_MAX_WORKERS : maxWorkers;
        this.workQueue = new ArrayBlockingQueue<>(maxQueue <= 0 ? DEFAULT_MAX_QUEUE : maxQueue);
        this.threadPoolExecutor = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS, workQueue,
                new NamedThreadFactory("resilience-bulkhead-" + name + "-"), (task, executor) -> {
                    if (executor.isShutdown()) {
                        throw new RejectedExecutionException("bulkhead '" + name + "' is stopped");
                    }
                    throw new BulkheadFullException(name);
                });
        this.threadPoolExecutor.prestartAllCoreThreads();

        final String metricsNameBase = "resilience.bulkhead." + name + ".";
        this.callsAccepted = metrics.counter(metricsNameBase + "callsAccepted.total",
                "Number of tasks accepted by the bulkhead");
        this.callsRejected = metrics.counter(metricsNameBase + "callsRejected.total",
                "Number of tasks rejected by the bulkhead");
        metrics.gauge(metricsNameBase + "concurrentExecutions", "Number of currently running tasks", "none",
                () -> (long) getActiveCount());
        metrics.gauge(metricsNameBase + "waitingQueue.population", "Number of tasks waiting for a worker", "none",
                () -> (long) getQueuedCount());
    }

    public String getName() {
        return name;
    }

    public Future<?> submit(final Runnable task) {
        final FutureTask<Void> futureTask = new FutureTask<>(task, null);
        enqueue(futureTask);
        return futureTask;
    }

    /**
     * Submits {@code task} and waits for its result. When {@code context} is done first, the
     * task is cancelled (interrupting it if it already runs) and the context's error is thrown.
     */
    public <T> T submitWait(final CallContext context, final ContextualCallable<T> task) throws Exception {
        context.throwIfDone();
        final CompletableFuture<Void> finished = new CompletableFuture<>();
        final FutureTask<T> futureTask = new FutureTask<T>(() -> task.call(context)) {
            @Override
            protected void done() {
                finished.complete(null);
            }
        };
        enqueue(futureTask);

        try (CallContext.Registration ignored = context.onDone(() -> finished.complete(null))) {
            finished.get();
        } catch (final InterruptedException e) {
            futureTask.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        }

        if (!futureTask.isDone()) {
            futureTask.cancel(true);
            throw context.cause();
        }
        try {
            return futureTask.get();
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    public int getActiveCount() {
        return threadPoolExecutor.getActiveCount();
    }

    public int getQueuedCount() {
        return workQueue.size();
    }

    /**
     * Stops accepting tasks, lets the queued ones run and waits for every worker to finish.
     */
    public void stop() {
        threadPoolExecutor.shutdown();
        try {
            while (!threadPoolExecutor.awaitTermination(1, TimeUnit.MINUTES)) {
                LOGGER.info("Bulkhead '{}' still has {} running tasks and {} queued ones",
                        name, getActiveCount(), getQueuedCount());
            }
        } catch (final InterruptedException e) {
            LOGGER.warn("Interrupted while stopping bulkhead '{}'", name);
            Thread.currentThread().interrupt();
        }
    }

    public boolean isStopped() {
        return threadPoolExecutor.isTerminated();
    }

    @Override
    public void close() {
        stop();
    }

    private void enqueue(final FutureTask<?> task) {
        try {
            threadPoolExecutor.execute(task);
            callsAccepted.inc();
        } catch (final BulkheadFullException e) {
            callsRejected.inc();
            LOGGER.debug("Bulkhead '{}' queue is full, rejecting task", name);
            throw e;
        }
    }
}
