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

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.resilience.api.CallContext;
import org.apache.resilience.api.ContextualCallable;
import org.apache.resilience.api.bulkhead.Bulkhead;
import org.apache.resilience.api.bulkhead.BulkheadDefinition;
import org.apache.resilience.exception.BulkheadFullException;
import org.apache.resilience.exception.BulkheadTimeoutException;
import org.apache.resilience.impl.metrics.ResilienceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fair semaphore bulkhead. The active and waiting counters are only informative, admission
 * relies on the semaphore alone.
 */
public class SemaphoreBulkhead implements Bulkhead {
    private static final Logger LOGGER = LoggerFactory.getLogger(SemaphoreBulkhead.class);

    // how often a blocked caller looks at its context
    private static final long CONTEXT_POLL = Duration.ofMillis(10).toNanos();

    private final BulkheadDefinition definition;
    private final String name;
    private final Semaphore semaphore;
    private final long maxWait;
    private final Lock countersLock = new ReentrantLock();
    private int active;
    private int waiting;

    private final ResilienceMetrics.Counter callsAccepted;
    private final ResilienceMetrics.Counter callsRejected;

    public SemaphoreBulkhead(final BulkheadDefinition definition) {
        this(definition, ResilienceMetrics.noop());
    }

    public SemaphoreBulkhead(final BulkheadDefinition definition, final ResilienceMetrics metrics) {
        this.definition = definition;
        this.name = definition.getName();
        this.semaphore = new Semaphore(definition.getMaxConcurrentExecutions(), true);
        this.maxWait = definition.getMaxWait().toNanos();

        final String metricsNameBase = "resilience.bulkhead." + name + ".";
        this.callsAccepted = metrics.counter(metricsNameBase + "callsAccepted.total",
                "Number of calls accepted by the bulkhead");
        this.callsRejected = metrics.counter(metricsNameBase + "callsRejected.total",
                "Number of calls rejected by the bulkhead");
        metrics.gauge(metricsNameBase + "concurrentExecutions", "Number of currently running executions",
                "none", () -> (long) getActiveCount());
        metrics.gauge(metricsNameBase + "waitingQueue.population", "Number of executions currently waiting in the queue",
                "none", () -> (long) getWaitingCount());
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public BulkheadDefinition getDefinition() {
        return definition;
    }

    @Override
    public <T> T execute(final Callable<T> callable) throws Exception {
        acquire(CallContext.background());
        try {
            return callable.call();
        } finally {
            release();
        }
    }

    @Override
    public <T> T executeWithContext(final CallContext context, final ContextualCallable<T> callable) throws Exception {
        acquire(context);
        try {
            return callable.call(context);
        } finally {
            release();
        }
    }

    @Override
    public int getActiveCount() {
        countersLock.lock();
        try {
            return active;
        } finally {
            countersLock.unlock();
        }
    }

    @Override
    public int getWaitingCount() {
        countersLock.lock();
        try {
            return waiting;
        } finally {
            countersLock.unlock();
        }
    }

    @Override
    public int getAvailableSlots() {
        return semaphore.availablePermits();
    }

    private void acquire(final CallContext context) throws InterruptedException {
        context.throwIfDone();
        if (maxWait == 0) {
            if (!semaphore.tryAcquire()) {
                reject();
                throw new BulkheadFullException(name);
            }
        } else {
            updateWaiting(1);
            try {
                if (!awaitSlot(context)) {
                    reject();
                    throw new BulkheadTimeoutException(name, definition.getMaxWait());
                }
            } finally {
                updateWaiting(-1);
            }
        }
        updateActive(1);
        callsAccepted.inc();
        definition.getListener().onAcquire(name);
    }

    private boolean awaitSlot(final CallContext context) throws InterruptedException {
        final long deadline = System.nanoTime() + maxWait;
        while (true) {
            final long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            if (semaphore.tryAcquire(Math.min(remaining, CONTEXT_POLL), NANOSECONDS)) {
                return true;
            }
            context.throwIfDone();
        }
    }

    private void release() {
        semaphore.release();
        updateActive(-1);
        definition.getListener().onRelease(name);
    }

    private void reject() {
        callsRejected.inc();
        LOGGER.debug("Bulkhead '{}' is full, rejecting call", name);
        definition.getListener().onFull(name);
    }

    private void updateActive(final int delta) {
        countersLock.lock();
        try {
            active += delta;
        } finally {
            countersLock.unlock();
        }
    }

    private void updateWaiting(final int delta) {
        countersLock.lock();
        try {
            waiting += delta;
        } finally {
            countersLock.unlock();
        }
    }

    @Override
    public String toString() {
        return "SemaphoreBulkhead{name='" + name + "', active=" + getActiveCount() + ", waiting=" + getWaitingCount() + '}';
    }
}
