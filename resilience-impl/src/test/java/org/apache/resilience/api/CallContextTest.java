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

package org.apache.resilience.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.resilience.exception.DeadlineExceededException;
import org.testng.annotations.Test;

public class CallContextTest {
    @Test
    public void backgroundIsNeverDone() throws Exception {
        final CallContext background = CallContext.background();
        assertThat(background.isDone()).isFalse();
        assertThat(background.cause()).isNull();
        assertThat(background.remaining()).isEmpty();
        assertThat(background.getParent()).isNull();
        background.throwIfDone();
        background.sleep(Duration.ofMillis(1));
        assertThatThrownBy(background::cancel).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    public void cancelPropagatesToChildren() {
        final CallContext parent = CallContext.cancellable();
        final CallContext child = parent.withCancel();
        final CallContext grandChild = child.withTimeout(Duration.ofMinutes(1));
        assertThat(grandChild.getParent()).isSameAs(child);

        parent.cancel();
        assertThat(child.isDone()).isTrue();
        assertThat(grandChild.isDone()).isTrue();
        assertThat(grandChild.cause()).isExactlyInstanceOf(CancellationException.class).isSameAs(parent.cause());
        assertThatThrownBy(grandChild::throwIfDone).isSameAs(parent.cause());
    }

    @Test
    public void cancellingChildLeavesParentAlive() {
        final CallContext parent = CallContext.cancellable();
        final CallContext child = parent.withCancel();
        child.cancel();
        assertThat(child.isDone()).isTrue();
        assertThat(parent.isDone()).isFalse();
    }

    @Test
    public void firstCauseWins() {
        final CallContext context = CallContext.cancellable();
        context.cancel();
        final CancellationException first = context.cause();
        context.cancel();
        assertThat(context.cause()).isSameAs(first);
    }

    @Test
    public void deadlineExpires() throws Exception {
        final CallContext context = CallContext.timeout(Duration.ofMillis(30));
        assertThat(context.remaining()).hasValueSatisfying(remaining ->
                assertThat(remaining).isLessThanOrEqualTo(Duration.ofMillis(30)));
        context.whenDone().get(5, TimeUnit.SECONDS);

        assertThat(context.cause()).isInstanceOf(DeadlineExceededException.class);
        assertThat(context.remaining()).contains(Duration.ZERO);
    }

    @Test
    public void childNeverOutlivesParentDeadline() {
        final CallContext parent = CallContext.timeout(Duration.ofMillis(50));
        final CallContext child = parent.withTimeout(Duration.ofHours(1));
        assertThat(child.remaining()).hasValueSatisfying(remaining ->
                assertThat(remaining).isLessThanOrEqualTo(Duration.ofMillis(50)));
    }

    @Test
    public void sleepStopsWhenDone() {
        final CallContext context = CallContext.timeout(Duration.ofMillis(50));
        final long start = System.nanoTime();
        assertThatThrownBy(() -> context.sleep(Duration.ofSeconds(30))).isInstanceOf(DeadlineExceededException.class);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    public void sleepReturnsAfterDelay() throws Exception {
        final CallContext context = CallContext.cancellable();
        context.sleep(Duration.ofMillis(20));
        assertThat(context.isDone()).isFalse();
    }

    @Test
    public void listenersRunOnceWhenDone() {
        final CallContext context = CallContext.cancellable();
        final AtomicInteger notified = new AtomicInteger();
        context.onDone(notified::incrementAndGet);
        final CallContext.Registration detached = context.onDone(notified::incrementAndGet);
        detached.close();
        assertThat(context.getPendingListenerCount()).isEqualTo(1);

        context.cancel();
        context.cancel();
        assertThat(notified).hasValue(1);
        assertThat(context.getPendingListenerCount()).isZero();

        context.onDone(notified::incrementAndGet);
        assertThat(notified).hasValue(2);
        assertThat(context.getPendingListenerCount()).isZero();
    }

    @Test
    public void backgroundKeepsNoListener() {
        final CallContext background = CallContext.background();
        background.onDone(() -> {
            throw new IllegalStateException("never done");
        }).close();
        final CompletableFuture<Void> done = background.whenDone();
        assertThat(done).isNotDone();
        assertThat(background.getPendingListenerCount()).isZero();
    }

    @Test
    public void cancelledWaiterDetachesFromContext() {
        final CallContext context = CallContext.cancellable();
        final CompletableFuture<Void> done = context.whenDone();
        assertThat(context.getPendingListenerCount()).isEqualTo(1);
        done.cancel(false);
        assertThat(context.getPendingListenerCount()).isZero();
    }

    @Test
    public void finishedChildrenDetachFromParent() throws Exception {
        final CallContext parent = CallContext.cancellable();
        for (int i = 0; i < 1_000; i++) {
            parent.withCancel().cancel();
        }
        final CallContext expiring = parent.withTimeout(Duration.ofMillis(10));
        expiring.whenDone().get(5, TimeUnit.SECONDS);
        assertThat(parent.getPendingListenerCount()).isZero();
        assertThat(parent.isDone()).isFalse();

        final CallContext live = parent.withCancel();
        assertThat(parent.getPendingListenerCount()).isEqualTo(1);
        parent.cancel();
        assertThat(live.isDone()).isTrue();
        assertThat(parent.getPendingListenerCount()).isZero();
    }

    @Test
    public void rejectsNegativeTimeout() {
        assertThatThrownBy(() -> CallContext.timeout(Duration.ofMillis(-1))).isInstanceOf(IllegalArgumentException.class);
    }
}
