/*
 * Copyright 2023 asyncer.io projects
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.asyncer.mysql.wire.client;

import org.jetbrains.annotations.Nullable;
import reactor.core.Disposable;
import reactor.core.publisher.MonoSink;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * A queued exchange. Running it hands the prepared exchange to the subscriber, which then owns the request
 * resources. A task cancelled before running releases the resources itself.
 */
final class RequestTask {

    private static final int QUEUED = 0;

    private static final int RUNNING = 1;

    private static final int CANCELLED = 2;

    private final AtomicInteger state = new AtomicInteger(QUEUED);

    private final Runnable start;

    private final Runnable release;

    private final Runnable next;

    private final Consumer<Throwable> error;

    private RequestTask(Runnable start, Runnable release, Runnable next, Consumer<Throwable> error) {
        this.start = start;
        this.release = release;
        this.next = next;
        this.error = error;
    }

    /**
     * Runs this task, or the next one if it has been cancelled by the subscriber.
     */
    void run() {
        if (state.compareAndSet(QUEUED, RUNNING)) {
            start.run();
        } else {
            next.run();
        }
    }

    /**
     * Cancels this task because the connection has been closed or broken.
     *
     * @param e the reason.
     */
    void cancel(Throwable e) {
        if (state.compareAndSet(QUEUED, CANCELLED)) {
            release.run();
            error.accept(e);
        }
    }

    boolean isCancelled() {
        return state.get() == CANCELLED;
    }

    private void onSubscriberCancel() {
        if (state.compareAndSet(QUEUED, CANCELLED)) {
            release.run();
        } else if (state.compareAndSet(RUNNING, CANCELLED)) {
            // The exchange will never be subscribed, the queue must move on.
            release.run();
            next.run();
        }
    }

    /**
     * Creates a task that emits the {@code exchange} to {@code sink} when it is the turn.
     *
     * @param sink      the sink waiting for the exchange.
     * @param exchange  the exchange.
     * @param resources the resources of requests, or {@code null} if none.
     * @param next      runs the next task of the queue.
     * @param <T>       the type of the exchange.
     * @return the task.
     */
    static <T> RequestTask of(MonoSink<T> sink, T exchange, @Nullable Disposable resources, Runnable next) {
        Runnable release = resources == null ? () -> { } : resources::dispose;
        RequestTask task = new RequestTask(() -> sink.success(exchange), release, next, sink::error);

        sink.onCancel(task::onSubscriberCancel);

        return task;
    }
}
