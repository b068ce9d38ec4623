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

package io.asyncer.mysql.wire;

import io.asyncer.mysql.wire.message.server.CompleteMessage;
import io.asyncer.mysql.wire.message.server.ServerMessage;
import org.jetbrains.annotations.Nullable;
import org.reactivestreams.Subscription;
import reactor.core.CoreSubscriber;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.publisher.Sinks;

import java.util.function.Consumer;

/**
 * A subscriber of the responses of a statement, it requests one message for each pull, so rows are read from
 * the transport only when the caller advances the result set.
 * <p>
 * After the first result is done, or the cursor is drained, it requests all remaining messages so that the
 * exchange can terminate and the next command can be sent.
 */
final class RowCursor implements CoreSubscriber<ServerMessage> {

    private final Consumer<RowCursor> onTerminate;

    private final Sinks.Empty<Void> terminated = Sinks.empty();

    @Nullable
    private Subscription subscription;

    @Nullable
    private MonoSink<ServerMessage> pending;

    private long earlyRequests;

    private boolean unbounded;

    private boolean done;

    @Nullable
    private Throwable error;

    private boolean errorObserved;

    RowCursor(Consumer<RowCursor> onTerminate) {
        this.onTerminate = onTerminate;
    }

    @Override
    public void onSubscribe(Subscription s) {
        long n;

        synchronized (this) {
            this.subscription = s;
            n = unbounded ? Long.MAX_VALUE : earlyRequests;
            earlyRequests = 0;
        }

        if (n > 0) {
            s.request(n);
        }
    }

    @Override
    public void onNext(ServerMessage message) {
        MonoSink<ServerMessage> sink;
        boolean drain = message instanceof CompleteMessage;

        synchronized (this) {
            sink = pending;
            pending = null;

            if (drain) {
                drain = !unbounded;
                unbounded = true;
            }
        }

        if (sink == null) {
            QueryFlow.release(message);
        } else {
            sink.success(message);
        }

        if (drain) {
            request(Long.MAX_VALUE);
        }
    }

    @Override
    public void onError(Throwable t) {
        MonoSink<ServerMessage> sink;

        synchronized (this) {
            sink = pending;
            pending = null;
            done = true;
            error = t;
            errorObserved = sink != null;
        }

        onTerminate.accept(this);

        if (sink != null) {
            sink.error(t);
        }

        terminated.tryEmitError(t);
    }

    @Override
    public void onComplete() {
        MonoSink<ServerMessage> sink;

        synchronized (this) {
            sink = pending;
            pending = null;
            done = true;
        }

        onTerminate.accept(this);

        if (sink != null) {
            sink.error(new IllegalStateException("Responses ended before the result is done"));
        }

        terminated.tryEmitEmpty();
    }

    /**
     * Pulls the next message of the first result.
     *
     * @return the message, or an error if the responses failed.
     */
    Mono<ServerMessage> pull() {
        return Mono.create(sink -> {
            Throwable failure = null;
            boolean ended = false;

            synchronized (this) {
                if (pending != null) {
                    failure = new IllegalStateException("Previous pull is still pending");
                } else if (error != null) {
                    failure = error;
                    errorObserved = true;
                } else if (done) {
                    ended = true;
                } else {
                    pending = sink;
                }
            }

            if (failure != null) {
                sink.error(failure);
            } else if (ended) {
                sink.error(new IllegalStateException("Responses have ended"));
            } else {
                sink.onCancel(() -> clearPending(sink));
                request(1);
            }
        });
    }

    /**
     * Discards the remaining messages.
     *
     * @return a {@link Mono} completes after the responses terminated, it emits the error of responses if it
     * has not been observed by any pull.
     */
    Mono<Void> drain() {
        boolean observed;

        synchronized (this) {
            observed = errorObserved;
        }

        request(Long.MAX_VALUE);

        Mono<Void> end = terminated.asMono();

        return observed ? end.onErrorResume(e -> Mono.empty()) : end;
    }

    /**
     * Cancels the responses, the transport will be closed if the responses are not terminated.
     */
    void cancel() {
        Subscription s;

        synchronized (this) {
            s = subscription;
        }

        if (s != null) {
            s.cancel();
        }
    }

    private void request(long n) {
        Subscription s;

        synchronized (this) {
            s = subscription;

            if (s == null) {
                if (n == Long.MAX_VALUE) {
                    unbounded = true;
                } else {
                    earlyRequests += n;
                }
                return;
            }
        }

        s.request(n);
    }

    private synchronized void clearPending(MonoSink<ServerMessage> sink) {
        if (pending == sink) {
            pending = null;
        }
    }
}
