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

import io.asyncer.mysql.wire.message.server.RowMessage;
import io.asyncer.mysql.wire.message.server.ServerMessage;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;
import io.r2dbc.spi.R2dbcException;
import org.jetbrains.annotations.Nullable;
import org.reactivestreams.Subscription;
import reactor.core.CoreSubscriber;
import reactor.core.publisher.FluxSink;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.function.Consumer;

/**
 * Receives the inbound messages of a connection and hands them to the active exchange. The demand of the
 * inbound is driven by the exchange and bounded by a prefetch, so a slow consumer keeps the rest of a large
 * result in the socket instead of memory.
 */
final class ResponseReceiver implements CoreSubscriber<Object> {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(ResponseReceiver.class);

    private static final int PREFETCH = 32;

    private final Queue<ServerMessage> pending = new ArrayDeque<>();

    private final Consumer<Throwable> onError;

    private final Runnable onComplete;

    @Nullable
    private Subscription upstream;

    @Nullable
    private FluxSink<ServerMessage> current;

    private long inFlight;

    @Nullable
    private R2dbcException terminal;

    private boolean done;

    ResponseReceiver(Consumer<Throwable> onError, Runnable onComplete) {
        this.onError = onError;
        this.onComplete = onComplete;
    }

    @Override
    public void onSubscribe(Subscription s) {
        synchronized (this) {
            this.upstream = s;
        }
    }

    @Override
    public void onNext(Object msg) {
        if (!(msg instanceof ServerMessage)) {
            logger.warn("Unknown message type {} on reading", msg.getClass());
            ReferenceCountUtil.release(msg);
            return;
        }

        ServerMessage message = (ServerMessage) msg;

        synchronized (this) {
            if (inFlight > 0) {
                --inFlight;
            }

            FluxSink<ServerMessage> sink = this.current;

            if (sink == null || !pending.isEmpty()) {
                pending.offer(message);
            } else {
                sink.next(message);
            }

            replenish();
        }
    }

    @Override
    public void onError(Throwable t) {
        R2dbcException error = ClientExceptions.wrap(t);
        FluxSink<ServerMessage> sink;

        synchronized (this) {
            if (done) {
                return;
            }

            done = true;
            terminal = error;
            sink = this.current;
            this.current = null;
            releasePending();
        }

        onError.accept(error);

        if (sink != null) {
            sink.error(error);
        }
    }

    @Override
    public void onComplete() {
        FluxSink<ServerMessage> sink;

        synchronized (this) {
            if (done) {
                return;
            }

            done = true;
            sink = this.current;
            this.current = null;
            releasePending();
        }

        onComplete.run();

        if (sink != null) {
            sink.error(ClientExceptions.unexpectedClosed());
        }
    }

    /**
     * Attaches the sink of an exchange, it receives the inbound messages until it is disposed.
     *
     * @param sink the sink of the exchange.
     */
    void attach(FluxSink<ServerMessage> sink) {
        synchronized (this) {
            if (done) {
                R2dbcException e = terminal;
                sink.error(e == null ? ClientExceptions.unexpectedClosed() : e);
                return;
            }

            this.current = sink;
        }

        sink.onRequest(n -> {
            synchronized (this) {
                if (current == sink) {
                    drain(sink);
                    replenish();
                }
            }
        });
        sink.onDispose(() -> {
            synchronized (this) {
                if (current == sink) {
                    current = null;
                }
            }
        });
    }

    private void drain(FluxSink<ServerMessage> sink) {
        while (sink.requestedFromDownstream() > 0) {
            ServerMessage message = pending.poll();

            if (message == null) {
                return;
            }

            sink.next(message);
        }
    }

    private void replenish() {
        FluxSink<ServerMessage> sink = this.current;
        Subscription s = this.upstream;

        if (sink == null || s == null || done || !pending.isEmpty()) {
            return;
        }

        long wanted = Math.min(sink.requestedFromDownstream(), PREFETCH);

        if (wanted > inFlight) {
            long n = wanted - inFlight;

            inFlight = wanted;
            s.request(n);
        }
    }

    private void releasePending() {
        ServerMessage message;

        while ((message = pending.poll()) != null) {
            if (message instanceof RowMessage) {
                ((RowMessage) message).release();
            }
        }
    }

    void cancel() {
        Subscription s;

        synchronized (this) {
            s = this.upstream;
        }

        if (s != null) {
            s.cancel();
        }
    }
}
