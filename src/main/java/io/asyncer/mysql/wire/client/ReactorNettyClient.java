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

import io.asyncer.mysql.wire.ConnectionContext;
import io.asyncer.mysql.wire.SslConfiguration;
import io.asyncer.mysql.wire.message.client.ClientMessage;
import io.asyncer.mysql.wire.message.client.CommandMessage;
import io.asyncer.mysql.wire.message.server.RowMessage;
import io.asyncer.mysql.wire.message.server.ServerMessage;
import io.netty.buffer.ByteBufAllocator;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;
import io.r2dbc.spi.R2dbcException;
import org.jetbrains.annotations.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.publisher.SynchronousSink;
import reactor.netty.Connection;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * An implementation of client based on the Reactor Netty project.
 */
final class ReactorNettyClient implements Client {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(ReactorNettyClient.class);

    private static final int ST_CONNECTED = 0;

    private static final int ST_CLOSING = 1;

    private static final int ST_CLOSED = 2;

    private final AtomicInteger state = new AtomicInteger(ST_CONNECTED);

    private final Connection connection;

    private final ConnectionContext context;

    private final Sinks.Many<ClientMessage> requests = Sinks.many().unicast().onBackpressureBuffer();

    private final RequestQueue requestQueue = new RequestQueue();

    private final ResponseReceiver receiver;

    ReactorNettyClient(Connection connection, SslConfiguration ssl, ConnectionContext context) {
        requireNonNull(connection, "connection must not be null");
        requireNonNull(context, "context must not be null");
        requireNonNull(ssl, "ssl must not be null");

        this.connection = connection;
        this.context = context;
        this.receiver = new ResponseReceiver(this::handleError, this::handleClose);

        Sequencer sequencer = new Sequencer();

        // Note: encoder/decoder should before reactor bridge.
        connection.addHandlerLast(PacketDecoder.NAME, new PacketDecoder(sequencer, context.isDebug()))
            .addHandlerLast(MessageDuplexCodec.NAME, new MessageDuplexCodec(context, sequencer));

        if (ssl.getSslMode().startSsl()) {
            connection.addHandlerFirst(SslBridgeHandler.NAME, new SslBridgeHandler(context, ssl));
        }

        connection.inbound().receiveObject().subscribe(receiver);

        this.requests.asFlux()
            .concatMap(message -> {
                if (logger.isTraceEnabled()) {
                    logger.trace("Request: {}", message);
                }

                return connection.outbound().sendObject(message);
            })
            .onErrorResume(this::resumeError)
            .subscribe();
    }

    @Override
    public <T> Flux<T> exchange(ClientMessage request, BiConsumer<ServerMessage, SynchronousSink<T>> handler) {
        requireNonNull(request, "request must not be null");
        requireNonNull(handler, "handler must not be null");

        return Mono.<Flux<T>>create(sink -> {
            if (!isConnected()) {
                sink.error(ClientExceptions.exchangeClosed());
                return;
            }

            Flux<T> exchange;

            if (request.isResponded()) {
                exchange = responses(s -> emitRequest(request, s), handler);
            } else {
                exchange = Mono.<T>fromRunnable(() -> emitRequest(request, null))
                    .doAfterTerminate(requestQueue)
                    .flux();
            }

            requestQueue.submit(RequestTask.of(sink, exchange, null, requestQueue));
        }).flatMapMany(Function.identity());
    }

    @Override
    public <T> Flux<T> exchange(FluxExchangeable<T> exchangeable) {
        requireNonNull(exchangeable, "exchangeable must not be null");

        return Mono.<Flux<T>>create(sink -> {
            if (!isConnected()) {
                exchangeable.dispose();
                sink.error(ClientExceptions.exchangeClosed());
                return;
            }

            Flux<T> exchange = responses(s -> exchangeable.subscribe(message -> emitRequest(message, s), s::error),
                exchangeable)
                .doOnTerminate(exchangeable::dispose)
                .doOnCancel(exchangeable::dispose);

            requestQueue.submit(RequestTask.of(sink, exchange, exchangeable, requestQueue));
        }).flatMapMany(Function.identity());
    }

    @Override
    public Mono<Void> close() {
        return Mono.<Mono<Void>>create(sink -> {
            if (!state.compareAndSet(ST_CONNECTED, ST_CLOSING)) {
                logger.debug("Close request ignored for connection state {}", state.get());
                sink.success(connection.onDispose());
                return;
            }

            logger.debug("Close request accepted, sending COM_QUIT");

            Mono<Void> quit = Mono.fromRunnable(() -> emitRequest(CommandMessage.quit(), null))
                .then(connection.onDispose());

            requestQueue.submit(RequestTask.of(sink, quit, null, requestQueue));
        }).flatMap(Function.identity()).onErrorResume(e -> {
            logger.error("COM_QUIT sending failed, force closing", e);
            return forceClose();
        });
    }

    @Override
    public Mono<Void> forceClose() {
        return Mono.defer(() -> {
            if (state.getAndSet(ST_CLOSED) != ST_CLOSED) {
                logger.debug("Force closing connection {}", context.getConnectionId());
                connection.dispose();
            }

            return connection.onDispose();
        });
    }

    @Override
    public ByteBufAllocator getByteBufAllocator() {
        return connection.outbound().alloc();
    }

    @Override
    public ConnectionContext getContext() {
        return context;
    }

    @Override
    public boolean isConnected() {
        return state.get() < ST_CLOSED && connection.channel().isOpen();
    }

    @Override
    public void sslUnsupported() {
        connection.channel().pipeline().fireUserEventTriggered(SslState.UNSUPPORTED);
    }

    @Override
    public void loginSuccess() {
        if (logger.isDebugEnabled()) {
            logger.debug("Connection (id {}) login success", context.getConnectionId());
        }
    }

    @Override
    public String toString() {
        return "ReactorNettyClient(" + connection + "){connectionId=" + context.getConnectionId() + '}';
    }

    private <T> Flux<T> responses(Consumer<FluxSink<ServerMessage>> sender,
        BiConsumer<ServerMessage, SynchronousSink<T>> handler) {
        AtomicBoolean terminated = new AtomicBoolean();

        return Flux.<ServerMessage>create(sink -> {
                receiver.attach(sink);
                sender.accept(sink);
            })
            .handle(handler)
            .doOnTerminate(() -> {
                terminated.set(true);
                requestQueue.run();
            })
            .doOnCancel(() -> {
                if (terminated.compareAndSet(false, true)) {
                    // Rest of responses cannot be recognized by next exchange.
                    logger.warn("Exchange cancelled while responses are pending, force closing connection {}",
                        context.getConnectionId());
                    forceClose().subscribe();
                }
            })
            .doOnDiscard(RowMessage.class, RowMessage::release);
    }

    private void emitRequest(ClientMessage request, @Nullable FluxSink<?> sink) {
        Sinks.EmitResult result = requests.tryEmitNext(request);

        if (result != Sinks.EmitResult.OK) {
            IllegalStateException e = new IllegalStateException("Fail to emit a request due to " + result);

            if (sink == null) {
                throw e;
            }

            sink.error(e);
        }
    }

    private Mono<Void> resumeError(Throwable e) {
        handleError(e);

        return forceClose();
    }

    private void handleError(Throwable e) {
        R2dbcException error = ClientExceptions.wrap(e);

        logger.error("Connection {} broken by an error", context.getConnectionId(), error);
        state.set(ST_CLOSED);
        requestQueue.dispose(error);
        connection.dispose();
    }

    private void handleClose() {
        int previous = state.getAndSet(ST_CLOSED);

        if (previous == ST_CONNECTED) {
            logger.warn("Connection {} unexpectedly closed", context.getConnectionId());
            requestQueue.dispose(ClientExceptions.unexpectedClosed());
        } else {
            logger.debug("Connection {} closed", context.getConnectionId());
            requestQueue.dispose(ClientExceptions.expectedClosed());
        }
    }
}
