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
import io.asyncer.mysql.wire.message.server.ServerMessage;
import io.netty.buffer.ByteBufAllocator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SynchronousSink;
import reactor.netty.tcp.TcpClient;

import java.util.function.BiConsumer;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * The transport of one server session. Requests are exchanged strictly one after another; a second
 * exchange subscribed while the first is running waits in a queue.
 */
public interface Client {

    /**
     * Opens a TCP session to the server. Nothing is sent until the login exchange runs.
     *
     * @param tcpClient the configured TCP client
     * @param ssl       the TLS settings, used when the login upgrades the session
     * @param context   the per-session state
     * @return the connected client
     * @throws IllegalArgumentException if any argument is {@code null}
     */
    static Mono<Client> connect(TcpClient tcpClient, SslConfiguration ssl, ConnectionContext context) {
        requireNonNull(tcpClient, "tcpClient must not be null");
        requireNonNull(ssl, "ssl must not be null");
        requireNonNull(context, "context must not be null");

        return tcpClient.connect().map(conn -> new ReactorNettyClient(conn, ssl, context));
    }

    /**
     * Sends one command and maps its response packets through {@code handler}. The handler completes the
     * sink on the packet that ends the response; packets are read only as fast as the result is consumed.
     * Cancelling the result before that point closes the session since the remaining packets can no longer
     * be told apart from the next response.
     *
     * @param request the command
     * @param handler maps each response packet, completing the sink on the last one
     * @param <T>     the mapped type
     * @return the mapped response
     */
    <T> Flux<T> exchange(ClientMessage request, BiConsumer<ServerMessage, SynchronousSink<T>> handler);

    /**
     * Runs a conversation of several requests, e.g. the login or a prepare-execute-close round.
     *
     * @param exchangeable produces requests and consumes responses
     * @param <T>          the mapped type
     * @return the mapped responses
     */
    <T> Flux<T> exchange(FluxExchangeable<T> exchangeable);

    /**
     * Sends {@code COM_QUIT} and completes once the server has closed the socket. Only valid after login.
     *
     * @return completes when the session is gone
     */
    Mono<Void> close();

    /**
     * Drops the socket without saying goodbye, used after a failed login or a broken exchange.
     *
     * @return completes when the session is gone
     */
    Mono<Void> forceClose();

    boolean isConnected();

    ByteBufAllocator getByteBufAllocator();

    ConnectionContext getContext();

    /**
     * Tells the transport that the server refused TLS and the login goes on in plaintext.
     */
    void sslUnsupported();

    void loginSuccess();
}
