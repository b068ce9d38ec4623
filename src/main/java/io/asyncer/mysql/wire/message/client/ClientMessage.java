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

package io.asyncer.mysql.wire.message.client;

import io.asyncer.mysql.wire.ConnectionContext;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import reactor.core.publisher.Mono;

/**
 * A request written to the server. The encoded payload is framed into packets by the transport.
 */
public interface ClientMessage {

    /**
     * Encodes the payload lazily, on subscription. The returned buffer is owned by the subscriber.
     *
     * @param allocator the allocator of the channel.
     * @param context   the session state, e.g. for capability-dependent fields.
     * @return the payload, without any packet header.
     * @throws IllegalArgumentException if {@code allocator} or {@code context} is {@code null}.
     */
    Mono<ByteBuf> encode(ByteBufAllocator allocator, ConnectionContext context);

    /**
     * Commands restart the sequence at {@code 0}; login responses continue the sequence of the handshake.
     *
     * @return {@code true} if this message starts a new sequence.
     */
    default boolean isSequenceReset() {
        return true;
    }

    /**
     * Fire-and-forget commands such as {@code COM_STMT_CLOSE} return {@code false}.
     *
     * @return {@code true} if the server sends a response.
     */
    default boolean isResponded() {
        return true;
    }
}
