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

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * Base of the commands whose whole payload fits into a single buffer built on subscription, e.g. COM_QUERY
 * or COM_STMT_CLOSE.
 */
abstract class ScalarClientMessage implements ClientMessage {

    /**
     * Writes the payload, without the packet header.
     *
     * @param buf     the target buffer, released by the caller if this throws.
     * @param context the connection context.
     */
    protected abstract void writeTo(ByteBuf buf, ConnectionContext context);

    @Override
    public Mono<ByteBuf> encode(ByteBufAllocator allocator, ConnectionContext context) {
        requireNonNull(allocator, "allocator must not be null");
        requireNonNull(context, "context must not be null");

        return Mono.fromSupplier(() -> payload(allocator.buffer(), context));
    }

    private ByteBuf payload(ByteBuf buf, ConnectionContext context) {
        boolean written = false;

        try {
            writeTo(buf, context);
            written = true;
            return buf;
        } finally {
            if (!written) {
                buf.release();
            }
        }
    }
}
