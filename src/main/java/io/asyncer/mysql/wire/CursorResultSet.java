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

import io.asyncer.mysql.wire.codec.Codecs;
import io.asyncer.mysql.wire.message.FieldValue;
import io.asyncer.mysql.wire.message.server.CompleteMessage;
import io.asyncer.mysql.wire.message.server.RowMessage;
import io.asyncer.mysql.wire.message.server.ServerMessage;
import reactor.core.publisher.Mono;

/**
 * A result set which reads rows from the connection lazily, each {@link #next()} reads one row.
 */
final class CursorResultSet extends AbstractResultSet {

    private final RowCursor cursor;

    private final ReadTimeout timeout;

    CursorResultSet(MySqlRowDescriptor descriptor, Codecs codecs, boolean binary, RowCursor cursor,
        ReadTimeout timeout) {
        super(descriptor, codecs, binary);

        this.cursor = cursor;
        this.timeout = timeout;
    }

    @Override
    public Mono<Boolean> next() {
        return Mono.defer(() -> {
            requireOpen();

            if (isExhausted()) {
                return Mono.just(false);
            }

            return timeout.apply(cursor.pull()).map(this::accept);
        });
    }

    @Override
    public Mono<Void> close() {
        return Mono.defer(() -> markClosed() ? timeout.apply(cursor.drain()) : Mono.empty());
    }

    private boolean accept(ServerMessage message) {
        if (message instanceof RowMessage) {
            RowMessage row = (RowMessage) message;
            FieldValue[] values;

            try {
                values = row.decode(isBinary(), types());
            } finally {
                row.release();
            }

            advance(values);

            return true;
        }

        if (message instanceof CompleteMessage) {
            exhaust();
            return false;
        }

        QueryFlow.release(message);

        throw new IllegalStateException("Unexpected message " + message.getClass().getSimpleName() +
            " in the result set");
    }
}
