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
import io.asyncer.mysql.wire.constant.ColumnDefinitions;
import io.asyncer.mysql.wire.constant.MySqlType;
import io.asyncer.mysql.wire.message.FieldValue;
import io.asyncer.mysql.wire.message.server.DefinitionMetadataMessage;
import io.netty.buffer.Unpooled;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * A result set which is created by the client rather than read from the server, e.g. the generated keys of
 * an insertion, or the empty result of a query which returns no rows. The rows use the text protocol.
 */
final class SyntheticResultSet extends AbstractResultSet {

    static final String GENERATED_KEY = "GENERATED_KEY";

    private static final DefinitionMetadataMessage[] GENERATED_KEY_COLUMNS = {
        DefinitionMetadataMessage.synthetic(GENERATED_KEY, MySqlType.BIGINT,
            (short) (ColumnDefinitions.NOT_NULL | ColumnDefinitions.UNSIGNED | ColumnDefinitions.AUTO_INCREMENT)),
    };

    private final long firstKey;

    private final long rows;

    private long cursor;

    private SyntheticResultSet(MySqlRowDescriptor descriptor, Codecs codecs, long firstKey, long rows) {
        super(descriptor, codecs, false);

        this.firstKey = firstKey;
        this.rows = rows;
    }

    @Override
    public Mono<Boolean> next() {
        return Mono.fromSupplier(() -> {
            requireOpen();

            if (cursor >= rows) {
                if (!isExhausted()) {
                    exhaust();
                }

                return false;
            }

            String key = Long.toUnsignedString(firstKey + cursor++);

            advance(new FieldValue[] { FieldValue.of(Unpooled.copiedBuffer(key, StandardCharsets.US_ASCII)) });

            return true;
        });
    }

    @Override
    public Mono<Void> close() {
        return Mono.fromRunnable(this::markClosed);
    }

    /**
     * Creates the generated keys of an insertion. MySQL reports the first key of the insertion, the others
     * are assumed to follow it one by one.
     *
     * @param codecs       the codecs.
     * @param lastInsertId the last insert id of the OK message, {@code 0} means no keys generated.
     * @param affectedRows the affected rows of the OK message.
     * @return the result set with the column {@code GENERATED_KEY}.
     */
    static SyntheticResultSet generatedKeys(Codecs codecs, long lastInsertId, long affectedRows) {
        long rows = lastInsertId == 0 ? 0 : affectedRows;

        return new SyntheticResultSet(MySqlRowDescriptor.create(GENERATED_KEY_COLUMNS), codecs, lastInsertId, rows);
    }

    static SyntheticResultSet empty(Codecs codecs) {
        return new SyntheticResultSet(MySqlRowDescriptor.create(new DefinitionMetadataMessage[0]), codecs, 0, 0);
    }
}
