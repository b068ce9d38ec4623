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

package io.asyncer.mysql.wire.codec;

import io.asyncer.mysql.wire.api.MySqlColumnMetadata;
import io.asyncer.mysql.wire.constant.MySqlType;
import io.netty.buffer.ByteBuf;

import java.time.LocalDateTime;

/**
 * Codec for {@link LocalDateTime} of {@code DATETIME}, {@code TIMESTAMP} and {@code DATE}.
 */
final class LocalDateTimeCodec extends AbstractClassedCodec<LocalDateTime> {

    static final LocalDateTimeCodec INSTANCE = new LocalDateTimeCodec();

    private LocalDateTimeCodec() {
        super(LocalDateTime.class);
    }

    @Override
    public LocalDateTime decode(ByteBuf value, MySqlColumnMetadata metadata, Class<?> target, boolean binary) {
        return DateTimes.readDateTime(value, binary);
    }

    @Override
    public boolean canEncode(Object value) {
        return value instanceof LocalDateTime;
    }

    @Override
    public MySqlParameter encode(Object value) {
        return new LocalDateTimeMySqlParameter((LocalDateTime) value);
    }

    @Override
    protected boolean doCanDecode(MySqlColumnMetadata metadata) {
        MySqlType type = metadata.getType();

        return type.isDateTime() || type == MySqlType.DATE;
    }

    private static final class LocalDateTimeMySqlParameter implements MySqlParameter {

        private final LocalDateTime value;

        private LocalDateTimeMySqlParameter(LocalDateTime value) {
            this.value = value;
        }

        @Override
        public MySqlType getType() {
            return MySqlType.DATETIME;
        }

        @Override
        public void writeBinary(ByteBuf buf) {
            DateTimes.writeDateTime(buf, value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof LocalDateTimeMySqlParameter)) {
                return false;
            }

            return value.equals(((LocalDateTimeMySqlParameter) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }
}
