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

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Codec for {@link LocalDate}. The time part of {@code DATETIME} and {@code TIMESTAMP} is discarded.
 */
final class LocalDateCodec extends AbstractClassedCodec<LocalDate> {

    static final LocalDateCodec INSTANCE = new LocalDateCodec();

    private LocalDateCodec() {
        super(LocalDate.class);
    }

    @Override
    public LocalDate decode(ByteBuf value, MySqlColumnMetadata metadata, Class<?> target, boolean binary) {
        LocalDateTime dateTime = DateTimes.readDateTime(value, binary);

        return dateTime == null ? null : dateTime.toLocalDate();
    }

    @Override
    public boolean canEncode(Object value) {
        return value instanceof LocalDate;
    }

    @Override
    public MySqlParameter encode(Object value) {
        return new LocalDateMySqlParameter((LocalDate) value);
    }

    @Override
    protected boolean doCanDecode(MySqlColumnMetadata metadata) {
        MySqlType type = metadata.getType();

        return type == MySqlType.DATE || type.isDateTime();
    }

    private static final class LocalDateMySqlParameter implements MySqlParameter {

        private final LocalDate value;

        private LocalDateMySqlParameter(LocalDate value) {
            this.value = value;
        }

        @Override
        public MySqlType getType() {
            return MySqlType.DATE;
        }

        @Override
        public void writeBinary(ByteBuf buf) {
            DateTimes.writeDate(buf, value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof LocalDateMySqlParameter)) {
                return false;
            }

            return value.equals(((LocalDateMySqlParameter) o).value);
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
