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
import java.time.LocalTime;

/**
 * Codec for {@link LocalTime}. A {@code TIME} which is negative or not less than 24 hours can not be decoded.
 */
final class LocalTimeCodec extends AbstractClassedCodec<LocalTime> {

    static final LocalTimeCodec INSTANCE = new LocalTimeCodec();

    private LocalTimeCodec() {
        super(LocalTime.class);
    }

    @Override
    public LocalTime decode(ByteBuf value, MySqlColumnMetadata metadata, Class<?> target, boolean binary) {
        if (metadata.getType() == MySqlType.TIME) {
            return DateTimes.readTime(value, binary);
        }

        LocalDateTime dateTime = DateTimes.readDateTime(value, binary);

        return dateTime == null ? null : dateTime.toLocalTime();
    }

    @Override
    public boolean canEncode(Object value) {
        return value instanceof LocalTime;
    }

    @Override
    public MySqlParameter encode(Object value) {
        return new LocalTimeMySqlParameter((LocalTime) value);
    }

    @Override
    protected boolean doCanDecode(MySqlColumnMetadata metadata) {
        MySqlType type = metadata.getType();

        return type == MySqlType.TIME || type.isDateTime();
    }

    private static final class LocalTimeMySqlParameter implements MySqlParameter {

        private final LocalTime value;

        private LocalTimeMySqlParameter(LocalTime value) {
            this.value = value;
        }

        @Override
        public MySqlType getType() {
            return MySqlType.TIME;
        }

        @Override
        public void writeBinary(ByteBuf buf) {
            DateTimes.writeTime(buf, value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof LocalTimeMySqlParameter)) {
                return false;
            }

            return value.equals(((LocalTimeMySqlParameter) o).value);
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
