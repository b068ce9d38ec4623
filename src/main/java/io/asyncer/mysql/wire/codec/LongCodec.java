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
import io.asyncer.mysql.wire.codec.ByteCodec.ByteMySqlParameter;
import io.asyncer.mysql.wire.codec.IntegerCodec.IntMySqlParameter;
import io.asyncer.mysql.wire.codec.ShortCodec.ShortMySqlParameter;
import io.asyncer.mysql.wire.constant.MySqlType;
import io.netty.buffer.ByteBuf;

/**
 * Codec for {@link Long}. A {@code BIGINT UNSIGNED} greater than {@link Long#MAX_VALUE} can not be decoded,
 * use {@link java.math.BigInteger} for it.
 */
final class LongCodec extends AbstractClassedCodec<Long> {

    static final LongCodec INSTANCE = new LongCodec();

    private LongCodec() {
        super(Long.class);
    }

    @Override
    public Long decode(ByteBuf value, MySqlColumnMetadata metadata, Class<?> target, boolean binary) {
        return CodecUtils.longValueExact(CodecUtils.decodeNumber(value, metadata, binary));
    }

    @Override
    public boolean canEncode(Object value) {
        return value instanceof Long;
    }

    @Override
    public MySqlParameter encode(Object value) {
        return encodeLong((Long) value);
    }

    @Override
    protected boolean doCanDecode(MySqlColumnMetadata metadata) {
        return metadata.getType().isNumeric();
    }

    static MySqlParameter encodeLong(long v) {
        if ((byte) v == v) {
            return new ByteMySqlParameter((byte) v);
        } else if ((short) v == v) {
            return new ShortMySqlParameter((short) v);
        } else if ((int) v == v) {
            return new IntMySqlParameter((int) v);
        }

        return new LongMySqlParameter(v, false);
    }

    static final class LongMySqlParameter implements MySqlParameter {

        private final long value;

        private final boolean unsigned;

        LongMySqlParameter(long value, boolean unsigned) {
            this.value = value;
            this.unsigned = unsigned;
        }

        @Override
        public MySqlType getType() {
            return MySqlType.BIGINT;
        }

        @Override
        public boolean isUnsigned() {
            return unsigned;
        }

        @Override
        public void writeBinary(ByteBuf buf) {
            buf.writeLongLE(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof LongMySqlParameter)) {
                return false;
            }

            LongMySqlParameter that = (LongMySqlParameter) o;

            return value == that.value && unsigned == that.unsigned;
        }

        @Override
        public int hashCode() {
            return 31 * Long.hashCode(value) + (unsigned ? 1 : 0);
        }

        @Override
        public String toString() {
            return unsigned ? Long.toUnsignedString(value) : Long.toString(value);
        }
    }
}
