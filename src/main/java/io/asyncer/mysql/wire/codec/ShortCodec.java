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
import io.asyncer.mysql.wire.constant.MySqlType;
import io.netty.buffer.ByteBuf;

/**
 * Codec for {@link Short}.
 */
final class ShortCodec extends AbstractClassedCodec<Short> {

    static final ShortCodec INSTANCE = new ShortCodec();

    private ShortCodec() {
        super(Short.class);
    }

    @Override
    public Short decode(ByteBuf value, MySqlColumnMetadata metadata, Class<?> target, boolean binary) {
        long v = CodecUtils.longValueExact(CodecUtils.decodeNumber(value, metadata, binary));

        return (short) CodecUtils.rangeCheck(v, Short.MIN_VALUE, Short.MAX_VALUE);
    }

    @Override
    public boolean canEncode(Object value) {
        return value instanceof Short;
    }

    @Override
    public MySqlParameter encode(Object value) {
        short v = (Short) value;

        if ((byte) v == v) {
            return new ByteMySqlParameter((byte) v);
        }

        return new ShortMySqlParameter(v);
    }

    @Override
    protected boolean doCanDecode(MySqlColumnMetadata metadata) {
        return metadata.getType().isNumeric();
    }

    static final class ShortMySqlParameter implements MySqlParameter {

        private final short value;

        ShortMySqlParameter(short value) {
            this.value = value;
        }

        @Override
        public MySqlType getType() {
            return MySqlType.SMALLINT;
        }

        @Override
        public void writeBinary(ByteBuf buf) {
            buf.writeShortLE(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof ShortMySqlParameter)) {
                return false;
            }

            return value == ((ShortMySqlParameter) o).value;
        }

        @Override
        public int hashCode() {
            return value;
        }

        @Override
        public String toString() {
            return Short.toString(value);
        }
    }
}
