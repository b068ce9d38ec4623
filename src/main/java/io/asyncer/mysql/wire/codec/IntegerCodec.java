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
import io.asyncer.mysql.wire.codec.ShortCodec.ShortMySqlParameter;
import io.asyncer.mysql.wire.constant.MySqlType;
import io.netty.buffer.ByteBuf;

/**
 * Codec for {@link Integer}.
 */
final class IntegerCodec extends AbstractClassedCodec<Integer> {

    static final IntegerCodec INSTANCE = new IntegerCodec();

    private IntegerCodec() {
        super(Integer.class);
    }

    @Override
    public Integer decode(ByteBuf value, MySqlColumnMetadata metadata, Class<?> target, boolean binary) {
        return Math.toIntExact(CodecUtils.longValueExact(CodecUtils.decodeNumber(value, metadata, binary)));
    }

    @Override
    public boolean canEncode(Object value) {
        return value instanceof Integer;
    }

    @Override
    public MySqlParameter encode(Object value) {
        int v = (Integer) value;

        if ((byte) v == v) {
            return new ByteMySqlParameter((byte) v);
        } else if ((short) v == v) {
            return new ShortMySqlParameter((short) v);
        }

        return new IntMySqlParameter(v);
    }

    @Override
    protected boolean doCanDecode(MySqlColumnMetadata metadata) {
        return metadata.getType().isNumeric();
    }

    static final class IntMySqlParameter implements MySqlParameter {

        private final int value;

        IntMySqlParameter(int value) {
            this.value = value;
        }

        @Override
        public MySqlType getType() {
            return MySqlType.INT;
        }

        @Override
        public void writeBinary(ByteBuf buf) {
            buf.writeIntLE(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof IntMySqlParameter)) {
                return false;
            }

            return value == ((IntMySqlParameter) o).value;
        }

        @Override
        public int hashCode() {
            return value;
        }

        @Override
        public String toString() {
            return Integer.toString(value);
        }
    }
}
