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

/**
 * Codec for {@link Byte}.
 */
final class ByteCodec extends AbstractClassedCodec<Byte> {

    static final ByteCodec INSTANCE = new ByteCodec();

    private ByteCodec() {
        super(Byte.class);
    }

    @Override
    public Byte decode(ByteBuf value, MySqlColumnMetadata metadata, Class<?> target, boolean binary) {
        long v = CodecUtils.longValueExact(CodecUtils.decodeNumber(value, metadata, binary));

        return (byte) CodecUtils.rangeCheck(v, Byte.MIN_VALUE, Byte.MAX_VALUE);
    }

    @Override
    public boolean canEncode(Object value) {
        return value instanceof Byte;
    }

    @Override
    public MySqlParameter encode(Object value) {
        return new ByteMySqlParameter((Byte) value);
    }

    @Override
    protected boolean doCanDecode(MySqlColumnMetadata metadata) {
        return metadata.getType().isNumeric();
    }

    static final class ByteMySqlParameter implements MySqlParameter {

        private final byte value;

        ByteMySqlParameter(byte value) {
            this.value = value;
        }

        @Override
        public MySqlType getType() {
            return MySqlType.TINYINT;
        }

        @Override
        public void writeBinary(ByteBuf buf) {
            buf.writeByte(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof ByteMySqlParameter)) {
                return false;
            }

            return value == ((ByteMySqlParameter) o).value;
        }

        @Override
        public int hashCode() {
            return value;
        }

        @Override
        public String toString() {
            return Byte.toString(value);
        }
    }
}
