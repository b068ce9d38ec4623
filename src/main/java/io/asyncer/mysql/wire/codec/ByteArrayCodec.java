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
import io.netty.buffer.ByteBufUtil;

import java.util.Arrays;

import static io.asyncer.mysql.wire.internal.util.VarIntUtils.writeVarIntSizedBytes;

/**
 * Codec for {@code byte[]} of strings, blobs, {@code BIT} and {@code GEOMETRY}.
 */
final class ByteArrayCodec extends AbstractClassedCodec<byte[]> {

    static final ByteArrayCodec INSTANCE = new ByteArrayCodec();

    private ByteArrayCodec() {
        super(byte[].class);
    }

    @Override
    public byte[] decode(ByteBuf value, MySqlColumnMetadata metadata, Class<?> target, boolean binary) {
        return ByteBufUtil.getBytes(value);
    }

    @Override
    public boolean canEncode(Object value) {
        return value instanceof byte[];
    }

    @Override
    public MySqlParameter encode(Object value) {
        return new BytesMySqlParameter((byte[]) value);
    }

    @Override
    protected boolean doCanDecode(MySqlColumnMetadata metadata) {
        MySqlType type = metadata.getType();

        return type.isLengthEncoded() && !type.isDecimal();
    }

    private static final class BytesMySqlParameter implements MySqlParameter {

        private final byte[] value;

        private BytesMySqlParameter(byte[] value) {
            this.value = value;
        }

        @Override
        public MySqlType getType() {
            return MySqlType.BLOB;
        }

        @Override
        public void writeBinary(ByteBuf buf) {
            writeVarIntSizedBytes(buf, value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof BytesMySqlParameter)) {
                return false;
            }

            return Arrays.equals(value, ((BytesMySqlParameter) o).value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "byte[" + value.length + ']';
        }
    }
}
