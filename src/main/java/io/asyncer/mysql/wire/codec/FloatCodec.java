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
 * Codec for {@link Float}.
 */
final class FloatCodec extends AbstractClassedCodec<Float> {

    static final FloatCodec INSTANCE = new FloatCodec();

    private FloatCodec() {
        super(Float.class);
    }

    @Override
    public Float decode(ByteBuf value, MySqlColumnMetadata metadata, Class<?> target, boolean binary) {
        return CodecUtils.decodeNumber(value, metadata, binary).floatValue();
    }

    @Override
    public boolean canEncode(Object value) {
        return value instanceof Float;
    }

    @Override
    public MySqlParameter encode(Object value) {
        return new FloatMySqlParameter((Float) value);
    }

    @Override
    protected boolean doCanDecode(MySqlColumnMetadata metadata) {
        return metadata.getType().isNumeric();
    }

    private static final class FloatMySqlParameter implements MySqlParameter {

        private final float value;

        private FloatMySqlParameter(float value) {
            this.value = value;
        }

        @Override
        public MySqlType getType() {
            return MySqlType.FLOAT;
        }

        @Override
        public void writeBinary(ByteBuf buf) {
            buf.writeFloatLE(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof FloatMySqlParameter)) {
                return false;
            }

            return Float.compare(((FloatMySqlParameter) o).value, value) == 0;
        }

        @Override
        public int hashCode() {
            return Float.hashCode(value);
        }

        @Override
        public String toString() {
            return Float.toString(value);
        }
    }
}
