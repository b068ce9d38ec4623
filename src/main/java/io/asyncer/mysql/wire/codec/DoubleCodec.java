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
 * Codec for {@link Double}.
 */
final class DoubleCodec extends AbstractClassedCodec<Double> {

    static final DoubleCodec INSTANCE = new DoubleCodec();

    private DoubleCodec() {
        super(Double.class);
    }

    @Override
    public Double decode(ByteBuf value, MySqlColumnMetadata metadata, Class<?> target, boolean binary) {
        Number number = CodecUtils.decodeNumber(value, metadata, binary);

        if (number instanceof Float) {
            // Keeps the decimal digits, e.g. 0.1F is decoded as 0.1 instead of 0.10000000149011612.
            return Double.parseDouble(number.toString());
        }

        return number.doubleValue();
    }

    @Override
    public boolean canEncode(Object value) {
        return value instanceof Double;
    }

    @Override
    public MySqlParameter encode(Object value) {
        return new DoubleMySqlParameter((Double) value);
    }

    @Override
    protected boolean doCanDecode(MySqlColumnMetadata metadata) {
        return metadata.getType().isNumeric();
    }

    private static final class DoubleMySqlParameter implements MySqlParameter {

        private final double value;

        private DoubleMySqlParameter(double value) {
            this.value = value;
        }

        @Override
        public MySqlType getType() {
            return MySqlType.DOUBLE;
        }

        @Override
        public void writeBinary(ByteBuf buf) {
            buf.writeDoubleLE(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof DoubleMySqlParameter)) {
                return false;
            }

            return Double.compare(((DoubleMySqlParameter) o).value, value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }
}
