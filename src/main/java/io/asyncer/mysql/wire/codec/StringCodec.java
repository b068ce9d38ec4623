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

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;

import static io.asyncer.mysql.wire.internal.util.VarIntUtils.writeVarIntSizedBytes;

/**
 * Codec for {@link String}. Values of the text protocol are decoded as they are, binary numbers and date/time
 * values are formatted as the text protocol does.
 */
final class StringCodec extends AbstractClassedCodec<String> {

    static final StringCodec INSTANCE = new StringCodec();

    private StringCodec() {
        super(String.class);
    }

    @Override
    public String decode(ByteBuf value, MySqlColumnMetadata metadata, Class<?> target, boolean binary) {
        MySqlType type = metadata.getType();

        if (!binary || type.isLengthEncoded()) {
            return value.toString(StandardCharsets.UTF_8);
        }

        switch (type) {
            case DATE:
            case TIME:
            case DATETIME:
            case TIMESTAMP:
                return DateTimes.toText(value, type);
            default:
                Number number = CodecUtils.decodeNumber(value, metadata, true);

                return number instanceof BigDecimal ? ((BigDecimal) number).toPlainString() : number.toString();
        }
    }

    @Override
    public boolean canEncode(Object value) {
        return value instanceof CharSequence;
    }

    @Override
    public MySqlParameter encode(Object value) {
        return new StringMySqlParameter(value.toString());
    }

    @Override
    protected boolean doCanDecode(MySqlColumnMetadata metadata) {
        MySqlType type = metadata.getType();

        return type != MySqlType.GEOMETRY && type != MySqlType.BIT && type != MySqlType.UNKNOWN;
    }

    private static final class StringMySqlParameter implements MySqlParameter {

        private final String value;

        private StringMySqlParameter(String value) {
            this.value = value;
        }

        @Override
        public MySqlType getType() {
            return MySqlType.VARCHAR;
        }

        @Override
        public void writeBinary(ByteBuf buf) {
            writeVarIntSizedBytes(buf, value.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof StringMySqlParameter)) {
                return false;
            }

            return value.equals(((StringMySqlParameter) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return value;
        }
    }
}
