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
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import static io.asyncer.mysql.wire.internal.util.VarIntUtils.writeVarIntSizedBytes;

/**
 * Codec for {@link BigDecimal}.
 */
final class BigDecimalCodec extends AbstractClassedCodec<BigDecimal> {

    static final BigDecimalCodec INSTANCE = new BigDecimalCodec();

    private BigDecimalCodec() {
        super(BigDecimal.class);
    }

    @Override
    public BigDecimal decode(ByteBuf value, MySqlColumnMetadata metadata, Class<?> target, boolean binary) {
        Number number = CodecUtils.decodeNumber(value, metadata, binary);

        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        } else if (number instanceof BigInteger) {
            return new BigDecimal((BigInteger) number);
        } else if (number instanceof Long) {
            return BigDecimal.valueOf(number.longValue());
        } else if (number instanceof Float) {
            // Avoid the binary expansion of float, e.g. 0.1F is not 0.100000001490116119384765625.
            return new BigDecimal(number.toString());
        }

        return BigDecimal.valueOf(number.doubleValue());
    }

    @Override
    public boolean canEncode(Object value) {
        return value instanceof BigDecimal;
    }

    @Override
    public MySqlParameter encode(Object value) {
        return new DecimalMySqlParameter(((BigDecimal) value).toPlainString());
    }

    @Override
    protected boolean doCanDecode(MySqlColumnMetadata metadata) {
        return metadata.getType().isNumeric();
    }

    static final class DecimalMySqlParameter implements MySqlParameter {

        private final String value;

        DecimalMySqlParameter(String value) {
            this.value = value;
        }

        @Override
        public MySqlType getType() {
            return MySqlType.NEW_DECIMAL;
        }

        @Override
        public void writeBinary(ByteBuf buf) {
            writeVarIntSizedBytes(buf, value.getBytes(StandardCharsets.US_ASCII));
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof DecimalMySqlParameter)) {
                return false;
            }

            return value.equals(((DecimalMySqlParameter) o).value);
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
