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
import io.asyncer.mysql.wire.codec.LongCodec.LongMySqlParameter;
import io.netty.buffer.ByteBuf;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Codec for {@link BigInteger}.
 */
final class BigIntegerCodec extends AbstractClassedCodec<BigInteger> {

    static final BigIntegerCodec INSTANCE = new BigIntegerCodec();

    private static final BigInteger MAX_UNSIGNED_LONG = BigInteger.ONE.shiftLeft(Long.SIZE).subtract(BigInteger.ONE);

    private BigIntegerCodec() {
        super(BigInteger.class);
    }

    @Override
    public BigInteger decode(ByteBuf value, MySqlColumnMetadata metadata, Class<?> target, boolean binary) {
        Number number = CodecUtils.decodeNumber(value, metadata, binary);

        if (number instanceof BigInteger) {
            return (BigInteger) number;
        } else if (number instanceof Long) {
            return BigInteger.valueOf(number.longValue());
        } else if (number instanceof BigDecimal) {
            return ((BigDecimal) number).toBigInteger();
        }

        return BigDecimal.valueOf(number.doubleValue()).toBigInteger();
    }

    @Override
    public boolean canEncode(Object value) {
        return value instanceof BigInteger;
    }

    @Override
    public MySqlParameter encode(Object value) {
        BigInteger v = (BigInteger) value;

        if (v.bitLength() < Long.SIZE) {
            return LongCodec.encodeLong(v.longValue());
        } else if (v.signum() > 0 && v.compareTo(MAX_UNSIGNED_LONG) <= 0) {
            return new LongMySqlParameter(v.longValue(), true);
        }

        return new BigDecimalCodec.DecimalMySqlParameter(v.toString());
    }

    @Override
    protected boolean doCanDecode(MySqlColumnMetadata metadata) {
        return metadata.getType().isNumeric();
    }
}
