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
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;

/**
 * A utility for decoding numeric values.
 */
final class CodecUtils {

    private static final BigInteger UNSIGNED_LONG_OFFSET = BigInteger.ONE.shiftLeft(Long.SIZE);

    /**
     * Decodes a numeric column value. Integers are {@link Long}, or {@link BigInteger} if a {@code BIGINT
     * UNSIGNED} overflows {@link Long}, decimals are {@link BigDecimal}, and floating points are {@link Float}
     * or {@link Double}.
     *
     * @param buf      the value.
     * @param metadata the column metadata.
     * @param binary   if the value is in the binary protocol.
     * @return the number.
     * @throws NumberFormatException if a text value is not a number.
     * @throws IllegalStateException if the column is not numeric.
     */
    static Number decodeNumber(ByteBuf buf, MySqlColumnMetadata metadata, boolean binary) {
        MySqlType type = metadata.getType();
        boolean unsigned = metadata.isUnsigned();

        // Decimals are always sent as text.
        if (!binary || type.isDecimal()) {
            String text = buf.toString(StandardCharsets.US_ASCII);

            if (type.isDecimal()) {
                return new BigDecimal(text);
            } else if (type.isFloatingPoint()) {
                return Double.parseDouble(text);
            } else if (type == MySqlType.BIGINT && unsigned) {
                BigInteger value = new BigInteger(text);

                return value.bitLength() < Long.SIZE ? (Number) value.longValue() : value;
            }

            return Long.parseLong(text);
        }

        switch (type) {
            case BIGINT:
                long value = buf.readLongLE();
                return unsigned && value < 0 ? unsignedBigInteger(value) : (Number) value;
            case INT:
                return unsigned ? buf.readUnsignedIntLE() : (long) buf.readIntLE();
            case MEDIUMINT:
                // MySQL sends 32-bits two's complement for 24-bits integer.
                return (long) buf.readIntLE();
            case SMALLINT:
                return unsigned ? (long) buf.readUnsignedShortLE() : (long) buf.readShortLE();
            case YEAR:
                return (long) buf.readShortLE();
            case TINYINT:
                return unsigned ? (long) buf.readUnsignedByte() : (long) buf.readByte();
            case FLOAT:
                return buf.readFloatLE();
            case DOUBLE:
                return buf.readDoubleLE();
            default:
                throw new IllegalStateException("Cannot decode type " + type + " as a number");
        }
    }

    /**
     * Converts a number to {@code long}, fraction of decimals and floating points is discarded.
     *
     * @param number the number.
     * @return the {@code long} value.
     * @throws ArithmeticException if the number is out of range of {@code long}.
     */
    static long longValueExact(Number number) {
        if (number instanceof Long) {
            return number.longValue();
        } else if (number instanceof BigInteger) {
            return ((BigInteger) number).longValueExact();
        } else if (number instanceof BigDecimal) {
            return ((BigDecimal) number).setScale(0, RoundingMode.DOWN).longValueExact();
        }

        double value = number.doubleValue();

        if (Double.isNaN(value) || value < Long.MIN_VALUE || value >= 0x1p63) {
            throw new ArithmeticException("Value " + number + " is out of range of long");
        }

        return (long) value;
    }

    static long rangeCheck(long value, long min, long max) {
        if (value < min || value > max) {
            throw new ArithmeticException("Value " + value + " is out of range [" + min + ", " + max + ']');
        }

        return value;
    }

    static BigInteger unsignedBigInteger(long value) {
        BigInteger result = BigInteger.valueOf(value);

        return value < 0 ? result.add(UNSIGNED_LONG_OFFSET) : result;
    }

    private CodecUtils() { }
}
