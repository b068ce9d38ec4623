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

import io.asyncer.mysql.wire.TypeConversionException;
import io.asyncer.mysql.wire.api.MySqlColumnMetadata;
import io.asyncer.mysql.wire.constant.MySqlType;
import io.asyncer.mysql.wire.message.FieldValue;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Year;
import java.util.BitSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

/**
 * Unit tests for {@link DefaultCodecs}.
 */
class DefaultCodecsTest {

    private final Codecs codecs = Codecs.getInstance();

    @Test
    void nullValue() {
        assertThat(codecs.<Integer>decode(FieldValue.nullField(), ColumnMetadataStub.of(MySqlType.INT),
            int.class, false)).isNull();
    }

    @Test
    void textIntegers() {
        MySqlColumnMetadata bigint = ColumnMetadataStub.of(MySqlType.BIGINT);

        assertThat(this.<Object>text("42", bigint, Object.class)).isEqualTo(42L);
        assertThat(this.<Integer>text("42", bigint, int.class)).isEqualTo(42);
        assertThat(this.<String>text("42", bigint, String.class)).isEqualTo("42");
        assertThat(this.<BigInteger>text("42", bigint, BigInteger.class)).isEqualTo(BigInteger.valueOf(42));
        assertThat(this.<Boolean>text("0", bigint, Boolean.class)).isFalse();
    }

    @Test
    void unsignedBigint() {
        MySqlColumnMetadata unsigned = ColumnMetadataStub.unsigned(MySqlType.BIGINT);
        String max = "18446744073709551615";

        assertThat(this.<BigInteger>text(max, unsigned, BigInteger.class)).isEqualTo(new BigInteger(max));
        assertThatExceptionOfType(TypeConversionException.class)
            .isThrownBy(() -> text(max, unsigned, Long.class))
            .satisfies(e -> {
                assertThat(e.getColumn()).isEqualTo("c");
                assertThat(e.getRequested()).isEqualTo(Long.class);
                assertThat(e.getActual()).isEqualTo(MySqlType.BIGINT);
                assertThat(e.getCause()).isInstanceOf(ArithmeticException.class);
            });

        ByteBuf binaryMax = Unpooled.buffer().writeLongLE(-1L);

        assertThat(this.<BigInteger>decode(binaryMax, unsigned, BigInteger.class, true))
            .isEqualTo(new BigInteger(max));
    }

    @Test
    void binaryIntegers() {
        assertThat(this.<Integer>decode(Unpooled.buffer().writeIntLE(-7), ColumnMetadataStub.of(MySqlType.INT),
            Integer.class, true)).isEqualTo(-7);
        assertThat(this.<Long>decode(Unpooled.buffer().writeIntLE(-1), ColumnMetadataStub.unsigned(MySqlType.INT),
            Long.class, true)).isEqualTo(4294967295L);
        assertThat(this.<Short>decode(Unpooled.buffer().writeByte(200),
            ColumnMetadataStub.unsigned(MySqlType.TINYINT), Short.class, true)).isEqualTo((short) 200);
        assertThat(this.<Year>decode(Unpooled.buffer().writeShortLE(2024), ColumnMetadataStub.of(MySqlType.YEAR),
            Year.class, true)).isEqualTo(Year.of(2024));
    }

    @Test
    void decimals() {
        MySqlColumnMetadata decimal = ColumnMetadataStub.of(MySqlType.NEW_DECIMAL);

        assertThat(this.<BigDecimal>decode(ascii("12.50"), decimal, BigDecimal.class, true))
            .isEqualTo(new BigDecimal("12.50"));
        assertThat(this.<String>text("12.50", decimal, String.class)).isEqualTo("12.50");
        assertThat(this.<Double>decode(Unpooled.buffer().writeDoubleLE(0.25), ColumnMetadataStub.of(MySqlType.DOUBLE),
            Double.class, true)).isEqualTo(0.25);
    }

    @Test
    void bits() {
        MySqlColumnMetadata bit = ColumnMetadataStub.binary(MySqlType.BIT);
        BitSet expected = new BitSet();

        expected.set(0);
        expected.set(2);

        assertThat(this.<BitSet>decode(Unpooled.wrappedBuffer(new byte[] { 0, 5 }), bit, BitSet.class, false))
            .isEqualTo(expected);
        assertThat(this.<Boolean>decode(Unpooled.wrappedBuffer(new byte[] { 0, 1 }), bit, Boolean.class, true))
            .isTrue();
        assertThat(this.<Boolean>decode(Unpooled.wrappedBuffer(new byte[] { 0 }), bit, Boolean.class, false))
            .isFalse();
    }

    @Test
    void textDateTimes() {
        MySqlColumnMetadata datetime = ColumnMetadataStub.of(MySqlType.DATETIME);

        assertThat(this.<LocalDateTime>text("2024-02-29 12:34:56.789", datetime, LocalDateTime.class))
            .isEqualTo(LocalDateTime.of(2024, 2, 29, 12, 34, 56, 789_000_000));
        assertThat(this.<LocalDate>text("2024-02-29 12:34:56", datetime, LocalDate.class))
            .isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(this.<LocalDateTime>text("0000-00-00 00:00:00", datetime, LocalDateTime.class)).isNull();
        assertThat(this.<LocalTime>text("23:59:59.5", ColumnMetadataStub.of(MySqlType.TIME), LocalTime.class))
            .isEqualTo(LocalTime.of(23, 59, 59, 500_000_000));
        assertThatExceptionOfType(TypeConversionException.class)
            .isThrownBy(() -> text("25:00:00", ColumnMetadataStub.of(MySqlType.TIME), LocalTime.class));
    }

    @Test
    void binaryDateTimes() {
        ByteBuf date = Unpooled.buffer().writeByte(4).writeShortLE(2024).writeByte(2).writeByte(29);

        assertThat(this.<LocalDate>decode(date, ColumnMetadataStub.of(MySqlType.DATE), LocalDate.class, true))
            .isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(this.<LocalDateTime>decode(Unpooled.buffer().writeByte(0),
            ColumnMetadataStub.of(MySqlType.TIMESTAMP), LocalDateTime.class, true)).isNull();

        ByteBuf negative = Unpooled.buffer().writeByte(8).writeBoolean(true).writeIntLE(1).writeByte(1)
            .writeByte(0).writeByte(0);

        assertThat(this.<String>decode(negative, ColumnMetadataStub.of(MySqlType.TIME), String.class, true))
            .isEqualTo("-25:00:00");
    }

    @Test
    void stringsAndBytes() {
        assertThat(this.<String>text("héllo", ColumnMetadataStub.of(MySqlType.VARCHAR), String.class))
            .isEqualTo("héllo");
        assertThat(this.<byte[]>decode(Unpooled.wrappedBuffer(new byte[] { 1, 2 }),
            ColumnMetadataStub.binary(MySqlType.BLOB), byte[].class, false)).containsExactly(1, 2);
        assertThatExceptionOfType(TypeConversionException.class)
            .isThrownBy(() -> text("abc", ColumnMetadataStub.of(MySqlType.VARCHAR), Integer.class));
        assertThatExceptionOfType(TypeConversionException.class)
            .isThrownBy(() -> text("abc", ColumnMetadataStub.of(MySqlType.INT), Integer.class));
    }

    @Test
    void encode() {
        assertThat(codecs.encode(1L).getType()).isEqualTo(MySqlType.TINYINT);
        assertThat(codecs.encode(1L << 40).getType()).isEqualTo(MySqlType.BIGINT);
        assertThat(codecs.encode(true).getType()).isEqualTo(MySqlType.TINYINT);
        assertThat(codecs.encode("a").getType()).isEqualTo(MySqlType.VARCHAR);
        assertThat(codecs.encode(new byte[] { 1 }).getType()).isEqualTo(MySqlType.BLOB);
        assertThat(codecs.encode(LocalDate.of(2024, 1, 1)).getType()).isEqualTo(MySqlType.DATE);
        assertThat(codecs.encode(new BigInteger("18446744073709551615")).isUnsigned()).isTrue();
        assertThat(codecs.encodeNull().isNull()).isTrue();
        assertThatIllegalArgumentException().isThrownBy(() -> codecs.encode(new Object()));

        ByteBuf buf = Unpooled.buffer();

        try {
            codecs.encode(LocalDateTime.of(2024, 2, 29, 1, 2, 3, 4_000)).writeBinary(buf);

            assertThat(buf.readableBytes()).isEqualTo(12);
            assertThat(buf.getUnsignedByte(0)).isEqualTo((short) 11);
            assertThat(buf.getIntLE(8)).isEqualTo(4);
        } finally {
            buf.release();
        }
    }

    @Nullable
    private <T> T text(String value, MySqlColumnMetadata metadata, Class<?> type) {
        return decode(ascii(value), metadata, type, false);
    }

    @Nullable
    private <T> T decode(ByteBuf buf, MySqlColumnMetadata metadata, Class<?> type, boolean binary) {
        FieldValue value = FieldValue.of(buf);

        try {
            return codecs.decode(value, metadata, type, binary);
        } finally {
            value.release();
        }
    }

    private static ByteBuf ascii(String value) {
        return Unpooled.copiedBuffer(value, StandardCharsets.UTF_8);
    }
}
