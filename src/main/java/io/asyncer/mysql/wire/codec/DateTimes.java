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

import io.asyncer.mysql.wire.constant.MySqlType;
import io.netty.buffer.ByteBuf;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * A utility for reading and writing date/time values of both protocols.
 * <p>
 * Binary values keep the leading length byte. Zero dates, e.g. {@code 0000-00-00}, are decoded as
 * {@code null}.
 */
final class DateTimes {

    private static final int DATE_SIZE = 4;

    private static final int DATETIME_SIZE = 7;

    private static final int MICRO_DATETIME_SIZE = 11;

    private static final int TIME_SIZE = 8;

    private static final int MICRO_TIME_SIZE = 12;

    private static final int NANOS_OF_MICRO = 1000;

    private static final int FRACTION_DIGITS = 9;

    /**
     * Reads a {@code DATE}, {@code DATETIME} or {@code TIMESTAMP} value.
     *
     * @param buf    the value.
     * @param binary if it is in the binary protocol.
     * @return the date time, or {@code null} if it is a zero date.
     */
    @Nullable
    static LocalDateTime readDateTime(ByteBuf buf, boolean binary) {
        if (binary) {
            return readBinaryDateTime(buf);
        }

        String text = buf.toString(StandardCharsets.US_ASCII).trim();
        int space = text.indexOf(' ');
        LocalDate date = parseDate(space < 0 ? text : text.substring(0, space));

        if (date == null) {
            return null;
        }

        return space < 0 ? date.atStartOfDay() : date.atTime(parseTime(text.substring(space + 1)));
    }

    /**
     * Reads a {@code TIME} value as a time of day.
     *
     * @param buf    the value.
     * @param binary if it is in the binary protocol.
     * @return the time.
     * @throws ArithmeticException if the value is negative or not less than 24 hours.
     */
    static LocalTime readTime(ByteBuf buf, boolean binary) {
        if (!binary) {
            String text = buf.toString(StandardCharsets.US_ASCII).trim();

            if (text.startsWith("-")) {
                throw new ArithmeticException("Negative TIME " + text + " is out of range of LocalTime");
            }

            return parseTime(text);
        }

        int size = buf.readUnsignedByte();

        if (size == 0) {
            return LocalTime.MIDNIGHT;
        }

        boolean negative = buf.readBoolean();
        long days = buf.readUnsignedIntLE();
        int hour = buf.readUnsignedByte();
        int minute = buf.readUnsignedByte();
        int second = buf.readUnsignedByte();
        int micros = size >= MICRO_TIME_SIZE ? (int) buf.readUnsignedIntLE() : 0;

        if (negative || days != 0) {
            throw new ArithmeticException("TIME with " + (negative ? "negative sign" : days + " days") +
                " is out of range of LocalTime");
        }

        return LocalTime.of(hour, minute, second, micros * NANOS_OF_MICRO);
    }

    /**
     * Formats a binary date/time value as the server formats it in the text protocol.
     *
     * @param buf  the binary value.
     * @param type the column type.
     * @return the text.
     */
    static String toText(ByteBuf buf, MySqlType type) {
        if (type == MySqlType.TIME) {
            int size = buf.readUnsignedByte();

            if (size == 0) {
                return "00:00:00";
            }

            boolean negative = buf.readBoolean();
            long hours = buf.readUnsignedIntLE() * 24 + buf.readUnsignedByte();
            int minute = buf.readUnsignedByte();
            int second = buf.readUnsignedByte();
            int micros = size >= MICRO_TIME_SIZE ? (int) buf.readUnsignedIntLE() : 0;
            String text = String.format("%s%02d:%02d:%02d", negative ? "-" : "", hours, minute, second);

            return micros == 0 ? text : text + String.format(".%06d", micros);
        }

        int size = buf.readUnsignedByte();
        int year = size >= DATE_SIZE ? buf.readUnsignedShortLE() : 0;
        int month = size >= DATE_SIZE ? buf.readUnsignedByte() : 0;
        int day = size >= DATE_SIZE ? buf.readUnsignedByte() : 0;
        String date = String.format("%04d-%02d-%02d", year, month, day);

        if (type == MySqlType.DATE) {
            return date;
        }

        int hour = size >= DATETIME_SIZE ? buf.readUnsignedByte() : 0;
        int minute = size >= DATETIME_SIZE ? buf.readUnsignedByte() : 0;
        int second = size >= DATETIME_SIZE ? buf.readUnsignedByte() : 0;
        int micros = size >= MICRO_DATETIME_SIZE ? (int) buf.readUnsignedIntLE() : 0;
        String text = date + String.format(" %02d:%02d:%02d", hour, minute, second);

        return micros == 0 ? text : text + String.format(".%06d", micros);
    }

    static void writeDate(ByteBuf buf, LocalDate date) {
        buf.writeByte(DATE_SIZE)
            .writeShortLE(date.getYear())
            .writeByte(date.getMonthValue())
            .writeByte(date.getDayOfMonth());
    }

    static void writeDateTime(ByteBuf buf, LocalDateTime dateTime) {
        int micros = dateTime.getNano() / NANOS_OF_MICRO;

        buf.writeByte(micros == 0 ? DATETIME_SIZE : MICRO_DATETIME_SIZE)
            .writeShortLE(dateTime.getYear())
            .writeByte(dateTime.getMonthValue())
            .writeByte(dateTime.getDayOfMonth())
            .writeByte(dateTime.getHour())
            .writeByte(dateTime.getMinute())
            .writeByte(dateTime.getSecond());

        if (micros != 0) {
            buf.writeIntLE(micros);
        }
    }

    static void writeTime(ByteBuf buf, LocalTime time) {
        int micros = time.getNano() / NANOS_OF_MICRO;

        buf.writeByte(micros == 0 ? TIME_SIZE : MICRO_TIME_SIZE)
            // Positive, and 0 days.
            .writeBoolean(false)
            .writeIntLE(0)
            .writeByte(time.getHour())
            .writeByte(time.getMinute())
            .writeByte(time.getSecond());

        if (micros != 0) {
            buf.writeIntLE(micros);
        }
    }

    @Nullable
    private static LocalDateTime readBinaryDateTime(ByteBuf buf) {
        int size = buf.readUnsignedByte();

        if (size < DATE_SIZE) {
            return null;
        }

        int year = buf.readUnsignedShortLE();
        int month = buf.readUnsignedByte();
        int day = buf.readUnsignedByte();

        if (year == 0 && month == 0 && day == 0) {
            return null;
        }

        if (size < DATETIME_SIZE) {
            return LocalDateTime.of(year, month, day, 0, 0);
        }

        int hour = buf.readUnsignedByte();
        int minute = buf.readUnsignedByte();
        int second = buf.readUnsignedByte();
        int micros = size >= MICRO_DATETIME_SIZE ? (int) buf.readUnsignedIntLE() : 0;

        return LocalDateTime.of(year, month, day, hour, minute, second, micros * NANOS_OF_MICRO);
    }

    @Nullable
    private static LocalDate parseDate(String text) {
        String[] parts = text.split("-", 3);

        if (parts.length != 3) {
            throw new NumberFormatException("Malformed date " + text);
        }

        int year = Integer.parseInt(parts[0]);
        int month = Integer.parseInt(parts[1]);
        int day = Integer.parseInt(parts[2]);

        if (year == 0 && month == 0 && day == 0) {
            return null;
        }

        return LocalDate.of(year, month, day);
    }

    private static LocalTime parseTime(String text) {
        int dot = text.indexOf('.');
        String[] parts = (dot < 0 ? text : text.substring(0, dot)).split(":", 3);

        if (parts.length != 3) {
            throw new NumberFormatException("Malformed time " + text);
        }

        int hour = Integer.parseInt(parts[0]);

        if (hour >= 24) {
            throw new ArithmeticException("TIME " + text + " is out of range of LocalTime");
        }

        int nanos = 0;

        if (dot >= 0) {
            StringBuilder fraction = new StringBuilder(text.substring(dot + 1));

            while (fraction.length() < FRACTION_DIGITS) {
                fraction.append('0');
            }

            nanos = Integer.parseInt(fraction.substring(0, FRACTION_DIGITS));
        }

        return LocalTime.of(hour, Integer.parseInt(parts[1]), Integer.parseInt(parts[2]), nanos);
    }

    private DateTimes() { }
}
