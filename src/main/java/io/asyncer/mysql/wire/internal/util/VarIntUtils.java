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

package io.asyncer.mysql.wire.internal.util;

import io.asyncer.mysql.wire.ProtocolFramingException;
import io.netty.buffer.ByteBuf;

import java.nio.charset.Charset;

/**
 * Reads and writes the length-encoded integers of the MySQL protocol.
 * <p>
 * A value lower than 251 takes one byte, otherwise a prefix byte selects a 2, 3 or 8 bytes little-endian
 * value. Prefix {@code 0xFB} means SQL {@code NULL} in a text row and {@code 0xFF} is the first byte of an
 * error packet, so neither of them is a legal integer here.
 */
public final class VarIntUtils {

    private static final int ONE_BYTE_LIMIT = 0xFB;

    private static final int NULL_CODE = 0xFB;

    private static final int TWO_BYTES_CODE = 0xFC;

    private static final int THREE_BYTES_CODE = 0xFD;

    private static final int EIGHT_BYTES_CODE = 0xFE;

    private static final int TWO_BYTES_LIMIT = 1 << 16;

    private static final int THREE_BYTES_LIMIT = 1 << 24;

    /**
     * Reads a length-encoded integer. The value of an 8-bytes integer is unsigned and may be negative
     * when read as {@code long}.
     *
     * @param buf the buffer, its reader index will be moved.
     * @return the integer.
     * @throws ProtocolFramingException if the prefix is {@code 0xFB} or {@code 0xFF}, or not enough bytes.
     */
    public static long readVarInt(ByteBuf buf) {
        if (!buf.isReadable()) {
            throw new ProtocolFramingException("Length-encoded integer expected but buffer is exhausted");
        }

        int code = buf.readUnsignedByte();

        if (code < ONE_BYTE_LIMIT) {
            return code;
        }

        switch (code) {
            case TWO_BYTES_CODE:
                requireReadable(buf, Short.BYTES);
                return buf.readUnsignedShortLE();
            case THREE_BYTES_CODE:
                requireReadable(buf, 3);
                return buf.readUnsignedMediumLE();
            case EIGHT_BYTES_CODE:
                requireReadable(buf, Long.BYTES);
                return buf.readLongLE();
            case NULL_CODE:
                throw new ProtocolFramingException("Unexpected NULL marker 0xFB as a length-encoded integer");
            default:
                throw new ProtocolFramingException("Unexpected error marker 0xFF as a length-encoded integer");
        }
    }

    /**
     * Checks whether next byte is the {@code NULL} marker of a text row field, without moving any index.
     *
     * @param buf the buffer.
     * @return if next field is {@code NULL}.
     */
    public static boolean isNextNull(ByteBuf buf) {
        return buf.getUnsignedByte(buf.readerIndex()) == NULL_CODE;
    }

    /**
     * Reads a length-encoded integer which must fit an {@code int}, e.g. the length of a field.
     *
     * @param buf the buffer.
     * @return the integer.
     * @throws ProtocolFramingException if the integer is illegal or larger than {@link Integer#MAX_VALUE}.
     */
    public static int readVarIntSize(ByteBuf buf) {
        long size = readVarInt(buf);

        if (size < 0 || size > Integer.MAX_VALUE) {
            throw new ProtocolFramingException("Length-encoded size " + Long.toUnsignedString(size) +
                " exceeds the maximum " + Integer.MAX_VALUE);
        }

        return (int) size;
    }

    /**
     * Reads a length-encoded byte sequence and returns it as a retained slice.
     *
     * @param buf the buffer.
     * @return the retained slice, the caller should release it.
     */
    public static ByteBuf readVarIntSizedRetained(ByteBuf buf) {
        int size = readVarIntSize(buf);

        requireReadable(buf, size);

        return buf.readRetainedSlice(size);
    }

    /**
     * Reads a length-encoded string.
     *
     * @param buf     the buffer.
     * @param charset the charset of the string.
     * @return the string.
     */
    public static String readVarIntSizedString(ByteBuf buf, Charset charset) {
        int size = readVarIntSize(buf);

        requireReadable(buf, size);

        String result = buf.toString(buf.readerIndex(), size, charset);
        buf.skipBytes(size);

        return result;
    }

    /**
     * Reads a length-encoded byte array.
     *
     * @param buf the buffer.
     * @return the bytes.
     */
    public static byte[] readVarIntSizedBytes(ByteBuf buf) {
        int size = readVarIntSize(buf);

        requireReadable(buf, size);

        byte[] bytes = new byte[size];
        buf.readBytes(bytes);

        return bytes;
    }

    /**
     * Writes a length-encoded integer with the minimal size class.
     *
     * @param buf   the buffer.
     * @param value the value, it is treated as unsigned.
     */
    public static void writeVarInt(ByteBuf buf, long value) {
        if (value >= 0 && value < ONE_BYTE_LIMIT) {
            buf.writeByte((int) value);
        } else if (value >= 0 && value < TWO_BYTES_LIMIT) {
            buf.writeByte(TWO_BYTES_CODE).writeShortLE((int) value);
        } else if (value >= 0 && value < THREE_BYTES_LIMIT) {
            buf.writeByte(THREE_BYTES_CODE).writeMediumLE((int) value);
        } else {
            buf.writeByte(EIGHT_BYTES_CODE).writeLongLE(value);
        }
    }

    /**
     * Writes a byte array with a length-encoded size prefix.
     *
     * @param buf   the buffer.
     * @param bytes the bytes.
     */
    public static void writeVarIntSizedBytes(ByteBuf buf, byte[] bytes) {
        writeVarInt(buf, bytes.length);
        buf.writeBytes(bytes);
    }

    /**
     * Calculates the encoded size of a length-encoded integer, includes its prefix.
     *
     * @param value the value, it is treated as unsigned.
     * @return the encoded size.
     */
    public static int varIntBytes(long value) {
        if (value >= 0 && value < ONE_BYTE_LIMIT) {
            return 1;
        } else if (value >= 0 && value < TWO_BYTES_LIMIT) {
            return 3;
        } else if (value >= 0 && value < THREE_BYTES_LIMIT) {
            return 4;
        }

        return 9;
    }

    private static void requireReadable(ByteBuf buf, int size) {
        if (buf.readableBytes() < size) {
            throw new ProtocolFramingException("Need " + size + " bytes but only " + buf.readableBytes() +
                " bytes readable");
        }
    }

    private VarIntUtils() { }
}
