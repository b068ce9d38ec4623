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

package io.asyncer.mysql.wire.message.server;

import io.asyncer.mysql.wire.ProtocolFramingException;
import io.asyncer.mysql.wire.constant.MySqlType;
import io.asyncer.mysql.wire.message.FieldValue;
import io.netty.buffer.ByteBuf;
import io.netty.util.ReferenceCountUtil;

import static io.asyncer.mysql.wire.internal.util.VarIntUtils.isNextNull;
import static io.asyncer.mysql.wire.internal.util.VarIntUtils.readVarIntSizedRetained;

/**
 * A row of a result set. The payload is split into column values lazily, by the text or the binary protocol
 * which the command used.
 */
public final class RowMessage implements ServerMessage {

    private static final byte BINARY_HEADER = 0;

    /**
     * The first 2 bits of the binary null bitmap are reserved.
     */
    private static final int BIT_OFFSET = 2;

    private final ByteBuf buf;

    RowMessage(ByteBuf buf) {
        this.buf = buf;
    }

    /**
     * Splits the payload into column values. It does not release the payload, see {@link #release()}.
     *
     * @param binary if the row uses the binary protocol.
     * @param types  the types of columns, required by the binary protocol.
     * @return the values, each of them should be released by the caller.
     */
    public FieldValue[] decode(boolean binary, MySqlType[] types) {
        ByteBuf buf = this.buf.duplicate();
        FieldValue[] values = new FieldValue[types.length];

        try {
            if (binary) {
                decodeBinary(buf, types, values);
            } else {
                decodeText(buf, values);
            }

            return values;
        } catch (IndexOutOfBoundsException e) {
            FieldValue.releaseAll(values);
            throw new ProtocolFramingException("Row packet is shorter than its columns", e);
        } catch (RuntimeException e) {
            FieldValue.releaseAll(values);
            throw e;
        }
    }

    public void release() {
        ReferenceCountUtil.safeRelease(buf);
    }

    @Override
    public String toString() {
        return "RowMessage{size=" + buf.readableBytes() + '}';
    }

    private static void decodeText(ByteBuf buf, FieldValue[] values) {
        for (int i = 0; i < values.length; ++i) {
            if (isNextNull(buf)) {
                buf.skipBytes(1);
                values[i] = FieldValue.nullField();
            } else {
                values[i] = FieldValue.of(readVarIntSizedRetained(buf));
            }
        }
    }

    private static void decodeBinary(ByteBuf buf, MySqlType[] types, FieldValue[] values) {
        if (buf.readByte() != BINARY_HEADER) {
            throw new ProtocolFramingException("Binary row must start with header 0x00");
        }

        int size = types.length;
        byte[] nullBitmap = new byte[(size + BIT_OFFSET + 7) >>> 3];

        buf.readBytes(nullBitmap);

        for (int i = 0; i < size; ++i) {
            int bit = i + BIT_OFFSET;

            if ((nullBitmap[bit >>> 3] & (1 << (bit & 7))) != 0) {
                values[i] = FieldValue.nullField();
            } else {
                values[i] = readBinaryValue(buf, types[i]);
            }
        }
    }

    private static FieldValue readBinaryValue(ByteBuf buf, MySqlType type) {
        switch (type) {
            case TINYINT:
                return FieldValue.of(buf.readRetainedSlice(Byte.BYTES));
            case SMALLINT:
            case YEAR:
                return FieldValue.of(buf.readRetainedSlice(Short.BYTES));
            case MEDIUMINT:
            case INT:
            case FLOAT:
                return FieldValue.of(buf.readRetainedSlice(Integer.BYTES));
            case BIGINT:
            case DOUBLE:
                return FieldValue.of(buf.readRetainedSlice(Long.BYTES));
            case NULL:
                return FieldValue.nullField();
            case DATE:
            case DATETIME:
            case TIMESTAMP:
            case TIME:
                // A length byte and the date/time parts, keeps the length byte.
                return FieldValue.of(buf.readRetainedSlice(buf.getUnsignedByte(buf.readerIndex()) + 1));
            default:
                return FieldValue.of(readVarIntSizedRetained(buf));
        }
    }
}
