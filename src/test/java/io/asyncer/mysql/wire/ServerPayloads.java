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

package io.asyncer.mysql.wire;

import io.asyncer.mysql.wire.constant.MySqlType;
import io.asyncer.mysql.wire.internal.util.VarIntUtils;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;

/**
 * Builds payloads the way a server sends them, without packet headers.
 */
public final class ServerPayloads {

    /**
     * The capabilities of a MySQL 8 server, without {@code SSL}.
     */
    public static final long SERVER_CAPABILITIES = 0x01FFF7FFL & ~2048L;

    public static final byte[] SALT = "0123456789abcdefghij".getBytes(StandardCharsets.US_ASCII);

    public static ByteBuf handshake(int connectionId, String version, long capabilities, String authType) {
        ByteBuf buf = Unpooled.buffer()
            .writeByte(10)
            .writeBytes(version.getBytes(StandardCharsets.US_ASCII))
            .writeByte(0)
            .writeIntLE(connectionId)
            .writeBytes(SALT, 0, 8)
            .writeByte(0)
            .writeShortLE((int) capabilities)
            .writeByte(45)
            .writeShortLE(2)
            .writeShortLE((int) (capabilities >>> 16))
            .writeByte(SALT.length + 1)
            .writeZero(10)
            .writeBytes(SALT, 8, SALT.length - 8)
            .writeByte(0);

        return buf.writeBytes(authType.getBytes(StandardCharsets.US_ASCII)).writeByte(0);
    }

    public static ByteBuf ok(long affectedRows, long lastInsertId, int serverStatuses) {
        return okLike(0, affectedRows, lastInsertId, serverStatuses);
    }

    /**
     * The terminal of a result set when {@code CLIENT_DEPRECATE_EOF} is negotiated.
     */
    public static ByteBuf eofOk(int serverStatuses) {
        return okLike(0xFE, 0, 0, serverStatuses);
    }

    public static ByteBuf eof(int serverStatuses) {
        return Unpooled.buffer().writeByte(0xFE).writeShortLE(0).writeShortLE(serverStatuses);
    }

    public static ByteBuf error(int code, @Nullable String sqlState, String message) {
        ByteBuf buf = Unpooled.buffer().writeByte(0xFF).writeShortLE(code);

        if (sqlState != null) {
            buf.writeByte('#').writeBytes(sqlState.getBytes(StandardCharsets.US_ASCII));
        }

        return buf.writeBytes(message.getBytes(StandardCharsets.UTF_8));
    }

    public static ByteBuf columnCount(int columns) {
        ByteBuf buf = Unpooled.buffer();

        VarIntUtils.writeVarInt(buf, columns);

        return buf;
    }

    public static ByteBuf column(String name, MySqlType type, int definitions) {
        ByteBuf buf = Unpooled.buffer();

        writeString(buf, "def");
        writeString(buf, "test");
        writeString(buf, "t");
        writeString(buf, "t");
        writeString(buf, name);
        writeString(buf, name);

        return buf.writeByte(0x0C)
            .writeShortLE(45)
            .writeIntLE(64)
            .writeByte(type.getId())
            .writeShortLE(definitions)
            .writeByte(0)
            .writeZero(2);
    }

    public static ByteBuf textRow(@Nullable String... values) {
        ByteBuf buf = Unpooled.buffer();

        for (String value : values) {
            if (value == null) {
                buf.writeByte(0xFB);
            } else {
                writeString(buf, value);
            }
        }

        return buf;
    }

    public static ByteBuf changeAuth(String authType, byte[] salt) {
        return Unpooled.buffer()
            .writeByte(0xFE)
            .writeBytes(authType.getBytes(StandardCharsets.US_ASCII))
            .writeByte(0)
            .writeBytes(salt)
            .writeByte(0);
    }

    public static ByteBuf authMoreData(byte[] data) {
        return Unpooled.buffer().writeByte(1).writeBytes(data);
    }

    public static ByteBuf preparedOk(int statementId, int columns, int parameters) {
        return Unpooled.buffer()
            .writeByte(0)
            .writeIntLE(statementId)
            .writeShortLE(columns)
            .writeShortLE(parameters)
            .writeByte(0)
            .writeShortLE(0);
    }

    private static ByteBuf okLike(int header, long affectedRows, long lastInsertId, int serverStatuses) {
        ByteBuf buf = Unpooled.buffer().writeByte(header);

        VarIntUtils.writeVarInt(buf, affectedRows);
        VarIntUtils.writeVarInt(buf, lastInsertId);

        return buf.writeShortLE(serverStatuses).writeShortLE(0);
    }

    private static void writeString(ByteBuf buf, String value) {
        VarIntUtils.writeVarIntSizedBytes(buf, value.getBytes(StandardCharsets.UTF_8));
    }

    private ServerPayloads() { }
}
