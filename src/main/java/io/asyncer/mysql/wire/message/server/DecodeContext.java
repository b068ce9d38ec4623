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

import io.asyncer.mysql.wire.ConnectionContext;
import io.asyncer.mysql.wire.ProtocolFramingException;
import io.netty.buffer.ByteBuf;
import org.jetbrains.annotations.Nullable;

/**
 * The state of decoding, which decides how the next payload is interpreted. The same header byte means
 * different messages in different phases, e.g. {@code 0xFE} is an authentication switch in the login phase
 * but the terminal of rows in a result set.
 */
public abstract class DecodeContext {

    static final short OK = 0x00;

    static final short AUTH_MORE_DATA = 0x01;

    static final short LOCAL_INFILE = 0xFB;

    static final short EOF = 0xFE;

    static final short ERROR = 0xFF;

    /**
     * Decodes a payload. The payload is released by the caller.
     *
     * @param buf     the payload.
     * @param context the connection context.
     * @return the message, or {@code null} if more payloads are needed, e.g. column definitions.
     */
    @Nullable
    abstract ServerMessage decode(ByteBuf buf, ConnectionContext context);

    public static DecodeContext login() {
        return new LoginDecodeContext();
    }

    public static DecodeContext command() {
        return CommandDecodeContext.INSTANCE;
    }

    public static DecodeContext prepareQuery() {
        return PrepareQueryDecodeContext.INSTANCE;
    }

    public static DecodeContext result(boolean eofDeprecated, int totalColumns) {
        return new ResultDecodeContext(eofDeprecated, totalColumns);
    }

    public static DecodeContext preparedMetadata(boolean eofDeprecated, int totalColumns,
        int totalParameters) {
        return new PreparedMetadataDecodeContext(eofDeprecated, totalColumns, totalParameters);
    }

    static ProtocolFramingException unknownHeader(short header, String phase) {
        return new ProtocolFramingException("Unknown message header 0x" + Integer.toHexString(header) +
            " in " + phase);
    }

    private static final class LoginDecodeContext extends DecodeContext {

        private boolean handshakeReceived;

        @Override
        ServerMessage decode(ByteBuf buf, ConnectionContext context) {
            short header = buf.getUnsignedByte(buf.readerIndex());

            if (!handshakeReceived) {
                handshakeReceived = true;

                // A server may refuse the connection before the handshake, e.g. too many connections.
                return header == ERROR ? ErrorMessage.decode(buf) : HandshakeRequest.decode(buf);
            }

            switch (header) {
                case OK:
                    return OkMessage.decode(buf);
                case AUTH_MORE_DATA:
                    return AuthMoreDataMessage.decode(buf);
                case EOF:
                    return ChangeAuthMessage.decode(buf);
                case ERROR:
                    return ErrorMessage.decode(buf);
            }

            throw unknownHeader(header, "login phase");
        }

        @Override
        public String toString() {
            return "DecodeContext-Login";
        }
    }

    private static final class CommandDecodeContext extends DecodeContext {

        static final CommandDecodeContext INSTANCE = new CommandDecodeContext();

        @Override
        ServerMessage decode(ByteBuf buf, ConnectionContext context) {
            short header = buf.getUnsignedByte(buf.readerIndex());

            switch (header) {
                case ERROR:
                    return ErrorMessage.decode(buf);
                case OK:
                    if (OkMessage.isValidSize(buf.readableBytes())) {
                        return OkMessage.decode(buf);
                    }
                    break;
                case LOCAL_INFILE:
                    throw new ProtocolFramingException("LOCAL INFILE is not supported");
                case EOF:
                    if (buf.readableBytes() == EofMessage.SIZE) {
                        return EofMessage.decode(buf);
                    }
                    break;
            }

            return ColumnCountMessage.decode(buf);
        }

        @Override
        public String toString() {
            return "DecodeContext-Command";
        }
    }

    private static final class PrepareQueryDecodeContext extends DecodeContext {

        static final PrepareQueryDecodeContext INSTANCE = new PrepareQueryDecodeContext();

        @Override
        ServerMessage decode(ByteBuf buf, ConnectionContext context) {
            short header = buf.getUnsignedByte(buf.readerIndex());

            if (header == ERROR) {
                return ErrorMessage.decode(buf);
            } else if (header == OK && PreparedOkMessage.isValidSize(buf.readableBytes())) {
                return PreparedOkMessage.decode(buf);
            }

            throw unknownHeader(header, "prepare response");
        }

        @Override
        public String toString() {
            return "DecodeContext-PrepareQuery";
        }
    }
}
