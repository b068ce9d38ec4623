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
import io.asyncer.mysql.wire.constant.Packets;
import io.netty.buffer.ByteBuf;
import org.jetbrains.annotations.Nullable;

/**
 * Decodes a result set: column definitions, an EOF if it is not deprecated, rows and a terminal EOF or OK.
 */
final class ResultDecodeContext extends DecodeContext {

    private final boolean eofDeprecated;

    private final DefinitionMetadataMessage[] definitions;

    private int collected;

    private boolean metadataEmitted;

    ResultDecodeContext(boolean eofDeprecated, int totalColumns) {
        this.eofDeprecated = eofDeprecated;
        this.definitions = new DefinitionMetadataMessage[totalColumns];
    }

    @Nullable
    @Override
    ServerMessage decode(ByteBuf buf, ConnectionContext context) {
        short header = buf.getUnsignedByte(buf.readerIndex());

        if (header == ERROR) {
            return ErrorMessage.decode(buf);
        }

        if (metadataEmitted) {
            return decodeRow(buf, header);
        }

        if (collected < definitions.length) {
            definitions[collected++] = DefinitionMetadataMessage.decode(buf);

            if (collected == definitions.length && eofDeprecated) {
                metadataEmitted = true;
                return new SyntheticMetadataMessage(false, definitions);
            }

            return null;
        }

        if (header != EOF) {
            throw unknownHeader(header, "result metadata terminal");
        }

        // EOF of metadata, warnings and statuses are ignored because the terminal of rows also has them.
        metadataEmitted = true;

        return new SyntheticMetadataMessage(false, definitions);
    }

    private ServerMessage decodeRow(ByteBuf buf, short header) {
        if (header == EOF) {
            int size = buf.readableBytes();

            if (eofDeprecated && size < Packets.MAX_PAYLOAD_SIZE) {
                return OkMessage.decode(buf);
            } else if (!eofDeprecated && size == EofMessage.SIZE) {
                return EofMessage.decode(buf);
            } else if (!eofDeprecated && size < EofMessage.SIZE) {
                throw new ProtocolFramingException("EOF packet is too short, size " + size);
            }
        }

        return new RowMessage(buf.retain());
    }

    @Override
    public String toString() {
        return "DecodeContext-Result{eofDeprecated=" + eofDeprecated + ", totalColumns=" + definitions.length +
            ", collected=" + collected + '}';
    }
}
