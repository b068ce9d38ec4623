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
import io.netty.buffer.ByteBuf;
import org.jetbrains.annotations.Nullable;

/**
 * Decodes the parameter and column definitions following a {@link PreparedOkMessage}. Only the column
 * definitions are emitted, parameters are counted.
 */
final class PreparedMetadataDecodeContext extends DecodeContext {

    private final boolean eofDeprecated;

    private final DefinitionMetadataMessage[] columns;

    private int remainingParameters;

    private int collectedColumns;

    private boolean awaitingParameterEof;

    PreparedMetadataDecodeContext(boolean eofDeprecated, int totalColumns, int totalParameters) {
        this.eofDeprecated = eofDeprecated;
        this.columns = new DefinitionMetadataMessage[totalColumns];
        this.remainingParameters = totalParameters;
    }

    @Nullable
    @Override
    ServerMessage decode(ByteBuf buf, ConnectionContext context) {
        short header = buf.getUnsignedByte(buf.readerIndex());

        if (header == ERROR) {
            return ErrorMessage.decode(buf);
        }

        if (remainingParameters > 0) {
            DefinitionMetadataMessage.decode(buf);

            if (--remainingParameters == 0) {
                if (!eofDeprecated) {
                    awaitingParameterEof = true;
                    return null;
                }

                return columns.length == 0 ? complete() : null;
            }

            return null;
        }

        if (awaitingParameterEof) {
            if (header != EOF) {
                throw unknownHeader(header, "parameter definitions terminal");
            }

            awaitingParameterEof = false;

            return columns.length == 0 ? complete() : null;
        }

        if (collectedColumns < columns.length) {
            columns[collectedColumns++] = DefinitionMetadataMessage.decode(buf);

            return collectedColumns == columns.length && eofDeprecated ? complete() : null;
        }

        if (header != EOF) {
            throw unknownHeader(header, "column definitions terminal");
        }

        return complete();
    }

    private SyntheticMetadataMessage complete() {
        return new SyntheticMetadataMessage(true, columns);
    }

    @Override
    public String toString() {
        return "DecodeContext-PreparedMetadata{eofDeprecated=" + eofDeprecated + ", totalColumns=" +
            columns.length + ", remainingParameters=" + remainingParameters + '}';
    }
}
