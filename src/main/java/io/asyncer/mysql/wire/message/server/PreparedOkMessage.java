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

import io.netty.buffer.ByteBuf;

/**
 * The first response packet of {@code COM_STMT_PREPARE}.
 */
public final class PreparedOkMessage implements ServerMessage {

    private static final int MIN_SIZE = 9;

    private final int statementId;

    private final int totalColumns;

    private final int totalParameters;

    private PreparedOkMessage(int statementId, int totalColumns, int totalParameters) {
        this.statementId = statementId;
        this.totalColumns = totalColumns;
        this.totalParameters = totalParameters;
    }

    public int getStatementId() {
        return statementId;
    }

    public int getTotalColumns() {
        return totalColumns;
    }

    public int getTotalParameters() {
        return totalParameters;
    }

    @Override
    public String toString() {
        return "PreparedOkMessage{statementId=" + statementId + ", totalColumns=" + totalColumns +
            ", totalParameters=" + totalParameters + '}';
    }

    static boolean isValidSize(int bytes) {
        return bytes >= MIN_SIZE;
    }

    static PreparedOkMessage decode(ByteBuf buf) {
        buf.skipBytes(1);

        int statementId = buf.readIntLE();
        int totalColumns = buf.readUnsignedShortLE();
        int totalParameters = buf.readUnsignedShortLE();

        return new PreparedOkMessage(statementId, totalColumns, totalParameters);
    }
}
