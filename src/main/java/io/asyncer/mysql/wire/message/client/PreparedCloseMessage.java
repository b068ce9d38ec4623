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

package io.asyncer.mysql.wire.message.client;

import io.asyncer.mysql.wire.ConnectionContext;
import io.netty.buffer.ByteBuf;

/**
 * The {@code COM_STMT_CLOSE} command, deallocates a prepared statement. The server does not respond.
 */
public final class PreparedCloseMessage extends ScalarClientMessage {

    private static final byte CLOSE_FLAG = 0x19;

    private final int statementId;

    public PreparedCloseMessage(int statementId) {
        this.statementId = statementId;
    }

    @Override
    public boolean isResponded() {
        return false;
    }

    @Override
    protected void writeTo(ByteBuf buf, ConnectionContext context) {
        buf.writeByte(CLOSE_FLAG).writeIntLE(statementId);
    }

    @Override
    public String toString() {
        return "PreparedCloseMessage{statementId=" + statementId + '}';
    }
}
