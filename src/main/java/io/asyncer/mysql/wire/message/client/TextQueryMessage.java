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

import java.nio.charset.StandardCharsets;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * The {@code COM_QUERY} command, the SQL is sent opaquely and the result uses the text protocol.
 */
public final class TextQueryMessage extends ScalarClientMessage {

    static final byte QUERY_FLAG = 0x03;

    private final String sql;

    public TextQueryMessage(String sql) {
        this.sql = requireNonNull(sql, "sql must not be null");
    }

    @Override
    protected void writeTo(ByteBuf buf, ConnectionContext context) {
        buf.writeByte(QUERY_FLAG).writeCharSequence(sql, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "TextQueryMessage{sql=REDACTED}";
    }
}
