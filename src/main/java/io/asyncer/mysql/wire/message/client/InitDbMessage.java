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

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonEmpty;

/**
 * {@code COM_INIT_DB}: switches the default database, answered by an OK or an error.
 */
public final class InitDbMessage extends ScalarClientMessage {

    private static final int COM_INIT_DB = 0x02;

    private final String database;

    public InitDbMessage(String database) {
        this.database = requireNonEmpty(database, "database must not be empty");
    }

    @Override
    protected void writeTo(ByteBuf buf, ConnectionContext context) {
        // The name runs to the end of the payload, no terminator.
        buf.writeByte(COM_INIT_DB);
        buf.writeCharSequence(database, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "COM_INIT_DB: " + database;
    }
}
