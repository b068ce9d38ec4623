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
 * A command without arguments, e.g. {@code COM_PING}.
 */
public final class CommandMessage extends ScalarClientMessage {

    private static final CommandMessage QUIT = new CommandMessage((byte) 0x01, "COM_QUIT");

    private static final CommandMessage PING = new CommandMessage((byte) 0x0E, "COM_PING");

    private static final CommandMessage RESET_CONNECTION = new CommandMessage((byte) 0x1F,
        "COM_RESET_CONNECTION");

    private final byte flag;

    private final String name;

    private CommandMessage(byte flag, String name) {
        this.flag = flag;
        this.name = name;
    }

    @Override
    public boolean isResponded() {
        return this != QUIT;
    }

    @Override
    protected void writeTo(ByteBuf buf, ConnectionContext context) {
        buf.writeByte(flag);
    }

    @Override
    public String toString() {
        return name;
    }

    public static CommandMessage quit() {
        return QUIT;
    }

    public static CommandMessage ping() {
        return PING;
    }

    public static CommandMessage resetConnection() {
        return RESET_CONNECTION;
    }
}
