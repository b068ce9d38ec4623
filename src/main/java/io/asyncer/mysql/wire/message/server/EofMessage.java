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
 * The EOF packet of protocol 4.1. It terminates column definitions and rows when
 * {@code CLIENT_DEPRECATE_EOF} is not negotiated.
 */
public final class EofMessage implements CompleteMessage {

    static final int SIZE = 5;

    private final int warnings;

    private final short serverStatuses;

    private EofMessage(int warnings, short serverStatuses) {
        this.warnings = warnings;
        this.serverStatuses = serverStatuses;
    }

    public int getWarnings() {
        return warnings;
    }

    @Override
    public short getServerStatuses() {
        return serverStatuses;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EofMessage)) {
            return false;
        }

        EofMessage that = (EofMessage) o;

        return warnings == that.warnings && serverStatuses == that.serverStatuses;
    }

    @Override
    public int hashCode() {
        return 31 * warnings + serverStatuses;
    }

    @Override
    public String toString() {
        return "EofMessage{warnings=" + warnings + ", serverStatuses=" + Integer.toHexString(serverStatuses) +
            '}';
    }

    static EofMessage decode(ByteBuf buf) {
        buf.skipBytes(1);

        return new EofMessage(buf.readUnsignedShortLE(), buf.readShortLE());
    }
}
