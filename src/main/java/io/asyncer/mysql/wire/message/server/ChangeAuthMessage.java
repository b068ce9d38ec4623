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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static io.asyncer.mysql.wire.internal.util.NettyBufferUtils.readCString;

/**
 * The authentication switch request, the server asks the client to restart authentication with another
 * plugin and a new salt.
 */
public final class ChangeAuthMessage implements ServerMessage {

    private final String authType;

    private final byte[] salt;

    private ChangeAuthMessage(String authType, byte[] salt) {
        this.authType = authType;
        this.salt = salt;
    }

    public String getAuthType() {
        return authType;
    }

    public byte[] getSalt() {
        return salt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChangeAuthMessage)) {
            return false;
        }

        ChangeAuthMessage that = (ChangeAuthMessage) o;

        return authType.equals(that.authType) && Arrays.equals(salt, that.salt);
    }

    @Override
    public int hashCode() {
        return 31 * authType.hashCode() + Arrays.hashCode(salt);
    }

    @Override
    public String toString() {
        return "ChangeAuthMessage{authType='" + authType + "', salt=REDACTED}";
    }

    static ChangeAuthMessage decode(ByteBuf buf) {
        buf.skipBytes(1);

        String authType = readCString(buf, StandardCharsets.US_ASCII);
        int size = buf.readableBytes();

        // The salt is terminated by a NUL byte which is not a part of the salt.
        if (size > 0 && buf.getByte(buf.writerIndex() - 1) == 0) {
            --size;
        }

        byte[] salt = new byte[size];
        buf.readBytes(salt);

        return new ChangeAuthMessage(authType, salt);
    }
}
