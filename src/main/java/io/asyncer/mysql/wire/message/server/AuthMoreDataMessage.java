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
 * Extra authentication data sent by the server, e.g. the result of the fast authentication of
 * {@code caching_sha2_password} or an RSA public key.
 */
public final class AuthMoreDataMessage implements ServerMessage {

    private static final byte FAST_AUTH_SUCCESS = 3;

    private static final byte FULL_AUTH_REQUIRED = 4;

    private final byte[] data;

    private AuthMoreDataMessage(byte[] data) {
        this.data = data;
    }

    public byte[] getData() {
        return data;
    }

    /**
     * Checks if the fast authentication of {@code caching_sha2_password} succeeded, an OK will follow.
     *
     * @return if succeeded.
     */
    public boolean isFastAuthSuccess() {
        return data.length == 1 && data[0] == FAST_AUTH_SUCCESS;
    }

    /**
     * Checks if the fast authentication failed and the server requires a full authentication.
     *
     * @return if full authentication is required.
     */
    public boolean isFullAuthRequired() {
        return data.length == 1 && data[0] == FULL_AUTH_REQUIRED;
    }

    @Override
    public String toString() {
        return "AuthMoreDataMessage{size=" + data.length + '}';
    }

    static AuthMoreDataMessage decode(ByteBuf buf) {
        buf.skipBytes(1);

        byte[] data = new byte[buf.readableBytes()];
        buf.readBytes(data);

        return new AuthMoreDataMessage(data);
    }
}
