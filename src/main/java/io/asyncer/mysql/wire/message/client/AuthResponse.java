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

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * A raw authentication response, sent after an authentication switch or a request of more data.
 */
public final class AuthResponse extends ScalarClientMessage implements SubsequenceClientMessage {

    private final byte[] authentication;

    public AuthResponse(byte[] authentication) {
        this.authentication = requireNonNull(authentication, "authentication must not be null");
    }

    @Override
    protected void writeTo(ByteBuf buf, ConnectionContext context) {
        buf.writeBytes(authentication);
    }

    @Override
    public String toString() {
        return "AuthResponse{authentication=REDACTED}";
    }
}
