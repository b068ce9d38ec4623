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

import io.asyncer.mysql.wire.Capability;
import io.asyncer.mysql.wire.ConnectionContext;
import io.netty.buffer.ByteBuf;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;
import static io.asyncer.mysql.wire.internal.util.NettyBufferUtils.writeCString;
import static io.asyncer.mysql.wire.internal.util.VarIntUtils.writeVarIntSizedBytes;

/**
 * The handshake response of protocol 4.1, carries the user, the first authentication response, the
 * database and the plugin name.
 */
public final class HandshakeResponse41 extends ScalarClientMessage implements SubsequenceClientMessage {

    private final Capability capability;

    private final int collationId;

    private final String user;

    private final byte[] authentication;

    private final String authType;

    @Nullable
    private final String database;

    public HandshakeResponse41(Capability capability, int collationId, String user, byte[] authentication,
        String authType, @Nullable String database) {
        this.capability = requireNonNull(capability, "capability must not be null");
        this.collationId = collationId;
        this.user = requireNonNull(user, "user must not be null");
        this.authentication = requireNonNull(authentication, "authentication must not be null");
        this.authType = requireNonNull(authType, "authType must not be null");
        this.database = database;
    }

    @Override
    protected void writeTo(ByteBuf buf, ConnectionContext context) {
        SslRequest.writeHeader(buf, capability, collationId);
        writeCString(buf, user, StandardCharsets.UTF_8);

        if (capability.isVarIntSizedAuthAllowed()) {
            writeVarIntSizedBytes(buf, authentication);
        } else if (authentication.length <= 0xFF) {
            buf.writeByte(authentication.length).writeBytes(authentication);
        } else {
            throw new IllegalStateException("Authentication response is too long for the server");
        }

        if (capability.isConnectWithDatabase() && database != null) {
            writeCString(buf, database, StandardCharsets.UTF_8);
        }

        if (capability.isPluginAuthAllowed()) {
            writeCString(buf, authType, StandardCharsets.US_ASCII);
        }
    }

    @Override
    public String toString() {
        return "HandshakeResponse41{capability=" + capability + ", collationId=" + collationId + ", user='" +
            user + "', authentication=REDACTED, authType='" + authType + "', database='" + database + "'}";
    }
}
