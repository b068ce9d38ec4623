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
import io.asyncer.mysql.wire.constant.Packets;
import io.netty.buffer.ByteBuf;

/**
 * The SSL request of protocol 4.1, the server starts a TLS handshake after it is received. It is a prefix of
 * {@link HandshakeResponse41} without credentials.
 */
public final class SslRequest extends ScalarClientMessage implements SubsequenceClientMessage {

    static final int FILTER_SIZE = 23;

    private final Capability capability;

    private final int collationId;

    public SslRequest(Capability capability, int collationId) {
        this.capability = capability;
        this.collationId = collationId;
    }

    public Capability getCapability() {
        return capability;
    }

    @Override
    protected void writeTo(ByteBuf buf, ConnectionContext context) {
        writeHeader(buf, capability, collationId);
    }

    static void writeHeader(ByteBuf buf, Capability capability, int collationId) {
        buf.writeIntLE(capability.getBaseBitmap())
            .writeIntLE(Packets.MAX_PAYLOAD_SIZE)
            .writeByte(collationId & 0xFF)
            .writeZero(FILTER_SIZE);
    }

    @Override
    public String toString() {
        return "SslRequest{capability=" + capability + ", collationId=" + collationId + '}';
    }
}
