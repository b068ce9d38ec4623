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

import io.asyncer.mysql.wire.Capability;
import io.asyncer.mysql.wire.ProtocolFramingException;
import io.asyncer.mysql.wire.ServerVersion;
import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static io.asyncer.mysql.wire.internal.util.NettyBufferUtils.readCString;

/**
 * The initial handshake of protocol version 10, the first packet of a connection.
 */
public final class HandshakeRequest implements ServerStatusMessage {

    private static final int PROTOCOL_VERSION = 10;

    private static final int SALT_FIRST_PART_SIZE = 8;

    private static final int MIN_SALT_SECOND_PART_SIZE = 12;

    private static final int RESERVED_SIZE = 10;

    private final ServerVersion serverVersion;

    private final int connectionId;

    private final Capability serverCapability;

    private final int collationId;

    private final short serverStatuses;

    private final byte[] salt;

    private final String authType;

    private HandshakeRequest(ServerVersion serverVersion, int connectionId, Capability serverCapability,
        int collationId, short serverStatuses, byte[] salt, String authType) {
        this.serverVersion = serverVersion;
        this.connectionId = connectionId;
        this.serverCapability = serverCapability;
        this.collationId = collationId;
        this.serverStatuses = serverStatuses;
        this.salt = salt;
        this.authType = authType;
    }

    public ServerVersion getServerVersion() {
        return serverVersion;
    }

    public int getConnectionId() {
        return connectionId;
    }

    public Capability getServerCapability() {
        return serverCapability;
    }

    public int getCollationId() {
        return collationId;
    }

    @Override
    public short getServerStatuses() {
        return serverStatuses;
    }

    /**
     * Get the challenge of authentication, includes both parts without the terminal.
     *
     * @return the salt.
     */
    public byte[] getSalt() {
        return salt;
    }

    /**
     * Get the name of the default authentication plugin of the server.
     *
     * @return the plugin name, empty if the server does not support plugins.
     */
    public String getAuthType() {
        return authType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HandshakeRequest)) {
            return false;
        }

        HandshakeRequest that = (HandshakeRequest) o;

        return connectionId == that.connectionId && collationId == that.collationId &&
            serverStatuses == that.serverStatuses && serverVersion.equals(that.serverVersion) &&
            serverCapability.equals(that.serverCapability) && Arrays.equals(salt, that.salt) &&
            authType.equals(that.authType);
    }

    @Override
    public int hashCode() {
        int hash = serverVersion.hashCode();
        hash = 31 * hash + connectionId;
        hash = 31 * hash + serverCapability.hashCode();
        hash = 31 * hash + collationId;
        hash = 31 * hash + serverStatuses;
        hash = 31 * hash + Arrays.hashCode(salt);
        return 31 * hash + authType.hashCode();
    }

    @Override
    public String toString() {
        return "HandshakeRequest{serverVersion=" + serverVersion + ", connectionId=" + connectionId +
            ", serverCapability=" + serverCapability + ", collationId=" + collationId + ", serverStatuses=" +
            Integer.toHexString(serverStatuses) + ", salt=REDACTED, authType='" + authType + "'}";
    }

    /**
     * Decodes the initial handshake.
     *
     * @param buf the payload.
     * @return the handshake.
     * @throws ProtocolFramingException if the protocol version is not 10.
     */
    public static HandshakeRequest decode(ByteBuf buf) {
        int protocolVersion = buf.readUnsignedByte();

        if (protocolVersion != PROTOCOL_VERSION) {
            throw new ProtocolFramingException("Unsupported handshake protocol version " + protocolVersion);
        }

        ServerVersion serverVersion = ServerVersion.parse(readCString(buf, StandardCharsets.US_ASCII));
        int connectionId = buf.readIntLE();
        byte[] saltFirst = new byte[SALT_FIRST_PART_SIZE];

        buf.readBytes(saltFirst);
        // Filler.
        buf.skipBytes(1);

        long capabilities = buf.readUnsignedShortLE();

        if (!buf.isReadable()) {
            return new HandshakeRequest(serverVersion, connectionId, Capability.of(capabilities), 0,
                (short) 0, saltFirst, "");
        }

        int collationId = buf.readUnsignedByte();
        short serverStatuses = buf.readShortLE();

        capabilities |= ((long) buf.readUnsignedShortLE()) << 16;

        Capability capability = Capability.of(capabilities);
        int saltSize = buf.readUnsignedByte();

        buf.skipBytes(RESERVED_SIZE);

        byte[] salt = saltFirst;

        if (capability.isSaltSecured()) {
            int secondSize = Math.max(MIN_SALT_SECOND_PART_SIZE, saltSize - SALT_FIRST_PART_SIZE - 1);
            salt = Arrays.copyOf(saltFirst, SALT_FIRST_PART_SIZE + secondSize);

            buf.readBytes(salt, SALT_FIRST_PART_SIZE, secondSize);

            // Terminal of the salt.
            if (buf.isReadable() && buf.getByte(buf.readerIndex()) == 0) {
                buf.skipBytes(1);
            }
        }

        String authType = capability.isPluginAuthAllowed() ? readCString(buf, StandardCharsets.US_ASCII) : "";

        return new HandshakeRequest(serverVersion, connectionId, capability, collationId, serverStatuses, salt,
            authType);
    }
}
