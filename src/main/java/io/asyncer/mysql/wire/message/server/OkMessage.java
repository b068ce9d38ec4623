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

import static io.asyncer.mysql.wire.internal.util.VarIntUtils.readVarInt;

/**
 * The OK packet, which means a command completed. A result set is also terminated by an OK packet when
 * {@code CLIENT_DEPRECATE_EOF} was negotiated, it has header {@code 0xFE} in that case.
 */
public final class OkMessage implements CompleteMessage {

    private static final int MIN_SIZE = 7;

    private final long affectedRows;

    private final long lastInsertId;

    private final short serverStatuses;

    private final int warnings;

    private final String information;

    private OkMessage(long affectedRows, long lastInsertId, short serverStatuses, int warnings,
        String information) {
        this.affectedRows = affectedRows;
        this.lastInsertId = lastInsertId;
        this.serverStatuses = serverStatuses;
        this.warnings = warnings;
        this.information = information;
    }

    /**
     * Get the affected rows, it is an unsigned 64-bits integer.
     *
     * @return the affected rows.
     */
    public long getAffectedRows() {
        return affectedRows;
    }

    /**
     * Get the last inserted id, it is an unsigned 64-bits integer and {@code 0} if nothing generated.
     *
     * @return the last inserted id.
     */
    public long getLastInsertId() {
        return lastInsertId;
    }

    @Override
    public short getServerStatuses() {
        return serverStatuses;
    }

    public int getWarnings() {
        return warnings;
    }

    public String getInformation() {
        return information;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OkMessage)) {
            return false;
        }

        OkMessage that = (OkMessage) o;

        return affectedRows == that.affectedRows && lastInsertId == that.lastInsertId &&
            serverStatuses == that.serverStatuses && warnings == that.warnings &&
            information.equals(that.information);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(affectedRows);
        result = 31 * result + Long.hashCode(lastInsertId);
        result = 31 * result + serverStatuses;
        result = 31 * result + warnings;
        return 31 * result + information.hashCode();
    }

    @Override
    public String toString() {
        if (warnings == 0) {
            return "OkMessage{affectedRows=" + Long.toUnsignedString(affectedRows) + ", lastInsertId=" +
                Long.toUnsignedString(lastInsertId) + ", serverStatuses=" + Integer.toHexString(serverStatuses) +
                ", information='" + information + "'}";
        }

        return "OkMessage{affectedRows=" + Long.toUnsignedString(affectedRows) + ", lastInsertId=" +
            Long.toUnsignedString(lastInsertId) + ", serverStatuses=" + Integer.toHexString(serverStatuses) +
            ", warnings=" + warnings + ", information='" + information + "'}";
    }

    static boolean isValidSize(int bytes) {
        return bytes >= MIN_SIZE;
    }

    /**
     * Decodes an OK packet, includes the header byte.
     *
     * @param buf the payload.
     * @return the OK message.
     */
    public static OkMessage decode(ByteBuf buf) {
        buf.skipBytes(1);

        long affectedRows = readVarInt(buf);
        long lastInsertId = readVarInt(buf);
        short serverStatuses = buf.readShortLE();
        int warnings = buf.readUnsignedShortLE();
        String information = buf.isReadable() ? buf.toString(StandardCharsets.UTF_8) : "";

        return new OkMessage(affectedRows, lastInsertId, serverStatuses, warnings, information);
    }
}
