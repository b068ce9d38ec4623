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

package io.asyncer.mysql.wire;

import io.asyncer.mysql.wire.constant.ServerStatuses;
import org.jetbrains.annotations.Nullable;

/**
 * The connection context considers the behavior of server or client. It is created before the transport
 * is connected, and initialized by the initial handshake.
 */
public final class ConnectionContext {

    private static final ServerVersion NONE_VERSION = ServerVersion.create(0, 0, 0);

    /**
     * Collation {@code utf8mb4_general_ci}, available since MySQL 5.5.3.
     */
    private static final int UTF8MB4_GENERAL_CI = 45;

    /**
     * Collation {@code utf8_general_ci} for servers older than 5.5.3.
     */
    private static final int UTF8_GENERAL_CI = 33;

    private final boolean debug;

    private volatile int connectionId = -1;

    private volatile ServerVersion serverVersion = NONE_VERSION;

    @Nullable
    private volatile Capability capability = null;

    /**
     * Assume that the auto commit is always turned on, it will be set after the handshake and each OK
     * or EOF message.
     */
    private volatile short serverStatuses = ServerStatuses.AUTO_COMMIT;

    @Nullable
    private volatile String database;

    ConnectionContext(boolean debug, @Nullable String database) {
        this.debug = debug;
        this.database = database;
    }

    /**
     * Initializes this context by the initial handshake.
     *
     * @param connectionId the connection identifier that is specified by server.
     * @param version      the server version.
     * @param capability   the negotiated connection capabilities.
     */
    public void initHandshake(int connectionId, ServerVersion version, Capability capability) {
        this.connectionId = connectionId;
        this.serverVersion = version;
        this.capability = capability;
    }

    /**
     * Get the connection identifier that is specified by server.
     *
     * @return the connection identifier.
     */
    public int getConnectionId() {
        return connectionId;
    }

    public ServerVersion getServerVersion() {
        return serverVersion;
    }

    /**
     * Get the connection capability. Should use it after this context initialized.
     *
     * @return the connection capability.
     * @throws IllegalStateException if the handshake has not been received.
     */
    public Capability getCapability() {
        Capability capability = this.capability;

        if (capability == null) {
            throw new IllegalStateException("Capability has not been negotiated");
        }

        return capability;
    }

    public boolean isMariaDb() {
        Capability capability = this.capability;

        return (capability != null && capability.isMariaDb()) || serverVersion.isMariaDb();
    }

    /**
     * Get the collation id of the client, always a UTF-8 collation.
     *
     * @return the collation id.
     */
    public int getClientCollationId() {
        return serverVersion.isLessThan(5, 5, 3) ? UTF8_GENERAL_CI : UTF8MB4_GENERAL_CI;
    }

    public boolean isDebug() {
        return debug;
    }

    /**
     * Get the bitmap of server statuses.
     *
     * @return the bitmap.
     */
    public short getServerStatuses() {
        return serverStatuses;
    }

    /**
     * Updates server statuses.
     *
     * @param serverStatuses the bitmap of server statuses.
     */
    public void setServerStatuses(short serverStatuses) {
        this.serverStatuses = serverStatuses;
    }

    public boolean isAutoCommit() {
        return (serverStatuses & ServerStatuses.AUTO_COMMIT) != 0;
    }

    public boolean isInTransaction() {
        return (serverStatuses & ServerStatuses.IN_TRANSACTION) != 0;
    }

    /**
     * Get the current database. It is the database of login, or the last one switched by the connection.
     *
     * @return the database, or {@code null} if no database selected.
     */
    @Nullable
    public String getDatabase() {
        return database;
    }

    void setDatabase(@Nullable String database) {
        this.database = database;
    }
}
