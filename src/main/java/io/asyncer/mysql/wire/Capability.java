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

/**
 * A capabilities flag bitmap considers to define the session behaviors of the connection.
 * <p>
 * The effective capabilities of a connection are the intersection of what the client desires and what the
 * server advertises in its initial handshake, see {@link #intersect(Capability)}.
 */
public final class Capability {

    /**
     * If UNSET, the server supports the MariaDB protocol and statements.
     */
    private static final long CLIENT_MYSQL = 1L;

    /**
     * Use found/touched rows instead of changed rows for affected rows.
     */
    private static final long FOUND_ROWS = 2L;

    /**
     * Use 2-bytes column definition flags.
     */
    private static final long LONG_FLAG = 4L;

    /**
     * Connect to server with a database.
     */
    private static final long CONNECT_WITH_DB = 8L;

    /**
     * The protocol version is 4.1 (instead of 3.20).
     */
    private static final long PROTOCOL_41 = 512L;

    /**
     * Enable SSL.
     */
    private static final long SSL = 2048L;

    /**
     * Allow transactions. All available versions of MySQL server support it.
     */
    private static final long TRANSACTIONS = 8192L;

    /**
     * Allow second part of authentication hashing salt.
     * <p>
     * Origin name: SECURE_CONNECTION.
     */
    private static final long SECURE_SALT = 32768L;

    /**
     * Allow to send multiple statements in one text query. The client never sends it.
     */
    private static final long MULTI_STATEMENTS = 65536L;

    /**
     * Allow to receive multiple results in the response of executing a text query.
     */
    private static final long MULTI_RESULTS = 1L << 17;

    /**
     * Allow to receive multiple results in the response of executing a prepared statement.
     */
    private static final long PS_MULTI_RESULTS = 1L << 18;

    /**
     * Supports authentication plugins. Server will send more details (i.e. name) for authentication plugin.
     */
    private static final long PLUGIN_AUTH = 1L << 19;

    /**
     * Can use var-integer sized bytes to encode client authentication.
     * <p>
     * Origin name: PLUGIN_AUTH_LENENC_CLIENT_DATA.
     */
    private static final long VAR_INT_SIZED_AUTH = 1L << 21;

    /**
     * The server marks the EOF message as deprecated and use OK message instead.
     */
    private static final long DEPRECATE_EOF = 1L << 24;

    private static final long ALL_SUPPORTED = CLIENT_MYSQL | FOUND_ROWS | LONG_FLAG | CONNECT_WITH_DB |
        PROTOCOL_41 | SSL | TRANSACTIONS | SECURE_SALT | MULTI_STATEMENTS | MULTI_RESULTS | PS_MULTI_RESULTS |
        PLUGIN_AUTH | VAR_INT_SIZED_AUTH | DEPRECATE_EOF;

    private static final long CLIENT_BASE = CLIENT_MYSQL | FOUND_ROWS | LONG_FLAG | PROTOCOL_41 |
        TRANSACTIONS | SECURE_SALT | MULTI_RESULTS | PS_MULTI_RESULTS | PLUGIN_AUTH | VAR_INT_SIZED_AUTH |
        DEPRECATE_EOF;

    private final long bitmap;

    /**
     * Checks if the connection is using MariaDB capabilities.
     *
     * @return if using MariaDB capabilities.
     */
    public boolean isMariaDb() {
        return (bitmap & CLIENT_MYSQL) == 0;
    }

    public boolean isConnectWithDatabase() {
        return (bitmap & CONNECT_WITH_DB) != 0;
    }

    public boolean isSslEnabled() {
        return (bitmap & SSL) != 0;
    }

    public boolean isProtocol41() {
        return (bitmap & PROTOCOL_41) != 0;
    }

    public boolean isVarIntSizedAuthAllowed() {
        return (bitmap & VAR_INT_SIZED_AUTH) != 0;
    }

    public boolean isPluginAuthAllowed() {
        return (bitmap & PLUGIN_AUTH) != 0;
    }

    public boolean isEofDeprecated() {
        return (bitmap & DEPRECATE_EOF) != 0;
    }

    public boolean isSaltSecured() {
        return (bitmap & SECURE_SALT) != 0;
    }

    /**
     * Intersects this with the capabilities of the other side of the connection.
     *
     * @param other the capabilities of the other side.
     * @return the capabilities both sides agree to enable.
     */
    public Capability intersect(Capability other) {
        return new Capability(this.bitmap & other.bitmap);
    }

    /**
     * Get the lower 32-bits bitmap of {@link Capability this}.
     *
     * @return the lower 32-bits bitmap.
     */
    public int getBaseBitmap() {
        return (int) bitmap;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Capability)) {
            return false;
        }

        Capability that = (Capability) o;

        return bitmap == that.bitmap;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(bitmap);
    }

    @Override
    public String toString() {
        // Do not consider complex output, just use hex.
        return "Capability<0x" + Long.toHexString(bitmap) + '>';
    }

    private Capability(long bitmap) {
        this.bitmap = bitmap;
    }

    /**
     * Creates a {@link Capability} with capabilities bitmap. It will unset all unknown flags.
     *
     * @param capabilities the bitmap of capabilities.
     * @return the {@link Capability} without unknown flags.
     */
    public static Capability of(long capabilities) {
        return new Capability(capabilities & ALL_SUPPORTED);
    }

    /**
     * Creates the capabilities desired by the client.
     *
     * @param withDatabase if login with a database.
     * @param ssl          if TLS is requested.
     * @return the desired capabilities.
     */
    public static Capability clientDesired(boolean withDatabase, boolean ssl) {
        long bitmap = CLIENT_BASE;

        if (withDatabase) {
            bitmap |= CONNECT_WITH_DB;
        }

        if (ssl) {
            bitmap |= SSL;
        }

        return new Capability(bitmap);
    }
}
