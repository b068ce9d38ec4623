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

package io.asyncer.mysql.wire.authentication;

import io.asyncer.mysql.wire.AuthenticationException;
import org.jetbrains.annotations.Nullable;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * An abstraction of MySQL authorization plugin provider for connection phase. The server selects the
 * authentication type in the handshake and may switch it by an authentication switch request.
 */
public interface MySqlAuthProvider {

    /**
     * The new authentication plugin type under MySQL 8.0+. It is also the default type of MySQL 8.0.x.
     */
    String CACHING_SHA2_PASSWORD = "caching_sha2_password";

    /**
     * The most generic authentication type in MySQL 5.x.
     */
    String MYSQL_NATIVE_PASSWORD = "mysql_native_password";

    /**
     * The new authentication plugin type under MySQL 5.6+, it needs either TLS or the RSA public key of the
     * server.
     */
    String SHA256_PASSWORD = "sha256_password";

    /**
     * Try use empty string to represent has no authentication provider when
     * {@code Capability.PLUGIN_AUTH} does not set.
     */
    String NO_AUTH_PROVIDER = "";

    /**
     * The cleartext password authentication, it sends the password in plaintext and requires TLS.
     */
    String MYSQL_CLEAR_PASSWORD = "mysql_clear_password";

    /**
     * Checks if the authentication type requires a secure channel, i.e. the password is sent in cleartext or
     * encrypted by the RSA public key.
     *
     * @return if it requires TLS or RSA.
     */
    boolean isSslNecessary();

    /**
     * Get the request byte for the RSA public key of the server, used if the channel is not secure.
     *
     * @return the request byte, or {@code 0} if the authentication type does not support RSA.
     */
    default byte getPublicKeyRequest() {
        return 0;
    }

    /**
     * Generates an authorization of the current provider.
     *
     * @param password user password, UTF-8 encoded.
     * @param salt     password salt for hash algorithm.
     * @return encrypted authorization.
     */
    byte[] authentication(@Nullable CharSequence password, byte[] salt);

    /**
     * Get the next authentication provider of the current one, e.g. the full authentication after the fast
     * authentication of {@code caching_sha2_password} fails.
     *
     * @return the next provider.
     */
    MySqlAuthProvider next();

    /**
     * Get the authentication type name.
     *
     * @return the type name.
     */
    String getType();

    /**
     * Builds the provider of an authentication type.
     *
     * @param type           the authentication type, may be empty.
     * @param pluginAuthUsed if the server supports authentication plugins.
     * @return the provider.
     * @throws AuthenticationException if the authentication type is unknown.
     */
    static MySqlAuthProvider build(String type, boolean pluginAuthUsed) {
        requireNonNull(type, "type must not be null");

        switch (type) {
            case CACHING_SHA2_PASSWORD:
                return CachingSha2FastAuthProvider.INSTANCE;
            case MYSQL_NATIVE_PASSWORD:
                return NativePasswordAuthProvider.INSTANCE;
            case SHA256_PASSWORD:
                return Sha256AuthProvider.INSTANCE;
            case MYSQL_CLEAR_PASSWORD:
                return MySqlClearAuthProvider.INSTANCE;
            case NO_AUTH_PROVIDER:
                // Servers without plugin authentication use the native password.
                return pluginAuthUsed ? NoAuthProvider.INSTANCE : NativePasswordAuthProvider.INSTANCE;
        }

        throw AuthenticationException.local("Unknown authentication plugin '" + type + "'");
    }

    /**
     * Checks if a password is empty, the authentication is trivial in this case.
     *
     * @param password the password.
     * @return if it is {@code null} or empty.
     */
    static boolean isEmpty(@Nullable CharSequence password) {
        return password == null || password.length() == 0;
    }
}
