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

import org.jetbrains.annotations.Nullable;

/**
 * An implementation of {@link MySqlAuthProvider} for type "sha256_password". It has no scramble, the
 * password is sent in cleartext over TLS, or encrypted by the RSA public key of the server.
 */
final class Sha256AuthProvider implements MySqlAuthProvider {

    static final Sha256AuthProvider INSTANCE = new Sha256AuthProvider();

    private static final byte PUBLIC_KEY_REQUEST = 1;

    @Override
    public boolean isSslNecessary() {
        return true;
    }

    @Override
    public byte getPublicKeyRequest() {
        return PUBLIC_KEY_REQUEST;
    }

    @Override
    public byte[] authentication(@Nullable CharSequence password, byte[] salt) {
        return AuthUtils.encodeTerminal(password == null ? "" : password);
    }

    @Override
    public MySqlAuthProvider next() {
        return this;
    }

    @Override
    public String getType() {
        return SHA256_PASSWORD;
    }

    private Sha256AuthProvider() { }
}
