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
 * Second stage of {@code caching_sha2_password}, entered when the server's cache misses. The password is
 * either sent plain over TLS or, on a plaintext session, RSA-encrypted after asking the server for its public
 * key with the request byte {@code 2}.
 */
final class CachingSha2FullAuthProvider implements MySqlAuthProvider {

    static final CachingSha2FullAuthProvider INSTANCE = new CachingSha2FullAuthProvider();

    @Override
    public String getType() {
        return CACHING_SHA2_PASSWORD;
    }

    @Override
    public byte getPublicKeyRequest() {
        return 2;
    }

    @Override
    public byte[] authentication(@Nullable CharSequence password, byte[] salt) {
        return AuthUtils.encodeTerminal(password == null ? "" : password);
    }

    @Override
    public boolean isSslNecessary() {
        return true;
    }

    @Override
    public MySqlAuthProvider next() {
        return INSTANCE;
    }

    private CachingSha2FullAuthProvider() {
    }
}
