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
 * Placeholder used when the handshake names no plugin. The login response carries an empty token and the
 * server answers with an auth switch naming the real plugin.
 */
final class NoAuthProvider implements MySqlAuthProvider {

    static final NoAuthProvider INSTANCE = new NoAuthProvider();

    @Override
    public String getType() {
        return NO_AUTH_PROVIDER;
    }

    @Override
    public byte[] authentication(@Nullable CharSequence password, byte[] salt) {
        return new byte[0];
    }

    @Override
    public boolean isSslNecessary() {
        return false;
    }

    @Override
    public MySqlAuthProvider next() {
        return INSTANCE;
    }

    private NoAuthProvider() {
    }
}
