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
 * The {@code mysql_clear_password} plugin: the password goes over the wire as a NUL-terminated string, so
 * it is only offered on a TLS session.
 */
final class MySqlClearAuthProvider implements MySqlAuthProvider {

    static final MySqlClearAuthProvider INSTANCE = new MySqlClearAuthProvider();

    @Override
    public String getType() {
        return MYSQL_CLEAR_PASSWORD;
    }

    @Override
    public byte[] authentication(@Nullable CharSequence password, byte[] salt) {
        CharSequence plain = password == null ? "" : password;

        return AuthUtils.encodeTerminal(plain);
    }

    @Override
    public boolean isSslNecessary() {
        return true;
    }

    @Override
    public MySqlAuthProvider next() {
        return INSTANCE;
    }

    private MySqlClearAuthProvider() {
    }
}
