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

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * An implementation of {@link MySqlAuthProvider} for type "mysql_native_password".
 */
final class NativePasswordAuthProvider implements MySqlAuthProvider {

    static final NativePasswordAuthProvider INSTANCE = new NativePasswordAuthProvider();

    private static final byte[] EMPTY = new byte[0];

    @Override
    public boolean isSslNecessary() {
        return false;
    }

    @Override
    public byte[] authentication(@Nullable CharSequence password, byte[] salt) {
        if (MySqlAuthProvider.isEmpty(password)) {
            return EMPTY;
        }

        requireNonNull(salt, "salt must not be null when password exists");

        return AuthUtils.hash1(AuthUtils.encode(password), salt);
    }

    @Override
    public MySqlAuthProvider next() {
        return this;
    }

    @Override
    public String getType() {
        return MYSQL_NATIVE_PASSWORD;
    }

    private NativePasswordAuthProvider() { }
}
