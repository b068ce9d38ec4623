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

package io.asyncer.mysql.wire.internal.util;

import org.jetbrains.annotations.Nullable;

/**
 * Argument checks. All of them fail with an {@link IllegalArgumentException} carrying the given message.
 */
public final class AssertUtils {

    public static <T> T requireNonNull(@Nullable T obj, String message) {
        require(obj != null, message);

        return obj;
    }

    public static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Rejects {@code null} as well as the empty string.
     *
     * @param s       the value to check.
     * @param message the failure message.
     * @return {@code s}
     */
    public static String requireNonEmpty(@Nullable String s, String message) {
        require(s != null && !s.isEmpty(), message);

        return s;
    }

    /**
     * Accepts {@code 0} as well, which lets the operating system choose the port.
     *
     * @param port the TCP port.
     * @return {@code port}
     */
    public static int requireValidPort(int port) {
        require(port >= 0 && port <= 0xFFFF, "port must be between 0 and 65535, but was " + port);

        return port;
    }

    private AssertUtils() {
    }
}
