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

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonEmpty;

/**
 * A utility for building the few SQL fragments the client sends on its own behalf.
 */
public final class StringUtils {

    private static final String BACKTICK = "`";

    private static final String DOUBLED_BACKTICK = "``";

    /**
     * Wraps a savepoint, database or other identifier in backticks. A backtick inside the name is doubled so
     * the server reads it back as a single literal backtick.
     *
     * @param identifier the raw identifier
     * @return the quoted identifier, e.g. {@code sp`1} becomes {@code `sp``1`}
     */
    public static String quoteIdentifier(String identifier) {
        requireNonEmpty(identifier, "identifier must not be empty");

        String body = identifier.contains(BACKTICK) ? identifier.replace(BACKTICK, DOUBLED_BACKTICK) : identifier;

        return BACKTICK + body + BACKTICK;
    }

    private StringUtils() {
    }
}
