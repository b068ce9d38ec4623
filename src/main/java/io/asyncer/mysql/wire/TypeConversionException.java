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

import io.asyncer.mysql.wire.constant.MySqlType;

/**
 * A column value can not be decoded as the requested Java type. It only fails the current column access, the
 * connection is still usable.
 */
public final class TypeConversionException extends IllegalArgumentException {

    private static final long serialVersionUID = 7731692826614127445L;

    private final String column;

    private final Class<?> requested;

    private final MySqlType actual;

    public TypeConversionException(String column, Class<?> requested, MySqlType actual) {
        this(column, requested, actual, null);
    }

    public TypeConversionException(String column, Class<?> requested, MySqlType actual, Throwable cause) {
        super("Column '" + column + "' of type " + actual + " can not be converted to " +
            requested.getName(), cause);

        this.column = column;
        this.requested = requested;
        this.actual = actual;
    }

    public String getColumn() {
        return column;
    }

    public Class<?> getRequested() {
        return requested;
    }

    public MySqlType getActual() {
        return actual;
    }
}
