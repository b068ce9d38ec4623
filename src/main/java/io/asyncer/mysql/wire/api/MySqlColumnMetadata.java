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

package io.asyncer.mysql.wire.api;

import io.asyncer.mysql.wire.constant.MySqlType;
import io.r2dbc.spi.ColumnMetadata;

/**
 * {@link ColumnMetadata} of a column returned from a MySQL database, decoded from its column definition.
 */
public interface MySqlColumnMetadata extends ColumnMetadata {

    /**
     * {@inheritDoc}
     *
     * @return the {@link MySqlType} descriptor.
     */
    @Override
    MySqlType getType();

    /**
     * Gets the index of this column in the row, starts from {@code 0}.
     *
     * @return the column index.
     */
    int getIndex();

    /**
     * Checks if the column is an unsigned integer. The Java type of an unsigned integer is widened, e.g.
     * {@code INT UNSIGNED} is decoded as {@link Long} by default.
     *
     * @return if it is unsigned.
     */
    boolean isUnsigned();

    /**
     * Checks if the column stores raw bytes, e.g. {@code BLOB}, {@code BINARY} or {@code VARBINARY}.
     *
     * @return if it is binary.
     */
    boolean isBinary();

    int getCollationId();

    /**
     * Gets the column flags of the column definition.
     *
     * @return the bitmap of {@link io.asyncer.mysql.wire.constant.ColumnDefinitions}.
     */
    short getDefinitions();
}
