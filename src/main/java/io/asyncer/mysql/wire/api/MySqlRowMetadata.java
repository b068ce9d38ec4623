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

import io.r2dbc.spi.RowMetadata;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * Column layout of a {@link MySqlResultSet}. Lookup by name ignores case, and when names repeat the
 * leftmost column is returned.
 */
public interface MySqlRowMetadata extends RowMetadata {

    /**
     * {@inheritDoc}
     *
     * @throws IndexOutOfBoundsException if the {@code index} is out of range.
     */
    @Override
    MySqlColumnMetadata getColumnMetadata(int index);

    /**
     * {@inheritDoc}
     *
     * @throws NoSuchElementException if there is no column with the {@code name}.
     */
    @Override
    MySqlColumnMetadata getColumnMetadata(String name);

    @Override
    List<? extends MySqlColumnMetadata> getColumnMetadatas();

    /**
     * Gets the number of columns.
     *
     * @return the number of columns.
     */
    int getColumnCount();
}
