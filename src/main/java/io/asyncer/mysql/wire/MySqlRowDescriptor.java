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

import io.asyncer.mysql.wire.api.MySqlColumnMetadata;
import io.asyncer.mysql.wire.api.MySqlRowMetadata;
import io.asyncer.mysql.wire.constant.MySqlType;
import io.asyncer.mysql.wire.message.server.DefinitionMetadataMessage;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * An implementation of {@link MySqlRowMetadata}.
 */
final class MySqlRowDescriptor implements MySqlRowMetadata {

    private final MySqlColumnDescriptor[] columns;

    private final MySqlType[] types;

    private final Map<String, Integer> indexes;

    private MySqlRowDescriptor(MySqlColumnDescriptor[] columns) {
        int size = columns.length;
        MySqlType[] types = new MySqlType[size];
        Map<String, Integer> indexes = new HashMap<>(size * 2);

        for (int i = 0; i < size; ++i) {
            types[i] = columns[i].getType();
            indexes.putIfAbsent(columns[i].getName().toLowerCase(Locale.ROOT), i);
        }

        this.columns = columns;
        this.types = types;
        this.indexes = indexes;
    }

    static MySqlRowDescriptor create(DefinitionMetadataMessage[] messages) {
        int size = messages.length;
        MySqlColumnDescriptor[] columns = new MySqlColumnDescriptor[size];

        for (int i = 0; i < size; ++i) {
            columns[i] = MySqlColumnDescriptor.create(i, messages[i]);
        }

        return new MySqlRowDescriptor(columns);
    }

    @Override
    public MySqlColumnMetadata getColumnMetadata(int index) {
        if (index < 0 || index >= columns.length) {
            throw new IndexOutOfBoundsException("Column index " + index + " is out of range [0, " +
                columns.length + ')');
        }

        return columns[index];
    }

    @Override
    public MySqlColumnMetadata getColumnMetadata(String name) {
        return columns[indexOf(name)];
    }

    @Override
    public boolean contains(String name) {
        requireNonNull(name, "name must not be null");

        return indexes.containsKey(name.toLowerCase(Locale.ROOT));
    }

    @Override
    public List<MySqlColumnDescriptor> getColumnMetadatas() {
        return Collections.unmodifiableList(Arrays.asList(columns));
    }

    @Override
    public int getColumnCount() {
        return columns.length;
    }

    int indexOf(String name) {
        requireNonNull(name, "name must not be null");

        Integer index = indexes.get(name.toLowerCase(Locale.ROOT));

        if (index == null) {
            throw new NoSuchElementException("Column name '" + name + "' does not exist in " +
                indexes.keySet());
        }

        return index;
    }

    MySqlType[] getTypes() {
        return types;
    }

    @Override
    public String toString() {
        return "MySqlRowDescriptor{columns=" + Arrays.toString(columns) + '}';
    }
}
