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
import io.asyncer.mysql.wire.api.MySqlResultSet;
import io.asyncer.mysql.wire.api.MySqlRowMetadata;
import io.asyncer.mysql.wire.codec.Codecs;
import io.asyncer.mysql.wire.constant.MySqlType;
import io.asyncer.mysql.wire.message.FieldValue;
import org.jetbrains.annotations.Nullable;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * A base of {@link MySqlResultSet}s which holds the values of the current row.
 */
abstract class AbstractResultSet implements MySqlResultSet {

    private final MySqlRowDescriptor descriptor;

    private final Codecs codecs;

    private final boolean binary;

    @Nullable
    private FieldValue[] current;

    private boolean exhausted;

    private volatile boolean closed;

    AbstractResultSet(MySqlRowDescriptor descriptor, Codecs codecs, boolean binary) {
        this.descriptor = descriptor;
        this.codecs = codecs;
        this.binary = binary;
    }

    @Override
    public final MySqlRowMetadata getMetadata() {
        return descriptor;
    }

    @Nullable
    @Override
    public final <T> T get(int index, Class<T> type) {
        requireNonNull(type, "type must not be null");

        FieldValue[] row = requireRow();
        MySqlColumnMetadata column = descriptor.getColumnMetadata(index);

        return codecs.decode(row[index], column, type, binary);
    }

    @Nullable
    @Override
    public final <T> T get(String name, Class<T> type) {
        requireNonNull(name, "name must not be null");

        return get(descriptor.indexOf(name), type);
    }

    @Override
    public final boolean isClosed() {
        return closed;
    }

    final MySqlType[] types() {
        return descriptor.getTypes();
    }

    final boolean isBinary() {
        return binary;
    }

    final boolean isExhausted() {
        return exhausted;
    }

    /**
     * Replaces the current row, the values of the previous row are released.
     *
     * @param row the values of the new row.
     */
    final void advance(FieldValue[] row) {
        FieldValue[] previous = this.current;

        this.current = row;

        if (previous != null) {
            FieldValue.releaseAll(previous);
        }
    }

    final void exhaust() {
        this.exhausted = true;
        clearRow();
    }

    /**
     * Marks this closed and releases the current row.
     *
     * @return {@code true} if this call closes it, {@code false} if it has been closed.
     */
    final boolean markClosed() {
        if (closed) {
            return false;
        }

        closed = true;
        clearRow();

        return true;
    }

    final void requireOpen() {
        if (closed) {
            throw new IllegalStateException("Result set is closed");
        }
    }

    private void clearRow() {
        FieldValue[] previous = this.current;

        this.current = null;

        if (previous != null) {
            FieldValue.releaseAll(previous);
        }
    }

    private FieldValue[] requireRow() {
        requireOpen();

        FieldValue[] row = this.current;

        if (row == null) {
            throw new IllegalStateException(exhausted ? "Result set is exhausted" :
                "No current row, next() must emit true before reading columns");
        }

        return row;
    }
}
