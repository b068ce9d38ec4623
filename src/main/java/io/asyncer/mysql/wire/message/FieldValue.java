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

package io.asyncer.mysql.wire.message;

import io.netty.buffer.ByteBuf;
import io.netty.util.ReferenceCountUtil;
import org.jetbrains.annotations.Nullable;

/**
 * The raw bytes of one column of a row, or SQL {@code NULL}.
 * <p>
 * A value is a retained slice of the row packet, it must be released when the cursor leaves the row.
 */
public final class FieldValue {

    private static final FieldValue NULL = new FieldValue(null);

    @Nullable
    private final ByteBuf buf;

    private FieldValue(@Nullable ByteBuf buf) {
        this.buf = buf;
    }

    public boolean isNull() {
        return buf == null;
    }

    /**
     * Get the bytes of the value, its indexes are independent of other readers.
     *
     * @return the buffer duplicated from the value.
     * @throws IllegalStateException if the value is {@code NULL}.
     */
    public ByteBuf getBufferSlice() {
        if (buf == null) {
            throw new IllegalStateException("Value is NULL");
        }

        return buf.duplicate();
    }

    public void release() {
        if (buf != null) {
            ReferenceCountUtil.safeRelease(buf);
        }
    }

    @Override
    public String toString() {
        return buf == null ? "FieldValue{NULL}" : "FieldValue{size=" + buf.readableBytes() + '}';
    }

    public static FieldValue nullField() {
        return NULL;
    }

    public static FieldValue of(ByteBuf buf) {
        return new FieldValue(buf);
    }

    /**
     * Releases all values of a row, ignores {@code null} elements.
     *
     * @param values the values.
     */
    public static void releaseAll(FieldValue[] values) {
        for (FieldValue value : values) {
            if (value != null) {
                value.release();
            }
        }
    }
}
