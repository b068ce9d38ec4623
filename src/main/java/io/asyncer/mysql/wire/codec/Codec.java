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

package io.asyncer.mysql.wire.codec;

import io.asyncer.mysql.wire.api.MySqlColumnMetadata;
import io.netty.buffer.ByteBuf;
import org.jetbrains.annotations.Nullable;

/**
 * Converts between one Java type and the wire form of column values and statement parameters.
 *
 * @param <T> the Java type.
 */
public interface Codec<T> {

    boolean canDecode(MySqlColumnMetadata metadata, Class<?> target);

    /**
     * Reads a non-{@code NULL} column value.
     *
     * @param value    the raw value, text or binary.
     * @param metadata the column.
     * @param target   the requested type, may be a supertype of {@code T}.
     * @param binary   {@code true} for rows of a prepared statement.
     * @return the value.
     */
    @Nullable
    T decode(ByteBuf value, MySqlColumnMetadata metadata, Class<?> target, boolean binary);

    boolean canEncode(Object value);

    /**
     * Turns a bound value into a parameter of {@code COM_STMT_EXECUTE}.
     *
     * @param value a value accepted by {@link #canEncode(Object)}.
     * @return the parameter.
     */
    MySqlParameter encode(Object value);

    /**
     * The exact class this codec serves, which lets {@link Codecs} find it by lookup.
     *
     * @return the class, or {@code null} for codecs matched by scanning.
     */
    @Nullable
    default Class<?> getMainClass() {
        return null;
    }
}
