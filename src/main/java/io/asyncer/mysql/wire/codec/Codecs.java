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
import io.asyncer.mysql.wire.message.FieldValue;
import org.jetbrains.annotations.Nullable;

/**
 * Bind all codecs for all types.
 */
public interface Codecs {

    /**
     * Decode a {@link FieldValue} as specified {@link Class}.
     *
     * @param value    the {@link FieldValue}.
     * @param metadata the metadata of the column.
     * @param type     the specified {@link Class}, primitive classes are decoded as their boxed classes.
     * @param binary   if the value should be decoded by binary protocol.
     * @param <T>      the generic result type.
     * @return the decoded result, or {@code null} if the value is SQL {@code NULL}.
     * @throws IllegalArgumentException if any parameter is {@code null}.
     * @throws io.asyncer.mysql.wire.TypeConversionException if the value can not be decoded as {@code type}.
     */
    @Nullable
    <T> T decode(FieldValue value, MySqlColumnMetadata metadata, Class<?> type, boolean binary);

    /**
     * Encode a value to a {@link MySqlParameter}.
     *
     * @param value the specified value.
     * @return encoded {@link MySqlParameter}.
     * @throws IllegalArgumentException if {@code value} is {@code null} or no codec can encode it.
     */
    MySqlParameter encode(Object value);

    /**
     * Gets the {@link MySqlParameter} of SQL {@code NULL}.
     *
     * @return the parameter.
     */
    MySqlParameter encodeNull();

    static Codecs getInstance() {
        return DefaultCodecs.INSTANCE;
    }
}
