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

import io.asyncer.mysql.wire.constant.MySqlType;
import io.netty.buffer.ByteBuf;

/**
 * A bound parameter of a prepared statement, encoded by the binary protocol.
 */
public interface MySqlParameter {

    /**
     * Get the wire type of this parameter, sent in the parameter types of {@code COM_STMT_EXECUTE}.
     *
     * @return the type.
     */
    MySqlType getType();

    /**
     * Checks if the value is unsigned, the server needs it for integers beyond the signed range.
     *
     * @return if unsigned.
     */
    default boolean isUnsigned() {
        return false;
    }

    /**
     * Checks if this parameter is SQL {@code NULL}, which is sent by the null bitmap and has no value bytes.
     *
     * @return if it is {@code NULL}.
     */
    default boolean isNull() {
        return false;
    }

    /**
     * Writes the binary protocol value.
     *
     * @param buf the buffer.
     */
    void writeBinary(ByteBuf buf);
}
