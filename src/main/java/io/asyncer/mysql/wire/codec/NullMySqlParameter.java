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
 * The SQL {@code NULL} parameter. It is carried entirely by the null bitmap of {@code COM_STMT_EXECUTE},
 * so it writes no value bytes.
 */
final class NullMySqlParameter implements MySqlParameter {

    static final NullMySqlParameter INSTANCE = new NullMySqlParameter();

    private NullMySqlParameter() {
    }

    @Override
    public MySqlType getType() {
        return MySqlType.NULL;
    }

    @Override
    public boolean isNull() {
        return true;
    }

    @Override
    public void writeBinary(ByteBuf buf) {
        // Nothing, see the null bitmap.
    }

    @Override
    public String toString() {
        return "NULL";
    }
}
