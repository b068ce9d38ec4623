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

package io.asyncer.mysql.wire.message.client;

import io.asyncer.mysql.wire.ConnectionContext;
import io.asyncer.mysql.wire.codec.MySqlParameter;
import io.netty.buffer.ByteBuf;

import java.util.Arrays;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * The {@code COM_STMT_EXECUTE} command, executes a prepared statement with parameters bound by the binary
 * protocol. The rows of the result use the binary protocol as well.
 */
public final class PreparedExecuteMessage extends ScalarClientMessage {

    private static final byte EXECUTE_FLAG = 0x17;

    private static final byte NO_CURSOR = 0;

    private static final int ITERATION_COUNT = 1;

    private static final byte NEW_PARAMS_BOUND = 1;

    private static final int UNSIGNED_FLAG = 0x80;

    private final int statementId;

    private final MySqlParameter[] values;

    public PreparedExecuteMessage(int statementId, MySqlParameter[] values) {
        this.statementId = statementId;
        this.values = requireNonNull(values, "values must not be null");
    }

    @Override
    protected void writeTo(ByteBuf buf, ConnectionContext context) {
        buf.writeByte(EXECUTE_FLAG)
            .writeIntLE(statementId)
            .writeByte(NO_CURSOR)
            .writeIntLE(ITERATION_COUNT);

        int size = values.length;

        if (size == 0) {
            return;
        }

        byte[] nullBitmap = new byte[(size + 7) >>> 3];

        for (int i = 0; i < size; ++i) {
            if (values[i].isNull()) {
                nullBitmap[i >>> 3] |= (byte) (1 << (i & 7));
            }
        }

        buf.writeBytes(nullBitmap).writeByte(NEW_PARAMS_BOUND);

        for (MySqlParameter value : values) {
            buf.writeByte(value.getType().getId())
                .writeByte(value.isUnsigned() ? UNSIGNED_FLAG : 0);
        }

        for (MySqlParameter value : values) {
            if (!value.isNull()) {
                value.writeBinary(buf);
            }
        }
    }

    @Override
    public String toString() {
        return "PreparedExecuteMessage{statementId=" + statementId + ", values=" + Arrays.toString(values) +
            '}';
    }
}
