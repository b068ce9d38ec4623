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

package io.asyncer.mysql.wire.message.server;

import io.netty.buffer.ByteBuf;

import static io.asyncer.mysql.wire.internal.util.VarIntUtils.readVarIntSize;

/**
 * The first packet of a result set, declares how many column definitions follow.
 */
public final class ColumnCountMessage implements ServerMessage {

    private final int totalColumns;

    private ColumnCountMessage(int totalColumns) {
        this.totalColumns = totalColumns;
    }

    public int getTotalColumns() {
        return totalColumns;
    }

    @Override
    public String toString() {
        return "ColumnCountMessage{totalColumns=" + totalColumns + '}';
    }

    static ColumnCountMessage decode(ByteBuf buf) {
        return new ColumnCountMessage(readVarIntSize(buf));
    }
}
