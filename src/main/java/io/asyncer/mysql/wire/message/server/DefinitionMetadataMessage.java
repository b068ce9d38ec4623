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

import io.asyncer.mysql.wire.constant.MySqlType;
import io.netty.buffer.ByteBuf;

import java.nio.charset.StandardCharsets;

import static io.asyncer.mysql.wire.internal.util.VarIntUtils.readVarInt;
import static io.asyncer.mysql.wire.internal.util.VarIntUtils.readVarIntSizedString;

/**
 * A column definition of protocol 4.1, describes a column of a result set or a parameter of a prepared
 * statement.
 */
public final class DefinitionMetadataMessage implements ServerMessage {

    private final String database;

    private final String table;

    private final String column;

    private final int collationId;

    private final long size;

    private final MySqlType type;

    private final short definitions;

    private final short decimals;

    private DefinitionMetadataMessage(String database, String table, String column, int collationId, long size,
        MySqlType type, short definitions, short decimals) {
        this.database = database;
        this.table = table;
        this.column = column;
        this.collationId = collationId;
        this.size = size;
        this.type = type;
        this.definitions = definitions;
        this.decimals = decimals;
    }

    public String getDatabase() {
        return database;
    }

    public String getColumn() {
        return column;
    }

    public int getCollationId() {
        return collationId;
    }

    public long getSize() {
        return size;
    }

    public MySqlType getType() {
        return type;
    }

    public short getDefinitions() {
        return definitions;
    }

    public short getDecimals() {
        return decimals;
    }

    @Override
    public String toString() {
        return "DefinitionMetadataMessage{database='" + database + "', table='" + table + "', column='" +
            column + "', collationId=" + collationId + ", size=" + size + ", type=" + type +
            ", definitions=" + definitions + ", decimals=" + decimals + '}';
    }

    /**
     * Creates a definition built by the client, e.g. the column of generated keys.
     *
     * @param column      the column name.
     * @param type        the column type.
     * @param definitions the column flags.
     * @return the definition.
     */
    public static DefinitionMetadataMessage synthetic(String column, MySqlType type, short definitions) {
        return new DefinitionMetadataMessage("", "", column, 63, 20, type, definitions, (short) 0);
    }

    static DefinitionMetadataMessage decode(ByteBuf buf) {
        // Always "def".
        readVarIntSizedString(buf, StandardCharsets.US_ASCII);

        String database = readVarIntSizedString(buf, StandardCharsets.UTF_8);
        String table = readVarIntSizedString(buf, StandardCharsets.UTF_8);
        // Physical table name, unused.
        readVarIntSizedString(buf, StandardCharsets.UTF_8);
        String column = readVarIntSizedString(buf, StandardCharsets.UTF_8);
        // Physical column name, unused.
        readVarIntSizedString(buf, StandardCharsets.UTF_8);

        // Size of fixed fields, always 0x0C.
        readVarInt(buf);

        int collationId = buf.readUnsignedShortLE();
        long size = buf.readUnsignedIntLE();
        MySqlType type = MySqlType.of(buf.readUnsignedByte());
        short definitions = buf.readShortLE();
        short decimals = buf.readUnsignedByte();

        return new DefinitionMetadataMessage(database, table, column, collationId, size, type, definitions,
            decimals);
    }
}
