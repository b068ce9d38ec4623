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
import io.asyncer.mysql.wire.constant.ColumnDefinitions;
import io.asyncer.mysql.wire.constant.MySqlType;
import io.asyncer.mysql.wire.message.server.DefinitionMetadataMessage;
import io.r2dbc.spi.Nullability;

import java.math.BigInteger;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.require;
import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * An implementation of {@link MySqlColumnMetadata}.
 */
final class MySqlColumnDescriptor implements MySqlColumnMetadata {

    private final int index;

    private final MySqlType type;

    private final String name;

    private final short definitions;

    private final long size;

    private final int decimals;

    private final int collationId;

    private MySqlColumnDescriptor(int index, MySqlType type, String name, short definitions, long size,
        int decimals, int collationId) {
        require(index >= 0, "index must not be a negative integer");
        require(decimals >= 0, "decimals must not be a negative integer");
        requireNonNull(name, "name must not be null");

        this.index = index;
        this.type = type;
        this.name = name;
        this.definitions = definitions;
        this.size = size;
        this.decimals = decimals;
        this.collationId = collationId;
    }

    static MySqlColumnDescriptor create(int index, DefinitionMetadataMessage message) {
        return new MySqlColumnDescriptor(index, message.getType(), message.getColumn(),
            message.getDefinitions(), message.getSize(), message.getDecimals(), message.getCollationId());
    }

    @Override
    public int getIndex() {
        return index;
    }

    @Override
    public MySqlType getType() {
        return type;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isUnsigned() {
        return (definitions & ColumnDefinitions.UNSIGNED) != 0;
    }

    @Override
    public boolean isBinary() {
        return collationId == ColumnDefinitions.BINARY_COLLATION;
    }

    @Override
    public int getCollationId() {
        return collationId;
    }

    @Override
    public short getDefinitions() {
        return definitions;
    }

    @Override
    public Class<?> getJavaType() {
        if (isUnsigned()) {
            switch (type) {
                case TINYINT:
                    return Short.class;
                case SMALLINT:
                case MEDIUMINT:
                    return Integer.class;
                case INT:
                    return Long.class;
                case BIGINT:
                    return BigInteger.class;
                default:
                    return type.getJavaType();
            }
        }

        if (type.isBlob()) {
            return isBinary() ? byte[].class : String.class;
        }

        switch (type) {
            case VARCHAR:
            case VAR_STRING:
            case STRING:
                // BINARY and VARBINARY.
                return isBinary() ? byte[].class : String.class;
            default:
                return type.getJavaType();
        }
    }

    @Override
    public Nullability getNullability() {
        return (definitions & ColumnDefinitions.NOT_NULL) != 0 ? Nullability.NON_NULL : Nullability.NULLABLE;
    }

    @Override
    public Integer getPrecision() {
        return (int) Math.min(size, Integer.MAX_VALUE);
    }

    @Override
    public Integer getScale() {
        // 0x00 to 0x51 for the number of digits to right of the decimal point.
        if ((type.isDecimal() || type.isFloatingPoint()) && decimals <= 0x51) {
            return decimals;
        }

        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MySqlColumnDescriptor)) {
            return false;
        }

        MySqlColumnDescriptor that = (MySqlColumnDescriptor) o;

        return index == that.index && definitions == that.definitions && size == that.size &&
            decimals == that.decimals && collationId == that.collationId && type == that.type &&
            name.equals(that.name);
    }

    @Override
    public int hashCode() {
        int hash = 31 * index + type.hashCode();
        hash = 31 * hash + name.hashCode();
        hash = 31 * hash + definitions;
        hash = 31 * hash + Long.hashCode(size);
        hash = 31 * hash + decimals;
        return 31 * hash + collationId;
    }

    @Override
    public String toString() {
        return "MySqlColumnDescriptor{index=" + index + ", type=" + type + ", name='" + name +
            "', definitions=" + Integer.toHexString(definitions & 0xFFFF) + ", size=" + size +
            ", decimals=" + decimals + ", collationId=" + collationId + '}';
    }
}
