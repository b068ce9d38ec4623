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

package io.asyncer.mysql.wire.constant;

import io.r2dbc.spi.Type;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.BitSet;

/**
 * Column and parameter types of the wire protocol. The {@link #getId() id} is the type byte sent in column
 * definitions and {@code COM_STMT_EXECUTE}.
 */
public enum MySqlType implements Type {

    DECIMAL(0),

    TINYINT(1),

    SMALLINT(2),

    INT(3),

    FLOAT(4),

    DOUBLE(5),

    NULL(6),

    TIMESTAMP(7),

    BIGINT(8),

    MEDIUMINT(9),

    DATE(10),

    TIME(11),

    DATETIME(12),

    YEAR(13),

    VARCHAR(15),

    BIT(16),

    JSON(245),

    NEW_DECIMAL(246),

    ENUM(247),

    SET(248),

    TINY_BLOB(249),

    MEDIUM_BLOB(250),

    LONG_BLOB(251),

    BLOB(252),

    VAR_STRING(253),

    STRING(254),

    GEOMETRY(255),

    UNKNOWN(-1);

    private static final MySqlType[] TYPES = new MySqlType[256];

    static {
        for (MySqlType type : values()) {
            if (type.id >= 0) {
                TYPES[type.id] = type;
            }
        }
    }

    private final int id;

    MySqlType(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    /**
     * Gets the Java type which a value of this type is decoded into by default. Blob types are {@code byte[]}
     * here, the column metadata knows if it is a text column.
     *
     * @return the default Java type.
     */
    @Override
    public Class<?> getJavaType() {
        switch (this) {
            case DECIMAL:
            case NEW_DECIMAL:
                return BigDecimal.class;
            case TINYINT:
                return Byte.class;
            case SMALLINT:
            case YEAR:
                return Short.class;
            case MEDIUMINT:
            case INT:
                return Integer.class;
            case BIGINT:
                return Long.class;
            case FLOAT:
                return Float.class;
            case DOUBLE:
                return Double.class;
            case DATE:
                return LocalDate.class;
            case TIME:
                return LocalTime.class;
            case DATETIME:
            case TIMESTAMP:
                return LocalDateTime.class;
            case BIT:
                return BitSet.class;
            case VARCHAR:
            case JSON:
            case ENUM:
            case SET:
            case VAR_STRING:
            case STRING:
                return String.class;
            case TINY_BLOB:
            case MEDIUM_BLOB:
            case LONG_BLOB:
            case BLOB:
            case GEOMETRY:
                return byte[].class;
            default:
                return Object.class;
        }
    }

    @Override
    public String getName() {
        return name();
    }

    public boolean isBlob() {
        switch (this) {
            case TINY_BLOB:
            case MEDIUM_BLOB:
            case LONG_BLOB:
            case BLOB:
                return true;
            default:
                return false;
        }
    }

    /**
     * Checks if values of this type are integers on the wire, i.e. {@code TINYINT} to {@code BIGINT} and
     * {@code YEAR}.
     *
     * @return if it is an integer type.
     */
    public boolean isInteger() {
        switch (this) {
            case TINYINT:
            case SMALLINT:
            case MEDIUMINT:
            case INT:
            case BIGINT:
            case YEAR:
                return true;
            default:
                return false;
        }
    }

    public boolean isDecimal() {
        return this == DECIMAL || this == NEW_DECIMAL;
    }

    public boolean isFloatingPoint() {
        return this == FLOAT || this == DOUBLE;
    }

    public boolean isNumeric() {
        return isInteger() || isDecimal() || isFloatingPoint();
    }

    public boolean isDateTime() {
        return this == DATETIME || this == TIMESTAMP;
    }

    /**
     * Checks if values of this type are variable length bytes on the wire, i.e. strings, blobs, decimals and
     * other types encoded as text.
     *
     * @return if it is a length-encoded type.
     */
    public boolean isLengthEncoded() {
        switch (this) {
            case DECIMAL:
            case NEW_DECIMAL:
            case VARCHAR:
            case BIT:
            case JSON:
            case ENUM:
            case SET:
            case TINY_BLOB:
            case MEDIUM_BLOB:
            case LONG_BLOB:
            case BLOB:
            case VAR_STRING:
            case STRING:
            case GEOMETRY:
                return true;
            default:
                return false;
        }
    }

    /**
     * Finds the type by the wire id.
     *
     * @param id the type byte.
     * @return the type, or {@link #UNKNOWN} if it is not a known id.
     */
    public static MySqlType of(int id) {
        if (id < 0 || id >= TYPES.length) {
            return UNKNOWN;
        }

        MySqlType type = TYPES[id];

        return type == null ? UNKNOWN : type;
    }
}
