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

import io.asyncer.mysql.wire.ServerErrorException;
import io.netty.buffer.ByteBuf;
import io.r2dbc.spi.R2dbcBadGrammarException;
import io.r2dbc.spi.R2dbcDataIntegrityViolationException;
import io.r2dbc.spi.R2dbcException;
import io.r2dbc.spi.R2dbcNonTransientResourceException;
import io.r2dbc.spi.R2dbcPermissionDeniedException;
import io.r2dbc.spi.R2dbcRollbackException;
import io.r2dbc.spi.R2dbcTimeoutException;
import io.r2dbc.spi.R2dbcTransientResourceException;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * The ERR packet, a command or the login failed.
 */
public final class ErrorMessage implements ServerMessage {

    private static final byte SQL_STATE_MARKER = '#';

    private static final int SQL_STATE_SIZE = 5;

    private final int code;

    @Nullable
    private final String sqlState;

    private final String message;

    private ErrorMessage(int code, @Nullable String sqlState, String message) {
        this.code = code;
        this.sqlState = sqlState;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    @Nullable
    public String getSqlState() {
        return sqlState;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Converts this message to an {@link R2dbcException} without offending SQL.
     *
     * @return the exception.
     */
    public R2dbcException toException() {
        return toException(null);
    }

    /**
     * Converts this message to the most specific {@link R2dbcException}, by the error code first and then by
     * the class of the SQL state.
     *
     * @param sql the offending SQL, may be {@code null}.
     * @return the exception.
     */
    public R2dbcException toException(@Nullable String sql) {
        switch (code) {
            case 1044: // Database access denied
            case 1045: // Wrong password
            case 1095: // Kill denied
            case 1142: // Table access denied
            case 1143: // Column access denied
            case 1227: // Specific access denied
            case 1370: // Routine access denied
            case 1698: // Without password
            case 1873: // Change user denied
                return new R2dbcPermissionDeniedException(message, sqlState, code);
            case 1159: // Read interrupted, reading packet timeout because of network jitter in most cases
            case 1161: // Write interrupted, writing packet timeout because of network jitter in most cases
            case 1213: // Dead lock :-( no one wants this
            case 1215: // Cannot add foreign key constraint, may be concurrent with another DDL
                return new R2dbcTransientResourceException(message, sqlState, code);
            case 1205: // Wait lock timeout
            case 1907: // Statement executing timeout
                return new R2dbcTimeoutException(message, sqlState, code);
            case 1613: // Transaction rollback because of took too long
                return new R2dbcRollbackException(message, sqlState, code);
            case 1022: // Duplicate key
            case 1048: // Field cannot be null
            case 1062: // Duplicate entry for key
            case 1169: // Violation of an UNIQUE constraint
            case 1451: // Cannot delete a parent row
            case 1452: // Cannot add a child row
            case 1557: // Duplicate key in foreign key constraint
            case 1859: // Duplicate unknown entry for key
                return new R2dbcDataIntegrityViolationException(message, sqlState, code);
        }

        if (sqlState == null) {
            return new ServerErrorException(message, null, code);
        } else if (sqlState.startsWith("0A")) {
            return new R2dbcNonTransientResourceException(message, sqlState, code);
        } else if (sqlState.startsWith("08")) {
            return new R2dbcNonTransientResourceException(message, sqlState, code);
        } else if (sqlState.startsWith("22") || sqlState.startsWith("23")) {
            return new R2dbcDataIntegrityViolationException(message, sqlState, code);
        } else if (sqlState.startsWith("28")) {
            return new R2dbcPermissionDeniedException(message, sqlState, code);
        } else if (sqlState.startsWith("40")) {
            return new R2dbcRollbackException(message, sqlState, code);
        } else if (sqlState.startsWith("42")) {
            return new R2dbcBadGrammarException(message, sqlState, code, sql);
        }

        return new ServerErrorException(message, sqlState, code);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ErrorMessage)) {
            return false;
        }

        ErrorMessage that = (ErrorMessage) o;

        return code == that.code && Objects.equals(sqlState, that.sqlState) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        int hash = 31 * code + Objects.hashCode(sqlState);
        return 31 * hash + message.hashCode();
    }

    @Override
    public String toString() {
        return "ErrorMessage{code=" + code + ", sqlState='" + sqlState + "', message='" + message + "'}";
    }

    /**
     * Decodes an ERR packet, includes the header byte.
     *
     * @param buf the payload.
     * @return the error message.
     */
    public static ErrorMessage decode(ByteBuf buf) {
        buf.skipBytes(1);

        int code = buf.readUnsignedShortLE();
        String sqlState = null;

        if (buf.readableBytes() > SQL_STATE_SIZE && buf.getByte(buf.readerIndex()) == SQL_STATE_MARKER) {
            buf.skipBytes(1);
            sqlState = buf.readCharSequence(SQL_STATE_SIZE, StandardCharsets.US_ASCII).toString();
        }

        return new ErrorMessage(code, sqlState, buf.toString(StandardCharsets.UTF_8));
    }
}
