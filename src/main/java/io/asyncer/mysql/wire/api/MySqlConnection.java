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

package io.asyncer.mysql.wire.api;

import io.asyncer.mysql.wire.ServerVersion;
import io.r2dbc.spi.IsolationLevel;
import org.jetbrains.annotations.Nullable;
import reactor.core.publisher.Mono;

/**
 * An authenticated connection to a MySQL database. A connection executes one command at a time, commands
 * issued during an active command are queued in order.
 */
public interface MySqlConnection {

    /**
     * Creates a text protocol statement.
     *
     * @return a new statement.
     */
    MySqlStatement createStatement();

    /**
     * Prepares a statement on the server.
     *
     * @param sql the SQL with parameter markers {@code ?}.
     * @return a {@link Mono} emits the prepared statement.
     * @throws IllegalArgumentException if {@code sql} is {@code null} or empty.
     */
    default Mono<MySqlPreparedStatement> prepareStatement(String sql) {
        return prepareStatement(sql, MySqlStatement.NO_GENERATED_KEYS);
    }

    /**
     * Prepares a statement on the server.
     *
     * @param sql               the SQL with parameter markers {@code ?}.
     * @param autoGeneratedKeys {@link MySqlStatement#RETURN_GENERATED_KEYS} or
     *                          {@link MySqlStatement#NO_GENERATED_KEYS}.
     * @return a {@link Mono} emits the prepared statement.
     * @throws IllegalArgumentException if {@code sql} is {@code null} or empty, or the flag is unknown.
     */
    Mono<MySqlPreparedStatement> prepareStatement(String sql, int autoGeneratedKeys);

    /**
     * Checks the connection by {@code COM_PING}.
     *
     * @return a {@link Mono} emits {@code true} if the server responded, it never emits an error.
     */
    Mono<Boolean> validate();

    /**
     * Checks the auto-commit mode by the last server statuses, it does not issue a query.
     *
     * @return if it is in auto-commit mode.
     */
    boolean isAutoCommit();

    Mono<Void> setAutoCommit(boolean autoCommit);

    boolean isInTransaction();

    Mono<Void> commit();

    Mono<Void> rollback();

    Mono<Void> createSavepoint(String name);

    Mono<Void> releaseSavepoint(String name);

    Mono<Void> rollbackToSavepoint(String name);

    Mono<Void> setTransactionIsolationLevel(IsolationLevel level);

    Mono<Void> setReadOnly(boolean readOnly);

    /**
     * Gets the current database if the connection uses the schema term.
     *
     * @return the database, or {@code null} if it uses the catalog term or no database selected.
     */
    @Nullable
    String getSchema();

    /**
     * Selects the database by {@code COM_INIT_DB} if the connection uses the schema term, otherwise it does
     * nothing.
     *
     * @param schema the database.
     * @return a {@link Mono} completes when selected.
     */
    Mono<Void> setSchema(String schema);

    /**
     * Gets the current database if the connection uses the catalog term.
     *
     * @return the database, or {@code null} if it uses the schema term or no database selected.
     */
    @Nullable
    String getCatalog();

    /**
     * Selects the database by {@code COM_INIT_DB} if the connection uses the catalog term, otherwise it does
     * nothing.
     *
     * @param catalog the database.
     * @return a {@link Mono} completes when selected.
     */
    Mono<Void> setCatalog(String catalog);

    /**
     * Resets the session state by {@code COM_RESET_CONNECTION}, e.g. user variables, temporary tables and
     * prepared statements.
     *
     * @return a {@link Mono} completes when reset.
     */
    Mono<Void> resetServerState();

    ServerVersion getServerVersion();

    int getConnectionId();

    /**
     * Closes the connection by {@code COM_QUIT}. Unfinished result sets are cancelled, which closes the
     * transport immediately.
     *
     * @return a {@link Mono} completes when the transport closed.
     */
    Mono<Void> close();

    boolean isClosed();
}
