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

import org.jetbrains.annotations.Nullable;
import reactor.core.publisher.Mono;

import java.util.OptionalLong;

/**
 * A statement which executes SQL by the text protocol, i.e. {@code COM_QUERY}. The SQL is sent as it is.
 * <p>
 * A statement keeps the outcome of the last execution, e.g. {@link #getUpdateCount()}. Executing it again
 * closes the previous {@link MySqlResultSet}.
 */
public interface MySqlStatement {

    /**
     * The flag indicates that the generated keys should be available by {@link #getGeneratedKeys()}.
     */
    int RETURN_GENERATED_KEYS = 1;

    /**
     * The flag indicates that the generated keys should not be available.
     */
    int NO_GENERATED_KEYS = 2;

    /**
     * Executes a query and returns its rows. A statement which returns no rows, e.g. {@code UPDATE}, is
     * executed and an empty {@link MySqlResultSet} is emitted.
     *
     * @param sql the SQL statement.
     * @return a {@link Mono} emits the result set after the column metadata received.
     * @throws IllegalArgumentException if {@code sql} is {@code null} or empty.
     */
    Mono<MySqlResultSet> executeQuery(String sql);

    /**
     * Executes a data manipulation statement and returns the number of affected rows.
     *
     * @param sql the SQL statement.
     * @return a {@link Mono} emits the affected rows, it emits an {@link IllegalStateException} if the statement
     * returns rows.
     * @throws IllegalArgumentException if {@code sql} is {@code null} or empty.
     */
    default Mono<Long> executeUpdate(String sql) {
        return executeUpdate(sql, NO_GENERATED_KEYS);
    }

    /**
     * Executes a data manipulation statement and returns the number of affected rows.
     *
     * @param sql               the SQL statement.
     * @param autoGeneratedKeys {@link #RETURN_GENERATED_KEYS} or {@link #NO_GENERATED_KEYS}.
     * @return a {@link Mono} emits the affected rows.
     * @throws IllegalArgumentException if {@code sql} is {@code null} or empty, or the flag is unknown.
     */
    Mono<Long> executeUpdate(String sql, int autoGeneratedKeys);

    /**
     * Executes any statement.
     *
     * @param sql the SQL statement.
     * @return a {@link Mono} emits {@code true} if the first result is a result set, which is available by
     * {@link #getResultSet()}, or {@code false} if it is an update count.
     * @throws IllegalArgumentException if {@code sql} is {@code null} or empty.
     */
    Mono<Boolean> execute(String sql);

    /**
     * Gets the result set of the last execution.
     *
     * @return the result set, or {@code null} if the last execution returned no rows.
     */
    @Nullable
    MySqlResultSet getResultSet();

    /**
     * Gets the affected rows of the last execution.
     *
     * @return the affected rows, or {@code -1} if the last execution returned rows or nothing was executed.
     */
    long getUpdateCount();

    /**
     * Gets the last inserted ID of the last execution.
     *
     * @return the last inserted ID, or empty if it is {@code 0} or the last execution returned rows.
     */
    OptionalLong getLastInsertId();

    /**
     * Gets the keys generated by the last execution, one {@code GENERATED_KEY} column and one row per
     * inserted row.
     *
     * @return the generated keys.
     * @throws IllegalStateException if the last execution did not request {@link #RETURN_GENERATED_KEYS}.
     */
    MySqlResultSet getGeneratedKeys();

    MySqlStatement addBatch(String sql);

    MySqlStatement clearBatch();

    /**
     * Executes statements added by {@link #addBatch(String)} one by one, and clears them.
     *
     * @return a {@link Mono} emits affected rows of each statement, in order.
     */
    Mono<long[]> executeBatch();

    /**
     * Closes this statement and its result set.
     *
     * @return a {@link Mono} completes when closed.
     */
    Mono<Void> close();
}
