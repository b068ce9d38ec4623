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
 * A statement prepared on the server, executed by the binary protocol with positional parameters.
 * <p>
 * It owns a server-side statement handle until it is {@link #close() closed}.
 */
public interface MySqlPreparedStatement {

    /**
     * Gets the number of parameter markers declared by the server.
     *
     * @return the number of parameters.
     */
    int getParameterCount();

    /**
     * Gets the metadata of columns which are declared by the server on preparing.
     *
     * @return the metadata, or {@code null} if the statement returns no rows.
     */
    @Nullable
    MySqlRowMetadata getMetadata();

    /**
     * Binds a value to a parameter.
     *
     * @param index the parameter index starting at {@code 0}.
     * @param value the value.
     * @return {@link MySqlPreparedStatement this}.
     * @throws IllegalArgumentException  if {@code value} is {@code null} or of a type which can not be encoded.
     * @throws IndexOutOfBoundsException if {@code index} is out of range.
     */
    MySqlPreparedStatement bind(int index, Object value);

    /**
     * Binds SQL {@code NULL} to a parameter.
     *
     * @param index the parameter index starting at {@code 0}.
     * @param type  the Java type of the parameter.
     * @return {@link MySqlPreparedStatement this}.
     * @throws IllegalArgumentException  if {@code type} is {@code null}.
     * @throws IndexOutOfBoundsException if {@code index} is out of range.
     */
    MySqlPreparedStatement bindNull(int index, Class<?> type);

    MySqlPreparedStatement clearParameters();

    /**
     * Saves the current bindings as a batch item and clears them.
     *
     * @return {@link MySqlPreparedStatement this}.
     * @throws IllegalStateException if some parameters are not bound.
     */
    MySqlPreparedStatement addBatch();

    /**
     * Executes the statement with current bindings.
     *
     * @return a {@link Mono} emits the result set, which is empty if the statement returns no rows.
     * @throws IllegalStateException if some parameters are not bound.
     */
    Mono<MySqlResultSet> executeQuery();

    /**
     * Executes the statement with current bindings.
     *
     * @return a {@link Mono} emits affected rows.
     * @throws IllegalStateException if some parameters are not bound.
     */
    Mono<Long> executeUpdate();

    /**
     * Executes the statement with current bindings.
     *
     * @return a {@link Mono} emits {@code true} if the first result is a result set.
     * @throws IllegalStateException if some parameters are not bound.
     */
    Mono<Boolean> execute();

    /**
     * Executes every batch item in order, and clears them.
     *
     * @return a {@link Mono} emits affected rows of each item.
     */
    Mono<long[]> executeBatch();

    @Nullable
    MySqlResultSet getResultSet();

    long getUpdateCount();

    OptionalLong getLastInsertId();

    /**
     * Gets the keys generated by the last execution.
     *
     * @return the generated keys.
     * @throws IllegalStateException if it was not prepared with {@link MySqlStatement#RETURN_GENERATED_KEYS}.
     */
    MySqlResultSet getGeneratedKeys();

    /**
     * Closes the result set and the server-side statement by {@code COM_STMT_CLOSE}.
     *
     * @return a {@link Mono} completes when closed.
     */
    Mono<Void> close();
}
