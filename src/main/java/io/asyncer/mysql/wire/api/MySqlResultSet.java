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

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.NoSuchElementException;

/**
 * A cursor over the rows of a query result. Rows are pulled from the connection on demand, so the result must
 * be read to the end or {@link #close() closed} before the connection can execute the next command.
 * <p>
 * Column accessors read the current row, i.e. the row of the last {@link #next()} which emitted
 * {@code true}. All getters of boxed types return {@code null} for SQL {@code NULL}.
 */
public interface MySqlResultSet {

    /**
     * Advances the cursor to the next row. It is the only operation which reads from the network.
     *
     * @return a {@link Mono} emits {@code true} if the cursor is on a new row, or {@code false} if there is no
     * more row.
     * @throws IllegalStateException if previous {@link #next()} has not completed yet.
     */
    Mono<Boolean> next();

    /**
     * Returns the metadata of columns, it is available before the first row.
     *
     * @return the metadata.
     */
    MySqlRowMetadata getMetadata();

    /**
     * Returns the value of a column in the current row.
     *
     * @param index the column index starting at {@code 0}.
     * @param type  the Java type to decode into, or {@link Object} for the default type of the column.
     * @param <T>   the type of the value.
     * @return the value, or {@code null} if it is SQL {@code NULL}.
     * @throws IllegalArgumentException  if {@code type} is {@code null}.
     * @throws IndexOutOfBoundsException if {@code index} is out of range.
     * @throws IllegalStateException     if the cursor is not on a row.
     * @throws io.asyncer.mysql.wire.TypeConversionException if the value can not be decoded as {@code type}.
     */
    @Nullable
    <T> T get(int index, Class<T> type);

    /**
     * Returns the value of a column in the current row.
     *
     * @param name the column name, case-insensitive.
     * @param type the Java type to decode into, or {@link Object} for the default type of the column.
     * @param <T>  the type of the value.
     * @return the value, or {@code null} if it is SQL {@code NULL}.
     * @throws IllegalArgumentException if {@code name} or {@code type} is {@code null}.
     * @throws NoSuchElementException   if there is no column with the {@code name}.
     * @throws IllegalStateException    if the cursor is not on a row.
     * @throws io.asyncer.mysql.wire.TypeConversionException if the value can not be decoded as {@code type}.
     */
    @Nullable
    <T> T get(String name, Class<T> type);

    @Nullable
    default Object get(int index) {
        return get(index, Object.class);
    }

    @Nullable
    default Object get(String name) {
        return get(name, Object.class);
    }

    @Nullable
    default String getString(int index) {
        return get(index, String.class);
    }

    @Nullable
    default String getString(String name) {
        return get(name, String.class);
    }

    @Nullable
    default Long getLong(int index) {
        return get(index, Long.class);
    }

    @Nullable
    default Long getLong(String name) {
        return get(name, Long.class);
    }

    @Nullable
    default Integer getInt(int index) {
        return get(index, Integer.class);
    }

    @Nullable
    default Integer getInt(String name) {
        return get(name, Integer.class);
    }

    @Nullable
    default Boolean getBoolean(int index) {
        return get(index, Boolean.class);
    }

    @Nullable
    default Boolean getBoolean(String name) {
        return get(name, Boolean.class);
    }

    @Nullable
    default BigDecimal getBigDecimal(int index) {
        return get(index, BigDecimal.class);
    }

    @Nullable
    default BigDecimal getBigDecimal(String name) {
        return get(name, BigDecimal.class);
    }

    @Nullable
    default Double getDouble(int index) {
        return get(index, Double.class);
    }

    @Nullable
    default Double getDouble(String name) {
        return get(name, Double.class);
    }

    @Nullable
    default byte[] getBytes(int index) {
        return get(index, byte[].class);
    }

    @Nullable
    default byte[] getBytes(String name) {
        return get(name, byte[].class);
    }

    @Nullable
    default LocalDate getLocalDate(int index) {
        return get(index, LocalDate.class);
    }

    @Nullable
    default LocalDate getLocalDate(String name) {
        return get(name, LocalDate.class);
    }

    @Nullable
    default LocalTime getLocalTime(int index) {
        return get(index, LocalTime.class);
    }

    @Nullable
    default LocalTime getLocalTime(String name) {
        return get(name, LocalTime.class);
    }

    @Nullable
    default LocalDateTime getLocalDateTime(int index) {
        return get(index, LocalDateTime.class);
    }

    @Nullable
    default LocalDateTime getLocalDateTime(String name) {
        return get(name, LocalDateTime.class);
    }

    /**
     * Checks if the cursor is closed, i.e. all rows are read or it is {@link #close() closed}.
     *
     * @return if it is closed.
     */
    boolean isClosed();

    /**
     * Closes the cursor and discards the rest of rows. The connection stays usable.
     *
     * @return a {@link Mono} completes when the rest of rows are discarded.
     */
    Mono<Void> close();
}
