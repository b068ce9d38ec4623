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

import io.asyncer.mysql.wire.api.MySqlResultSet;
import io.asyncer.mysql.wire.api.MySqlStatement;
import org.jetbrains.annotations.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.require;
import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonEmpty;

/**
 * An implementation of {@link MySqlStatement} which executes SQL statements by the text protocol.
 */
final class TextSimpleStatement extends StatementSupport implements MySqlStatement {

    private final List<String> batch = new ArrayList<>();

    TextSimpleStatement(MySqlSimpleConnection connection) {
        super(connection);
    }

    @Override
    public Mono<MySqlResultSet> executeQuery(String sql) {
        requireNonEmpty(sql, "sql must not be empty");

        return query("executeQuery", sql, false, () -> QueryFlow.execute(connection.getClient(), sql));
    }

    @Override
    public Mono<Long> executeUpdate(String sql, int autoGeneratedKeys) {
        requireNonEmpty(sql, "sql must not be empty");
        require(autoGeneratedKeys == RETURN_GENERATED_KEYS || autoGeneratedKeys == NO_GENERATED_KEYS,
            "autoGeneratedKeys must be RETURN_GENERATED_KEYS or NO_GENERATED_KEYS");

        return update("executeUpdate", sql, false, autoGeneratedKeys == RETURN_GENERATED_KEYS,
            () -> QueryFlow.execute(connection.getClient(), sql));
    }

    @Override
    public Mono<Boolean> execute(String sql) {
        requireNonEmpty(sql, "sql must not be empty");

        return open("execute", sql, false, false, () -> QueryFlow.execute(connection.getClient(), sql));
    }

    @Nullable
    @Override
    public MySqlResultSet getResultSet() {
        return currentResultSet();
    }

    @Override
    public long getUpdateCount() {
        return updateCount();
    }

    @Override
    public OptionalLong getLastInsertId() {
        return lastInsertId();
    }

    @Override
    public MySqlResultSet getGeneratedKeys() {
        return generatedKeys();
    }

    @Override
    public MySqlStatement addBatch(String sql) {
        requireNonEmpty(sql, "sql must not be empty");
        requireOpen();

        batch.add(sql);

        return this;
    }

    @Override
    public MySqlStatement clearBatch() {
        batch.clear();

        return this;
    }

    @Override
    public Mono<long[]> executeBatch() {
        return Mono.defer(() -> {
            requireOpen();

            List<String> statements = new ArrayList<>(batch);

            batch.clear();

            return Flux.fromIterable(statements)
                .concatMap(this::executeUpdate)
                .collectList()
                .map(TextSimpleStatement::toCounts);
        });
    }

    @Override
    public Mono<Void> close() {
        return Mono.defer(() -> {
            if (!markClosed()) {
                return Mono.empty();
            }

            batch.clear();

            return closeResultSet();
        });
    }

    @Override
    public String toString() {
        return "TextSimpleStatement{batch=" + batch.size() + '}';
    }

    static long[] toCounts(List<Long> counts) {
        int size = counts.size();
        long[] result = new long[size];

        for (int i = 0; i < size; ++i) {
            result[i] = counts.get(i);
        }

        return result;
    }
}
