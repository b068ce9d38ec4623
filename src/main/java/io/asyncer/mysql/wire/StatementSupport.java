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
import io.asyncer.mysql.wire.message.server.OkMessage;
import io.asyncer.mysql.wire.message.server.ServerMessage;
import io.asyncer.mysql.wire.message.server.SyntheticMetadataMessage;
import org.jetbrains.annotations.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.OptionalLong;
import java.util.function.Supplier;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * Base class considers the generic logic of statements: the current result set, the update count and the
 * generated keys of the last execution.
 */
abstract class StatementSupport {

    protected final MySqlSimpleConnection connection;

    @Nullable
    private AbstractResultSet resultSet;

    private long updateCount = -1;

    @Nullable
    private OkMessage lastOk;

    private boolean keysRequested;

    private volatile boolean closed;

    StatementSupport(MySqlSimpleConnection connection) {
        this.connection = requireNonNull(connection, "connection must not be null");
    }

    /**
     * Executes a statement, and reads its first response. The previous result set is closed before the
     * execution.
     *
     * @param operation     the operation name for the {@link Tracer}.
     * @param sql           the SQL statement.
     * @param binary        if the rows use the binary protocol.
     * @param keysRequested if the generated keys are requested.
     * @param exchange      the supplier of the responses.
     * @return {@code true} if the statement returns a result set, {@code false} if it is an update.
     */
    final Mono<Boolean> open(String operation, String sql, boolean binary, boolean keysRequested,
        Supplier<Flux<ServerMessage>> exchange) {
        return Mono.defer(() -> {
            requireOpen();

            return closeResultSet().then(Mono.defer(() -> {
                Tracer tracer = connection.getTracer();
                RowCursor cursor = connection.openCursor();

                this.updateCount = -1;
                this.lastOk = null;
                this.keysRequested = keysRequested;

                tracer.onStart(operation, sql);
                exchange.get().subscribe(cursor);

                return connection.getReadTimeout().apply(cursor.pull())
                    .map(message -> accept(message, cursor, binary))
                    .doOnCancel(cursor::cancel)
                    .doOnSuccess(ignored -> tracer.onEnd(operation, sql, null))
                    .doOnError(e -> tracer.onEnd(operation, sql, e));
            }));
        });
    }

    final Mono<MySqlResultSet> query(String operation, String sql, boolean binary,
        Supplier<Flux<ServerMessage>> exchange) {
        return open(operation, sql, binary, false, exchange).map(rows -> {
            AbstractResultSet result = this.resultSet;

            return rows && result != null ? result : SyntheticResultSet.empty(connection.getCodecs());
        });
    }

    final Mono<Long> update(String operation, String sql, boolean binary, boolean keysRequested,
        Supplier<Flux<ServerMessage>> exchange) {
        return open(operation, sql, binary, keysRequested, exchange).flatMap(rows -> {
            if (!rows) {
                return Mono.just(updateCount);
            }

            return closeResultSet().then(Mono.error(new IllegalStateException(
                "The statement returns a result set, use a query instead of an update")));
        });
    }

    @Nullable
    final MySqlResultSet currentResultSet() {
        return resultSet;
    }

    final long updateCount() {
        return updateCount;
    }

    final OptionalLong lastInsertId() {
        OkMessage ok = this.lastOk;

        return ok == null || ok.getLastInsertId() == 0 ? OptionalLong.empty() :
            OptionalLong.of(ok.getLastInsertId());
    }

    final MySqlResultSet generatedKeys() {
        if (!keysRequested) {
            throw new IllegalStateException("Generated keys are not requested, use RETURN_GENERATED_KEYS");
        }

        OkMessage ok = this.lastOk;

        if (ok == null) {
            throw new IllegalStateException("No update has been executed");
        }

        return SyntheticResultSet.generatedKeys(connection.getCodecs(), ok.getLastInsertId(),
            ok.getAffectedRows());
    }

    final Mono<Void> closeResultSet() {
        AbstractResultSet result = this.resultSet;

        if (result == null) {
            return Mono.empty();
        }

        this.resultSet = null;

        return result.close();
    }

    /**
     * Marks this closed, the caller should close the current result set.
     *
     * @return {@code true} if this call closes it.
     */
    final boolean markClosed() {
        if (closed) {
            return false;
        }

        closed = true;

        return true;
    }

    final void requireOpen() {
        if (closed) {
            throw new IllegalStateException("Statement is closed");
        }
    }

    private boolean accept(ServerMessage message, RowCursor cursor, boolean binary) {
        if (message instanceof SyntheticMetadataMessage) {
            MySqlRowDescriptor descriptor = MySqlRowDescriptor.create(((SyntheticMetadataMessage) message).unwrap());

            this.resultSet = new CursorResultSet(descriptor, connection.getCodecs(), binary, cursor,
                connection.getReadTimeout());

            return true;
        }

        if (message instanceof OkMessage) {
            OkMessage ok = (OkMessage) message;

            this.lastOk = ok;
            this.updateCount = ok.getAffectedRows();

            return false;
        }

        QueryFlow.release(message);

        throw new IllegalStateException("Unexpected response " + message.getClass().getSimpleName());
    }
}
