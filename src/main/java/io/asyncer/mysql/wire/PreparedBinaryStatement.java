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

import io.asyncer.mysql.wire.api.MySqlPreparedStatement;
import io.asyncer.mysql.wire.api.MySqlResultSet;
import io.asyncer.mysql.wire.api.MySqlRowMetadata;
import io.asyncer.mysql.wire.codec.MySqlParameter;
import io.asyncer.mysql.wire.message.server.PreparedOkMessage;
import io.asyncer.mysql.wire.message.server.ServerMessage;
import io.asyncer.mysql.wire.message.server.SyntheticMetadataMessage;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;
import org.jetbrains.annotations.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalLong;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * An implementation of {@link MySqlPreparedStatement} which executes a server-side prepared statement by the
 * binary protocol. Parameter indexes are 0-based.
 */
final class PreparedBinaryStatement extends StatementSupport implements MySqlPreparedStatement {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(PreparedBinaryStatement.class);

    private final String sql;

    private final int statementId;

    @Nullable
    private final MySqlRowDescriptor metadata;

    private final boolean keysRequested;

    private final MySqlParameter[] bindings;

    private final List<MySqlParameter[]> batch = new ArrayList<>();

    private PreparedBinaryStatement(MySqlSimpleConnection connection, String sql, int statementId,
        int parameters, @Nullable MySqlRowDescriptor metadata, boolean keysRequested) {
        super(connection);

        this.sql = sql;
        this.statementId = statementId;
        this.metadata = metadata;
        this.keysRequested = keysRequested;
        this.bindings = new MySqlParameter[parameters];
    }

    @Override
    public int getParameterCount() {
        return bindings.length;
    }

    @Nullable
    @Override
    public MySqlRowMetadata getMetadata() {
        return metadata;
    }

    @Override
    public MySqlPreparedStatement bind(int index, Object value) {
        requireNonNull(value, "value must not be null, use bindNull instead");
        checkIndex(index);

        bindings[index] = connection.getCodecs().encode(value);

        return this;
    }

    @Override
    public MySqlPreparedStatement bindNull(int index, Class<?> type) {
        requireNonNull(type, "type must not be null");
        checkIndex(index);

        bindings[index] = connection.getCodecs().encodeNull();

        return this;
    }

    @Override
    public MySqlPreparedStatement clearParameters() {
        Arrays.fill(bindings, null);

        return this;
    }

    @Override
    public MySqlPreparedStatement addBatch() {
        requireOpen();

        batch.add(boundValues());
        Arrays.fill(bindings, null);

        return this;
    }

    @Override
    public Mono<MySqlResultSet> executeQuery() {
        return Mono.defer(() -> {
            MySqlParameter[] values = boundValues();

            return query("executeQuery", sql, true, () -> exchange(values));
        });
    }

    @Override
    public Mono<Long> executeUpdate() {
        return Mono.defer(() -> {
            MySqlParameter[] values = boundValues();

            return update("executeUpdate", sql, true, keysRequested, () -> exchange(values));
        });
    }

    @Override
    public Mono<Boolean> execute() {
        return Mono.defer(() -> {
            MySqlParameter[] values = boundValues();

            return open("execute", sql, true, keysRequested, () -> exchange(values));
        });
    }

    @Override
    public Mono<long[]> executeBatch() {
        return Mono.defer(() -> {
            requireOpen();

            List<MySqlParameter[]> values = new ArrayList<>(batch);

            batch.clear();

            return Flux.fromIterable(values)
                .concatMap(parameters -> update("executeBatch", sql, true, keysRequested,
                    () -> exchange(parameters)))
                .collectList()
                .map(TextSimpleStatement::toCounts);
        });
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
    public Mono<Void> close() {
        return Mono.defer(() -> {
            if (!markClosed()) {
                return Mono.empty();
            }

            batch.clear();

            if (logger.isDebugEnabled()) {
                logger.debug("Closing prepared statement {} of connection {}", statementId,
                    connection.getConnectionId());
            }

            return closeResultSet().then(QueryFlow.close(connection.getClient(), statementId));
        });
    }

    @Override
    public String toString() {
        return "PreparedBinaryStatement{statementId=" + statementId + ", parameters=" + bindings.length + '}';
    }

    private Flux<ServerMessage> exchange(MySqlParameter[] values) {
        return QueryFlow.execute(connection.getClient(), statementId, values, sql);
    }

    private MySqlParameter[] boundValues() {
        requireOpen();

        for (int i = 0; i < bindings.length; ++i) {
            if (bindings[i] == null) {
                throw new IllegalStateException("Parameter " + i + " has no value bound");
            }
        }

        return bindings.clone();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= bindings.length) {
            throw new IndexOutOfBoundsException("Parameter index " + index + " is out of range [0, " +
                bindings.length + ')');
        }
    }

    /**
     * Creates a statement from the prepare responses, see {@link QueryFlow#prepare}.
     *
     * @param connection    the connection.
     * @param sql           the prepared SQL.
     * @param responses     the prepare responses.
     * @param keysRequested if the generated keys are requested.
     * @return the prepared statement.
     */
    static PreparedBinaryStatement create(MySqlSimpleConnection connection, String sql,
        List<ServerMessage> responses, boolean keysRequested) {
        PreparedOkMessage ok = null;
        MySqlRowDescriptor metadata = null;

        for (ServerMessage message : responses) {
            if (message instanceof PreparedOkMessage) {
                ok = (PreparedOkMessage) message;
            } else if (message instanceof SyntheticMetadataMessage) {
                metadata = MySqlRowDescriptor.create(((SyntheticMetadataMessage) message).unwrap());
            }
        }

        if (ok == null) {
            throw new IllegalStateException("Statement is not prepared by the server");
        }

        return new PreparedBinaryStatement(connection, sql, ok.getStatementId(), ok.getTotalParameters(),
            ok.getTotalColumns() > 0 ? metadata : null, keysRequested);
    }
}
