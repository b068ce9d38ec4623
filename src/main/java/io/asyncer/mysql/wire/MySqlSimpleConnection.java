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

import io.asyncer.mysql.wire.api.MySqlConnection;
import io.asyncer.mysql.wire.api.MySqlPreparedStatement;
import io.asyncer.mysql.wire.api.MySqlStatement;
import io.asyncer.mysql.wire.client.Client;
import io.asyncer.mysql.wire.codec.Codecs;
import io.asyncer.mysql.wire.constant.DatabaseTerm;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;
import io.r2dbc.spi.IsolationLevel;
import org.jetbrains.annotations.Nullable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.require;
import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonEmpty;
import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;
import static io.asyncer.mysql.wire.internal.util.StringUtils.quoteIdentifier;

/**
 * An implementation of {@link MySqlConnection} for connecting to the MySQL server.
 */
final class MySqlSimpleConnection implements MySqlConnection {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(MySqlSimpleConnection.class);

    private final Client client;

    private final Codecs codecs;

    private final ReadTimeout readTimeout;

    private final Tracer tracer;

    private final DatabaseTerm databaseTerm;

    private final Set<RowCursor> cursors = ConcurrentHashMap.newKeySet();

    MySqlSimpleConnection(Client client, Codecs codecs, @Nullable Duration readTimeout, Tracer tracer,
        DatabaseTerm databaseTerm) {
        this.client = requireNonNull(client, "client must not be null");
        this.codecs = requireNonNull(codecs, "codecs must not be null");
        this.readTimeout = new ReadTimeout(client, readTimeout);
        this.tracer = requireNonNull(tracer, "tracer must not be null");
        this.databaseTerm = requireNonNull(databaseTerm, "databaseTerm must not be null");
    }

    @Override
    public MySqlStatement createStatement() {
        return new TextSimpleStatement(this);
    }

    @Override
    public Mono<MySqlPreparedStatement> prepareStatement(String sql, int autoGeneratedKeys) {
        requireNonEmpty(sql, "sql must not be empty");
        require(autoGeneratedKeys == MySqlStatement.RETURN_GENERATED_KEYS ||
            autoGeneratedKeys == MySqlStatement.NO_GENERATED_KEYS,
            "autoGeneratedKeys must be RETURN_GENERATED_KEYS or NO_GENERATED_KEYS");

        return readTimeout.apply(QueryFlow.prepare(client, sql).collectList())
            .map(responses -> PreparedBinaryStatement.create(this, sql, responses,
                autoGeneratedKeys == MySqlStatement.RETURN_GENERATED_KEYS));
    }

    @Override
    public Mono<Boolean> validate() {
        if (!client.isConnected()) {
            return Mono.just(false);
        }

        return readTimeout.apply(QueryFlow.ping(client)).onErrorResume(e -> {
            logger.debug("Remote validate failed", e);

            return Mono.just(false);
        });
    }

    @Override
    public boolean isAutoCommit() {
        return client.getContext().isAutoCommit();
    }

    @Override
    public Mono<Void> setAutoCommit(boolean autoCommit) {
        return Mono.defer(() -> {
            if (autoCommit == isAutoCommit()) {
                return Mono.empty();
            }

            return executeVoid("SET autocommit=" + (autoCommit ? 1 : 0));
        });
    }

    @Override
    public boolean isInTransaction() {
        return client.getContext().isInTransaction();
    }

    @Override
    public Mono<Void> commit() {
        return executeVoid("COMMIT");
    }

    @Override
    public Mono<Void> rollback() {
        return executeVoid("ROLLBACK");
    }

    @Override
    public Mono<Void> createSavepoint(String name) {
        return executeVoid("SAVEPOINT " + quoteIdentifier(name));
    }

    @Override
    public Mono<Void> releaseSavepoint(String name) {
        return executeVoid("RELEASE SAVEPOINT " + quoteIdentifier(name));
    }

    @Override
    public Mono<Void> rollbackToSavepoint(String name) {
        return executeVoid("ROLLBACK TO SAVEPOINT " + quoteIdentifier(name));
    }

    @Override
    public Mono<Void> setTransactionIsolationLevel(IsolationLevel level) {
        requireNonNull(level, "level must not be null");

        return executeVoid("SET SESSION TRANSACTION ISOLATION LEVEL " + level.asSql());
    }

    @Override
    public Mono<Void> setReadOnly(boolean readOnly) {
        return executeVoid("SET SESSION TRANSACTION " + (readOnly ? "READ ONLY" : "READ WRITE"));
    }

    @Nullable
    @Override
    public String getSchema() {
        return databaseTerm == DatabaseTerm.SCHEMA ? client.getContext().getDatabase() : null;
    }

    @Override
    public Mono<Void> setSchema(String schema) {
        requireNonEmpty(schema, "schema must not be empty");

        return databaseTerm == DatabaseTerm.SCHEMA ? useDatabase(schema) : Mono.empty();
    }

    @Nullable
    @Override
    public String getCatalog() {
        return databaseTerm == DatabaseTerm.CATALOG ? client.getContext().getDatabase() : null;
    }

    @Override
    public Mono<Void> setCatalog(String catalog) {
        requireNonEmpty(catalog, "catalog must not be empty");

        return databaseTerm == DatabaseTerm.CATALOG ? useDatabase(catalog) : Mono.empty();
    }

    @Override
    public Mono<Void> resetServerState() {
        return readTimeout.apply(QueryFlow.resetConnection(client));
    }

    @Override
    public ServerVersion getServerVersion() {
        return client.getContext().getServerVersion();
    }

    @Override
    public int getConnectionId() {
        return client.getContext().getConnectionId();
    }

    @Override
    public Mono<Void> close() {
        return Mono.defer(() -> {
            if (!cursors.isEmpty()) {
                logger.debug("Connection {} closing with open result sets, cancelling them", getConnectionId());

                for (RowCursor cursor : cursors) {
                    cursor.cancel();
                }

                cursors.clear();
            }

            Mono<Void> closer = client.close();

            if (logger.isDebugEnabled()) {
                return closer.doOnSubscribe(s -> logger.debug("Connection closing"))
                    .doOnSuccess(ignored -> logger.debug("Connection close succeed"));
            }

            return closer;
        });
    }

    @Override
    public boolean isClosed() {
        return !client.isConnected();
    }

    @Override
    public String toString() {
        return "MySqlSimpleConnection{client=" + client + ", databaseTerm=" + databaseTerm + '}';
    }

    Client getClient() {
        return client;
    }

    Codecs getCodecs() {
        return codecs;
    }

    ReadTimeout getReadTimeout() {
        return readTimeout;
    }

    Tracer getTracer() {
        return tracer;
    }

    /**
     * Creates a cursor of statement responses, it will be cancelled if the connection closes before the
     * responses end.
     *
     * @return the cursor.
     */
    RowCursor openCursor() {
        RowCursor cursor = new RowCursor(cursors::remove);

        cursors.add(cursor);

        return cursor;
    }

    private Mono<Void> useDatabase(String database) {
        return readTimeout.apply(QueryFlow.initDb(client, database))
            .doOnSuccess(ignored -> logger.debug("Connection {} switched database", getConnectionId()));
    }

    private Mono<Void> executeVoid(String sql) {
        return Mono.defer(() -> {
            tracer.onStart("executeVoid", sql);

            return readTimeout.apply(QueryFlow.executeVoid(client, sql))
                .doOnSuccess(ignored -> tracer.onEnd("executeVoid", sql, null))
                .doOnError(e -> tracer.onEnd("executeVoid", sql, e));
        });
    }
}
