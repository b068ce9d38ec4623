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

import io.asyncer.mysql.wire.client.Client;
import io.asyncer.mysql.wire.codec.MySqlParameter;
import io.asyncer.mysql.wire.message.client.CommandMessage;
import io.asyncer.mysql.wire.message.client.InitDbMessage;
import io.asyncer.mysql.wire.message.client.PrepareQueryMessage;
import io.asyncer.mysql.wire.message.client.PreparedCloseMessage;
import io.asyncer.mysql.wire.message.client.PreparedExecuteMessage;
import io.asyncer.mysql.wire.message.client.TextQueryMessage;
import io.asyncer.mysql.wire.message.server.CompleteMessage;
import io.asyncer.mysql.wire.message.server.ErrorMessage;
import io.asyncer.mysql.wire.message.server.OkMessage;
import io.asyncer.mysql.wire.message.server.PreparedOkMessage;
import io.asyncer.mysql.wire.message.server.RowMessage;
import io.asyncer.mysql.wire.message.server.ServerMessage;
import io.asyncer.mysql.wire.message.server.SyntheticMetadataMessage;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SynchronousSink;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * A message flow utility processes the commands after the login phase.
 */
final class QueryFlow {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(QueryFlow.class);

    private static final BiConsumer<ServerMessage, SynchronousSink<CompleteMessage>> COMPLETE = (message, sink) -> {
        if (message instanceof ErrorMessage) {
            sink.error(((ErrorMessage) message).toException());
        } else if (message instanceof CompleteMessage && ((CompleteMessage) message).isDone()) {
            sink.next((CompleteMessage) message);
            sink.complete();
        } else {
            release(message);
        }
    };

    /**
     * Executes a SQL statement by the text protocol. The {@link Flux} emits the messages of the first result
     * only: a {@link SyntheticMetadataMessage} and {@link RowMessage}s if it has rows, and then the
     * {@link CompleteMessage} that ends the result. The following results are released.
     *
     * @param client the client.
     * @param sql    the SQL statement.
     * @return the messages of the first result.
     */
    static Flux<ServerMessage> execute(Client client, String sql) {
        if (logger.isDebugEnabled()) {
            logger.debug("Connection {} executes a text query", client.getContext().getConnectionId());
        }

        return client.exchange(new TextQueryMessage(sql), new FirstResultHandler(sql));
    }

    /**
     * Executes a prepared statement by the binary protocol, see also {@link #execute(Client, String)}.
     *
     * @param client      the client.
     * @param statementId the identifier of the prepared statement.
     * @param values      the bound parameters.
     * @param sql         the SQL of the prepared statement, used by the error conversion.
     * @return the messages of the first result.
     */
    static Flux<ServerMessage> execute(Client client, int statementId, MySqlParameter[] values, String sql) {
        return client.exchange(new PreparedExecuteMessage(statementId, values), new FirstResultHandler(sql));
    }

    /**
     * Prepares a SQL statement. The {@link Flux} emits a {@link PreparedOkMessage} and then a completed
     * {@link SyntheticMetadataMessage} if the statement has parameters or columns.
     *
     * @param client the client.
     * @param sql    the SQL statement.
     * @return the prepare responses.
     */
    static Flux<ServerMessage> prepare(Client client, String sql) {
        return client.exchange(new PrepareQueryMessage(sql), (message, sink) -> {
            if (message instanceof ErrorMessage) {
                sink.error(((ErrorMessage) message).toException(sql));
            } else if (message instanceof PreparedOkMessage) {
                PreparedOkMessage ok = (PreparedOkMessage) message;

                sink.next(ok);

                if (ok.getTotalColumns() == 0 && ok.getTotalParameters() == 0) {
                    sink.complete();
                }
            } else if (message instanceof SyntheticMetadataMessage &&
                ((SyntheticMetadataMessage) message).isCompleted()) {
                sink.next(message);
                sink.complete();
            } else {
                release(message);
            }
        });
    }

    /**
     * Closes a prepared statement, the server does not respond to it.
     *
     * @param client      the client.
     * @param statementId the identifier of the prepared statement.
     * @return a {@link Mono} completes after the command is sent.
     */
    static Mono<Void> close(Client client, int statementId) {
        return client.exchange(new PreparedCloseMessage(statementId), (message, sink) -> release(message))
            .then();
    }

    /**
     * Reduces the first result to its {@link OkMessage}. Rows are released, a result with rows is an error.
     *
     * @param responses the responses of {@link #execute(Client, String)}.
     * @return the OK message.
     */
    static Mono<OkMessage> update(Flux<ServerMessage> responses) {
        return responses.doOnNext(QueryFlow::release)
            .filter(message -> !(message instanceof RowMessage))
            .collectList()
            .flatMap(QueryFlow::toOk);
    }

    /**
     * Executes a statement which has no result rows, e.g. {@code SET}, {@code COMMIT}.
     *
     * @param client the client.
     * @param sql    the SQL statement.
     * @return a {@link Mono} completes after the statement is done.
     */
    static Mono<Void> executeVoid(Client client, String sql) {
        return update(execute(client, sql)).then();
    }

    static Mono<Boolean> ping(Client client) {
        return client.exchange(CommandMessage.ping(), COMPLETE).then(Mono.just(true));
    }

    /**
     * Switches the current database by {@code COM_INIT_DB}, and updates the connection context.
     *
     * @param client   the client.
     * @param database the database.
     * @return a {@link Mono} completes after the database is switched.
     */
    static Mono<Void> initDb(Client client, String database) {
        return client.exchange(new InitDbMessage(database), COMPLETE)
            .then(Mono.fromRunnable(() -> client.getContext().setDatabase(database)));
    }

    static Mono<Void> resetConnection(Client client) {
        return client.exchange(CommandMessage.resetConnection(), COMPLETE).then();
    }

    static void release(ServerMessage message) {
        if (message instanceof RowMessage) {
            ((RowMessage) message).release();
        }
    }

    private static Mono<OkMessage> toOk(List<ServerMessage> messages) {
        if (messages.isEmpty()) {
            return Mono.error(new IllegalStateException("No response of the statement"));
        }

        ServerMessage first = messages.get(0);

        if (first instanceof OkMessage) {
            return Mono.just((OkMessage) first);
        } else if (first instanceof SyntheticMetadataMessage) {
            return Mono.error(new IllegalStateException("The statement returns a result set, use a query " +
                "instead of an update"));
        }

        return Mono.error(new IllegalStateException("Unexpected response " + first.getClass().getSimpleName()));
    }

    private QueryFlow() { }
}

/**
 * Forwards the first result of a response, and releases the following results of multi-statements or
 * stored procedures. The exchange ends with the last {@link CompleteMessage}.
 */
final class FirstResultHandler implements BiConsumer<ServerMessage, SynchronousSink<ServerMessage>> {

    private final String sql;

    private boolean firstDone;

    FirstResultHandler(String sql) {
        this.sql = sql;
    }

    @Override
    public void accept(ServerMessage message, SynchronousSink<ServerMessage> sink) {
        if (message instanceof ErrorMessage) {
            sink.error(((ErrorMessage) message).toException(sql));
            return;
        }

        if (message instanceof CompleteMessage) {
            if (!firstDone) {
                firstDone = true;
                sink.next(message);
            }

            if (((CompleteMessage) message).isDone()) {
                sink.complete();
            }
        } else if (firstDone) {
            QueryFlow.release(message);
        } else {
            sink.next(message);
        }
    }
}
