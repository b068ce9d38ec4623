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
import io.asyncer.mysql.wire.api.MySqlResultSet;
import io.asyncer.mysql.wire.api.MySqlStatement;
import io.asyncer.mysql.wire.constant.ColumnDefinitions;
import io.asyncer.mysql.wire.constant.MySqlType;
import io.asyncer.mysql.wire.constant.ServerStatuses;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.r2dbc.spi.IsolationLevel;
import io.r2dbc.spi.R2dbcBadGrammarException;
import io.r2dbc.spi.R2dbcNonTransientResourceException;
import io.r2dbc.spi.R2dbcTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

/**
 * Statement scenarios against a {@link FakeServer} which responds by the SQL it receives.
 */
class StatementScenarioTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private static final short AUTO_COMMIT = ServerStatuses.AUTO_COMMIT;

    private static final byte COM_STMT_PREPARE = 0x16;

    private static final byte COM_STMT_EXECUTE = 0x17;

    private static final byte COM_STMT_CLOSE = 0x19;

    private static final byte COM_RESET_CONNECTION = 0x1F;

    private final FakeServer server = FakeServer.start(SqlScript::new);

    @AfterEach
    void stopServer() {
        server.close();
    }

    @Test
    void lazyTextRows() {
        server.provider().use(connection -> connection.createStatement()
                .executeQuery("SELECT id, name FROM users")
                .flatMap(rs -> {
                    assertThat(rs.getMetadata().getColumnCount()).isEqualTo(2);
                    assertThat(rs.getMetadata().getColumnMetadata("NAME").getType()).isEqualTo(MySqlType.VARCHAR);

                    return rows(rs, it -> it.getLong("id") + "=" + it.getString(1));
                }))
            .as(StepVerifier::create)
            .expectNext(Arrays.asList("1=alice", "2=null", "3=carol"))
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void exhaustedResultSet() {
        server.provider().use(connection -> connection.createStatement()
                .executeQuery("SELECT id, name FROM users")
                .flatMap(rs -> rows(rs, it -> it.getInt(0)).then(Mono.defer(() -> {
                    assertThatExceptionOfType(IllegalStateException.class)
                        .isThrownBy(() -> rs.get(0))
                        .withMessageContaining("exhausted");

                    return rs.next();
                }))))
            .as(StepVerifier::create)
            .expectNext(false)
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void closeResultSetEarly() {
        server.provider().use(connection -> {
                MySqlStatement statement = connection.createStatement();

                return statement.executeQuery("SELECT id, name FROM users")
                    .flatMap(rs -> rs.next()
                        .doOnNext(row -> assertThat(rs.getString("name")).isEqualTo("alice"))
                        .then(rs.close())
                        .then(Mono.fromCallable(() -> {
                            assertThat(rs.isClosed()).isTrue();
                            assertThatExceptionOfType(IllegalStateException.class).isThrownBy(() -> rs.get(0));

                            return rs;
                        })))
                    .then(statement.executeUpdate("UPDATE users SET name = 'dave'"));
            })
            .as(StepVerifier::create)
            .expectNext(5L)
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void bitInsertCounts() {
        server.provider().use(connection -> {
                MySqlStatement statement = connection.createStatement();

                return Flux.concat(statement.executeUpdate("CREATE TEMPORARY TABLE bits (v BIT(1))"),
                        statement.executeUpdate("INSERT INTO bits VALUES (b'1')"),
                        statement.executeUpdate("INSERT INTO bits VALUES (b'0'), (b'1')"))
                    .collectList();
            })
            .as(StepVerifier::create)
            .expectNext(Arrays.asList(0L, 1L, 2L))
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void generatedKeys() {
        String insert = "INSERT INTO users (name) VALUES ('a'), ('b'), ('c')";

        server.provider().use(connection -> {
                MySqlStatement statement = connection.createStatement();

                return statement.executeUpdate(insert, MySqlStatement.RETURN_GENERATED_KEYS)
                    .flatMap(count -> {
                        assertThat(count).isEqualTo(3);
                        assertThat(statement.getLastInsertId()).hasValue(10);

                        MySqlResultSet keys = statement.getGeneratedKeys();

                        assertThat(keys.getMetadata().getColumnMetadata(0).getName())
                            .isEqualTo("GENERATED_KEY");

                        return rows(keys, it -> it.get("GENERATED_KEY", BigInteger.class).longValue());
                    });
            })
            .as(StepVerifier::create)
            .expectNext(Arrays.asList(10L, 11L, 12L))
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void generatedKeysNotRequested() {
        server.provider().use(connection -> {
                MySqlStatement statement = connection.createStatement();

                return statement.executeUpdate("INSERT INTO users (name) VALUES ('a'), ('b'), ('c')")
                    .map(count -> statement);
            })
            .as(StepVerifier::create)
            .assertNext(statement -> {
                assertThat(statement.getUpdateCount()).isEqualTo(3);
                assertThat(statement.getLastInsertId()).hasValue(10);
                assertThatExceptionOfType(IllegalStateException.class)
                    .isThrownBy(statement::getGeneratedKeys)
                    .withMessageContaining("RETURN_GENERATED_KEYS");
            })
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void queryWithoutRows() {
        server.provider().use(connection -> {
                MySqlStatement statement = connection.createStatement();

                return statement.executeQuery("DELETE FROM users")
                    .flatMap(rs -> {
                        assertThat(rs.getMetadata().getColumnCount()).isZero();
                        assertThat(statement.getUpdateCount()).isEqualTo(4);

                        return rs.next();
                    });
            })
            .as(StepVerifier::create)
            .expectNext(false)
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void updateWithRows() {
        server.provider().use(connection -> {
                MySqlStatement statement = connection.createStatement();

                return statement.executeUpdate("SELECT id, name FROM users")
                    .onErrorResume(IllegalStateException.class, e -> {
                        assertThat(e).hasMessageContaining("use a query instead of an update");

                        return statement.executeUpdate("UPDATE users SET name = 'dave'");
                    });
            })
            .as(StepVerifier::create)
            .expectNext(5L)
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void serverErrorIsTraced() {
        RecordingTracer tracer = new RecordingTracer();

        server.provider().setTracer(tracer).use(connection -> {
                MySqlStatement statement = connection.createStatement();

                return statement.executeQuery("SELEC 1")
                    .then(Mono.<Long>error(new AssertionError("Bad grammar must fail")))
                    .onErrorResume(R2dbcBadGrammarException.class, e -> {
                        assertThat(e.getErrorCode()).isEqualTo(1064);
                        assertThat(e.getSqlState()).isEqualTo("42000");
                        assertThat(e.getOffendingSql()).isEqualTo("SELEC 1");

                        return statement.executeUpdate("UPDATE users SET name = 'dave'");
                    });
            })
            .as(StepVerifier::create)
            .expectNext(5L)
            .expectComplete()
            .verify(TIMEOUT);

        assertThat(tracer.getEvents()).containsExactly(
            "start executeQuery SELEC 1",
            "error executeQuery R2dbcBadGrammarException",
            "start executeUpdate UPDATE users SET name = 'dave'",
            "end executeUpdate");
    }

    @Test
    void followingResultsAreDiscarded() {
        server.provider().use(connection -> {
                MySqlStatement statement = connection.createStatement();

                return statement.executeQuery("CALL report()")
                    .flatMap(rs -> rows(rs, it -> it.getString(0)))
                    .flatMap(values -> statement.executeUpdate("UPDATE users SET name = 'dave'")
                        .map(count -> values + ":" + count));
            })
            .as(StepVerifier::create)
            .expectNext("[first]:5")
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void textBatch() {
        server.provider().use(connection -> connection.createStatement()
                .addBatch("INSERT INTO bits VALUES (b'1')")
                .addBatch("INSERT INTO bits VALUES (b'0'), (b'1')")
                .executeBatch())
            .as(StepVerifier::create)
            .assertNext(counts -> assertThat(counts).containsExactly(1, 2))
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void preparedStatement() throws InterruptedException {
        server.provider().use(connection -> connection.prepareStatement("SELECT ? + 1 AS v")
                .flatMap(statement -> {
                    assertThat(statement.getParameterCount()).isEqualTo(1);
                    assertThat(statement.getMetadata().getColumnMetadata("v").getType())
                        .isEqualTo(MySqlType.BIGINT);

                    assertThatExceptionOfType(IndexOutOfBoundsException.class)
                        .isThrownBy(() -> statement.bind(1, 41L))
                        .withMessage("Parameter index 1 is out of range [0, 1)");

                    return statement.executeQuery()
                        .then(Mono.<MySqlResultSet>error(new AssertionError("Unbound parameter must fail")))
                        .onErrorResume(IllegalStateException.class, e -> {
                            assertThat(e).hasMessage("Parameter 0 has no value bound");

                            return statement.bind(0, 41L).executeQuery();
                        })
                        .flatMap(rs -> rows(rs, it -> it.getLong("v")))
                        .flatMap(values -> statement.close().thenReturn(values));
                }))
            .as(StepVerifier::create)
            .expectNext(Arrays.asList(42L))
            .expectComplete()
            .verify(TIMEOUT);

        assertThat(server.awaitAllClosed(TIMEOUT)).isTrue();

        List<byte[]> commands = server.session(0).getCommands();

        assertThat(commands).hasSize(3);
        assertThat(commands.get(0)[0]).isEqualTo(COM_STMT_PREPARE);
        assertThat(commands.get(1)).startsWith(COM_STMT_EXECUTE, 7, 0, 0, 0);
        assertThat(commands.get(2)).containsExactly(COM_STMT_CLOSE, 7, 0, 0, 0);
    }

    @Test
    void sessionCommands() {
        server.provider().use(connection -> connection.setAutoCommit(false)
                .then(Mono.fromRunnable(() -> assertThat(connection.isAutoCommit()).isFalse()))
                .then(connection.createSavepoint("sp`1"))
                .then(connection.rollbackToSavepoint("sp`1"))
                .then(connection.commit())
                .then(connection.setTransactionIsolationLevel(IsolationLevel.READ_COMMITTED))
                .then(connection.setCatalog("other"))
                .then(connection.validate())
                .map(valid -> connection.getCatalog() + ':' + valid))
            .as(StepVerifier::create)
            .expectNext("other:true")
            .expectComplete()
            .verify(TIMEOUT);

        assertThat(server.queries()).containsExactly(
            "SET autocommit=0",
            "SAVEPOINT `sp``1`",
            "ROLLBACK TO SAVEPOINT `sp``1`",
            "COMMIT",
            "SET SESSION TRANSACTION ISOLATION LEVEL READ COMMITTED");
    }

    @Test
    void sessionStateCommands() {
        server.provider().use(connection -> connection.setSchema("ignored")
                .then(connection.setReadOnly(true))
                .then(connection.resetServerState())
                .then(Mono.fromCallable(() -> String.valueOf(connection.getSchema()))))
            .as(StepVerifier::create)
            .expectNext("null")
            .expectComplete()
            .verify(TIMEOUT);

        // Catalog is the default term, so setSchema sends nothing.
        assertThat(server.queries()).containsExactly("SET SESSION TRANSACTION READ ONLY");
        assertThat(server.session(0).getCommands()).anySatisfy(command ->
            assertThat(command[0]).isEqualTo(COM_RESET_CONNECTION));
    }

    @Test
    void executeAndClearBatch() {
        server.provider().use(connection -> {
                MySqlStatement statement = connection.createStatement();

                return statement.addBatch("DELETE FROM users")
                    .clearBatch()
                    .addBatch("UPDATE users SET name = 'erin'")
                    .executeBatch()
                    .flatMap(counts -> {
                        assertThat(counts).containsExactly(5);

                        return statement.execute("SELECT id, name FROM users");
                    })
                    .flatMap(hasRows -> {
                        assertThat(hasRows).isTrue();

                        return rows(statement.getResultSet(), it -> it.getLong("id"));
                    });
            })
            .as(StepVerifier::create)
            .expectNext(Arrays.asList(1L, 2L, 3L))
            .expectComplete()
            .verify(TIMEOUT);

        assertThat(server.queries()).containsExactly("UPDATE users SET name = 'erin'", "SELECT id, name FROM users");
    }

    @Test
    void clearedParametersMustBeBoundAgain() {
        server.provider().use(connection -> connection.prepareStatement("SELECT ? + 1 AS v")
                .flatMap(statement -> statement.bind(0, 41L).clearParameters().executeQuery()))
            .as(StepVerifier::create)
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Parameter 0 has no value bound"))
            .verify(TIMEOUT);
    }

    @Test
    void outOfOrderPacketBreaksConnection() throws InterruptedException {
        MySqlConnection connection = server.provider().create().block(TIMEOUT);

        assertThat(connection).isNotNull();

        connection.createStatement()
            .executeQuery("SELECT 'out of order'")
            .as(StepVerifier::create)
            .expectErrorSatisfies(e -> assertThat(e)
                .isInstanceOf(ProtocolFramingException.class)
                .hasMessageContaining("expected sequence id 1 but got 5"))
            .verify(TIMEOUT);

        assertThat(server.awaitAllClosed(TIMEOUT)).isTrue();

        connection.createStatement()
            .executeUpdate("UPDATE users SET name = 'erin'")
            .as(StepVerifier::create)
            .expectError(R2dbcNonTransientResourceException.class)
            .verify(TIMEOUT);
    }

    @Test
    void closeCancelsOpenResultSet() throws InterruptedException {
        MySqlConnection connection = server.provider().create().block(TIMEOUT);

        assertThat(connection).isNotNull();

        connection.createStatement()
            .executeQuery("SELECT id FROM endless")
            .flatMap(rs -> rs.next().thenReturn(rs))
            .flatMap(rs -> connection.close().thenReturn(rs))
            .as(StepVerifier::create)
            .assertNext(rs -> assertThat(connection.isClosed()).isTrue())
            .expectComplete()
            .verify(TIMEOUT);

        assertThat(server.awaitAllClosed(TIMEOUT)).isTrue();
    }

    @Test
    void readTimeoutClosesConnection() throws InterruptedException {
        server.provider().setReadTimeout(Duration.ofMillis(200))
            .use(connection -> connection.createStatement().executeQuery("SELECT SLEEP(10)"))
            .as(StepVerifier::create)
            .expectError(R2dbcTimeoutException.class)
            .verify(TIMEOUT);

        assertThat(server.awaitAllClosed(TIMEOUT)).isTrue();
    }

    private static <T> Mono<List<T>> rows(MySqlResultSet rs, Function<MySqlResultSet, T> mapper) {
        return Mono.defer(rs::next)
            .repeat()
            .takeWhile(Boolean::booleanValue)
            .map(ignored -> mapper.apply(rs))
            .collectList();
    }

    /**
     * Responds by the SQL of text queries, and the prepared statement {@code SELECT ? + 1 AS v}.
     */
    private static final class SqlScript extends FakeServer.Script {

        @Override
        void onCommand(FakeServer.Session session, ByteBuf payload) {
            switch (FakeServer.command(payload)) {
                case COM_STMT_PREPARE:
                    session.reply(ServerPayloads.preparedOk(7, 1, 1),
                        ServerPayloads.column("?", MySqlType.BIGINT, 0),
                        ServerPayloads.column("v", MySqlType.BIGINT, 0));
                    return;
                case COM_STMT_EXECUTE:
                    session.reply(ServerPayloads.columnCount(1),
                        ServerPayloads.column("v", MySqlType.BIGINT, 0),
                        Unpooled.buffer().writeByte(0).writeByte(0).writeLongLE(42),
                        ServerPayloads.eofOk(AUTO_COMMIT));
                    return;
                case COM_STMT_CLOSE:
                    return;
                default:
                    break;
            }

            String sql = FakeServer.query(payload);

            if (sql == null) {
                super.onCommand(session, payload);
            } else if (sql.startsWith("SELECT id, name")) {
                session.reply(ServerPayloads.columnCount(2),
                    ServerPayloads.column("id", MySqlType.BIGINT,
                        ColumnDefinitions.NOT_NULL | ColumnDefinitions.PRIMARY_PART),
                    ServerPayloads.column("name", MySqlType.VARCHAR, 0),
                    ServerPayloads.textRow("1", "alice"),
                    ServerPayloads.textRow("2", null),
                    ServerPayloads.textRow("3", "carol"),
                    ServerPayloads.eofOk(AUTO_COMMIT));
            } else if (sql.equals("SELECT id FROM endless")) {
                session.reply(ServerPayloads.columnCount(1),
                    ServerPayloads.column("id", MySqlType.BIGINT, 0),
                    ServerPayloads.textRow("1"));
            } else if (sql.equals("SELECT 'out of order'")) {
                session.resequence(5);
                session.reply(ServerPayloads.ok(0, 0, AUTO_COMMIT));
            } else if (sql.startsWith("SELECT SLEEP")) {
                // Never responds.
                return;
            } else if (sql.startsWith("CALL")) {
                session.reply(ServerPayloads.columnCount(1),
                    ServerPayloads.column("s", MySqlType.VARCHAR, 0),
                    ServerPayloads.textRow("first"),
                    ServerPayloads.eofOk(AUTO_COMMIT | ServerStatuses.MORE_RESULTS_EXISTS),
                    ServerPayloads.ok(0, 0, AUTO_COMMIT));
            } else if (sql.startsWith("SELEC ")) {
                session.reply(ServerPayloads.error(1064, "42000", "You have an error in your SQL syntax"));
            } else if (sql.startsWith("INSERT INTO users")) {
                session.reply(ServerPayloads.ok(3, 10, AUTO_COMMIT));
            } else if (sql.startsWith("INSERT INTO bits")) {
                session.reply(ServerPayloads.ok(sql.indexOf("),") < 0 ? 1 : 2, 0, AUTO_COMMIT));
            } else if (sql.startsWith("UPDATE")) {
                session.reply(ServerPayloads.ok(5, 0, AUTO_COMMIT));
            } else if (sql.startsWith("DELETE")) {
                session.reply(ServerPayloads.ok(4, 0, AUTO_COMMIT));
            } else if (sql.equals("SET autocommit=0")) {
                session.reply(ServerPayloads.ok(0, 0, 0));
            } else {
                super.onCommand(session, payload);
            }
        }
    }
}
