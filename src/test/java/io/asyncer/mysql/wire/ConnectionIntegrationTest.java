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

import io.asyncer.mysql.wire.api.MySqlStatement;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigInteger;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.BitSet;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for connections, statements and result sets on a real server.
 */
class ConnectionIntegrationTest extends IntegrationTestSupport {

    @Test
    void bitInsertCounts() {
        provider().use(connection -> {
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
        provider().use(connection -> {
                MySqlStatement statement = connection.createStatement();

                return statement.executeUpdate("CREATE TEMPORARY TABLE users " +
                        "(id BIGINT UNSIGNED AUTO_INCREMENT PRIMARY KEY, name VARCHAR(20))")
                    .then(statement.executeUpdate("INSERT INTO users (name) VALUES ('a'), ('b')",
                        MySqlStatement.RETURN_GENERATED_KEYS))
                    .flatMap(count -> rows(statement.getGeneratedKeys(),
                        rs -> rs.get("GENERATED_KEY", BigInteger.class)));
            })
            .as(StepVerifier::create)
            .expectNext(Arrays.asList(BigInteger.ONE, BigInteger.valueOf(2)))
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void preparedRoundTrip() {
        provider().use(connection -> connection.createStatement()
                .executeUpdate("CREATE TEMPORARY TABLE events (id INT, day DATE, flags BIT(8), note TEXT)")
                .then(connection.prepareStatement("INSERT INTO events VALUES (?, ?, ?, ?)"))
                .flatMap(insert -> {
                    BitSet flags = new BitSet();

                    flags.set(0);
                    flags.set(7);

                    return insert.bind(0, 1)
                        .bind(1, LocalDate.of(2023, 10, 1))
                        .bind(2, flags)
                        .bindNull(3, String.class)
                        .executeUpdate()
                        .flatMap(count -> insert.close().thenReturn(count));
                })
                .then(connection.prepareStatement("SELECT id, day, flags, note FROM events WHERE id = ?"))
                .flatMap(select -> select.bind(0, 1)
                    .executeQuery()
                    .flatMap(rs -> rows(rs, it -> it.getInt("id") + " " + it.getLocalDate("day") + " " +
                        it.get("flags", BitSet.class) + " " + it.getString("note")))
                    .flatMap(values -> select.close().thenReturn(values))))
            .as(StepVerifier::create)
            .expectNext(Arrays.asList("1 2023-10-01 {0, 7} null"))
            .expectComplete()
            .verify(TIMEOUT);
    }

    @Test
    void lazyCursorCloseDrains() {
        complete(connection -> {
            MySqlStatement statement = connection.createStatement();

            return statement.executeQuery("SELECT 1 UNION ALL SELECT 2 UNION ALL SELECT 3")
                .flatMap(rs -> rs.next().then(rs.close()))
                .then(statement.executeQuery("SELECT 42"))
                .flatMap(rs -> rows(rs, it -> it.getLong(0)))
                .doOnNext(values -> assertThat(values).containsExactly(42L));
        });
    }

    @Test
    void badGrammarKeepsConnectionUsable() {
        badGrammar(connection -> connection.createStatement().executeQuery("SELEC 1"));
    }

    @Test
    void transactions() {
        complete(connection -> connection.createStatement()
            .executeUpdate("CREATE TEMPORARY TABLE tx (v INT)")
            .then(connection.setAutoCommit(false))
            .then(connection.createStatement().executeUpdate("INSERT INTO tx VALUES (1)"))
            .then(Mono.fromRunnable(() -> assertThat(connection.isInTransaction()).isTrue()))
            .then(connection.rollback())
            .then(connection.createStatement().executeQuery("SELECT COUNT(*) FROM tx"))
            .flatMap(rs -> rows(rs, it -> it.getLong(0)))
            .doOnNext(values -> assertThat(values).containsExactly(0L)));
    }

    @Test
    void tls() {
        provider().setSSL(SslConfiguration.trusted())
            .use(connection -> connection.createStatement()
                .executeQuery("SHOW SESSION STATUS LIKE 'Ssl_version'")
                .flatMap(rs -> rows(rs, it -> it.getString(1))))
            .as(StepVerifier::create)
            .assertNext(values -> assertThat(values).hasSize(1).allSatisfy(v -> assertThat(v).startsWith("TLS")))
            .expectComplete()
            .verify(TIMEOUT);
    }
}
