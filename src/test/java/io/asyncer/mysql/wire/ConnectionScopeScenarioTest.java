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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Scenarios of {@link ConnectionProvider#use} hooks against a {@link FakeServer}.
 */
class ConnectionScopeScenarioTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private final FakeServer server = FakeServer.start(FakeServer.Script::new);

    private final List<Object> afterInputs = new CopyOnWriteArrayList<>();

    private final AtomicInteger bodies = new AtomicInteger();

    @AfterEach
    void stopServer() {
        server.close();
    }

    @Test
    void hooksAroundBody() throws InterruptedException {
        hooked().use(connection -> execute(connection, "SELECT 1").thenReturn("done"))
            .as(StepVerifier::create)
            .expectNext("done")
            .expectComplete()
            .verify(TIMEOUT);

        assertThat(server.queries()).containsExactly("SET @tag = 'scope'", "SELECT 1", "SET @tag = NULL");
        assertThat(afterInputs).containsExactly("scope");
        assertThat(server.awaitAllClosed(TIMEOUT)).isTrue();
    }

    @Test
    void afterRunsWhenBodyFails() throws InterruptedException {
        hooked().use(connection -> execute(connection, "SELECT 1")
                .then(Mono.error(new IllegalArgumentException("body failed"))))
            .as(StepVerifier::create)
            .expectErrorMessage("body failed")
            .verify(TIMEOUT);

        assertThat(server.queries()).containsExactly("SET @tag = 'scope'", "SELECT 1", "SET @tag = NULL");
        assertThat(afterInputs).containsExactly("scope");
        assertThat(server.awaitAllClosed(TIMEOUT)).isTrue();
    }

    @Test
    void afterRunsWhenBodyCancelled() throws InterruptedException {
        hooked().use(connection -> {
                bodies.incrementAndGet();
                return Mono.never();
            })
            .as(StepVerifier::create)
            .expectSubscription()
            .then(() -> awaitBodies(1))
            .thenCancel()
            .verify(TIMEOUT);

        assertThat(server.awaitAllClosed(TIMEOUT)).isTrue();
        assertThat(afterInputs).containsExactly("scope");
        assertThat(server.queries()).containsExactly("SET @tag = 'scope'", "SET @tag = NULL");
    }

    @Test
    void failedBeforeSkipsBodyAndAfter() throws InterruptedException {
        server.provider()
            .withBeforeAfter(connection -> Mono.<String>error(new IllegalStateException("before failed")),
                (connection, tag) -> Mono.fromRunnable(() -> afterInputs.add(tag)))
            .use(connection -> {
                bodies.incrementAndGet();
                return Mono.just("unreachable");
            })
            .as(StepVerifier::create)
            .expectErrorMessage("before failed")
            .verify(TIMEOUT);

        assertThat(bodies).hasValue(0);
        assertThat(afterInputs).isEmpty();
        assertThat(server.awaitAllClosed(TIMEOUT)).isTrue();
    }

    @Test
    void afterWithoutBefore() {
        server.provider()
            .withAfter((connection, input) -> Mono.fromRunnable(() -> afterInputs.add(String.valueOf(input))))
            .use(connection -> Mono.just(connection.getConnectionId()))
            .as(StepVerifier::create)
            .expectNext(101)
            .expectComplete()
            .verify(TIMEOUT);

        assertThat(afterInputs).containsExactly("null");
    }

    @Test
    void beforeWithoutValue() {
        server.provider()
            .withBeforeAfter(connection -> execute(connection, "SET @tag = NULL").then(Mono.<String>empty()),
                (connection, tag) -> Mono.fromRunnable(() -> afterInputs.add(String.valueOf(tag))))
            .use(connection -> Mono.just("done"))
            .as(StepVerifier::create)
            .expectNext("done")
            .expectComplete()
            .verify(TIMEOUT);

        assertThat(afterInputs).containsExactly("null");
    }

    @Test
    void eachScopeUsesItsOwnConnection() throws InterruptedException {
        ConnectionProvider provider = server.provider();

        provider.use(connection -> Mono.just(connection.getConnectionId()))
            .concatWith(provider.use(connection -> Mono.just(connection.getConnectionId())))
            .as(StepVerifier::create)
            .expectNext(101, 102)
            .expectComplete()
            .verify(TIMEOUT);

        assertThat(server.sessionCount()).isEqualTo(2);
        assertThat(server.awaitAllClosed(TIMEOUT)).isTrue();
    }

    private ConnectionProvider hooked() {
        return server.provider().withBeforeAfter(
            connection -> execute(connection, "SET @tag = 'scope'").thenReturn("scope"),
            (connection, tag) -> {
                afterInputs.add(tag);
                return execute(connection, "SET @tag = NULL");
            });
    }

    private void awaitBodies(int expected) {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();

        while (bodies.get() < expected && System.nanoTime() < deadline) {
            Thread.onSpinWait();
        }
    }

    private static Mono<Void> execute(MySqlConnection connection, String sql) {
        return connection.createStatement().executeUpdate(sql).then();
    }
}
