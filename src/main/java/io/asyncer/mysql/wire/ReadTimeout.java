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
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;
import io.r2dbc.spi.R2dbcTimeoutException;
import org.jetbrains.annotations.Nullable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Applies the read timeout of a connection to each await of server responses. The connection can not be
 * reused after a timeout, because the rest of responses can not be recognized, so it will be closed.
 */
final class ReadTimeout {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(ReadTimeout.class);

    private final Client client;

    @Nullable
    private final Duration timeout;

    ReadTimeout(Client client, @Nullable Duration timeout) {
        this.client = client;
        this.timeout = timeout;
    }

    <T> Mono<T> apply(Mono<T> source) {
        Duration timeout = this.timeout;

        if (timeout == null) {
            return source;
        }

        return source.timeout(timeout).onErrorResume(TimeoutException.class, e -> {
            logger.warn("Connection {} read timed out after {}, closing", client.getContext().getConnectionId(),
                timeout);

            return client.forceClose().then(Mono.error(new R2dbcTimeoutException("Read timed out after " +
                timeout, e)));
        });
    }
}
