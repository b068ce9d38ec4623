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

package io.asyncer.mysql.wire.client;

import io.asyncer.mysql.wire.message.client.ClientMessage;
import io.asyncer.mysql.wire.message.server.ServerMessage;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.SynchronousSink;

import java.util.function.BiConsumer;

/**
 * An exchange of multiple request messages, the requests are driven by the responses, e.g. the login which
 * sends an authentication response for each challenge.
 *
 * @param <T> the type of the results.
 */
public abstract class FluxExchangeable<T> extends Flux<ClientMessage>
    implements BiConsumer<ServerMessage, SynchronousSink<T>>, Disposable {
}
