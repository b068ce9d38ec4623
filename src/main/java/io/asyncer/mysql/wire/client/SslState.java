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

/**
 * User events of the TLS bridge.
 */
enum SslState {

    /**
     * The SSL request has been sent, the TLS handshake should be started.
     */
    BRIDGING,

    /**
     * The server does not support SSL and the configuration allows to continue in plaintext.
     */
    UNSUPPORTED
}
