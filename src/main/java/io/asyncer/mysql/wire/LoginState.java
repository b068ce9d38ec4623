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

/**
 * The states of the connection phase, from the initial handshake to the end of authentication.
 */
enum LoginState {

    AWAIT_INITIAL_HANDSHAKE,

    /**
     * The SSL request is sent, it contains the negotiated capabilities.
     */
    CAPABILITIES_SENT,

    TLS_UPGRADING,

    /**
     * An authentication response is sent, waiting for the server to accept, challenge or switch the
     * authentication plugin.
     */
    AUTH_CHALLENGE_SENT,

    AUTH_SWITCHING,

    /**
     * The RSA public key of the server is requested, the next authentication data is the key.
     */
    PUBLIC_KEY_REQUESTED,

    AUTHENTICATED,

    AUTH_FAILED
}
