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

package io.asyncer.mysql.wire.constant;

/**
 * The SSL mode of a connection.
 */
public enum SslMode {

    /**
     * Plaintext connection, never attempt TLS.
     */
    DISABLED,

    /**
     * TLS with any server certificate accepted, for development or a trusted network.
     */
    TRUSTED,

    /**
     * TLS verified by the trust store of the JVM.
     */
    SYSTEM_TRUST,

    /**
     * TLS configured by a user customizer of the SSL context builder.
     */
    CUSTOM;

    /**
     * Checks if TLS should be started.
     *
     * @return if not {@link #DISABLED}.
     */
    public boolean startSsl() {
        return this != DISABLED;
    }

    /**
     * Checks if the server certificate should be verified.
     *
     * @return if verifying.
     */
    public boolean verifyCertificate() {
        return this == SYSTEM_TRUST || this == CUSTOM;
    }

    /**
     * Checks if the host name of the server should match its certificate.
     *
     * @return if verifying.
     */
    public boolean verifyIdentity() {
        return this == SYSTEM_TRUST;
    }
}
