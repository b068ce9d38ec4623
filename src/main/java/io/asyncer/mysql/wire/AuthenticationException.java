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

import io.r2dbc.spi.R2dbcPermissionDeniedException;
import org.jetbrains.annotations.Nullable;

/**
 * Login failed. It is either rejected by the server, then it carries the error code and SQL state of the
 * server, or refused locally, e.g. the configuration does not allow to retrieve the RSA public key.
 */
public final class AuthenticationException extends R2dbcPermissionDeniedException {

    private static final long serialVersionUID = -2290814390357161829L;

    /**
     * The client specific SQL state, means general error.
     */
    static final String CLI_SPECIFIC = "HY000";

    private final boolean policyViolation;

    private AuthenticationException(String reason, @Nullable String sqlState, int errorCode,
        boolean policyViolation) {
        super(reason, sqlState, errorCode);

        this.policyViolation = policyViolation;
    }

    /**
     * Checks if the login is refused by a local policy instead of the server.
     *
     * @return if it is a policy violation.
     */
    public boolean isPolicyViolation() {
        return policyViolation;
    }

    /**
     * Creates an exception of a server rejection.
     *
     * @param errorCode the server error code.
     * @param sqlState  the SQL state, may be {@code null} for very old servers.
     * @param message   the server error message.
     * @return the exception.
     */
    public static AuthenticationException rejected(int errorCode, @Nullable String sqlState, String message) {
        return new AuthenticationException(message, sqlState, errorCode, false);
    }

    /**
     * Creates an exception of a local failure, e.g. unknown authentication plugin.
     *
     * @param reason the reason.
     * @return the exception.
     */
    public static AuthenticationException local(String reason) {
        return new AuthenticationException(reason, CLI_SPECIFIC, 0, false);
    }

    /**
     * Creates an exception of a local policy, e.g. public key retrieval is not allowed.
     *
     * @param reason the reason.
     * @return the exception.
     */
    public static AuthenticationException policy(String reason) {
        return new AuthenticationException(reason, CLI_SPECIFIC, 0, true);
    }
}
