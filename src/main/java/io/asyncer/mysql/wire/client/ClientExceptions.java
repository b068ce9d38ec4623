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

import io.netty.handler.codec.DecoderException;
import io.r2dbc.spi.R2dbcException;
import io.r2dbc.spi.R2dbcNonTransientResourceException;

/**
 * A factory for creating {@link R2dbcException}s of the transport.
 */
final class ClientExceptions {

    private static final String CONNECTION_CLOSED = "08003";

    private static final String COMMUNICATION_FAILURE = "08S01";

    static R2dbcException unexpectedClosed() {
        return new R2dbcNonTransientResourceException("Connection unexpectedly closed", COMMUNICATION_FAILURE);
    }

    static R2dbcException expectedClosed() {
        return new R2dbcNonTransientResourceException("Connection closed", CONNECTION_CLOSED);
    }

    static R2dbcException exchangeClosed() {
        return new R2dbcNonTransientResourceException("Cannot exchange because the connection is closed",
            CONNECTION_CLOSED);
    }

    /**
     * Unwraps the errors of Netty decoders and wraps everything that is not an {@link R2dbcException}.
     *
     * @param e the error from the pipeline.
     * @return the error for users.
     */
    static R2dbcException wrap(Throwable e) {
        Throwable cause = e;

        if (cause instanceof DecoderException && cause.getCause() != null) {
            cause = cause.getCause();
        }

        if (cause instanceof R2dbcException) {
            return (R2dbcException) cause;
        }

        return new R2dbcNonTransientResourceException(cause.getMessage() == null ?
            cause.getClass().getName() : cause.getMessage(), COMMUNICATION_FAILURE, 0, cause);
    }

    private ClientExceptions() { }
}
