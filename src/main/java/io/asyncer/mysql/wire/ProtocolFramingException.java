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

import io.r2dbc.spi.R2dbcNonTransientResourceException;

/**
 * The packet stream is malformed or out of sequence. The connection can not be resynchronized and has been
 * or will be closed.
 */
public final class ProtocolFramingException extends R2dbcNonTransientResourceException {

    private static final long serialVersionUID = 4820394715672018763L;

    private static final String SQL_STATE = "08S01";

    public ProtocolFramingException(String reason) {
        super(reason, SQL_STATE);
    }

    public ProtocolFramingException(String reason, Throwable cause) {
        super(reason, SQL_STATE, 0, cause);
    }
}
