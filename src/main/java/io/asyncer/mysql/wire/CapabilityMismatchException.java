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
 * The client requires a protocol feature which the server does not advertise, e.g. SSL. The handshake is
 * aborted and is not retried.
 */
public final class CapabilityMismatchException extends R2dbcNonTransientResourceException {

    private static final long serialVersionUID = -3151072993853170641L;

    public CapabilityMismatchException(String reason) {
        super(reason, "08004");
    }
}
