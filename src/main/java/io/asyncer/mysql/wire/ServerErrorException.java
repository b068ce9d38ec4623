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

import io.r2dbc.spi.R2dbcNonTransientException;
import org.jetbrains.annotations.Nullable;

/**
 * An error reported by the server which has no more specific category. The connection is still usable.
 */
public final class ServerErrorException extends R2dbcNonTransientException {

    private static final long serialVersionUID = -1739124602447861047L;

    public ServerErrorException(String reason, @Nullable String sqlState, int errorCode) {
        super(reason, sqlState, errorCode);
    }
}
