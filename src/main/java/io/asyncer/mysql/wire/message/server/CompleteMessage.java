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

package io.asyncer.mysql.wire.message.server;

import io.asyncer.mysql.wire.constant.ServerStatuses;

/**
 * A message which terminates a result, i.e. OK or EOF.
 */
public interface CompleteMessage extends ServerStatusMessage {

    /**
     * Checks if no more result follows, e.g. the last result of a stored procedure call.
     *
     * @return if the whole response is done.
     */
    default boolean isDone() {
        return (getServerStatuses() & ServerStatuses.MORE_RESULTS_EXISTS) == 0;
    }
}
