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

import java.util.Arrays;

/**
 * All column definitions of a result set or a prepared statement, collected by the decoder and emitted as
 * one message.
 */
public final class SyntheticMetadataMessage implements ServerMessage {

    private final boolean completed;

    private final DefinitionMetadataMessage[] messages;

    SyntheticMetadataMessage(boolean completed, DefinitionMetadataMessage[] messages) {
        this.completed = completed;
        this.messages = messages;
    }

    /**
     * Checks if it is the last part of the response, i.e. the metadata of a prepared statement without
     * rows following.
     *
     * @return if nothing follows.
     */
    public boolean isCompleted() {
        return completed;
    }

    public DefinitionMetadataMessage[] unwrap() {
        return messages;
    }

    @Override
    public String toString() {
        return "SyntheticMetadataMessage{completed=" + completed + ", messages=" + Arrays.toString(messages) +
            '}';
    }
}
