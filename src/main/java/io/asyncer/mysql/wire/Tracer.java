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

import org.jetbrains.annotations.Nullable;

/**
 * A hook around the executions of statements, e.g. for metrics or tracing spans. Implementations are
 * invoked on the threads of the transport, and should not block.
 */
public interface Tracer {

    /**
     * The tracer does nothing, it is the default of {@link ConnectionProvider}.
     */
    Tracer NOOP = new Tracer() {

        @Override
        public void onStart(String operation, String sql) {
            // Nothing to trace.
        }

        @Override
        public void onEnd(String operation, String sql, @Nullable Throwable error) {
            // Nothing to trace.
        }

        @Override
        public String toString() {
            return "Tracer.NOOP";
        }
    };

    /**
     * Invoked before a statement is sent to the server.
     *
     * @param operation the operation name, e.g. {@code executeQuery}.
     * @param sql       the SQL statement.
     */
    void onStart(String operation, String sql);

    /**
     * Invoked after the server responds to a statement, or the execution fails.
     *
     * @param operation the operation name.
     * @param sql       the SQL statement.
     * @param error     the error, or {@code null} if the execution succeeds.
     */
    void onEnd(String operation, String sql, @Nullable Throwable error);
}
