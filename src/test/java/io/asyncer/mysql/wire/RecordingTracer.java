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

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A {@link Tracer} records events as strings, e.g. {@code start executeQuery SELECT 1}.
 */
final class RecordingTracer implements Tracer {

    private final List<String> events = new CopyOnWriteArrayList<>();

    @Override
    public void onStart(String operation, String sql) {
        events.add("start " + operation + ' ' + sql);
    }

    @Override
    public void onEnd(String operation, String sql, @Nullable Throwable error) {
        events.add(error == null ? "end " + operation : "error " + operation + ' ' + error.getClass().getSimpleName());
    }

    List<String> getEvents() {
        return events;
    }
}
