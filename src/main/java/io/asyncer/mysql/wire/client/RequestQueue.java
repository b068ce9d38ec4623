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

import io.r2dbc.spi.R2dbcException;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;

/**
 * A queue of exchanges, at most one of them is active at any time. The active exchange runs the next one by
 * {@link #run()} when it terminates.
 */
final class RequestQueue implements Runnable {

    private final Queue<RequestTask> tasks = new ArrayDeque<>();

    private boolean active;

    @Nullable
    private R2dbcException disposed;

    /**
     * Submits a task, it will be run immediately if no exchange is active.
     *
     * @param task the task.
     */
    void submit(RequestTask task) {
        synchronized (this) {
            if (disposed != null) {
                task.cancel(disposed);
                return;
            }

            if (active) {
                tasks.offer(task);
                return;
            }

            active = true;
        }

        task.run();
    }

    /**
     * Completes the active exchange and runs the next one.
     */
    @Override
    public void run() {
        RequestTask task;

        synchronized (this) {
            do {
                task = tasks.poll();
            } while (task != null && task.isCancelled());

            if (task == null) {
                active = false;
                return;
            }
        }

        task.run();
    }

    /**
     * Disposes this queue, all pending tasks and the later submitted ones are cancelled by the error.
     *
     * @param e the error.
     */
    void dispose(R2dbcException e) {
        List<RequestTask> pending;

        synchronized (this) {
            if (disposed != null) {
                return;
            }

            disposed = e;
            pending = new ArrayList<>(tasks);
            tasks.clear();
        }

        for (RequestTask task : pending) {
            task.cancel(e);
        }
    }

    @Override
    public synchronized String toString() {
        return "RequestQueue{active=" + active + ", pending=" + tasks.size() + ", disposed=" +
            (disposed != null) + '}';
    }
}
