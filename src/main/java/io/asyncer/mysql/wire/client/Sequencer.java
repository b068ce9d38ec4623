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

import io.asyncer.mysql.wire.ProtocolFramingException;

/**
 * The sequence id of packets of one exchange, shared by the reading and writing side of a connection. It
 * is only accessed by the event loop of the channel.
 */
final class Sequencer {

    private int next;

    /**
     * Restarts the sequence, a command is the first packet of a new exchange.
     */
    void reset() {
        next = 0;
    }

    /**
     * Takes the sequence id for an outbound packet.
     *
     * @return the sequence id.
     */
    int next() {
        int id = next;

        next = (id + 1) & 0xFF;

        return id;
    }

    /**
     * Verifies the sequence id of an inbound packet and moves forward.
     *
     * @param actual the sequence id in the packet header.
     * @throws ProtocolFramingException if it is not the expected one.
     */
    void verify(int actual) {
        if (actual != next) {
            throw new ProtocolFramingException("Packets out of order, expected sequence id " + next +
                " but got " + actual);
        }

        next = (actual + 1) & 0xFF;
    }

    @Override
    public String toString() {
        return "Sequencer{next=" + next + '}';
    }
}
