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

package io.asyncer.mysql.wire.constant;

/**
 * Framing constants. Every packet starts with a 3-byte little-endian payload length followed by a 1-byte
 * sequence id.
 */
public final class Packets {

    public static final int SIZE_FIELD_SIZE = 3;

    public static final int NORMAL_HEADER_SIZE = SIZE_FIELD_SIZE + 1;

    /**
     * Largest payload of one packet. A payload of exactly this size is continued by the next packet, so a
     * message whose length is a multiple of it ends with an empty packet.
     */
    public static final int MAX_PAYLOAD_SIZE = 0xFFFFFF;

    /**
     * Terminator of NUL-terminated strings.
     */
    public static final byte TERMINAL = 0;

    private Packets() {
    }
}
