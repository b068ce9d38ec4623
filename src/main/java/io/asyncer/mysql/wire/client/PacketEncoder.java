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

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.CompositeByteBuf;

import static io.asyncer.mysql.wire.constant.Packets.MAX_PAYLOAD_SIZE;
import static io.asyncer.mysql.wire.constant.Packets.NORMAL_HEADER_SIZE;

/**
 * Splits a payload into packets. Each packet is a 3-bytes little-endian payload length, a sequence id and
 * at most {@code 0xFFFFFF} bytes of the payload. A payload of an exact multiple of the maximum size ends with
 * an empty packet.
 */
final class PacketEncoder {

    /**
     * Frames a payload.
     *
     * @param allocator the allocator for headers.
     * @param payload   the payload, it will be released.
     * @param sequencer the sequence of current exchange.
     * @return the framed packets.
     */
    static ByteBuf frame(ByteBufAllocator allocator, ByteBuf payload, Sequencer sequencer) {
        CompositeByteBuf packets = allocator.compositeBuffer();

        try {
            while (true) {
                int size = Math.min(payload.readableBytes(), MAX_PAYLOAD_SIZE);
                ByteBuf header = allocator.buffer(NORMAL_HEADER_SIZE, NORMAL_HEADER_SIZE)
                    .writeMediumLE(size)
                    .writeByte(sequencer.next());

                packets.addComponent(true, header);

                if (size > 0) {
                    packets.addComponent(true, payload.readRetainedSlice(size));
                }

                if (size < MAX_PAYLOAD_SIZE) {
                    return packets;
                }
            }
        } catch (Throwable e) {
            packets.release();
            throw e;
        } finally {
            payload.release();
        }
    }

    private PacketEncoder() { }
}
