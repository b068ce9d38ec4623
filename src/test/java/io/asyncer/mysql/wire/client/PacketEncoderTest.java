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
import io.asyncer.mysql.wire.constant.Packets;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

/**
 * Unit tests for {@link PacketEncoder} and {@link Sequencer}.
 */
class PacketEncoderTest {

    @Test
    void smallPayload() {
        Sequencer sequencer = new Sequencer();
        ByteBuf payload = Unpooled.copiedBuffer("SELECT 1", StandardCharsets.US_ASCII);
        ByteBuf framed = PacketEncoder.frame(ByteBufAllocator.DEFAULT, payload, sequencer);

        try {
            assertThat(payload.refCnt()).isZero();
            assertThat(framed.readUnsignedMediumLE()).isEqualTo(8);
            assertThat(framed.readUnsignedByte()).isEqualTo((short) 0);
            assertThat(framed.toString(StandardCharsets.US_ASCII)).isEqualTo("SELECT 1");
            assertThat(sequencer.next()).isEqualTo(1);
        } finally {
            framed.release();
        }
    }

    @Test
    void emptyPayload() {
        ByteBuf framed = PacketEncoder.frame(ByteBufAllocator.DEFAULT, Unpooled.buffer(), new Sequencer());

        try {
            assertThat(framed.readableBytes()).isEqualTo(Packets.NORMAL_HEADER_SIZE);
            assertThat(framed.getUnsignedMediumLE(0)).isZero();
        } finally {
            framed.release();
        }
    }

    @Test
    void exactMaxPayloadEndsWithEmptyPacket() {
        int size = Packets.MAX_PAYLOAD_SIZE;
        ByteBuf framed = PacketEncoder.frame(ByteBufAllocator.DEFAULT, Unpooled.buffer(size).writeZero(size),
            new Sequencer());

        try {
            assertThat(framed.readableBytes()).isEqualTo(size + 2 * Packets.NORMAL_HEADER_SIZE);
            assertThat(framed.getUnsignedMediumLE(0)).isEqualTo(size);
            assertThat(framed.getUnsignedByte(3)).isEqualTo((short) 0);

            int second = Packets.NORMAL_HEADER_SIZE + size;

            assertThat(framed.getUnsignedMediumLE(second)).isZero();
            assertThat(framed.getUnsignedByte(second + 3)).isEqualTo((short) 1);
        } finally {
            framed.release();
        }
    }

    @Test
    void splitPayload() {
        int size = Packets.MAX_PAYLOAD_SIZE + 10;
        ByteBuf framed = PacketEncoder.frame(ByteBufAllocator.DEFAULT, Unpooled.buffer(size).writeZero(size),
            new Sequencer());

        try {
            int second = Packets.NORMAL_HEADER_SIZE + Packets.MAX_PAYLOAD_SIZE;

            assertThat(framed.readableBytes()).isEqualTo(size + 2 * Packets.NORMAL_HEADER_SIZE);
            assertThat(framed.getUnsignedMediumLE(second)).isEqualTo(10);
            assertThat(framed.getUnsignedByte(second + 3)).isEqualTo((short) 1);
        } finally {
            framed.release();
        }
    }

    @Test
    void sequenceWrapsAndVerifies() {
        Sequencer sequencer = new Sequencer();

        for (int i = 0; i < 256; ++i) {
            sequencer.verify(i);
        }

        assertThat(sequencer.next()).isZero();

        sequencer.reset();

        assertThatExceptionOfType(ProtocolFramingException.class)
            .isThrownBy(() -> sequencer.verify(1))
            .withMessage("Packets out of order, expected sequence id 0 but got 1");
    }
}
