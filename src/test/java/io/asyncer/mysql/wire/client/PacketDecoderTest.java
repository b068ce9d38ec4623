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
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PacketDecoder}.
 */
class PacketDecoderTest {

    @Test
    void singlePackets() {
        EmbeddedChannel channel = new EmbeddedChannel(new PacketDecoder(new Sequencer(), false));

        assertThat(channel.writeInbound(Unpooled.wrappedBuffer(packet(0, "hello"), packet(1, "world")))).isTrue();

        assertPayload(channel.readInbound(), "hello");
        assertPayload(channel.readInbound(), "world");
        assertThat(channel.finish()).isFalse();
    }

    @Test
    void fragmentedStream() {
        EmbeddedChannel channel = new EmbeddedChannel(new PacketDecoder(new Sequencer(), false));
        ByteBuf whole = packet(0, "fragmented");

        try {
            for (int i = 0; i < whole.readableBytes(); ++i) {
                channel.writeInbound(whole.retainedSlice(i, 1));
            }
        } finally {
            whole.release();
        }

        assertPayload(channel.readInbound(), "fragmented");
        assertThat(channel.finish()).isFalse();
    }

    @Test
    void reassembleLargePayload() {
        EmbeddedChannel channel = new EmbeddedChannel(new PacketDecoder(new Sequencer(), false));
        int size = Packets.MAX_PAYLOAD_SIZE;
        ByteBuf first = Unpooled.buffer(Packets.NORMAL_HEADER_SIZE + size)
            .writeMediumLE(size)
            .writeByte(0)
            .writeZero(size);

        channel.writeInbound(first);

        assertThat((Object) channel.readInbound()).isNull();

        channel.writeInbound(packet(1, "tail"));

        ByteBuf payload = channel.readInbound();

        try {
            assertThat(payload.readableBytes()).isEqualTo(size + 4);
            assertThat(payload.toString(size, 4, StandardCharsets.US_ASCII)).isEqualTo("tail");
        } finally {
            payload.release();
        }

        assertThat(channel.finish()).isFalse();
    }

    @Test
    void terminatorPacket() {
        EmbeddedChannel channel = new EmbeddedChannel(new PacketDecoder(new Sequencer(), false));
        int size = Packets.MAX_PAYLOAD_SIZE;

        channel.writeInbound(Unpooled.buffer(Packets.NORMAL_HEADER_SIZE + size)
            .writeMediumLE(size)
            .writeByte(0)
            .writeZero(size));
        channel.writeInbound(Unpooled.buffer().writeMediumLE(0).writeByte(1));

        ByteBuf payload = channel.readInbound();

        try {
            assertThat(payload.readableBytes()).isEqualTo(size);
        } finally {
            payload.release();
        }

        assertThat(channel.finish()).isFalse();
    }

    @Test
    void sequenceMismatch() {
        EmbeddedChannel channel = new EmbeddedChannel(new PacketDecoder(new Sequencer(), false));

        assertThatThrownBy(() -> channel.writeInbound(packet(3, "oops")))
            .hasRootCauseInstanceOf(ProtocolFramingException.class)
            .hasStackTraceContaining("expected sequence id 0 but got 3");

        channel.close();
    }

    @Test
    void truncatedStream() {
        EmbeddedChannel channel = new EmbeddedChannel(new PacketDecoder(new Sequencer(), false));
        ByteBuf whole = packet(0, "truncated");

        channel.writeInbound(whole.readRetainedSlice(6));
        whole.release();

        assertThat((Object) channel.readInbound()).isNull();
        assertThatThrownBy(channel::finish)
            .hasRootCauseInstanceOf(ProtocolFramingException.class)
            .hasStackTraceContaining("incomplete packet");
    }

    private static ByteBuf packet(int sequenceId, String payload) {
        byte[] bytes = payload.getBytes(StandardCharsets.US_ASCII);

        return Unpooled.buffer(Packets.NORMAL_HEADER_SIZE + bytes.length)
            .writeMediumLE(bytes.length)
            .writeByte(sequenceId)
            .writeBytes(bytes);
    }

    private static void assertPayload(ByteBuf payload, String expected) {
        try {
            assertThat(payload.toString(StandardCharsets.US_ASCII)).isEqualTo(expected);
        } finally {
            payload.release();
        }
    }
}
