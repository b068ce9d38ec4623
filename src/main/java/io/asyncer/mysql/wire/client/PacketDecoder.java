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
import io.asyncer.mysql.wire.internal.util.NettyBufferUtils;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static io.asyncer.mysql.wire.constant.Packets.MAX_PAYLOAD_SIZE;
import static io.asyncer.mysql.wire.constant.Packets.NORMAL_HEADER_SIZE;
import static io.asyncer.mysql.wire.constant.Packets.SIZE_FIELD_SIZE;

/**
 * Slices the byte stream into packets, verifies their sequence ids and reassembles the payloads which are
 * split into multiple packets. It emits one {@link ByteBuf} per logical payload.
 */
final class PacketDecoder extends ByteToMessageDecoder {

    static final String NAME = "MySqlPacketDecoder";

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(PacketDecoder.class);

    private final Sequencer sequencer;

    private final boolean debug;

    private final List<ByteBuf> parts = new ArrayList<>();

    PacketDecoder(Sequencer sequencer, boolean debug) {
        this.sequencer = sequencer;
        this.debug = debug;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        while (in.readableBytes() >= NORMAL_HEADER_SIZE) {
            int start = in.readerIndex();
            int size = in.getUnsignedMediumLE(start);

            if (in.readableBytes() < NORMAL_HEADER_SIZE + size) {
                return;
            }

            int sequenceId = in.getUnsignedByte(start + SIZE_FIELD_SIZE);

            if (debug && logger.isDebugEnabled()) {
                logger.debug("Inbound packet: size {}, sequence id {}", size, sequenceId);
            }

            sequencer.verify(sequenceId);
            in.skipBytes(NORMAL_HEADER_SIZE);

            ByteBuf part = in.readRetainedSlice(size);

            if (size == MAX_PAYLOAD_SIZE) {
                // The payload continues in next packet.
                parts.add(part);
            } else if (parts.isEmpty()) {
                out.add(part);
            } else {
                parts.add(part);
                out.add(NettyBufferUtils.composite(parts));
            }
        }
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        super.decodeLast(ctx, in, out);

        if (in.isReadable() || !parts.isEmpty()) {
            int buffered = in.readableBytes();

            for (ByteBuf part : parts) {
                buffered += part.readableBytes();
            }

            throw new ProtocolFramingException("Connection closed with an incomplete packet, " + buffered +
                " bytes buffered");
        }
    }

    @Override
    protected void handlerRemoved0(ChannelHandlerContext ctx) {
        NettyBufferUtils.releaseAll(parts);
        parts.clear();
    }
}
