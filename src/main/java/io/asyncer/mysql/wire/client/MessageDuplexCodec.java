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

import io.asyncer.mysql.wire.ConnectionContext;
import io.asyncer.mysql.wire.message.client.ClientMessage;
import io.asyncer.mysql.wire.message.client.PrepareQueryMessage;
import io.asyncer.mysql.wire.message.client.SslRequest;
import io.asyncer.mysql.wire.message.server.ColumnCountMessage;
import io.asyncer.mysql.wire.message.server.CompleteMessage;
import io.asyncer.mysql.wire.message.server.DecodeContext;
import io.asyncer.mysql.wire.message.server.ErrorMessage;
import io.asyncer.mysql.wire.message.server.PreparedOkMessage;
import io.asyncer.mysql.wire.message.server.ServerMessage;
import io.asyncer.mysql.wire.message.server.ServerMessageDecoder;
import io.asyncer.mysql.wire.message.server.ServerStatusMessage;
import io.asyncer.mysql.wire.message.server.SyntheticMetadataMessage;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelDuplexHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * A codec that encodes and decodes MySQL messages.
 * <ul>
 * <li>Read: payload {@link ByteBuf} -&gt; {@link ServerMessage}</li>
 * <li>Write: {@link ClientMessage} -&gt; framed {@link ByteBuf} with flush</li>
 * </ul>
 * The payloads are reassembled by {@link PacketDecoder}, they share the same {@link Sequencer}.
 */
final class MessageDuplexCodec extends ChannelDuplexHandler {

    static final String NAME = "MySqlMessageDuplexCodec";

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(MessageDuplexCodec.class);

    private DecodeContext decodeContext = DecodeContext.login();

    private final ConnectionContext context;

    private final Sequencer sequencer;

    private final ServerMessageDecoder decoder = new ServerMessageDecoder();

    MessageDuplexCodec(ConnectionContext context, Sequencer sequencer) {
        this.context = requireNonNull(context, "context must not be null");
        this.sequencer = requireNonNull(sequencer, "sequencer must not be null");
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof ByteBuf) {
            ServerMessage message = decoder.decode((ByteBuf) msg, context, decodeContext);

            if (message != null) {
                handleDecoded(ctx, message);
            }
        } else {
            // e.g. the synthetic message of TLS bridge.
            ctx.fireChannelRead(msg);
        }
    }

    @Override
    public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
        if (!(msg instanceof ClientMessage)) {
            if (logger.isWarnEnabled()) {
                logger.warn("Unknown message type {} on writing", msg.getClass());
            }
            ReferenceCountUtil.release(msg);
            promise.setFailure(new IllegalArgumentException("Unknown message type " + msg.getClass()));
            return;
        }

        ClientMessage message = (ClientMessage) msg;

        if (message.isSequenceReset()) {
            sequencer.reset();
            setDecodeContext(message instanceof PrepareQueryMessage ? DecodeContext.prepareQuery() :
                DecodeContext.command());
        }

        if (context.isDebug() && logger.isDebugEnabled()) {
            logger.debug("Outbound message: {}", message);
        }

        message.encode(ctx.alloc(), context).subscribe(
            payload -> ctx.writeAndFlush(PacketEncoder.frame(ctx.alloc(), payload, sequencer), promise),
            promise::setFailure);

        if (message instanceof SslRequest) {
            ctx.channel().pipeline().fireUserEventTriggered(SslState.BRIDGING);
        }
    }

    private void handleDecoded(ChannelHandlerContext ctx, ServerMessage msg) {
        if (msg instanceof ServerStatusMessage) {
            this.context.setServerStatuses(((ServerStatusMessage) msg).getServerStatuses());
        }

        if (msg instanceof CompleteMessage) {
            // Also for more results, each of them starts with a column count or an OK.
            setDecodeContext(DecodeContext.command());
        } else if (msg instanceof SyntheticMetadataMessage) {
            if (((SyntheticMetadataMessage) msg).isCompleted()) {
                setDecodeContext(DecodeContext.command());
            }
        } else if (msg instanceof ColumnCountMessage) {
            setDecodeContext(DecodeContext.result(this.context.getCapability().isEofDeprecated(),
                ((ColumnCountMessage) msg).getTotalColumns()));
            return;
        } else if (msg instanceof PreparedOkMessage) {
            PreparedOkMessage message = (PreparedOkMessage) msg;
            int columns = message.getTotalColumns();
            int parameters = message.getTotalParameters();

            // All is 0 means no definition and no EOF message following.
            if (columns > 0 || parameters > 0) {
                setDecodeContext(DecodeContext.preparedMetadata(this.context.getCapability()
                    .isEofDeprecated(), columns, parameters));
            } else {
                setDecodeContext(DecodeContext.command());
            }
        } else if (msg instanceof ErrorMessage) {
            setDecodeContext(DecodeContext.command());
        }

        if (context.isDebug() && logger.isDebugEnabled()) {
            logger.debug("Inbound message: {}", msg);
        }

        ctx.fireChannelRead(msg);
    }

    private void setDecodeContext(DecodeContext context) {
        this.decodeContext = context;

        if (logger.isTraceEnabled()) {
            logger.trace("Decode context change to {}", context);
        }
    }
}
