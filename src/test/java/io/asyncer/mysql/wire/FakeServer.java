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

import io.asyncer.mysql.wire.constant.ServerStatuses;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.util.ReferenceCountUtil;
import org.jetbrains.annotations.Nullable;
import reactor.netty.DisposableServer;
import reactor.netty.tcp.TcpServer;

import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * A scripted server which speaks the packet framing of MySQL on a local port. Each accepted connection gets a
 * new {@link Script}, and the packets it receives are recorded.
 */
final class FakeServer implements AutoCloseable {

    static final String USER = "tester";

    static final String PASSWORD = "secret";

    private static final int MAX_FRAME = 0xFFFFFF + 4;

    private static final byte COM_QUIT = 0x01;

    private final AtomicInteger connectionIds = new AtomicInteger(100);

    private final List<Session> sessions = new CopyOnWriteArrayList<>();

    private final DisposableServer server;

    private FakeServer(Supplier<? extends Script> scripts) {
        this.server = TcpServer.create()
            .host("127.0.0.1")
            .port(0)
            .doOnConnection(connection -> {
                Session session = new Session(connection.channel(), connectionIds.incrementAndGet());

                sessions.add(session);
                connection.addHandlerLast("frame", new LengthFieldBasedFrameDecoder(ByteOrder.LITTLE_ENDIAN,
                        MAX_FRAME, 0, 3, 1, 0, true))
                    .addHandlerLast("script", new ScriptHandler(session, scripts.get()));
            })
            // Subscribing the inbound turns auto-read on, frames are consumed by the script handler.
            .handle((in, out) -> in.receive().then().and(out.neverComplete()))
            .bindNow();
    }

    static FakeServer start(Supplier<? extends Script> scripts) {
        return new FakeServer(scripts);
    }

    ConnectionProvider provider() {
        return ConnectionProvider.defaults()
            .setPort(server.port())
            .setUser(USER)
            .setPassword(PASSWORD);
    }

    Session session(int index) {
        return sessions.get(index);
    }

    int sessionCount() {
        return sessions.size();
    }

    /**
     * Gets the text of all {@code COM_QUERY} commands received by all connections.
     *
     * @return the SQL statements, in the order of receipt.
     */
    List<String> queries() {
        List<String> result = new ArrayList<>();

        for (Session session : sessions) {
            for (byte[] command : session.commands) {
                if (command.length > 0 && command[0] == 0x03) {
                    result.add(new String(command, 1, command.length - 1, StandardCharsets.UTF_8));
                }
            }
        }

        return result;
    }

    boolean awaitAllClosed(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();

        for (Session session : sessions) {
            long remaining = deadline - System.nanoTime();

            if (remaining <= 0 || !session.channel.closeFuture().await(remaining, TimeUnit.NANOSECONDS)) {
                return false;
            }
        }

        return true;
    }

    @Override
    public void close() {
        server.disposeNow();
    }

    /**
     * The behavior of a server connection. The default behavior accepts any login with
     * {@code mysql_native_password} and responds an OK to every command.
     */
    static class Script {

        void onConnect(Session session) {
            session.reply(ServerPayloads.handshake(session.getConnectionId(), "8.0.36",
                ServerPayloads.SERVER_CAPABILITIES, "mysql_native_password"));
        }

        void onLogin(Session session, ByteBuf payload) {
            session.authenticated();
            session.reply(ServerPayloads.ok(0, 0, ServerStatuses.AUTO_COMMIT));
        }

        void onCommand(Session session, ByteBuf payload) {
            session.reply(ServerPayloads.ok(0, 0, ServerStatuses.AUTO_COMMIT));
        }
    }

    /**
     * A server side connection, it numbers outbound packets after the sequence id of the last inbound packet.
     */
    static final class Session {

        private final Channel channel;

        private final int connectionId;

        private final List<byte[]> logins = new CopyOnWriteArrayList<>();

        private final List<byte[]> commands = new CopyOnWriteArrayList<>();

        private int sequenceId;

        private volatile boolean authenticated;

        private Session(Channel channel, int connectionId) {
            this.channel = channel;
            this.connectionId = connectionId;
        }

        int getConnectionId() {
            return connectionId;
        }

        List<byte[]> getLogins() {
            return logins;
        }

        List<byte[]> getCommands() {
            return commands;
        }

        boolean isClosed() {
            return !channel.isOpen();
        }

        void authenticated() {
            this.authenticated = true;
        }

        void reply(ByteBuf... payloads) {
            for (ByteBuf payload : payloads) {
                ByteBuf header = channel.alloc().buffer(4)
                    .writeMediumLE(payload.readableBytes())
                    .writeByte(sequenceId++);

                channel.write(header);
                channel.write(payload);
            }

            channel.flush();
        }

        /**
         * Numbers the next outbound packet with {@code sequenceId} instead of continuing the sequence.
         *
         * @param sequenceId the sequence id of the next packet.
         */
        void resequence(int sequenceId) {
            this.sequenceId = sequenceId;
        }

        void close() {
            channel.close();
        }
    }

    /**
     * Gets the SQL of a {@code COM_QUERY} payload.
     *
     * @param payload the command payload.
     * @return the SQL, or {@code null} if it is not a text query.
     */
    @Nullable
    static String query(ByteBuf payload) {
        if (payload.getByte(payload.readerIndex()) != 0x03) {
            return null;
        }

        return payload.toString(payload.readerIndex() + 1, payload.readableBytes() - 1, StandardCharsets.UTF_8);
    }

    static int command(ByteBuf payload) {
        return payload.getUnsignedByte(payload.readerIndex());
    }

    private static final class ScriptHandler extends ChannelInboundHandlerAdapter {

        private final Session session;

        private final Script script;

        ScriptHandler(Session session, Script script) {
            this.session = session;
            this.script = script;
        }

        @Override
        public void handlerAdded(ChannelHandlerContext ctx) {
            if (ctx.channel().isActive()) {
                script.onConnect(session);
            }
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            if (!(msg instanceof ByteBuf)) {
                ctx.fireChannelRead(msg);
                return;
            }

            ByteBuf frame = (ByteBuf) msg;

            try {
                frame.skipBytes(3);
                session.sequenceId = frame.readUnsignedByte() + 1;

                byte[] payload = ByteBufUtil.getBytes(frame);

                if (!session.authenticated) {
                    session.logins.add(payload);
                    script.onLogin(session, frame);
                } else if (payload.length > 0 && payload[0] == COM_QUIT) {
                    ctx.close();
                } else {
                    session.commands.add(payload);
                    script.onCommand(session, frame);
                }
            } finally {
                ReferenceCountUtil.release(frame);
            }
        }
    }
}
