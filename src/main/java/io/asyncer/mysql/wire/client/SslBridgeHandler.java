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
import io.asyncer.mysql.wire.SslConfiguration;
import io.asyncer.mysql.wire.SslNegotiationException;
import io.asyncer.mysql.wire.message.server.SyntheticSslResponseMessage;
import io.netty.channel.ChannelDuplexHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.ssl.SslHandshakeCompletionEvent;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SNIServerName;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * A handler for build SSL handler and bridging. The MySQL protocol starts TLS in the middle of the
 * handshake, so the {@link SslHandler} is added after the SSL request has been written.
 */
final class SslBridgeHandler extends ChannelDuplexHandler {

    static final String NAME = "MySqlSslBridgeHandler";

    private static final String SSL_NAME = "MySqlSslHandler";

    private static final String ENDPOINT_IDENTIFICATION = "HTTPS";

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(SslBridgeHandler.class);

    private final ConnectionContext context;

    private final SslConfiguration ssl;

    SslBridgeHandler(ConnectionContext context, SslConfiguration ssl) {
        this.context = requireNonNull(context, "context must not be null");
        this.ssl = requireNonNull(ssl, "ssl must not be null");
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof SslState) {
            handleSslState(ctx, (SslState) evt);
            // Ignore event trigger for next handler, because it used only by this handler.
            return;
        } else if (evt instanceof SslHandshakeCompletionEvent) {
            handleSslCompleted(ctx, (SslHandshakeCompletionEvent) evt);
        }

        super.userEventTriggered(ctx, evt);
    }

    private void handleSslCompleted(ChannelHandlerContext ctx, SslHandshakeCompletionEvent evt) {
        if (!evt.isSuccess()) {
            ctx.fireExceptionCaught(new SslNegotiationException("TLS handshake failed with connection " +
                context.getConnectionId(), evt.cause()));
            return;
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Connection (id {}) TLS handshake completed", context.getConnectionId());
        }

        ctx.fireChannelRead(SyntheticSslResponseMessage.instance());
        ctx.pipeline().remove(NAME);
    }

    private void handleSslState(ChannelHandlerContext ctx, SslState state) {
        switch (state) {
            case BRIDGING:
                logger.debug("SSL request sent, bridging to TLS");

                try {
                    SslContext sslContext = ssl.newContext();
                    SslHandler handler = newHandler(ctx, sslContext);

                    ctx.pipeline().addBefore(NAME, SSL_NAME, handler);
                } catch (SslNegotiationException e) {
                    ctx.fireExceptionCaught(e);
                }
                break;
            case UNSUPPORTED:
                logger.debug("Server does not support SSL, continue in plaintext");
                ctx.pipeline().remove(NAME);
                break;
        }
    }

    private SslHandler newHandler(ChannelHandlerContext ctx, SslContext sslContext) {
        SocketAddress remote = ctx.channel().remoteAddress();
        SslHandler handler;

        if (remote instanceof InetSocketAddress) {
            InetSocketAddress address = (InetSocketAddress) remote;
            handler = sslContext.newHandler(ctx.alloc(), address.getHostString(), address.getPort());
        } else {
            handler = sslContext.newHandler(ctx.alloc());
        }

        SSLEngine engine = handler.engine();
        SSLParameters parameters = engine.getSSLParameters();
        List<String> serverNames = ssl.getTlsParameters().getServerNames();

        if (!serverNames.isEmpty()) {
            List<SNIServerName> names = new ArrayList<>(serverNames.size());

            for (String name : serverNames) {
                names.add(new SNIHostName(name));
            }

            parameters.setServerNames(names);
        }

        if (ssl.getSslMode().verifyIdentity()) {
            parameters.setEndpointIdentificationAlgorithm(ENDPOINT_IDENTIFICATION);
        }

        engine.setSSLParameters(parameters);

        return handler;
    }
}
