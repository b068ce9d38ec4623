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

import io.asyncer.mysql.wire.authentication.MySqlAuthProvider;
import io.asyncer.mysql.wire.authentication.RsaPasswordEncryptor;
import io.asyncer.mysql.wire.client.Client;
import io.asyncer.mysql.wire.client.FluxExchangeable;
import io.asyncer.mysql.wire.message.client.AuthResponse;
import io.asyncer.mysql.wire.message.client.ClientMessage;
import io.asyncer.mysql.wire.message.client.HandshakeResponse41;
import io.asyncer.mysql.wire.message.client.SslRequest;
import io.asyncer.mysql.wire.message.client.SubsequenceClientMessage;
import io.asyncer.mysql.wire.message.server.AuthMoreDataMessage;
import io.asyncer.mysql.wire.message.server.ChangeAuthMessage;
import io.asyncer.mysql.wire.message.server.ErrorMessage;
import io.asyncer.mysql.wire.message.server.HandshakeRequest;
import io.asyncer.mysql.wire.message.server.OkMessage;
import io.asyncer.mysql.wire.message.server.ServerMessage;
import io.asyncer.mysql.wire.message.server.SyntheticSslResponseMessage;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;
import org.jetbrains.annotations.Nullable;
import reactor.core.CoreSubscriber;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.publisher.SynchronousSink;
import reactor.util.concurrent.Queues;

/**
 * A message flow utility processes the connection phase: the initial handshake, the optional TLS upgrade
 * and the authentication.
 */
final class InitFlow {

    /**
     * Initializes handshake and login a {@link Client}. The client will be force closed if the login fails.
     *
     * @param client                   the {@link Client} to exchange messages with.
     * @param ssl                      the SSL configuration.
     * @param database                 the database of login, or {@code null} if not set.
     * @param user                     the user that will be login.
     * @param password                 the password of the {@code user}, or {@code null} if not set.
     * @param allowPublicKeyRetrieval  if the RSA public key can be requested from the server.
     * @return a {@link Mono} that indicates the initialization is done, or an error if the login failed.
     */
    static Mono<Void> login(Client client, SslConfiguration ssl, @Nullable String database, String user,
        @Nullable CharSequence password, boolean allowPublicKeyRetrieval) {
        return client.exchange(new LoginExchangeable(client, ssl, database, user, password,
                allowPublicKeyRetrieval))
            .then()
            .onErrorResume(e -> client.forceClose().then(Mono.error(e)));
    }

    private InitFlow() { }
}

/**
 * An exchangeable drives {@link LoginState}s by the server messages of the connection phase.
 */
final class LoginExchangeable extends FluxExchangeable<Void> {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(LoginExchangeable.class);

    private static final int MAX_AUTH_SWITCHES = 2;

    private final Sinks.Many<SubsequenceClientMessage> requests = Sinks.many().unicast()
        .onBackpressureBuffer(Queues.<SubsequenceClientMessage>one().get());

    private final Client client;

    private final SslConfiguration ssl;

    @Nullable
    private final String database;

    private final String user;

    @Nullable
    private final CharSequence password;

    private final boolean allowPublicKeyRetrieval;

    private LoginState state = LoginState.AWAIT_INITIAL_HANDSHAKE;

    private MySqlAuthProvider authProvider;

    private byte[] salt;

    private boolean sslCompleted;

    private int authSwitches;

    LoginExchangeable(Client client, SslConfiguration ssl, @Nullable String database, String user,
        @Nullable CharSequence password, boolean allowPublicKeyRetrieval) {
        this.client = client;
        this.ssl = ssl;
        this.database = database;
        this.user = user;
        this.password = password;
        this.allowPublicKeyRetrieval = allowPublicKeyRetrieval;
    }

    @Override
    public void subscribe(CoreSubscriber<? super ClientMessage> actual) {
        requests.asFlux().subscribe(actual);
    }

    @Override
    public void accept(ServerMessage message, SynchronousSink<Void> sink) {
        try {
            handle(message, sink);
        } catch (RuntimeException e) {
            transition(LoginState.AUTH_FAILED);
            sink.error(e);
        }
    }

    @Override
    public void dispose() {
        // No particular error condition handling for complete signal.
        this.requests.tryEmitComplete();
    }

    private void handle(ServerMessage message, SynchronousSink<Void> sink) {
        if (message instanceof ErrorMessage) {
            ErrorMessage error = (ErrorMessage) message;
            boolean handshaking = state == LoginState.AWAIT_INITIAL_HANDSHAKE;

            transition(LoginState.AUTH_FAILED);
            // e.g. too many connections before the handshake.
            sink.error(handshaking ? error.toException() :
                AuthenticationException.rejected(error.getCode(), error.getSqlState(), error.getMessage()));
            return;
        }

        switch (state) {
            case AWAIT_INITIAL_HANDSHAKE:
                if (message instanceof HandshakeRequest) {
                    onHandshake((HandshakeRequest) message, sink);
                    return;
                }
                break;
            case TLS_UPGRADING:
                if (message instanceof SyntheticSslResponseMessage) {
                    sslCompleted = true;
                    logger.debug("Connection {} TLS upgraded", client.getContext().getConnectionId());
                    sendHandshakeResponse(client.getContext().getCapability(), sink);
                    return;
                }
                break;
            case AUTH_CHALLENGE_SENT:
            case PUBLIC_KEY_REQUESTED:
                if (message instanceof OkMessage) {
                    transition(LoginState.AUTHENTICATED);
                    client.loginSuccess();
                    sink.complete();
                    return;
                } else if (message instanceof AuthMoreDataMessage) {
                    onMoreData((AuthMoreDataMessage) message, sink);
                    return;
                } else if (message instanceof ChangeAuthMessage) {
                    onChangeAuth((ChangeAuthMessage) message, sink);
                    return;
                }
                break;
            default:
                break;
        }

        throw new ProtocolFramingException("Unexpected message " + message.getClass().getSimpleName() +
            " in login state " + state);
    }

    private void onHandshake(HandshakeRequest request, SynchronousSink<Void> sink) {
        Capability capability = negotiate(request.getServerCapability());

        client.getContext().initHandshake(request.getConnectionId(), request.getServerVersion(), capability);
        this.authProvider = MySqlAuthProvider.build(request.getAuthType(), capability.isPluginAuthAllowed());
        this.salt = request.getSalt();

        if (logger.isDebugEnabled()) {
            logger.debug("Connection {} handshake with server {}, auth plugin '{}'", request.getConnectionId(),
                request.getServerVersion(), authProvider.getType());
        }

        if (capability.isSslEnabled()) {
            emitNext(new SslRequest(capability, client.getContext().getClientCollationId()), sink);
            transition(LoginState.CAPABILITIES_SENT);
            transition(LoginState.TLS_UPGRADING);
        } else {
            sendHandshakeResponse(capability, sink);
        }
    }

    private Capability negotiate(Capability server) {
        boolean sslRequested = ssl.getSslMode().startSsl();
        Capability capability = Capability.clientDesired(database != null, sslRequested).intersect(server);

        if (!capability.isProtocol41()) {
            throw new CapabilityMismatchException("Server does not support protocol 4.1");
        }

        if (sslRequested && !capability.isSslEnabled()) {
            if (!ssl.isFallback()) {
                throw new CapabilityMismatchException("Server does not support SSL but SSL mode " +
                    ssl.getSslMode() + " is requested");
            }

            logger.warn("Server does not support SSL, connection continues in plaintext by fallback");
            client.sslUnsupported();
        }

        return capability;
    }

    private void sendHandshakeResponse(Capability capability, SynchronousSink<Void> sink) {
        MySqlAuthProvider provider = this.authProvider;
        byte[] authentication = authenticate(provider);
        String authType = provider.getType();

        if (MySqlAuthProvider.NO_AUTH_PROVIDER.equals(authType)) {
            // Server will send a change authentication message if it requires a plugin.
            authType = MySqlAuthProvider.CACHING_SHA2_PASSWORD;
        }

        emitNext(new HandshakeResponse41(capability, client.getContext().getClientCollationId(), user,
            authentication, authType, database), sink);
    }

    private void onMoreData(AuthMoreDataMessage message, SynchronousSink<Void> sink) {
        if (state == LoginState.PUBLIC_KEY_REQUESTED) {
            logger.debug("Connection {} received RSA public key", client.getContext().getConnectionId());

            byte[] encrypted = RsaPasswordEncryptor.encrypt(password, salt, message.getData(),
                client.getContext().getServerVersion());

            transition(LoginState.AUTH_CHALLENGE_SENT);
            emitNext(new AuthResponse(encrypted), sink);
        } else if (message.isFastAuthSuccess()) {
            logger.debug("Connection {} fast authentication succeed", client.getContext().getConnectionId());
        } else if (message.isFullAuthRequired()) {
            logger.debug("Connection {} fast authentication failed, use full authentication",
                client.getContext().getConnectionId());

            this.authProvider = authProvider.next();
            emitNext(new AuthResponse(authenticate(authProvider)), sink);
        } else {
            throw new ProtocolFramingException("Unknown authentication data in login state " + state);
        }
    }

    private void onChangeAuth(ChangeAuthMessage message, SynchronousSink<Void> sink) {
        if (++authSwitches > MAX_AUTH_SWITCHES) {
            throw AuthenticationException.local("Server switched authentication plugin more than " +
                MAX_AUTH_SWITCHES + " times");
        }

        transition(LoginState.AUTH_SWITCHING);

        if (logger.isDebugEnabled()) {
            logger.debug("Connection {} switches authentication plugin from '{}' to '{}'",
                client.getContext().getConnectionId(), authProvider.getType(), message.getAuthType());
        }

        this.authProvider = MySqlAuthProvider.build(message.getAuthType(), true);
        this.salt = message.getSalt();

        emitNext(new AuthResponse(authenticate(authProvider)), sink);
    }

    /**
     * Generates the authentication data and moves to the next state. A plugin which sends the password needs
     * TLS, or the RSA public key of the server.
     *
     * @param provider the authentication plugin.
     * @return the authentication data, or the request of the RSA public key.
     */
    private byte[] authenticate(MySqlAuthProvider provider) {
        if (!provider.isSslNecessary() || sslCompleted || MySqlAuthProvider.isEmpty(password)) {
            transition(LoginState.AUTH_CHALLENGE_SENT);
            return provider.authentication(password, salt);
        }

        byte request = provider.getPublicKeyRequest();

        if (request == 0) {
            throw AuthenticationException.local("Authentication plugin '" + provider.getType() +
                "' requires SSL");
        }

        if (!allowPublicKeyRetrieval) {
            throw AuthenticationException.policy("Public Key Retrieval is not allowed");
        }

        transition(LoginState.PUBLIC_KEY_REQUESTED);

        return new byte[] { request };
    }

    private void emitNext(SubsequenceClientMessage message, SynchronousSink<Void> sink) {
        Sinks.EmitResult result = requests.tryEmitNext(message);

        if (result != Sinks.EmitResult.OK) {
            sink.error(new IllegalStateException("Fail to emit a login request due to " + result));
        }
    }

    private void transition(LoginState next) {
        if (logger.isDebugEnabled() && state != next) {
            logger.debug("Connection {} login state {} -> {}", client.getContext().getConnectionId(), state,
                next);
        }

        this.state = next;
    }
}
