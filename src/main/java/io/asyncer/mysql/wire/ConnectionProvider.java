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

import io.asyncer.mysql.wire.api.MySqlConnection;
import io.asyncer.mysql.wire.client.Client;
import io.asyncer.mysql.wire.codec.Codecs;
import io.asyncer.mysql.wire.constant.DatabaseTerm;
import io.netty.channel.ChannelOption;
import io.netty.util.internal.logging.InternalLogger;
import io.netty.util.internal.logging.InternalLoggerFactory;
import org.jetbrains.annotations.Nullable;
import reactor.core.publisher.Mono;
import reactor.netty.tcp.TcpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.require;
import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonEmpty;
import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;
import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireValidPort;

/**
 * An immutable configuration of MySQL connections, and the provider of them. Each setter returns a new
 * provider, the receiver is never changed.
 * <p>
 * The {@link #use(Function)} scopes a connection: it connects and logins, runs the {@code before} hook,
 * the body and the {@code after} hook, and then closes the connection whatever the body succeeds, fails or
 * is cancelled.
 */
public final class ConnectionProvider {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(ConnectionProvider.class);

    private static final String DEFAULT_HOST = "127.0.0.1";

    private static final int DEFAULT_PORT = 3306;

    private static final String DEFAULT_USER = "root";

    private static final List<SocketOptionValue<?>> DEFAULT_SOCKET_OPTIONS =
        Collections.singletonList(SocketOptionValue.of(ChannelOption.TCP_NODELAY, true));

    private static final ConnectionProvider DEFAULT = new ConnectionProvider(DEFAULT_HOST, DEFAULT_PORT,
        DEFAULT_USER, null, null, false, SslConfiguration.disabled(), DEFAULT_SOCKET_OPTIONS, null, null, false,
        DatabaseTerm.CATALOG, Tracer.NOOP, null, null);

    private final String host;

    private final int port;

    private final String user;

    @Nullable
    private final CharSequence password;

    @Nullable
    private final String database;

    private final boolean debug;

    private final SslConfiguration ssl;

    private final List<SocketOptionValue<?>> socketOptions;

    @Nullable
    private final Duration readTimeout;

    @Nullable
    private final Duration connectTimeout;

    private final boolean allowPublicKeyRetrieval;

    private final DatabaseTerm databaseTerm;

    private final Tracer tracer;

    @Nullable
    private final Function<? super MySqlConnection, ? extends Mono<?>> before;

    @Nullable
    private final BiFunction<? super MySqlConnection, ?, ? extends Mono<Void>> after;

    private ConnectionProvider(String host, int port, String user, @Nullable CharSequence password,
        @Nullable String database, boolean debug, SslConfiguration ssl, List<SocketOptionValue<?>> socketOptions,
        @Nullable Duration readTimeout, @Nullable Duration connectTimeout, boolean allowPublicKeyRetrieval,
        DatabaseTerm databaseTerm, Tracer tracer,
        @Nullable Function<? super MySqlConnection, ? extends Mono<?>> before,
        @Nullable BiFunction<? super MySqlConnection, ?, ? extends Mono<Void>> after) {
        this.host = host;
        this.port = port;
        this.user = user;
        this.password = password;
        this.database = database;
        this.debug = debug;
        this.ssl = ssl;
        this.socketOptions = socketOptions;
        this.readTimeout = readTimeout;
        this.connectTimeout = connectTimeout;
        this.allowPublicKeyRetrieval = allowPublicKeyRetrieval;
        this.databaseTerm = databaseTerm;
        this.tracer = tracer;
        this.before = before;
        this.after = after;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUser() {
        return user;
    }

    public Optional<CharSequence> getPassword() {
        return Optional.ofNullable(password);
    }

    public Optional<String> getDatabase() {
        return Optional.ofNullable(database);
    }

    public boolean isDebug() {
        return debug;
    }

    public SslConfiguration getSsl() {
        return ssl;
    }

    public List<SocketOptionValue<?>> getSocketOptions() {
        return socketOptions;
    }

    public Optional<Duration> getReadTimeout() {
        return Optional.ofNullable(readTimeout);
    }

    public Optional<Duration> getConnectTimeout() {
        return Optional.ofNullable(connectTimeout);
    }

    public boolean isAllowPublicKeyRetrieval() {
        return allowPublicKeyRetrieval;
    }

    public DatabaseTerm getDatabaseTerm() {
        return databaseTerm;
    }

    public Tracer getTracer() {
        return tracer;
    }

    public ConnectionProvider setHost(String host) {
        requireNonEmpty(host, "host must not be empty");

        return new ConnectionProvider(host, port, user, password, database, debug, ssl, socketOptions,
            readTimeout, connectTimeout, allowPublicKeyRetrieval, databaseTerm, tracer, before, after);
    }

    public ConnectionProvider setPort(int port) {
        return new ConnectionProvider(host, requireValidPort(port), user, password, database, debug, ssl,
            socketOptions, readTimeout, connectTimeout, allowPublicKeyRetrieval, databaseTerm, tracer, before,
            after);
    }

    public ConnectionProvider setUser(String user) {
        requireNonEmpty(user, "user must not be empty");

        return new ConnectionProvider(host, port, user, password, database, debug, ssl, socketOptions,
            readTimeout, connectTimeout, allowPublicKeyRetrieval, databaseTerm, tracer, before, after);
    }

    /**
     * Sets the password of the user.
     *
     * @param password the password, or {@code null} if the user has no password.
     * @return a new provider.
     */
    public ConnectionProvider setPassword(@Nullable CharSequence password) {
        return new ConnectionProvider(host, port, user, password, database, debug, ssl, socketOptions,
            readTimeout, connectTimeout, allowPublicKeyRetrieval, databaseTerm, tracer, before, after);
    }

    /**
     * Sets the database of login.
     *
     * @param database the database, or {@code null} or empty if login without database.
     * @return a new provider.
     */
    public ConnectionProvider setDatabase(@Nullable String database) {
        String db = database == null || database.isEmpty() ? null : database;

        return new ConnectionProvider(host, port, user, password, db, debug, ssl, socketOptions, readTimeout,
            connectTimeout, allowPublicKeyRetrieval, databaseTerm, tracer, before, after);
    }

    /**
     * Sets the debug mode, which logs each inbound and outbound message of connections.
     *
     * @param debug if enable the debug mode.
     * @return a new provider.
     */
    public ConnectionProvider setDebug(boolean debug) {
        return new ConnectionProvider(host, port, user, password, database, debug, ssl, socketOptions,
            readTimeout, connectTimeout, allowPublicKeyRetrieval, databaseTerm, tracer, before, after);
    }

    public ConnectionProvider setSSL(SslConfiguration ssl) {
        requireNonNull(ssl, "ssl must not be null");

        return new ConnectionProvider(host, port, user, password, database, debug, ssl, socketOptions,
            readTimeout, connectTimeout, allowPublicKeyRetrieval, databaseTerm, tracer, before, after);
    }

    /**
     * Appends a socket option, options are applied by their order.
     *
     * @param option the socket option.
     * @return a new provider.
     */
    public ConnectionProvider addSocketOption(SocketOptionValue<?> option) {
        requireNonNull(option, "option must not be null");

        List<SocketOptionValue<?>> options = new ArrayList<>(socketOptions.size() + 1);

        options.addAll(socketOptions);
        options.add(option);

        return new ConnectionProvider(host, port, user, password, database, debug, ssl,
            Collections.unmodifiableList(options), readTimeout, connectTimeout, allowPublicKeyRetrieval,
            databaseTerm, tracer, before, after);
    }

    public ConnectionProvider setSocketOptions(List<SocketOptionValue<?>> options) {
        requireNonNull(options, "options must not be null");

        for (SocketOptionValue<?> option : options) {
            requireNonNull(option, "option must not be null");
        }

        return new ConnectionProvider(host, port, user, password, database, debug, ssl,
            Collections.unmodifiableList(new ArrayList<>(options)), readTimeout, connectTimeout,
            allowPublicKeyRetrieval, databaseTerm, tracer, before, after);
    }

    /**
     * Sets the timeout of each await of server responses. A connection which is timed out will be closed.
     *
     * @param readTimeout the timeout, or {@code null} if no timeout.
     * @return a new provider.
     */
    public ConnectionProvider setReadTimeout(@Nullable Duration readTimeout) {
        require(readTimeout == null || !readTimeout.isNegative(), "readTimeout must not be negative");

        return new ConnectionProvider(host, port, user, password, database, debug, ssl, socketOptions,
            readTimeout, connectTimeout, allowPublicKeyRetrieval, databaseTerm, tracer, before, after);
    }

    public ConnectionProvider setConnectTimeout(@Nullable Duration connectTimeout) {
        require(connectTimeout == null || !connectTimeout.isNegative(), "connectTimeout must not be negative");

        return new ConnectionProvider(host, port, user, password, database, debug, ssl, socketOptions,
            readTimeout, connectTimeout, allowPublicKeyRetrieval, databaseTerm, tracer, before, after);
    }

    /**
     * Sets if the RSA public key of the server can be requested in plaintext connections. It is required by
     * {@code caching_sha2_password} and {@code sha256_password} without TLS.
     *
     * @param allowPublicKeyRetrieval if allow to request the public key.
     * @return a new provider.
     */
    public ConnectionProvider setAllowPublicKeyRetrieval(boolean allowPublicKeyRetrieval) {
        return new ConnectionProvider(host, port, user, password, database, debug, ssl, socketOptions,
            readTimeout, connectTimeout, allowPublicKeyRetrieval, databaseTerm, tracer, before, after);
    }

    public ConnectionProvider setDatabaseTerm(DatabaseTerm databaseTerm) {
        requireNonNull(databaseTerm, "databaseTerm must not be null");

        return new ConnectionProvider(host, port, user, password, database, debug, ssl, socketOptions,
            readTimeout, connectTimeout, allowPublicKeyRetrieval, databaseTerm, tracer, before, after);
    }

    public ConnectionProvider setTracer(Tracer tracer) {
        requireNonNull(tracer, "tracer must not be null");

        return new ConnectionProvider(host, port, user, password, database, debug, ssl, socketOptions,
            readTimeout, connectTimeout, allowPublicKeyRetrieval, databaseTerm, tracer, before, after);
    }

    /**
     * Sets the hook which runs before the body of {@link #use(Function)}. The {@code after} hook is cleared,
     * because its input is produced by the previous {@code before} hook.
     *
     * @param before the hook.
     * @return a new provider.
     */
    public ConnectionProvider withBefore(Function<? super MySqlConnection, ? extends Mono<?>> before) {
        requireNonNull(before, "before must not be null");

        return new ConnectionProvider(host, port, user, password, database, debug, ssl, socketOptions,
            readTimeout, connectTimeout, allowPublicKeyRetrieval, databaseTerm, tracer, before, null);
    }

    /**
     * Sets the hook which runs after the body of {@link #use(Function)}, even if the body fails. Its input
     * is the value of the {@code before} hook, or {@code null} if the hook is absent or emits nothing.
     *
     * @param after the hook.
     * @return a new provider.
     */
    public ConnectionProvider withAfter(BiFunction<? super MySqlConnection, Object, ? extends Mono<Void>> after) {
        requireNonNull(after, "after must not be null");

        return new ConnectionProvider(host, port, user, password, database, debug, ssl, socketOptions,
            readTimeout, connectTimeout, allowPublicKeyRetrieval, databaseTerm, tracer, before, after);
    }

    /**
     * Sets a pair of hooks, the value of {@code before} is passed to {@code after}.
     *
     * @param before the hook runs before the body.
     * @param after  the hook runs after the body.
     * @param <A>    the type of the value passed between the hooks.
     * @return a new provider.
     */
    public <A> ConnectionProvider withBeforeAfter(Function<? super MySqlConnection, ? extends Mono<A>> before,
        BiFunction<? super MySqlConnection, ? super A, ? extends Mono<Void>> after) {
        requireNonNull(before, "before must not be null");
        requireNonNull(after, "after must not be null");

        return new ConnectionProvider(host, port, user, password, database, debug, ssl, socketOptions,
            readTimeout, connectTimeout, allowPublicKeyRetrieval, databaseTerm, tracer, before, after);
    }

    /**
     * Connects and logins a connection without hooks, the caller should close it.
     *
     * @return a {@link Mono} emits the connection.
     */
    public Mono<MySqlConnection> create() {
        return Mono.defer(() -> {
            ConnectionContext context = new ConnectionContext(debug, database);

            return Client.connect(tcpClient(), ssl, context).flatMap(client -> {
                ReadTimeout timeout = new ReadTimeout(client, readTimeout);

                Mono<Void> login = InitFlow.login(client, ssl, database, user, password,
                    allowPublicKeyRetrieval);

                return timeout.apply(login)
                    .then(Mono.fromSupplier(() -> new MySqlSimpleConnection(client, Codecs.getInstance(),
                        readTimeout, tracer, databaseTerm)));
            });
        });
    }

    /**
     * Uses a connection in a scope. The {@code after} hook and the closing of the connection run exactly once,
     * when the body completes, fails or is cancelled. If the {@code before} hook fails, the body and the
     * {@code after} hook are skipped.
     *
     * @param body the body which uses the connection.
     * @param <T>  the type of the result.
     * @return the result of the body.
     */
    public <T> Mono<T> use(Function<? super MySqlConnection, ? extends Mono<T>> body) {
        requireNonNull(body, "body must not be null");

        return Mono.usingWhen(create(), connection -> useHooked(connection, body), MySqlConnection::close,
            (connection, e) -> connection.close(), MySqlConnection::close);
    }

    private <T> Mono<T> useHooked(MySqlConnection connection,
        Function<? super MySqlConnection, ? extends Mono<T>> body) {
        Function<? super MySqlConnection, ? extends Mono<?>> before = this.before;
        Mono<Optional<Object>> prepared;

        if (before == null) {
            prepared = Mono.just(Optional.empty());
        } else {
            prepared = Mono.defer(() -> before.apply(connection))
                .map(value -> Optional.<Object>of(value))
                .defaultIfEmpty(Optional.empty())
                .doOnSubscribe(s -> logger.debug("Running before hook of connection {}",
                    connection.getConnectionId()));
        }

        return prepared.flatMap(input -> Mono.usingWhen(Mono.just(input), ignored -> body.apply(connection),
            it -> runAfter(connection, it), (it, e) -> runAfter(connection, it), it -> runAfter(connection, it)));
    }

    @SuppressWarnings("unchecked")
    private Mono<Void> runAfter(MySqlConnection connection, Optional<Object> input) {
        BiFunction<? super MySqlConnection, Object, ? extends Mono<Void>> after =
            (BiFunction<? super MySqlConnection, Object, ? extends Mono<Void>>) this.after;

        if (after == null) {
            return Mono.empty();
        }

        logger.debug("Running after hook of connection {}", connection.getConnectionId());

        return Mono.defer(() -> after.apply(connection, input.orElse(null)));
    }

    private TcpClient tcpClient() {
        TcpClient client = TcpClient.newConnection().host(host).port(port);

        if (connectTimeout != null) {
            client = client.option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                Math.toIntExact(connectTimeout.toMillis()));
        }

        for (SocketOptionValue<?> option : socketOptions) {
            client = option.applyTo(client);
        }

        return client;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConnectionProvider)) {
            return false;
        }

        ConnectionProvider that = (ConnectionProvider) o;

        return port == that.port &&
            debug == that.debug &&
            allowPublicKeyRetrieval == that.allowPublicKeyRetrieval &&
            host.equals(that.host) &&
            user.equals(that.user) &&
            Objects.equals(passwordText(), that.passwordText()) &&
            Objects.equals(database, that.database) &&
            ssl.equals(that.ssl) &&
            socketOptions.equals(that.socketOptions) &&
            Objects.equals(readTimeout, that.readTimeout) &&
            Objects.equals(connectTimeout, that.connectTimeout) &&
            databaseTerm == that.databaseTerm &&
            tracer.equals(that.tracer) &&
            Objects.equals(before, that.before) &&
            Objects.equals(after, that.after);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, user, passwordText(), database, debug, ssl, socketOptions, readTimeout,
            connectTimeout, allowPublicKeyRetrieval, databaseTerm, tracer, before, after);
    }

    /**
     * Passwords may be a {@link StringBuilder} or {@link java.nio.CharBuffer}, which do not compare by content.
     */
    @Nullable
    private String passwordText() {
        CharSequence password = this.password;

        return password == null ? null : password.toString();
    }

    @Override
    public String toString() {
        return "ConnectionProvider{host='" + host + "', port=" + port + ", user='" + user +
            "', password=REDACTED, database='" + database + "', debug=" + debug + ", ssl=" + ssl +
            ", socketOptions=" + socketOptions + ", readTimeout=" + readTimeout + ", connectTimeout=" +
            connectTimeout + ", allowPublicKeyRetrieval=" + allowPublicKeyRetrieval + ", databaseTerm=" +
            databaseTerm + ", tracer=" + tracer + ", before=" + before + ", after=" + after + '}';
    }

    /**
     * Gets the provider with default configuration, it connects to {@code root@127.0.0.1:3306} without
     * password, database and SSL.
     *
     * @return the default provider.
     */
    public static ConnectionProvider defaults() {
        return DEFAULT;
    }
}
