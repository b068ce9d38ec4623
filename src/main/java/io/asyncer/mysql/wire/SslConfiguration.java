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

import io.asyncer.mysql.wire.constant.SslMode;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import org.jetbrains.annotations.Nullable;

import javax.net.ssl.SSLException;
import java.util.Objects;
import java.util.function.Function;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * A configuration of MySQL SSL connection. It is immutable, each {@code with} method creates a copy.
 */
public final class SslConfiguration {

    private static final SslConfiguration DISABLED = new SslConfiguration(SslMode.DISABLED,
        TlsParameters.defaults(), false, null);

    private final SslMode sslMode;

    private final TlsParameters tlsParameters;

    private final boolean fallback;

    @Nullable
    private final Function<SslContextBuilder, SslContextBuilder> customizer;

    private SslConfiguration(SslMode sslMode, TlsParameters tlsParameters, boolean fallback,
        @Nullable Function<SslContextBuilder, SslContextBuilder> customizer) {
        this.sslMode = sslMode;
        this.tlsParameters = tlsParameters;
        this.fallback = fallback;
        this.customizer = customizer;
    }

    public SslMode getSslMode() {
        return sslMode;
    }

    public TlsParameters getTlsParameters() {
        return tlsParameters;
    }

    /**
     * Checks if the connection can continue in plaintext when the server does not support SSL.
     *
     * @return if fallback is allowed.
     */
    public boolean isFallback() {
        return fallback;
    }

    public SslConfiguration withTlsParameters(TlsParameters tlsParameters) {
        requireNonNull(tlsParameters, "tlsParameters must not be null");

        return new SslConfiguration(sslMode, tlsParameters, fallback, customizer);
    }

    public SslConfiguration withFallback(boolean fallback) {
        return new SslConfiguration(sslMode, tlsParameters, fallback, customizer);
    }

    /**
     * Builds a new client {@link SslContext} of this configuration. It does not touch the network.
     *
     * @return the SSL context.
     * @throws SslNegotiationException if SSL is disabled, or the TLS provider rejects the configuration.
     */
    public SslContext newContext() {
        if (!sslMode.startSsl()) {
            throw new SslNegotiationException("SSL mode DISABLED cannot construct an SSL context");
        }

        SslContextBuilder builder = SslContextBuilder.forClient();

        if (!sslMode.verifyCertificate()) {
            builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
        }

        if (!tlsParameters.getProtocols().isEmpty()) {
            builder.protocols(tlsParameters.getProtocols());
        }

        if (!tlsParameters.getCipherSuites().isEmpty()) {
            builder.ciphers(tlsParameters.getCipherSuites());
        }

        if (customizer != null) {
            builder = customizer.apply(builder);
        }

        try {
            return builder.build();
        } catch (SSLException | IllegalArgumentException e) {
            throw new SslNegotiationException("Failed to construct an SSL context of mode " + sslMode, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SslConfiguration)) {
            return false;
        }

        SslConfiguration that = (SslConfiguration) o;

        return fallback == that.fallback && sslMode == that.sslMode &&
            tlsParameters.equals(that.tlsParameters) && Objects.equals(customizer, that.customizer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sslMode, tlsParameters, fallback, customizer);
    }

    @Override
    public String toString() {
        if (sslMode == SslMode.DISABLED) {
            return "SslConfiguration{sslMode=DISABLED}";
        }

        return "SslConfiguration{sslMode=" + sslMode + ", tlsParameters=" + tlsParameters + ", fallback=" +
            fallback + ", customizer=" + customizer + '}';
    }

    public static SslConfiguration disabled() {
        return DISABLED;
    }

    /**
     * Creates a configuration which accepts any server certificate.
     *
     * @return the configuration.
     */
    public static SslConfiguration trusted() {
        return new SslConfiguration(SslMode.TRUSTED, TlsParameters.defaults(), false, null);
    }

    /**
     * Creates a configuration which verifies the server certificate and host name by the trust store of the
     * JVM.
     *
     * @return the configuration.
     */
    public static SslConfiguration systemTrust() {
        return new SslConfiguration(SslMode.SYSTEM_TRUST, TlsParameters.defaults(), false, null);
    }

    /**
     * Creates a configuration customized by the user, e.g. a trust manager with a CA certificate, or a client
     * certificate.
     *
     * @param customizer customizes the builder, it will be applied after the TLS parameters.
     * @return the configuration.
     * @throws IllegalArgumentException if {@code customizer} is {@code null}.
     */
    public static SslConfiguration custom(Function<SslContextBuilder, SslContextBuilder> customizer) {
        requireNonNull(customizer, "customizer must not be null");

        return new SslConfiguration(SslMode.CUSTOM, TlsParameters.defaults(), false, customizer);
    }
}
