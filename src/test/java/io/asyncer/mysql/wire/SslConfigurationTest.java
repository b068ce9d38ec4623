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
import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

/**
 * Unit tests for {@link SslConfiguration} and {@link TlsParameters}.
 */
class SslConfigurationTest {

    @Test
    void disabledCannotBuildContext() {
        assertThatExceptionOfType(SslNegotiationException.class)
            .isThrownBy(() -> SslConfiguration.disabled().newContext())
            .withMessage("SSL mode DISABLED cannot construct an SSL context");
    }

    @Test
    void trustedBuildsClientContext() {
        SslContext context = SslConfiguration.trusted()
            .withTlsParameters(TlsParameters.defaults().withProtocols("TLSv1.2", "TLSv1.3"))
            .newContext();

        assertThat(context.isClient()).isTrue();
    }

    @Test
    void everyEnabledModeBuildsContext() {
        assertThat(SslConfiguration.trusted().newContext().isClient()).isTrue();
        assertThat(SslConfiguration.systemTrust().newContext().isClient()).isTrue();
        assertThat(SslConfiguration.custom(builder -> builder).newContext().isClient()).isTrue();
    }

    @Test
    void withersLeaveOriginalUnchanged() {
        SslConfiguration original = SslConfiguration.systemTrust();
        TlsParameters params = TlsParameters.defaults().withProtocols("TLSv1.3").withServerNames("db.example.com");

        SslConfiguration tuned = original.withTlsParameters(params);
        SslConfiguration fallback = original.withFallback(true);

        assertThat(tuned.getTlsParameters()).isEqualTo(params);
        assertThat(tuned.getSslMode()).isEqualTo(SslMode.SYSTEM_TRUST);
        assertThat(tuned).isNotEqualTo(original);
        assertThat(fallback.isFallback()).isTrue();
        assertThat(fallback.getTlsParameters()).isEqualTo(TlsParameters.defaults());

        assertThat(original.getTlsParameters()).isEqualTo(TlsParameters.defaults());
        assertThat(original.isFallback()).isFalse();
        assertThat(original).isEqualTo(SslConfiguration.systemTrust());
    }

    @Test
    void customizerApplied() {
        boolean[] applied = { false };
        SslConfiguration ssl = SslConfiguration.custom(builder -> {
            applied[0] = true;
            return builder;
        });

        assertThat(ssl.getSslMode()).isEqualTo(SslMode.CUSTOM);
        assertThat(ssl.newContext().isClient()).isTrue();
        assertThat(applied[0]).isTrue();
    }

    @Test
    void modes() {
        assertThat(SslMode.DISABLED.startSsl()).isFalse();
        assertThat(SslMode.TRUSTED.verifyCertificate()).isFalse();
        assertThat(SslMode.SYSTEM_TRUST.verifyIdentity()).isTrue();
        assertThat(SslMode.CUSTOM.verifyCertificate()).isTrue();
        assertThat(SslMode.CUSTOM.verifyIdentity()).isFalse();
    }

    @Test
    void fallbackAndEquality() {
        SslConfiguration trusted = SslConfiguration.trusted();

        assertThat(trusted.isFallback()).isFalse();
        assertThat(trusted.withFallback(true).isFallback()).isTrue();
        assertThat(trusted).isEqualTo(SslConfiguration.trusted()).isNotEqualTo(trusted.withFallback(true));
        assertThat(SslConfiguration.disabled()).hasToString("SslConfiguration{sslMode=DISABLED}");
        assertThatIllegalArgumentException().isThrownBy(() -> TlsParameters.defaults()
            .withServerNames("db", null));
    }

    @Test
    void tlsParametersAndSocketOptions() {
        TlsParameters params = TlsParameters.defaults()
            .withCipherSuites("TLS_AES_128_GCM_SHA256")
            .withServerNames("db.example.com");

        assertThat(params.getCipherSuites()).containsExactly("TLS_AES_128_GCM_SHA256");
        assertThat(params.getServerNames()).containsExactly("db.example.com");
        assertThat(params.getProtocols()).isEmpty();
        assertThat(SslConfiguration.systemTrust().getSslMode()).isEqualTo(SslMode.SYSTEM_TRUST);

        SocketOptionValue<Boolean> keepAlive = SocketOptionValue.of(ChannelOption.SO_KEEPALIVE, true);

        assertThat(keepAlive.getOption()).isSameAs(ChannelOption.SO_KEEPALIVE);
        assertThat(keepAlive.getValue()).isTrue();
    }
}
