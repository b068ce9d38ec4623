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

package io.asyncer.mysql.wire.authentication;

import io.asyncer.mysql.wire.AuthenticationException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

/**
 * Unit tests for {@link MySqlAuthProvider}.
 */
class MySqlAuthProviderTest {

    private static final byte[] SALT = "0123456789abcdefghij".getBytes(StandardCharsets.US_ASCII);

    @Test
    void nativePassword() throws NoSuchAlgorithmException {
        MySqlAuthProvider provider = MySqlAuthProvider.build(MySqlAuthProvider.MYSQL_NATIVE_PASSWORD, true);
        MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
        byte[] stage1 = sha1.digest("secret".getBytes(StandardCharsets.UTF_8));
        byte[] stage2 = sha1.digest(stage1);

        sha1.update(SALT);
        sha1.update(stage2);

        byte[] expected = xor(sha1.digest(), stage1);

        assertThat(provider.getType()).isEqualTo("mysql_native_password");
        assertThat(provider.isSslNecessary()).isFalse();
        assertThat(provider.authentication("secret", SALT)).hasSize(20).isEqualTo(expected);
        assertThat(provider.authentication("", SALT)).isEmpty();
        assertThat(provider.authentication(null, SALT)).isEmpty();
        assertThat(provider.next()).isSameAs(provider);
    }

    @Test
    void cachingSha2Fast() throws NoSuchAlgorithmException {
        MySqlAuthProvider provider = MySqlAuthProvider.build(MySqlAuthProvider.CACHING_SHA2_PASSWORD, true);
        MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
        byte[] stage1 = sha256.digest("secret".getBytes(StandardCharsets.UTF_8));
        byte[] stage2 = sha256.digest(stage1);

        sha256.update(stage2);
        sha256.update(SALT);

        byte[] expected = xor(sha256.digest(), stage1);

        assertThat(provider.isSslNecessary()).isFalse();
        assertThat(provider.authentication("secret", SALT)).hasSize(32).isEqualTo(expected);
        assertThat(provider.authentication(null, SALT)).isEmpty();
    }

    @Test
    void cachingSha2Full() {
        MySqlAuthProvider provider = MySqlAuthProvider.build(MySqlAuthProvider.CACHING_SHA2_PASSWORD, true).next();

        assertThat(provider.getType()).isEqualTo("caching_sha2_password");
        assertThat(provider.isSslNecessary()).isTrue();
        assertThat(provider.getPublicKeyRequest()).isEqualTo((byte) 2);
        assertThat(provider.authentication("pässword", SALT))
            .isEqualTo("pässword\0".getBytes(StandardCharsets.UTF_8));
        assertThat(provider.authentication(null, SALT)).containsExactly(0);
    }

    @Test
    void cleartextBased() {
        MySqlAuthProvider sha256 = MySqlAuthProvider.build(MySqlAuthProvider.SHA256_PASSWORD, true);
        MySqlAuthProvider clear = MySqlAuthProvider.build(MySqlAuthProvider.MYSQL_CLEAR_PASSWORD, true);

        assertThat(sha256.isSslNecessary()).isTrue();
        assertThat(sha256.getPublicKeyRequest()).isEqualTo((byte) 1);
        assertThat(clear.isSslNecessary()).isTrue();
        assertThat(clear.getPublicKeyRequest()).isZero();
        assertThat(clear.authentication("abc", SALT)).containsExactly('a', 'b', 'c', 0);
    }

    @Test
    void noPlugin() {
        assertThat(MySqlAuthProvider.build(MySqlAuthProvider.NO_AUTH_PROVIDER, true).authentication("a", SALT))
            .isEmpty();
        assertThat(MySqlAuthProvider.build(MySqlAuthProvider.NO_AUTH_PROVIDER, false).getType())
            .isEqualTo(MySqlAuthProvider.MYSQL_NATIVE_PASSWORD);
    }

    @Test
    void unknownPlugin() {
        assertThatExceptionOfType(AuthenticationException.class)
            .isThrownBy(() -> MySqlAuthProvider.build("authentication_ldap_sasl_client", true))
            .withMessageContaining("authentication_ldap_sasl_client")
            .satisfies(e -> assertThat(e.isPolicyViolation()).isFalse());
    }

    private static byte[] xor(byte[] left, byte[] right) {
        byte[] result = new byte[left.length];

        for (int i = 0; i < result.length; ++i) {
            result[i] = (byte) (left[i] ^ right[i]);
        }

        return result;
    }
}
