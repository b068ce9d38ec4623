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
import io.asyncer.mysql.wire.ServerVersion;
import org.jetbrains.annotations.Nullable;

import javax.crypto.Cipher;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.Base64;

/**
 * Encrypts a password by the RSA public key of the server, used by {@code caching_sha2_password} full
 * authentication and {@code sha256_password} on an insecure channel.
 */
public final class RsaPasswordEncryptor {

    private static final String BEGIN = "-----BEGIN PUBLIC KEY-----";

    private static final String END = "-----END PUBLIC KEY-----";

    private static final String OAEP = "RSA/ECB/OAEPWithSHA-1AndMGF1Padding";

    private static final String PKCS1 = "RSA/ECB/PKCS1Padding";

    /**
     * Encrypts {@code (password + NUL) XOR salt}.
     *
     * @param password  the password.
     * @param salt      the salt of the current authentication.
     * @param publicKey the PEM encoded public key sent by the server.
     * @param version   the server version, servers before 8.0.5 use PKCS#1 padding.
     * @return the encrypted password.
     * @throws AuthenticationException if the public key is malformed or the encryption fails.
     */
    public static byte[] encrypt(@Nullable CharSequence password, byte[] salt, byte[] publicKey,
        ServerVersion version) {
        byte[] input = AuthUtils.encodeTerminal(password == null ? "" : password);

        if (salt.length > 0) {
            for (int i = 0; i < input.length; ++i) {
                input[i] ^= salt[i % salt.length];
            }
        }

        try {
            Cipher cipher = Cipher.getInstance(version.isLessThan(8, 0, 5) ? PKCS1 : OAEP);

            cipher.init(Cipher.ENCRYPT_MODE, parse(publicKey));

            return cipher.doFinal(input);
        } catch (GeneralSecurityException e) {
            throw AuthenticationException.local("Failed to encrypt password by the RSA public key: " +
                e.getMessage());
        } finally {
            Arrays.fill(input, (byte) 0);
        }
    }

    static PublicKey parse(byte[] pem) throws GeneralSecurityException {
        String text = new String(pem, StandardCharsets.US_ASCII).trim();
        int begin = text.indexOf(BEGIN);
        int end = text.indexOf(END);

        if (begin < 0 || end < begin) {
            throw AuthenticationException.local("Unsupported public key format, expected " + BEGIN);
        }

        String body = text.substring(begin + BEGIN.length(), end).replaceAll("\\s", "");
        byte[] der;

        try {
            der = Base64.getDecoder().decode(body);
        } catch (IllegalArgumentException e) {
            throw AuthenticationException.local("Malformed public key: " + e.getMessage());
        }

        return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
    }

    private RsaPasswordEncryptor() { }
}
