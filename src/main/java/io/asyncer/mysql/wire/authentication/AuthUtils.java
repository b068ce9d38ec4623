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

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * A utility for hashing and encoding passwords.
 */
final class AuthUtils {

    private static final String SHA1 = "SHA-1";

    private static final String SHA256 = "SHA-256";

    private static final byte TERMINAL = 0;

    /**
     * The scramble of {@code mysql_native_password}:
     * {@code SHA1(password) XOR SHA1(salt + SHA1(SHA1(password)))}.
     *
     * @param password the UTF-8 encoded password.
     * @param salt     the salt.
     * @return the scramble.
     */
    static byte[] hash1(byte[] password, byte[] salt) {
        return scramble(SHA1, password, salt, true);
    }

    /**
     * The scramble of {@code caching_sha2_password}:
     * {@code SHA256(password) XOR SHA256(SHA256(SHA256(password)) + salt)}.
     *
     * @param password the UTF-8 encoded password.
     * @param salt     the salt.
     * @return the scramble.
     */
    static byte[] hash256(byte[] password, byte[] salt) {
        return scramble(SHA256, password, salt, false);
    }

    /**
     * Encodes a password with a NUL terminal.
     *
     * @param password the password.
     * @return the UTF-8 encoded password with a NUL terminal.
     */
    static byte[] encodeTerminal(CharSequence password) {
        ByteBuffer encoded = StandardCharsets.UTF_8.encode(CharBuffer.wrap(password));
        byte[] result = new byte[encoded.remaining() + 1];

        encoded.get(result, 0, result.length - 1);
        result[result.length - 1] = TERMINAL;

        return result;
    }

    static byte[] encode(CharSequence password) {
        ByteBuffer encoded = StandardCharsets.UTF_8.encode(CharBuffer.wrap(password));
        byte[] result = new byte[encoded.remaining()];

        encoded.get(result);

        return result;
    }

    private static byte[] scramble(String algorithm, byte[] password, byte[] salt, boolean saltFirst) {
        MessageDigest digest = loadDigest(algorithm);
        byte[] oneRound = digest.digest(password);
        byte[] twoRounds = digest.digest(oneRound);

        if (saltFirst) {
            digest.update(salt);
            digest.update(twoRounds);
        } else {
            digest.update(twoRounds);
            digest.update(salt);
        }

        byte[] result = digest.digest();

        for (int i = 0; i < result.length; ++i) {
            result[i] ^= oneRound[i];
        }

        Arrays.fill(oneRound, (byte) 0);

        return result;
    }

    private static MessageDigest loadDigest(String name) {
        try {
            return MessageDigest.getInstance(name);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(name + " not support of MessageDigest", e);
        }
    }

    private AuthUtils() { }
}
