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

package io.asyncer.mysql.wire.message.server;

import io.asyncer.mysql.wire.ProtocolFramingException;
import io.asyncer.mysql.wire.ServerPayloads;
import io.asyncer.mysql.wire.ServerVersion;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

/**
 * Unit tests for {@link HandshakeRequest}.
 */
class HandshakeRequestTest {

    @Test
    void decodeMySql() {
        ByteBuf buf = ServerPayloads.handshake(42, "8.0.36", ServerPayloads.SERVER_CAPABILITIES,
            "caching_sha2_password");

        try {
            HandshakeRequest request = HandshakeRequest.decode(buf);

            assertThat(request.getConnectionId()).isEqualTo(42);
            assertThat(request.getServerVersion()).isEqualTo(ServerVersion.create(8, 0, 36));
            assertThat(request.getSalt()).isEqualTo(ServerPayloads.SALT);
            assertThat(request.getAuthType()).isEqualTo("caching_sha2_password");
            assertThat(request.getCollationId()).isEqualTo(45);
            assertThat(request.getServerCapability().isProtocol41()).isTrue();
            assertThat(request.getServerCapability().isEofDeprecated()).isTrue();
            assertThat(request.getServerCapability().isSslEnabled()).isFalse();
            assertThat(request.toString()).contains("salt=REDACTED");
        } finally {
            buf.release();
        }
    }

    @Test
    void decodeMariaDb() {
        ByteBuf buf = ServerPayloads.handshake(3, "5.5.5-10.11.6-MariaDB", ServerPayloads.SERVER_CAPABILITIES & ~1L,
            "mysql_native_password");

        try {
            HandshakeRequest request = HandshakeRequest.decode(buf);

            assertThat(request.getServerVersion().isMariaDb()).isTrue();
            assertThat(request.getServerCapability().isMariaDb()).isTrue();
            assertThat(request.getAuthType()).isEqualTo("mysql_native_password");
        } finally {
            buf.release();
        }
    }

    @Test
    void rejectOldProtocol() {
        ByteBuf buf = Unpooled.buffer().writeByte(9);

        buf.writeCharSequence("3.23.58", StandardCharsets.US_ASCII);
        buf.writeByte(0);

        try {
            assertThatExceptionOfType(ProtocolFramingException.class)
                .isThrownBy(() -> HandshakeRequest.decode(buf))
                .withMessage("Unsupported handshake protocol version 9");
        } finally {
            buf.release();
        }
    }
}
