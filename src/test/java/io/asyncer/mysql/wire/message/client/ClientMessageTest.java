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

package io.asyncer.mysql.wire.message.client;

import io.asyncer.mysql.wire.Capability;
import io.asyncer.mysql.wire.ConnectionContext;
import io.asyncer.mysql.wire.ConnectionContextTest;
import io.asyncer.mysql.wire.codec.Codecs;
import io.asyncer.mysql.wire.codec.MySqlParameter;
import io.asyncer.mysql.wire.constant.MySqlType;
import io.asyncer.mysql.wire.constant.Packets;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.ByteBufUtil;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

/**
 * Unit tests for encoding of {@link ClientMessage}s.
 */
class ClientMessageTest {

    private final ConnectionContext context = ConnectionContextTest.mock();

    @Test
    void textQuery() {
        ClientMessage message = new TextQueryMessage("SELECT 1");

        assertThat(message.isSequenceReset()).isTrue();
        assertThat(message.isResponded()).isTrue();
        assertThat(message).hasToString("TextQueryMessage{sql=REDACTED}");
        assertPayload(message, buf -> {
            assertThat(buf.readByte()).isEqualTo((byte) 0x03);
            assertThat(buf.toString(StandardCharsets.UTF_8)).isEqualTo("SELECT 1");
        });
    }

    @Test
    void prepareAndClose() {
        assertPayload(new PrepareQueryMessage("SELECT ?"), buf -> {
            assertThat(buf.readByte()).isEqualTo((byte) 0x16);
            assertThat(buf.toString(StandardCharsets.UTF_8)).isEqualTo("SELECT ?");
        });

        ClientMessage close = new PreparedCloseMessage(7);

        assertThat(close.isResponded()).isFalse();
        assertPayload(close, buf -> {
            assertThat(buf.readByte()).isEqualTo((byte) 0x19);
            assertThat(buf.readIntLE()).isEqualTo(7);
        });
    }

    @Test
    void initDb() {
        assertThatIllegalArgumentException().isThrownBy(() -> new InitDbMessage(""));
        assertPayload(new InitDbMessage("test"), buf -> {
            assertThat(buf.readByte()).isEqualTo((byte) 0x02);
            assertThat(buf.toString(StandardCharsets.UTF_8)).isEqualTo("test");
        });
    }

    @Test
    void sslRequestIsPrefixOfHandshakeResponse() {
        Capability capability = Capability.clientDesired(true, true);
        byte[] authentication = new byte[] { 1, 2, 3 };
        SslRequest ssl = new SslRequest(capability, 45);
        HandshakeResponse41 response = new HandshakeResponse41(capability, 45, "root", authentication,
            "mysql_native_password", "test");

        assertThat(ssl.isSequenceReset()).isFalse();
        assertThat(response.isSequenceReset()).isFalse();
        assertThat(response.toString()).contains("authentication=REDACTED").doesNotContain("[1, 2, 3]");

        byte[] sslBytes = encode(ssl);
        byte[] responseBytes = encode(response);

        assertThat(sslBytes).hasSize(32);
        assertThat(responseBytes).startsWith(sslBytes);

        ByteBuf buf = ByteBufAllocator.DEFAULT.buffer().writeBytes(responseBytes);

        try {
            assertThat(buf.readIntLE()).isEqualTo(capability.getBaseBitmap());
            assertThat(buf.readIntLE()).isEqualTo(Packets.MAX_PAYLOAD_SIZE);
            assertThat(buf.readUnsignedByte()).isEqualTo((short) 45);
            buf.skipBytes(23);
            assertThat(readCString(buf)).isEqualTo("root");
            assertThat(buf.readByte()).isEqualTo((byte) 3);
            buf.skipBytes(3);
            assertThat(readCString(buf)).isEqualTo("test");
            assertThat(readCString(buf)).isEqualTo("mysql_native_password");
            assertThat(buf.isReadable()).isFalse();
        } finally {
            buf.release();
        }
    }

    @Test
    void handshakeResponseWithoutDatabase() {
        Capability capability = Capability.clientDesired(false, false);
        HandshakeResponse41 response = new HandshakeResponse41(capability, 45, "root", new byte[0],
            "caching_sha2_password", null);
        ByteBuf buf = ByteBufAllocator.DEFAULT.buffer().writeBytes(encode(response));

        try {
            buf.skipBytes(32);
            assertThat(readCString(buf)).isEqualTo("root");
            assertThat(buf.readByte()).isZero();
            assertThat(readCString(buf)).isEqualTo("caching_sha2_password");
            assertThat(buf.isReadable()).isFalse();
        } finally {
            buf.release();
        }
    }

    @Test
    void preparedExecute() {
        Codecs codecs = Codecs.getInstance();
        MySqlParameter[] values = {
            codecs.encode(1000),
            codecs.encodeNull(),
            codecs.encode("ab"),
        };

        assertPayload(new PreparedExecuteMessage(3, values), buf -> {
            assertThat(buf.readByte()).isEqualTo((byte) 0x17);
            assertThat(buf.readIntLE()).isEqualTo(3);
            assertThat(buf.readByte()).isZero();
            assertThat(buf.readIntLE()).isOne();
            // Null bitmap, the second parameter.
            assertThat(buf.readByte()).isEqualTo((byte) 0b010);
            assertThat(buf.readByte()).isOne();
            assertThat(buf.readUnsignedShortLE()).isEqualTo(MySqlType.SMALLINT.getId());
            assertThat(buf.readUnsignedShortLE()).isEqualTo(MySqlType.NULL.getId());
            assertThat(buf.readUnsignedShortLE()).isEqualTo(MySqlType.VARCHAR.getId());
            assertThat(buf.readShortLE()).isEqualTo((short) 1000);
            assertThat(buf.readByte()).isEqualTo((byte) 2);
            assertThat(buf.toString(StandardCharsets.UTF_8)).isEqualTo("ab");
        });
    }

    @Test
    void preparedExecuteWithoutParameters() {
        assertPayload(new PreparedExecuteMessage(9, new MySqlParameter[0]), buf ->
            assertThat(buf.readableBytes()).isEqualTo(10));
    }

    private void assertPayload(ClientMessage message, Consumer<ByteBuf> assertion) {
        StepVerifier.create(message.encode(ByteBufAllocator.DEFAULT, context))
            .assertNext(buf -> {
                try {
                    assertion.accept(buf);
                } finally {
                    buf.release();
                }
            })
            .verifyComplete();
    }

    private byte[] encode(ClientMessage message) {
        ByteBuf buf = message.encode(ByteBufAllocator.DEFAULT, context).block();

        assertThat(buf).isNotNull();

        try {
            return ByteBufUtil.getBytes(buf);
        } finally {
            buf.release();
        }
    }

    private static String readCString(ByteBuf buf) {
        int end = buf.indexOf(buf.readerIndex(), buf.writerIndex(), (byte) 0);
        String value = buf.toString(buf.readerIndex(), end - buf.readerIndex(), StandardCharsets.UTF_8);

        buf.readerIndex(end + 1);

        return value;
    }
}
