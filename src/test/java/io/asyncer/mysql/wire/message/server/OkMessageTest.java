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

import io.asyncer.mysql.wire.ServerPayloads;
import io.asyncer.mysql.wire.constant.ServerStatuses;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link OkMessage}.
 */
class OkMessageTest {

    @Test
    void decodeWithInformation() {
        OkMessage message = OkMessage.decode(infoOk());

        assertThat(message.getAffectedRows()).isOne();
        assertThat(message.getLastInsertId()).isEqualTo(2);
        assertThat(message.getServerStatuses()).isEqualTo((short) 0x4000);
        assertThat(message.getWarnings()).isEqualTo(3);
        assertThat(message.getInformation()).isEqualTo("autocommit");
        assertThat(message.isDone()).isTrue();
    }

    @Test
    void unsignedLastInsertId() {
        ByteBuf buf = Unpooled.buffer().writeByte(0).writeByte(1).writeByte(0xFE).writeLongLE(-1L)
            .writeShortLE(ServerStatuses.AUTO_COMMIT | ServerStatuses.MORE_RESULTS_EXISTS).writeShortLE(0);
        OkMessage message = OkMessage.decode(buf);

        assertThat(Long.toUnsignedString(message.getLastInsertId())).isEqualTo("18446744073709551615");
        assertThat(message.getInformation()).isEmpty();
        assertThat(message.isDone()).isFalse();
    }

    @Test
    void equality() {
        assertThat(OkMessage.decode(ServerPayloads.ok(2, 5, ServerStatuses.AUTO_COMMIT)))
            .isEqualTo(OkMessage.decode(ServerPayloads.ok(2, 5, ServerStatuses.AUTO_COMMIT)))
            .isNotEqualTo(OkMessage.decode(ServerPayloads.ok(2, 6, ServerStatuses.AUTO_COMMIT)));
    }

    private static ByteBuf infoOk() {
        return Unpooled.wrappedBuffer(new byte[] {
            0,
            1, 2, 0, 0x40, 3, 0,
            0x61, 0x75, 0x74, 0x6f, 0x63, 0x6f, 0x6d, 0x6d, 0x69, 0x74,
        });
    }
}
