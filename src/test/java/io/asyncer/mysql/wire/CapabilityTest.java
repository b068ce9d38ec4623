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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link Capability}.
 */
class CapabilityTest {

    @Test
    void clientDesired() {
        Capability plain = Capability.clientDesired(false, false);

        assertThat(plain.isProtocol41()).isTrue();
        assertThat(plain.isEofDeprecated()).isTrue();
        assertThat(plain.isPluginAuthAllowed()).isTrue();
        assertThat(plain.isConnectWithDatabase()).isFalse();
        assertThat(plain.isSslEnabled()).isFalse();
        assertThat(plain.isMariaDb()).isFalse();

        Capability full = Capability.clientDesired(true, true);

        assertThat(full.isConnectWithDatabase()).isTrue();
        assertThat(full.isSslEnabled()).isTrue();
    }

    @Test
    void intersect() {
        Capability server = Capability.of(ServerPayloads.SERVER_CAPABILITIES & ~(1L << 24));
        Capability negotiated = Capability.clientDesired(true, true).intersect(server);

        assertThat(negotiated.isEofDeprecated()).isFalse();
        assertThat(negotiated.isSslEnabled()).isFalse();
        assertThat(negotiated.isConnectWithDatabase()).isTrue();
        assertThat(negotiated.isProtocol41()).isTrue();
    }

    @Test
    void unknownFlagsDropped() {
        assertThat(Capability.of(~0L)).isEqualTo(Capability.of(~0L & ((1L << 25) - 1)));
        assertThat(Capability.of(0).isMariaDb()).isTrue();
    }
}
