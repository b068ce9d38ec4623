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

import io.netty.channel.ChannelOption;
import reactor.netty.tcp.TcpClient;

import java.util.Objects;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * A socket option with its value, applied to the TCP client before connecting.
 *
 * @param <T> the type of the option value.
 */
public final class SocketOptionValue<T> {

    private final ChannelOption<T> option;

    private final T value;

    private SocketOptionValue(ChannelOption<T> option, T value) {
        this.option = option;
        this.value = value;
    }

    public ChannelOption<T> getOption() {
        return option;
    }

    public T getValue() {
        return value;
    }

    TcpClient applyTo(TcpClient client) {
        return client.option(option, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SocketOptionValue)) {
            return false;
        }

        SocketOptionValue<?> that = (SocketOptionValue<?>) o;

        return option.equals(that.option) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(option, value);
    }

    @Override
    public String toString() {
        return option.name() + '=' + value;
    }

    /**
     * Creates a socket option value.
     *
     * @param option the option, e.g. {@link ChannelOption#TCP_NODELAY}.
     * @param value  the value.
     * @param <T>    the type of the option value.
     * @return the socket option value.
     * @throws IllegalArgumentException if {@code option} or {@code value} is {@code null}.
     */
    public static <T> SocketOptionValue<T> of(ChannelOption<T> option, T value) {
        requireNonNull(option, "option must not be null");
        requireNonNull(value, "value must not be null");

        return new SocketOptionValue<>(option, value);
    }
}
