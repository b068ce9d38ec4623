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

import io.asyncer.mysql.wire.ConnectionContext;
import io.asyncer.mysql.wire.ProtocolFramingException;
import io.netty.buffer.ByteBuf;
import org.jetbrains.annotations.Nullable;

/**
 * Generic message decoder logic, decodes payloads reassembled by the framing layer.
 */
public final class ServerMessageDecoder {

    /**
     * Decodes a payload and releases it.
     *
     * @param buf           the payload of a logical packet.
     * @param context       the connection context.
     * @param decodeContext the decode context of current phase.
     * @return the message, or {@code null} if more payloads are needed.
     * @throws ProtocolFramingException if the payload is malformed.
     */
    @Nullable
    public ServerMessage decode(ByteBuf buf, ConnectionContext context, DecodeContext decodeContext) {
        try {
            if (!buf.isReadable()) {
                throw new ProtocolFramingException("Empty payload in " + decodeContext);
            }

            return decodeContext.decode(buf, context);
        } catch (IndexOutOfBoundsException e) {
            throw new ProtocolFramingException("Malformed payload in " + decodeContext, e);
        } finally {
            buf.release();
        }
    }
}
