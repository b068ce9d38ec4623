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

package io.asyncer.mysql.wire.internal.util;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.CompositeByteBuf;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.ReferenceCounted;

import java.nio.charset.Charset;
import java.util.List;

/**
 * An internal utility considers the use of safe release buffers and the {@code NUL}-terminated strings of
 * the protocol. It uses standard netty {@link ReferenceCountUtil#safeRelease} to suppress release errors.
 */
public final class NettyBufferUtils {

    private static final byte TERMINAL = 0;

    /**
     * Reads a {@code NUL}-terminated string. The terminal is consumed and not a part of the result.
     * <p>
     * If no terminal found, all remaining bytes are the string. Some servers omit the terminal of the last
     * field of a handshake.
     *
     * @param buf     the buffer.
     * @param charset the charset of the string.
     * @return the string.
     */
    public static String readCString(ByteBuf buf, Charset charset) {
        int start = buf.readerIndex();
        int end = buf.indexOf(start, buf.writerIndex(), TERMINAL);

        if (end < 0) {
            String result = buf.toString(charset);
            buf.skipBytes(buf.readableBytes());
            return result;
        }

        String result = buf.toString(start, end - start, charset);
        buf.readerIndex(end + 1);

        return result;
    }

    /**
     * Writes a {@code NUL}-terminated string.
     *
     * @param buf     the buffer.
     * @param value   the string.
     * @param charset the charset of the string.
     */
    public static void writeCString(ByteBuf buf, CharSequence value, Charset charset) {
        buf.writeCharSequence(value, charset);
        buf.writeByte(TERMINAL);
    }

    /**
     * Combine {@link ByteBuf}s through composite buffer.
     * <p>
     * This method would release all {@link ByteBuf}s when any exception throws.
     *
     * @param parts The {@link ByteBuf}s want to be wrap, it can not be empty, and it will be cleared.
     * @return A {@link ByteBuf} holds the all bytes of given {@code parts}, it may be a read-only buffer.
     */
    public static ByteBuf composite(final List<ByteBuf> parts) {
        final int size = parts.size();

        switch (size) {
            case 0:
                throw new IllegalStateException("No buffer available");
            case 1:
                try {
                    return parts.get(0);
                } finally {
                    parts.clear();
                }
            default:
                CompositeByteBuf composite = null;

                try {
                    composite = parts.get(0).alloc().compositeBuffer(size);
                    // Auto-releasing failed parts
                    return composite.addComponents(true, parts);
                } catch (Throwable e) {
                    if (composite == null) {
                        // Alloc failed, release parts.
                        releaseAll(parts);
                    } else {
                        // Also release success parts.
                        composite.release();
                    }
                    throw e;
                } finally {
                    parts.clear();
                }
        }
    }

    public static void releaseAll(List<? extends ReferenceCounted> parts) {
        for (ReferenceCounted counted : parts) {
            if (counted != null) {
                ReferenceCountUtil.safeRelease(counted);
            }
        }
    }

    private NettyBufferUtils() { }
}
