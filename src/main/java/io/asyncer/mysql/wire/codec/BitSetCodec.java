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

package io.asyncer.mysql.wire.codec;

import io.asyncer.mysql.wire.api.MySqlColumnMetadata;
import io.asyncer.mysql.wire.codec.LongCodec.LongMySqlParameter;
import io.asyncer.mysql.wire.constant.MySqlType;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;

import java.util.BitSet;

/**
 * Codec for {@link BitSet} of {@code BIT} columns.
 */
final class BitSetCodec extends AbstractClassedCodec<BitSet> {

    static final BitSetCodec INSTANCE = new BitSetCodec();

    private BitSetCodec() {
        super(BitSet.class);
    }

    @Override
    public BitSet decode(ByteBuf value, MySqlColumnMetadata metadata, Class<?> target, boolean binary) {
        if (!value.isReadable()) {
            return new BitSet();
        }

        // Result with big-endian, BitSet is using little-endian, need reverse.
        return BitSet.valueOf(reverse(ByteBufUtil.getBytes(value)));
    }

    @Override
    public boolean canEncode(Object value) {
        return value instanceof BitSet;
    }

    @Override
    public MySqlParameter encode(Object value) {
        long[] array = ((BitSet) value).toLongArray();

        // The max precision of BIT is 64, so just use the first long.
        long bits = array.length == 0 ? 0 : array[0];

        return bits < 0 ? new LongMySqlParameter(bits, true) : LongCodec.encodeLong(bits);
    }

    @Override
    protected boolean doCanDecode(MySqlColumnMetadata metadata) {
        return metadata.getType() == MySqlType.BIT;
    }

    private static byte[] reverse(byte[] bytes) {
        int maxIndex = bytes.length - 1;
        int half = bytes.length >>> 1;

        for (int i = 0; i < half; ++i) {
            byte b = bytes[i];
            bytes[i] = bytes[maxIndex - i];
            bytes[maxIndex - i] = b;
        }

        return bytes;
    }
}
