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
import io.asyncer.mysql.wire.codec.ByteCodec.ByteMySqlParameter;
import io.asyncer.mysql.wire.constant.MySqlType;
import io.netty.buffer.ByteBuf;

import java.math.BigDecimal;

/**
 * Codec for {@link Boolean}. {@code BIT} is {@code true} if any bit is set, numbers are {@code true} if not
 * zero.
 */
final class BooleanCodec extends AbstractClassedCodec<Boolean> {

    static final BooleanCodec INSTANCE = new BooleanCodec();

    private static final MySqlParameter TRUE = new ByteMySqlParameter((byte) 1);

    private static final MySqlParameter FALSE = new ByteMySqlParameter((byte) 0);

    private BooleanCodec() {
        super(Boolean.class);
    }

    @Override
    public Boolean decode(ByteBuf value, MySqlColumnMetadata metadata, Class<?> target, boolean binary) {
        if (metadata.getType() == MySqlType.BIT) {
            while (value.isReadable()) {
                if (value.readByte() != 0) {
                    return true;
                }
            }

            return false;
        }

        Number number = CodecUtils.decodeNumber(value, metadata, binary);

        if (number instanceof BigDecimal) {
            return ((BigDecimal) number).signum() != 0;
        }

        return number.doubleValue() != 0;
    }

    @Override
    public boolean canEncode(Object value) {
        return value instanceof Boolean;
    }

    @Override
    public MySqlParameter encode(Object value) {
        return (Boolean) value ? TRUE : FALSE;
    }

    @Override
    protected boolean doCanDecode(MySqlColumnMetadata metadata) {
        MySqlType type = metadata.getType();

        return type == MySqlType.BIT || type.isNumeric();
    }
}
