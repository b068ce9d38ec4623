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
import io.asyncer.mysql.wire.codec.ShortCodec.ShortMySqlParameter;
import io.asyncer.mysql.wire.constant.MySqlType;
import io.netty.buffer.ByteBuf;

import java.time.Year;

/**
 * Codec for {@link Year}, reading YEAR(4) columns as a small integer in either protocol.
 */
final class YearCodec extends AbstractClassedCodec<Year> {

    static final YearCodec INSTANCE = new YearCodec();

    private YearCodec() {
        super(Year.class);
    }

    @Override
    protected boolean doCanDecode(MySqlColumnMetadata metadata) {
        return MySqlType.YEAR == metadata.getType();
    }

    @Override
    public Year decode(ByteBuf value, MySqlColumnMetadata metadata, Class<?> target, boolean binary) {
        Number number = CodecUtils.decodeNumber(value, metadata, binary);
        long checked = CodecUtils.rangeCheck(number.longValue(), Year.MIN_VALUE, Year.MAX_VALUE);

        return Year.of((int) checked);
    }

    @Override
    public boolean canEncode(Object value) {
        return value instanceof Year;
    }

    @Override
    public MySqlParameter encode(Object value) {
        int year = ((Year) value).getValue();

        // Years outside SMALLINT go out as a wider integer and the server rejects them.
        return year >= Short.MIN_VALUE && year <= Short.MAX_VALUE ?
            new ShortMySqlParameter((short) year) : LongCodec.encodeLong(year);
    }
}
