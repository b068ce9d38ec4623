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

import io.asyncer.mysql.wire.TypeConversionException;
import io.asyncer.mysql.wire.api.MySqlColumnMetadata;
import io.asyncer.mysql.wire.message.FieldValue;
import io.netty.buffer.ByteBuf;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.asyncer.mysql.wire.internal.util.AssertUtils.requireNonNull;

/**
 * An implementation of {@link Codecs}.
 */
final class DefaultCodecs implements Codecs {

    static final DefaultCodecs INSTANCE = new DefaultCodecs(Collections.unmodifiableList(Arrays.asList(
        ByteCodec.INSTANCE,
        ShortCodec.INSTANCE,
        IntegerCodec.INSTANCE,
        LongCodec.INSTANCE,
        BigIntegerCodec.INSTANCE,

        BigDecimalCodec.INSTANCE,
        FloatCodec.INSTANCE,
        DoubleCodec.INSTANCE,

        BooleanCodec.INSTANCE,
        BitSetCodec.INSTANCE,

        LocalDateTimeCodec.INSTANCE,
        LocalDateCodec.INSTANCE,
        LocalTimeCodec.INSTANCE,
        YearCodec.INSTANCE,

        StringCodec.INSTANCE,
        ByteArrayCodec.INSTANCE
    )));

    private static final Map<Class<?>, Class<?>> BOXED = new HashMap<>();

    static {
        BOXED.put(Byte.TYPE, Byte.class);
        BOXED.put(Short.TYPE, Short.class);
        BOXED.put(Integer.TYPE, Integer.class);
        BOXED.put(Long.TYPE, Long.class);
        BOXED.put(Float.TYPE, Float.class);
        BOXED.put(Double.TYPE, Double.class);
        BOXED.put(Boolean.TYPE, Boolean.class);
    }

    private final List<Codec<?>> codecs;

    private final Map<Class<?>, Codec<?>> fastPath;

    private DefaultCodecs(List<Codec<?>> codecs) {
        Map<Class<?>, Codec<?>> fastPath = new HashMap<>();

        for (Codec<?> codec : codecs) {
            Class<?> mainClass = codec.getMainClass();

            if (mainClass != null) {
                fastPath.putIfAbsent(mainClass, codec);
            }
        }

        this.codecs = codecs;
        this.fastPath = fastPath;
    }

    /**
     * Note: this method should NEVER release the buffer of {@code value} because it is owned by the row which
     * will release it.
     */
    @SuppressWarnings("unchecked")
    @Override
    public <T> T decode(FieldValue value, MySqlColumnMetadata metadata, Class<?> type, boolean binary) {
        requireNonNull(value, "value must not be null");
        requireNonNull(metadata, "metadata must not be null");
        requireNonNull(type, "type must not be null");

        if (value.isNull()) {
            // T is always an object, so null should be returned even if the type is a primitive class.
            return null;
        }

        Class<?> target = chooseClass(metadata, type);
        Codec<?> codec = findDecoder(metadata, target);

        if (codec == null) {
            throw new TypeConversionException(metadata.getName(), type, metadata.getType());
        }

        ByteBuf buf = value.getBufferSlice();

        try {
            return (T) codec.decode(buf, metadata, target, binary);
        } catch (TypeConversionException e) {
            throw e;
        } catch (RuntimeException e) {
            // e.g. NumberFormatException, ArithmeticException, DateTimeException or a too short value.
            throw new TypeConversionException(metadata.getName(), type, metadata.getType(), e);
        }
    }

    @Override
    public MySqlParameter encode(Object value) {
        requireNonNull(value, "value must not be null");

        Codec<?> fast = fastPath.get(value.getClass());

        if (fast != null && fast.canEncode(value)) {
            return fast.encode(value);
        }

        for (Codec<?> codec : codecs) {
            if (codec.canEncode(value)) {
                return codec.encode(value);
            }
        }

        throw new IllegalArgumentException("Cannot encode " + value.getClass());
    }

    @Override
    public MySqlParameter encodeNull() {
        return NullMySqlParameter.INSTANCE;
    }

    private Codec<?> findDecoder(MySqlColumnMetadata metadata, Class<?> target) {
        Codec<?> fast = fastPath.get(target);

        if (fast != null && fast.canDecode(metadata, target)) {
            return fast;
        }

        for (Codec<?> codec : codecs) {
            if (codec.canDecode(metadata, target)) {
                return codec;
            }
        }

        return null;
    }

    private static Class<?> chooseClass(MySqlColumnMetadata metadata, Class<?> type) {
        Class<?> javaType = metadata.getJavaType();

        // e.g. Object or Number, use the default Java type of the column.
        if (type.isAssignableFrom(javaType)) {
            return javaType;
        }

        Class<?> boxed = BOXED.get(type);

        return boxed == null ? type : boxed;
    }
}
