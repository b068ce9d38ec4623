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

import io.asyncer.mysql.wire.api.MySqlColumnMetadata;
import io.asyncer.mysql.wire.constant.ColumnDefinitions;
import io.asyncer.mysql.wire.constant.MySqlType;
import io.asyncer.mysql.wire.message.server.DefinitionMetadataMessage;
import io.r2dbc.spi.Nullability;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

/**
 * Unit tests for {@link MySqlRowDescriptor} and {@link MySqlColumnDescriptor}.
 */
class MySqlRowDescriptorTest {

    private final MySqlRowDescriptor descriptor = MySqlRowDescriptor.create(new DefinitionMetadataMessage[] {
        DefinitionMetadataMessage.synthetic("id", MySqlType.BIGINT,
            (short) (ColumnDefinitions.NOT_NULL | ColumnDefinitions.UNSIGNED)),
        DefinitionMetadataMessage.synthetic("Name", MySqlType.VARCHAR, (short) 0),
        DefinitionMetadataMessage.synthetic("name", MySqlType.INT, (short) 0),
    });

    @Test
    void lookupByName() {
        assertThat(descriptor.getColumnCount()).isEqualTo(3);
        assertThat(descriptor.contains("ID")).isTrue();
        assertThat(descriptor.contains("missing")).isFalse();
        // The first column wins if names are duplicated.
        assertThat(descriptor.indexOf("NAME")).isOne();
        assertThat(descriptor.getColumnMetadata("name").getType()).isEqualTo(MySqlType.VARCHAR);
        assertThatExceptionOfType(NoSuchElementException.class).isThrownBy(() -> descriptor.indexOf("missing"));
    }

    @Test
    void lookupByIndex() {
        assertThat(descriptor.getColumnMetadata(2).getName()).isEqualTo("name");
        assertThat(descriptor.getTypes()).containsExactly(MySqlType.BIGINT, MySqlType.VARCHAR, MySqlType.INT);
        assertThatExceptionOfType(IndexOutOfBoundsException.class)
            .isThrownBy(() -> descriptor.getColumnMetadata(3))
            .withMessage("Column index 3 is out of range [0, 3)");
        assertThatExceptionOfType(IndexOutOfBoundsException.class)
            .isThrownBy(() -> descriptor.getColumnMetadata(-1));
    }

    @Test
    void columnDetails() {
        MySqlColumnMetadata id = descriptor.getColumnMetadata(0);

        assertThat(id.getIndex()).isZero();
        assertThat(id.isUnsigned()).isTrue();
        assertThat(id.isBinary()).isTrue();
        assertThat(id.getJavaType()).isEqualTo(BigInteger.class);
        assertThat(id.getNullability()).isEqualTo(Nullability.NON_NULL);
        assertThat(id.getPrecision()).isEqualTo(20);
        assertThat(id.getScale()).isNull();

        MySqlColumnMetadata name = descriptor.getColumnMetadata(1);

        assertThat(name.getNullability()).isEqualTo(Nullability.NULLABLE);
        // Synthetic columns use the binary collation.
        assertThat(name.getJavaType()).isEqualTo(byte[].class);
    }
}
