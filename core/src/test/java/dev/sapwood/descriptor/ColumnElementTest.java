/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.descriptor;

import org.junit.jupiter.api.Test;

import dev.sapwood.metadata.PhysicalType;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnElementTest {

    @Test
    void testElementSizes() {
        assertThat(ColumnElement.sizeOf(PhysicalType.BOOLEAN)).isEqualTo(1);
        assertThat(ColumnElement.sizeOf(PhysicalType.INT32)).isEqualTo(4);
        assertThat(ColumnElement.sizeOf(PhysicalType.FLOAT)).isEqualTo(4);
        assertThat(ColumnElement.sizeOf(PhysicalType.INT64)).isEqualTo(8);
        assertThat(ColumnElement.sizeOf(PhysicalType.DOUBLE)).isEqualTo(8);
        assertThat(ColumnElement.sizeOf(PhysicalType.INT96)).isEqualTo(12);
        assertThat(ColumnElement.sizeOf(PhysicalType.BYTE_ARRAY)).isEqualTo(8);
        assertThat(ColumnElement.sizeOf(PhysicalType.FIXED_LEN_BYTE_ARRAY)).isEqualTo(8);
    }
}
