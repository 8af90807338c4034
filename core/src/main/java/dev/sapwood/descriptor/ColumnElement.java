/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.descriptor;

import dev.sapwood.metadata.PhysicalType;

/**
 * Sizes of the default in-memory representation of column elements.
 */
public final class ColumnElement {

    private ColumnElement() {
        // Utility class
    }

    /**
     * Returns the number of bytes one element of the given type occupies in memory.
     * Byte arrays are held as references to their values, so they count as one reference.
     */
    public static int sizeOf(PhysicalType type) {
        return switch (type) {
            case BOOLEAN -> 1;
            case INT32, FLOAT -> 4;
            case INT64, DOUBLE -> 8;
            case INT96 -> 12;
            case BYTE_ARRAY, FIXED_LEN_BYTE_ARRAY -> 8;
        };
    }
}
