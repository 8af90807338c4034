/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.reader;

import java.util.Locale;

import dev.sapwood.metadata.ConvertedType;
import dev.sapwood.metadata.SchemaElement;

/**
 * Derives the type name reported for a field from its schema element.
 */
public final class FieldTypeNames {

    private FieldTypeNames() {
        // Utility class
    }

    public static String of(SchemaElement element) {
        if (element.isGroup()) {
            if (element.convertedType() == ConvertedType.LIST) {
                return "list";
            }
            if (element.convertedType() == ConvertedType.MAP || element.convertedType() == ConvertedType.MAP_KEY_VALUE) {
                return "map";
            }
            return element.logicalType() != null ? element.logicalType().typeName() : "struct";
        }

        if (element.logicalType() != null) {
            return element.logicalType().typeName();
        }
        if (element.convertedType() != null) {
            return element.convertedType() == ConvertedType.UTF8
                    ? "string"
                    : element.convertedType().name().toLowerCase(Locale.ROOT);
        }
        return switch (element.type()) {
            case BYTE_ARRAY -> "binary";
            case FIXED_LEN_BYTE_ARRAY -> "fixed_len_byte_array(" + element.typeLength() + ")";
            default -> element.type().name().toLowerCase(Locale.ROOT);
        };
    }
}
