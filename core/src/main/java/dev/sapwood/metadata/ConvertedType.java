/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.metadata;

/**
 * Legacy type annotations. Only consulted when a schema element carries no logical type.
 */
public enum ConvertedType {
    UTF8,
    MAP,
    MAP_KEY_VALUE,
    LIST,
    ENUM,
    DECIMAL,
    DATE,
    TIME_MILLIS,
    TIME_MICROS,
    TIMESTAMP_MILLIS,
    TIMESTAMP_MICROS,
    UINT_8,
    UINT_16,
    UINT_32,
    UINT_64,
    INT_8,
    INT_16,
    INT_32,
    INT_64,
    JSON,
    BSON,
    INTERVAL;

    /**
     * @return the converted type, or null for values this reader does not know
     */
    public static ConvertedType fromThriftValue(int value) {
        ConvertedType[] types = values();
        return value >= 0 && value < types.length ? types[value] : null;
    }
}
