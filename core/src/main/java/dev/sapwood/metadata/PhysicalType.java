/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.metadata;

/**
 * Physical storage types of Parquet leaf columns. Used as the column type tag of the descriptor.
 */
public enum PhysicalType {
    BOOLEAN(0),
    INT32(1),
    INT64(2),
    INT96(3),
    FLOAT(4),
    DOUBLE(5),
    BYTE_ARRAY(6),
    FIXED_LEN_BYTE_ARRAY(7);

    private static final PhysicalType[] BY_THRIFT_VALUE = values();

    private final int thriftValue;

    PhysicalType(int thriftValue) {
        this.thriftValue = thriftValue;
    }

    public int thriftValue() {
        return thriftValue;
    }

    public static PhysicalType fromThriftValue(int value) {
        if (value < 0 || value >= BY_THRIFT_VALUE.length) {
            throw new IllegalArgumentException("Unknown physical type: " + value);
        }
        return BY_THRIFT_VALUE[value];
    }
}
