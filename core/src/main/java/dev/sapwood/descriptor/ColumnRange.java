/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.descriptor;

/**
 * Element range and compression setting of one physical column within one cluster.
 */
public record ColumnRange(int physicalColumnId, long firstElementIndex, long elementCount, int compressionSettings) {

    public ColumnRange {
        if (elementCount < 0) {
            throw new IllegalArgumentException("Negative element count: " + elementCount);
        }
    }
}
