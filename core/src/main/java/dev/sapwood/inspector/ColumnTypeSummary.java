/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.inspector;

import dev.sapwood.metadata.PhysicalType;

/**
 * Statistics of all physical columns sharing a type.
 */
public record ColumnTypeSummary(PhysicalType type, int columnCount, long elementCount, long onDiskSize,
                                long inMemorySize) {

    ColumnTypeSummary add(ColumnInfo column) {
        return new ColumnTypeSummary(type, columnCount + 1, elementCount + column.elementCount(),
                onDiskSize + column.onDiskSize(), inMemorySize + column.inMemorySize());
    }
}
