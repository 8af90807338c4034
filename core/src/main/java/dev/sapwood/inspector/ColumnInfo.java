/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.inspector;

import dev.sapwood.descriptor.ColumnDescriptor;
import dev.sapwood.metadata.PhysicalType;

/**
 * Storage statistics of one physical column, summed over all clusters.
 *
 * @param onDiskSize bytes on storage of all pages of the column
 * @param elementSize bytes per element in the default in-memory representation
 * @param elementCount number of elements over all clusters
 */
public record ColumnInfo(ColumnDescriptor descriptor, long onDiskSize, int elementSize, long elementCount) {

    public long inMemorySize() {
        return elementCount * elementSize;
    }

    public PhysicalType type() {
        return descriptor.type();
    }
}
