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
 * A column of the dataset. Physical columns own their storage and have equal logical and
 * physical ids; alias columns carry a logical id of their own and point to the physical
 * column whose storage they share.
 *
 * @param index position of the column among the columns of its field
 */
public record ColumnDescriptor(int logicalId, int physicalId, int fieldId, PhysicalType type, int index) {

    public boolean isAliasColumn() {
        return logicalId != physicalId;
    }
}
