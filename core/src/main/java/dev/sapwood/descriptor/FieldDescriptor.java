/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.descriptor;

import java.util.List;

/**
 * A node of the schema tree.
 *
 * @param parentId {@link DatasetDescriptor#INVALID_ID} for field zero
 * @param subFieldIds ids of the direct sub-fields, in declaration order
 * @param logicalColumnIds logical ids of the columns directly owned by this field, aliases included
 */
public record FieldDescriptor(
        int id,
        int parentId,
        String fieldName,
        String typeName,
        List<Integer> subFieldIds,
        List<Integer> logicalColumnIds) {

    public FieldDescriptor {
        subFieldIds = List.copyOf(subFieldIds);
        logicalColumnIds = List.copyOf(logicalColumnIds);
    }
}
