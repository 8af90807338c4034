/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.inspector;

import java.util.HashMap;
import java.util.Map;

import dev.sapwood.descriptor.ColumnDescriptor;
import dev.sapwood.descriptor.DatasetDescriptor;
import dev.sapwood.descriptor.FieldDescriptor;

/**
 * Rolls column statistics up the field tree. Each field's totals are its own physical columns
 * plus the totals of its sub-fields, computed in postorder and stored once per field.
 */
final class FieldTreeAggregator {

    private final DatasetDescriptor descriptor;
    private final Map<Integer, ColumnInfo> columnInfos;
    private final Map<Integer, FieldTreeInfo> fieldTreeInfos = new HashMap<>();

    private FieldTreeAggregator(DatasetDescriptor descriptor, Map<Integer, ColumnInfo> columnInfos) {
        this.descriptor = descriptor;
        this.columnInfos = columnInfos;
    }

    /**
     * Aggregates the subtree of every field reachable from field zero.
     *
     * @return the totals by field id
     */
    static Map<Integer, FieldTreeInfo> aggregate(DatasetDescriptor descriptor, Map<Integer, ColumnInfo> columnInfos) {
        FieldTreeAggregator aggregator = new FieldTreeAggregator(descriptor, columnInfos);
        aggregator.collectFieldTreeInfo(descriptor.getFieldZeroId());
        return Map.copyOf(aggregator.fieldTreeInfos);
    }

    private FieldTreeInfo collectFieldTreeInfo(int fieldId) {
        FieldTreeInfo known = fieldTreeInfos.get(fieldId);
        if (known != null) {
            return known;
        }

        long onDiskSize = 0;
        long inMemorySize = 0;

        for (ColumnDescriptor column : descriptor.getColumns(fieldId)) {
            if (column.isAliasColumn()) {
                continue;
            }
            ColumnInfo columnInfo = columnInfos.get(column.physicalId());
            onDiskSize += columnInfo.onDiskSize();
            inMemorySize += columnInfo.inMemorySize();
        }

        for (FieldDescriptor subField : descriptor.getSubFields(fieldId)) {
            FieldTreeInfo subFieldInfo = collectFieldTreeInfo(subField.id());
            onDiskSize += subFieldInfo.onDiskSize();
            inMemorySize += subFieldInfo.inMemorySize();
        }

        FieldTreeInfo fieldTreeInfo = new FieldTreeInfo(descriptor.getFieldDescriptor(fieldId), onDiskSize, inMemorySize);
        fieldTreeInfos.put(fieldId, fieldTreeInfo);
        return fieldTreeInfo;
    }
}
