/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.descriptor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable description of a dataset's schema and storage layout: the field tree, the columns
 * and the clusters with their per-column element ranges and pages.
 * <p>
 * Fields are addressed by id in {@code [0, getFieldCount())}, columns by logical id in
 * {@code [0, getColumnCount())}. Physical columns come first, so physical ids are
 * {@code [0, getPhysicalColumnCount())}.
 * </p>
 * <p>
 * Instances are created with {@link DescriptorBuilder}.
 * </p>
 */
public final class DatasetDescriptor {

    /**
     * Parent id of field zero, and the result of a failed field lookup.
     */
    public static final int INVALID_ID = -1;

    private final String name;
    private final List<FieldDescriptor> fields;
    private final List<ColumnDescriptor> columns;
    private final List<ClusterDescriptor> clusters;
    private final int fieldZeroId;
    private final int physicalColumnCount;
    private final Map<String, Integer> fieldIdsByQualifiedName;

    DatasetDescriptor(String name, List<FieldDescriptor> fields, List<ColumnDescriptor> columns,
                      List<ClusterDescriptor> clusters, int fieldZeroId) {
        this.name = name;
        this.fields = List.copyOf(fields);
        this.columns = List.copyOf(columns);
        this.clusters = List.copyOf(clusters);
        this.fieldZeroId = fieldZeroId;

        int physical = 0;
        for (ColumnDescriptor column : this.columns) {
            if (!column.isAliasColumn()) {
                physical++;
            }
        }
        this.physicalColumnCount = physical;

        this.fieldIdsByQualifiedName = new HashMap<>();
        for (FieldDescriptor field : this.fields) {
            if (field.id() != fieldZeroId) {
                fieldIdsByQualifiedName.put(qualifiedName(field), field.id());
            }
        }
    }

    /**
     * Returns an independent copy of this descriptor.
     */
    public DatasetDescriptor copy() {
        List<FieldDescriptor> fieldCopies = new ArrayList<>(fields.size());
        for (FieldDescriptor field : fields) {
            fieldCopies.add(new FieldDescriptor(field.id(), field.parentId(), field.fieldName(), field.typeName(),
                    field.subFieldIds(), field.logicalColumnIds()));
        }
        List<ClusterDescriptor> clusterCopies = new ArrayList<>(clusters.size());
        for (ClusterDescriptor cluster : clusters) {
            clusterCopies.add(new ClusterDescriptor(cluster.id(), cluster.firstEntryIndex(), cluster.entryCount(),
                    cluster.columnRanges(), cluster.pageRanges()));
        }
        return new DatasetDescriptor(name, fieldCopies, new ArrayList<>(columns), clusterCopies, fieldZeroId);
    }

    public String getName() {
        return name;
    }

    public int getFieldZeroId() {
        return fieldZeroId;
    }

    public int getFieldCount() {
        return fields.size();
    }

    /**
     * Number of columns, alias columns included.
     */
    public int getColumnCount() {
        return columns.size();
    }

    public int getPhysicalColumnCount() {
        return physicalColumnCount;
    }

    public int getClusterCount() {
        return clusters.size();
    }

    public List<ClusterDescriptor> getClusters() {
        return clusters;
    }

    public long getEntryCount() {
        long entries = 0;
        for (ClusterDescriptor cluster : clusters) {
            entries += cluster.entryCount();
        }
        return entries;
    }

    public FieldDescriptor getFieldDescriptor(int fieldId) {
        if (fieldId < 0 || fieldId >= fields.size()) {
            throw new IllegalArgumentException("No field with ID " + fieldId + " present");
        }
        return fields.get(fieldId);
    }

    public ColumnDescriptor getColumnDescriptor(int logicalColumnId) {
        if (logicalColumnId < 0 || logicalColumnId >= columns.size()) {
            throw new IllegalArgumentException("No column with ID " + logicalColumnId + " present");
        }
        return columns.get(logicalColumnId);
    }

    /**
     * Returns the columns directly owned by the given field, alias columns included.
     */
    public List<ColumnDescriptor> getColumns(int fieldId) {
        List<Integer> columnIds = getFieldDescriptor(fieldId).logicalColumnIds();
        List<ColumnDescriptor> result = new ArrayList<>(columnIds.size());
        for (int columnId : columnIds) {
            result.add(columns.get(columnId));
        }
        return result;
    }

    /**
     * Returns the direct sub-fields of the given field.
     */
    public List<FieldDescriptor> getSubFields(int fieldId) {
        List<Integer> subFieldIds = getFieldDescriptor(fieldId).subFieldIds();
        List<FieldDescriptor> result = new ArrayList<>(subFieldIds.size());
        for (int subFieldId : subFieldIds) {
            result.add(fields.get(subFieldId));
        }
        return result;
    }

    /**
     * Finds a field by its qualified name, the dot-separated names from the top-level field
     * down, e.g. {@code "address.city"}. A top-level field's qualified name is its own name.
     *
     * @return the field id, or {@link #INVALID_ID} if there is no such field
     */
    public int findFieldId(String qualifiedName) {
        Integer id = fieldIdsByQualifiedName.get(qualifiedName);
        return id != null ? id : INVALID_ID;
    }

    /**
     * Finds a direct sub-field of the given parent by name.
     *
     * @return the field id, or {@link #INVALID_ID} if there is no such field
     */
    public int findFieldId(String fieldName, int parentId) {
        for (int subFieldId : getFieldDescriptor(parentId).subFieldIds()) {
            if (fields.get(subFieldId).fieldName().equals(fieldName)) {
                return subFieldId;
            }
        }
        return INVALID_ID;
    }

    public String getQualifiedFieldName(int fieldId) {
        FieldDescriptor field = getFieldDescriptor(fieldId);
        return field.id() == fieldZeroId ? "" : qualifiedName(field);
    }

    private String qualifiedName(FieldDescriptor field) {
        StringBuilder sb = new StringBuilder(field.fieldName());
        int parentId = field.parentId();
        while (parentId != fieldZeroId && parentId != INVALID_ID) {
            FieldDescriptor parent = fields.get(parentId);
            sb.insert(0, '.').insert(0, parent.fieldName());
            parentId = parent.parentId();
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "DatasetDescriptor[name=" + name + ", fields=" + fields.size() + ", columns=" + columns.size()
                + ", physicalColumns=" + physicalColumnCount + ", clusters=" + clusters.size() + "]";
    }
}
