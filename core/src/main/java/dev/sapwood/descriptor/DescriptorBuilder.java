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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import dev.sapwood.metadata.PhysicalType;

/**
 * Assembles a {@link DatasetDescriptor}. Field zero (id 0, empty name and type) is created
 * up front; every other field hangs below it.
 *
 * <pre>{@code
 * DescriptorBuilder builder = DescriptorBuilder.create("events");
 * builder.addField(1, 0, "pt", "float");
 * builder.addColumn(0, 1, PhysicalType.FLOAT);
 * builder.addCluster(0, 0, 1000)
 *         .addColumnRange(0, 0, 1000, 1)
 *         .addPage(0, 1000, 2412);
 * DatasetDescriptor descriptor = builder.build();
 * }</pre>
 *
 * {@link #build()} validates the structure and rejects inconsistent input with an
 * {@link IllegalArgumentException}.
 */
public final class DescriptorBuilder {

    private static final int FIELD_ZERO_ID = 0;

    private final String name;
    private final Map<Integer, PendingField> fields = new TreeMap<>();
    private final Map<Integer, PendingColumn> columns = new TreeMap<>();
    private final List<ClusterBuilder> clusters = new ArrayList<>();

    private DescriptorBuilder(String name) {
        this.name = name;
        fields.put(FIELD_ZERO_ID, new PendingField(FIELD_ZERO_ID, DatasetDescriptor.INVALID_ID, "", ""));
    }

    public static DescriptorBuilder create(String datasetName) {
        if (datasetName == null) {
            throw new IllegalArgumentException("Dataset name must not be null");
        }
        return new DescriptorBuilder(datasetName);
    }

    public DescriptorBuilder addField(int fieldId, int parentId, String fieldName, String typeName) {
        if (fields.containsKey(fieldId)) {
            throw new IllegalArgumentException("Duplicate field ID " + fieldId);
        }
        if (fieldName == null || fieldName.isEmpty() || typeName == null) {
            throw new IllegalArgumentException("Field " + fieldId + " needs a name and a type name");
        }
        fields.put(fieldId, new PendingField(fieldId, parentId, fieldName, typeName));
        return this;
    }

    /**
     * Adds a physical column; its logical and physical ids are the same.
     */
    public DescriptorBuilder addColumn(int columnId, int fieldId, PhysicalType type) {
        return addColumn(columnId, columnId, fieldId, type);
    }

    /**
     * Adds a column that shares the storage of physical column {@code physicalId}.
     */
    public DescriptorBuilder addAliasColumn(int logicalId, int physicalId, int fieldId, PhysicalType type) {
        if (logicalId == physicalId) {
            throw new IllegalArgumentException("Alias column " + logicalId + " must not point to itself");
        }
        return addColumn(logicalId, physicalId, fieldId, type);
    }

    private DescriptorBuilder addColumn(int logicalId, int physicalId, int fieldId, PhysicalType type) {
        if (type == null) {
            throw new IllegalArgumentException("Column " + logicalId + " has no type");
        }
        if (columns.containsKey(logicalId)) {
            throw new IllegalArgumentException("Duplicate column ID " + logicalId);
        }
        columns.put(logicalId, new PendingColumn(logicalId, physicalId, fieldId, type));
        return this;
    }

    public ClusterBuilder addCluster(int clusterId, long firstEntryIndex, long entryCount) {
        ClusterBuilder cluster = new ClusterBuilder(clusterId, firstEntryIndex, entryCount);
        clusters.add(cluster);
        return cluster;
    }

    public DatasetDescriptor build() {
        checkContiguous(fields.keySet(), "field");
        checkContiguous(columns.keySet(), "column");

        Map<Integer, List<Integer>> subFieldIds = new HashMap<>();
        Map<Integer, Set<String>> siblingNames = new HashMap<>();
        for (PendingField field : fields.values()) {
            if (field.id == FIELD_ZERO_ID) {
                continue;
            }
            if (field.parentId == field.id || !fields.containsKey(field.parentId)) {
                throw new IllegalArgumentException("Field " + field.id + " has unknown parent " + field.parentId);
            }
            if (!siblingNames.computeIfAbsent(field.parentId, k -> new HashSet<>()).add(field.fieldName)) {
                throw new IllegalArgumentException("Duplicate field name '" + field.fieldName + "' below field " + field.parentId);
            }
            subFieldIds.computeIfAbsent(field.parentId, k -> new ArrayList<>()).add(field.id);
        }
        checkReachable(subFieldIds);

        int physicalCount = 0;
        for (PendingColumn column : columns.values()) {
            if (column.logicalId == column.physicalId) {
                physicalCount++;
            }
        }

        Map<Integer, List<Integer>> columnIdsByField = new HashMap<>();
        List<ColumnDescriptor> columnDescriptors = new ArrayList<>(columns.size());
        for (PendingColumn column : columns.values()) {
            boolean alias = column.logicalId != column.physicalId;
            if (!alias && column.logicalId >= physicalCount) {
                throw new IllegalArgumentException("Physical column " + column.logicalId
                        + " must have an ID below the first alias column");
            }
            if (alias) {
                PendingColumn target = columns.get(column.physicalId);
                if (target == null || target.logicalId != target.physicalId) {
                    throw new IllegalArgumentException("Alias column " + column.logicalId
                            + " points to unknown physical column " + column.physicalId);
                }
            }
            if (!fields.containsKey(column.fieldId)) {
                throw new IllegalArgumentException("Column " + column.logicalId + " has unknown field " + column.fieldId);
            }
            List<Integer> fieldColumns = columnIdsByField.computeIfAbsent(column.fieldId, k -> new ArrayList<>());
            columnDescriptors.add(new ColumnDescriptor(column.logicalId, column.physicalId, column.fieldId,
                    column.type, fieldColumns.size()));
            fieldColumns.add(column.logicalId);
        }

        List<FieldDescriptor> fieldDescriptors = new ArrayList<>(fields.size());
        for (PendingField field : fields.values()) {
            fieldDescriptors.add(new FieldDescriptor(field.id, field.parentId, field.fieldName, field.typeName,
                    subFieldIds.getOrDefault(field.id, List.of()),
                    columnIdsByField.getOrDefault(field.id, List.of())));
        }

        Set<Integer> clusterIds = new HashSet<>();
        List<ClusterDescriptor> clusterDescriptors = new ArrayList<>(clusters.size());
        for (ClusterBuilder cluster : clusters) {
            if (!clusterIds.add(cluster.id)) {
                throw new IllegalArgumentException("Duplicate cluster ID " + cluster.id);
            }
            clusterDescriptors.add(cluster.build(physicalCount));
        }
        clusterDescriptors.sort((a, b) -> Integer.compare(a.id(), b.id()));

        return new DatasetDescriptor(name, fieldDescriptors, columnDescriptors, clusterDescriptors, FIELD_ZERO_ID);
    }

    private static void checkContiguous(Set<Integer> ids, String kind) {
        int expected = 0;
        for (int id : ids) {
            if (id != expected) {
                throw new IllegalArgumentException("Missing " + kind + " ID " + expected
                        + ": " + kind + " IDs must be contiguous from 0");
            }
            expected++;
        }
    }

    // A parent chain that never reaches field zero is a cycle
    private void checkReachable(Map<Integer, List<Integer>> subFieldIds) {
        Set<Integer> reached = new HashSet<>();
        List<Integer> worklist = new ArrayList<>();
        worklist.add(FIELD_ZERO_ID);
        while (!worklist.isEmpty()) {
            int fieldId = worklist.remove(worklist.size() - 1);
            if (reached.add(fieldId)) {
                worklist.addAll(subFieldIds.getOrDefault(fieldId, List.of()));
            }
        }
        if (reached.size() != fields.size()) {
            throw new IllegalArgumentException("Field tree has fields not reachable from field zero");
        }
    }

    /**
     * Collects the column ranges and pages of one cluster.
     */
    public static final class ClusterBuilder {

        private final int id;
        private final long firstEntryIndex;
        private final long entryCount;
        private final Map<Integer, ColumnRange> columnRanges = new LinkedHashMap<>();
        private final Map<Integer, List<PageInfo>> pages = new LinkedHashMap<>();
        private long nextPagePosition;

        private ClusterBuilder(int id, long firstEntryIndex, long entryCount) {
            this.id = id;
            this.firstEntryIndex = firstEntryIndex;
            this.entryCount = entryCount;
        }

        public ClusterBuilder addColumnRange(int physicalColumnId, long firstElementIndex, long elementCount,
                                             int compressionSettings) {
            if (columnRanges.containsKey(physicalColumnId)) {
                throw new IllegalArgumentException("Cluster " + id + " already has a range for column " + physicalColumnId);
            }
            columnRanges.put(physicalColumnId,
                    new ColumnRange(physicalColumnId, firstElementIndex, elementCount, compressionSettings));
            return this;
        }

        /**
         * Adds a page placed directly after the previously added page of this cluster.
         */
        public ClusterBuilder addPage(int physicalColumnId, long elementCount, long bytesOnStorage) {
            PageInfo page = new PageInfo(elementCount, new Locator(nextPagePosition, bytesOnStorage));
            nextPagePosition += bytesOnStorage;
            return addPage(physicalColumnId, page);
        }

        public ClusterBuilder addPage(int physicalColumnId, PageInfo page) {
            pages.computeIfAbsent(physicalColumnId, k -> new ArrayList<>()).add(page);
            return this;
        }

        private ClusterDescriptor build(int physicalColumnCount) {
            for (int columnId : columnRanges.keySet()) {
                if (columnId < 0 || columnId >= physicalColumnCount) {
                    throw new IllegalArgumentException("Cluster " + id + " references unknown physical column " + columnId);
                }
            }
            Map<Integer, PageRange> pageRanges = new HashMap<>();
            for (Map.Entry<Integer, List<PageInfo>> entry : pages.entrySet()) {
                if (!columnRanges.containsKey(entry.getKey())) {
                    throw new IllegalArgumentException("Cluster " + id + " has pages for column " + entry.getKey()
                            + " without a column range");
                }
                pageRanges.put(entry.getKey(), new PageRange(entry.getKey(), entry.getValue()));
            }
            for (ColumnRange range : columnRanges.values()) {
                long pageElements = 0;
                for (PageInfo page : pages.getOrDefault(range.physicalColumnId(), List.of())) {
                    pageElements += page.elementCount();
                }
                if (pageElements != range.elementCount()) {
                    throw new IllegalArgumentException("Cluster " + id + " declares " + range.elementCount()
                            + " elements for column " + range.physicalColumnId() + " but its pages hold " + pageElements);
                }
            }
            return new ClusterDescriptor(id, firstEntryIndex, entryCount, columnRanges, pageRanges);
        }
    }

    private record PendingField(int id, int parentId, String fieldName, String typeName) {
    }

    private record PendingColumn(int logicalId, int physicalId, int fieldId, PhysicalType type) {
    }
}
