/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.reader;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import dev.sapwood.descriptor.DatasetDescriptor;
import dev.sapwood.descriptor.DescriptorBuilder;
import dev.sapwood.descriptor.PageInfo;
import dev.sapwood.metadata.ColumnChunk;
import dev.sapwood.metadata.ColumnMetaData;
import dev.sapwood.metadata.FileMetaData;
import dev.sapwood.metadata.PhysicalType;
import dev.sapwood.metadata.RowGroup;
import dev.sapwood.metadata.SchemaElement;

/**
 * Builds a {@link DatasetDescriptor} from the metadata of a Parquet file.
 * <p>
 * Schema elements become fields, with the schema element index as field id and the root
 * element as field zero. Leaf elements own one physical column each, numbered in schema order,
 * which is also the order of column chunks within a row group. Row groups become clusters and
 * their column chunks the column ranges, with the codec as compression setting.
 * </p>
 */
public final class ParquetDescriptorFactory {

    private static final System.Logger LOG = System.getLogger(ParquetDescriptorFactory.class.getName());

    private ParquetDescriptorFactory() {
        // Utility class
    }

    /**
     * @param fileMetaData the file's footer
     * @param fileMapping buffer of the entire file, used to walk page headers
     * @param fileName used for log and error messages
     */
    public static DatasetDescriptor create(FileMetaData fileMetaData, ByteBuffer fileMapping, String fileName)
            throws IOException {
        List<SchemaElement> schema = fileMetaData.schema();
        SchemaElement root = schema.get(0);
        if (root.isPrimitive()) {
            throw new IOException("Root schema element of " + fileName + " must be a group");
        }

        DescriptorBuilder builder = DescriptorBuilder.create(root.name());
        List<PhysicalType> columnTypes = new ArrayList<>();
        List<String> columnPaths = new ArrayList<>();

        try {
            int end = addFields(schema, 1, root.childCount(), 0, "", builder, columnTypes, columnPaths);
            if (end != schema.size()) {
                throw new IOException("Schema of " + fileName + " has " + (schema.size() - end)
                        + " elements outside the schema tree");
            }

            PageScanner scanner = new PageScanner(fileMapping);
            long firstEntry = 0;
            long[] firstElements = new long[columnTypes.size()];
            for (int clusterId = 0; clusterId < fileMetaData.rowGroups().size(); clusterId++) {
                RowGroup rowGroup = fileMetaData.rowGroups().get(clusterId);
                if (rowGroup.columns().size() != columnTypes.size()) {
                    throw new IOException("Row group " + clusterId + " of " + fileName + " has "
                            + rowGroup.columns().size() + " column chunks, the schema has " + columnTypes.size() + " columns");
                }

                DescriptorBuilder.ClusterBuilder cluster = builder.addCluster(clusterId, firstEntry, rowGroup.numRows());
                for (int columnId = 0; columnId < columnTypes.size(); columnId++) {
                    ColumnChunk chunk = rowGroup.columns().get(columnId);
                    if (!chunk.isLocal()) {
                        // the cluster does not hold this column
                        continue;
                    }
                    ColumnMetaData metaData = chunk.metaData();
                    if (metaData.type() != columnTypes.get(columnId)) {
                        throw new IOException("Column chunk " + columnId + " of row group " + clusterId + " in " + fileName
                                + " has type " + metaData.type() + ", the schema declares " + columnTypes.get(columnId));
                    }

                    cluster.addColumnRange(columnId, firstElements[columnId], metaData.numValues(), metaData.codec().thriftValue());
                    for (PageInfo page : scanner.scanPages(metaData, columnPaths.get(columnId))) {
                        cluster.addPage(columnId, page);
                    }
                    firstElements[columnId] += metaData.numValues();
                }
                firstEntry += rowGroup.numRows();
            }

            DatasetDescriptor descriptor = builder.build();
            LOG.log(System.Logger.Level.DEBUG, "Built descriptor of ''{0}'' from {1}: {2} fields, {3} columns, {4} clusters",
                    descriptor.getName(), fileName, descriptor.getFieldCount(), descriptor.getPhysicalColumnCount(),
                    descriptor.getClusterCount());
            return descriptor;
        }
        catch (IllegalArgumentException e) {
            throw new IOException("Invalid schema or layout in " + fileName + ": " + e.getMessage(), e);
        }
    }

    /**
     * Adds {@code numChildren} consecutive sibling subtrees starting at {@code startIndex}.
     *
     * @return index of the first schema element after the siblings' subtrees
     */
    private static int addFields(List<SchemaElement> schema, int startIndex, int numChildren, int parentId,
                                 String parentPath, DescriptorBuilder builder, List<PhysicalType> columnTypes,
                                 List<String> columnPaths) throws IOException {
        int currentIndex = startIndex;

        for (int i = 0; i < numChildren; i++) {
            if (currentIndex >= schema.size()) {
                throw new IOException("Schema declares more children than it has elements");
            }
            SchemaElement element = schema.get(currentIndex);
            int fieldId = currentIndex;
            String path = parentPath.isEmpty() ? element.name() : parentPath + "." + element.name();
            builder.addField(fieldId, parentId, element.name(), FieldTypeNames.of(element));

            if (element.isPrimitive()) {
                int columnId = columnTypes.size();
                builder.addColumn(columnId, fieldId, element.type());
                columnTypes.add(element.type());
                columnPaths.add(path);
                currentIndex++;
            }
            else {
                currentIndex = addFields(schema, currentIndex + 1, element.childCount(), fieldId, path,
                        builder, columnTypes, columnPaths);
            }
        }

        return currentIndex;
    }
}
