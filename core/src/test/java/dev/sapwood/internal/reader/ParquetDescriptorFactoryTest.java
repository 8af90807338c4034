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
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import dev.sapwood.descriptor.ClusterDescriptor;
import dev.sapwood.descriptor.ColumnRange;
import dev.sapwood.descriptor.DatasetDescriptor;
import dev.sapwood.descriptor.FieldDescriptor;
import dev.sapwood.metadata.CompressionCodec;
import dev.sapwood.metadata.FileMetaData;
import dev.sapwood.metadata.LogicalType;
import dev.sapwood.metadata.PhysicalType;
import dev.sapwood.metadata.RowGroup;
import dev.sapwood.metadata.SchemaElement;
import dev.sapwood.testing.ParquetFixtureWriter;

import static dev.sapwood.testing.ParquetFixtureWriter.chunk;
import static dev.sapwood.testing.ParquetFixtureWriter.dataPage;
import static dev.sapwood.testing.ParquetFixtureWriter.group;
import static dev.sapwood.testing.ParquetFixtureWriter.primitive;
import static dev.sapwood.testing.ParquetFixtureWriter.repeatedGroup;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for building descriptors from Parquet metadata.
 */
class ParquetDescriptorFactoryTest {

    private static final String FILE_NAME = "nested.parquet";

    private static ByteBuffer nestedFile() {
        return ByteBuffer.wrap(ParquetFixtureWriter.create("nested",
                        primitive("id", PhysicalType.INT64),
                        group("attributes", 1, new LogicalType.MapType()),
                        repeatedGroup("key_value", 2),
                        primitive("key", PhysicalType.BYTE_ARRAY, new LogicalType.StringType()),
                        primitive("value", PhysicalType.INT32),
                        primitive("flag", PhysicalType.BOOLEAN))
                .rowGroup(30,
                        chunk(CompressionCodec.ZSTD, dataPage(30, 240)),
                        chunk(CompressionCodec.ZSTD, dataPage(45, 300)),
                        chunk(CompressionCodec.ZSTD, dataPage(45, 180)),
                        chunk(CompressionCodec.ZSTD, dataPage(30, 4)))
                .rowGroup(20,
                        chunk(CompressionCodec.ZSTD, dataPage(20, 160)),
                        chunk(CompressionCodec.ZSTD, dataPage(25, 150)),
                        chunk(CompressionCodec.ZSTD, dataPage(25, 100)),
                        chunk(CompressionCodec.ZSTD, dataPage(20, 3)))
                .toByteArray());
    }

    private static DatasetDescriptor describe(ByteBuffer file) throws IOException {
        FileMetaData metaData = ParquetMetadataReader.readMetadata(file, Path.of(FILE_NAME));
        return ParquetDescriptorFactory.create(metaData, file, FILE_NAME);
    }

    @Test
    void testFieldTree() throws Exception {
        DatasetDescriptor descriptor = describe(nestedFile());

        assertThat(descriptor.getName()).isEqualTo("nested");
        assertThat(descriptor.getFieldCount()).isEqualTo(7);
        assertThat(descriptor.getFieldDescriptor(0).parentId()).isEqualTo(DatasetDescriptor.INVALID_ID);
        assertThat(descriptor.getSubFields(0)).extracting(FieldDescriptor::fieldName)
                .containsExactly("id", "attributes", "flag");

        FieldDescriptor attributes = descriptor.getFieldDescriptor(2);
        assertThat(attributes.fieldName()).isEqualTo("attributes");
        assertThat(attributes.typeName()).isEqualTo("map");
        assertThat(attributes.subFieldIds()).containsExactly(3);
        assertThat(descriptor.getFieldDescriptor(3).subFieldIds()).containsExactly(4, 5);

        assertThat(descriptor.findFieldId("attributes.key_value.value")).isEqualTo(5);
        assertThat(descriptor.findFieldId("flag")).isEqualTo(6);
        assertThat(descriptor.getQualifiedFieldName(4)).isEqualTo("attributes.key_value.key");
    }

    @Test
    void testColumns() throws Exception {
        DatasetDescriptor descriptor = describe(nestedFile());

        assertThat(descriptor.getColumnCount()).isEqualTo(4);
        assertThat(descriptor.getPhysicalColumnCount()).isEqualTo(4);
        assertThat(descriptor.getColumnDescriptor(0).fieldId()).isEqualTo(1);
        assertThat(descriptor.getColumnDescriptor(1).fieldId()).isEqualTo(4);
        assertThat(descriptor.getColumnDescriptor(1).type()).isEqualTo(PhysicalType.BYTE_ARRAY);
        assertThat(descriptor.getColumnDescriptor(2).fieldId()).isEqualTo(5);
        assertThat(descriptor.getColumnDescriptor(3).type()).isEqualTo(PhysicalType.BOOLEAN);
        assertThat(descriptor.getColumns(2)).isEmpty();
        assertThat(descriptor.getColumns(6)).hasSize(1);
    }

    @Test
    void testClusters() throws Exception {
        DatasetDescriptor descriptor = describe(nestedFile());

        List<ClusterDescriptor> clusters = descriptor.getClusters();
        assertThat(clusters).hasSize(2);
        assertThat(clusters.get(1).firstEntryIndex()).isEqualTo(30);
        assertThat(clusters.get(1).entryCount()).isEqualTo(20);
        assertThat(descriptor.getEntryCount()).isEqualTo(50);

        ColumnRange keys = clusters.get(1).getColumnRange(1);
        assertThat(keys.firstElementIndex()).isEqualTo(45);
        assertThat(keys.elementCount()).isEqualTo(25);
        assertThat(keys.compressionSettings()).isEqualTo(CompressionCodec.ZSTD.thriftValue());
        assertThat(clusters.get(0).getPageRange(1).pageInfos()).hasSize(1);
    }

    @Test
    void testChunkTypeMustMatchSchema() throws Exception {
        ByteBuffer file = nestedFile();
        FileMetaData metaData = ParquetMetadataReader.readMetadata(file, Path.of(FILE_NAME));

        // declare the boolean leaf as a double
        List<SchemaElement> schema = new ArrayList<>(metaData.schema());
        SchemaElement flag = schema.get(6);
        schema.set(6, new SchemaElement(flag.name(), PhysicalType.DOUBLE, null, flag.repetitionType(), null, null, null));
        FileMetaData altered = new FileMetaData(metaData.version(), schema, metaData.numRows(),
                metaData.rowGroups(), metaData.createdBy());

        assertThatThrownBy(() -> ParquetDescriptorFactory.create(altered, file, FILE_NAME))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("BOOLEAN");
    }

    @Test
    void testRowGroupWithMissingChunks() throws Exception {
        ByteBuffer file = nestedFile();
        FileMetaData metaData = ParquetMetadataReader.readMetadata(file, Path.of(FILE_NAME));

        RowGroup first = metaData.rowGroups().get(0);
        RowGroup truncated = new RowGroup(first.columns().subList(0, 2), first.totalByteSize(), first.numRows());
        FileMetaData altered = new FileMetaData(metaData.version(), metaData.schema(), metaData.numRows(),
                List.of(truncated), metaData.createdBy());

        assertThatThrownBy(() -> ParquetDescriptorFactory.create(altered, file, FILE_NAME))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("2 column chunks");
    }

    @Test
    void testSchemaWithTooFewElements() throws Exception {
        ByteBuffer file = nestedFile();
        FileMetaData metaData = ParquetMetadataReader.readMetadata(file, Path.of(FILE_NAME));

        FileMetaData altered = new FileMetaData(metaData.version(), metaData.schema().subList(0, 4),
                metaData.numRows(), List.of(), metaData.createdBy());

        assertThatThrownBy(() -> ParquetDescriptorFactory.create(altered, file, FILE_NAME))
                .isInstanceOf(IOException.class);
    }

    @Test
    void testDuplicateSiblingNames() throws Exception {
        ByteBuffer file = ByteBuffer.wrap(ParquetFixtureWriter.create("dupes",
                        primitive("a", PhysicalType.INT32),
                        primitive("a", PhysicalType.INT32))
                .toByteArray());
        FileMetaData metaData = ParquetMetadataReader.readMetadata(file, Path.of("dupes.parquet"));

        assertThatThrownBy(() -> ParquetDescriptorFactory.create(metaData, file, "dupes.parquet"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Duplicate field name");
    }
}
