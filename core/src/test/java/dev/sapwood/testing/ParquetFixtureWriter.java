/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.testing;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import dev.sapwood.metadata.CompressionCodec;
import dev.sapwood.metadata.LogicalType;
import dev.sapwood.metadata.PageHeader.PageType;
import dev.sapwood.metadata.PhysicalType;
import dev.sapwood.metadata.RepetitionType;
import dev.sapwood.metadata.SchemaElement;

/**
 * Writes structurally valid Parquet files for tests. Page payloads are zero bytes of the requested
 * size; only the file layout, the page headers and the footer are meaningful.
 *
 * <pre>{@code
 * Path file = ParquetFixtureWriter.create("events",
 *                 primitive("id", PhysicalType.INT64),
 *                 primitive("name", PhysicalType.BYTE_ARRAY, new LogicalType.StringType()))
 *         .rowGroup(100,
 *                 chunk(CompressionCodec.SNAPPY, dataPage(100, 400)),
 *                 chunk(CompressionCodec.SNAPPY, dictionaryPage(10, 80), dataPage(100, 50)))
 *         .write(tempDir.resolve("events.parquet"));
 * }</pre>
 */
public final class ParquetFixtureWriter {

    private static final byte[] MAGIC = "PAR1".getBytes(StandardCharsets.UTF_8);

    private final String datasetName;
    private final List<SchemaElement> schema;
    private final List<PhysicalType> leafTypes = new ArrayList<>();
    private final List<List<String>> leafPaths = new ArrayList<>();
    private final List<FixtureRowGroup> rowGroups = new ArrayList<>();

    private ParquetFixtureWriter(String datasetName, List<SchemaElement> schema) {
        this.datasetName = datasetName;
        this.schema = schema;
    }

    /**
     * @param elements the schema below the root, flattened in pre-order
     */
    public static ParquetFixtureWriter create(String datasetName, SchemaElement... elements) {
        ParquetFixtureWriter writer = new ParquetFixtureWriter(datasetName, List.of(elements));
        int index = 0;
        while (index < elements.length) {
            index = writer.collectLeaves(index, new ArrayList<>());
        }
        return writer;
    }

    public static SchemaElement primitive(String name, PhysicalType type) {
        return new SchemaElement(name, type, null, RepetitionType.REQUIRED, null, null, null);
    }

    public static SchemaElement primitive(String name, PhysicalType type, LogicalType logicalType) {
        return new SchemaElement(name, type, null, RepetitionType.OPTIONAL, null, null, logicalType);
    }

    public static SchemaElement group(String name, int numChildren) {
        return new SchemaElement(name, null, null, RepetitionType.OPTIONAL, numChildren, null, null);
    }

    public static SchemaElement group(String name, int numChildren, LogicalType logicalType) {
        return new SchemaElement(name, null, null, RepetitionType.OPTIONAL, numChildren, null, logicalType);
    }

    public static SchemaElement repeatedGroup(String name, int numChildren) {
        return new SchemaElement(name, null, null, RepetitionType.REPEATED, numChildren, null, null);
    }

    public static FixtureChunk chunk(CompressionCodec codec, FixturePage... pages) {
        return new FixtureChunk(codec, List.of(pages), null, -1);
    }

    /**
     * A column chunk stored in another file; it has no pages in the written file.
     */
    public static FixtureChunk external(String filePath) {
        return new FixtureChunk(null, List.of(), filePath, -1);
    }

    public static FixturePage dataPage(int numValues, int payloadSize) {
        return new FixturePage(PageType.DATA_PAGE, numValues, payloadSize);
    }

    public static FixturePage dataPageV2(int numValues, int payloadSize) {
        return new FixturePage(PageType.DATA_PAGE_V2, numValues, payloadSize);
    }

    public static FixturePage dictionaryPage(int numEntries, int payloadSize) {
        return new FixturePage(PageType.DICTIONARY_PAGE, numEntries, payloadSize);
    }

    public ParquetFixtureWriter rowGroup(long numRows, FixtureChunk... columns) {
        if (columns.length != leafTypes.size()) {
            throw new IllegalArgumentException("Row group needs " + leafTypes.size() + " column chunks, got " + columns.length);
        }
        rowGroups.add(new FixtureRowGroup(numRows, List.of(columns)));
        return this;
    }

    public Path write(Path target) throws IOException {
        Files.write(target, toByteArray());
        return target;
    }

    public byte[] toByteArray() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(MAGIC, 0, MAGIC.length);

        List<List<WrittenChunk>> writtenRowGroups = new ArrayList<>();
        for (FixtureRowGroup rowGroup : rowGroups) {
            List<WrittenChunk> chunks = new ArrayList<>();
            for (FixtureChunk column : rowGroup.columns()) {
                chunks.add(column.filePath() != null ? null : writeChunk(out, column));
            }
            writtenRowGroups.add(chunks);
        }

        byte[] footer = footer(writtenRowGroups);
        out.write(footer, 0, footer.length);
        int length = footer.length;
        out.write(length & 0xFF);
        out.write((length >>> 8) & 0xFF);
        out.write((length >>> 16) & 0xFF);
        out.write((length >>> 24) & 0xFF);
        out.write(MAGIC, 0, MAGIC.length);
        return out.toByteArray();
    }

    private WrittenChunk writeChunk(ByteArrayOutputStream out, FixtureChunk column) {
        long start = out.size();
        Long dictionaryOffset = null;
        long dataOffset = -1;
        long numValues = 0;
        long uncompressed = 0;

        for (FixturePage page : column.pages()) {
            long pageOffset = out.size();
            if (page.type() == PageType.DICTIONARY_PAGE) {
                if (dictionaryOffset == null) {
                    dictionaryOffset = pageOffset;
                }
            }
            else {
                if (dataOffset < 0) {
                    dataOffset = pageOffset;
                }
                numValues += page.numValues();
            }
            byte[] header = pageHeader(page);
            out.write(header, 0, header.length);
            out.write(new byte[page.payloadSize()], 0, page.payloadSize());
            uncompressed += header.length + page.payloadSize();
        }

        if (dataOffset < 0) {
            dataOffset = start;
        }
        long declaredValues = column.declaredValues() >= 0 ? column.declaredValues() : numValues;
        return new WrittenChunk(column.codec(), declaredValues, uncompressed, out.size() - start,
                dataOffset, dictionaryOffset, start);
    }

    private static byte[] pageHeader(FixturePage page) {
        ThriftCompactWriter writer = new ThriftCompactWriter().structBegin()
                .i32Field(1, page.type().ordinal())
                .i32Field(2, page.payloadSize())
                .i32Field(3, page.payloadSize())
                .i32Field(4, 0); // crc
        switch (page.type()) {
            case DATA_PAGE -> writer.structField(5)
                    .i32Field(1, page.numValues())
                    .i32Field(2, 0)
                    .i32Field(3, 3)
                    .i32Field(4, 3)
                    .structEnd();
            case DICTIONARY_PAGE -> writer.structField(7)
                    .i32Field(1, page.numValues())
                    .i32Field(2, 0)
                    .boolField(3, false)
                    .structEnd();
            case DATA_PAGE_V2 -> writer.structField(8)
                    .i32Field(1, page.numValues())
                    .i32Field(2, 0)
                    .i32Field(3, page.numValues())
                    .i32Field(4, 0)
                    .i32Field(5, 0)
                    .i32Field(6, 0)
                    .structEnd();
            default -> {
                // index pages carry no nested header
            }
        }
        return writer.structEnd().toByteArray();
    }

    private byte[] footer(List<List<WrittenChunk>> writtenRowGroups) {
        ThriftCompactWriter writer = new ThriftCompactWriter().structBegin()
                .i32Field(1, 1)
                .listField(2, ThriftCompactWriter.TYPE_STRUCT, schema.size() + 1);

        writeSchemaElement(writer, new SchemaElement(datasetName, null, null, null, topLevelCount(), null, null));
        for (SchemaElement element : schema) {
            writeSchemaElement(writer, element);
        }

        long totalRows = 0;
        for (FixtureRowGroup rowGroup : rowGroups) {
            totalRows += rowGroup.numRows();
        }
        writer.i64Field(3, totalRows)
                .listField(4, ThriftCompactWriter.TYPE_STRUCT, rowGroups.size());

        for (int i = 0; i < rowGroups.size(); i++) {
            FixtureRowGroup rowGroup = rowGroups.get(i);
            List<WrittenChunk> chunks = writtenRowGroups.get(i);
            long totalByteSize = 0;
            writer.structBegin().listField(1, ThriftCompactWriter.TYPE_STRUCT, chunks.size());
            for (int columnId = 0; columnId < chunks.size(); columnId++) {
                WrittenChunk chunk = chunks.get(columnId);
                if (chunk == null) {
                    writer.structBegin()
                            .stringField(1, rowGroup.columns().get(columnId).filePath())
                            .i64Field(2, 4)
                            .structEnd();
                }
                else {
                    writeColumnChunk(writer, chunk, columnId);
                    totalByteSize += chunk.uncompressedSize();
                }
            }
            writer.i64Field(2, totalByteSize)
                    .i64Field(3, rowGroup.numRows())
                    .structEnd();
        }

        return writer.stringField(6, "sapwood fixture writer")
                .structEnd()
                .toByteArray();
    }

    private void writeColumnChunk(ThriftCompactWriter writer, WrittenChunk chunk, int columnId) {
        List<String> path = leafPaths.get(columnId);
        writer.structBegin()
                .i64Field(2, chunk.chunkStart())
                .structField(3)
                .i32Field(1, leafTypes.get(columnId).thriftValue())
                .listField(2, ThriftCompactWriter.TYPE_I32, 1)
                .i32Element(0)
                .listField(3, ThriftCompactWriter.TYPE_BINARY, path.size());
        for (String part : path) {
            writer.stringElement(part);
        }
        writer.i32Field(4, chunk.codec().thriftValue())
                .i64Field(5, chunk.numValues())
                .i64Field(6, chunk.uncompressedSize())
                .i64Field(7, chunk.compressedSize())
                .i64Field(9, chunk.dataPageOffset());
        if (chunk.dictionaryPageOffset() != null) {
            writer.i64Field(11, chunk.dictionaryPageOffset());
        }
        writer.structEnd().structEnd();
    }

    private static void writeSchemaElement(ThriftCompactWriter writer, SchemaElement element) {
        writer.structBegin();
        if (element.type() != null) {
            writer.i32Field(1, element.type().thriftValue());
        }
        if (element.typeLength() != null) {
            writer.i32Field(2, element.typeLength());
        }
        if (element.repetitionType() != null) {
            writer.i32Field(3, element.repetitionType().ordinal());
        }
        writer.stringField(4, element.name());
        if (element.numChildren() != null) {
            writer.i32Field(5, element.numChildren());
        }
        if (element.convertedType() != null) {
            writer.i32Field(6, element.convertedType().ordinal());
        }
        if (element.logicalType() != null) {
            writer.structField(10);
            writeLogicalType(writer, element.logicalType());
            writer.structEnd();
        }
        writer.structEnd();
    }

    private static void writeLogicalType(ThriftCompactWriter writer, LogicalType logicalType) {
        if (logicalType instanceof LogicalType.StringType) {
            writer.structField(1).structEnd();
        }
        else if (logicalType instanceof LogicalType.MapType) {
            writer.structField(2).structEnd();
        }
        else if (logicalType instanceof LogicalType.ListType) {
            writer.structField(3).structEnd();
        }
        else if (logicalType instanceof LogicalType.EnumType) {
            writer.structField(4).structEnd();
        }
        else if (logicalType instanceof LogicalType.DecimalType decimal) {
            writer.structField(5).i32Field(1, decimal.scale()).i32Field(2, decimal.precision()).structEnd();
        }
        else if (logicalType instanceof LogicalType.DateType) {
            writer.structField(6).structEnd();
        }
        else if (logicalType instanceof LogicalType.TimeType time) {
            writeTimeMember(writer, 7, time.isAdjustedToUTC(), time.unit());
        }
        else if (logicalType instanceof LogicalType.TimestampType timestamp) {
            writeTimeMember(writer, 8, timestamp.isAdjustedToUTC(), timestamp.unit());
        }
        else if (logicalType instanceof LogicalType.IntType intType) {
            writer.structField(10).byteField(1, (byte) intType.bitWidth()).boolField(2, intType.isSigned()).structEnd();
        }
        else if (logicalType instanceof LogicalType.JsonType) {
            writer.structField(12).structEnd();
        }
        else if (logicalType instanceof LogicalType.BsonType) {
            writer.structField(13).structEnd();
        }
        else if (logicalType instanceof LogicalType.UuidType) {
            writer.structField(14).structEnd();
        }
        else {
            throw new IllegalArgumentException("Unsupported logical type: " + logicalType);
        }
    }

    private static void writeTimeMember(ThriftCompactWriter writer, int memberId, boolean adjustedToUtc,
                                        LogicalType.TimeUnit unit) {
        writer.structField(memberId)
                .boolField(1, adjustedToUtc)
                .structField(2)
                .structField(unit.ordinal() + 1)
                .structEnd()
                .structEnd()
                .structEnd();
    }

    private int topLevelCount() {
        int count = 0;
        int index = 0;
        while (index < schema.size()) {
            index = subtreeEnd(index);
            count++;
        }
        return count;
    }

    private int subtreeEnd(int index) {
        SchemaElement element = schema.get(index);
        int next = index + 1;
        for (int i = 0; i < element.childCount(); i++) {
            next = subtreeEnd(next);
        }
        return next;
    }

    private int collectLeaves(int index, List<String> parentPath) {
        SchemaElement element = schema.get(index);
        List<String> path = new ArrayList<>(parentPath);
        path.add(element.name());
        if (element.isPrimitive()) {
            leafTypes.add(element.type());
            leafPaths.add(path);
            return index + 1;
        }
        int next = index + 1;
        for (int i = 0; i < element.childCount(); i++) {
            next = collectLeaves(next, path);
        }
        return next;
    }

    public record FixturePage(PageType type, int numValues, int payloadSize) {
    }

    public record FixtureChunk(CompressionCodec codec, List<FixturePage> pages, String filePath, long declaredValues) {

        /**
         * Declares a value count in the chunk metadata that differs from what the pages hold.
         */
        public FixtureChunk withDeclaredValues(long values) {
            return new FixtureChunk(codec, pages, filePath, values);
        }
    }

    private record FixtureRowGroup(long numRows, List<FixtureChunk> columns) {
    }

    private record WrittenChunk(CompressionCodec codec, long numValues, long uncompressedSize, long compressedSize,
                                long dataPageOffset, Long dictionaryPageOffset, long chunkStart) {
    }
}
