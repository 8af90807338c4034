/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.thrift;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import dev.sapwood.metadata.ColumnMetaData;
import dev.sapwood.metadata.CompressionCodec;
import dev.sapwood.metadata.PhysicalType;

import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_I32;
import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_I64;
import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_LIST;

/**
 * Reader for ColumnMetaData from Thrift Compact Protocol. Encodings, statistics and
 * index offsets are skipped.
 */
public final class ColumnMetaDataReader {

    private ColumnMetaDataReader() {
    }

    public static ColumnMetaData read(ThriftCompactReader reader) throws IOException {
        Fields fields = new Fields();

        reader.readStruct(header -> {
            switch (header.fieldId()) {
                case 1: // type
                    if (header.is(TYPE_I32)) {
                        fields.type = PhysicalType.fromThriftValue(reader.readI32());
                        return true;
                    }
                    return false;
                case 3: // path_in_schema
                    if (header.is(TYPE_LIST)) {
                        ThriftCompactReader.CollectionHeader listHeader = reader.readListHeader();
                        for (int i = 0; i < listHeader.size(); i++) {
                            fields.pathInSchema.add(reader.readString());
                        }
                        return true;
                    }
                    return false;
                case 4: // codec
                    if (header.is(TYPE_I32)) {
                        fields.codec = CompressionCodec.fromThriftValue(reader.readI32());
                        return true;
                    }
                    return false;
                case 5: // num_values
                    if (header.is(TYPE_I64)) {
                        fields.numValues = reader.readI64();
                        return true;
                    }
                    return false;
                case 6: // total_uncompressed_size
                    if (header.is(TYPE_I64)) {
                        fields.totalUncompressedSize = reader.readI64();
                        return true;
                    }
                    return false;
                case 7: // total_compressed_size
                    if (header.is(TYPE_I64)) {
                        fields.totalCompressedSize = reader.readI64();
                        return true;
                    }
                    return false;
                case 9: // data_page_offset
                    if (header.is(TYPE_I64)) {
                        fields.dataPageOffset = reader.readI64();
                        return true;
                    }
                    return false;
                case 11: // dictionary_page_offset (optional)
                    if (header.is(TYPE_I64)) {
                        fields.dictionaryPageOffset = reader.readI64();
                        return true;
                    }
                    return false;
                default:
                    return false;
            }
        });

        if (fields.type == null || fields.codec == null) {
            throw new IOException("ColumnMetaData missing required field: " + (fields.type == null ? "type" : "codec"));
        }
        return new ColumnMetaData(fields.type, List.copyOf(fields.pathInSchema), fields.codec, fields.numValues,
                fields.totalUncompressedSize, fields.totalCompressedSize, fields.dataPageOffset,
                fields.dictionaryPageOffset);
    }

    private static final class Fields {
        PhysicalType type;
        final List<String> pathInSchema = new ArrayList<>();
        CompressionCodec codec;
        long numValues;
        long totalUncompressedSize;
        long totalCompressedSize;
        long dataPageOffset;
        Long dictionaryPageOffset;
    }
}
