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

import dev.sapwood.metadata.FileMetaData;
import dev.sapwood.metadata.RowGroup;
import dev.sapwood.metadata.SchemaElement;

import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_BINARY;
import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_I32;
import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_I64;
import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_LIST;

/**
 * Reader for FileMetaData from Thrift Compact Protocol.
 */
public final class FileMetaDataReader {

    private FileMetaDataReader() {
    }

    public static FileMetaData read(ThriftCompactReader reader) throws IOException {
        Fields fields = new Fields();

        reader.readStruct(header -> {
            switch (header.fieldId()) {
                case 1: // version
                    if (header.is(TYPE_I32)) {
                        fields.version = reader.readI32();
                        return true;
                    }
                    return false;
                case 2: // schema
                    if (header.is(TYPE_LIST)) {
                        reader.readStructList(SchemaElementReader::read, fields.schema);
                        return true;
                    }
                    return false;
                case 3: // num_rows
                    if (header.is(TYPE_I64)) {
                        fields.numRows = reader.readI64();
                        return true;
                    }
                    return false;
                case 4: // row_groups
                    if (header.is(TYPE_LIST)) {
                        reader.readStructList(RowGroupReader::read, fields.rowGroups);
                        return true;
                    }
                    return false;
                case 6: // created_by
                    if (header.is(TYPE_BINARY)) {
                        fields.createdBy = reader.readString();
                        return true;
                    }
                    return false;
                default:
                    return false;
            }
        });

        if (fields.schema.isEmpty()) {
            throw new IOException("FileMetaData missing required field: schema");
        }
        return new FileMetaData(fields.version, List.copyOf(fields.schema), fields.numRows,
                List.copyOf(fields.rowGroups), fields.createdBy);
    }

    private static final class Fields {
        int version;
        final List<SchemaElement> schema = new ArrayList<>();
        long numRows;
        final List<RowGroup> rowGroups = new ArrayList<>();
        String createdBy;
    }
}
