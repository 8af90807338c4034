/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.thrift;

import java.io.IOException;

import dev.sapwood.metadata.ColumnChunk;
import dev.sapwood.metadata.ColumnMetaData;

import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_BINARY;
import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_I64;
import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_STRUCT;

/**
 * Reader for ColumnChunk from Thrift Compact Protocol.
 */
public final class ColumnChunkReader {

    private ColumnChunkReader() {
    }

    public static ColumnChunk read(ThriftCompactReader reader) throws IOException {
        String[] filePath = new String[1];
        long[] fileOffset = new long[1];
        ColumnMetaData[] metaData = new ColumnMetaData[1];

        reader.readStruct(header -> {
            switch (header.fieldId()) {
                case 1: // file_path (optional)
                    if (header.is(TYPE_BINARY)) {
                        filePath[0] = reader.readString();
                        return true;
                    }
                    return false;
                case 2: // file_offset
                    if (header.is(TYPE_I64)) {
                        fileOffset[0] = reader.readI64();
                        return true;
                    }
                    return false;
                case 3: // meta_data
                    if (header.is(TYPE_STRUCT)) {
                        metaData[0] = ColumnMetaDataReader.read(reader);
                        return true;
                    }
                    return false;
                default:
                    return false;
            }
        });

        return new ColumnChunk(filePath[0], fileOffset[0], metaData[0]);
    }
}
