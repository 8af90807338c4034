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

import dev.sapwood.metadata.ColumnChunk;
import dev.sapwood.metadata.RowGroup;

import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_I64;
import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_LIST;

/**
 * Reader for RowGroup from Thrift Compact Protocol.
 */
public final class RowGroupReader {

    private RowGroupReader() {
    }

    public static RowGroup read(ThriftCompactReader reader) throws IOException {
        List<ColumnChunk> columns = new ArrayList<>();
        long[] sizes = new long[2]; // total_byte_size, num_rows

        reader.readStruct(header -> {
            switch (header.fieldId()) {
                case 1: // columns
                    if (header.is(TYPE_LIST)) {
                        reader.readStructList(ColumnChunkReader::read, columns);
                        return true;
                    }
                    return false;
                case 2: // total_byte_size
                case 3: // num_rows
                    if (header.is(TYPE_I64)) {
                        sizes[header.fieldId() - 2] = reader.readI64();
                        return true;
                    }
                    return false;
                default:
                    return false;
            }
        });

        return new RowGroup(List.copyOf(columns), sizes[0], sizes[1]);
    }
}
