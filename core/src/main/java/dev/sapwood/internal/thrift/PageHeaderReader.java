/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.thrift;

import java.io.IOException;

import dev.sapwood.metadata.PageHeader;

import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_I32;
import static dev.sapwood.internal.thrift.ThriftCompactReader.TYPE_STRUCT;

/**
 * Reader for PageHeader from Thrift Compact Protocol. Of the nested data page, data page v2
 * and dictionary page headers only the value count is kept; statistics and encodings are skipped.
 */
public final class PageHeaderReader {

    private PageHeaderReader() {
    }

    public static PageHeader read(ThriftCompactReader reader) throws IOException {
        Fields fields = new Fields();

        reader.readStruct(header -> {
            switch (header.fieldId()) {
                case 1: // type
                    if (header.is(TYPE_I32)) {
                        fields.type = PageHeader.PageType.fromThriftValue(reader.readI32());
                        return true;
                    }
                    return false;
                case 2: // uncompressed_page_size
                    if (header.is(TYPE_I32)) {
                        fields.uncompressedPageSize = reader.readI32();
                        return true;
                    }
                    return false;
                case 3: // compressed_page_size
                    if (header.is(TYPE_I32)) {
                        fields.compressedPageSize = reader.readI32();
                        return true;
                    }
                    return false;
                case 5: // data_page_header
                case 7: // dictionary_page_header
                case 8: // data_page_header_v2
                    if (header.is(TYPE_STRUCT)) {
                        fields.numValues = readNumValues(reader);
                        return true;
                    }
                    return false;
                default:
                    return false;
            }
        });

        if (fields.type == null) {
            throw new IOException("PageHeader missing required field: type");
        }
        if (fields.compressedPageSize < 0) {
            throw new IOException("Invalid compressed page size: " + fields.compressedPageSize);
        }
        return new PageHeader(fields.type, fields.uncompressedPageSize, fields.compressedPageSize,
                fields.type == PageHeader.PageType.INDEX_PAGE ? 0 : fields.numValues);
    }

    // num_values is field 1 in all three nested header structs
    private static int readNumValues(ThriftCompactReader reader) throws IOException {
        int[] numValues = new int[1];

        reader.readStruct(header -> {
            if (header.fieldId() == 1 && header.is(TYPE_I32)) {
                numValues[0] = reader.readI32();
                return true;
            }
            return false;
        });

        return numValues[0];
    }

    private static final class Fields {
        PageHeader.PageType type;
        int uncompressedPageSize;
        int compressedPageSize;
        int numValues;
    }
}
