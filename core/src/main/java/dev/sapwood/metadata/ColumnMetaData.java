/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.metadata;

import java.util.List;

public record ColumnMetaData(
        PhysicalType type,
        List<String> pathInSchema,
        CompressionCodec codec,
        long numValues,
        long totalUncompressedSize,
        long totalCompressedSize,
        long dataPageOffset,
        Long dictionaryPageOffset) {

    /**
     * File offset of the first page of the chunk, the dictionary page if there is one.
     */
    public long chunkStartOffset() {
        return dictionaryPageOffset != null && dictionaryPageOffset > 0 ? dictionaryPageOffset : dataPageOffset;
    }
}
