/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.metadata;

/**
 * Column chunk entry of a row group.
 *
 * @param filePath set when the chunk lives in an external file; such chunks are not held by this file
 * @param metaData may be null if the writer omitted it
 */
public record ColumnChunk(String filePath, long fileOffset, ColumnMetaData metaData) {

    public boolean isLocal() {
        return filePath == null && metaData != null;
    }
}
