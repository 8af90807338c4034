/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.metadata;

import java.util.List;

public record FileMetaData(
        int version,
        List<SchemaElement> schema,
        long numRows,
        List<RowGroup> rowGroups,
        String createdBy) {

    /**
     * The name of the root schema element, which names the dataset stored in the file.
     */
    public String datasetName() {
        return schema.isEmpty() ? null : schema.get(0).name();
    }
}
