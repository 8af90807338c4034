/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.metadata;

import java.util.List;

public record RowGroup(
        List<ColumnChunk> columns,
        long totalByteSize,
        long numRows) {
}
