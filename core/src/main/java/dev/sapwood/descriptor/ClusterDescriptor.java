/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.descriptor;

import java.util.Map;

/**
 * A contiguous batch of entries and, per physical column it holds, the column's element
 * range and pages.
 */
public record ClusterDescriptor(
        int id,
        long firstEntryIndex,
        long entryCount,
        Map<Integer, ColumnRange> columnRanges,
        Map<Integer, PageRange> pageRanges) {

    public ClusterDescriptor {
        columnRanges = Map.copyOf(columnRanges);
        pageRanges = Map.copyOf(pageRanges);
    }

    public boolean containsColumn(int physicalColumnId) {
        return columnRanges.containsKey(physicalColumnId);
    }

    public ColumnRange getColumnRange(int physicalColumnId) {
        ColumnRange range = columnRanges.get(physicalColumnId);
        if (range == null) {
            throw new IllegalArgumentException("Cluster " + id + " does not contain column " + physicalColumnId);
        }
        return range;
    }

    /**
     * Returns the pages of the column, an empty range if the cluster lists none.
     */
    public PageRange getPageRange(int physicalColumnId) {
        PageRange range = pageRanges.get(physicalColumnId);
        return range != null ? range : PageRange.empty(physicalColumnId);
    }
}
