/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.inspector;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import dev.sapwood.descriptor.ClusterDescriptor;
import dev.sapwood.descriptor.ColumnDescriptor;
import dev.sapwood.descriptor.ColumnElement;
import dev.sapwood.descriptor.ColumnRange;
import dev.sapwood.descriptor.DatasetDescriptor;
import dev.sapwood.descriptor.PageInfo;

/**
 * Sums up the pages of every physical column over all clusters.
 * <p>
 * The dataset is expected to use one compression setting throughout. The first setting seen
 * becomes the dataset's setting; every column range deviating from it is reported in
 * {@link Result#mismatches()}. Deciding what a mismatch means is left to the caller.
 * </p>
 */
final class ColumnStatsCollector {

    static final int UNSET_COMPRESSION_SETTINGS = -1;

    private static final System.Logger LOG = System.getLogger(ColumnStatsCollector.class.getName());

    private ColumnStatsCollector() {
    }

    static Result collect(DatasetDescriptor descriptor) {
        Map<Integer, ColumnInfo> columnInfos = new HashMap<>();
        List<CompressionMismatch> mismatches = new ArrayList<>();
        int compressionSettings = UNSET_COMPRESSION_SETTINGS;
        long totalOnDiskSize = 0;
        long totalInMemorySize = 0;

        for (int columnId = 0; columnId < descriptor.getPhysicalColumnCount(); columnId++) {
            ColumnDescriptor column = descriptor.getColumnDescriptor(columnId);
            int elementSize = ColumnElement.sizeOf(column.type());
            long elementCount = 0;
            long onDiskSize = 0;

            for (ClusterDescriptor cluster : descriptor.getClusters()) {
                if (!cluster.containsColumn(columnId)) {
                    continue;
                }

                ColumnRange columnRange = cluster.getColumnRange(columnId);
                elementCount += columnRange.elementCount();

                if (compressionSettings == UNSET_COMPRESSION_SETTINGS) {
                    compressionSettings = columnRange.compressionSettings();
                }
                else if (columnRange.compressionSettings() != compressionSettings) {
                    mismatches.add(new CompressionMismatch(columnId, cluster.id(), compressionSettings,
                            columnRange.compressionSettings()));
                }

                for (PageInfo page : cluster.getPageRange(columnId).pageInfos()) {
                    onDiskSize += page.bytesOnStorage();
                    totalOnDiskSize += page.bytesOnStorage();
                    totalInMemorySize += page.elementCount() * elementSize;
                }
            }

            LOG.log(System.Logger.Level.TRACE, "Column {0} ({1}): {2} elements, {3} bytes on disk",
                    columnId, column.type(), elementCount, onDiskSize);
            columnInfos.put(columnId, new ColumnInfo(column, onDiskSize, elementSize, elementCount));
        }

        return new Result(columnInfos, totalOnDiskSize, totalInMemorySize, compressionSettings, mismatches);
    }

    /**
     * Outcome of a collection run.
     *
     * @param compressionSettings the first setting seen, {@link #UNSET_COMPRESSION_SETTINGS} if no cluster holds any column
     * @param mismatches empty if all column ranges agree on the compression setting
     */
    record Result(
            Map<Integer, ColumnInfo> columnInfos,
            long onDiskSize,
            long inMemorySize,
            int compressionSettings,
            List<CompressionMismatch> mismatches) {

        Result {
            columnInfos = Map.copyOf(columnInfos);
            mismatches = List.copyOf(mismatches);
        }

        boolean isConsistent() {
            return mismatches.isEmpty();
        }
    }
}
