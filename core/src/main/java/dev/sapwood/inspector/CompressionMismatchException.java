/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.inspector;

import java.io.IOException;
import java.util.List;

/**
 * Thrown when the clusters of a dataset disagree on the compression setting.
 */
public class CompressionMismatchException extends IOException {

    private static final long serialVersionUID = 1L;

    private final transient List<CompressionMismatch> mismatches;

    public CompressionMismatchException(String datasetName, List<CompressionMismatch> mismatches) {
        super("Dataset '" + datasetName + "' uses more than one compression setting: " + mismatches.get(0)
                + (mismatches.size() > 1 ? " (and " + (mismatches.size() - 1) + " more)" : ""));
        this.mismatches = List.copyOf(mismatches);
    }

    public List<CompressionMismatch> getMismatches() {
        return mismatches;
    }
}
