/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.inspector;

/**
 * A column range whose compression setting differs from the first one seen in the dataset.
 */
public record CompressionMismatch(int physicalColumnId, int clusterId, int expectedSettings, int actualSettings) {

    @Override
    public String toString() {
        return "column " + physicalColumnId + " in cluster " + clusterId + " has compression setting "
                + actualSettings + ", expected " + expectedSettings;
    }
}
