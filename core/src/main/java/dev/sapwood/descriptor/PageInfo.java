/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.descriptor;

/**
 * A single page of a column within a cluster.
 *
 * @param elementCount number of column elements stored in the page; 0 for pages holding no column elements
 */
public record PageInfo(long elementCount, Locator locator) {

    public PageInfo {
        if (elementCount < 0) {
            throw new IllegalArgumentException("Negative element count: " + elementCount);
        }
    }

    public long bytesOnStorage() {
        return locator.bytesOnStorage();
    }
}
