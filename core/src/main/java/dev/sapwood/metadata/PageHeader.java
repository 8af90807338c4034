/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.metadata;

/**
 * Page header, reduced to what is needed to account for a page without reading its payload.
 *
 * @param numValues value count of a data page; entry count of a dictionary page; 0 for index pages
 */
public record PageHeader(
        PageType type,
        int uncompressedPageSize,
        int compressedPageSize,
        int numValues) {

    public boolean isDataPage() {
        return type == PageType.DATA_PAGE || type == PageType.DATA_PAGE_V2;
    }

    public enum PageType {
        DATA_PAGE,
        INDEX_PAGE,
        DICTIONARY_PAGE,
        DATA_PAGE_V2;

        public static PageType fromThriftValue(int value) {
            PageType[] types = values();
            if (value < 0 || value >= types.length) {
                throw new IllegalArgumentException("Unknown page type: " + value);
            }
            return types[value];
        }
    }
}
