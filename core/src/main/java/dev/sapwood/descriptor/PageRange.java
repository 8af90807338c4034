/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.descriptor;

import java.util.List;

/**
 * The pages of one physical column within one cluster, in file order.
 */
public record PageRange(int physicalColumnId, List<PageInfo> pageInfos) {

    public PageRange {
        pageInfos = List.copyOf(pageInfos);
    }

    public static PageRange empty(int physicalColumnId) {
        return new PageRange(physicalColumnId, List.of());
    }
}
