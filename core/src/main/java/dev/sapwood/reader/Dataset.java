/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.reader;

import java.io.IOException;

/**
 * A named dataset stored in some backing file.
 */
public interface Dataset {

    String getName();

    /**
     * Opens a new, unattached page source for this dataset. The caller owns the returned source.
     */
    PageSource openPageSource() throws IOException;
}
