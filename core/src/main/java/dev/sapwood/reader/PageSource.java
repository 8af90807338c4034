/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.reader;

import java.io.IOException;

import dev.sapwood.descriptor.DatasetDescriptor;

/**
 * An open source of a dataset's pages and of the descriptor that describes them.
 * <p>
 * A page source must be attached before its descriptor can be used. Whoever holds a page source
 * owns it and is responsible for closing it.
 * </p>
 */
public interface PageSource extends AutoCloseable {

    /**
     * Reads the dataset's metadata and builds its descriptor. Attaching twice is a no-op.
     */
    void attach() throws IOException;

    /**
     * @throws IllegalStateException if the source has not been attached
     */
    DatasetDescriptor getDescriptor();

    @Override
    void close() throws IOException;
}
