/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.testing;

import java.io.IOException;

import dev.sapwood.descriptor.DatasetDescriptor;
import dev.sapwood.reader.PageSource;

/**
 * Page source serving a prebuilt descriptor. Records how it was used.
 */
public class DescriptorPageSource implements PageSource {

    private final DatasetDescriptor descriptor;
    private int attachCount;
    private int closeCount;

    public DescriptorPageSource(DatasetDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    @Override
    public void attach() {
        attachCount++;
    }

    @Override
    public DatasetDescriptor getDescriptor() {
        if (attachCount == 0) {
            throw new IllegalStateException("Page source not attached");
        }
        return descriptor;
    }

    @Override
    public void close() throws IOException {
        closeCount++;
    }

    public int getAttachCount() {
        return attachCount;
    }

    public int getCloseCount() {
        return closeCount;
    }

    public boolean isClosed() {
        return closeCount > 0;
    }
}
