/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.reader;

import java.io.IOException;
import java.nio.file.Path;

import dev.sapwood.descriptor.DatasetDescriptor;
import dev.sapwood.internal.reader.ParquetDescriptorFactory;

/**
 * Page source over a Parquet file. Attaching walks the page headers of every column chunk;
 * page payloads are never read.
 */
public class ParquetPageSource implements PageSource {

    private final ParquetFile file;
    private DatasetDescriptor descriptor;

    /**
     * Creates a page source that takes ownership of the given file.
     */
    public ParquetPageSource(ParquetFile file) {
        if (file == null) {
            throw new IllegalArgumentException("File must not be null");
        }
        this.file = file;
    }

    /**
     * Opens a page source over the file at the given path.
     */
    public static ParquetPageSource open(Path path) throws IOException {
        return new ParquetPageSource(ParquetFile.open(path));
    }

    @Override
    public void attach() throws IOException {
        if (descriptor == null) {
            descriptor = ParquetDescriptorFactory.create(file.getFileMetaData(), file.getFileMapping(),
                    file.getPath().getFileName().toString());
        }
    }

    @Override
    public DatasetDescriptor getDescriptor() {
        if (descriptor == null) {
            throw new IllegalStateException("Page source for " + file.getPath() + " is not attached");
        }
        return descriptor;
    }

    @Override
    public void close() throws IOException {
        file.close();
    }
}
