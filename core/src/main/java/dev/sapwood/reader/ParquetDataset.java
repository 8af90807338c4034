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

/**
 * The dataset held by a Parquet file. Each page source opened from it maps the file anew.
 */
public class ParquetDataset implements Dataset {

    private final Path path;
    private final String name;

    public ParquetDataset(Path path, String name) {
        this.path = path;
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public PageSource openPageSource() throws IOException {
        ParquetFile file = ParquetFile.open(path);
        String actualName = file.getFileMetaData().datasetName();
        if (!name.equals(actualName)) {
            IOException mismatch = new IOException("File " + path + " no longer holds dataset '" + name
                    + "' but '" + actualName + "'");
            try {
                file.close();
            }
            catch (IOException e) {
                mismatch.addSuppressed(e);
            }
            throw mismatch;
        }
        return new ParquetPageSource(file);
    }

    @Override
    public String toString() {
        return "ParquetDataset[name=" + name + ", path=" + path + "]";
    }
}
