/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.reader;

import jdk.jfr.Category;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event emitted when a Parquet file is memory-mapped for inspection.
 */
@Name("dev.sapwood.FileMapping")
@Label("File Mapping")
@Category({ "Sapwood", "I/O" })
@Description("Memory-mapping of a Parquet file for metadata inspection")
public class FileMappingEvent extends Event {

    @Label("File Path")
    @Description("Path to the file being mapped")
    public String path;

    @Label("Size")
    @Description("Size of the mapped region (bytes)")
    public long size;
}
