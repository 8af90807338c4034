/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.reader;

import jdk.jfr.Category;
import jdk.jfr.DataAmount;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event spanning the statistics collection of one dataset.
 */
@Name("dev.sapwood.Inspection")
@Label("Dataset Inspection")
@Category({ "Sapwood", "Inspection" })
@Description("Collection of column and field statistics of a dataset")
public class InspectionEvent extends Event {

    @Label("Dataset")
    public String dataset;

    @Label("Columns")
    @Description("Number of physical columns")
    public int columns;

    @Label("Fields")
    public int fields;

    @Label("On-Disk Size")
    @DataAmount
    public long onDiskSize;

    @Label("In-Memory Size")
    @DataAmount
    public long inMemorySize;
}
