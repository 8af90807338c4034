/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.inspector;

/**
 * What to do when a dataset's clusters disagree on the compression setting.
 */
public enum MismatchPolicy {

    /**
     * Inspection fails with a {@link CompressionMismatchException}.
     */
    FAIL,

    /**
     * Each mismatch is logged; the first setting seen is reported.
     */
    WARN
}
