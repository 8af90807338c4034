/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.descriptor;

/**
 * Position and stored length of a page.
 */
public record Locator(long position, long bytesOnStorage) {

    public Locator {
        if (bytesOnStorage < 0) {
            throw new IllegalArgumentException("Negative page size: " + bytesOnStorage);
        }
    }
}
