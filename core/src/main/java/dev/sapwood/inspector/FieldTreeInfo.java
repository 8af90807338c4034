/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.inspector;

import dev.sapwood.descriptor.FieldDescriptor;

/**
 * Storage statistics of a field and all of its sub-fields. Alias columns do not count.
 *
 * @param descriptor the field at the root of the subtree
 */
public record FieldTreeInfo(FieldDescriptor descriptor, long onDiskSize, long inMemorySize) {
}
