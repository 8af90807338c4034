/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.metadata;

public enum RepetitionType {
    REQUIRED,
    OPTIONAL,
    REPEATED;

    public static RepetitionType fromThriftValue(int value) {
        RepetitionType[] types = values();
        if (value < 0 || value >= types.length) {
            throw new IllegalArgumentException("Unknown repetition type: " + value);
        }
        return types[value];
    }
}
