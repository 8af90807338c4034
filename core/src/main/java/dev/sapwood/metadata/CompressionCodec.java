/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.metadata;

import java.util.Optional;

/**
 * Compression codecs a column chunk may declare. The thrift value doubles as the
 * compression setting reported by the inspector.
 */
public enum CompressionCodec {
    UNCOMPRESSED(0),
    SNAPPY(1),
    GZIP(2),
    LZO(3),
    BROTLI(4),
    LZ4(5),
    ZSTD(6),
    LZ4_RAW(7);

    private final int thriftValue;

    CompressionCodec(int thriftValue) {
        this.thriftValue = thriftValue;
    }

    public int thriftValue() {
        return thriftValue;
    }

    public static CompressionCodec fromThriftValue(int value) {
        return find(value).orElseThrow(() -> new IllegalArgumentException("Unknown compression codec: " + value));
    }

    /**
     * Looks up a codec without failing for values written by newer writers.
     */
    public static Optional<CompressionCodec> find(int value) {
        for (CompressionCodec codec : values()) {
            if (codec.thriftValue == value) {
                return Optional.of(codec);
            }
        }
        return Optional.empty();
    }
}
