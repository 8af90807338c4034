/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.internal.reader;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;

import dev.sapwood.internal.thrift.FileMetaDataReader;
import dev.sapwood.internal.thrift.ThriftCompactReader;
import dev.sapwood.metadata.FileMetaData;

/**
 * Reads the footer of a Parquet file: {@code PAR1 <data> <FileMetaData> <footer length> PAR1}.
 */
public final class ParquetMetadataReader {

    private static final byte[] MAGIC = "PAR1".getBytes(StandardCharsets.UTF_8);
    private static final int FOOTER_LENGTH_SIZE = 4;
    private static final int MAGIC_SIZE = 4;

    private ParquetMetadataReader() {
        // Utility class
    }

    /**
     * Reads file metadata from a buffer covering the entire file.
     *
     * @param fileMapping the buffer of the entire file
     * @param path the file path, used for error messages
     * @throws IOException if the file is not a valid Parquet file
     */
    public static FileMetaData readMetadata(ByteBuffer fileMapping, Path path) throws IOException {
        int fileSize = fileMapping.limit();
        if (fileSize < MAGIC_SIZE + MAGIC_SIZE + FOOTER_LENGTH_SIZE) {
            throw new IOException("File too small to be a valid Parquet file: " + path);
        }

        byte[] magic = new byte[MAGIC_SIZE];
        fileMapping.get(0, magic);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new IOException("Not a Parquet file (invalid magic number at start): " + path);
        }

        int footerInfoPos = fileSize - MAGIC_SIZE - FOOTER_LENGTH_SIZE;
        ByteBuffer footerInfo = fileMapping.slice(footerInfoPos, FOOTER_LENGTH_SIZE + MAGIC_SIZE)
                .order(ByteOrder.LITTLE_ENDIAN);
        int footerLength = footerInfo.getInt();
        footerInfo.get(magic);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new IOException("Not a Parquet file (invalid magic number at end): " + path);
        }

        int footerStart = footerInfoPos - footerLength;
        if (footerLength <= 0 || footerStart < MAGIC_SIZE) {
            throw new IOException("Invalid footer length " + footerLength + " in " + path);
        }

        try {
            return FileMetaDataReader.read(new ThriftCompactReader(fileMapping.slice(footerStart, footerLength)));
        }
        catch (IllegalArgumentException e) {
            // unknown enum values in the footer
            throw new IOException("Corrupt footer in " + path + ": " + e.getMessage(), e);
        }
    }
}
