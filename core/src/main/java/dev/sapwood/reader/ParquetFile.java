/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.reader;

import java.io.IOException;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

import dev.sapwood.internal.reader.FileMappingEvent;
import dev.sapwood.internal.reader.ParquetMetadataReader;
import dev.sapwood.metadata.FileMetaData;

/**
 * An open Parquet file. The file holds a single dataset, named by the root element of its schema.
 *
 * <pre>{@code
 * try (ParquetFile file = ParquetFile.open(path)) {
 *     Dataset dataset = file.findDataset("schema").orElseThrow();
 *     // ...
 * }
 * }</pre>
 */
public class ParquetFile implements AutoCloseable {

    private static final System.Logger LOG = System.getLogger(ParquetFile.class.getName());

    private final Path path;
    private final FileChannel channel;
    private final MappedByteBuffer fileMapping;
    private final FileMetaData fileMetaData;

    private ParquetFile(Path path, FileChannel channel, MappedByteBuffer fileMapping, FileMetaData fileMetaData) {
        this.path = path;
        this.channel = channel;
        this.fileMapping = fileMapping;
        this.fileMetaData = fileMetaData;
    }

    /**
     * Opens and memory-maps the file and reads its footer.
     *
     * @throws IOException if the file cannot be opened or is not a valid Parquet file
     */
    public static ParquetFile open(Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("Path must not be null");
        }
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            long fileSize = channel.size();
            if (fileSize > Integer.MAX_VALUE) {
                throw new IOException("File too large to be mapped: " + path + " (" + fileSize + " bytes)");
            }

            FileMappingEvent event = new FileMappingEvent();
            event.begin();

            MappedByteBuffer fileMapping = channel.map(FileChannel.MapMode.READ_ONLY, 0, fileSize);

            event.path = path.toString();
            event.size = fileSize;
            event.commit();

            FileMetaData fileMetaData = ParquetMetadataReader.readMetadata(fileMapping, path);
            LOG.log(System.Logger.Level.DEBUG, "Opened ''{0}'': dataset ''{1}'', {2} row groups, {3} rows",
                    path, fileMetaData.datasetName(), fileMetaData.rowGroups().size(), fileMetaData.numRows());

            return new ParquetFile(path, channel, fileMapping, fileMetaData);
        }
        catch (IOException | RuntimeException e) {
            try {
                channel.close();
            }
            catch (IOException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }

    public Path getPath() {
        return path;
    }

    public FileMetaData getFileMetaData() {
        return fileMetaData;
    }

    MappedByteBuffer getFileMapping() {
        return fileMapping;
    }

    /**
     * Returns the dataset stored in this file.
     */
    public Dataset getDataset() {
        return new ParquetDataset(path, fileMetaData.datasetName());
    }

    /**
     * Returns the dataset with the given name, if this file holds it.
     */
    public Optional<Dataset> findDataset(String datasetName) {
        if (datasetName == null || !datasetName.equals(fileMetaData.datasetName())) {
            return Optional.empty();
        }
        return Optional.of(getDataset());
    }

    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
