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
import java.util.ArrayList;
import java.util.List;

import dev.sapwood.descriptor.Locator;
import dev.sapwood.descriptor.PageInfo;
import dev.sapwood.internal.thrift.PageHeaderReader;
import dev.sapwood.internal.thrift.ThriftCompactReader;
import dev.sapwood.metadata.ColumnMetaData;
import dev.sapwood.metadata.PageHeader;

/**
 * Walks the page headers of a column chunk and locates every page.
 * <p>
 * Only headers are decoded; page payloads are stepped over without being read or decompressed.
 * A page's bytes on storage are its header plus its compressed payload, so the pages of a chunk
 * add up to the chunk's {@code total_compressed_size}. Every page up to the end of the chunk is
 * located, including the pages of chunks that hold no values.
 * </p>
 */
public class PageScanner {

    private static final System.Logger LOG = System.getLogger(PageScanner.class.getName());

    private final ByteBuffer fileMapping;

    public PageScanner(ByteBuffer fileMapping) {
        this.fileMapping = fileMapping;
    }

    /**
     * Scans the pages of one column chunk.
     *
     * @param metaData the chunk's metadata
     * @param columnName the column path, used for error messages
     * @return the pages in file order; data pages carry their value count, other pages zero elements
     */
    public List<PageInfo> scanPages(ColumnMetaData metaData, String columnName) throws IOException {
        long chunkStart = metaData.chunkStartOffset();
        long chunkSize = metaData.totalCompressedSize();
        if (chunkStart < 0 || chunkSize < 0 || chunkStart + chunkSize > fileMapping.limit()) {
            throw new IOException("Column chunk of '" + columnName + "' at offset " + chunkStart
                    + " with size " + chunkSize + " exceeds the file size " + fileMapping.limit());
        }

        ByteBuffer chunk = fileMapping.slice((int) chunkStart, (int) chunkSize);
        List<PageInfo> pages = new ArrayList<>();
        long valuesRead = 0;
        int position = 0;

        while (position < chunk.limit()) {
            ThriftCompactReader headerReader = new ThriftCompactReader(chunk, position);
            PageHeader header = PageHeaderReader.read(headerReader);
            int headerSize = headerReader.getBytesRead();

            long pageSize = (long) headerSize + header.compressedPageSize();
            if (position + pageSize > chunk.limit()) {
                throw new IOException("Page at offset " + (chunkStart + position) + " of column '" + columnName
                        + "' extends beyond its column chunk");
            }

            long elements = header.isDataPage() ? header.numValues() : 0;
            pages.add(new PageInfo(elements, new Locator(chunkStart + position, pageSize)));
            valuesRead += elements;
            position += (int) pageSize;
        }

        if (valuesRead != metaData.numValues()) {
            throw new IOException("Column '" + columnName + "' declares " + metaData.numValues()
                    + " values but its pages hold " + valuesRead);
        }

        LOG.log(System.Logger.Level.TRACE, "Scanned {0} pages of column ''{1}'' ({2} bytes)",
                pages.size(), columnName, position);
        return pages;
    }
}
