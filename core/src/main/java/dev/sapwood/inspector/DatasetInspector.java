/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sapwood.inspector;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import dev.sapwood.descriptor.ColumnDescriptor;
import dev.sapwood.descriptor.DatasetDescriptor;
import dev.sapwood.descriptor.FieldDescriptor;
import dev.sapwood.internal.reader.InspectionEvent;
import dev.sapwood.metadata.CompressionCodec;
import dev.sapwood.metadata.PhysicalType;
import dev.sapwood.reader.Dataset;
import dev.sapwood.reader.PageSource;
import dev.sapwood.reader.ParquetFile;

/**
 * Reports storage statistics of a dataset: on-disk and in-memory size per column, per field
 * subtree and for the whole dataset, the compression setting, and column and field counts by type.
 * <p>
 * All statistics are collected when the inspector is created, from a copy of the dataset's
 * descriptor; queries only read them, so they can be issued from several threads. {@link #close()}
 * is idempotent and safe to call concurrently.
 * </p>
 *
 * <pre>{@code
 * try (DatasetInspector inspector = DatasetInspector.create("schema", Path.of("trips.parquet"))) {
 *     System.out.println(inspector.getOnDiskSize() + " bytes, compression factor "
 *             + inspector.getCompressionFactor());
 * }
 * }</pre>
 *
 * The inspector owns the page source it reads from, and the file it opened itself; both are
 * released by {@link #close()}.
 */
public final class DatasetInspector implements AutoCloseable {

    private static final System.Logger LOG = System.getLogger(DatasetInspector.class.getName());

    private final PageSource pageSource;
    private final ParquetFile sourceFile;
    private final DatasetDescriptor descriptor;
    private final Map<Integer, ColumnInfo> columnInfos;
    private final Map<Integer, FieldTreeInfo> fieldTreeInfos;
    private final long onDiskSize;
    private final long inMemorySize;
    private final int compressionSettings;
    private final List<CompressionMismatch> compressionMismatches;

    private boolean closed; // guarded by this

    private DatasetInspector(PageSource pageSource, ParquetFile sourceFile, InspectorOptions options)
            throws IOException {
        this.pageSource = pageSource;
        this.sourceFile = sourceFile;

        pageSource.attach();
        this.descriptor = pageSource.getDescriptor().copy();

        InspectionEvent event = new InspectionEvent();
        event.begin();

        ColumnStatsCollector.Result columns = ColumnStatsCollector.collect(descriptor);
        if (!columns.isConsistent()) {
            handleMismatches(columns.mismatches(), options.mismatchPolicy());
        }

        this.columnInfos = columns.columnInfos();
        this.onDiskSize = columns.onDiskSize();
        this.inMemorySize = columns.inMemorySize();
        this.compressionSettings = columns.compressionSettings();
        this.compressionMismatches = columns.mismatches();
        this.fieldTreeInfos = FieldTreeAggregator.aggregate(descriptor, columnInfos);

        event.dataset = descriptor.getName();
        event.columns = descriptor.getPhysicalColumnCount();
        event.fields = descriptor.getFieldCount();
        event.onDiskSize = onDiskSize;
        event.inMemorySize = inMemorySize;
        event.commit();

        LOG.log(System.Logger.Level.DEBUG,
                "Inspected dataset ''{0}'': {1} columns, {2} fields, {3} clusters, {4} bytes on disk, {5} bytes in memory",
                descriptor.getName(), descriptor.getPhysicalColumnCount(), descriptor.getFieldCount(),
                descriptor.getClusterCount(), onDiskSize, inMemorySize);
    }

    private void handleMismatches(List<CompressionMismatch> mismatches, MismatchPolicy policy)
            throws CompressionMismatchException {
        if (policy == MismatchPolicy.FAIL) {
            throw new CompressionMismatchException(descriptor.getName(), mismatches);
        }
        for (CompressionMismatch mismatch : mismatches) {
            LOG.log(System.Logger.Level.WARNING, "Dataset ''{0}'': {1}", descriptor.getName(), mismatch);
        }
    }

    /**
     * Creates an inspector reading from the given page source, which it takes ownership of.
     * The source is closed if inspection fails. Options are read from system properties, see
     * {@link InspectorOptions#fromSystemProperties()}.
     *
     * @throws CompressionMismatchException if the clusters disagree on the compression setting
     * @throws IOException if the source cannot be attached
     */
    public static DatasetInspector create(PageSource pageSource) throws IOException {
        InspectorOptions options;
        try {
            options = InspectorOptions.fromSystemProperties();
        }
        catch (IllegalArgumentException e) {
            closeAfterFailure(e, pageSource);
            throw e;
        }
        return create(pageSource, options);
    }

    public static DatasetInspector create(PageSource pageSource, InspectorOptions options) throws IOException {
        if (pageSource == null) {
            throw new IllegalArgumentException("Provided page source is null");
        }
        return create(pageSource, null, options);
    }

    /**
     * Creates an inspector for the given dataset, reading from a page source of its own.
     * Options are read from system properties.
     */
    public static DatasetInspector create(Dataset dataset) throws IOException {
        return create(dataset, InspectorOptions.fromSystemProperties());
    }

    public static DatasetInspector create(Dataset dataset, InspectorOptions options) throws IOException {
        if (dataset == null) {
            throw new IllegalArgumentException("Provided dataset is null");
        }
        return create(dataset.openPageSource(), null, options);
    }

    /**
     * Opens the given Parquet file and creates an inspector for the named dataset in it.
     * The file stays open until the inspector is closed. Options are read from system properties.
     *
     * @throws IOException if the file cannot be opened or is not a Parquet file
     * @throws IllegalArgumentException if the file does not hold the named dataset
     */
    public static DatasetInspector create(String datasetName, Path sourceFileName) throws IOException {
        return create(datasetName, sourceFileName, InspectorOptions.fromSystemProperties());
    }

    public static DatasetInspector create(String datasetName, Path sourceFileName, InspectorOptions options)
            throws IOException {
        if (datasetName == null || sourceFileName == null) {
            throw new IllegalArgumentException("Dataset name and source file must not be null");
        }

        return create(datasetName, ParquetFile.open(sourceFileName), options);
    }

    /**
     * Creates an inspector for the named dataset of an open file, which it takes ownership of.
     * The file is closed if the dataset is not found or inspection fails.
     */
    static DatasetInspector create(String datasetName, ParquetFile sourceFile, InspectorOptions options)
            throws IOException {
        Optional<Dataset> dataset = sourceFile.findDataset(datasetName);
        if (dataset.isEmpty()) {
            IllegalArgumentException notFound = new IllegalArgumentException(
                    "Cannot read dataset '" + datasetName + "' from " + sourceFile.getPath());
            closeAfterFailure(notFound, sourceFile);
            throw notFound;
        }

        PageSource pageSource;
        try {
            pageSource = dataset.get().openPageSource();
        }
        catch (IOException | RuntimeException e) {
            closeAfterFailure(e, sourceFile);
            throw e;
        }
        return create(pageSource, sourceFile, options);
    }

    private static DatasetInspector create(PageSource pageSource, ParquetFile sourceFile, InspectorOptions options)
            throws IOException {
        if (options == null) {
            closeAfterFailure(null, pageSource, sourceFile);
            throw new IllegalArgumentException("Options must not be null");
        }
        try {
            return new DatasetInspector(pageSource, sourceFile, options);
        }
        catch (IOException | RuntimeException e) {
            closeAfterFailure(e, pageSource, sourceFile);
            throw e;
        }
    }

    private static void closeAfterFailure(Exception failure, AutoCloseable... resources) {
        for (AutoCloseable resource : resources) {
            if (resource == null) {
                continue;
            }
            try {
                resource.close();
            }
            catch (Exception closeException) {
                if (failure != null) {
                    failure.addSuppressed(closeException);
                }
                else {
                    LOG.log(System.Logger.Level.WARNING, "Failed to close " + resource, closeException);
                }
            }
        }
    }

    /**
     * Returns the inspector's own copy of the dataset descriptor.
     */
    public DatasetDescriptor getDescriptor() {
        return descriptor;
    }

    /**
     * Returns the compression setting shared by all column ranges, -1 if the dataset holds no data.
     */
    public int getCompressionSettings() {
        return compressionSettings;
    }

    /**
     * Returns the name of the codec the compression setting stands for, "unknown" if there is none.
     */
    public String getCompressionSettingsAsString() {
        return CompressionCodec.find(compressionSettings)
                .map(CompressionCodec::name)
                .orElse("unknown");
    }

    /**
     * False if column ranges with a different compression setting were tolerated.
     *
     * @see MismatchPolicy#WARN
     */
    public boolean isCompressionUniform() {
        return compressionMismatches.isEmpty();
    }

    public List<CompressionMismatch> getCompressionMismatches() {
        return compressionMismatches;
    }

    /**
     * Bytes on storage of all pages of all physical columns.
     */
    public long getOnDiskSize() {
        return onDiskSize;
    }

    /**
     * Size of all column elements in their default in-memory representation.
     */
    public long getInMemorySize() {
        return inMemorySize;
    }

    /**
     * Ratio of in-memory to on-disk size; 0 for a dataset without pages.
     */
    public double getCompressionFactor() {
        return onDiskSize == 0 ? 0 : (double) inMemorySize / onDiskSize;
    }

    public int getColumnCount() {
        return descriptor.getPhysicalColumnCount();
    }

    /**
     * Returns the statistics of all physical columns, ordered by column id.
     */
    public List<ColumnInfo> getColumnInfos() {
        List<ColumnInfo> result = new ArrayList<>(columnInfos.size());
        for (int columnId = 0; columnId < descriptor.getPhysicalColumnCount(); columnId++) {
            result.add(columnInfos.get(columnId));
        }
        return result;
    }

    /**
     * @throws IllegalArgumentException if there is no physical column with that id
     */
    public ColumnInfo getColumnInfo(int physicalColumnId) {
        if (physicalColumnId < 0 || physicalColumnId >= descriptor.getPhysicalColumnCount()) {
            throw new IllegalArgumentException("No column with physical ID " + physicalColumnId + " present");
        }
        return columnInfos.get(physicalColumnId);
    }

    public int getColumnTypeCount(PhysicalType type) {
        int typeCount = 0;
        for (ColumnInfo columnInfo : columnInfos.values()) {
            if (columnInfo.type() == type) {
                typeCount++;
            }
        }
        return typeCount;
    }

    /**
     * Returns the ids of all physical columns of the given type, ascending.
     */
    public List<Integer> getColumnsByType(PhysicalType type) {
        List<Integer> columnIds = new ArrayList<>();
        for (int columnId = 0; columnId < descriptor.getPhysicalColumnCount(); columnId++) {
            if (columnInfos.get(columnId).type() == type) {
                columnIds.add(columnId);
            }
        }
        return columnIds;
    }

    /**
     * @throws IllegalArgumentException if there is no field with that id
     */
    public FieldTreeInfo getFieldTreeInfo(int fieldId) {
        if (fieldId < 0 || fieldId >= descriptor.getFieldCount()) {
            throw new IllegalArgumentException("No field with ID " + fieldId + " present");
        }
        return fieldTreeInfos.get(fieldId);
    }

    /**
     * @param fieldName the qualified field name, e.g. {@code "address.city"}
     * @throws IllegalArgumentException if there is no field with that name
     */
    public FieldTreeInfo getFieldTreeInfo(String fieldName) {
        int fieldId = descriptor.findFieldId(fieldName);
        if (fieldId == DatasetDescriptor.INVALID_ID) {
            throw new IllegalArgumentException("Could not find field '" + fieldName + "'");
        }
        return getFieldTreeInfo(fieldId);
    }

    /**
     * Counts the fields with the given type name.
     *
     * @param includeSubFields whether to count nested fields too, or only top-level fields
     */
    public int getFieldTypeCount(String typeName, boolean includeSubFields) {
        int typeCount = 0;
        for (FieldTreeInfo fieldInfo : fieldTreeInfos.values()) {
            if (isCandidate(fieldInfo.descriptor(), includeSubFields)
                    && fieldInfo.descriptor().typeName().equals(typeName)) {
                typeCount++;
            }
        }
        return typeCount;
    }

    /**
     * Counts the fields whose type name matches the given pattern as a whole.
     */
    public int getFieldTypeCount(Pattern typeNamePattern, boolean includeSubFields) {
        int typeCount = 0;
        for (FieldTreeInfo fieldInfo : fieldTreeInfos.values()) {
            if (isCandidate(fieldInfo.descriptor(), includeSubFields)
                    && typeNamePattern.matcher(fieldInfo.descriptor().typeName()).matches()) {
                typeCount++;
            }
        }
        return typeCount;
    }

    /**
     * Returns the ids of the fields whose name matches the given pattern as a whole, ascending.
     *
     * @param searchInSubFields whether to consider nested fields too, or only top-level fields
     */
    public List<Integer> getFieldsByName(Pattern fieldNamePattern, boolean searchInSubFields) {
        List<Integer> fieldIds = new ArrayList<>();
        for (int fieldId = 0; fieldId < descriptor.getFieldCount(); fieldId++) {
            FieldDescriptor field = descriptor.getFieldDescriptor(fieldId);
            if (field.id() != descriptor.getFieldZeroId() && isCandidate(field, searchInSubFields)
                    && fieldNamePattern.matcher(field.fieldName()).matches()) {
                fieldIds.add(fieldId);
            }
        }
        return fieldIds;
    }

    private boolean isCandidate(FieldDescriptor field, boolean includeSubFields) {
        return includeSubFields || field.parentId() == descriptor.getFieldZeroId();
    }

    /**
     * Returns the ids of all physical columns in the subtree of the given field, alias columns
     * excluded. The order of the ids carries no meaning.
     *
     * @throws IllegalArgumentException if there is no field with that id
     */
    public List<Integer> getColumnsForFieldTree(int fieldId) {
        if (fieldId < 0 || fieldId >= descriptor.getFieldCount()) {
            throw new IllegalArgumentException("No field with ID " + fieldId + " present");
        }

        List<Integer> columnIds = new ArrayList<>();
        Deque<Integer> fieldIdQueue = new ArrayDeque<>();
        fieldIdQueue.add(fieldId);

        while (!fieldIdQueue.isEmpty()) {
            int currentId = fieldIdQueue.poll();

            for (ColumnDescriptor column : descriptor.getColumns(currentId)) {
                if (!column.isAliasColumn()) {
                    columnIds.add(column.physicalId());
                }
            }
            for (FieldDescriptor subField : descriptor.getSubFields(currentId)) {
                fieldIdQueue.add(subField.id());
            }
        }

        return columnIds;
    }

    /**
     * Returns column statistics summed up per column type, for the types present in the dataset.
     */
    public List<ColumnTypeSummary> getColumnTypeSummaries() {
        Map<PhysicalType, ColumnTypeSummary> summaries = new EnumMap<>(PhysicalType.class);
        for (ColumnInfo columnInfo : getColumnInfos()) {
            ColumnTypeSummary summary = summaries.getOrDefault(columnInfo.type(),
                    new ColumnTypeSummary(columnInfo.type(), 0, 0, 0, 0));
            summaries.put(columnInfo.type(), summary.add(columnInfo));
        }
        return new ArrayList<>(summaries.values());
    }

    /**
     * Prints the per-type column statistics, one line per column type.
     */
    public void printColumnTypeInfo(PrintFormat format, PrintStream output) {
        List<ColumnTypeSummary> summaries = getColumnTypeSummaries();
        switch (format) {
            case TABLE -> {
                output.println(" column type          | count   | # elements      | compressed bytes  | uncompressed bytes");
                output.println("----------------------|---------|-----------------|-------------------|--------------------");
                for (ColumnTypeSummary summary : summaries) {
                    output.println(String.format(Locale.ROOT, " %-20s | %7d | %15d | %17d | %18d",
                            summary.type(), summary.columnCount(), summary.elementCount(), summary.onDiskSize(),
                            summary.inMemorySize()));
                }
            }
            case CSV -> {
                output.println("columnType,count,nElements,compressedSize,uncompressedSize");
                for (ColumnTypeSummary summary : summaries) {
                    output.println(summary.type() + "," + summary.columnCount() + "," + summary.elementCount() + ","
                            + summary.onDiskSize() + "," + summary.inMemorySize());
                }
            }
        }
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;

        IOException failure = null;
        for (AutoCloseable resource : new AutoCloseable[]{ pageSource, sourceFile }) {
            if (resource == null) {
                continue;
            }
            try {
                resource.close();
            }
            catch (Exception e) {
                IOException closeFailure = e instanceof IOException io ? io : new IOException(e);
                if (failure == null) {
                    failure = closeFailure;
                }
                else {
                    failure.addSuppressed(closeFailure);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
