package io.landdata.collection.tasks.staleness;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Stores fingerprints in the dataset-resource log files, `<root>/<dataset>/<resource>.csv`.
///
/// The pipeline writes these logs itself, with columns such as `entry-count` and `mime-type`.
/// Only the `code-version`, `config-hash` and `specification-hash` columns belong to this store:
/// a write sets them in the existing row and leaves every other column as it was. A log without
/// those columns, without a data row, with a truncated row, or that cannot be parsed counts as
/// never processed.
public class DatasetResourceLogStore implements FingerprintStore {
    private static final Logger logger = LogManager.getLogger(DatasetResourceLogStore.class);

    public static final String DATASET = "dataset";
    public static final String RESOURCE = "resource";
    public static final String CODE_VERSION = "code-version";
    public static final String CONFIG_HASH = "config-hash";
    public static final String SPECIFICATION_HASH = "specification-hash";

    private static final List<String> FINGERPRINT_COLUMNS = List.of(CODE_VERSION, CONFIG_HASH, SPECIFICATION_HASH);

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreEmptyLines(true)
        .build();

    private final Path root;

    /// @param root the dataset-resource log directory
    public DatasetResourceLogStore(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    /// @param dataset the dataset
    /// @param resource the requested resource
    /// @return the log file location for the pair
    public Path logPath(String dataset, String resource) {
        return root.resolve(dataset).resolve(resource + ".csv");
    }

    @Override
    public Optional<Fingerprint> read(String dataset, String resource) throws IOException {
        Path path = logPath(dataset, resource);
        Map<String, String> row = readRow(path);
        for (String column : FINGERPRINT_COLUMNS) {
            if (!row.containsKey(column)) {
                logger.debug("Dataset resource log {} has no {} value", path, column);
                return Optional.empty();
            }
        }
        return Optional.of(new Fingerprint(row.get(CODE_VERSION), row.get(CONFIG_HASH), row.get(SPECIFICATION_HASH)));
    }

    @Override
    public void write(String dataset, String resource, Fingerprint fingerprint) throws IOException {
        Path path = logPath(dataset, resource);
        Files.createDirectories(path.getParent());

        Map<String, String> row = readRow(path);
        if (row.getOrDefault(DATASET, "").isEmpty()) {
            row.put(DATASET, dataset);
        }
        if (row.getOrDefault(RESOURCE, "").isEmpty()) {
            row.put(RESOURCE, resource);
        }
        row.put(CODE_VERSION, fingerprint.codeVersion());
        row.put(CONFIG_HASH, fingerprint.configHash());
        row.put(SPECIFICATION_HASH, fingerprint.specificationHash());

        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(row.keySet().toArray(new String[0]))
            .setRecordSeparator('\n')
            .build();
        Path partial = Files.createTempFile(path.getParent(), resource, ".part");
        try {
            try (Writer writer = Files.newBufferedWriter(partial, StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, format)) {
                printer.printRecord(row.values());
            }
            Files.move(partial, path, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(partial);
        }
    }

    /// The first data row of a log, keyed by header in header order. Columns missing from a
    /// truncated row are absent. A missing or unparseable log yields an empty map.
    private Map<String, String> readRow(Path path) {
        Map<String, String> row = new LinkedHashMap<>();
        if (!Files.isRegularFile(path)) {
            return row;
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = READ_FORMAT.parse(reader)) {
            Iterator<CSVRecord> records = parser.iterator();
            CSVRecord record = records.hasNext() ? records.next() : null;
            for (String column : parser.getHeaderNames()) {
                if (record == null) {
                    continue;
                }
                if (record.isSet(column)) {
                    row.put(column, record.get(column));
                } else {
                    logger.warn("Dataset resource log {} is truncated at column {}", path, column);
                    break;
                }
            }
            return row;
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            logger.warn("Ignoring unreadable dataset resource log {}: {}", path, e.getMessage());
            return new LinkedHashMap<>();
        }
    }
}
