package io.landdata.collection.tasks.collection;

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

import io.landdata.collection.tasks.CollectionConfigurationException;
import io.landdata.collection.tasks.model.CollectionIndex;
import io.landdata.collection.tasks.model.RedirectEntry;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/// A collection read from the `resource.csv` and `old-resource.csv` files of a collection directory.
///
/// `resource.csv` columns used: `resource`, `datasets`, `endpoints`, `organisations`,
/// `start-date`; list columns are `;` separated. `old-resource.csv` columns used:
/// `old-resource`, `status`, `resource`. Other columns are ignored.
public final class CsvResourceCollection implements ResourceCollection {
    private static final Logger logger = LogManager.getLogger(CsvResourceCollection.class);

    public static final String RESOURCE_FILE = "resource.csv";
    public static final String OLD_RESOURCE_FILE = "old-resource.csv";
    public static final String RESOURCE_DIR = "resource";
    private static final String COLLECTION_SUFFIX = "-collection";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreEmptyLines(true)
        .setTrim(true)
        .build();

    private final Path directory;
    private final String name;
    private final CollectionIndex index;
    private final List<RedirectEntry> redirects;
    private final Map<String, ResourceRow> rows;

    private record ResourceRow(List<String> endpoints, List<String> organisations, String startDate) {
    }

    private CsvResourceCollection(Path directory, String name, CollectionIndex index,
                                  List<RedirectEntry> redirects, Map<String, ResourceRow> rows) {
        this.directory = directory;
        this.name = name;
        this.index = index;
        this.redirects = redirects;
        this.rows = rows;
    }

    /// Load a collection directory.
    /// @param directory the collection directory
    /// @return the loaded collection
    /// @throws CollectionConfigurationException if the directory or its `resource.csv` is missing
    /// @throws UncheckedIOException if a file exists but cannot be read
    public static CsvResourceCollection load(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new CollectionConfigurationException("Collection directory does not exist: " + directory);
        }
        Path resourceFile = directory.resolve(RESOURCE_FILE);
        if (!Files.isRegularFile(resourceFile)) {
            throw new CollectionConfigurationException("Collection has no " + RESOURCE_FILE + ": " + resourceFile);
        }

        Map<String, Set<String>> datasetResources = new TreeMap<>();
        Map<String, ResourceRow> rows = new HashMap<>();
        for (CSVRecord record : readAll(resourceFile)) {
            String resource = column(record, "resource");
            if (resource.isEmpty()) {
                continue;
            }
            for (String dataset : splitList(column(record, "datasets"))) {
                datasetResources.computeIfAbsent(dataset, d -> new LinkedHashSet<>()).add(resource);
            }
            rows.put(resource, new ResourceRow(
                splitList(column(record, "endpoints")),
                splitList(column(record, "organisations")),
                column(record, "start-date")));
        }

        List<RedirectEntry> redirects = new ArrayList<>();
        Path oldResourceFile = directory.resolve(OLD_RESOURCE_FILE);
        if (Files.isRegularFile(oldResourceFile)) {
            for (CSVRecord record : readAll(oldResourceFile)) {
                String oldResource = column(record, "old-resource");
                if (!oldResource.isEmpty()) {
                    redirects.add(new RedirectEntry(oldResource, column(record, "resource"), column(record, "status")));
                }
            }
        } else {
            logger.debug("No {} in {}, no redirects", OLD_RESOURCE_FILE, directory);
        }

        logger.info("Loaded collection {}: {} resources in {} datasets, {} redirects",
            directory, rows.size(), datasetResources.size(), redirects.size());
        return new CsvResourceCollection(directory, nameOf(directory), CollectionIndex.of(datasetResources),
            Collections.unmodifiableList(redirects), Collections.unmodifiableMap(rows));
    }

    private static String nameOf(Path directory) {
        Path fileName = directory.toAbsolutePath().normalize().getFileName();
        String dirName = fileName == null ? "" : fileName.toString();
        return dirName.endsWith(COLLECTION_SUFFIX)
            ? dirName.substring(0, dirName.length() - COLLECTION_SUFFIX.length())
            : dirName;
    }

    private static List<CSVRecord> readAll(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {
            return parser.getRecords();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }

    private static String column(CSVRecord record, String name) {
        return record.isMapped(name) && record.isSet(name) ? record.get(name).trim() : "";
    }

    private static List<String> splitList(String value) {
        if (value.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(value.split(";"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CollectionIndex datasetResourceMap() {
        return index;
    }

    @Override
    public List<RedirectEntry> oldResourceEntries() {
        return redirects;
    }

    @Override
    public Path resourcePath(String resource) {
        return directory.resolve(RESOURCE_DIR).resolve(resource);
    }

    @Override
    public List<String> resourceEndpoints(String resource) {
        ResourceRow row = rows.get(resource);
        return row == null ? List.of() : row.endpoints();
    }

    @Override
    public List<String> resourceOrganisations(String resource) {
        ResourceRow row = rows.get(resource);
        return row == null ? List.of() : row.organisations();
    }

    @Override
    public String resourceStartDate(String resource) {
        ResourceRow row = rows.get(resource);
        return row == null ? "" : row.startDate();
    }

    /// @return the collection directory
    public Path directory() {
        return directory;
    }
}
