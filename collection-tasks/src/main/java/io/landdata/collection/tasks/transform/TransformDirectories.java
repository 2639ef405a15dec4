package io.landdata.collection.tasks.transform;

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

import java.nio.file.Path;
import java.util.Objects;

/**
 * Input and output locations shared by every transform of a run.
 * <p>
 * The per-dataset accessors resolve the dataset's subdirectory of the corresponding root.
 *
 * @param collectionDir the collection directory
 * @param pipelineDir pipeline configuration, hashed into the fingerprint
 * @param specificationDir specification files, hashed into the fingerprint
 * @param cacheDir engine cache, holding {@code config.sqlite3} and {@code organisation.csv}
 * @param transformedDir transformed output root
 * @param issueDir issue log root
 * @param operationalIssueDir operational issue directory
 * @param outputLogDir per-task output log root
 * @param columnFieldDir column-field log root
 * @param datasetResourceDir dataset-resource log root, where fingerprints are kept
 * @param convertedResourceDir converted resource root
 */
public record TransformDirectories(
    Path collectionDir,
    Path pipelineDir,
    Path specificationDir,
    Path cacheDir,
    Path transformedDir,
    Path issueDir,
    Path operationalIssueDir,
    Path outputLogDir,
    Path columnFieldDir,
    Path datasetResourceDir,
    Path convertedResourceDir
) {
    public static final String DEFAULT_PIPELINE_DIR = "pipeline/";
    public static final String DEFAULT_SPECIFICATION_DIR = "specification/";
    public static final String DEFAULT_CACHE_DIR = "var/cache/";
    public static final String DEFAULT_TRANSFORMED_DIR = "transformed/";
    public static final String DEFAULT_ISSUE_DIR = "issue/";
    public static final String DEFAULT_OPERATIONAL_ISSUE_DIR = "performance/operational_issue/";
    public static final String DEFAULT_OUTPUT_LOG_DIR = "log/";
    public static final String DEFAULT_COLUMN_FIELD_DIR = "var/column-field/";
    public static final String DEFAULT_DATASET_RESOURCE_DIR = "var/dataset-resource/";
    public static final String DEFAULT_CONVERTED_RESOURCE_DIR = "var/converted-resource/";

    public TransformDirectories {
        Objects.requireNonNull(collectionDir, "collectionDir");
        Objects.requireNonNull(pipelineDir, "pipelineDir");
        Objects.requireNonNull(specificationDir, "specificationDir");
        Objects.requireNonNull(cacheDir, "cacheDir");
        Objects.requireNonNull(transformedDir, "transformedDir");
        Objects.requireNonNull(issueDir, "issueDir");
        Objects.requireNonNull(operationalIssueDir, "operationalIssueDir");
        Objects.requireNonNull(outputLogDir, "outputLogDir");
        Objects.requireNonNull(columnFieldDir, "columnFieldDir");
        Objects.requireNonNull(datasetResourceDir, "datasetResourceDir");
        Objects.requireNonNull(convertedResourceDir, "convertedResourceDir");
    }

    /**
     * The default layout, relative to {@code base}.
     */
    public static TransformDirectories defaults(Path collectionDir, Path base) {
        return new TransformDirectories(
            collectionDir,
            base.resolve(DEFAULT_PIPELINE_DIR),
            base.resolve(DEFAULT_SPECIFICATION_DIR),
            base.resolve(DEFAULT_CACHE_DIR),
            base.resolve(DEFAULT_TRANSFORMED_DIR),
            base.resolve(DEFAULT_ISSUE_DIR),
            base.resolve(DEFAULT_OPERATIONAL_ISSUE_DIR),
            base.resolve(DEFAULT_OUTPUT_LOG_DIR),
            base.resolve(DEFAULT_COLUMN_FIELD_DIR),
            base.resolve(DEFAULT_DATASET_RESOURCE_DIR),
            base.resolve(DEFAULT_CONVERTED_RESOURCE_DIR));
    }

    public Path configPath() {
        return cacheDir.resolve("config.sqlite3");
    }

    public Path organisationPath() {
        return cacheDir.resolve("organisation.csv");
    }

    public Path transformedDir(String dataset) {
        return transformedDir.resolve(dataset);
    }

    public Path issueDir(String dataset) {
        return issueDir.resolve(dataset);
    }

    public Path columnFieldDir(String dataset) {
        return columnFieldDir.resolve(dataset);
    }

    public Path datasetResourceDir(String dataset) {
        return datasetResourceDir.resolve(dataset);
    }

    public Path convertedResourceDir(String dataset) {
        return convertedResourceDir.resolve(dataset);
    }
}
