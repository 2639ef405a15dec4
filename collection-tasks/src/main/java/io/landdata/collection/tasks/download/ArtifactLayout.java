package io.landdata.collection.tasks.download;

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

import io.landdata.collection.tasks.model.Task;

import java.util.List;
import java.util.Objects;

/// Relative directories of the per-task artifacts published for a collection.
///
/// The same relative path is used below the remote collection prefix and below the local root.
///
/// @param transformedDir transformed parquet files
/// @param issueDir issue logs
/// @param columnFieldDir column-field logs
/// @param datasetResourceDir dataset-resource logs
/// @param convertedResourceDir converted resources
public record ArtifactLayout(String transformedDir, String issueDir, String columnFieldDir,
                             String datasetResourceDir, String convertedResourceDir) {
    private static final ArtifactLayout DEFAULTS = new ArtifactLayout(
        "transformed/", "issue/", "var/column-field/", "var/dataset-resource/", "var/converted-resource/");

    public ArtifactLayout {
        transformedDir = asPrefix(transformedDir);
        issueDir = asPrefix(issueDir);
        columnFieldDir = asPrefix(columnFieldDir);
        datasetResourceDir = asPrefix(datasetResourceDir);
        convertedResourceDir = asPrefix(convertedResourceDir);
    }

    public static ArtifactLayout defaults() {
        return DEFAULTS;
    }

    /// @param task the task, naming dataset and requested resource
    /// @return the five artifact paths for the task
    public List<String> artifactsFor(Task task) {
        String ds = task.dataset();
        String r = task.resource();
        return List.of(
            transformedDir + ds + "/" + r + ".parquet",
            issueDir + ds + "/" + r + ".csv",
            columnFieldDir + ds + "/" + r + ".csv",
            datasetResourceDir + ds + "/" + r + ".csv",
            convertedResourceDir + ds + "/" + r + ".csv");
    }

    /// @param task the task
    /// @return the dataset-resource log path for the task
    public String datasetResourceLogFor(Task task) {
        return datasetResourceDir + task.dataset() + "/" + task.resource() + ".csv";
    }

    static String asPrefix(String dir) {
        Objects.requireNonNull(dir, "dir");
        String normalized = dir.replace('\\', '/');
        return normalized.isEmpty() || normalized.endsWith("/") ? normalized : normalized + "/";
    }
}
