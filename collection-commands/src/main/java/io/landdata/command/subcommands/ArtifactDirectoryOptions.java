package io.landdata.command.subcommands;

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

import io.landdata.collection.tasks.download.ArtifactLayout;
import io.landdata.collection.tasks.transform.TransformDirectories;
import picocli.CommandLine;

/// Local (and remote) directories of the per-task artifacts
public class ArtifactDirectoryOptions {

    @CommandLine.Option(names = {"--transformed-dir"}, defaultValue = TransformDirectories.DEFAULT_TRANSFORMED_DIR,
        description = "Directory for transformed files (default: ${DEFAULT-VALUE})")
    String transformedDir;

    @CommandLine.Option(names = {"--issue-dir"}, defaultValue = TransformDirectories.DEFAULT_ISSUE_DIR,
        description = "Directory for issue files (default: ${DEFAULT-VALUE})")
    String issueDir;

    @CommandLine.Option(names = {"--column-field-dir"}, defaultValue = TransformDirectories.DEFAULT_COLUMN_FIELD_DIR,
        description = "Directory for column field mappings (default: ${DEFAULT-VALUE})")
    String columnFieldDir;

    @CommandLine.Option(names = {"--dataset-resource-dir"},
        defaultValue = TransformDirectories.DEFAULT_DATASET_RESOURCE_DIR,
        description = "Directory for dataset resource logs (default: ${DEFAULT-VALUE})")
    String datasetResourceDir;

    @CommandLine.Option(names = {"--converted-resource-dir"},
        defaultValue = TransformDirectories.DEFAULT_CONVERTED_RESOURCE_DIR,
        description = "Directory for converted resources (default: ${DEFAULT-VALUE})")
    String convertedResourceDir;

    ArtifactLayout toLayout() {
        return new ArtifactLayout(transformedDir, issueDir, columnFieldDir, datasetResourceDir, convertedResourceDir);
    }
}
