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

import io.landdata.collection.tasks.collection.CsvResourceCollection;
import io.landdata.collection.tasks.runner.RunSummary;
import io.landdata.collection.tasks.runner.TaskRunner;
import io.landdata.collection.tasks.transform.CommandTransformEngine;
import io.landdata.collection.tasks.transform.ResourceTransformer;
import io.landdata.collection.tasks.transform.TransformDirectories;
import io.landdata.collection.tasks.transform.TransformEngine;
import io.landdata.command.common.CollectionCommand;
import io.landdata.command.common.TaskWindowOption;
import io.landdata.status.ProgressReporter;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Arrays;

/// Transform the selected resources with the external pipeline, one child process per task
@CommandLine.Command(name = "transform-resources",
    header = "Transform collection resources",
    description = "Runs the pipeline command for each selected (dataset, resource) task in parallel,"
        + " skipping tasks whose dataset resource log matches the current code, configuration and specification",
    exitCodeList = {"0: success or nothing to do", "1: a task failed, or range or configuration error",
        "2: usage error"})
public class CMD_transform_resources extends CollectionCommand {

    @CommandLine.Mixin
    private final TaskWindowOption window = new TaskWindowOption();

    @CommandLine.Option(names = {"--max-workers"}, defaultValue = "${env:TRANSFORMED_JOBS}",
        description = "Number of concurrent transforms (default: number of CPUs)")
    private Integer maxWorkers;

    @CommandLine.Option(names = {"--reprocess"},
        description = "Reprocess all resources, even those whose dataset resource log is up-to-date")
    private boolean reprocess;

    @CommandLine.Option(names = {"--transform-command"},
        defaultValue = "${env:TRANSFORM_COMMAND:-digital-land pipeline}",
        description = "Pipeline command, split on whitespace (default: ${DEFAULT-VALUE})")
    private String transformCommand;

    @CommandLine.Option(names = {"--code-version"}, defaultValue = "${env:PIPELINE_CODE_VERSION:-unknown}",
        description = "Pipeline version recorded in dataset resource logs (default: ${DEFAULT-VALUE})")
    private String codeVersion;

    @CommandLine.Option(names = {"--pipeline-dir"}, defaultValue = TransformDirectories.DEFAULT_PIPELINE_DIR,
        description = "Pipeline configuration directory (default: ${DEFAULT-VALUE})")
    private Path pipelineDir;

    @CommandLine.Option(names = {"--specification-dir"}, defaultValue = TransformDirectories.DEFAULT_SPECIFICATION_DIR,
        description = "Specification directory (default: ${DEFAULT-VALUE})")
    private Path specificationDir;

    @CommandLine.Option(names = {"--cache-dir"}, defaultValue = TransformDirectories.DEFAULT_CACHE_DIR,
        description = "Cache directory (default: ${DEFAULT-VALUE})")
    private Path cacheDir;

    @CommandLine.Option(names = {"--transformed-dir"}, defaultValue = TransformDirectories.DEFAULT_TRANSFORMED_DIR,
        description = "Transformed output directory (default: ${DEFAULT-VALUE})")
    private Path transformedDir;

    @CommandLine.Option(names = {"--issue-dir"}, defaultValue = TransformDirectories.DEFAULT_ISSUE_DIR,
        description = "Issue directory (default: ${DEFAULT-VALUE})")
    private Path issueDir;

    @CommandLine.Option(names = {"--operational-issue-dir"},
        defaultValue = TransformDirectories.DEFAULT_OPERATIONAL_ISSUE_DIR,
        description = "Operational issue directory (default: ${DEFAULT-VALUE})")
    private Path operationalIssueDir;

    @CommandLine.Option(names = {"--output-log-dir"}, defaultValue = TransformDirectories.DEFAULT_OUTPUT_LOG_DIR,
        description = "Output log directory (default: ${DEFAULT-VALUE})")
    private Path outputLogDir;

    @CommandLine.Option(names = {"--column-field-dir"}, defaultValue = TransformDirectories.DEFAULT_COLUMN_FIELD_DIR,
        description = "Column field directory (default: ${DEFAULT-VALUE})")
    private Path columnFieldDir;

    @CommandLine.Option(names = {"--dataset-resource-dir"},
        defaultValue = TransformDirectories.DEFAULT_DATASET_RESOURCE_DIR,
        description = "Dataset resource directory (default: ${DEFAULT-VALUE})")
    private Path datasetResourceDir;

    @CommandLine.Option(names = {"--converted-resource-dir"},
        defaultValue = TransformDirectories.DEFAULT_CONVERTED_RESOURCE_DIR,
        description = "Converted resource directory (default: ${DEFAULT-VALUE})")
    private Path convertedResourceDir;

    TransformDirectories directories() {
        return new TransformDirectories(collectionDir, pipelineDir, specificationDir, cacheDir, transformedDir,
            issueDir, operationalIssueDir, outputLogDir, columnFieldDir, datasetResourceDir, convertedResourceDir);
    }

    TransformEngine engine() {
        return new CommandTransformEngine(Arrays.asList(transformCommand.trim().split("\\s+")), codeVersion);
    }

    @Override
    protected int execute(CsvResourceCollection collection, ProgressReporter reporter) {
        ResourceTransformer transformer = new ResourceTransformer(collection, engine(), new TaskRunner(reporter));
        RunSummary summary = transformer.transform(directories(), window.toWindow(), maxWorkers, reprocess);
        if (summary.noop()) {
            System.out.println("\nNo transformation tasks to process");
            return 0;
        }
        System.out.println("\nProcessing complete!");
        System.out.println("Successful: " + summary.successful());
        System.out.println("Failed: " + summary.failed());
        return summary.hasFailures() ? 1 : 0;
    }
}
