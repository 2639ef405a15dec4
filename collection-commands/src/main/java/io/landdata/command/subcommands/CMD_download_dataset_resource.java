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
import io.landdata.collection.tasks.download.ArtifactLayout;
import io.landdata.collection.tasks.download.DatasetResourceLogDownloader;
import io.landdata.collection.tasks.transform.TransformDirectories;
import io.landdata.command.common.CollectionCommand;
import io.landdata.command.common.RemoteSourceOption;
import io.landdata.status.ProgressReporter;
import picocli.CommandLine;

import java.nio.file.Path;

/// Download the dataset resource logs used to skip up-to-date transforms
@CommandLine.Command(name = "download-dataset-resource",
    header = "Download dataset resource logs",
    description = "Downloads the dataset resource log of every task. Missing logs are counted, not errors:"
        + " those resources will be processed.",
    exitCodeList = {"0: success", "1: configuration error", "2: usage error"})
public class CMD_download_dataset_resource extends CollectionCommand {

    @CommandLine.Mixin
    private final RemoteSourceOption remote = new RemoteSourceOption();

    @CommandLine.Option(names = {"--dataset"}, description = "Filter downloads to only this dataset")
    private String dataset;

    @CommandLine.Option(names = {"--dataset-resource-dir"},
        defaultValue = TransformDirectories.DEFAULT_DATASET_RESOURCE_DIR,
        description = "Directory for dataset resource logs (default: ${DEFAULT-VALUE})")
    private String datasetResourceDir;

    @CommandLine.Option(names = {"--max-threads"}, defaultValue = "${env:DOWNLOAD_THREADS:-4}",
        description = "Maximum number of concurrent download threads (default: ${DEFAULT-VALUE})")
    private int maxThreads;

    @CommandLine.Option(names = {"--local-root"}, defaultValue = ".",
        description = "Local directory the artifact paths are resolved against (default: ${DEFAULT-VALUE})")
    private Path localRoot;

    @Override
    protected int execute(CsvResourceCollection collection, ProgressReporter reporter) {
        ArtifactLayout defaults = ArtifactLayout.defaults();
        ArtifactLayout layout = new ArtifactLayout(defaults.transformedDir(), defaults.issueDir(),
            defaults.columnFieldDir(), datasetResourceDir, defaults.convertedResourceDir());
        DatasetResourceLogDownloader.Result result = new DatasetResourceLogDownloader(
            collection, newFetcher(reporter), localRoot)
            .download(remote.toSource(collection.name()), dataset, layout, maxThreads);
        System.out.printf("Downloaded %d dataset resource logs, %d not found%n", result.downloaded(), result.notFound());
        return 0;
    }
}
