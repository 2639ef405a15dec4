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
import io.landdata.collection.tasks.download.TransformedDownloader;
import io.landdata.command.common.CollectionCommand;
import io.landdata.command.common.RemoteSourceOption;
import io.landdata.command.common.TaskWindowOption;
import io.landdata.status.ProgressReporter;
import picocli.CommandLine;

import java.nio.file.Path;

/// Download the published artifacts of already transformed tasks
@CommandLine.Command(name = "download-transformed",
    header = "Download transformed artifacts",
    description = "Downloads transformed, issue, column-field, dataset-resource and converted-resource files"
        + " for the selected transformation tasks, skipping retired resources",
    exitCodeList = {"0: success", "1: download, range or configuration error", "2: usage error"})
public class CMD_download_transformed extends CollectionCommand {

    @CommandLine.Mixin
    private final RemoteSourceOption remote = new RemoteSourceOption();

    @CommandLine.Mixin
    private final TaskWindowOption window = new TaskWindowOption();

    @CommandLine.Mixin
    private final ArtifactDirectoryOptions directories = new ArtifactDirectoryOptions();

    @CommandLine.Option(names = {"--max-threads"}, defaultValue = "${env:DOWNLOAD_THREADS:-4}",
        description = "Maximum number of concurrent download threads (default: ${DEFAULT-VALUE})")
    private int maxThreads;

    @CommandLine.Option(names = {"--local-root"}, defaultValue = ".",
        description = "Local directory the artifact paths are resolved against (default: ${DEFAULT-VALUE})")
    private Path localRoot;

    @Override
    protected int execute(CsvResourceCollection collection, ProgressReporter reporter) {
        new TransformedDownloader(collection, newFetcher(reporter), localRoot)
            .download(remote.toSource(collection.name()), window.toWindow(), directories.toLayout(), maxThreads);
        return 0;
    }
}
