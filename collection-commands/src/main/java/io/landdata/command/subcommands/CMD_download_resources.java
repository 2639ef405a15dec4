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
import io.landdata.collection.tasks.download.ResourceDownloader;
import io.landdata.collection.tasks.fetch.ConcurrentFetcher;
import io.landdata.command.common.CollectionCommand;
import io.landdata.command.common.RemoteSourceOption;
import io.landdata.command.common.TaskWindowOption;
import io.landdata.status.ProgressReporter;
import picocli.CommandLine;

/// Download the raw resources needed by a shard of transformation tasks
@CommandLine.Command(name = "download-resources",
    header = "Download collection resources",
    description = "Downloads the resources of the selected transformation tasks into <collection-dir>/resource/",
    exitCodeList = {"0: success", "1: download, range or configuration error", "2: usage error"})
public class CMD_download_resources extends CollectionCommand {

    @CommandLine.Mixin
    private final RemoteSourceOption remote = new RemoteSourceOption();

    @CommandLine.Mixin
    private final TaskWindowOption window = new TaskWindowOption();

    @CommandLine.Option(names = {"--max-threads"}, defaultValue = "${env:DOWNLOAD_THREADS:-4}",
        description = "Maximum number of concurrent download threads (default: ${DEFAULT-VALUE})")
    private int maxThreads;

    @Override
    protected int execute(CsvResourceCollection collection, ProgressReporter reporter) {
        ConcurrentFetcher fetcher = newFetcher(reporter);
        new ResourceDownloader(collection, fetcher)
            .download(remote.toSource(collection.name()), window.toWindow(), maxThreads);
        return 0;
    }
}
