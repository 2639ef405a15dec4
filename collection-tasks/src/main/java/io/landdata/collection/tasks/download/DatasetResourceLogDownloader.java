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

import io.landdata.collection.tasks.TaskWindow;
import io.landdata.collection.tasks.collection.RemoteSource;
import io.landdata.collection.tasks.collection.ResourceCollection;
import io.landdata.collection.tasks.fetch.ConcurrentFetcher;
import io.landdata.collection.tasks.model.Task;
import io.landdata.collection.tasks.model.TaskList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Downloads the dataset-resource logs that hold the fingerprint of each task's last run.
///
/// Every task of the dataset filter is covered; there is no shard window. A missing log means the
/// task was never processed, so each log gets a single attempt and failures are only counted.
public class DatasetResourceLogDownloader {
    private static final Logger logger = LogManager.getLogger(DatasetResourceLogDownloader.class);

    private final ResourceCollection collection;
    private final ConcurrentFetcher fetcher;
    private final Path localRoot;

    /// Counts of a log download run.
    /// @param downloaded logs fetched
    /// @param notFound logs that could not be fetched
    public record Result(int downloaded, int notFound) {
    }

    /// @param collection the loaded collection
    /// @param fetcher the shared fetcher
    /// @param localRoot directory the log directory is resolved against
    public DatasetResourceLogDownloader(ResourceCollection collection, ConcurrentFetcher fetcher, Path localRoot) {
        this.collection = Objects.requireNonNull(collection, "collection");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.localRoot = Objects.requireNonNull(localRoot, "localRoot");
    }

    /// @param source where the collection is published
    /// @param dataset dataset to restrict to, or null for all
    /// @param layout artifact directories; only the dataset-resource directory is used
    /// @param maxThreads concurrent downloads
    /// @return downloaded and not-found counts
    public Result download(RemoteSource source, String dataset, ArtifactLayout layout, int maxThreads) {
        TaskList tasks = TaskWindow.forDataset(dataset).build(collection.datasetResourceMap());
        logger.info("Downloading dataset resource logs for {} resources...", tasks.size());

        Map<String, Path> downloads = new LinkedHashMap<>();
        for (Task task : tasks) {
            String log = layout.datasetResourceLogFor(task);
            downloads.put(source.urlFor(log), localRoot.resolve(log));
        }
        Map<String, Boolean> results = fetcher.fetchEach(downloads, maxThreads, 1);
        int downloaded = (int) results.values().stream().filter(Boolean::booleanValue).count();
        Result result = new Result(downloaded, tasks.size() - downloaded);
        logger.info("Downloaded {} dataset resource logs ({} not found - these resources will be processed)",
            result.downloaded(), result.notFound());
        return result;
    }
}
