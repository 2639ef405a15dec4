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

import io.landdata.collection.tasks.RedirectResolver;
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
import java.util.Set;

/// Downloads the published artifacts of already transformed tasks.
///
/// Retired resources (status 410) are skipped after slicing, so shard windows stay aligned with
/// the transform step.
public class TransformedDownloader {
    private static final Logger logger = LogManager.getLogger(TransformedDownloader.class);

    private final ResourceCollection collection;
    private final ConcurrentFetcher fetcher;
    private final Path localRoot;

    /// @param collection the loaded collection
    /// @param fetcher the shared fetcher
    /// @param localRoot directory the artifact layout is resolved against
    public TransformedDownloader(ResourceCollection collection, ConcurrentFetcher fetcher, Path localRoot) {
        this.collection = Objects.requireNonNull(collection, "collection");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.localRoot = Objects.requireNonNull(localRoot, "localRoot");
    }

    /// @param source where the collection is published
    /// @param window dataset filter and shard window
    /// @param layout artifact directories
    /// @param maxThreads concurrent downloads
    /// @return outcome per URL
    /// @throws io.landdata.collection.tasks.fetch.FetchFailedException if any download failed
    public Map<String, Boolean> download(RemoteSource source, TaskWindow window, ArtifactLayout layout,
                                         int maxThreads) {
        Map<String, Path> downloads = plan(source, window, layout);
        Map<String, Boolean> results = fetcher.fetchAll(downloads, maxThreads);
        logger.info("Download complete!");
        return results;
    }

    /// @return the URL to local path map for the window, without fetching anything
    public Map<String, Path> plan(RemoteSource source, TaskWindow window, ArtifactLayout layout) {
        TaskList all = window.build(collection.datasetResourceMap());
        TaskList selected = window.slice(all);
        logger.info("Downloading transformed files for {} transformation tasks (out of {} total)",
            selected.size(), all.size());

        Set<String> retired = new RedirectResolver(collection.oldResourceEntries()).retiredSet();
        Map<String, Path> downloads = new LinkedHashMap<>();
        int tasks = 0;
        for (Task task : selected) {
            if (retired.contains(task.resource())) {
                logger.info("Skipping retired resource (status 410): {}", task.resource());
                continue;
            }
            tasks++;
            for (String artifact : layout.artifactsFor(task)) {
                downloads.put(source.urlFor(artifact), localRoot.resolve(artifact));
            }
        }
        logger.info("Downloading {} files ({} per transformation task) from {}...",
            downloads.size(), tasks == 0 ? 0 : downloads.size() / tasks, source.describe());
        return downloads;
    }
}
