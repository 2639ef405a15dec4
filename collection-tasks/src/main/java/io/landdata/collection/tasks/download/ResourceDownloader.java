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
import io.landdata.collection.tasks.model.TaskList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Downloads the raw resources needed by a window of transformation tasks.
///
/// A resource shared by several datasets is fetched once. Redirected resources are fetched under
/// their physical identifier; removed resources are skipped.
public class ResourceDownloader {
    private static final Logger logger = LogManager.getLogger(ResourceDownloader.class);

    private final ResourceCollection collection;
    private final ConcurrentFetcher fetcher;

    public ResourceDownloader(ResourceCollection collection, ConcurrentFetcher fetcher) {
        this.collection = Objects.requireNonNull(collection, "collection");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    /// @param source where the collection is published
    /// @param window dataset filter and shard window
    /// @param maxThreads concurrent downloads
    /// @return outcome per URL, in first-seen resource order
    /// @throws io.landdata.collection.tasks.fetch.FetchFailedException if any download failed
    public Map<String, Boolean> download(RemoteSource source, TaskWindow window, int maxThreads) {
        Map<String, Path> downloads = plan(source, window);
        logger.info("Downloading {} resources...", downloads.size());
        return fetcher.fetchAll(downloads, maxThreads);
    }

    /// @return the URL to local path map for the window, without fetching anything
    public Map<String, Path> plan(RemoteSource source, TaskWindow window) {
        TaskList all = window.build(collection.datasetResourceMap());
        TaskList selected = window.slice(all);
        logger.info("Downloading resources for {} transformation tasks (out of {} total)",
            selected.size(), all.size());

        RedirectResolver resolver = new RedirectResolver(collection.oldResourceEntries());
        Map<String, Path> downloads = new LinkedHashMap<>();
        for (String requested : selected.uniqueResources()) {
            Optional<String> physical = resolver.resolve(requested);
            if (physical.isEmpty()) {
                logger.info("Skipping removed resource: {}", requested);
                continue;
            }
            downloads.put(source.urlFor("collection/resource/" + physical.get()),
                collection.resourcePath(physical.get()));
        }
        return downloads;
    }
}
