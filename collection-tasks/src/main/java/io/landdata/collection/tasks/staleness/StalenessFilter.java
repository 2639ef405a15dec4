package io.landdata.collection.tasks.staleness;

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
import io.landdata.collection.tasks.model.TaskList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Skips tasks whose previous output was produced with the current fingerprint.
///
/// A task needs processing when no fingerprint was stored for it or when any of the three
/// stored components differs from the current one.
public class StalenessFilter {
    private static final Logger logger = LogManager.getLogger(StalenessFilter.class);

    private final FingerprintStore store;

    /// @param store where fingerprints of earlier runs are kept
    public StalenessFilter(FingerprintStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /// @param dataset the dataset
    /// @param resource the requested resource
    /// @param current the fingerprint of the run about to start
    /// @return true when the pair must be (re)processed
    public boolean needsProcessing(String dataset, String resource, Fingerprint current) {
        Objects.requireNonNull(current, "current");
        Optional<Fingerprint> previous;
        try {
            previous = store.read(dataset, resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read fingerprint for " + dataset + "/" + resource, e);
        }
        return previous.map(p -> !p.equals(current)).orElse(true);
    }

    /// Keep only the tasks that need processing, in their existing order.
    /// @param tasks the candidate tasks
    /// @param current the fingerprint of the run about to start
    /// @return the tasks still to do
    public TaskList filter(TaskList tasks, Fingerprint current) {
        List<Task> remaining = new ArrayList<>();
        for (Task task : tasks) {
            if (needsProcessing(task.dataset(), task.resource(), current)) {
                remaining.add(task);
            }
        }
        logger.info("Skipping {} already up-to-date resources, {} to process",
            tasks.size() - remaining.size(), remaining.size());
        return TaskList.of(remaining);
    }
}
