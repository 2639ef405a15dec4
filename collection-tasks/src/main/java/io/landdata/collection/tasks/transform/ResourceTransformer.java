package io.landdata.collection.tasks.transform;

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
import io.landdata.collection.tasks.collection.ResourceCollection;
import io.landdata.collection.tasks.model.Task;
import io.landdata.collection.tasks.model.TaskList;
import io.landdata.collection.tasks.runner.RunSummary;
import io.landdata.collection.tasks.runner.TaskRunner;
import io.landdata.collection.tasks.staleness.DatasetResourceLogStore;
import io.landdata.collection.tasks.staleness.DirectoryHasher;
import io.landdata.collection.tasks.staleness.Fingerprint;
import io.landdata.collection.tasks.staleness.FingerprintStore;
import io.landdata.collection.tasks.staleness.StalenessFilter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Transforms the resources of a collection, one engine call per (dataset, resource) task.
 * <p>
 * Tasks are built and sliced in canonical order, then tasks whose stored fingerprint matches the
 * current one are skipped (unless reprocessing), then each remaining task is resolved through
 * the collection's redirects. Removed resources are dropped. The fingerprint is recorded for every
 * task that succeeds.
 */
public class ResourceTransformer {
    private static final Logger logger = LogManager.getLogger(ResourceTransformer.class);

    private final ResourceCollection collection;
    private final TransformEngine engine;
    private final TaskRunner runner;

    public ResourceTransformer(ResourceCollection collection, TransformEngine engine, TaskRunner runner) {
        this.collection = Objects.requireNonNull(collection, "collection");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    /**
     * @param directories locations for the run
     * @param window dataset filter and shard window
     * @param maxWorkers concurrent transforms, or null for the processor count
     * @param reprocess when true, tasks are run even if their fingerprint is current
     * @return the outcome; {@link RunSummary#nothingToDo()} when no task is left after filtering
     * @throws io.landdata.collection.tasks.TaskRangeException if the offset is beyond the task count
     */
    public RunSummary transform(TransformDirectories directories, TaskWindow window, Integer maxWorkers,
                                boolean reprocess) {
        TaskList all = window.build(collection.datasetResourceMap());
        TaskList selected = window.slice(all);

        Fingerprint fingerprint = currentFingerprint(directories);
        FingerprintStore store = new DatasetResourceLogStore(directories.datasetResourceDir());
        if (!reprocess) {
            selected = new StalenessFilter(store).filter(selected, fingerprint);
        }

        List<TransformRequest> requests = resolve(selected, directories);
        logger.info("Processing {} transformation tasks (out of {} total)", requests.size(), all.size());
        if (requests.isEmpty()) {
            logger.warn("No transformation tasks to process after applying filters");
            return RunSummary.nothingToDo();
        }

        return runner.run(requests, r -> r.task().id(), request -> {
            engine.transform(request);
            store.write(request.dataset(), request.requestedResource(), fingerprint);
        }, maxWorkers);
    }

    /**
     * @return the fingerprint for the engine version and the current pipeline and specification trees
     */
    public Fingerprint currentFingerprint(TransformDirectories directories) {
        try {
            return new Fingerprint(engine.codeVersion(),
                DirectoryHasher.hash(directories.pipelineDir()),
                DirectoryHasher.hash(directories.specificationDir()));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot hash pipeline or specification directory", e);
        }
    }

    private List<TransformRequest> resolve(TaskList tasks, TransformDirectories directories) {
        RedirectResolver resolver = new RedirectResolver(collection.oldResourceEntries());
        List<TransformRequest> requests = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            Optional<String> physical = resolver.resolve(task.resource());
            if (physical.isEmpty()) {
                logger.info("Skipping removed resource: {}", task.resource());
                continue;
            }
            String requested = task.resource();
            requests.add(new TransformRequest(task, physical.get(), collection.resourcePath(physical.get()),
                collection.resourceEndpoints(requested), collection.resourceOrganisations(requested),
                collection.resourceStartDate(requested), directories));
        }
        return requests;
    }
}
