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

import io.landdata.collection.tasks.model.Task;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the transform engine needs for one task.
 * <p>
 * Outputs and metadata use the requested resource; only {@code inputPath} points at the
 * redirected physical resource.
 *
 * @param task the task, holding the requested resource
 * @param physicalResource the resource the input was resolved to
 * @param inputPath the downloaded physical resource
 * @param endpoints endpoints of the requested resource
 * @param organisations organisations of the requested resource
 * @param entryDate start date of the requested resource
 * @param directories shared locations for the run
 */
public record TransformRequest(
    Task task,
    String physicalResource,
    Path inputPath,
    List<String> endpoints,
    List<String> organisations,
    String entryDate,
    TransformDirectories directories
) {
    public TransformRequest {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(physicalResource, "physicalResource");
        Objects.requireNonNull(inputPath, "inputPath");
        endpoints = List.copyOf(endpoints);
        organisations = List.copyOf(organisations);
        entryDate = entryDate == null ? "" : entryDate;
        Objects.requireNonNull(directories, "directories");
    }

    public String dataset() {
        return task.dataset();
    }

    public String requestedResource() {
        return task.resource();
    }

    /**
     * @return {@code transformed/<dataset>/<requested>.csv}
     */
    public Path outputPath() {
        return directories.transformedDir(dataset()).resolve(requestedResource() + ".csv");
    }

    /**
     * @return the requested resource when the input was redirected, so the engine records
     *     output under the requested identity
     */
    public Optional<String> resourceOverride() {
        return physicalResource.equals(requestedResource()) ? Optional.empty() : Optional.of(requestedResource());
    }
}
