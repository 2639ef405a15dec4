package io.landdata.collection.tasks.model;

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

import java.util.Comparator;
import java.util.Objects;

/// One unit of work: a resource as requested under one dataset.
///
/// The resource is always the requested (pre-redirect) identifier; output files and metadata are
/// named by it even when the physical input has moved.
///
/// @param dataset the dataset the resource is published under
/// @param resource the requested resource identifier
public record Task(String dataset, String resource) implements Comparable<Task> {
    /// Canonical order: dataset first, then resource, both lexicographic.
    public static final Comparator<Task> CANONICAL_ORDER =
        Comparator.comparing(Task::dataset).thenComparing(Task::resource);

    public Task {
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(resource, "resource");
    }

    /// @return an identifier for logs and error reports, `dataset/resource`
    public String id() {
        return dataset + "/" + resource;
    }

    @Override
    public int compareTo(Task other) {
        return CANONICAL_ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + dataset + "," + resource + ")";
    }
}
