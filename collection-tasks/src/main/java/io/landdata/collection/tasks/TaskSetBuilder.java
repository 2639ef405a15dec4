package io.landdata.collection.tasks;

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

import io.landdata.collection.tasks.model.CollectionIndex;
import io.landdata.collection.tasks.model.Task;
import io.landdata.collection.tasks.model.TaskList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;

/// Builds the canonical task list for a collection.
///
/// Datasets are visited in lexicographic order and, within each, resources in lexicographic
/// order. The result depends only on the index contents and the dataset filter, so independent
/// invocations agree on positions and can shard the list with offset/limit windows.
public final class TaskSetBuilder {

    private TaskSetBuilder() {
    }

    /// Build one task per (dataset, resource) membership.
    /// @param index the collection index
    /// @param dataset an optional dataset to restrict to, or null for every dataset
    /// @return the tasks in canonical order; empty when the requested dataset is unknown
    public static TaskList build(CollectionIndex index, String dataset) {
        Objects.requireNonNull(index, "index");
        Collection<String> datasets = dataset == null || dataset.isEmpty()
            ? index.datasets()
            : List.of(dataset);
        List<Task> tasks = new ArrayList<>();
        for (String ds : datasets) {
            SortedSet<String> resources = index.resources(ds).orElse(null);
            if (resources == null) {
                continue;
            }
            for (String resource : resources) {
                tasks.add(new Task(ds, resource));
            }
        }
        return TaskList.of(tasks);
    }
}
