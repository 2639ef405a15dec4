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
import io.landdata.collection.tasks.model.TaskList;

/// The dataset filter and shard window selected for one invocation.
///
/// @param dataset dataset to restrict to, or null for all
/// @param offset number of leading tasks to skip, or null
/// @param limit maximum number of tasks to keep, or null
public record TaskWindow(String dataset, Integer offset, Integer limit) {
    private static final TaskWindow ALL = new TaskWindow(null, null, null);

    public TaskWindow {
        dataset = dataset == null || dataset.isBlank() ? null : dataset.trim();
    }

    /// @return every task of every dataset
    public static TaskWindow all() {
        return ALL;
    }

    /// @param dataset dataset to restrict to, or null for all
    /// @return the unsliced window over one dataset
    public static TaskWindow forDataset(String dataset) {
        return new TaskWindow(dataset, null, null);
    }

    /// @param index the collection index
    /// @return every task matching the dataset filter, in canonical order, before slicing
    public TaskList build(CollectionIndex index) {
        return TaskSetBuilder.build(index, dataset);
    }

    /// @param tasks tasks in canonical order
    /// @return the offset/limit window over them
    /// @throws TaskRangeException if the offset is at or beyond the end
    public TaskList slice(TaskList tasks) {
        return TaskPartitioner.slice(tasks, offset, limit, dataset);
    }
}
