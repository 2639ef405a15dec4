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

import io.landdata.collection.tasks.model.TaskList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Applies an offset/limit window over a task list in its existing order.
///
/// Contiguous windows `[0, n)`, `[n, n + m)`, ... taken over the same list cover it exactly
/// once. An offset at or past the end is treated as a misconfigured shard and rejected.
public final class TaskPartitioner {
    private static final Logger logger = LogManager.getLogger(TaskPartitioner.class);

    private TaskPartitioner() {
    }

    /// Slice a task list.
    /// @param tasks the tasks in canonical order
    /// @param offset number of leading tasks to drop, or null for none
    /// @param limit maximum number of tasks to keep after the offset, or null for no limit
    /// @param contextLabel optional label echoed in range errors, usually the dataset filter
    /// @return the window, or {@code tasks} itself when neither offset nor limit is given
    /// @throws TaskRangeException if {@code offset >= tasks.size()}
    /// @throws IllegalArgumentException if offset or limit is negative
    public static TaskList slice(TaskList tasks, Integer offset, Integer limit, String contextLabel) {
        Objects.requireNonNull(tasks, "tasks");
        if (offset == null && limit == null) {
            return tasks;
        }
        int from = 0;
        if (offset != null) {
            if (offset < 0) {
                throw new IllegalArgumentException("Offset must not be negative: " + offset);
            }
            if (offset >= tasks.size()) {
                TaskRangeException e = new TaskRangeException(offset, tasks.size(), contextLabel);
                logger.error(e.getMessage());
                throw e;
            }
            from = offset;
        }
        int to = tasks.size();
        if (limit != null) {
            if (limit < 0) {
                throw new IllegalArgumentException("Limit must not be negative: " + limit);
            }
            to = (int) Math.min((long) from + limit, tasks.size());
        }
        return tasks.subList(from, to);
    }
}
