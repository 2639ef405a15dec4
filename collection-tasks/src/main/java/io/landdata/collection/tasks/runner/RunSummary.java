package io.landdata.collection.tasks.runner;

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

import java.util.List;

/// Outcome of a {@link TaskRunner} batch.
///
/// A no-op summary means there was nothing to run after filtering; it is distinct from a run in
/// which tasks were attempted.
///
/// @param successful number of tasks that completed
/// @param failed number of tasks that threw
/// @param errors one entry per failed task
/// @param noop true when no task was submitted
public record RunSummary(int successful, int failed, List<TaskError> errors, boolean noop) {
    private static final RunSummary NOOP = new RunSummary(0, 0, List.of(), true);

    public RunSummary {
        errors = List.copyOf(errors);
    }

    /// @return the summary for a batch with nothing to do
    public static RunSummary nothingToDo() {
        return NOOP;
    }

    /// @param successful number of tasks that completed
    /// @param errors one entry per failed task
    /// @return the summary of an executed batch
    public static RunSummary of(int successful, List<TaskError> errors) {
        return new RunSummary(successful, errors.size(), errors, false);
    }

    /// @return true when at least one task failed
    public boolean hasFailures() {
        return failed > 0;
    }
}
