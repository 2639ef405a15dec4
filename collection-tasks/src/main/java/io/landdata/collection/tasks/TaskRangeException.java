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

/// Thrown when a shard offset lies at or beyond the end of the task list.
public class TaskRangeException extends RuntimeException {
    private final int offset;
    private final int total;
    private final String contextLabel;

    /// @param offset the requested offset
    /// @param total the number of tasks available
    /// @param contextLabel an optional label such as the dataset filter, or null
    public TaskRangeException(int offset, int total, String contextLabel) {
        super(message(offset, total, contextLabel));
        this.offset = offset;
        this.total = total;
        this.contextLabel = contextLabel;
    }

    private static String message(int offset, int total, String contextLabel) {
        String msg = "Offset " + offset + " is beyond the total number of transformation tasks (" + total + ")";
        if (contextLabel != null && !contextLabel.isEmpty()) {
            msg += " (filtering by dataset '" + contextLabel + "')";
        }
        return msg;
    }

    public int getOffset() {
        return offset;
    }

    public int getTotal() {
        return total;
    }

    /// @return the context label, or null when none was given
    public String getContextLabel() {
        return contextLabel;
    }
}
