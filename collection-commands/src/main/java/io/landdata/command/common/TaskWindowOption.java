package io.landdata.command.common;

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

import io.landdata.collection.tasks.TaskWindow;
import picocli.CommandLine;

/**
 * Shared {@code --dataset}, {@code --offset} and {@code --limit} options selecting a shard of the
 * canonical task list.
 */
public class TaskWindowOption {

    @CommandLine.Option(names = {"--dataset"}, description = "Filter resources to only this dataset")
    private String dataset;

    @CommandLine.Option(names = {"--offset"}, defaultValue = "${env:TRANSFORMATION_OFFSET}",
        description = "Number of transformation tasks to skip (default: $${env:TRANSFORMATION_OFFSET})")
    private Integer offset;

    @CommandLine.Option(names = {"--limit"}, defaultValue = "${env:TRANSFORMATION_LIMIT}",
        description = "Maximum number of transformation tasks (default: $${env:TRANSFORMATION_LIMIT})")
    private Integer limit;

    public TaskWindow toWindow() {
        return new TaskWindow(dataset, offset, limit);
    }
}
