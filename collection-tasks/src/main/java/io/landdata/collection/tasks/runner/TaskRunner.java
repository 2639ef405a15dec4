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

import io.landdata.collection.tasks.NamedThreadFactory;
import io.landdata.collection.tasks.model.Task;
import io.landdata.collection.tasks.model.TaskList;
import io.landdata.status.ProgressReporter;
import io.landdata.status.ProgressTracker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/// Runs a worker over every task with a bounded pool and collects per-task outcomes.
///
/// Each task is isolated: an exception from the worker is recorded as a {@link TaskError} and the
/// remaining tasks still run. Workers that need process isolation start their own child process
/// per task (see the transform engine); the pool bounds how many run at once.
public class TaskRunner {
    private static final Logger logger = LogManager.getLogger(TaskRunner.class);

    private final ProgressReporter reporter;

    /// @param reporter where batch progress is reported
    public TaskRunner(ProgressReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    /// @return the default worker count, the number of available processors
    public static int defaultMaxWorkers() {
        return Runtime.getRuntime().availableProcessors();
    }

    /// Run a worker over collection tasks.
    /// @param tasks the tasks
    /// @param worker processes one task
    /// @param maxWorkers pool size, or null for {@link #defaultMaxWorkers()}
    /// @return the summary; {@link RunSummary#nothingToDo()} when {@code tasks} is empty
    public RunSummary run(TaskList tasks, TaskWorker<Task> worker, Integer maxWorkers) {
        return run(tasks.asList(), Task::id, worker, maxWorkers);
    }

    /// Run a worker over arbitrary items.
    /// @param items the items to process
    /// @param idOf identifies an item in error reports
    /// @param worker processes one item
    /// @param maxWorkers pool size, or null for {@link #defaultMaxWorkers()}
    /// @param <T> the item type
    /// @return the summary; {@link RunSummary#nothingToDo()} when {@code items} is empty, without starting a pool
    public <T> RunSummary run(List<T> items, Function<T, String> idOf, TaskWorker<T> worker, Integer maxWorkers) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(idOf, "idOf");
        Objects.requireNonNull(worker, "worker");
        if (items.isEmpty()) {
            return RunSummary.nothingToDo();
        }
        int workers = maxWorkers == null ? defaultMaxWorkers() : maxWorkers;
        if (workers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1: " + workers);
        }
        workers = Math.min(workers, items.size());
        logger.info("Using {} workers for {} tasks", workers, items.size());

        ExecutorService executor = Executors.newFixedThreadPool(workers, new NamedThreadFactory("task"));
        int successful = 0;
        List<TaskError> errors = new ArrayList<>();
        try (ProgressTracker tracker = reporter.begin("Processing resources", items.size())) {
            List<Future<?>> futures = new ArrayList<>(items.size());
            for (T item : items) {
                futures.add(executor.submit(() -> {
                    try {
                        worker.process(item);
                        return null;
                    } finally {
                        tracker.advance();
                    }
                }));
            }
            for (int i = 0; i < items.size(); i++) {
                String id = idOf.apply(items.get(i));
                String failure = await(id, futures.get(i));
                if (failure == null) {
                    successful++;
                } else {
                    errors.add(new TaskError(id, failure));
                }
            }
        } finally {
            executor.shutdownNow();
        }

        RunSummary summary = RunSummary.of(successful, errors);
        logger.info("Processing complete: {} successful, {} failed", summary.successful(), summary.failed());
        if (summary.hasFailures()) {
            logger.error("Failed resources:");
            for (TaskError error : summary.errors()) {
                logger.error("  - {}: {}", error.taskId(), error.message());
            }
        }
        return summary;
    }

    private static String await(String id, Future<?> future) {
        try {
            future.get();
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            String message = cause.getMessage() == null ? cause.toString() : cause.getMessage();
            logger.error("Error processing {}: {}", id, message);
            return message;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return "interrupted before completion";
        }
    }
}
