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

import io.landdata.collection.tasks.model.Task;
import io.landdata.collection.tasks.model.TaskList;
import io.landdata.status.ProgressReporter;
import io.landdata.status.ProgressTracker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TaskRunner")
class TaskRunnerTest {

    /// Counts batches and advances so tests can check what was reported.
    static class CountingReporter implements ProgressReporter {
        final AtomicInteger batches = new AtomicInteger();
        final AtomicInteger advances = new AtomicInteger();

        @Override
        public ProgressTracker begin(String description, long total) {
            batches.incrementAndGet();
            return new ProgressTracker() {
                @Override
                public void advance() {
                    advances.incrementAndGet();
                }

                @Override
                public long completed() {
                    return advances.get();
                }

                @Override
                public long total() {
                    return total;
                }

                @Override
                public void close() {
                }
            };
        }
    }

    private final CountingReporter reporter = new CountingReporter();
    private final TaskRunner runner = new TaskRunner(reporter);

    @Test
    @DisplayName("should isolate a failing task from its siblings")
    void shouldIsolateFailures() {
        TaskList tasks = TaskList.of(
            new Task("tree", "a"), new Task("tree", "boom"), new Task("tree", "c"), new Task("park", "d"));
        Set<String> processed = ConcurrentHashMap.newKeySet();

        RunSummary summary = runner.run(tasks, task -> {
            if (task.resource().equals("boom")) {
                throw new IllegalStateException("bad geometry");
            }
            processed.add(task.id());
        }, 2);

        assertThat(summary.noop()).isFalse();
        assertThat(summary.successful()).isEqualTo(3);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.hasFailures()).isTrue();
        assertThat(summary.errors()).containsExactly(new TaskError("tree/boom", "bad geometry"));
        assertThat(processed).containsExactlyInAnyOrder("tree/a", "tree/c", "park/d");
        assertThat(reporter.advances.get()).isEqualTo(4);
    }

    @Test
    @DisplayName("should return the no-op summary for an empty list without reporting a batch")
    void shouldReturnNoopForEmptyInput() {
        RunSummary summary = runner.run(TaskList.empty(), task -> fail("must not run"), null);

        assertThat(summary).isSameAs(RunSummary.nothingToDo());
        assertThat(summary.noop()).isTrue();
        assertThat(summary.hasFailures()).isFalse();
        assertThat(reporter.batches.get()).isZero();
    }

    @Test
    @DisplayName("a batch where every task failed is not a no-op")
    void shouldDistinguishAllFailedFromNoop() {
        RunSummary summary = runner.run(List.of("x", "y"), Function.identity(), item -> {
            throw new Exception("failed " + item);
        }, 1);

        assertThat(summary.noop()).isFalse();
        assertThat(summary.successful()).isZero();
        assertThat(summary.errors()).extracting(TaskError::message).containsExactly("failed x", "failed y");
    }

    @Test
    @DisplayName("should not run more tasks at once than workers")
    void shouldBoundConcurrency() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<Integer> items = List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);

        RunSummary summary = runner.run(items, String::valueOf, item -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(20);
            running.decrementAndGet();
        }, 3);

        assertThat(summary.successful()).isEqualTo(10);
        assertThat(peak.get()).isBetween(1, 3);
    }

    @Test
    @DisplayName("should reject a non-positive worker count")
    void shouldRejectZeroWorkers() {
        assertThatIllegalArgumentException()
            .isThrownBy(() -> runner.run(TaskList.of(new Task("a", "b")), task -> { }, 0));
        assertThat(TaskRunner.defaultMaxWorkers()).isPositive();
    }
}
