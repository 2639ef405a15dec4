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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/// An immutable, ordered sequence of {@link Task}s.
///
/// A resource that belongs to two datasets appears as two tasks. Use {@link #uniqueResources()}
/// when the bytes only need to be handled once.
public final class TaskList implements Iterable<Task> {
    private static final TaskList EMPTY = new TaskList(List.of());

    private final List<Task> tasks;

    private TaskList(List<Task> tasks) {
        this.tasks = tasks;
    }

    /// @param tasks the tasks in the order they should be kept
    /// @return a list holding a copy of the tasks
    public static TaskList of(Collection<Task> tasks) {
        Objects.requireNonNull(tasks, "tasks");
        return tasks.isEmpty() ? EMPTY : new TaskList(List.copyOf(tasks));
    }

    /// @param tasks the tasks in the order they should be kept
    /// @return a list holding the tasks
    public static TaskList of(Task... tasks) {
        return of(List.of(tasks));
    }

    /// @return the empty list
    public static TaskList empty() {
        return EMPTY;
    }

    /// @return the number of tasks
    public int size() {
        return tasks.size();
    }

    /// @return true when there are no tasks
    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    /// @param index the position
    /// @return the task at the position
    public Task get(int index) {
        return tasks.get(index);
    }

    /// @param fromInclusive first position to keep
    /// @param toExclusive position after the last one to keep
    /// @return the tasks in the range, in the same order
    public TaskList subList(int fromInclusive, int toExclusive) {
        return new TaskList(tasks.subList(fromInclusive, toExclusive));
    }

    /// @return the requested resource identifiers in first-seen order, without repeats
    public List<String> uniqueResources() {
        LinkedHashSet<String> resources = new LinkedHashSet<>();
        for (Task task : tasks) {
            resources.add(task.resource());
        }
        return new ArrayList<>(resources);
    }

    /// @return an unmodifiable view of the tasks
    public List<Task> asList() {
        return tasks;
    }

    @Override
    public Iterator<Task> iterator() {
        return tasks.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TaskList && tasks.equals(((TaskList) o).tasks);
    }

    @Override
    public int hashCode() {
        return tasks.hashCode();
    }

    @Override
    public String toString() {
        return tasks.toString();
    }
}
