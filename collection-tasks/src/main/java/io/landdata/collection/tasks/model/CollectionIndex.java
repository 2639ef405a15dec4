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

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/// Read-only mapping from dataset name to the resources published under it.
///
/// Datasets and resources are held sorted, so iteration order never depends on how the source
/// map was built.
public final class CollectionIndex {
    private final TreeMap<String, SortedSet<String>> resourcesByDataset;

    private CollectionIndex(TreeMap<String, SortedSet<String>> resourcesByDataset) {
        this.resourcesByDataset = resourcesByDataset;
    }

    /// @param datasetResources resources per dataset; repeated resources within a dataset collapse
    /// @return an index holding a sorted copy
    public static CollectionIndex of(Map<String, ? extends Collection<String>> datasetResources) {
        Objects.requireNonNull(datasetResources, "datasetResources");
        TreeMap<String, SortedSet<String>> copy = new TreeMap<>();
        datasetResources.forEach((dataset, resources) ->
            copy.put(Objects.requireNonNull(dataset, "dataset"),
                Collections.unmodifiableSortedSet(new TreeSet<>(resources))));
        return new CollectionIndex(copy);
    }

    /// @return dataset names in lexicographic order
    public SortedSet<String> datasets() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(resourcesByDataset.keySet()));
    }

    /// @param dataset a dataset name
    /// @return the dataset's resources in lexicographic order, or empty when the dataset is unknown
    public Optional<SortedSet<String>> resources(String dataset) {
        return Optional.ofNullable(resourcesByDataset.get(dataset));
    }

    /// @param dataset a dataset name
    /// @return true when the index has the dataset
    public boolean contains(String dataset) {
        return resourcesByDataset.containsKey(dataset);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CollectionIndex
            && resourcesByDataset.equals(((CollectionIndex) o).resourcesByDataset);
    }

    @Override
    public int hashCode() {
        return resourcesByDataset.hashCode();
    }

    @Override
    public String toString() {
        return resourcesByDataset.toString();
    }
}
