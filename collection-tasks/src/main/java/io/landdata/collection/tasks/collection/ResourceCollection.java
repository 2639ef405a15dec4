package io.landdata.collection.tasks.collection;

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
import io.landdata.collection.tasks.model.RedirectEntry;

import java.nio.file.Path;
import java.util.List;

/// A loaded collection: which resources belong to which datasets, their redirects and metadata.
///
/// Implementations are loaded once by the caller and are read-only afterwards.
public interface ResourceCollection {

    /// @return the collection name
    String name();

    /// @return resources per dataset
    CollectionIndex datasetResourceMap();

    /// @return historical renames and retirements
    List<RedirectEntry> oldResourceEntries();

    /// @param resource a physical resource identifier
    /// @return where the downloaded resource is kept locally
    Path resourcePath(String resource);

    /// @param resource a requested resource identifier
    /// @return endpoints the resource was collected from, possibly empty
    List<String> resourceEndpoints(String resource);

    /// @param resource a requested resource identifier
    /// @return organisations that published the resource, possibly empty
    List<String> resourceOrganisations(String resource);

    /// @param resource a requested resource identifier
    /// @return the resource's start date, or the empty string when unknown
    String resourceStartDate(String resource);
}
