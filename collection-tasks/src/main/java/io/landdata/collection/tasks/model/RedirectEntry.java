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

import java.util.Objects;

/// A historical rename or retirement of a resource.
///
/// @param oldResource the identifier that was published earlier
/// @param newResource the identifier that replaces it, or the empty string when removed
/// @param status the status recorded for the entry, `"410"` for retired resources
public record RedirectEntry(String oldResource, String newResource, String status) {
    /// Status marking a resource permanently withdrawn by its source.
    public static final String RETIRED_STATUS = "410";

    public RedirectEntry {
        Objects.requireNonNull(oldResource, "oldResource");
        newResource = newResource == null ? "" : newResource;
        status = status == null ? "" : status.trim();
    }

    /// @return true when the old resource maps to nothing
    public boolean isRemoval() {
        return newResource.isEmpty();
    }

    /// @return true when the status marks the old resource as retired
    public boolean isRetired() {
        return RETIRED_STATUS.equals(status);
    }
}
