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

import io.landdata.collection.tasks.model.RedirectEntry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Resolves requested resource identifiers to the physical resource holding their content.
///
/// Built once from the collection's redirect entries. When the same old resource appears more than
/// once, the last entry wins.
public final class RedirectResolver {
    private static final Logger logger = LogManager.getLogger(RedirectResolver.class);

    private final Map<String, String> redirects;
    private final Set<String> retired;

    /// @param entries the collection's redirect entries
    public RedirectResolver(Collection<RedirectEntry> entries) {
        Objects.requireNonNull(entries, "entries");
        Map<String, String> map = new HashMap<>();
        Set<String> retiredSet = new LinkedHashSet<>();
        for (RedirectEntry entry : entries) {
            map.put(entry.oldResource(), entry.newResource());
            if (entry.isRetired()) {
                retiredSet.add(entry.oldResource());
            }
        }
        this.redirects = Collections.unmodifiableMap(map);
        this.retired = Collections.unmodifiableSet(retiredSet);
        logger.debug("Loaded {} redirects, {} retired resources", redirects.size(), retired.size());
    }

    /// @return a resolver with no redirects
    public static RedirectResolver none() {
        return new RedirectResolver(Collections.emptyList());
    }

    /// Resolve a requested resource.
    /// @param requested the requested resource identifier
    /// @return the physical resource, or empty when the resource was removed
    public Optional<String> resolve(String requested) {
        String target = redirects.getOrDefault(requested, requested);
        return target.isEmpty() ? Optional.empty() : Optional.of(target);
    }

    /// @return old resources whose redirect status marks them retired (410)
    public Set<String> retiredSet() {
        return retired;
    }
}
