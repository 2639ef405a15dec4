package io.landdata.collection.tasks.staleness;

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

import java.io.IOException;
import java.util.Optional;

/// Persists one {@link Fingerprint} per (dataset, resource) after a successful transform.
public interface FingerprintStore {

    /// @param dataset the dataset
    /// @param resource the requested resource
    /// @return the stored fingerprint, or empty when the pair was never processed
    /// @throws IOException if a stored record exists but cannot be read
    Optional<Fingerprint> read(String dataset, String resource) throws IOException;

    /// Replace the stored fingerprint for a pair.
    /// @param dataset the dataset
    /// @param resource the requested resource
    /// @param fingerprint the fingerprint of the run that just succeeded
    /// @throws IOException if the record cannot be written
    void write(String dataset, String resource, Fingerprint fingerprint) throws IOException;
}
