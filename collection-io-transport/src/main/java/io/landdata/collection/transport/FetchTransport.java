package io.landdata.collection.transport;

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
import java.nio.file.Path;

/// Copies one remote object to a local file.
///
/// Implementations are constructed once per process around a shared client and are
/// safe for concurrent use. A transport never retries; callers decide the retry budget.
/// The target's parent directory must already exist. The target is replaced only when
/// the whole object has been received, so a failed fetch leaves no partial file behind.
public interface FetchTransport {

    /// Fetch the object at `url` into `target`.
    /// @param url the source URL, with a scheme this transport declares via {@link TransportScheme}
    /// @param target the local file to create or replace
    /// @throws IOException if the object cannot be read or written
    void fetch(String url, Path target) throws IOException;
}
