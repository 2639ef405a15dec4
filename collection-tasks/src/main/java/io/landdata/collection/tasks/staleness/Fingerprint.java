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

import java.util.Objects;

/// The inputs a transform output depends on besides the resource bytes themselves.
///
/// @param codeVersion version of the transform engine
/// @param configHash hash of the pipeline configuration directory
/// @param specificationHash hash of the specification directory
public record Fingerprint(String codeVersion, String configHash, String specificationHash) {
    public Fingerprint {
        Objects.requireNonNull(codeVersion, "codeVersion");
        Objects.requireNonNull(configHash, "configHash");
        Objects.requireNonNull(specificationHash, "specificationHash");
    }
}
