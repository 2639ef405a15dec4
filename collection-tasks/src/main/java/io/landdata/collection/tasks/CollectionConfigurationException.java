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

/// Thrown before any work starts when a collection or remote source is not usable as configured.
public class CollectionConfigurationException extends RuntimeException {
    public CollectionConfigurationException(String message) {
        super(message);
    }

    public CollectionConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
