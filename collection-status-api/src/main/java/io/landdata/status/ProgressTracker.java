package io.landdata.status;

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

/**
 * Progress of a single batch. Thread-safe; {@link #advance()} may be called concurrently
 * by every worker that completes an item.
 */
public interface ProgressTracker extends AutoCloseable {

    /**
     * Records one more completed item.
     */
    void advance();

    /**
     * @return the number of items completed so far
     */
    long completed();

    /**
     * @return the number of items in the batch
     */
    long total();

    /**
     * Marks the batch finished and emits any final output.
     */
    @Override
    void close();
}
