package io.landdata.collection.tasks.transform;

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

/**
 * Transforms one resource for one dataset. Implementations may be called from several worker
 * threads at once, each with a different request.
 */
public interface TransformEngine {

    /**
     * @param request the task and its locations
     * @throws IOException if the transform fails; the task is recorded as failed
     */
    void transform(TransformRequest request) throws IOException;

    /**
     * @return the engine version recorded in fingerprints
     */
    String codeVersion();
}
