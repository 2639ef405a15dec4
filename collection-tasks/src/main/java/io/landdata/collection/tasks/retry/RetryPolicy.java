package io.landdata.collection.tasks.retry;

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

/**
 * How many times to attempt a call and how long to wait in between.
 *
 * @param maxAttempts total attempts including the first, at least 1
 * @param backoff delay between attempts
 */
public record RetryPolicy(int maxAttempts, BackoffPolicy backoff) {
    /** Attempts used for fetches unless configured otherwise. */
    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        Objects.requireNonNull(backoff, "backoff");
    }

    /**
     * Immediate retries, up to {@code maxAttempts} attempts in total.
     */
    public static RetryPolicy attempts(int maxAttempts) {
        return new RetryPolicy(maxAttempts, BackoffPolicy.none());
    }
}
