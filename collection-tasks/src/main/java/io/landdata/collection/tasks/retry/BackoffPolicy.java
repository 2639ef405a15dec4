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

import java.time.Duration;
import java.util.Objects;

/**
 * Delay to wait between two attempts of a retried call.
 */
public final class BackoffPolicy {
    private static final BackoffPolicy NONE = new BackoffPolicy(Duration.ZERO, Duration.ZERO, false);

    private final Duration initial;
    private final Duration max;
    private final boolean exponential;

    private BackoffPolicy(Duration initial, Duration max, boolean exponential) {
        this.initial = initial;
        this.max = max;
        this.exponential = exponential;
    }

    /**
     * Retry immediately.
     */
    public static BackoffPolicy none() {
        return NONE;
    }

    /**
     * Wait the same delay before every retry.
     */
    public static BackoffPolicy fixed(Duration delay) {
        requireNotNegative(delay, "delay");
        return delay.isZero() ? NONE : new BackoffPolicy(delay, delay, false);
    }

    /**
     * Double the delay after each failure, starting at {@code initial} and capped at {@code max}.
     */
    public static BackoffPolicy exponential(Duration initial, Duration max) {
        requireNotNegative(initial, "initial");
        requireNotNegative(max, "max");
        if (max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("max delay " + max + " is below initial delay " + initial);
        }
        return new BackoffPolicy(initial, max, true);
    }

    /**
     * @param failedAttempts number of attempts that have failed so far, at least 1
     * @return the delay before the next attempt
     */
    public Duration delayAfter(int failedAttempts) {
        if (failedAttempts < 1) {
            throw new IllegalArgumentException("failedAttempts must be at least 1: " + failedAttempts);
        }
        if (!exponential) {
            return initial;
        }
        Duration delay = initial;
        for (int i = 1; i < failedAttempts && delay.compareTo(max) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(max) > 0 ? max : delay;
    }

    private static void requireNotNegative(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative: " + d);
        }
    }

    @Override
    public String toString() {
        if (this == NONE) {
            return "none";
        }
        return exponential ? "exponential(" + initial + ".." + max + ")" : "fixed(" + initial + ")";
    }
}
