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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;

/**
 * Runs a call until it succeeds or its {@link RetryPolicy} is exhausted.
 * <p>
 * Every failed attempt is logged at error level with the label, typically the URL, and the
 * failure message. The caller decides whether the final failure is rethrown.
 */
public final class Retrier {
    private static final Logger logger = LogManager.getLogger(Retrier.class);

    /**
     * A single attempt of the retried call.
     */
    @FunctionalInterface
    public interface Attempt {
        void run() throws Exception;
    }

    /**
     * Result of a retried call.
     *
     * @param succeeded true when one of the attempts completed
     * @param attempts number of attempts made
     * @param lastFailure the failure of the final attempt, or null on success
     */
    public record Outcome(boolean succeeded, int attempts, Exception lastFailure) {
    }

    private Retrier() {
    }

    /**
     * Attempt the call as often as the policy allows. If the calling thread is interrupted while
     * waiting between attempts, no further attempt is made and the interrupt flag stays set.
     *
     * @param label identifies the call in log messages
     * @param policy attempt budget and backoff
     * @param attempt the call
     * @return the outcome; never throws for failures of the call itself
     */
    public static Outcome run(String label, RetryPolicy policy, Attempt attempt) {
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(attempt, "attempt");
        Exception last = null;
        int made = 0;
        while (made < policy.maxAttempts()) {
            made++;
            try {
                attempt.run();
                if (made > 1) {
                    logger.debug("{} succeeded on attempt {}/{}", label, made, policy.maxAttempts());
                }
                return new Outcome(true, made, null);
            } catch (Exception e) {
                last = e;
                logger.error("Attempt {}/{} failed for {}: {}",
                    made, policy.maxAttempts(), label, e.getMessage());
            }
            if (made < policy.maxAttempts() && !pause(policy.backoff().delayAfter(made), label)) {
                break;
            }
        }
        return new Outcome(false, made, last);
    }

    /**
     * Like {@link #run(String, RetryPolicy, Attempt)} but rethrows the last failure.
     *
     * @throws Exception the failure of the final attempt
     */
    public static void runOrThrow(String label, RetryPolicy policy, Attempt attempt) throws Exception {
        Outcome outcome = run(label, policy, attempt);
        if (!outcome.succeeded()) {
            throw outcome.lastFailure();
        }
    }

    private static boolean pause(Duration delay, String label) {
        if (delay.isZero()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Retry of {} interrupted during backoff", label);
            return false;
        }
    }
}
