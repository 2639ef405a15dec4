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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Retrier")
class RetrierTest {

    @Test
    @DisplayName("should stop at the first success")
    void shouldStopAtFirstSuccess() {
        AtomicInteger calls = new AtomicInteger();
        Retrier.Outcome outcome = Retrier.run("flaky", RetryPolicy.attempts(5), () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("connection reset");
            }
        });

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(outcome.lastFailure()).isNull();
    }

    @Test
    @DisplayName("should return the last failure once the budget is spent")
    void shouldReturnLastFailure() {
        AtomicInteger calls = new AtomicInteger();
        Retrier.Outcome outcome = Retrier.run("broken", RetryPolicy.attempts(3), () -> {
            throw new IOException("failure " + calls.incrementAndGet());
        });

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(outcome.lastFailure()).hasMessage("failure 3");
    }

    @Test
    @DisplayName("runOrThrow should rethrow the last failure")
    void shouldRethrow() {
        assertThatThrownBy(() -> Retrier.runOrThrow("broken", RetryPolicy.attempts(2), () -> {
            throw new IOException("nope");
        })).isInstanceOf(IOException.class).hasMessage("nope");
    }

    @Test
    @DisplayName("backoff policies should compute their delays")
    void shouldComputeBackoff() {
        assertThat(BackoffPolicy.none().delayAfter(3)).isEqualTo(Duration.ZERO);
        assertThat(BackoffPolicy.fixed(Duration.ofMillis(200)).delayAfter(4)).isEqualTo(Duration.ofMillis(200));

        BackoffPolicy exponential = BackoffPolicy.exponential(Duration.ofSeconds(1), Duration.ofSeconds(30));
        assertThat(exponential.delayAfter(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(exponential.delayAfter(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(exponential.delayAfter(10)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("should wait between attempts with a fixed backoff")
    void shouldWaitBetweenAttempts() {
        long start = System.nanoTime();
        Retrier.run("slow", new RetryPolicy(3, BackoffPolicy.fixed(Duration.ofMillis(50))), () -> {
            throw new IOException("again");
        });
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(100));
    }

    @Test
    @DisplayName("should reject an empty budget")
    void shouldRejectZeroAttempts() {
        assertThatIllegalArgumentException().isThrownBy(() -> RetryPolicy.attempts(0));
    }
}
