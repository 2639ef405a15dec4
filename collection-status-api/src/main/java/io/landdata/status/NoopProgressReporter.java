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

import java.util.concurrent.atomic.AtomicLong;

/**
 * A reporter that produces no output. Trackers still count completions so callers
 * can query them.
 */
public final class NoopProgressReporter implements ProgressReporter {

    private static final NoopProgressReporter INSTANCE = new NoopProgressReporter();

    private NoopProgressReporter() {
    }

    /**
     * @return the shared instance
     */
    public static NoopProgressReporter getInstance() {
        return INSTANCE;
    }

    @Override
    public ProgressTracker begin(String description, long total) {
        return new CountingTracker(total);
    }

    private static final class CountingTracker implements ProgressTracker {
        private final long total;
        private final AtomicLong completed = new AtomicLong();

        private CountingTracker(long total) {
            this.total = total;
        }

        @Override
        public void advance() {
            completed.incrementAndGet();
        }

        @Override
        public long completed() {
            return completed.get();
        }

        @Override
        public long total() {
            return total;
        }

        @Override
        public void close() {
        }
    }
}
