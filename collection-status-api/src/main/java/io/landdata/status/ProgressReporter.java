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
 * Reports the progress of a batch of items towards completion.
 *
 * <p>One reporter is selected at startup (see {@link ProgressReporters}) and passed to
 * the components that run batches. Each batch obtains its own {@link ProgressTracker}
 * from {@link #begin(String, long)}; trackers may be advanced from many threads.</p>
 *
 * <p>Implementations:</p>
 * <ul>
 *   <li>{@link ConsolePanelReporter} - live progress line for interactive terminals</li>
 *   <li>{@link LoggerProgressReporter} - periodic log lines for batch logs</li>
 *   <li>{@link NoopProgressReporter} - silent</li>
 * </ul>
 */
public interface ProgressReporter extends AutoCloseable {

    /**
     * Starts tracking a batch.
     *
     * @param description short human readable label, e.g. "Downloading files"
     * @param total number of items in the batch
     * @return a tracker which must be closed when the batch completes
     */
    ProgressTracker begin(String description, long total);

    /**
     * Releases any terminal or logging resources held by the reporter.
     */
    @Override
    default void close() {
    }
}
