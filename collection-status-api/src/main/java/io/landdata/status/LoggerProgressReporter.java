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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * A reporter for non-interactive output (piped stdout, container logs, CI) that writes
 * progress through Log4j 2.
 *
 * <p>Instead of one line per item, a line is written each time completion crosses the
 * next multiple of the configured percentage interval, plus the final item. When the
 * tracker is closed a summary line is written.</p>
 *
 * <h2>Log Message Format</h2>
 * <ul>
 *   <li><strong>Start:</strong> "Starting Downloading files: 40 items"</li>
 *   <li><strong>Interval:</strong> "Progress: 12/40 Downloading files (30%)"</li>
 *   <li><strong>Close:</strong> "Downloading files: 40 of 40 complete"</li>
 * </ul>
 *
 * <p>Thread safety is provided by synchronizing each tracker; Log4j 2 handles concurrent
 * access to the appenders.</p>
 */
public final class LoggerProgressReporter implements ProgressReporter {

    /** Default percentage interval between progress lines. */
    public static final int DEFAULT_INTERVAL_PERCENT = 10;

    private final Logger logger;
    private final Level level;
    private final int intervalPercent;

    public LoggerProgressReporter() {
        this(LogManager.getLogger(LoggerProgressReporter.class), Level.INFO, DEFAULT_INTERVAL_PERCENT);
    }

    public LoggerProgressReporter(Logger logger) {
        this(logger, Level.INFO, DEFAULT_INTERVAL_PERCENT);
    }

    public LoggerProgressReporter(Logger logger, Level level, int intervalPercent) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.level = Objects.requireNonNullElse(level, Level.INFO);
        if (intervalPercent < 1 || intervalPercent > 100) {
            throw new IllegalArgumentException("intervalPercent must be between 1 and 100, got " + intervalPercent);
        }
        this.intervalPercent = intervalPercent;
    }

    @Override
    public ProgressTracker begin(String description, long total) {
        logger.log(level, "Starting {}: {} items", description, total);
        return new IntervalTracker(description, total);
    }

    private final class IntervalTracker implements ProgressTracker {
        private final String description;
        private final long total;
        private long completed;
        private long lastLoggedPercent;
        private boolean closed;

        private IntervalTracker(String description, long total) {
            this.description = description;
            this.total = total;
        }

        @Override
        public synchronized void advance() {
            completed++;
            long percent = total > 0 ? (completed * 100) / total : 100;
            if (percent >= lastLoggedPercent + intervalPercent || completed == total) {
                logger.log(level, "Progress: {}/{} {} ({}%)", completed, total, description, percent);
                lastLoggedPercent = percent;
            }
        }

        @Override
        public synchronized long completed() {
            return completed;
        }

        @Override
        public long total() {
            return total;
        }

        @Override
        public synchronized void close() {
            if (closed) {
                return;
            }
            closed = true;
            logger.log(level, "{}: {} of {} complete", description, completed, total);
        }
    }
}
