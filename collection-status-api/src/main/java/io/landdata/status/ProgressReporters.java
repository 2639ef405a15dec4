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
 * Selects the {@link ProgressReporter} implementation for a {@link ProgressMode}.
 *
 * <p>Call once at startup and pass the result to the components that run batches:</p>
 * <pre>{@code
 * try (ProgressReporter progress = ProgressReporters.fromSystemProperty()) {
 *     new ConcurrentFetcher(transports, progress).fetchAll(urlMap, 4);
 * }
 * }</pre>
 */
public final class ProgressReporters {

    private ProgressReporters() {
    }

    /**
     * @param mode requested mode; AUTO is resolved against {@link System#console()}
     * @return a reporter for the resolved mode
     */
    public static ProgressReporter forMode(ProgressMode mode) {
        ProgressMode resolved = (mode == null ? ProgressMode.AUTO : mode).resolve(System.console() != null);
        switch (resolved) {
            case PANEL:
                return ConsolePanelReporter.forSystemTerminal();
            case LOG:
                return new LoggerProgressReporter();
            case OFF:
                return NoopProgressReporter.getInstance();
            default:
                throw new IllegalStateException("Unresolved progress mode: " + resolved);
        }
    }

    /**
     * @return a reporter for the mode named by {@link ProgressMode#PROPERTY_KEY}
     */
    public static ProgressReporter fromSystemProperty() {
        return forMode(ProgressMode.fromSystemProperty());
    }
}
