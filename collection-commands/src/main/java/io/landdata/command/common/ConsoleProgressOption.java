package io.landdata.command.common;

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

import io.landdata.status.ProgressMode;
import io.landdata.status.ProgressReporter;
import io.landdata.status.ProgressReporters;
import picocli.CommandLine;

/**
 * The {@code --status} mixin shared by the collection commands. It picks how download and
 * transform progress is shown: a live line on the terminal, periodic log lines, or nothing.
 *
 * <p>The choice travels through the {@value ProgressMode#PROPERTY_KEY} system property so that
 * {@link ProgressReporters#fromSystemProperty()} and anything else reading the property agree.
 * The property is only touched when {@code --status} is given, and only for the lifetime of the
 * {@link Scope}.</p>
 */
public final class ConsoleProgressOption {

    @CommandLine.Option(
        names = {"--status"},
        paramLabel = "MODE",
        description = {
            "Progress output: ${COMPLETION-CANDIDATES}.",
            "Defaults to the " + ProgressMode.PROPERTY_KEY + " property, else panel on a terminal and log otherwise."
        },
        converter = ProgressModeConverter.class
    )
    private ProgressMode progressMode;

    /**
     * Sets the property for the selected mode until the returned scope is closed.
     *
     * @return the scope to close when the command finishes
     */
    public Scope scopedProperty() {
        if (progressMode == null) {
            return Scope.UNCHANGED;
        }
        Scope scope = new Scope(true, System.getProperty(ProgressMode.PROPERTY_KEY));
        System.setProperty(ProgressMode.PROPERTY_KEY, progressMode.getPropertyValue());
        return scope;
    }

    /**
     * @return the reporter for the effective mode; call while the scope is open
     */
    public ProgressReporter reporter() {
        return ProgressReporters.fromSystemProperty();
    }

    /**
     * @return the mode given with {@code --status}, or {@code null}
     */
    public ProgressMode getProgressMode() {
        return progressMode;
    }

    /** Parses mode names and their aliases ({@code tui}, {@code logger}, {@code none}, ...). */
    public static final class ProgressModeConverter implements CommandLine.ITypeConverter<ProgressMode> {
        @Override
        public ProgressMode convert(String value) {
            try {
                return ProgressMode.fromString(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    /** Puts the progress property back the way it was before {@link #scopedProperty()}. */
    public static final class Scope implements AutoCloseable {
        static final Scope UNCHANGED = new Scope(false, null);

        private final boolean restore;
        private final String previous;

        private Scope(boolean restore, String previous) {
            this.restore = restore;
            this.previous = previous;
        }

        @Override
        public void close() {
            if (!restore) {
                return;
            }
            if (previous == null) {
                System.clearProperty(ProgressMode.PROPERTY_KEY);
            } else {
                System.setProperty(ProgressMode.PROPERTY_KEY, previous);
            }
        }
    }
}
