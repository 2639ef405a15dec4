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

import java.util.Locale;

/**
 * Progress output modes for the {@code collection.status.sink} system property.
 *
 * <p>Supported modes:</p>
 * <ul>
 *   <li><strong>AUTO</strong> - selects PANEL when a console is attached, LOG otherwise</li>
 *   <li><strong>PANEL</strong> - live progress line redrawn on the terminal</li>
 *   <li><strong>LOG</strong> - periodic progress log lines at fixed percentage intervals</li>
 *   <li><strong>OFF</strong> - no progress output</li>
 * </ul>
 */
public enum ProgressMode {
    AUTO("auto"),
    PANEL("panel"),
    LOG("log"),
    OFF("off");

    /** System property consulted by {@link #fromSystemProperty()}. */
    public static final String PROPERTY_KEY = "collection.status.sink";

    private final String propertyValue;

    ProgressMode(String propertyValue) {
        this.propertyValue = propertyValue;
    }

    /**
     * Returns the system property value corresponding to this mode.
     *
     * @return the property value string (e.g., "auto", "panel", "log", "off")
     */
    public String getPropertyValue() {
        return propertyValue;
    }

    /**
     * Parses a string value into a ProgressMode, accepting various aliases.
     * Case-insensitive, surrounding whitespace ignored.
     *
     * <ul>
     *   <li><strong>AUTO:</strong> "auto", "default", "" (empty string)</li>
     *   <li><strong>PANEL:</strong> "panel", "tui", "console", "bar"</li>
     *   <li><strong>LOG:</strong> "log", "logger", "text"</li>
     *   <li><strong>OFF:</strong> "off", "none", "disable", "disabled", "false"</li>
     * </ul>
     *
     * @param value the string value to parse (may be null)
     * @return the corresponding mode, or null if the input is null
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static ProgressMode fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "panel":
            case "tui":
            case "console":
            case "bar":
                return PANEL;
            case "log":
            case "logger":
            case "text":
                return LOG;
            case "off":
            case "none":
            case "disable":
            case "disabled":
            case "false":
                return OFF;
            case "auto":
            case "default":
            case "":
                return AUTO;
            default:
                throw new IllegalArgumentException(
                    "Unrecognized status mode '" + value + "'. Expected one of: auto, panel, log, off.");
        }
    }

    /**
     * Reads {@link #PROPERTY_KEY}, falling back to AUTO when unset or unrecognized.
     *
     * @return the configured mode, never null
     */
    public static ProgressMode fromSystemProperty() {
        try {
            ProgressMode mode = fromString(System.getProperty(PROPERTY_KEY, "auto"));
            return mode == null ? AUTO : mode;
        } catch (IllegalArgumentException e) {
            return AUTO;
        }
    }

    /**
     * Resolves AUTO to a concrete mode. Concrete modes are returned as-is.
     *
     * @param consoleAttached whether an interactive console is attached to this process
     * @return PANEL, LOG or OFF
     */
    public ProgressMode resolve(boolean consoleAttached) {
        if (this != AUTO) {
            return this;
        }
        return consoleAttached ? PANEL : LOG;
    }

    @Override
    public String toString() {
        return propertyValue;
    }
}
