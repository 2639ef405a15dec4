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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared {@code --quiet} / {@code --debug} options that set the root log level.
 */
public class VerbosityOption {

    @CommandLine.Option(names = {"--quiet"}, description = "Suppress progress output (only show warnings and errors)")
    private boolean quiet;

    @CommandLine.Option(names = {"--debug"}, description = "Enable debug logging")
    private boolean debug;

    /**
     * @return the level selected by the flags, or {@code null} when neither was given.
     * {@code --debug} wins over {@code --quiet}.
     */
    public Level getLevel() {
        if (debug) {
            return Level.DEBUG;
        }
        return quiet ? Level.WARN : null;
    }

    /**
     * Applies the selected level to the root logger, if any flag was given.
     */
    public void apply() {
        Level level = getLevel();
        if (level != null) {
            Configurator.setRootLevel(level);
        }
    }
}
