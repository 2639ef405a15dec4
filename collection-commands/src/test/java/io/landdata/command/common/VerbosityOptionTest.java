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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

class VerbosityOptionTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "'',                NONE",
        "--quiet,           WARN",
        "--debug,           DEBUG",
        "--quiet --debug,   DEBUG"
    })
    void flagsSelectRootLevel(String args, String expected) {
        Holder holder = new Holder();
        String[] argv = args.isBlank() ? new String[0] : args.trim().split("\\s+");
        new CommandLine(holder).parseArgs(argv);

        Level level = holder.verbosity.getLevel();
        if ("NONE".equals(expected)) {
            assertThat(level).isNull();
        } else {
            assertThat(level).isEqualTo(Level.getLevel(expected));
        }
    }

    private static final class Holder implements Runnable {
        @CommandLine.Mixin
        final VerbosityOption verbosity = new VerbosityOption();

        @Override
        public void run() {
        }
    }
}
