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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ConsolePanelReporter")
class ConsolePanelReporterTest {

    @Test
    @DisplayName("should render a bar proportional to completion")
    void shouldRenderBar() {
        ConsolePanelReporter reporter = new ConsolePanelReporter(new PrintWriter(new StringWriter()), () -> 60);

        String half = reporter.renderLine("Fetch", 5, 10, 61);
        assertThat(half).startsWith("Fetch [").endsWith("]  50% 5/10");
        String bar = half.substring(half.indexOf('[') + 1, half.indexOf(']'));
        assertThat(bar.chars().filter(c -> c == '#').count())
            .isEqualTo(bar.chars().filter(c -> c == '-').count());
    }

    @Test
    @DisplayName("should redraw in place and terminate the line on close")
    void shouldRedrawInPlace() {
        StringWriter out = new StringWriter();
        ConsolePanelReporter reporter = new ConsolePanelReporter(new PrintWriter(out), () -> 50);

        try (ProgressTracker tracker = reporter.begin("Processing", 2)) {
            tracker.advance();
            tracker.advance();
        }

        String text = out.toString();
        assertThat(text).startsWith("\r");
        assertThat(text).contains("100% 2/2");
        assertThat(text).endsWith(System.lineSeparator());
    }

    @Test
    @DisplayName("should keep a minimum bar width on narrow consoles")
    void shouldKeepMinimumBarWidth() {
        ConsolePanelReporter reporter = new ConsolePanelReporter(new PrintWriter(new StringWriter()), () -> 5);
        String line = reporter.renderLine("A long description", 0, 4, 5);
        assertThat(line).contains("[----------]");
    }
}
