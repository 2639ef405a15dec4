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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ProgressMode")
class ProgressModeTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(ProgressMode.PROPERTY_KEY);
    }

    @ParameterizedTest
    @CsvSource({
        "auto, AUTO",
        "'', AUTO",
        "PANEL, PANEL",
        "tui, PANEL",
        "bar, PANEL",
        "' log ', LOG",
        "text, LOG",
        "none, OFF",
        "false, OFF"
    })
    @DisplayName("should parse values and aliases")
    void shouldParseAliases(String value, ProgressMode expected) {
        assertThat(ProgressMode.fromString(value)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should return null for null input and reject unknown names")
    void shouldHandleNullAndUnknown() {
        assertThat(ProgressMode.fromString(null)).isNull();
        assertThatThrownBy(() -> ProgressMode.fromString("fancy"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("fancy");
    }

    @Test
    @DisplayName("should resolve AUTO by console presence and keep concrete modes")
    void shouldResolveAuto() {
        assertThat(ProgressMode.AUTO.resolve(true)).isEqualTo(ProgressMode.PANEL);
        assertThat(ProgressMode.AUTO.resolve(false)).isEqualTo(ProgressMode.LOG);
        assertThat(ProgressMode.OFF.resolve(true)).isEqualTo(ProgressMode.OFF);
        assertThat(ProgressMode.LOG.resolve(true)).isEqualTo(ProgressMode.LOG);
    }

    @Test
    @DisplayName("should read the system property and fall back to AUTO")
    void shouldReadSystemProperty() {
        assertThat(ProgressMode.fromSystemProperty()).isEqualTo(ProgressMode.AUTO);

        System.setProperty(ProgressMode.PROPERTY_KEY, "log");
        assertThat(ProgressMode.fromSystemProperty()).isEqualTo(ProgressMode.LOG);

        System.setProperty(ProgressMode.PROPERTY_KEY, "not-a-mode");
        assertThat(ProgressMode.fromSystemProperty()).isEqualTo(ProgressMode.AUTO);
    }

    @Test
    @DisplayName("should build a silent reporter for OFF")
    void shouldBuildNoopForOff() {
        assertThat(ProgressReporters.forMode(ProgressMode.OFF)).isSameAs(NoopProgressReporter.getInstance());
        assertThat(ProgressReporters.forMode(ProgressMode.LOG)).isInstanceOf(LoggerProgressReporter.class);
    }
}
