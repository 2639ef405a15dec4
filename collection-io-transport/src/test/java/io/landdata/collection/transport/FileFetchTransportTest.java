package io.landdata.collection.transport;

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
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FileFetchTransport")
class FileFetchTransportTest {

    @TempDir
    Path tempDir;

    private final FileFetchTransport transport = new FileFetchTransport();

    @Test
    @DisplayName("should copy a local file addressed by a file URL")
    void shouldCopyLocalFile() throws IOException {
        Path source = Files.writeString(tempDir.resolve("source.csv"), "dataset,resource\n");
        Path target = Files.createDirectories(tempDir.resolve("out")).resolve("copy.csv");

        transport.fetch(source.toUri().toString(), target);

        assertThat(target).hasSameTextualContentAs(source);
    }

    @Test
    @DisplayName("should report a missing source as not found")
    void shouldReportMissingSource() {
        String url = tempDir.resolve("absent.csv").toUri().toString();

        assertThatThrownBy(() -> transport.fetch(url, tempDir.resolve("target.csv")))
            .isInstanceOf(FetchException.class)
            .satisfies(e -> assertThat(((FetchException) e).isNotFound()).isTrue());
        assertThat(tempDir.resolve("target.csv")).doesNotExist();
    }
}
