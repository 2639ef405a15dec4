package io.landdata.collection.tasks.staleness;

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

@DisplayName("DirectoryHasher")
class DirectoryHasherTest {

    private static final String EMPTY_SHA256 = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("missing and empty directories should hash to the empty digest")
    void shouldHashMissingDirectoryAsEmpty() throws IOException {
        assertThat(DirectoryHasher.hash(tempDir.resolve("absent"))).isEqualTo(EMPTY_SHA256);
        assertThat(DirectoryHasher.hash(Files.createDirectory(tempDir.resolve("empty")))).isEqualTo(EMPTY_SHA256);
    }

    @Test
    @DisplayName("should change when a file changes and be stable otherwise")
    void shouldTrackContent() throws IOException {
        Path pipeline = Files.createDirectories(tempDir.resolve("pipeline"));
        Files.writeString(pipeline.resolve("column.csv"), "dataset,column,field\n");
        Files.createDirectories(pipeline.resolve("tree"));
        Files.writeString(pipeline.resolve("tree/default.csv"), "a\n");

        String first = DirectoryHasher.hash(pipeline);
        assertThat(first).hasSize(64).isEqualTo(DirectoryHasher.hash(pipeline));

        Files.writeString(pipeline.resolve("tree/default.csv"), "b\n");
        assertThat(DirectoryHasher.hash(pipeline)).isNotEqualTo(first);
    }

    @Test
    @DisplayName("should include file names")
    void shouldIncludeNames() throws IOException {
        Path a = Files.createDirectories(tempDir.resolve("a"));
        Path b = Files.createDirectories(tempDir.resolve("b"));
        Files.writeString(a.resolve("one.csv"), "x");
        Files.writeString(b.resolve("two.csv"), "x");

        assertThat(DirectoryHasher.hash(a)).isNotEqualTo(DirectoryHasher.hash(b));
    }
}
