package io.landdata.collection.tasks.transform;

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

import io.landdata.collection.tasks.model.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CommandTransformEngine")
class CommandTransformEngineTest {

    @TempDir
    Path tempDir;

    private TransformDirectories directories;

    @BeforeEach
    void setUp() {
        directories = TransformDirectories.defaults(tempDir.resolve("collection"), tempDir);
    }

    private TransformRequest request(String requested, String physical) {
        return new TransformRequest(new Task("tree", requested), physical,
            tempDir.resolve("collection/resource").resolve(physical),
            List.of("e1", "e2"), List.of("org:1"), "2024-01-01", directories);
    }

    @Test
    @DisplayName("should pass locations, metadata and the resource override as arguments")
    void shouldBuildArguments() {
        CommandTransformEngine engine = new CommandTransformEngine(List.of("pipeline", "run"), "2.0");

        List<String> args = engine.arguments(request("old", "new"));

        assertThat(args).startsWith("pipeline", "run", "--dataset", "tree");
        assertThat(args).containsSequence("--input-path", tempDir.resolve("collection/resource/new").toString());
        assertThat(args).containsSequence("--output-path", tempDir.resolve("transformed/tree/old.csv").toString());
        assertThat(args).containsSequence("--issue-dir", tempDir.resolve("issue/tree").toString());
        assertThat(args).containsSequence("--config-path", tempDir.resolve("var/cache/config.sqlite3").toString());
        assertThat(args).containsSequence("--endpoint", "e1", "--endpoint", "e2");
        assertThat(args).containsSequence("--entry-date", "2024-01-01");
        assertThat(args).endsWith("--resource", "old");
        assertThat(engine.codeVersion()).isEqualTo("2.0");
    }

    @Test
    @DisplayName("should omit the override when the resource was not redirected")
    void shouldOmitOverride() {
        CommandTransformEngine engine = new CommandTransformEngine(List.of("pipeline"), "2.0");
        assertThat(engine.arguments(request("same", "same"))).doesNotContain("--resource");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("should capture the child's output in the task log and create output directories")
    void shouldCaptureOutput() throws IOException {
        CommandTransformEngine engine = new CommandTransformEngine(
            List.of("sh", "-c", "echo transforming \"$2\"", "engine"), "2.0");

        TransformRequest request = request("abc", "abc");
        engine.transform(request);

        assertThat(Files.readString(CommandTransformEngine.logFile(request))).contains("transforming tree");
        assertThat(directories.transformedDir("tree")).isDirectory();
        assertThat(directories.datasetResourceDir("tree")).isDirectory();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("a non-zero exit status should fail the request")
    void shouldFailOnNonZeroExit() {
        CommandTransformEngine engine = new CommandTransformEngine(List.of("sh", "-c", "exit 3", "engine"), "2.0");

        assertThatThrownBy(() -> engine.transform(request("abc", "abc")))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("tree/abc")
            .hasMessageContaining("status 3");
    }

    @Test
    @DisplayName("should require a command")
    void shouldRequireCommand() {
        assertThatIllegalArgumentException().isThrownBy(() -> new CommandTransformEngine(List.of(), "1"));
    }
}
