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

import io.landdata.collection.tasks.TaskRangeException;
import io.landdata.collection.tasks.TaskWindow;
import io.landdata.collection.tasks.collection.CollectionFixtures;
import io.landdata.collection.tasks.collection.CsvResourceCollection;
import io.landdata.collection.tasks.runner.RunSummary;
import io.landdata.collection.tasks.runner.TaskError;
import io.landdata.collection.tasks.runner.TaskRunner;
import io.landdata.collection.tasks.staleness.DatasetResourceLogStore;
import io.landdata.status.NoopProgressReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ResourceTransformer")
class ResourceTransformerTest {

    @TempDir
    Path tempDir;

    private Path collectionDir;
    private TransformDirectories directories;
    private final RecordingEngine engine = new RecordingEngine();

    /// Records requests instead of transforming; resources named in `failing` throw.
    static class RecordingEngine implements TransformEngine {
        final List<TransformRequest> requests = new CopyOnWriteArrayList<>();
        final List<String> failing = new CopyOnWriteArrayList<>();
        String version = "1.0.0";
        boolean writesLog;

        @Override
        public void transform(TransformRequest request) throws IOException {
            requests.add(request);
            if (failing.contains(request.requestedResource())) {
                throw new IOException("pipeline failed for " + request.requestedResource());
            }
            if (writesLog) {
                Path log = request.directories().datasetResourceDir(request.dataset())
                    .resolve(request.requestedResource() + ".csv");
                Files.createDirectories(log.getParent());
                Files.writeString(log, "dataset,resource,entry-count,mime-type\n"
                    + request.dataset() + "," + request.requestedResource() + ",42,text/csv\n");
            }
        }

        @Override
        public String codeVersion() {
            return version;
        }
    }

    @BeforeEach
    void setUp() throws IOException {
        collectionDir = CollectionFixtures.exampleCollection(tempDir);
        directories = TransformDirectories.defaults(collectionDir, tempDir);
        Files.createDirectories(directories.pipelineDir());
        Files.writeString(directories.pipelineDir().resolve("column.csv"), "dataset,column,field\n");
    }

    private ResourceTransformer transformer() {
        return new ResourceTransformer(CsvResourceCollection.load(collectionDir), engine,
            new TaskRunner(NoopProgressReporter.getInstance()));
    }

    @Test
    @DisplayName("a removed resource should be dropped from every dataset, leaving 1 of 3 tasks")
    void shouldDropRemovedResource() {
        RunSummary summary = transformer().transform(directories, TaskWindow.all(), 2, false);

        assertThat(summary.successful()).isEqualTo(1);
        assertThat(summary.failed()).isZero();
        assertThat(engine.requests).singleElement().satisfies(request -> {
            assertThat(request.task().id()).isEqualTo("ds-a/r3");
            assertThat(request.inputPath()).isEqualTo(collectionDir.resolve("resource/r3"));
            assertThat(request.outputPath()).isEqualTo(directories.transformedDir().resolve("ds-a/r3.csv"));
            assertThat(request.endpoints()).containsExactly("e3");
            assertThat(request.entryDate()).isEqualTo("2024-01-02");
            assertThat(request.resourceOverride()).isEmpty();
        });
    }

    @Test
    @DisplayName("should record fingerprints and skip up-to-date tasks on the next run")
    void shouldSkipUpToDateTasks() throws IOException {
        ResourceTransformer transformer = transformer();
        transformer.transform(directories, TaskWindow.all(), 1, false);
        assertThat(new DatasetResourceLogStore(directories.datasetResourceDir()).read("ds-a", "r3"))
            .contains(transformer.currentFingerprint(directories));

        engine.requests.clear();
        RunSummary second = transformer.transform(directories, TaskWindow.all(), 1, false);

        assertThat(second.noop()).isTrue();
        assertThat(engine.requests).isEmpty();
    }

    @Test
    @DisplayName("the fingerprint should be added to the log the pipeline wrote")
    void shouldKeepPipelineLogColumns() throws IOException {
        engine.writesLog = true;
        ResourceTransformer transformer = transformer();
        transformer.transform(directories, TaskWindow.all(), 1, false);

        Path log = directories.datasetResourceDir("ds-a").resolve("r3.csv");
        List<String> lines = Files.readAllLines(log);
        assertThat(lines.get(0)).startsWith("dataset,resource,entry-count,mime-type,code-version");
        assertThat(lines.get(1)).startsWith("ds-a,r3,42,text/csv,1.0.0,");
        assertThat(new DatasetResourceLogStore(directories.datasetResourceDir()).read("ds-a", "r3"))
            .contains(transformer.currentFingerprint(directories));
    }

    @Test
    @DisplayName("a truncated log left by an interrupted run should be reprocessed, not abort the run")
    void shouldReprocessAfterTruncatedLog() throws IOException {
        Path log = directories.datasetResourceDir("ds-a").resolve("r3.csv");
        Files.createDirectories(log.getParent());
        Files.writeString(log, "dataset,resource,code-version,config-hash,specification-hash\nds-a,r3\n");

        RunSummary summary = transformer().transform(directories, TaskWindow.all(), 1, false);

        assertThat(summary.successful()).isEqualTo(1);
        assertThat(engine.requests).singleElement()
            .satisfies(request -> assertThat(request.task().id()).isEqualTo("ds-a/r3"));
    }

    @Test
    @DisplayName("reprocess should ignore stored fingerprints")
    void shouldReprocessWhenAsked() {
        ResourceTransformer transformer = transformer();
        transformer.transform(directories, TaskWindow.all(), 1, false);
        engine.requests.clear();

        RunSummary summary = transformer.transform(directories, TaskWindow.all(), 1, true);

        assertThat(summary.successful()).isEqualTo(1);
        assertThat(engine.requests).hasSize(1);
    }

    @Test
    @DisplayName("a pipeline configuration change should make tasks stale again")
    void shouldRerunAfterConfigChange() throws IOException {
        ResourceTransformer transformer = transformer();
        transformer.transform(directories, TaskWindow.all(), 1, false);
        engine.requests.clear();

        Files.writeString(directories.pipelineDir().resolve("column.csv"), "dataset,column,field\ntree,x,y\n");

        assertThat(transformer.transform(directories, TaskWindow.all(), 1, false).successful()).isEqualTo(1);
    }

    @Test
    @DisplayName("a failed task should be reported and leave no fingerprint")
    void shouldReportFailedTask() throws IOException {
        engine.failing.add("r3");

        RunSummary summary = transformer().transform(directories, TaskWindow.all(), 1, false);

        assertThat(summary.errors()).containsExactly(new TaskError("ds-a/r3", "pipeline failed for r3"));
        assertThat(new DatasetResourceLogStore(directories.datasetResourceDir()).read("ds-a", "r3")).isEmpty();
    }

    @Test
    @DisplayName("a redirected resource should read the new input but keep the requested name")
    void shouldPassResourceOverrideForRedirects() throws IOException {
        Files.writeString(collectionDir.resolve("old-resource.csv"), "old-resource,status,resource\nr1,301,r9\n");

        transformer().transform(directories, new TaskWindow("ds-b", null, null), 1, false);

        assertThat(engine.requests).singleElement().satisfies(request -> {
            assertThat(request.requestedResource()).isEqualTo("r1");
            assertThat(request.physicalResource()).isEqualTo("r9");
            assertThat(request.inputPath()).isEqualTo(collectionDir.resolve("resource/r9"));
            assertThat(request.outputPath()).isEqualTo(directories.transformedDir().resolve("ds-b/r1.csv"));
            assertThat(request.endpoints()).containsExactly("e1", "e2");
            assertThat(request.resourceOverride()).contains("r1");
        });
    }

    @Test
    @DisplayName("should apply the shard window before redirects")
    void shouldSliceBeforeResolving() {
        RunSummary summary = transformer().transform(directories, new TaskWindow(null, 1, 1), 1, false);

        assertThat(summary.successful()).isEqualTo(1);
        assertThat(engine.requests).extracting(r -> r.task().id()).containsExactly("ds-a/r3");

        RunSummary removedOnly = transformer().transform(directories, new TaskWindow(null, 2, 1), 1, true);
        assertThat(removedOnly.noop()).isTrue();
    }

    @Test
    @DisplayName("an offset beyond the tasks should fail before any work")
    void shouldRejectOffsetBeyondTasks() {
        assertThatThrownBy(() -> transformer().transform(directories, new TaskWindow("ds-b", 1, null), 1, false))
            .isInstanceOf(TaskRangeException.class)
            .hasMessageContaining("ds-b");
        assertThat(engine.requests).isEmpty();
    }
}
