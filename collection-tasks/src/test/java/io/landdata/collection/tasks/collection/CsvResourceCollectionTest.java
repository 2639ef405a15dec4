package io.landdata.collection.tasks.collection;

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

import io.landdata.collection.tasks.CollectionConfigurationException;
import io.landdata.collection.tasks.model.RedirectEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CsvResourceCollection")
class CsvResourceCollectionTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should load datasets, metadata and redirects")
    void shouldLoadCollection() throws IOException {
        Path dir = CollectionFixtures.exampleCollection(tempDir);

        CsvResourceCollection collection = CsvResourceCollection.load(dir);

        assertThat(collection.name()).isEqualTo("tree");
        assertThat(collection.datasetResourceMap().datasets()).containsExactly("ds-a", "ds-b");
        assertThat(collection.datasetResourceMap().resources("ds-a")).hasValueSatisfying(
            resources -> assertThat(resources).containsExactly("r1", "r3"));
        assertThat(collection.resourceEndpoints("r1")).containsExactly("e1", "e2");
        assertThat(collection.resourceOrganisations("r1"))
            .containsExactly("local-authority:ABC", "local-authority:DEF");
        assertThat(collection.resourceStartDate("r3")).isEqualTo("2024-01-02");
        assertThat(collection.resourcePath("r3")).isEqualTo(dir.resolve("resource").resolve("r3"));
        assertThat(collection.oldResourceEntries()).containsExactly(new RedirectEntry("r1", "", "410"));
    }

    @Test
    @DisplayName("unknown resources should have empty metadata")
    void shouldReturnEmptyMetadataForUnknownResource() throws IOException {
        CsvResourceCollection collection = CsvResourceCollection.load(CollectionFixtures.exampleCollection(tempDir));

        assertThat(collection.resourceEndpoints("zzz")).isEmpty();
        assertThat(collection.resourceStartDate("zzz")).isEmpty();
    }

    @Test
    @DisplayName("a collection without old-resource.csv has no redirects")
    void shouldAllowMissingRedirects() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("park"));
        Files.writeString(dir.resolve("resource.csv"), "resource,datasets\nabc,park\n");

        CsvResourceCollection collection = CsvResourceCollection.load(dir);

        assertThat(collection.name()).isEqualTo("park");
        assertThat(collection.oldResourceEntries()).isEmpty();
        assertThat(collection.resourceEndpoints("abc")).isEmpty();
    }

    @Test
    @DisplayName("a directory without resource.csv is a configuration error")
    void shouldRejectMissingResourceFile() {
        assertThatThrownBy(() -> CsvResourceCollection.load(tempDir))
            .isInstanceOf(CollectionConfigurationException.class)
            .hasMessageContaining("resource.csv");
        assertThatThrownBy(() -> CsvResourceCollection.load(tempDir.resolve("absent")))
            .isInstanceOf(CollectionConfigurationException.class);
    }
}
