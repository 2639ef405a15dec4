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

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ObjectStorageLocation")
class ObjectStorageLocationTest {

    @Test
    @DisplayName("should split bucket and key")
    void shouldParseBucketAndKey() {
        ObjectStorageLocation location =
            ObjectStorageLocation.parse("s3://open-data/tree-collection/resource/abc");

        assertThat(location.bucket()).isEqualTo("open-data");
        assertThat(location.key()).isEqualTo("tree-collection/resource/abc");
        assertThat(location).hasToString("s3://open-data/tree-collection/resource/abc");
    }

    @Test
    @DisplayName("should reject URLs without a bucket or key")
    void shouldRejectIncompleteUrls() {
        assertThatIllegalArgumentException().isThrownBy(() -> ObjectStorageLocation.parse("s3://bucket-only"));
        assertThatIllegalArgumentException().isThrownBy(() -> ObjectStorageLocation.parse("s3:///key"));
        assertThatIllegalArgumentException().isThrownBy(() -> ObjectStorageLocation.parse("https://host/key"));
    }

    @Test
    @DisplayName("client settings should accept anonymous access")
    void clientShouldBuildWithoutCredentials() {
        assertThat(ObjectStorageClients.fromSettings(Map.of())).isNotNull();
        assertThat(ObjectStorageClients.fromSettings(Map.of(
            "AWS_ENDPOINT_URL", "http://127.0.0.1:9000",
            "AWS_ACCESS_KEY_ID", "key",
            "AWS_SECRET_ACCESS_KEY", "secret",
            "AWS_REGION", "eu-west-2"))).isNotNull();
    }
}
