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

import io.minio.MinioClient;

import java.util.Map;

/// Builds the process-wide {@link MinioClient} used by {@link ObjectStorageFetchTransport}.
///
/// Settings come from the standard AWS environment variables:
/// - `AWS_ENDPOINT_URL` (default `https://s3.amazonaws.com`)
/// - `AWS_ACCESS_KEY_ID` / `AWS_SECRET_ACCESS_KEY` (anonymous access when unset)
/// - `AWS_REGION` or `AWS_DEFAULT_REGION` (optional)
public final class ObjectStorageClients {
    /// Endpoint used when `AWS_ENDPOINT_URL` is unset.
    public static final String DEFAULT_ENDPOINT = "https://s3.amazonaws.com";

    private ObjectStorageClients() {
    }

    /// @return a client configured from the process environment
    public static MinioClient fromEnvironment() {
        return fromSettings(System.getenv());
    }

    /// @param env environment-style settings
    /// @return a client configured from the given settings
    public static MinioClient fromSettings(Map<String, String> env) {
        MinioClient.Builder builder = MinioClient.builder()
            .endpoint(valueOr(env, "AWS_ENDPOINT_URL", DEFAULT_ENDPOINT));
        String accessKey = env.get("AWS_ACCESS_KEY_ID");
        String secretKey = env.get("AWS_SECRET_ACCESS_KEY");
        if (accessKey != null && !accessKey.isBlank() && secretKey != null) {
            builder.credentials(accessKey, secretKey);
        }
        String region = valueOr(env, "AWS_REGION", env.get("AWS_DEFAULT_REGION"));
        if (region != null && !region.isBlank()) {
            builder.region(region);
        }
        return builder.build();
    }

    private static String valueOr(Map<String, String> env, String key, String fallback) {
        String value = env.get(key);
        return value == null || value.isBlank() ? fallback : value;
    }
}
