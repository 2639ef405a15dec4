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

/// Where a collection's published files live: an object storage bucket or an HTTP(S) base URL.
///
/// Files are addressed as `<collection>-collection/<path>` under the bucket or base URL. When
/// both a bucket and a base URL are given, the bucket is used.
public final class RemoteSource {
    private final String bucket;
    private final String baseUrl;
    private final String collectionName;

    private RemoteSource(String bucket, String baseUrl, String collectionName) {
        this.bucket = bucket;
        this.baseUrl = baseUrl;
        this.collectionName = collectionName;
    }

    /// @param bucket object storage bucket, or null/blank
    /// @param baseUrl HTTP(S) base URL, or null/blank
    /// @param collectionName the collection name
    /// @return the source
    /// @throws CollectionConfigurationException if neither bucket nor base URL is given, or the name is blank
    public static RemoteSource of(String bucket, String baseUrl, String collectionName) {
        boolean hasBucket = bucket != null && !bucket.isBlank();
        boolean hasBaseUrl = baseUrl != null && !baseUrl.isBlank();
        if (!hasBucket && !hasBaseUrl) {
            throw new CollectionConfigurationException("Either --bucket or --base-url must be provided");
        }
        if (collectionName == null || collectionName.isBlank()) {
            throw new CollectionConfigurationException("A collection name must be provided");
        }
        if (hasBucket) {
            return new RemoteSource(bucket.trim(), null, collectionName.trim());
        }
        String base = baseUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return new RemoteSource(null, base + "/", collectionName.trim());
    }

    /// @param remotePath path below the collection prefix, e.g. `collection/resource/abc`
    /// @return the URL of the file
    public String urlFor(String remotePath) {
        String relative = remotePath.startsWith("/") ? remotePath.substring(1) : remotePath;
        String prefix = collectionName + "-collection/" + relative;
        return bucket != null ? "s3://" + bucket + "/" + prefix : baseUrl + prefix;
    }

    /// @return `S3` or `HTTP(S)`, for log messages
    public String describe() {
        return bucket != null ? "S3" : "HTTP(S)";
    }

    public String collectionName() {
        return collectionName;
    }

    @Override
    public String toString() {
        return bucket != null ? "s3://" + bucket + "/" + collectionName + "-collection/"
            : baseUrl + collectionName + "-collection/";
    }
}
