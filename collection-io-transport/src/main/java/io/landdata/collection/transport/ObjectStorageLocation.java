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

import java.util.Objects;

/// A bucket and object key parsed from an `s3://bucket/key` URL.
///
/// @param bucket the bucket name
/// @param key the object key, without a leading slash
public record ObjectStorageLocation(String bucket, String key) {
    /// URL prefix for object storage locations.
    public static final String SCHEME_PREFIX = "s3://";

    public ObjectStorageLocation {
        Objects.requireNonNull(bucket, "bucket");
        Objects.requireNonNull(key, "key");
        if (bucket.isEmpty()) {
            throw new IllegalArgumentException("Object storage URL has no bucket");
        }
        if (key.isEmpty()) {
            throw new IllegalArgumentException("Object storage URL has no object key for bucket " + bucket);
        }
    }

    /// Parse an `s3://` URL.
    /// @param url the URL to parse
    /// @return the bucket and key
    /// @throws IllegalArgumentException if the URL is not an `s3://` URL with bucket and key
    public static ObjectStorageLocation parse(String url) {
        if (url == null || !url.regionMatches(true, 0, SCHEME_PREFIX, 0, SCHEME_PREFIX.length())) {
            throw new IllegalArgumentException("Not an object storage URL: " + url);
        }
        String remainder = url.substring(SCHEME_PREFIX.length());
        int slash = remainder.indexOf('/');
        if (slash < 0) {
            return new ObjectStorageLocation(remainder, "");
        }
        String key = remainder.substring(slash + 1);
        while (key.startsWith("/")) {
            key = key.substring(1);
        }
        return new ObjectStorageLocation(remainder.substring(0, slash), key);
    }

    @Override
    public String toString() {
        return SCHEME_PREFIX + bucket + "/" + key;
    }
}
