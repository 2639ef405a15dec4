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

import io.minio.GetObjectArgs;
import io.minio.GetObjectResponse;
import io.minio.MinioClient;
import io.minio.errors.ErrorResponseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/// Fetches `s3://bucket/key` objects through a shared MinIO client.
///
/// `NoSuchKey` and `NoSuchBucket` responses are reported as 404 {@link FetchException}s.
@TransportScheme("s3")
public class ObjectStorageFetchTransport implements FetchTransport {
    private static final Logger logger = LogManager.getLogger(ObjectStorageFetchTransport.class);

    private final MinioClient client;

    /// @param client the shared object storage client
    public ObjectStorageFetchTransport(MinioClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public void fetch(String url, Path target) throws IOException {
        ObjectStorageLocation location = ObjectStorageLocation.parse(url);
        GetObjectArgs args = GetObjectArgs.builder()
            .bucket(location.bucket())
            .object(location.key())
            .build();
        try (GetObjectResponse in = client.getObject(args)) {
            long bytes = TargetFiles.replaceWith(in, target);
            logger.debug("Fetched {} bytes from {} to {}", bytes, url, target);
        } catch (ErrorResponseException e) {
            String code = e.errorResponse().code();
            if ("NoSuchKey".equals(code) || "NoSuchBucket".equals(code)) {
                throw new FetchException(url, 404, code + " for " + url);
            }
            throw new FetchException(url, "Object storage error " + code + " for " + url, e);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new FetchException(url, "Failed to read object " + url + ": " + e.getMessage(), e);
        }
    }
}
