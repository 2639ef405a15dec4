package io.landdata.command.common;

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

import io.landdata.collection.tasks.collection.RemoteSource;
import picocli.CommandLine;

/**
 * Shared options locating the published collection: a bucket or a base URL, and the collection name.
 */
public class RemoteSourceOption {

    @CommandLine.Option(names = {"--bucket"}, defaultValue = "${env:COLLECTION_DATASET_BUCKET_NAME}",
        description = "Object storage bucket to download from (optional if --base-url provided)")
    private String bucket;

    @CommandLine.Option(names = {"--base-url"}, defaultValue = "${env:DATASTORE_URL}",
        description = "Base URL for HTTP(S) downloads, e.g. https://files.planning.data.gov.uk/")
    private String baseUrl;

    @CommandLine.Option(names = {"--collection-name"}, defaultValue = "${env:COLLECTION_NAME}",
        description = "Collection name, e.g. brownfield-land")
    private String collectionName;

    /**
     * @param fallbackName name used when {@code --collection-name} was not given
     * @return the remote source
     * @throws io.landdata.collection.tasks.CollectionConfigurationException if no location was given
     */
    public RemoteSource toSource(String fallbackName) {
        String name = collectionName == null || collectionName.isBlank() ? fallbackName : collectionName;
        return RemoteSource.of(bucket, baseUrl, name);
    }
}
