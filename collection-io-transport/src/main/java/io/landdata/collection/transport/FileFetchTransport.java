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

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/// Copies `file://` URLs, used for mirrors mounted on the local filesystem.
///
/// A missing source is reported as a 404 {@link FetchException}, matching the remote transports.
@TransportScheme("file")
public class FileFetchTransport implements FetchTransport {

    @Override
    public void fetch(String url, Path target) throws IOException {
        Path source;
        try {
            source = Paths.get(URI.create(url));
        } catch (IllegalArgumentException e) {
            throw new FetchException(url, "Failed to convert URL to path: " + url, e);
        }
        if (!Files.isRegularFile(source)) {
            throw new FetchException(url, 404, "File does not exist: " + source);
        }
        InputStream in;
        try {
            in = Files.newInputStream(source);
        } catch (NoSuchFileException e) {
            throw new FetchException(url, 404, "File does not exist: " + source);
        }
        try (in) {
            TargetFiles.replaceWith(in, target);
        }
    }
}
