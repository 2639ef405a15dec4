package io.landdata.collection.tasks.staleness;

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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Hashes a directory tree into a single SHA-256 hex string.
///
/// Regular files are visited in order of their `/`-separated relative path; each contributes
/// its relative path followed by its bytes. A missing directory hashes like an empty one.
public final class DirectoryHasher {
    private static final int BUFFER_SIZE = 8192;

    private DirectoryHasher() {
    }

    /// @param directory the directory to hash
    /// @return the lowercase hex SHA-256 digest
    /// @throws IOException if the tree cannot be read
    public static String hash(Path directory) throws IOException {
        MessageDigest digest = newDigest();
        if (Files.isDirectory(directory)) {
            List<Path> files;
            try (Stream<Path> walk = Files.walk(directory)) {
                files = walk.filter(Files::isRegularFile)
                    .sorted((a, b) -> relative(directory, a).compareTo(relative(directory, b)))
                    .collect(Collectors.toList());
            }
            byte[] buffer = new byte[BUFFER_SIZE];
            for (Path file : files) {
                digest.update(relative(directory, file).getBytes(StandardCharsets.UTF_8));
                try (InputStream in = Files.newInputStream(file)) {
                    int read;
                    while ((read = in.read(buffer)) != -1) {
                        digest.update(buffer, 0, read);
                    }
                }
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static String relative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
