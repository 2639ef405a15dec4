package io.landdata.jetty.testserver;

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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class JettyFileServerFixtureTest {

    @TempDir
    Path root;

    @Test
    void servesWrittenFilesAndAnswers404ForMissing() throws IOException {
        try (JettyFileServerFixture fixture = new JettyFileServerFixture(root)) {
            fixture.start();
            fixture.writeFile("nested/dir/hello.txt", "hello".getBytes(StandardCharsets.UTF_8));

            HttpURLConnection ok = (HttpURLConnection) new URL(fixture.urlFor("nested/dir/hello.txt")).openConnection();
            assertEquals(200, ok.getResponseCode());
            try (InputStream in = ok.getInputStream()) {
                assertEquals("hello", new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }

            HttpURLConnection missing = (HttpURLConnection) new URL(fixture.urlFor("nope.txt")).openConnection();
            assertEquals(404, missing.getResponseCode());
        }
    }

    @Test
    void rejectsMissingRoot() {
        assertThrows(RuntimeException.class, () -> new JettyFileServerFixture(root.resolve("absent")));
    }

    @Test
    void baseUrlRequiresStart() {
        JettyFileServerFixture fixture = new JettyFileServerFixture(root);
        assertThrows(IllegalStateException.class, fixture::getBaseUrl);
    }
}
