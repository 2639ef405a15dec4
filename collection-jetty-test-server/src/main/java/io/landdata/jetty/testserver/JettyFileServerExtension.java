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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

///  A JUnit Jupiter extension that runs one {@link JettyFileServerFixture} per test class.
///
///  The served root is a fresh temporary directory. Tests write the files they need with
///  {@link JettyFileServerFixture#writeFile(String, byte[])} and fetch them through
///  {@link #getServer()}.
///
/// Example usage:
///
/// ```java
/// @ExtendWith(JettyFileServerExtension.class)
/// class MyTest {
///     @Test
///     void fetches() throws IOException {
///         JettyFileServerFixture server = JettyFileServerExtension.getServer();
///         server.writeFile("a/b.csv", bytes);
///     }
/// }
/// ```
///
public class JettyFileServerExtension implements BeforeAllCallback, AfterAllCallback {
    private static final Logger logger = LogManager.getLogger(JettyFileServerExtension.class);
    private static final Object lock = new Object();
    private static JettyFileServerFixture server;

    /// Gets the running server for the current test class.
    /// @return the running fixture
    public static JettyFileServerFixture getServer() {
        synchronized (lock) {
            if (server == null) {
                throw new IllegalStateException("JettyFileServerExtension is not active for this test class");
            }
            return server;
        }
    }

    @Override
    public void beforeAll(ExtensionContext context) {
        synchronized (lock) {
            try {
                Path root = Files.createTempDirectory("jetty-testserver");
                server = new JettyFileServerFixture(root);
                server.start();
                logger.debug("JettyFileServerExtension started for {}", context.getDisplayName());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to start Jetty test web server", e);
            }
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        synchronized (lock) {
            if (server != null) {
                server.close();
                server = null;
            }
            logger.debug("JettyFileServerExtension stopped for {}", context.getDisplayName());
        }
    }
}
