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
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.DefaultServlet;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;


/**
 * A test fixture that starts a Jetty web server serving files from a directory.
 * <p>
 * The server listens on 127.0.0.1 with an ephemeral port. Files written into
 * {@link #getRootDirectory()} after start are served immediately; missing files
 * answer 404.
 * <p>
 * Example usage:
 * ```java
 * try (JettyFileServerFixture server = new JettyFileServerFixture(tempDir)) {
 *     server.start();
 *     String url = server.urlFor("collection/resource/abc");
 * }
 * ```
 */
public class JettyFileServerFixture implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(JettyFileServerFixture.class);

    private final Path resourcesRoot;
    private Server server;
    private int port;

    /**
     * Creates a new fixture serving the specified directory.
     *
     * @param resourcesRoot The root directory containing the files to serve
     */
    public JettyFileServerFixture(Path resourcesRoot) {
        if (!Files.isDirectory(resourcesRoot)) {
            throw new UncheckedIOException(new IOException("Resources directory does not exist: " + resourcesRoot));
        }
        this.resourcesRoot = resourcesRoot;
    }

    /**
     * Starts the web server on an ephemeral port.
     *
     * @throws IOException If the server cannot be started
     */
    public void start() throws IOException {
        server = new Server();

        ServerConnector connector = new ServerConnector(server);
        connector.setHost("127.0.0.1");
        connector.setPort(0);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.setResourceBase(resourcesRoot.toAbsolutePath().toString());
        server.setHandler(context);

        ServletHolder defaultServlet = new ServletHolder("default", DefaultServlet.class);
        defaultServlet.setInitParameter("dirAllowed", "false");
        defaultServlet.setInitParameter("welcomeServlets", "false");
        defaultServlet.setInitParameter("redirectWelcome", "false");
        defaultServlet.setInitParameter("precompressed", "false");
        defaultServlet.setInitParameter("useFileMappedBuffer", "false");
        defaultServlet.setInitParameter("cacheControl", "no-store");
        context.addServlet(defaultServlet, "/");

        try {
            server.start();
            this.port = connector.getLocalPort();
            logger.info("Jetty test web server started on port {} serving files from {}", port, resourcesRoot);
        } catch (Exception e) {
            throw new IOException("Failed to start Jetty server", e);
        }
    }

    /**
     * Gets the base URL of the server, always ending in a slash.
     *
     * @return The base URL of the server
     */
    public String getBaseUrl() {
        if (server == null) {
            throw new IllegalStateException("Server has not been started");
        }
        return "http://127.0.0.1:" + port + "/";
    }

    /**
     * @param relativePath path below the served root, without a leading slash
     * @return the URL at which that path is served
     */
    public String urlFor(String relativePath) {
        return getBaseUrl() + relativePath;
    }

    /**
     * Writes a file below the served root, creating parent directories.
     *
     * @param relativePath path below the served root
     * @param content file content
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    public Path writeFile(String relativePath, byte[] content) throws IOException {
        Path file = resourcesRoot.resolve(relativePath);
        Files.createDirectories(file.getParent());
        return Files.write(file, content);
    }

    /**
     * Gets the root directory being served by this server.
     *
     * @return The root directory path
     */
    public Path getRootDirectory() {
        return resourcesRoot;
    }

    /**
     * Stops the server and releases resources.
     */
    @Override
    public void close() {
        if (server != null) {
            try {
                server.stop();
                logger.info("Jetty test web server stopped");
            } catch (Exception e) {
                logger.error("Error stopping Jetty server", e);
            }
            server = null;
        }
    }
}
