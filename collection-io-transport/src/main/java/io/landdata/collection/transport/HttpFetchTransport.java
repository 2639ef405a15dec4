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

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/// Fetches whole files over HTTP or HTTPS with a shared OkHttp client.
///
/// Any non-2xx response is a {@link FetchException} carrying the status code, so callers
/// can tell a missing object (404) from other failures.
@TransportScheme({"http", "https"})
public class HttpFetchTransport implements FetchTransport {
    private static final Logger logger = LogManager.getLogger(HttpFetchTransport.class);
    private static final int MAX_ERROR_BODY_CHARS = 512;

    private final OkHttpClient client;

    /// Creates a transport with a default client: 60s connect, 5 minute read, redirects followed.
    public HttpFetchTransport() {
        this(new OkHttpClient.Builder()
            .connectTimeout(60, TimeUnit.SECONDS)
            .readTimeout(5, TimeUnit.MINUTES)
            .writeTimeout(60, TimeUnit.SECONDS)
            .followRedirects(true)
            .build());
    }

    /// Creates a transport around an existing client.
    /// @param client the shared HTTP client
    public HttpFetchTransport(OkHttpClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public void fetch(String url, Path target) throws IOException {
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new FetchException(url, response.code(),
                    "HTTP " + response.code() + " error downloading " + url + errorSuffix(response));
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new FetchException(url, response.code(), "No response body for " + url);
            }
            try (InputStream in = body.byteStream()) {
                long bytes = TargetFiles.replaceWith(in, target);
                logger.debug("Fetched {} bytes from {} to {}", bytes, url, target);
            }
        }
    }

    private static String errorSuffix(Response response) {
        try (ResponseBody body = response.body()) {
            if (body == null) {
                return "";
            }
            String text = body.string().trim();
            if (text.isEmpty()) {
                return "";
            }
            return ": " + (text.length() > MAX_ERROR_BODY_CHARS ? text.substring(0, MAX_ERROR_BODY_CHARS) + "..." : text);
        } catch (IOException e) {
            logger.debug("Could not read error body: {}", e.getMessage());
            return "";
        }
    }
}
