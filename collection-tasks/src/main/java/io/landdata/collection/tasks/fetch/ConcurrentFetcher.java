package io.landdata.collection.tasks.fetch;

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

import io.landdata.collection.tasks.NamedThreadFactory;
import io.landdata.collection.tasks.retry.BackoffPolicy;
import io.landdata.collection.tasks.retry.Retrier;
import io.landdata.collection.tasks.retry.RetryPolicy;
import io.landdata.collection.transport.FetchTransport;
import io.landdata.collection.transport.FetchTransports;
import io.landdata.status.ProgressReporter;
import io.landdata.status.ProgressTracker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/// Fetches URLs to local files with bounded parallelism and per-file retries.
///
/// The transport for each URL is chosen by its scheme from a shared {@link FetchTransports}
/// registry. Batch results are returned as a map from URL to outcome in the iteration order of
/// the input map; completion order is not significant.
///
/// ```java
/// ConcurrentFetcher fetcher = new ConcurrentFetcher(transports, reporter);
/// fetcher.fetchAll(Map.of(url, Path.of("collection/resource/abc")), 4);
/// ```
public class ConcurrentFetcher {
    private static final Logger logger = LogManager.getLogger(ConcurrentFetcher.class);

    /// Parallelism used by the command-line operations unless configured.
    public static final int DEFAULT_MAX_PARALLELISM = 4;

    private final FetchTransports transports;
    private final ProgressReporter reporter;
    private final BackoffPolicy backoff;

    /// @param transports the shared transport registry
    /// @param reporter where batch progress is reported
    public ConcurrentFetcher(FetchTransports transports, ProgressReporter reporter) {
        this(transports, reporter, BackoffPolicy.none());
    }

    /// @param transports the shared transport registry
    /// @param reporter where batch progress is reported
    /// @param backoff delay between attempts of one fetch
    public ConcurrentFetcher(FetchTransports transports, ProgressReporter reporter, BackoffPolicy backoff) {
        this.transports = Objects.requireNonNull(transports, "transports");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
    }

    /// Fetch one URL, logging failures rather than throwing them.
    /// @param url the URL to fetch
    /// @param localPath where to write it; parent directories are created
    /// @param maxRetries total attempts to make
    /// @return true when the file was written
    public boolean fetchOne(String url, Path localPath, int maxRetries) {
        try {
            return fetchOne(url, localPath, maxRetries, false);
        } catch (IOException e) {
            throw new IllegalStateException("fetch without raiseError threw", e);
        }
    }

    /// Fetch one URL.
    /// @param url the URL to fetch
    /// @param localPath where to write it; parent directories are created
    /// @param maxRetries total attempts to make
    /// @param raiseError when true, the last failure is thrown instead of returning false
    /// @return true when the file was written; false only when {@code raiseError} is false
    /// @throws IOException the final transport failure, when {@code raiseError} is set
    public boolean fetchOne(String url, Path localPath, int maxRetries, boolean raiseError) throws IOException {
        FetchTransport transport;
        try {
            transport = transports.transportFor(url);
            Path parent = localPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Cannot fetch {}: {}", url, e.getMessage());
            if (raiseError) {
                throw e;
            }
            return false;
        }

        RetryPolicy policy = new RetryPolicy(maxRetries, backoff);
        if (!raiseError) {
            return Retrier.run(url, policy, () -> transport.fetch(url, localPath)).succeeded();
        }
        try {
            Retrier.runOrThrow(url, policy, () -> transport.fetch(url, localPath));
            return true;
        } catch (IOException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("Failed to fetch " + url, e);
        }
    }

    /// Fetch every URL concurrently without raising for individual failures.
    /// @param urlToPath target path per URL
    /// @param parallelism maximum concurrent fetches
    /// @param maxRetries total attempts per URL
    /// @return outcome per URL, in the iteration order of {@code urlToPath}
    public Map<String, Boolean> fetchEach(Map<String, Path> urlToPath, int parallelism, int maxRetries) {
        Objects.requireNonNull(urlToPath, "urlToPath");
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
        }
        Map<String, Boolean> results = new LinkedHashMap<>();
        if (urlToPath.isEmpty()) {
            return results;
        }

        int threads = Math.min(parallelism, urlToPath.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads, new NamedThreadFactory("fetch"));
        try (ProgressTracker tracker = reporter.begin("Downloading files", urlToPath.size())) {
            List<Map.Entry<String, Future<Boolean>>> futures = new ArrayList<>(urlToPath.size());
            for (Map.Entry<String, Path> entry : urlToPath.entrySet()) {
                String url = entry.getKey();
                Path path = entry.getValue();
                futures.add(Map.entry(url, executor.submit(() -> {
                    try {
                        return fetchOne(url, path, maxRetries);
                    } finally {
                        tracker.advance();
                    }
                })));
            }
            for (Map.Entry<String, Future<Boolean>> entry : futures) {
                results.put(entry.getKey(), await(entry.getKey(), entry.getValue()));
            }
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    /// Fetch every URL concurrently and fail if any of them could not be fetched.
    /// @param urlToPath target path per URL
    /// @param maxParallelism maximum concurrent fetches
    /// @return outcome per URL, all true, in the iteration order of {@code urlToPath}
    /// @throws FetchFailedException after every URL was attempted, listing each one that failed
    public Map<String, Boolean> fetchAll(Map<String, Path> urlToPath, int maxParallelism) {
        return fetchAll(urlToPath, maxParallelism, RetryPolicy.DEFAULT_MAX_ATTEMPTS);
    }

    /// As {@link #fetchAll(Map, int)} with an explicit attempt budget per URL.
    public Map<String, Boolean> fetchAll(Map<String, Path> urlToPath, int maxParallelism, int maxRetries) {
        Map<String, Boolean> results = fetchEach(urlToPath, maxParallelism, maxRetries);
        List<String> failed = new ArrayList<>();
        results.forEach((url, ok) -> {
            if (!ok) {
                failed.add(url);
            }
        });
        if (!failed.isEmpty()) {
            FetchFailedException e = new FetchFailedException(failed, results.size());
            logger.error(e.getMessage());
            throw e;
        }
        return results;
    }

    private static boolean await(String url, Future<Boolean> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            logger.error("Failed to download {}: {}", url, e.getCause().toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for {}", url);
            future.cancel(true);
            return false;
        }
    }
}
