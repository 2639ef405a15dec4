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

import io.minio.MinioClient;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/// Routes URLs to the {@link FetchTransport} registered for their scheme.
///
/// Build one registry at startup and share it. Each transport is registered under every
/// scheme named by its {@link TransportScheme} annotation; later registrations replace
/// earlier ones for the same scheme.
///
/// ```java
/// FetchTransports transports = FetchTransports.standard(ObjectStorageClients::fromEnvironment);
/// transports.transportFor("s3://bucket/key").fetch("s3://bucket/key", target);
/// ```
public final class FetchTransports {
    private final Map<String, FetchTransport> byScheme;

    private FetchTransports(Map<String, FetchTransport> byScheme) {
        this.byScheme = Collections.unmodifiableMap(new LinkedHashMap<>(byScheme));
    }

    /// Create a registry from annotated transports.
    /// @param transports transports annotated with {@link TransportScheme}
    /// @return the registry
    public static FetchTransports of(FetchTransport... transports) {
        Map<String, FetchTransport> map = new LinkedHashMap<>();
        for (FetchTransport transport : transports) {
            Objects.requireNonNull(transport, "transport");
            TransportScheme scheme = transport.getClass().getAnnotation(TransportScheme.class);
            if (scheme == null) {
                throw new IllegalArgumentException(
                    transport.getClass().getName() + " is not annotated with @TransportScheme");
            }
            for (String name : scheme.value()) {
                map.put(name.toLowerCase(Locale.ROOT), transport);
            }
        }
        return new FetchTransports(map);
    }

    /// Create a registry with the HTTP(S), file, and object storage transports.
    /// The object storage client is created on first use of an `s3://` URL.
    /// @param objectStorageClient supplier of the shared object storage client
    /// @return the registry
    public static FetchTransports standard(Supplier<MinioClient> objectStorageClient) {
        return of(new HttpFetchTransport(), new FileFetchTransport(),
            new LazyObjectStorageTransport(objectStorageClient));
    }

    /// Find the transport for a URL by its scheme prefix.
    /// @param url the URL to fetch
    /// @return the transport for its scheme
    /// @throws IllegalArgumentException if the URL has no scheme or no transport handles it
    public FetchTransport transportFor(String url) {
        String scheme = schemeOf(url);
        FetchTransport transport = byScheme.get(scheme);
        if (transport == null) {
            throw new IllegalArgumentException("No transport for scheme '" + scheme + "' in " + url
                + ", supported: " + byScheme.keySet());
        }
        return transport;
    }

    /// @return the registered scheme names
    public Set<String> schemes() {
        return byScheme.keySet();
    }

    static String schemeOf(String url) {
        if (url == null) {
            throw new IllegalArgumentException("URL cannot be null");
        }
        int idx = url.indexOf("://");
        if (idx <= 0) {
            throw new IllegalArgumentException("URL has no scheme: " + url);
        }
        return url.substring(0, idx).toLowerCase(Locale.ROOT);
    }

    @TransportScheme("s3")
    private static final class LazyObjectStorageTransport implements FetchTransport {
        private final Supplier<MinioClient> clientSupplier;
        private volatile ObjectStorageFetchTransport delegate;

        private LazyObjectStorageTransport(Supplier<MinioClient> clientSupplier) {
            this.clientSupplier = Objects.requireNonNull(clientSupplier, "clientSupplier");
        }

        @Override
        public void fetch(String url, Path target) throws IOException {
            ObjectStorageFetchTransport transport = delegate;
            if (transport == null) {
                synchronized (this) {
                    transport = delegate;
                    if (transport == null) {
                        transport = new ObjectStorageFetchTransport(clientSupplier.get());
                        delegate = transport;
                    }
                }
            }
            transport.fetch(url, target);
        }
    }
}
