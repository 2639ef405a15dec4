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

import io.landdata.collection.transport.FetchException;
import io.landdata.collection.transport.FetchTransport;
import io.landdata.collection.transport.TransportScheme;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/// Serves `mem://` URLs from memory; URLs registered as failing always fail.
@TransportScheme("mem")
class MemoryFetchTransport implements FetchTransport {
    private final Map<String, String> content = new ConcurrentHashMap<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();

    MemoryFetchTransport put(String url, String body) {
        content.put(url, body);
        return this;
    }

    MemoryFetchTransport failing(String url) {
        failing.add(url);
        return this;
    }

    int attempts(String url) {
        AtomicInteger count = attempts.get(url);
        return count == null ? 0 : count.get();
    }

    @Override
    public void fetch(String url, Path target) throws IOException {
        attempts.computeIfAbsent(url, u -> new AtomicInteger()).incrementAndGet();
        if (failing.contains(url)) {
            throw new FetchException(url, 503, "service unavailable: " + url);
        }
        String body = content.get(url);
        if (body == null) {
            throw new FetchException(url, 404, "not found: " + url);
        }
        Files.writeString(target, body, StandardCharsets.UTF_8);
    }
}
