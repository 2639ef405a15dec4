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

import java.util.List;

/// Thrown after a batch of fetches completes with one or more failures.
///
/// The message lists every failed URL, one per line, after a count summary.
public class FetchFailedException extends RuntimeException {
    private final List<String> failedUrls;
    private final int attempted;

    /// @param failedUrls the URLs that could not be fetched, in input order
    /// @param attempted the number of URLs in the batch
    public FetchFailedException(List<String> failedUrls, int attempted) {
        super(message(failedUrls));
        this.failedUrls = List.copyOf(failedUrls);
        this.attempted = attempted;
    }

    private static String message(List<String> failedUrls) {
        return "Failed to download " + failedUrls.size() + " file(s):\n" + String.join("\n", failedUrls);
    }

    /// @return every URL that failed, in input order
    public List<String> getFailedUrls() {
        return failedUrls;
    }

    /// @return the number of URLs in the batch
    public int getAttempted() {
        return attempted;
    }
}
