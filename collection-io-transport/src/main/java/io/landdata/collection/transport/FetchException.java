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

/// A transport failure for a single URL, with the remote status code when one was received.
public class FetchException extends IOException {
    /// Status code used when no response status was received.
    public static final int NO_STATUS = -1;

    private final String url;
    private final int statusCode;

    /// Creates a failure carrying a remote status code.
    /// @param url the URL that was being fetched
    /// @param statusCode the HTTP(-equivalent) status, or {@link #NO_STATUS}
    /// @param message the error message
    public FetchException(String url, int statusCode, String message) {
        super(message);
        this.url = url;
        this.statusCode = statusCode;
    }

    /// Creates a failure caused by an underlying exception.
    /// @param url the URL that was being fetched
    /// @param message the error message
    /// @param cause the underlying exception
    public FetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = NO_STATUS;
    }

    /// @return the URL that was being fetched
    public String getUrl() {
        return url;
    }

    /// @return the remote status code, or {@link #NO_STATUS}
    public int getStatusCode() {
        return statusCode;
    }

    /// @return true when the remote reported that the object does not exist
    public boolean isNotFound() {
        return statusCode == 404;
    }
}
