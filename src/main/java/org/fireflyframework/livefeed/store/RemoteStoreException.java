/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.livefeed.store;

import lombok.Getter;

/**
 * Error signalled by a remote store listener.
 * <p>
 * The classification is the backend's own status string (for example
 * {@code UNAVAILABLE}, {@code FAILED_PRECONDITION} or {@code PERMISSION_DENIED}).
 * It is interpreted only by the fallback planner.
 */
@Getter
public class RemoteStoreException extends RuntimeException {

    public static final String UNAVAILABLE = "UNAVAILABLE";
    public static final String FAILED_PRECONDITION = "FAILED_PRECONDITION";
    public static final String PERMISSION_DENIED = "PERMISSION_DENIED";
    public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";

    private final String classification;

    public RemoteStoreException(String classification, String message) {
        super(message);
        this.classification = classification;
    }

    public RemoteStoreException(String classification, String message, Throwable cause) {
        super(message, cause);
        this.classification = classification;
    }

    public static RemoteStoreException unavailable(String message) {
        return new RemoteStoreException(UNAVAILABLE, message);
    }

    public static RemoteStoreException missingIndex(String indexSignature) {
        return new RemoteStoreException(FAILED_PRECONDITION,
                "The query requires an index. Create a composite index for " + indexSignature);
    }

    public static RemoteStoreException permissionDenied(String message) {
        return new RemoteStoreException(PERMISSION_DENIED, message);
    }
}
