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

package org.fireflyframework.livefeed.model;

/**
 * Classification of a feed subscription failure.
 */
public enum ErrorKind {

    /**
     * Network blip or timeout. Retried with the same query.
     */
    TRANSIENT,

    /**
     * The store lacks a capability the query needs, typically a composite index.
     * Handled by switching to the feed's declared degraded query.
     */
    MISSING_CAPABILITY,

    /**
     * Malformed query or revoked permission. Never retried.
     */
    PERMANENT
}
