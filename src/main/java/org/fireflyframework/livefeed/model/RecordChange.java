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

import java.util.Map;
import java.util.Objects;

/**
 * A single document change delivered by a remote store subscription.
 *
 * @param type       kind of change
 * @param documentId affected document
 * @param fields     document fields after the change; ignored for {@link Type#REMOVED}
 */
public record RecordChange(
        Type type,
        String documentId,
        Map<String, Object> fields
) {

    public enum Type {
        ADDED,
        MODIFIED,
        REMOVED
    }

    public RecordChange {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(documentId, "documentId cannot be null");
        fields = fields == null ? Map.of() : fields;
    }

    public static RecordChange added(String documentId, Map<String, Object> fields) {
        return new RecordChange(Type.ADDED, documentId, fields);
    }

    public static RecordChange modified(String documentId, Map<String, Object> fields) {
        return new RecordChange(Type.MODIFIED, documentId, fields);
    }

    public static RecordChange removed(String documentId) {
        return new RecordChange(Type.REMOVED, documentId, Map.of());
    }
}
