/*
 * Copyright 2014 the original author or authors.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package org.eventry.core;

import java.time.Instant;
import java.util.Map;

/**
 * An incoming event before it has been normalized and stored. Only the type and the source are required, the category is
 * derived from the type when it has not been supplied.
 *
 * <pre>
 *     EventSubmission submission = EventSubmission.of("order.created", EventSource.BACKEND)
 *         .entity("order", "42")
 *         .payload(Map.of("total", 99));
 * </pre>
 */
public final class EventSubmission {
    private EventCategory category;
    private Map<String, Object> context;
    private String correlationId;
    private String entityId;
    private String entityType;
    private Map<String, Object> metadata;
    private Map<String, Object> payload;
    private EventSource source;
    private Instant timestamp;
    private String type;
    private String userId;

    public static EventSubmission of(final String type, final EventSource source) {
        return new EventSubmission().type(type).source(source);
    }

    public EventCategory category() {
        return category;
    }

    public EventSubmission category(final EventCategory category) {
        this.category = category;
        return this;
    }

    public Map<String, Object> context() {
        return context;
    }

    public EventSubmission context(final Map<String, Object> context) {
        this.context = context;
        return this;
    }

    public String correlationId() {
        return correlationId;
    }

    public EventSubmission correlationId(final String correlationId) {
        this.correlationId = correlationId;
        return this;
    }

    public EventSubmission entity(final String entityType, final String entityId) {
        this.entityType = entityType;
        this.entityId = entityId;
        return this;
    }

    public String entityId() {
        return entityId;
    }

    public String entityType() {
        return entityType;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public EventSubmission metadata(final Map<String, Object> metadata) {
        this.metadata = metadata;
        return this;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public EventSubmission payload(final Map<String, Object> payload) {
        this.payload = payload;
        return this;
    }

    public EventSource source() {
        return source;
    }

    public EventSubmission source(final EventSource source) {
        this.source = source;
        return this;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public EventSubmission timestamp(final Instant timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    public String type() {
        return type;
    }

    public EventSubmission type(final String type) {
        this.type = type;
        return this;
    }

    public String userId() {
        return userId;
    }

    public EventSubmission userId(final String userId) {
        this.userId = userId;
        return this;
    }
}
