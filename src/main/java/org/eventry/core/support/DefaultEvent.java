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

package org.eventry.core.support;

import org.eventry.core.Event;
import org.eventry.core.EventCategory;
import org.eventry.core.EventSource;
import org.eventry.core.EventStatus;
import org.eventry.core.StatusChange;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * This is the event implementation, an immutable value. New instances are created via the {@link Builder} and processing
 * state changes produce new instances via {@link #apply(StatusChange, Instant)}.
 */
public final class DefaultEvent implements Event {
    public static final String DEFAULT_VERSION = "1.0.0";

    public static final class Builder {
        private EventCategory category;
        private Map<String, Object> context;
        private String correlationId;
        private Instant createdAt;
        private String entityId;
        private String entityType;
        private String errorMessage;
        private String id;
        private Map<String, Object> metadata;
        private Map<String, Object> payload;
        private Instant processedAt;
        private List<String> processors;
        private int retryCount;
        private String schemaVersion = DEFAULT_VERSION;
        private long sequence;
        private EventSource source;
        private EventStatus status = EventStatus.PENDING;
        private Instant timestamp;
        private String type;
        private Instant updatedAt;
        private String userId;
        private String version = DEFAULT_VERSION;

        private Builder() {
            // empty
        }

        public DefaultEvent build() {
            return new DefaultEvent(this);
        }

        public Builder category(final EventCategory category) {
            this.category = category;
            return this;
        }

        public Builder context(final Map<String, Object> context) {
            this.context = context;
            return this;
        }

        public Builder correlationId(final String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder createdAt(final Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder entity(final String entityType, final String entityId) {
            this.entityType = entityType;
            this.entityId = entityId;
            return this;
        }

        public Builder errorMessage(final String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder id(final String id) {
            this.id = id;
            return this;
        }

        public Builder metadata(final Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder payload(final Map<String, Object> payload) {
            this.payload = payload;
            return this;
        }

        public Builder processedAt(final Instant processedAt) {
            this.processedAt = processedAt;
            return this;
        }

        public Builder processors(final List<String> processors) {
            this.processors = processors;
            return this;
        }

        public Builder retryCount(final int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder schemaVersion(final String schemaVersion) {
            this.schemaVersion = schemaVersion;
            return this;
        }

        public Builder sequence(final long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder source(final EventSource source) {
            this.source = source;
            return this;
        }

        public Builder status(final EventStatus status) {
            this.status = status;
            return this;
        }

        public Builder timestamp(final Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder type(final String type) {
            this.type = type;
            return this;
        }

        public Builder updatedAt(final Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder userId(final String userId) {
            this.userId = userId;
            return this;
        }

        public Builder version(final String version) {
            this.version = version;
            return this;
        }
    }

    private final EventCategory category;
    private final Map<String, Object> context;
    private final String correlationId;
    private final Instant createdAt;
    private final String entityId;
    private final String entityType;
    private final String errorMessage;
    private final String id;
    private final Map<String, Object> metadata;
    private final Map<String, Object> payload;
    private final Instant processedAt;
    private final List<String> processors;
    private final int retryCount;
    private final String schemaVersion;
    private final long sequence;
    private final EventSource source;
    private final EventStatus status;
    private final Instant timestamp;
    private final String type;
    private final Instant updatedAt;
    private final String userId;
    private final String version;

    private DefaultEvent(final Builder builder) {
        this.id = builder.id;
        this.sequence = builder.sequence;
        this.type = requireNonNull(builder.type, "Event type must not be null");
        this.source = requireNonNull(builder.source, "Event source must not be null");
        this.category = requireNonNull(builder.category, "Event category must not be null");
        this.entityType = builder.entityType;
        this.entityId = builder.entityId;
        this.correlationId = builder.correlationId;
        this.userId = builder.userId;
        this.payload = copy(builder.payload);
        this.metadata = copy(builder.metadata);
        this.context = copy(builder.context);
        this.status = requireNonNull(builder.status, "Event status must not be null");
        this.retryCount = builder.retryCount;
        this.processors = builder.processors == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(builder.processors));
        this.errorMessage = builder.errorMessage;
        this.timestamp = builder.timestamp;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.processedAt = builder.processedAt;
        this.version = builder.version;
        this.schemaVersion = builder.schemaVersion;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder pre-populated with all the values of the provided event.
     */
    public static Builder from(final Event event) {
        return builder()
                .id(event.id())
                .sequence(event.sequence())
                .type(event.type())
                .source(event.source())
                .category(event.category())
                .entity(event.entityType(), event.entityId())
                .correlationId(event.correlationId())
                .userId(event.userId())
                .payload(event.payload())
                .metadata(event.metadata())
                .context(event.context())
                .status(event.status())
                .retryCount(event.retryCount())
                .processors(event.processors())
                .errorMessage(event.errorMessage())
                .timestamp(event.timestamp())
                .createdAt(event.createdAt())
                .updatedAt(event.updatedAt())
                .processedAt(event.processedAt())
                .version(event.version())
                .schemaVersion(event.schemaVersion());
    }

    /**
     * Returns a new snapshot where only the processing state has been changed.
     */
    public static Event apply(final Event event, final StatusChange change, final Instant now) {
        final Builder builder = from(event)
                .status(change.status())
                .errorMessage(change.errorMessage())
                .updatedAt(now);

        if (change.processors() != null) {
            builder.processors(change.processors());
        }
        if (change.processedAt() != null) {
            builder.processedAt(change.processedAt());
        }
        if (change.isRetryIncrement()) {
            builder.retryCount(event.retryCount() + 1);
        }
        return builder.build();
    }

    @Override
    public EventCategory category() {
        return category;
    }

    @Override
    public Map<String, Object> context() {
        return context;
    }

    @Override
    public String correlationId() {
        return correlationId;
    }

    @Override
    public Instant createdAt() {
        return createdAt;
    }

    @Override
    public String entityId() {
        return entityId;
    }

    @Override
    public String entityType() {
        return entityType;
    }

    @Override
    public boolean equals(final Object otherObject) {
        if (otherObject instanceof DefaultEvent) {
            final DefaultEvent otherEvent = (DefaultEvent) otherObject;
            return Objects.equals(id, otherEvent.id) && Objects.equals(type, otherEvent.type);
        }
        return false;
    }

    @Override
    public String errorMessage() {
        return errorMessage;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Map<String, Object> metadata() {
        return metadata;
    }

    @Override
    public Map<String, Object> payload() {
        return payload;
    }

    @Override
    public Instant processedAt() {
        return processedAt;
    }

    @Override
    public List<String> processors() {
        return processors;
    }

    @Override
    public int retryCount() {
        return retryCount;
    }

    @Override
    public String schemaVersion() {
        return schemaVersion;
    }

    @Override
    public long sequence() {
        return sequence;
    }

    @Override
    public EventSource source() {
        return source;
    }

    @Override
    public EventStatus status() {
        return status;
    }

    @Override
    public Instant timestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "Event[id=" + id + ", type=" + type + ", stream=" + streamId() + ", status=" + status + "]";
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public Instant updatedAt() {
        return updatedAt;
    }

    @Override
    public String userId() {
        return userId;
    }

    @Override
    public String version() {
        return version;
    }

    private static Map<String, Object> copy(final Map<String, Object> map) {
        if (map == null || map.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
