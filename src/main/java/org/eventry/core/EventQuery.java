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

/**
 * Filter and pagination settings for {@link EventStore#query(EventQuery)}. All populated filters must hold (AND). The limit
 * must be within [1, 1000] and the offset must not be negative, invalid values are rejected when the query is built.
 *
 * <pre>
 *     EventQuery query = EventQuery.builder()
 *         .entity("order", "42")
 *         .status(EventStatus.PROCESSED)
 *         .limit(10)
 *         .build();
 * </pre>
 */
public final class EventQuery {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public static final class Builder {
        private EventCategory category;
        private String correlationId;
        private Instant endTime;
        private String entityId;
        private String entityType;
        private int limit = DEFAULT_LIMIT;
        private int offset;
        private EventSource source;
        private Instant startTime;
        private EventStatus status;
        private String type;
        private String userId;

        private Builder() {
            // empty
        }

        public EventQuery build() {
            if (limit < 1 || limit > MAX_LIMIT) {
                throw new ValidationException(String.format("Limit must be between 1 and %d [limit=%d]", MAX_LIMIT, limit));
            }
            if (offset < 0) {
                throw new ValidationException(String.format("Offset must not be negative [offset=%d]", offset));
            }
            if (startTime != null && endTime != null && startTime.isAfter(endTime)) {
                throw new ValidationException("Start time must not be after end time");
            }
            return new EventQuery(this);
        }

        public Builder category(final EventCategory category) {
            this.category = category;
            return this;
        }

        public Builder correlationId(final String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder entity(final String entityType, final String entityId) {
            this.entityType = entityType;
            this.entityId = entityId;
            return this;
        }

        public Builder entityType(final String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder limit(final int limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(final int offset) {
            this.offset = offset;
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

        public Builder timeRange(final Instant startTime, final Instant endTime) {
            this.startTime = startTime;
            this.endTime = endTime;
            return this;
        }

        public Builder type(final String type) {
            this.type = type;
            return this;
        }

        public Builder userId(final String userId) {
            this.userId = userId;
            return this;
        }
    }

    private final EventCategory category;
    private final String correlationId;
    private final Instant endTime;
    private final String entityId;
    private final String entityType;
    private final int limit;
    private final int offset;
    private final EventSource source;
    private final Instant startTime;
    private final EventStatus status;
    private final String type;
    private final String userId;

    private EventQuery(final Builder builder) {
        this.category = builder.category;
        this.correlationId = builder.correlationId;
        this.endTime = builder.endTime;
        this.entityId = builder.entityId;
        this.entityType = builder.entityType;
        this.limit = builder.limit;
        this.offset = builder.offset;
        this.source = builder.source;
        this.startTime = builder.startTime;
        this.status = builder.status;
        this.type = builder.type;
        this.userId = builder.userId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public EventCategory category() {
        return category;
    }

    public String correlationId() {
        return correlationId;
    }

    public Instant endTime() {
        return endTime;
    }

    public String entityId() {
        return entityId;
    }

    public String entityType() {
        return entityType;
    }

    public int limit() {
        return limit;
    }

    /**
     * Checks the filters against a single event, used by stores that filter in memory.
     */
    public boolean matches(final Event event) {
        return (userId == null || userId.equals(event.userId()))
                && (entityType == null || entityType.equals(event.entityType()))
                && (entityId == null || entityId.equals(event.entityId()))
                && (type == null || type.equals(event.type()))
                && (source == null || source == event.source())
                && (category == null || category == event.category())
                && (status == null || status == event.status())
                && (correlationId == null || correlationId.equals(event.correlationId()))
                && (startTime == null || !event.timestamp().isBefore(startTime))
                && (endTime == null || !event.timestamp().isAfter(endTime));
    }

    public int offset() {
        return offset;
    }

    public EventSource source() {
        return source;
    }

    public Instant startTime() {
        return startTime;
    }

    public EventStatus status() {
        return status;
    }

    public String type() {
        return type;
    }

    public String userId() {
        return userId;
    }
}
