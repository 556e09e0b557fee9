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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * A read model derived by folding the events of one stream. The state maps every event type that occurred in the stream to
 * the payload of the latest event of that type.
 *
 * <p>Projections are immutable, {@link #apply(Event)} returns a new projection. Applying is deterministic but only correct
 * if the events are applied in stream order.</p>
 */
public final class Projection {
    public static final String DEFAULT_NAME = "default";

    private final String entityId;
    private final String entityType;
    private final String id;
    private final String lastAppliedEventId;
    private final String name;
    private final Map<String, Object> state;
    private final Instant updatedAt;
    private final long version;

    public Projection(
            final String id,
            final String name,
            final String entityType,
            final String entityId,
            final Map<String, Object> state,
            final long version,
            final String lastAppliedEventId,
            final Instant updatedAt) {

        this.id = requireNonNull(id, "Projection id must not be null");
        this.name = name == null ? DEFAULT_NAME : name;
        this.entityType = requireNonNull(entityType, "Entity type must not be null");
        this.entityId = requireNonNull(entityId, "Entity id must not be null");
        this.state = Collections.unmodifiableMap(new LinkedHashMap<>(state));
        this.version = version;
        this.lastAppliedEventId = lastAppliedEventId;
        this.updatedAt = updatedAt;
    }

    /**
     * An empty projection (version 0) for the stream of the provided entity.
     */
    public static Projection empty(final String name, final String entityType, final String entityId) {
        return new Projection(UUID.randomUUID().toString(), name, entityType, entityId, Collections.emptyMap(), 0, null, Instant.now());
    }

    /**
     * {@code state[event.type] = event.payload; version += 1}.
     */
    public Projection apply(final Event event) {
        final Map<String, Object> next = new LinkedHashMap<>(state);
        next.put(event.type(), event.payload());
        return new Projection(id, name, entityType, entityId, next, version + 1, event.id(), Instant.now());
    }

    public String entityId() {
        return entityId;
    }

    public String entityType() {
        return entityType;
    }

    public String id() {
        return id;
    }

    public String lastAppliedEventId() {
        return lastAppliedEventId;
    }

    public String name() {
        return name;
    }

    /**
     * Two projections have the same content when their stream, state, version and last applied event are equal.
     */
    public boolean sameContent(final Projection other) {
        return other != null
                && entityType.equals(other.entityType)
                && entityId.equals(other.entityId)
                && version == other.version
                && Objects.equals(lastAppliedEventId, other.lastAppliedEventId)
                && state.equals(other.state);
    }

    public Map<String, Object> state() {
        return state;
    }

    public String streamId() {
        return EventStream.streamId(entityType, entityId);
    }

    @Override
    public String toString() {
        return "Projection[id=" + id + ", stream=" + streamId() + ", version=" + version + "]";
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public long version() {
        return version;
    }

    /**
     * Resets the projection to version 0 keeping its identity, used when rebuilding.
     */
    public Projection reset() {
        return new Projection(id, name, entityType, entityId, Collections.emptyMap(), 0, null, Instant.now());
    }
}
