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
import java.util.List;
import java.util.Map;

/**
 * Events are immutable records of something that happened. An event carries a generated id, a type, the origin of the event,
 * an opaque payload and its processing state. The classifying and content parts of an event never change once it has been
 * appended to the {@link EventStore}, only the processing state (status, processors, error message, retry count, processed
 * and updated time) moves forward and every change results in a new snapshot.
 *
 * <p>The entity type and entity id define the stream the event belongs to, see {@link #streamId()}.</p>
 */
public interface Event {
    /**
     * The stream id separator, streams are identified by {@code entityType:entityId}.
     */
    String STREAM_SEPARATOR = ":";

    /**
     * A generated unique id (UUID) to identify the event.
     */
    String id();

    /**
     * Insertion sequence assigned by the event store, strictly increasing in append order. Zero for events that have not
     * been appended yet.
     */
    long sequence();

    /**
     * The event type is used to semantically describe an event, it is also used to route the event to processors and
     * subscriptions.
     */
    String type();

    EventSource source();

    EventCategory category();

    String entityType();

    String entityId();

    /**
     * The id of the stream the event belongs to or null if the event is not bound to an entity.
     */
    default String streamId() {
        if (entityType() == null || entityId() == null) {
            return null;
        }
        return entityType() + STREAM_SEPARATOR + entityId();
    }

    String correlationId();

    String userId();

    Map<String, Object> payload();

    Map<String, Object> metadata();

    Map<String, Object> context();

    EventStatus status();

    /**
     * Number of retries that have been performed for this event.
     */
    int retryCount();

    /**
     * Names of the processors that ran for this event, in the order they ran.
     */
    List<String> processors();

    String errorMessage();

    /**
     * When the event occurred, supplied by the submitter or the time of ingestion.
     */
    Instant timestamp();

    Instant createdAt();

    Instant updatedAt();

    Instant processedAt();

    String version();

    String schemaVersion();
}
