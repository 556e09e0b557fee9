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

package org.eventry.core.impl;

import org.eventry.core.BackendMessage;
import org.eventry.core.Event;
import org.eventry.core.EventCategory;
import org.eventry.core.EventSource;
import org.eventry.core.EventStore;
import org.eventry.core.EventSubmission;
import org.eventry.core.SignalType;
import org.eventry.core.TrackingEvent;
import org.eventry.core.ValidationException;
import org.eventry.core.support.DefaultEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.eventry.core.Event.STREAM_SEPARATOR;
import static org.eventry.core.impl.EventryHelper.isBlank;
import static org.eventry.core.impl.EventryHelper.parseTimestamp;
import static org.eventry.core.impl.EventryHelper.signalData;

/**
 * Validates and normalizes incoming events, stores them and hands them over to the processing queue. Nothing is stored when
 * validation fails.
 */
public class Ingestion {
    private static final String PAGE = "page";

    private final CategoryRules categoryRules;
    private final EventStore eventStore;
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final ProcessingQueue queue;
    private final SignalEmitter signals;

    public Ingestion(
            final EventStore eventStore,
            final CategoryRules categoryRules,
            final ProcessingQueue queue,
            final SignalEmitter signals) {

        this.eventStore = eventStore;
        this.categoryRules = categoryRules;
        this.queue = queue;
        this.signals = signals;
    }

    public String ingest(final EventSubmission submission) {
        validate(submission);

        final EventCategory category = submission.category() != null
                ? submission.category()
                : categoryRules.classify(submission.source(), submission.type());

        final DefaultEvent.Builder event = DefaultEvent.builder()
                .type(submission.type())
                .source(submission.source())
                .category(category)
                .correlationId(submission.correlationId())
                .userId(submission.userId())
                .payload(submission.payload())
                .metadata(submission.metadata())
                .context(submission.context())
                .timestamp(submission.timestamp());

        if (!isBlank(submission.entityType())) {
            event.entity(submission.entityType(), submission.entityId());
        }
        return store(event.build());
    }

    /**
     * Ingests a message from another back-end service. The user id is taken from {@code data.user_id}.
     */
    public String ingestBackend(final BackendMessage message) {
        if (isBlank(message.type())) {
            throw new ValidationException("Backend message type is required");
        }

        final Map<String, Object> data = message.data() == null ? new LinkedHashMap<>() : message.data();
        final Object userId = data.get("user_id");

        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source_service", message.source());
        metadata.put("event_id", message.id());
        metadata.put("version", message.version());

        final Map<String, Object> context = new LinkedHashMap<>();
        context.put("subject", message.subject());
        context.put("correlation_id", message.correlationId());

        return ingest(EventSubmission.of(message.type(), EventSource.BACKEND)
                .userId(userId == null ? null : userId.toString())
                .correlationId(message.correlationId())
                .payload(data)
                .metadata(metadata)
                .context(context)
                .timestamp(parseTimestamp(message.timestamp())));
    }

    /**
     * Ingests a front-end tracking call. Page calls without an event name are stored with the type {@code page}, anonymous
     * visitors are identified by their anonymous id.
     */
    public String ingestTracking(final TrackingEvent tracking) {
        final String type = isBlank(tracking.event()) ? tracking.type() : tracking.event();
        if (isBlank(type)) {
            throw new ValidationException("Tracking event name or type is required");
        }

        final Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("properties", tracking.properties() == null ? new LinkedHashMap<>() : tracking.properties());
        payload.put("type", tracking.type());

        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("anonymous_id", tracking.anonymousId());
        metadata.put("sent_at", tracking.sentAt());
        metadata.put("received_at", tracking.receivedAt());
        metadata.put("original_timestamp", tracking.originalTimestamp());

        final EventSubmission submission = EventSubmission.of(type, EventSource.FRONTEND)
                .userId(isBlank(tracking.userId()) ? tracking.anonymousId() : tracking.userId())
                .payload(payload)
                .metadata(metadata)
                .context(tracking.context())
                .timestamp(parseTimestamp(tracking.timestamp()));

        if (PAGE.equals(tracking.type())) {
            submission.category(categoryRules.classify(EventSource.FRONTEND, PAGE));
        }
        return ingest(submission);
    }

    private String store(final Event event) {
        final Event stored = eventStore.append(event);
        log.debug("Event stored [id={}, type={}, stream={}]", stored.id(), stored.type(), stored.streamId());

        queue.enqueue(stored.id());
        signals.emit(SignalType.EVENT_STORED, signalData(stored));
        return stored.id();
    }

    private void validate(final EventSubmission submission) {
        if (isBlank(submission.type())) {
            throw new ValidationException("Event type is required");
        }
        if (submission.source() == null) {
            throw new ValidationException("Event source is required");
        }
        if (isBlank(submission.entityType()) != isBlank(submission.entityId())) {
            throw new ValidationException("Entity type and entity id must be provided together");
        }
        if (submission.entityType() != null && submission.entityType().contains(STREAM_SEPARATOR)) {
            throw new ValidationException(
                    String.format("Entity type must not contain '%s' [entityType=%s]", STREAM_SEPARATOR, submission.entityType()));
        }
    }
}
