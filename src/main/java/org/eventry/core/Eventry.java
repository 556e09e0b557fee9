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

import java.util.List;

/**
 * The entry point for working with Eventry. The instance is created via the {@link EventryBuilder} class and is used for
 * lifecycle management, ingestion, queries and the administration of subscriptions, projections and replays. Processors
 * register during creation, also via the {@link EventryBuilder} class.
 *
 * @see #ingest(EventSubmission)
 */
public interface Eventry extends Startable<Eventry>, AutoCloseable {
    /**
     * Moves a processed or failed event to the archived status.
     *
     * @throws NotFoundException if the event does not exist.
     * @throws ValidationException if the event is neither processed nor failed.
     */
    void archive(String eventId);

    /**
     * Stops the workers (each finishes the event in hand) and releases all resources.
     */
    @Override
    void close();

    /**
     * Creates a projection with the default name for the stream of the provided entity by replaying the full stream.
     */
    Projection createProjection(String entityType, String entityId);

    Projection createProjection(String name, String entityType, String entityId);

    void disableSubscription(String subscriptionId);

    void enableSubscription(String subscriptionId);

    /**
     * @throws NotFoundException if no event with the id exists.
     */
    Event event(String eventId);

    /**
     * Validates, normalizes and stores the submission and hands it to the processing queue.
     *
     * @return The id of the stored event.
     * @throws ValidationException if the type or the source is missing.
     */
    String ingest(EventSubmission submission);

    /**
     * Ingests a message published by another back-end service.
     */
    String ingestBackend(BackendMessage message);

    /**
     * Ingests a front-end tracking call.
     */
    String ingestTracking(TrackingEvent trackingEvent);

    /**
     * @throws NotFoundException if no projection with the id exists.
     */
    Projection projection(String projectionId);

    EventPage query(EventQuery query);

    Projection rebuildProjection(String projectionId);

    /**
     * Replays the selected events, see {@link ReplayRequest}.
     */
    ReplayResult replay(ReplayRequest request);

    /**
     * The processing results recorded for an event, in the order they were recorded.
     */
    List<ProcessingResult> results(String eventId);

    /**
     * Retries failed events using the configured max retries and batch size.
     *
     * @return The number of events that were reset to pending.
     */
    int retryFailed();

    /**
     * Resets failed events that have been retried fewer than maxRetries times to pending and enqueues them again.
     *
     * @return The number of events that were reset to pending.
     */
    int retryFailed(int maxRetries, int batchSize);

    EventStatistics statistics();

    EventStatistics statistics(String userId);

    /**
     * Reads the events of a stream ({@code entityType:entityId}) in append order.
     *
     * @param fromVersion Only return events after this version, null for the full stream.
     * @throws NotFoundException if the stream has no events.
     */
    EventStream stream(String streamId, Long fromVersion);

    /**
     * Registers a new subscription.
     */
    Subscription subscribe(Subscription subscription);

    List<Subscription> subscriptions();
}
