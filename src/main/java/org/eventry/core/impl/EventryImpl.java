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
import org.eventry.core.EventPage;
import org.eventry.core.EventQuery;
import org.eventry.core.EventStatistics;
import org.eventry.core.EventStore;
import org.eventry.core.EventStream;
import org.eventry.core.EventSubmission;
import org.eventry.core.Eventry;
import org.eventry.core.NotFoundException;
import org.eventry.core.ProcessingResult;
import org.eventry.core.Projection;
import org.eventry.core.ProjectionStore;
import org.eventry.core.ReplayRequest;
import org.eventry.core.ReplayResult;
import org.eventry.core.SignalChannel;
import org.eventry.core.Startable;
import org.eventry.core.Subscription;
import org.eventry.core.SubscriptionStore;
import org.eventry.core.TrackingEvent;
import org.eventry.core.support.Resources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * The implementation of Eventry that "connects" all the various components. This instance should NOT be instantiated directly
 * but rather via the {@link org.eventry.core.EventryBuilder} class.
 */
public class EventryImpl implements Eventry {
    private final SignalChannel channel;
    private final ExecutorService deliveryExecutor;
    private final ExecutorService executorService;
    private final EventStore eventStore;
    private final Ingestion ingestion;
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final SubscriptionMatcher matcher;
    private final int maxRetries;
    private final ProjectionEngine projections;
    private final ProjectionStore projectionStore;
    private final ProcessingQueue queue;
    private final ReplayEngine replay;
    private final int retryBatchSize;
    private final SubscriptionStore subscriptionStore;

    public EventryImpl(
            final EventStore eventStore,
            final SubscriptionStore subscriptionStore,
            final ProjectionStore projectionStore,
            final SignalChannel channel,
            final ExecutorService executorService,
            final ExecutorService deliveryExecutor,
            final Ingestion ingestion,
            final ProcessingQueue queue,
            final SubscriptionMatcher matcher,
            final ProjectionEngine projections,
            final ReplayEngine replay,
            final int maxRetries,
            final int retryBatchSize) {

        this.eventStore = eventStore;
        this.subscriptionStore = subscriptionStore;
        this.projectionStore = projectionStore;
        this.channel = channel;
        this.executorService = executorService;
        this.deliveryExecutor = deliveryExecutor;
        this.ingestion = ingestion;
        this.queue = queue;
        this.matcher = matcher;
        this.projections = projections;
        this.replay = replay;
        this.maxRetries = maxRetries;
        this.retryBatchSize = retryBatchSize;

        queue.addListener(matcher);
        queue.addListener(projections);
    }

    @Override
    public void archive(final String eventId) {
        queue.archive(eventId);
    }

    @Override
    public void close() {
        close(queue);
        shutdown(deliveryExecutor);
        shutdown(executorService);
        close(eventStore);
        close(subscriptionStore);
        close(projectionStore);
        close(channel);
        log.debug("Eventry closed");
    }

    @Override
    public Projection createProjection(final String entityType, final String entityId) {
        return createProjection(Projection.DEFAULT_NAME, entityType, entityId);
    }

    @Override
    public Projection createProjection(final String name, final String entityType, final String entityId) {
        return projections.create(name, entityType, entityId);
    }

    @Override
    public void disableSubscription(final String subscriptionId) {
        matcher.disable(subscriptionId);
    }

    @Override
    public void enableSubscription(final String subscriptionId) {
        matcher.enable(subscriptionId);
    }

    @Override
    public Event event(final String eventId) {
        return eventStore.get(eventId)
                .orElseThrow(() -> new NotFoundException(String.format("Event not found [id=%s]", eventId)));
    }

    @Override
    public String ingest(final EventSubmission submission) {
        return ingestion.ingest(submission);
    }

    @Override
    public String ingestBackend(final BackendMessage message) {
        return ingestion.ingestBackend(message);
    }

    @Override
    public String ingestTracking(final TrackingEvent trackingEvent) {
        return ingestion.ingestTracking(trackingEvent);
    }

    @Override
    public Projection projection(final String projectionId) {
        return projections.get(projectionId);
    }

    @Override
    public EventPage query(final EventQuery query) {
        return eventStore.query(query);
    }

    @Override
    public Projection rebuildProjection(final String projectionId) {
        return projections.rebuild(projectionId);
    }

    @Override
    public ReplayResult replay(final ReplayRequest request) {
        return replay.replay(request);
    }

    @Override
    public List<ProcessingResult> results(final String eventId) {
        return eventStore.results(eventId);
    }

    @Override
    public int retryFailed() {
        return retryFailed(maxRetries, retryBatchSize);
    }

    @Override
    public int retryFailed(final int maxRetries, final int batchSize) {
        return queue.retryFailed(maxRetries, batchSize);
    }

    @Override
    public Eventry start() {
        start(eventStore);
        start(subscriptionStore);
        start(projectionStore);
        start(channel);
        start(matcher);
        start(queue);

        log.debug("Eventry started");
        return this;
    }

    @Override
    public EventStatistics statistics() {
        return statistics(null);
    }

    @Override
    public EventStatistics statistics(final String userId) {
        return eventStore.statistics(userId);
    }

    @Override
    public EventStream stream(final String streamId, final Long fromVersion) {
        final EventStream stream = eventStore.readStream(streamId, fromVersion);
        if (stream.version() == 0) {
            throw new NotFoundException(String.format("Stream not found [streamId=%s]", streamId));
        }
        return stream;
    }

    @Override
    public Subscription subscribe(final Subscription subscription) {
        return matcher.register(subscription);
    }

    @Override
    public List<Subscription> subscriptions() {
        return matcher.subscriptions();
    }

    private void close(final Object closeable) {
        if (closeable instanceof AutoCloseable) {
            Resources.closeSilently((AutoCloseable) closeable);
        }
    }

    private void shutdown(final ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void start(final Object startable) {
        if (startable instanceof Startable) {
            ((Startable<?>) startable).start();
        }
    }
}
