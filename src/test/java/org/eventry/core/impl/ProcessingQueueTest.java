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

import org.eventry.core.Event;
import org.eventry.core.EventCategory;
import org.eventry.core.EventProcessor;
import org.eventry.core.EventSource;
import org.eventry.core.EventStatus;
import org.eventry.core.InfrastructureException;
import org.eventry.core.NotFoundException;
import org.eventry.core.ProcessingResult;
import org.eventry.core.ProcessingStatus;
import org.eventry.core.ProcessorDefinition;
import org.eventry.core.ProcessorFilter;
import org.eventry.core.SignalType;
import org.eventry.core.StatusChange;
import org.eventry.core.ValidationException;
import org.eventry.core.support.DefaultEvent;
import org.eventry.core.support.InMemoryEventStore;
import org.eventry.test.DirectExecutorService;
import org.eventry.test.RecordingSignalChannel;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

public class ProcessingQueueTest {
    private RecordingSignalChannel channel;
    private InMemoryEventStore eventStore;
    private final List<ProcessingQueue> queues = new ArrayList<>();

    @Test
    public void archiveOnlyAcceptsFinishedEvents() {
        // Given
        final ProcessingQueue queue = queue(List.of());
        final Event processed = append("order.created");
        final Event pending = append("order.created");
        queue.process(processed.id());

        // When
        queue.archive(processed.id());

        // Then
        assertEquals(EventStatus.ARCHIVED, eventStore.get(processed.id()).get().status());
        try {
            queue.archive(pending.id());
            throw new AssertionError("Pending events must not be archived");
        } catch (final ValidationException e) {
            assertEquals(EventStatus.PENDING, eventStore.get(pending.id()).get().status());
        }
    }

    @Test(expected = NotFoundException.class)
    public void archiveUnknownEvent() {
        queue(List.of()).archive("unknown");
    }

    @Test
    public void eventIsOnlyProcessedByTheWorkerThatClaimsIt() {
        // Given
        final AtomicInteger invocations = new AtomicInteger();
        final ProcessingQueue queue = queue(List.of(ProcessorDefinition.of("count", event -> {
            invocations.incrementAndGet();
            return ProcessingStatus.SUCCESS;
        })));
        final Event event = append("order.created");

        // When
        final boolean first = queue.process(event.id());
        final boolean second = queue.process(event.id());

        // Then
        assertTrue(first);
        assertFalse(second);
        assertEquals(1, invocations.get());
    }

    @Test
    public void failingProcessorDoesNotStopTheOthers() {
        // Given
        final ProcessingQueue queue = queue(List.of(
                ProcessorDefinition.of("broken", event -> {
                    throw new IllegalStateException("database down");
                }),
                ProcessorDefinition.of("audit", event -> ProcessingStatus.SUCCESS)));
        final Event event = append("order.created");

        // When
        queue.process(event.id());

        // Then
        final Event failed = eventStore.get(event.id()).get();
        assertEquals(EventStatus.FAILED, failed.status());
        assertEquals(List.of("broken", "audit"), failed.processors());
        assertTrue(failed.errorMessage().contains("database down"));
        assertEquals(0, failed.retryCount());

        final List<ProcessingResult> results = eventStore.results(event.id());
        assertEquals(ProcessingStatus.FAILED, results.get(0).status());
        assertEquals(ProcessingStatus.SUCCESS, results.get(1).status());

        assertEquals(1, channel.signals(SignalType.EVENT_PROCESSED_FAILED).size());
        assertEquals("broken", channel.signals(SignalType.EVENT_PROCESSED_FAILED).get(0).data().get("processor_name"));
    }

    @Test
    public void filtersSelectTheProcessors() {
        // Given
        final ProcessingQueue queue = queue(List.of(
                ProcessorDefinition.of("orders", ProcessorFilter.type("order.created"), event -> ProcessingStatus.SUCCESS),
                ProcessorDefinition.of("devices", ProcessorFilter.source(EventSource.IOT_DEVICE), event -> ProcessingStatus.SUCCESS),
                new ProcessorDefinition("disabled", ProcessorFilter.all(), event -> ProcessingStatus.FAILED, false)));
        final Event event = append("order.created");

        // When
        queue.process(event.id());

        // Then
        final Event processed = eventStore.get(event.id()).get();
        assertEquals(EventStatus.PROCESSED, processed.status());
        assertEquals(List.of("orders"), processed.processors());
        assertNotNull(processed.processedAt());
        assertNotNull(processed.updatedAt());
    }

    @Test
    public void listenersAreOnlyNotifiedOfProcessedEvents() {
        // Given
        final ProcessingQueue queue = queue(List.of(
                ProcessorDefinition.of("picky", ProcessorFilter.type("order.cancelled"), event -> ProcessingStatus.RETRY)));
        final List<String> notified = new CopyOnWriteArrayList<>();
        queue.addListener(event -> notified.add(event.id()));
        final Event ok = append("order.created");
        final Event retry = append("order.cancelled");

        // When
        queue.process(ok.id());
        queue.process(retry.id());

        // Then
        assertEquals(List.of(ok.id()), notified);
        assertEquals(EventStatus.FAILED, eventStore.get(retry.id()).get().status());
        assertEquals("Processor picky returned RETRY", eventStore.get(retry.id()).get().errorMessage());
        assertEquals(1, channel.signals(SignalType.EVENT_PROCESSED_SUCCESS).size());
    }

    @Test
    public void pendingEventsAreRecoveredOnStart() throws Exception {
        // Given
        final CountDownLatch processed = new CountDownLatch(2);
        final ProcessingQueue queue = queue(List.of(ProcessorDefinition.of("audit", event -> ProcessingStatus.SUCCESS)));
        queue.addListener(event -> processed.countDown());
        append("order.created");
        append("order.updated");

        // When
        queue.start();

        // Then
        assertTrue(processed.await(5, TimeUnit.SECONDS));
        assertEquals(2, eventStore.statistics(null).processed());
    }

    @Test
    public void retryFailedIsBoundedByMaxRetries() {
        // Given
        final ProcessingQueue queue = queue(List.of(ProcessorDefinition.of("broken", event -> ProcessingStatus.FAILED)));
        final Event exhausted = append("order.created");
        final Event fresh = append("order.created");
        queue.process(exhausted.id());
        queue.process(fresh.id());
        eventStore.claimAndMark(exhausted.id(), EventStatus.FAILED, StatusChange.to(EventStatus.FAILED).incrementRetry());
        eventStore.claimAndMark(exhausted.id(), EventStatus.FAILED, StatusChange.to(EventStatus.FAILED).incrementRetry());

        // When
        final int retried = queue.retryFailed(2, 100);

        // Then
        assertEquals(1, retried);
        assertEquals(EventStatus.FAILED, eventStore.get(exhausted.id()).get().status());
        assertEquals(EventStatus.PENDING, eventStore.get(fresh.id()).get().status());
        assertEquals(1, eventStore.get(fresh.id()).get().retryCount());
    }

    @Test(expected = ValidationException.class)
    public void retryFailedRejectsEmptyBatches() {
        queue(List.of()).retryFailed(3, 0);
    }

    @Test
    public void retryUntilTheProcessorSucceeds() {
        // Given
        final ProcessingQueue queue = queue(List.of(ProcessorDefinition.of("flaky", flaky(2))));
        final Event event = append("order.created");
        queue.process(event.id());

        // When
        int included = 0;
        for (int round = 0; round < 5; round++) {
            final int retried = queue.retryFailed(3, 100);
            included += retried;
            if (retried > 0) {
                queue.process(event.id());
            }
        }

        // Then
        final Event processed = eventStore.get(event.id()).get();
        assertEquals(2, included);
        assertEquals(EventStatus.PROCESSED, processed.status());
        assertEquals(2, processed.retryCount());
        assertEquals(3, eventStore.results(event.id()).size());
    }

    @Test
    public void retryWithSingleRetryEndsPermanentlyFailed() {
        // Given
        final ProcessingQueue queue = queue(List.of(ProcessorDefinition.of("flaky", flaky(2))));
        final Event event = append("order.created");
        queue.process(event.id());

        // When
        final int first = queue.retryFailed(1, 100);
        queue.process(event.id());
        final int second = queue.retryFailed(1, 100);

        // Then
        assertEquals(1, first);
        assertEquals(0, second);
        final Event failed = eventStore.get(event.id()).get();
        assertEquals(EventStatus.FAILED, failed.status());
        assertEquals(1, failed.retryCount());
    }

    @Test
    public void skippedCountsAsSatisfied() {
        // Given
        final ProcessingQueue queue = queue(List.of(
                ProcessorDefinition.of("skip", event -> ProcessingStatus.SKIPPED),
                ProcessorDefinition.of("implicit", event -> null)));
        final Event event = append("order.created");

        // When
        queue.process(event.id());

        // Then
        assertEquals(EventStatus.PROCESSED, eventStore.get(event.id()).get().status());
        assertEquals(ProcessingStatus.SUCCESS, eventStore.results(event.id()).get(1).status());
    }

    @Test
    public void slowProcessorTimesOut() {
        // Given
        final ProcessingQueue queue = new ProcessingQueue(
                eventStore,
                List.of(ProcessorDefinition.of("slow", event -> {
                    Thread.sleep(5_000);
                    return ProcessingStatus.SUCCESS;
                })),
                new SignalEmitter(channel, new DirectExecutorService()),
                Executors.newSingleThreadExecutor(),
                Executors.newCachedThreadPool(),
                1,
                50,
                100);
        queues.add(queue);
        final Event event = append("order.created");

        // When
        queue.process(event.id());

        // Then
        final Event failed = eventStore.get(event.id()).get();
        assertEquals(EventStatus.FAILED, failed.status());
        assertTrue(failed.errorMessage().contains("timed out"));
    }

    @Test
    public void workersDrainTheQueue() throws Exception {
        // Given
        final int events = 50;
        final CountDownLatch processed = new CountDownLatch(events);
        final ProcessingQueue queue = queue(List.of(ProcessorDefinition.of("audit", event -> ProcessingStatus.SUCCESS)));
        queue.addListener(event -> processed.countDown());
        queue.start();

        // When
        for (int i = 0; i < events; i++) {
            queue.enqueue(append("order.created").id());
        }

        // Then
        assertTrue(processed.await(10, TimeUnit.SECONDS));
        queue.close();
        assertFalse(queue.isRunning());
        assertEquals(events, eventStore.statistics(null).processed());
    }

    @Test
    public void concurrentRetriesRespectTheRetryLimit() {
        // Given
        final AtomicInteger inner = new AtomicInteger(-1);
        final List<ProcessingQueue> holder = new ArrayList<>();
        eventStore = new InMemoryEventStore() {
            @Override
            public synchronized List<Event> retryCandidates(final int maxRetries, final int batchSize) {
                final List<Event> snapshot = super.retryCandidates(maxRetries, batchSize);
                if (inner.get() < 0) {
                    // another retry call acts on the same candidates before this one claims them
                    inner.set(0);
                    inner.set(holder.get(0).retryFailed(maxRetries, batchSize));
                    snapshot.forEach(event -> holder.get(0).process(event.id()));
                }
                return snapshot;
            }
        };
        final ProcessingQueue queue = queue(List.of(ProcessorDefinition.of("broken", event -> ProcessingStatus.FAILED)));
        holder.add(queue);
        final Event event = append("order.created");
        queue.process(event.id());

        // When
        final int retried = queue.retryFailed(1, 100);

        // Then
        assertEquals(1, inner.get());
        assertEquals(0, retried);
        final Event current = eventStore.get(event.id()).get();
        assertEquals(EventStatus.FAILED, current.status());
        assertEquals(1, current.retryCount());
    }

    @Test
    public void storeFailureDuringProcessingLeavesTheEventRetryable() {
        // Given
        final AtomicInteger failures = new AtomicInteger(1);
        eventStore = new InMemoryEventStore() {
            @Override
            public synchronized void record(final ProcessingResult result) {
                if (failures.getAndDecrement() > 0) {
                    throw new InfrastructureException("Database unavailable");
                }
                super.record(result);
            }
        };
        final ProcessingQueue queue = queue(List.of(ProcessorDefinition.of("audit", event -> ProcessingStatus.SUCCESS)));
        final Event event = append("order.created");

        // When
        queue.process(event.id());

        // Then
        final Event failed = eventStore.get(event.id()).get();
        assertEquals(EventStatus.FAILED, failed.status());
        assertTrue(failed.errorMessage().contains("Database unavailable"));

        assertEquals(1, queue.retryFailed(3, 100));
        queue.process(event.id());
        assertEquals(EventStatus.PROCESSED, eventStore.get(event.id()).get().status());
    }

    @Test
    public void staleProcessingEventsAreRecoveredOnStart() throws InterruptedException {
        // Given
        final Event stale = append("order.created");
        eventStore.claimAndMark(stale.id(), EventStatus.PENDING, StatusChange.to(EventStatus.PROCESSING));
        final CountDownLatch latch = new CountDownLatch(1);
        final ProcessingQueue queue = queue(List.of(ProcessorDefinition.of("audit", event -> ProcessingStatus.SUCCESS)));
        queue.addListener(event -> latch.countDown());

        // When
        queue.start();

        // Then
        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals(EventStatus.PROCESSED, eventStore.get(stale.id()).get().status());
    }

    @Before
    public void setUp() {
        eventStore = new InMemoryEventStore();
        channel = new RecordingSignalChannel();
    }

    @After
    public void tearDown() {
        queues.forEach(ProcessingQueue::close);
    }

    private Event append(final String type) {
        return eventStore.append(DefaultEvent.builder()
                .type(type)
                .source(EventSource.BACKEND)
                .category(EventCategory.ORDER)
                .entity("order", "42")
                .build());
    }

    /**
     * Throws on the first failures invocations and succeeds afterwards.
     */
    private EventProcessor flaky(final int failures) {
        final AtomicInteger attempts = new AtomicInteger();
        return event -> {
            if (attempts.incrementAndGet() <= failures) {
                throw new IllegalStateException("Attempt " + attempts.get() + " failed");
            }
            return ProcessingStatus.SUCCESS;
        };
    }

    private ProcessingQueue queue(final List<ProcessorDefinition> processors) {
        final ProcessingQueue queue = new ProcessingQueue(
                eventStore,
                processors,
                new SignalEmitter(channel, new DirectExecutorService()),
                Executors.newFixedThreadPool(3),
                Executors.newCachedThreadPool(),
                3,
                50,
                1000);
        queues.add(queue);
        return queue;
    }
}
