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

package org.eventry.core.store;

import org.eventry.core.Event;
import org.eventry.core.EventCategory;
import org.eventry.core.EventPage;
import org.eventry.core.EventQuery;
import org.eventry.core.EventSource;
import org.eventry.core.EventStatistics;
import org.eventry.core.EventStatus;
import org.eventry.core.EventStore;
import org.eventry.core.EventStream;
import org.eventry.core.InfrastructureException;
import org.eventry.core.ProcessingResult;
import org.eventry.core.ProcessingStatus;
import org.eventry.core.StatusChange;
import org.eventry.core.ValidationException;
import org.eventry.core.support.DefaultEvent;
import org.eventry.core.support.Resources;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

/**
 * Test case for event stores, this can be used as base for all types of event stores.
 */
public abstract class AbstractEventStoreTest {
    private static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");

    private EventStore eventStore;

    @Test
    public void appendAssignsUniqueIdsAndIncreasingSequence() {
        // When
        final Event first = eventStore.append(createEvent("order.created", "order", "1", T0));
        final Event second = eventStore.append(createEvent("order.created", "order", "1", T0));

        // Then
        assertNotNull(first.id());
        assertFalse(first.id().equals(second.id()));
        assertTrue(second.sequence() > first.sequence());
        assertEquals(EventStatus.PENDING, first.status());
        assertNotNull(first.createdAt());
        assertEquals(first, eventStore.get(first.id()).get());
    }

    @Test
    public void appendTruncatesTimestampsToMillis() {
        // Given
        final Instant precise = T0.plusNanos(123_456_789);

        // When
        final Event appended = eventStore.append(createEvent("order.created", "order", "1", precise));

        // Then
        assertEquals(T0.plusMillis(123), appended.timestamp());
        assertEquals(appended.timestamp(), eventStore.get(appended.id()).get().timestamp());
        assertEquals(0, appended.createdAt().getNano() % 1_000_000);
    }

    @Test(expected = InfrastructureException.class)
    public void appendRejectsDuplicateIds() {
        // Given
        eventStore.append(DefaultEvent.from(createEvent("a", "order", "1", T0)).id("fixed").build());

        // When
        eventStore.append(DefaultEvent.from(createEvent("b", "order", "2", T0)).id("fixed").build());
    }

    @Test
    public void claimAndMarkIsWonByExactlyOneCaller() throws Exception {
        // Given
        final Event event = eventStore.append(createEvent("order.created", "order", "1", T0));
        final int contenders = 8;
        final CountDownLatch go = new CountDownLatch(1);
        final ExecutorService executorService = Executors.newFixedThreadPool(contenders);

        // When
        final Callable<Boolean> claim = () -> {
            go.await();
            return eventStore.claimAndMark(event.id(), EventStatus.PENDING, StatusChange.to(EventStatus.PROCESSING));
        };
        final List<Future<Boolean>> futures = new ArrayList<>();
        for (int i = 0; i < contenders; i++) {
            futures.add(executorService.submit(claim));
        }
        go.countDown();

        int winners = 0;
        for (final Future<Boolean> future : futures) {
            if (future.get()) {
                winners++;
            }
        }
        executorService.shutdown();

        // Then
        assertEquals(1, winners);
        assertEquals(EventStatus.PROCESSING, eventStore.get(event.id()).get().status());
    }

    @Test
    public void claimAndMarkFailsWhenStatusDiffers() {
        // Given
        final Event event = eventStore.append(createEvent("order.created", "order", "1", T0));

        // When
        final boolean claimed = eventStore.claimAndMark(event.id(), EventStatus.FAILED, StatusChange.to(EventStatus.PENDING));

        // Then
        assertFalse(claimed);
        assertFalse(eventStore.claimAndMark("unknown", EventStatus.PENDING, StatusChange.to(EventStatus.PROCESSING)));
        assertEquals(EventStatus.PENDING, eventStore.get(event.id()).get().status());
    }

    @Test
    public void emptyStreamHasVersionZero() {
        // When
        final EventStream stream = eventStore.readStream("order:unknown", null);

        // Then
        assertEquals(0, stream.version());
        assertTrue(stream.events().isEmpty());
    }

    @Test
    public void processingResultsAreKeptInRecordingOrder() {
        // Given
        final Event event = eventStore.append(createEvent("order.created", "order", "1", T0));

        // When
        eventStore.record(new ProcessingResult(event.id(), "audit", ProcessingStatus.SUCCESS, 3, null, T0));
        eventStore.record(new ProcessingResult(event.id(), "billing", ProcessingStatus.FAILED, 5, "boom", T0));

        // Then
        final List<ProcessingResult> results = eventStore.results(event.id());
        assertEquals(2, results.size());
        assertEquals("audit", results.get(0).processorName());
        assertEquals(ProcessingStatus.FAILED, results.get(1).status());
        assertEquals("boom", results.get(1).message());
        assertTrue(eventStore.results("unknown").isEmpty());
    }

    @Test
    public void queryCombinesFiltersAndPagesNewestFirst() {
        // Given
        for (int i = 0; i < 5; i++) {
            eventStore.append(createEvent("order.created", "order", "42", T0.plusSeconds(i)));
        }
        eventStore.append(createEvent("order.created", "order", "7", T0));
        eventStore.append(createEvent("user.created", "user", "42", T0));

        // When
        final EventPage page = eventStore.query(EventQuery.builder()
                .entity("order", "42")
                .limit(2)
                .offset(1)
                .build());

        // Then
        assertEquals(5, page.total());
        assertEquals(2, page.items().size());
        assertTrue(page.hasMore());
        assertEquals(T0.plusSeconds(3), page.items().get(0).timestamp());
        assertEquals(T0.plusSeconds(2), page.items().get(1).timestamp());
    }

    @Test
    public void queryByTimeRangeIncludesBounds() {
        // Given
        eventStore.append(createEvent("a", "order", "1", T0));
        eventStore.append(createEvent("b", "order", "1", T0.plusSeconds(10)));
        eventStore.append(createEvent("c", "order", "1", T0.plusSeconds(20)));

        // When
        final EventPage page = eventStore.query(EventQuery.builder()
                .timeRange(T0, T0.plusSeconds(10))
                .build());

        // Then
        assertEquals(2, page.total());
        assertFalse(page.hasMore());
        assertEquals(List.of("b", "a"), page.items().stream().map(Event::type).collect(Collectors.toList()));
    }

    @Test
    public void queryByStatusAndSource() {
        // Given
        final Event processed = eventStore.append(createEvent("order.created", "order", "1", T0));
        eventStore.append(createEvent("order.created", "order", "2", T0));
        eventStore.claimAndMark(processed.id(), EventStatus.PENDING, StatusChange.to(EventStatus.PROCESSED));

        // When
        final EventPage page = eventStore.query(EventQuery.builder()
                .status(EventStatus.PROCESSED)
                .source(EventSource.BACKEND)
                .build());

        // Then
        assertEquals(1, page.total());
        assertEquals(processed.id(), page.items().get(0).id());
    }

    @Test
    public void rangeOrdersByTimestampThenInsertionOrder() {
        // Given
        final Event late = eventStore.append(createEvent("late", "order", "1", T0.plusSeconds(5)));
        final Event tie1 = eventStore.append(createEvent("tie1", "order", "2", T0));
        final Event tie2 = eventStore.append(createEvent("tie2", "order", "3", T0));
        eventStore.append(createEvent("outside", "order", "4", T0.plusSeconds(60)));

        // When
        final List<Event> range = eventStore.range(T0, T0.plusSeconds(5));

        // Then
        assertEquals(List.of(tie1.id(), tie2.id(), late.id()), range.stream().map(Event::id).collect(Collectors.toList()));
    }

    @Test
    public void readStreamWithVersionCursor() {
        // Given
        final List<String> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            ids.add(eventStore.append(createEvent("user.step" + i, "user", "7", T0.plusSeconds(5 - i))).id());
            eventStore.append(createEvent("noise", "user", "8", T0));
        }

        // When
        final EventStream full = eventStore.readStream("user:7", null);
        final EventStream suffix = eventStore.readStream("user:7", 2L);

        // Then
        assertEquals(5, full.version());
        assertEquals(ids, full.events().stream().map(Event::id).collect(Collectors.toList()));
        assertEquals(5, suffix.version());
        assertEquals(ids.subList(2, 5), suffix.events().stream().map(Event::id).collect(Collectors.toList()));
    }

    @Test(expected = ValidationException.class)
    public void readStreamRejectsMalformedStreamId() {
        eventStore.readStream("no-separator", null);
    }

    @Test
    public void retryCandidatesExcludeEventsThatReachedMaxRetries() {
        // Given
        final Event fresh = eventStore.append(createEvent("a", "order", "1", T0));
        final Event retried = eventStore.append(createEvent("b", "order", "2", T0));
        fail(fresh);
        fail(retried);
        eventStore.claimAndMark(retried.id(), EventStatus.FAILED, StatusChange.to(EventStatus.PENDING).incrementRetry());
        fail(retried);

        // When
        final List<Event> candidates = eventStore.retryCandidates(1, 100);

        // Then
        assertEquals(List.of(fresh.id()), candidates.stream().map(Event::id).collect(Collectors.toList()));
        assertEquals(1, eventStore.get(retried.id()).get().retryCount());
        assertEquals(2, eventStore.retryCandidates(2, 100).size());
        assertEquals(1, eventStore.retryCandidates(2, 1).size());
    }

    @Test
    public void statisticsCountByStatusAndGroup() {
        // Given
        final Event processed = eventStore.append(createEvent("order.created", "order", "1", T0, "u1"));
        final Event failed = eventStore.append(createEvent("order.created", "order", "2", T0, "u1"));
        eventStore.append(createEvent("user.created", "user", "3", T0, "u2"));
        eventStore.claimAndMark(processed.id(), EventStatus.PENDING, StatusChange.to(EventStatus.PROCESSED));
        fail(failed);

        // When
        final EventStatistics all = eventStore.statistics(null);
        final EventStatistics user = eventStore.statistics("u1");

        // Then
        assertEquals(3, all.total());
        assertEquals(1, all.pending());
        assertEquals(1, all.processed());
        assertEquals(1, all.failed());
        assertEquals(Long.valueOf(2), all.byType().get("order.created"));
        assertEquals(Long.valueOf(3), all.bySource().get("backend"));
        assertEquals(2, user.total());
        assertEquals(0, user.pending());
        assertEquals(50.0, user.errorRate(), 0.0001);
    }

    @Test
    public void statusTransitionsNeverChangeTheEventContent() {
        // Given
        final Event stored = eventStore.append(createEvent("order.created", "order", "1", T0));

        // When
        eventStore.claimAndMark(stored.id(), EventStatus.PENDING, StatusChange.to(EventStatus.PROCESSING));
        eventStore.claimAndMark(stored.id(), EventStatus.PROCESSING,
                StatusChange.to(EventStatus.FAILED).processors(List.of("audit")).errorMessage("boom"));
        eventStore.claimAndMark(stored.id(), EventStatus.FAILED,
                StatusChange.to(EventStatus.PENDING).errorMessage("boom").incrementRetry());
        eventStore.claimAndMark(stored.id(), EventStatus.PENDING, StatusChange.to(EventStatus.PROCESSING));
        eventStore.claimAndMark(stored.id(), EventStatus.PROCESSING,
                StatusChange.to(EventStatus.PROCESSED).processors(List.of("audit")).processedAt(T0));

        // Then
        final Event current = eventStore.get(stored.id()).get();
        assertEquals(EventStatus.PROCESSED, current.status());
        assertEquals(1, current.retryCount());
        assertEquals(List.of("audit"), current.processors());
        assertEquals(T0, current.processedAt());
        assertEquals(stored.payload(), current.payload());
        assertEquals(stored.type(), current.type());
        assertEquals(stored.source(), current.source());
        assertEquals(stored.category(), current.category());
        assertEquals(stored.createdAt(), current.createdAt());
    }

    @Test
    public void unprocessedReturnsPendingAndProcessingEventsOldestFirst() {
        // Given
        final Event first = eventStore.append(createEvent("a", "order", "1", T0));
        final Event claimed = eventStore.append(createEvent("b", "order", "2", T0));
        final Event done = eventStore.append(createEvent("c", "order", "3", T0));
        final Event last = eventStore.append(createEvent("d", "order", "4", T0));
        eventStore.claimAndMark(claimed.id(), EventStatus.PENDING, StatusChange.to(EventStatus.PROCESSING));
        eventStore.claimAndMark(done.id(), EventStatus.PENDING, StatusChange.to(EventStatus.PROCESSED));

        // When
        final List<Event> unprocessed = eventStore.unprocessed(10);

        // Then
        assertEquals(List.of(first.id(), claimed.id(), last.id()),
                unprocessed.stream().map(Event::id).collect(Collectors.toList()));
    }

    @Test
    public void retryClaimIsRejectedAtTheRetryLimit() {
        // Given
        final Event event = eventStore.append(createEvent("a", "order", "1", T0));
        fail(event);
        final StatusChange retry = StatusChange.to(EventStatus.PENDING).incrementRetry(1);

        // When
        final boolean first = eventStore.claimAndMark(event.id(), EventStatus.FAILED, retry);
        eventStore.claimAndMark(event.id(), EventStatus.PENDING, StatusChange.to(EventStatus.FAILED));
        final boolean second = eventStore.claimAndMark(event.id(), EventStatus.FAILED, retry);

        // Then
        assertTrue(first);
        assertFalse(second);
        final Event current = eventStore.get(event.id()).get();
        assertEquals(EventStatus.FAILED, current.status());
        assertEquals(1, current.retryCount());
    }

    @Test
    public void manyAppendsKeepIdsUnique() {
        // When
        final Set<String> ids = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            ids.add(eventStore.append(createEvent("bulk", "order", Integer.toString(i % 10), T0)).id());
        }

        // Then
        assertEquals(200, ids.size());
    }

    @Before
    public void setUp() throws Exception {
        eventStore = createEventStore();
    }

    @After
    public void tearDown() {
        if (eventStore instanceof AutoCloseable) {
            Resources.close((AutoCloseable) eventStore);
        }
    }

    protected Event createEvent(final String type, final String entityType, final String entityId, final Instant timestamp) {
        return createEvent(type, entityType, entityId, timestamp, null);
    }

    protected Event createEvent(
            final String type, final String entityType, final String entityId, final Instant timestamp, final String userId) {

        return DefaultEvent.builder()
                .type(type)
                .source(EventSource.BACKEND)
                .category(EventCategory.ORDER)
                .entity(entityType, entityId)
                .userId(userId)
                .payload(Map.of("entity", entityId))
                .timestamp(timestamp)
                .build();
    }

    protected abstract EventStore createEventStore() throws Exception;

    protected EventStore eventStore() {
        return eventStore;
    }

    private void fail(final Event event) {
        eventStore.claimAndMark(event.id(), EventStatus.PENDING, StatusChange.to(EventStatus.PROCESSING));
        eventStore.claimAndMark(event.id(), EventStatus.PROCESSING, StatusChange.to(EventStatus.FAILED).errorMessage("boom"));
    }
}
