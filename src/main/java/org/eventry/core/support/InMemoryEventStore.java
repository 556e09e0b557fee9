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
import org.eventry.core.EventPage;
import org.eventry.core.EventQuery;
import org.eventry.core.EventStatistics;
import org.eventry.core.EventStatus;
import org.eventry.core.EventStore;
import org.eventry.core.EventStream;
import org.eventry.core.InfrastructureException;
import org.eventry.core.ProcessingResult;
import org.eventry.core.StatusChange;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The default non-durable EventStore, this simple implementation keeps the events in memory and uses a single monitor for
 * all operations. Since it is only in-memory events will not be able to survive reboots. This EventStore is mainly used for
 * testing purposes and it is strongly recommended to use a durable store for production scenarios.
 */
public class InMemoryEventStore implements EventStore {
    private static final Comparator<Event> NEWEST_FIRST =
            Comparator.comparing(Event::timestamp).thenComparingLong(Event::sequence).reversed();
    private static final Comparator<Event> OLDEST_FIRST =
            Comparator.comparing(Event::timestamp).thenComparingLong(Event::sequence);

    private final Map<String, Event> events = new HashMap<>();
    private final List<String> journal = new ArrayList<>();
    private final Map<String, List<ProcessingResult>> results = new HashMap<>();
    private long sequence;

    @Override
    public synchronized Event append(final Event event) {
        final String id = event.id() == null ? UUID.randomUUID().toString() : event.id();
        if (events.containsKey(id)) {
            throw new InfrastructureException(String.format("Event already exists [id=%s]", id));
        }

        final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        final Event stored = DefaultEvent.from(event)
                .id(id)
                .sequence(++sequence)
                .timestamp(event.timestamp() == null ? now : event.timestamp().truncatedTo(ChronoUnit.MILLIS))
                .createdAt(now)
                .updatedAt(now)
                .build();

        events.put(id, stored);
        journal.add(id);
        return stored;
    }

    @Override
    public synchronized boolean claimAndMark(final String eventId, final EventStatus expectedStatus, final StatusChange change) {
        final Event current = events.get(eventId);
        if (current == null || current.status() != expectedStatus || !change.permitsRetryCount(current.retryCount())) {
            return false;
        }
        events.put(eventId, DefaultEvent.apply(current, change, Instant.now().truncatedTo(ChronoUnit.MILLIS)));
        return true;
    }

    @Override
    public synchronized Optional<Event> get(final String eventId) {
        return Optional.ofNullable(events.get(eventId));
    }

    @Override
    public synchronized EventPage query(final EventQuery query) {
        final List<Event> matching = all()
                .filter(query::matches)
                .sorted(NEWEST_FIRST)
                .collect(Collectors.toList());

        final List<Event> page = matching.stream()
                .skip(query.offset())
                .limit(query.limit())
                .collect(Collectors.toList());

        return new EventPage(page, matching.size(), query.limit(), query.offset());
    }

    @Override
    public synchronized List<Event> range(final Instant start, final Instant end) {
        return all()
                .filter(e -> !e.timestamp().isBefore(start) && !e.timestamp().isAfter(end))
                .sorted(OLDEST_FIRST)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized EventStream readStream(final String streamId, final Long fromVersion) {
        EventStream.parse(streamId);
        final List<Event> stream = all()
                .filter(e -> streamId.equals(e.streamId()))
                .collect(Collectors.toList());

        final long skip = fromVersion == null ? 0 : Math.max(0, fromVersion);
        return new EventStream(
                streamId,
                stream.stream().skip(skip).collect(Collectors.toList()),
                stream.size());
    }

    @Override
    public synchronized void record(final ProcessingResult result) {
        results.computeIfAbsent(result.eventId(), id -> new ArrayList<>()).add(result);
    }

    @Override
    public synchronized List<ProcessingResult> results(final String eventId) {
        return new ArrayList<>(results.getOrDefault(eventId, List.of()));
    }

    @Override
    public synchronized List<Event> retryCandidates(final int maxRetries, final int batchSize) {
        return all()
                .filter(e -> e.status() == EventStatus.FAILED && e.retryCount() < maxRetries)
                .limit(batchSize)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized EventStatistics statistics(final String userId) {
        final List<Event> selected = all()
                .filter(e -> userId == null || userId.equals(e.userId()))
                .collect(Collectors.toList());

        return new EventStatistics(
                selected.size(),
                count(selected, EventStatus.PENDING),
                count(selected, EventStatus.PROCESSING),
                count(selected, EventStatus.PROCESSED),
                count(selected, EventStatus.FAILED),
                groupBy(selected, e -> e.source().value()),
                groupBy(selected, e -> e.category().value()),
                groupBy(selected, Event::type));
    }

    @Override
    public synchronized List<Event> unprocessed(final int limit) {
        return all()
                .filter(e -> e.status() == EventStatus.PENDING || e.status() == EventStatus.PROCESSING)
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * All events in append order.
     */
    private Stream<Event> all() {
        return journal.stream().map(events::get);
    }

    private long count(final List<Event> selected, final EventStatus status) {
        return selected.stream().filter(e -> e.status() == status).count();
    }

    private Map<String, Long> groupBy(final List<Event> selected, final Function<Event, String> key) {
        return selected.stream().collect(Collectors.groupingBy(key, LinkedHashMap::new, Collectors.counting()));
    }
}
