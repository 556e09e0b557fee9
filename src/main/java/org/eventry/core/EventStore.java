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
import java.util.Optional;

/**
 * An event store is responsible for storing events in the order they are appended and later be able to replay the events that
 * occurred, per entity stream or by time. The event store is similar to an append-only journal: the content of an event is
 * never changed after append, only its processing state moves forward via {@link #claimAndMark(String, EventStatus,
 * StatusChange)}.
 *
 * <p>Implementations must be safe for concurrent use, the event store is shared by ingestion, the processing workers and the
 * administrative operations.</p>
 */
public interface EventStore {
    /**
     * Append a new event to the end of the event store. The store assigns the insertion sequence and, if the event carries no
     * id, a new unique id.
     *
     * @return The stored snapshot of the event.
     * @throws InfrastructureException if the event could not be stored, for instance if the id is already taken.
     */
    Event append(Event event);

    /**
     * Atomically moves the event from the expected status to the status of the change. Only one of several concurrent callers
     * can win the transition, the others get false back.
     *
     * @return true if the transition was applied, false if the event does not exist or is not in the expected status.
     */
    boolean claimAndMark(String eventId, EventStatus expectedStatus, StatusChange change);

    Optional<Event> get(String eventId);

    /**
     * Finds the events matching all the filters of the query, newest first (by timestamp, then by sequence).
     */
    EventPage query(EventQuery query);

    /**
     * All events whose timestamp is within [start, end] in ascending timestamp order, events sharing a timestamp are ordered by
     * their insertion sequence.
     */
    List<Event> range(Instant start, Instant end);

    /**
     * Reads a stream in append order. If a version is provided only the events after that version are returned, example: if
     * the stream contains {"a", "b", "c"} and version 1 is requested the result contains {"b", "c"}. The version of the
     * returned stream is always the total number of events in the stream.
     */
    EventStream readStream(String streamId, Long fromVersion);

    /**
     * Records the outcome of a processor.
     */
    void record(ProcessingResult result);

    /**
     * The recorded processing results of an event in the order they were recorded.
     */
    List<ProcessingResult> results(String eventId);

    /**
     * Failed events that have been retried fewer than maxRetries times, oldest first.
     */
    List<Event> retryCandidates(int maxRetries, int batchSize);

    /**
     * Statistics over all events, or over the events of one user if a user id is provided.
     */
    EventStatistics statistics(String userId);

    /**
     * Events that have not completed processing (pending, or processing when the previous run stopped), oldest first.
     */
    List<Event> unprocessed(int limit);
}
