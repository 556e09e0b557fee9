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
import org.eventry.core.EventStore;
import org.eventry.core.InfrastructureException;
import org.eventry.core.ReplayRequest;
import org.eventry.core.ReplayResult;
import org.eventry.core.SignalType;
import org.eventry.core.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * Re-drives stored events to a target. The order of the replay follows the selector: id lists are replayed in the order of
 * the list (unknown ids are skipped), streams in append order and time ranges by ascending timestamp with the insertion
 * sequence as tie-break. Replays never change the status of an event.
 */
public class ReplayEngine {
    private final EventStore eventStore;
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final SubscriptionMatcher matcher;
    private final SignalEmitter signals;

    public ReplayEngine(final EventStore eventStore, final SubscriptionMatcher matcher, final SignalEmitter signals) {
        this.eventStore = eventStore;
        this.matcher = matcher;
        this.signals = signals;
    }

    public ReplayResult replay(final ReplayRequest request) {
        final List<Event> events = resolve(request);
        final List<String> ids = events.stream().map(Event::id).collect(Collectors.toList());

        if (request.isDryRun()) {
            log.info("Replay dry run [selector={}, events={}]", request.selectorType(), ids.size());
            return ReplayResult.preview(ids);
        }

        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("events_count", ids.size());
        data.put("selector", request.selectorType().name());
        data.put("stream_id", request.streamId());
        data.put("target", request.target());
        data.put("dry_run", false);
        signals.emit(SignalType.REPLAY_STARTED, data);

        int replayed = 0;
        int failed = 0;
        for (final Event event : events) {
            if (redeliver(event, request.target())) {
                replayed++;
            } else {
                failed++;
            }
        }

        log.info("Replay completed [selector={}, replayed={}, failed={}]", request.selectorType(), replayed, failed);
        return ReplayResult.completed(ids, replayed, failed);
    }

    private boolean redeliver(final Event event, final String target) {
        final List<CompletableFuture<Void>> deliveries = new ArrayList<>();
        if (target != null) {
            deliveries.add(matcher.send(event, target));
        } else {
            for (final Subscription subscription : matcher.matching(event)) {
                deliveries.add(matcher.send(event, subscription.target()));
            }
        }

        boolean delivered = true;
        for (final CompletableFuture<Void> delivery : deliveries) {
            try {
                delivery.get();
            } catch (final ExecutionException e) {
                log.warn("Replay delivery failed [eventId={}]", event.id(), e.getCause());
                delivered = false;
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InfrastructureException("Replay interrupted", e);
            }
        }
        return delivered;
    }

    private List<Event> resolve(final ReplayRequest request) {
        switch (request.selectorType()) {
            case EVENT_IDS:
                final List<Event> events = new ArrayList<>();
                for (final String eventId : request.eventIds()) {
                    eventStore.get(eventId).ifPresentOrElse(
                            events::add,
                            () -> log.debug("Replay skips unknown event [id={}]", eventId));
                }
                return events;
            case STREAM:
                return eventStore.readStream(request.streamId(), null).events();
            case TIME_RANGE:
                return eventStore.range(request.startTime(), request.endTime());
        }
        throw new IllegalStateException("Unknown selector " + request.selectorType());
    }
}
