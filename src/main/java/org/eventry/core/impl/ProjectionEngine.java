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
import org.eventry.core.EventStream;
import org.eventry.core.NotFoundException;
import org.eventry.core.Projection;
import org.eventry.core.ProjectionStore;
import org.eventry.core.SignalType;
import org.eventry.core.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds projections by folding the events of a stream in stream order. All changes of one projection (create, catch-up and
 * rebuild) are serialized on a lock per projection id, different projections are built in parallel.
 */
public class ProjectionEngine implements ProcessedEventListener {
    private final ProjectionCache cache;
    private final EventStore eventStore;
    private final LockTemplate locks = new LockTemplate();
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final ProjectionStore projectionStore;
    private final SignalEmitter signals;

    public ProjectionEngine(
            final EventStore eventStore,
            final ProjectionStore projectionStore,
            final ProjectionCache cache,
            final SignalEmitter signals) {

        this.eventStore = eventStore;
        this.projectionStore = projectionStore;
        this.cache = cache;
        this.signals = signals;
    }

    /**
     * Applies the events of the stream that were appended after the current version of the projection.
     */
    public Projection catchUp(final String projectionId) {
        return locks.lock(projectionId, () -> {
            final Projection current = get(projectionId);
            final Projection next = fold(current, current.version());
            if (next.version() != current.version()) {
                store(next);
                log.debug("Projection caught up [id={}, version={}]", projectionId, next.version());
            }
            return next;
        });
    }

    /**
     * Creates a new projection for the stream of the provided entity from the full stream.
     */
    public Projection create(final String name, final String entityType, final String entityId) {
        if (EventryHelper.isBlank(entityType) || EventryHelper.isBlank(entityId)) {
            throw new ValidationException("Entity type and entity id are required for a projection");
        }
        final Projection empty = Projection.empty(name, entityType, entityId);

        final Projection projection = locks.lock(empty.id(), () -> {
            final Projection built = fold(empty, 0);
            store(built);
            return built;
        });
        log.info("Projection created [id={}, stream={}, version={}]", projection.id(), projection.streamId(), projection.version());

        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("projection_id", projection.id());
        data.put("projection_name", projection.name());
        data.put("entity_type", entityType);
        data.put("entity_id", entityId);
        data.put("events_count", projection.version());
        data.put("version", projection.version());
        signals.emit(SignalType.PROJECTION_CREATED, data);
        return projection;
    }

    /**
     * Returns the cached projection, or loads it from the projection store.
     *
     * @throws NotFoundException if the projection does not exist.
     */
    public Projection get(final String projectionId) {
        return cache.get(projectionId).orElseGet(() -> {
            final Projection loaded = projectionStore.get(projectionId)
                    .orElseThrow(() -> new NotFoundException(String.format("Projection not found [id=%s]", projectionId)));
            cache.put(loaded);
            return loaded;
        });
    }

    @Override
    public void onProcessed(final Event event) {
        if (event.streamId() == null) {
            return;
        }
        projectionStore.forStream(event.entityType(), event.entityId())
                .forEach(projection -> catchUp(projection.id()));
    }

    /**
     * Discards the current state and replays the full stream from version 0.
     */
    public Projection rebuild(final String projectionId) {
        return locks.lock(projectionId, () -> {
            final Projection current = get(projectionId);
            cache.invalidate(projectionId);

            final Projection rebuilt = fold(current.reset(), 0);
            store(rebuilt);
            log.info("Projection rebuilt [id={}, version={}]", projectionId, rebuilt.version());
            return rebuilt;
        });
    }

    private Projection fold(final Projection projection, final long fromVersion) {
        final EventStream stream = eventStore.readStream(projection.streamId(), fromVersion);
        Projection folded = projection;
        for (final Event event : stream.events()) {
            folded = folded.apply(event);
        }
        return folded;
    }

    private void store(final Projection projection) {
        projectionStore.save(projection);
        cache.put(projection);
    }
}
