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

import org.eventry.core.Projection;
import org.eventry.core.ProjectionStore;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Non-durable projection store, projections are lost when the application stops.
 */
public class InMemoryProjectionStore implements ProjectionStore {
    private final Map<String, Projection> projections = new ConcurrentHashMap<>();

    @Override
    public List<Projection> forStream(final String entityType, final String entityId) {
        return projections.values().stream()
                .filter(p -> p.entityType().equals(entityType) && p.entityId().equals(entityId))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Projection> get(final String projectionId) {
        return Optional.ofNullable(projections.get(projectionId));
    }

    @Override
    public void save(final Projection projection) {
        projections.put(projection.id(), projection);
    }
}
