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

import org.eventry.core.Projection;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache of the latest built version of every projection, owned by the {@link ProjectionEngine}. Entries are replaced whenever
 * a projection changes and invalidated when it is rebuilt.
 */
public class ProjectionCache {
    private final Map<String, Projection> projections = new ConcurrentHashMap<>();

    public Optional<Projection> get(final String projectionId) {
        return Optional.ofNullable(projections.get(projectionId));
    }

    public void invalidate(final String projectionId) {
        projections.remove(projectionId);
    }

    public void put(final Projection projection) {
        projections.put(projection.id(), projection);
    }
}
