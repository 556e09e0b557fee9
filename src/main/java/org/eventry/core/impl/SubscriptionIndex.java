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

import org.eventry.core.Subscription;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory index of the subscriptions keyed by event type, so that matching an event only looks at the subscriptions that
 * listen to its type. The index is owned by the {@link SubscriptionMatcher} and updated whenever a subscription changes.
 */
public class SubscriptionIndex {
    private final Map<String, Set<String>> byType = new ConcurrentHashMap<>();
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();

    /**
     * The subscriptions (enabled or not) that list the event type.
     */
    public List<Subscription> candidates(final String eventType) {
        return byType.getOrDefault(eventType, Collections.emptySet()).stream()
                .map(subscriptions::get)
                .filter(subscription -> subscription != null)
                .collect(Collectors.toList());
    }

    public void clear() {
        byType.clear();
        subscriptions.clear();
    }

    /**
     * Adds the subscription or replaces the indexed version with the same id.
     */
    public synchronized void put(final Subscription subscription) {
        remove(subscription.id());
        subscriptions.put(subscription.id(), subscription);
        subscription.eventTypes().forEach(type ->
                byType.computeIfAbsent(type, t -> ConcurrentHashMap.newKeySet()).add(subscription.id()));
    }

    private void remove(final String subscriptionId) {
        final Subscription previous = subscriptions.remove(subscriptionId);
        if (previous != null) {
            previous.eventTypes().forEach(type -> {
                final Set<String> ids = byType.get(type);
                if (ids != null) {
                    ids.remove(subscriptionId);
                }
            });
        }
    }

    public int size() {
        return subscriptions.size();
    }
}
