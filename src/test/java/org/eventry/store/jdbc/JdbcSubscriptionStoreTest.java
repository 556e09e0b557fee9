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

package org.eventry.store.jdbc;

import org.eventry.core.EventCategory;
import org.eventry.core.EventSource;
import org.eventry.core.Subscription;
import org.eventry.core.support.Resources;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class JdbcSubscriptionStoreTest {
    private JdbcSubscriptionStore store;

    @Test
    public void saveReplacesTheSubscriptionWithTheSameId() {
        // Given
        final Subscription subscription = Subscription.builder()
                .name("orders")
                .eventTypes("order.created", "order.updated")
                .eventSources(EventSource.BACKEND)
                .eventCategories(EventCategory.ORDER, EventCategory.PAYMENT)
                .target("http://localhost/orders")
                .createdAt(Instant.parse("2024-01-01T10:00:00Z"))
                .build();
        store.save(subscription);

        // When
        store.save(subscription.withEnabled(false));

        // Then
        final Subscription loaded = store.get(subscription.id()).get();
        assertEquals(1, store.all().size());
        assertFalse(loaded.isEnabled());
        assertEquals("orders", loaded.name());
        assertEquals(Set.of("order.created", "order.updated"), loaded.eventTypes());
        assertEquals(Set.of(EventSource.BACKEND), loaded.eventSources());
        assertEquals(Set.of(EventCategory.ORDER, EventCategory.PAYMENT), loaded.eventCategories());
        assertEquals("http://localhost/orders", loaded.target());
        assertEquals(subscription.createdAt(), loaded.createdAt());
    }

    @Test
    public void unknownSubscriptionIsEmpty() {
        assertTrue(store.get("unknown").isEmpty());
        assertTrue(store.all().isEmpty());
    }

    @Before
    public void setUp() {
        store = new JdbcSubscriptionStore("jdbc:h2:mem:" + UUID.randomUUID());
        store.start();
    }

    @After
    public void tearDown() {
        Resources.close(store);
    }
}
