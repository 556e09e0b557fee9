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

import org.eventry.core.DeliveryException;
import org.eventry.core.Event;
import org.eventry.core.EventCategory;
import org.eventry.core.EventSource;
import org.eventry.core.NotFoundException;
import org.eventry.core.SignalType;
import org.eventry.core.Subscription;
import org.eventry.core.support.DefaultEvent;
import org.eventry.core.support.InMemorySubscriptionStore;
import org.eventry.test.DirectExecutorService;
import org.eventry.test.RecordingDelivery;
import org.eventry.test.RecordingSignalChannel;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SubscriptionMatcherTest {
    private RecordingSignalChannel channel;
    private RecordingDelivery delivery;
    private SubscriptionMatcher matcher;
    private InMemorySubscriptionStore store;

    @Test
    public void disabledSubscriptionsAreSkippedUntilEnabled() {
        // Given
        final Subscription subscription = matcher.register(subscription("orders", "order.created"));

        // When
        matcher.disable(subscription.id());

        // Then
        assertTrue(matcher.matching(event("order.created")).isEmpty());
        assertFalse(store.get(subscription.id()).get().isEnabled());

        matcher.enable(subscription.id());
        assertEquals(1, matcher.matching(event("order.created")).size());
    }

    @Test(expected = NotFoundException.class)
    public void enablingAnUnknownSubscriptionFails() {
        matcher.enable("unknown");
    }

    @Test
    public void indexIsLoadedFromTheStoreOnStart() {
        // Given
        store.save(subscription("orders", "order.created"));
        store.save(subscription("users", "user.created"));

        // When
        matcher.start();

        // Then
        assertEquals(1, matcher.matching(event("user.created")).size());
        assertEquals(2, matcher.subscriptions().size());
    }

    @Test
    public void matchesOnlyTheRegisteredTypes() {
        // Given
        final Subscription subscription = matcher.register(subscription("orders", "order.created"));

        // Then
        assertTrue(matcher.matches(event("order.created"), subscription));
        assertFalse(matcher.matches(event("order.updated"), subscription));
        assertEquals(List.of(subscription.id()),
                matcher.matching(event("order.created")).stream().map(Subscription::id).collect(Collectors.toList()));
        assertTrue(matcher.matching(event("order.updated")).isEmpty());
    }

    @Test
    public void processedEventsAreDeliveredToEveryMatch() {
        // Given
        matcher.register(subscription("first", "order.created"));
        matcher.register(subscription("second", "order.created", "order.updated"));
        matcher.register(subscription("other", "user.created"));

        // When
        matcher.onProcessed(event("order.created"));

        // Then
        assertEquals(List.of("http://localhost/first", "http://localhost/second"),
                delivery.deliveries().stream().map(RecordingDelivery.Delivery::target).sorted().collect(Collectors.toList()));
    }

    @Test
    public void registrationIsSignalled() {
        // When
        final Subscription subscription = matcher.register(subscription("orders", "order.created"));

        // Then
        assertEquals(1, channel.signals(SignalType.SUBSCRIPTION_CREATED).size());
        assertEquals(subscription.id(), channel.signals(SignalType.SUBSCRIPTION_CREATED).get(0).data().get("subscription_id"));
    }

    @Test
    public void failedDeliveryCompletesExceptionally() throws Exception {
        // Given
        delivery.failFor("http://localhost/down");

        // When
        try {
            matcher.send(event("order.created"), "http://localhost/down").get();
            fail("Delivery should fail");
        } catch (final ExecutionException e) {
            // Then
            assertTrue(e.getCause() instanceof DeliveryException);
        }
    }

    @Test
    public void slowDeliveryTimesOut() throws Exception {
        // Given
        final ExecutorService executor = Executors.newSingleThreadExecutor();
        final SubscriptionMatcher slow = new SubscriptionMatcher(
                store,
                new SubscriptionIndex(),
                (event, target) -> Thread.sleep(2_000),
                executor,
                100,
                new SignalEmitter(channel, new DirectExecutorService()));

        // When
        try {
            slow.send(event("order.created"), "http://localhost/slow").get(1, TimeUnit.SECONDS);
            fail("Delivery should time out");
        } catch (final ExecutionException e) {
            // Then
            assertTrue(e.getCause() instanceof TimeoutException);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void timedOutDeliveryIsInterrupted() throws Exception {
        // Given
        final ExecutorService executor = Executors.newSingleThreadExecutor();
        final CountDownLatch interrupted = new CountDownLatch(1);
        final CountDownLatch hanging = new CountDownLatch(1);
        final SubscriptionMatcher slow = new SubscriptionMatcher(
                store,
                new SubscriptionIndex(),
                (event, target) -> {
                    try {
                        hanging.await();
                    } catch (final InterruptedException e) {
                        interrupted.countDown();
                        throw e;
                    }
                },
                executor,
                100,
                new SignalEmitter(channel, new DirectExecutorService()));

        try {
            // When
            slow.send(event("order.created"), "http://localhost/hanging").get(5, TimeUnit.SECONDS);
            fail("Delivery should time out");
        } catch (final ExecutionException e) {
            // Then
            assertTrue(e.getCause() instanceof TimeoutException);
            assertTrue(interrupted.await(5, TimeUnit.SECONDS));
            assertEquals("free", executor.submit(() -> "free").get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void concurrentEnableAndDisableKeepIndexAndStoreInSync() throws Exception {
        // Given
        final Subscription subscription = matcher.register(subscription("orders", "order.created"));
        final ExecutorService executor = Executors.newFixedThreadPool(8);
        final List<Future<?>> toggles = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < 200; i++) {
                final boolean enable = i % 2 == 0;
                toggles.add(executor.submit(() -> {
                    if (enable) {
                        matcher.enable(subscription.id());
                    } else {
                        matcher.disable(subscription.id());
                    }
                }));
            }
            for (final Future<?> toggle : toggles) {
                toggle.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        final boolean stored = store.get(subscription.id()).get().isEnabled();
        assertEquals(stored, !matcher.matching(event("order.created")).isEmpty());
    }

    @Before
    public void setUp() {
        store = new InMemorySubscriptionStore();
        channel = new RecordingSignalChannel();
        delivery = new RecordingDelivery();
        matcher = new SubscriptionMatcher(
                store,
                new SubscriptionIndex(),
                delivery,
                new DirectExecutorService(),
                1000,
                new SignalEmitter(channel, new DirectExecutorService()));
    }

    private Event event(final String type) {
        return DefaultEvent.builder()
                .id("e-" + type)
                .type(type)
                .source(EventSource.BACKEND)
                .category(EventCategory.ORDER)
                .timestamp(Instant.now())
                .build();
    }

    private Subscription subscription(final String name, final String... types) {
        return Subscription.builder()
                .name(name)
                .eventTypes(types)
                .target("http://localhost/" + name)
                .build();
    }
}
