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
import org.eventry.core.EventDelivery;
import org.eventry.core.NotFoundException;
import org.eventry.core.SignalType;
import org.eventry.core.Startable;
import org.eventry.core.Subscription;
import org.eventry.core.SubscriptionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Matches processed events against the registered subscriptions and pushes matching events to the subscription targets.
 * Deliveries run on their own executor with a timeout, a failed delivery is logged and not retried.
 */
public class SubscriptionMatcher implements Startable<SubscriptionMatcher>, ProcessedEventListener {
    private final EventDelivery delivery;
    private final ExecutorService deliveryExecutor;
    private final long deliveryTimeout;
    private final SubscriptionIndex index;
    private final LockTemplate locks = new LockTemplate();
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final SignalEmitter signals;
    private final SubscriptionStore subscriptionStore;

    public SubscriptionMatcher(
            final SubscriptionStore subscriptionStore,
            final SubscriptionIndex index,
            final EventDelivery delivery,
            final ExecutorService deliveryExecutor,
            final long deliveryTimeout,
            final SignalEmitter signals) {

        this.subscriptionStore = subscriptionStore;
        this.index = index;
        this.delivery = delivery;
        this.deliveryExecutor = deliveryExecutor;
        this.deliveryTimeout = deliveryTimeout;
        this.signals = signals;
    }

    /**
     * Pushes the event to the target of the subscription without blocking the caller.
     */
    public CompletableFuture<Void> deliver(final Event event, final Subscription subscription) {
        return send(event, subscription.target())
                .whenComplete((ignored, throwable) -> {
                    if (throwable != null) {
                        log.warn("Delivery failed [eventId={}, subscriptionId={}, target={}]",
                                event.id(), subscription.id(), subscription.target(), throwable);
                    } else {
                        log.debug("Event delivered [eventId={}, subscriptionId={}]", event.id(), subscription.id());
                    }
                });
    }

    public void disable(final String subscriptionId) {
        setEnabled(subscriptionId, false);
    }

    public void enable(final String subscriptionId) {
        setEnabled(subscriptionId, true);
    }

    public boolean matches(final Event event, final Subscription subscription) {
        return subscription.matches(event);
    }

    /**
     * The enabled subscriptions that match the event.
     */
    public List<Subscription> matching(final Event event) {
        return index.candidates(event.type()).stream()
                .filter(subscription -> matches(event, subscription))
                .collect(Collectors.toList());
    }

    @Override
    public void onProcessed(final Event event) {
        matching(event).forEach(subscription -> deliver(event, subscription));
    }

    /**
     * Persists and indexes the subscription.
     */
    public Subscription register(final Subscription subscription) {
        subscriptionStore.save(subscription);
        index.put(subscription);
        log.info("Subscription created [id={}, name={}, types={}]", subscription.id(), subscription.name(), subscription.eventTypes());

        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("subscription_id", subscription.id());
        data.put("subscriber_name", subscription.name());
        data.put("event_types", List.copyOf(subscription.eventTypes()));
        data.put("event_sources", subscription.eventSources().stream().map(s -> s.value()).collect(Collectors.toList()));
        data.put("enabled", subscription.isEnabled());
        signals.emit(SignalType.SUBSCRIPTION_CREATED, data);
        return subscription;
    }

    /**
     * Sends the event to a target. The future fails with a {@link DeliveryException} if the delivery fails and with a
     * {@link TimeoutException} if it does not complete within the delivery timeout, in which case the running delivery is
     * interrupted.
     */
    public CompletableFuture<Void> send(final Event event, final String target) {
        final CompletableFuture<Void> result = new CompletableFuture<>();
        final Future<?> task;
        try {
            task = deliveryExecutor.submit(() -> {
                try {
                    delivery.deliver(event, target);
                    result.complete(null);
                } catch (final DeliveryException e) {
                    result.completeExceptionally(e);
                } catch (final Exception e) {
                    result.completeExceptionally(
                            new DeliveryException(String.format("Unable to deliver event [id=%s, target=%s]", event.id(), target), e));
                }
            });
        } catch (final RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new DeliveryException("Delivery executor is shut down", e));
        }

        result.orTimeout(deliveryTimeout, TimeUnit.MILLISECONDS).whenComplete((ignored, throwable) -> {
            if (throwable instanceof TimeoutException) {
                task.cancel(true);
            }
        });
        return result;
    }

    @Override
    public SubscriptionMatcher start() {
        index.clear();
        subscriptionStore.all().forEach(index::put);
        log.debug("Subscriptions loaded [count={}]", index.size());
        return this;
    }

    public List<Subscription> subscriptions() {
        return subscriptionStore.all().stream()
                .sorted(Comparator.comparing(Subscription::createdAt))
                .collect(Collectors.toList());
    }

    /**
     * Updates store and index under the lock of the subscription, so that both always agree on the enabled flag.
     */
    private void setEnabled(final String subscriptionId, final boolean enabled) {
        locks.lock(subscriptionId, () -> {
            final Subscription current = subscriptionStore.get(subscriptionId)
                    .orElseThrow(() -> new NotFoundException(String.format("Subscription not found [id=%s]", subscriptionId)));

            final Subscription updated = current.withEnabled(enabled);
            subscriptionStore.save(updated);
            index.put(updated);
            return updated;
        });
        log.info("Subscription {} [id={}]", enabled ? "enabled" : "disabled", subscriptionId);
    }
}
