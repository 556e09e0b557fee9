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

import com.hazelcast.config.Config;
import com.hazelcast.core.HazelcastInstance;
import org.eventry.core.impl.CategoryRules;
import org.eventry.core.impl.EventryImpl;
import org.eventry.core.impl.Ingestion;
import org.eventry.core.impl.ProcessingQueue;
import org.eventry.core.impl.ProjectionCache;
import org.eventry.core.impl.ProjectionEngine;
import org.eventry.core.impl.ReplayEngine;
import org.eventry.core.impl.SignalEmitter;
import org.eventry.core.impl.SubscriptionIndex;
import org.eventry.core.impl.SubscriptionMatcher;
import org.eventry.core.support.InMemoryEventStore;
import org.eventry.core.support.InMemoryProjectionStore;
import org.eventry.core.support.InMemorySubscriptionStore;
import org.eventry.delivery.http.WebhookDelivery;
import org.eventry.signal.hazelcast.HazelcastSignalChannel;
import org.eventry.store.jdbc.H2EventStore;
import org.eventry.store.jdbc.JdbcProjectionStore;
import org.eventry.store.jdbc.JdbcSubscriptionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Setup of Eventry is done via this class. The builder design pattern is used and all the relevant settings can be
 * changed/overridden.
 *
 * <p>The following components can be specified:
 *
 * <strong>Stores</strong>: Where events, subscriptions and projections are kept. Either custom stores, a JDBC url (H2) or a
 * {@link StoreLocator} that resolves the url when Eventry is built. The default is a non-durable in-memory H2 database.
 *
 * <strong>Signals</strong>: The broadcast channel for notifications (event stored, processed, subscription created and so on).
 * Either a Hazelcast cluster or a custom {@link SignalChannel}. By default signals are dropped.
 *
 * <strong>Processors</strong>: The processing pipeline, run by {@link #DEFAULT_WORKERS} workers unless configured otherwise.
 *
 * <strong>Delivery</strong>: How events are pushed to subscription targets, webhooks by default.
 *
 * <strong>Executor services</strong>: The thread pools used for signals and for deliveries. If no thread pool is defined a
 * fixed-size pool is created for signals and a cached pool for deliveries. </p>
 *
 * To initialize Eventry with a processor and ingest an event the following code can be used:
 * <pre>
 *     Eventry eventry = EventryBuilder.builder()
 *         .jdbc("jdbc:h2:~/eventry")
 *         .processor("audit", event -&gt; ProcessingStatus.SUCCESS)
 *         .build()
 *         .start();
 *
 *     String eventId = eventry.ingest(
 *         EventSubmission.of("order.created", EventSource.BACKEND).entity("order", "42"));
 * </pre>
 *
 * Signals can be broadcast to a Hazelcast cluster:
 * <pre>
 *     Eventry eventry = EventryBuilder.builder()
 *         .hazelcast(new Config())
 *         .build()
 *         .start();
 * </pre>
 */
public final class EventryBuilder {
    public static final long DEFAULT_DELIVERY_TIMEOUT = 10_000;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_POLL_TIMEOUT = 500;
    public static final long DEFAULT_PROCESSOR_TIMEOUT = 30_000;
    public static final int DEFAULT_RETRY_BATCH_SIZE = 100;
    public static final int DEFAULT_WORKERS = 3;

    private CategoryRules categoryRules;
    private EventDelivery delivery;
    private ExecutorService deliveryExecutor;
    private long deliveryTimeout;
    private EventStore eventStore;
    private ExecutorService executorService;
    private Config hazelcastConfig;
    private HazelcastInstance hz;
    private boolean inMemory;
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private Integer maxRetries;
    private long pollTimeout;
    private final List<ProcessorDefinition> processors = new ArrayList<>();
    private long processorTimeout;
    private ProjectionStore projectionStore;
    private int retryBatchSize;
    private SignalChannel signalChannel;
    private StoreLocator storeLocator;
    private SubscriptionStore subscriptionStore;
    private String topic;
    private int workers;

    /**
     * Creates this builder.
     *
     * @return The builder.
     */
    public static EventryBuilder builder() {
        return new EventryBuilder();
    }

    private EventryBuilder() {
        // empty
    }

    /**
     * Build the Eventry-instance based on the settings you provided in the earlier steps.
     *
     * @return An Eventry-instance that has not yet been started.
     * @see #jdbc(String)
     * @see #hazelcast(Config)
     * @see #processor(String, EventProcessor)
     */
    public Eventry build() {
        final List<ProcessorDefinition> processors = processors();
        final int maxRetries = maxRetries();
        final String jdbcUrl = jdbcUrl();
        final EventStore eventStore = eventStore(jdbcUrl);
        final SubscriptionStore subscriptionStore = subscriptionStore(jdbcUrl);
        final ProjectionStore projectionStore = projectionStore(jdbcUrl);
        final SignalChannel channel = signalChannel();
        final ExecutorService executorService = executorService();
        final ExecutorService deliveryExecutor = deliveryExecutor();
        final SignalEmitter signals = new SignalEmitter(channel, executorService);

        final int workers = workers();
        final ProcessingQueue queue = new ProcessingQueue(
                eventStore,
                processors,
                signals,
                Executors.newFixedThreadPool(workers),
                Executors.newCachedThreadPool(),
                workers,
                pollTimeout(),
                processorTimeout());

        final SubscriptionMatcher matcher = new SubscriptionMatcher(
                subscriptionStore,
                new SubscriptionIndex(),
                delivery(),
                deliveryExecutor,
                deliveryTimeout(),
                signals);

        return new EventryImpl(
                eventStore,
                subscriptionStore,
                projectionStore,
                channel,
                executorService,
                deliveryExecutor,
                new Ingestion(eventStore, categoryRules(), queue, signals),
                queue,
                matcher,
                new ProjectionEngine(eventStore, projectionStore, new ProjectionCache(), signals),
                new ReplayEngine(eventStore, matcher, signals),
                maxRetries,
                retryBatchSize());
    }

    /**
     * The rules used to derive the category of events submitted without one, {@link CategoryRules#defaults()} if not set.
     *
     * @param categoryRules The category rules.
     * @return The builder to allow further chaining.
     */
    public EventryBuilder categoryRules(final CategoryRules categoryRules) {
        this.categoryRules = categoryRules;
        return this;
    }

    /**
     * Sets the transport used for subscription and replay deliveries. The default is a {@link WebhookDelivery}.
     *
     * @param delivery The delivery transport.
     * @return The builder to allow further chaining.
     */
    public EventryBuilder delivery(final EventDelivery delivery) {
        this.delivery = delivery;
        return this;
    }

    /**
     * Use a custom thread pool for subscription and replay deliveries. Deliveries never share a pool with signals, so slow
     * targets cannot hold up signals. A cached thread pool is used if not set, it is shut down when Eventry is closed.
     *
     * @param deliveryExecutor The thread pool.
     * @return The builder to allow further chaining.
     */
    public EventryBuilder deliveryExecutor(final ExecutorService deliveryExecutor) {
        this.deliveryExecutor = deliveryExecutor;
        return this;
    }

    /**
     * Sets the timeout (in millis) for a single delivery attempt, {@link #DEFAULT_DELIVERY_TIMEOUT} if not set. A delivery
     * that runs longer is interrupted.
     */
    public EventryBuilder deliveryTimeout(final long deliveryTimeout) {
        this.deliveryTimeout = deliveryTimeout;
        return this;
    }

    /**
     * Use a custom thread pool for signals (e.g. if you have a shared thread pool or similar). The pool is shut down when
     * Eventry is closed.
     *
     * @param executorService The thread pool.
     * @return The builder to allow further chaining.
     */
    public EventryBuilder executorService(final ExecutorService executorService) {
        this.executorService = executorService;
        return this;
    }

    /**
     * Broadcasts signals on the provided Hazelcast instance. The instance is not shut down when Eventry is closed.
     *
     * @param hz The hazelcast instance to use.
     * @return The builder to allow further chaining.
     * @see #hazelcast(Config)
     */
    public EventryBuilder hazelcast(final HazelcastInstance hz) {
        this.hz = hz;
        return this;
    }

    /**
     * Broadcasts signals on a new Hazelcast instance created from the provided configuration. The instance is created when
     * Eventry is built and shut down when it is closed.
     *
     * @param config The hazelcast configuration to use.
     * @return The builder to allow further chaining.
     * @see #hazelcast(HazelcastInstance)
     */
    public EventryBuilder hazelcast(final Config config) {
        this.hazelcastConfig = config;
        return this;
    }

    /**
     * Keep events, subscriptions and projections in plain in-memory stores instead of a database.
     *
     * @return The builder to allow further chaining.
     */
    public EventryBuilder inMemory() {
        this.inMemory = true;
        return this;
    }

    /**
     * Keep events, subscriptions and projections in the H2 database at the provided url. The tables are created if they do
     * not exist.
     *
     * @param jdbcUrl The JDBC url.
     * @return The builder to allow further chaining.
     */
    public EventryBuilder jdbc(final String jdbcUrl) {
        return storeLocator(() -> jdbcUrl);
    }

    /**
     * The default number of retries used by {@link Eventry#retryFailed()}, {@link #DEFAULT_MAX_RETRIES} if not set. Zero
     * disables retries.
     */
    public EventryBuilder maxRetries(final int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    /**
     * Sets how long (in millis) a worker waits for the next event before it checks whether it should stop, {@link
     * #DEFAULT_POLL_TIMEOUT} if not set.
     */
    public EventryBuilder pollTimeout(final long pollTimeout) {
        this.pollTimeout = pollTimeout;
        return this;
    }

    /**
     * Registers a processor that runs for all events. Processors run in registration order.
     *
     * @param name      The processor name, recorded with the event and its processing results.
     * @param processor The processor.
     * @return The builder to allow further chaining.
     */
    public EventryBuilder processor(final String name, final EventProcessor processor) {
        return processor(ProcessorDefinition.of(name, processor));
    }

    /**
     * Registers a processor that only runs for the events accepted by the filter.
     */
    public EventryBuilder processor(final String name, final ProcessorFilter filter, final EventProcessor processor) {
        return processor(ProcessorDefinition.of(name, filter, processor));
    }

    public EventryBuilder processor(final ProcessorDefinition definition) {
        processors.add(definition);
        return this;
    }

    /**
     * Sets the timeout (in millis) for a single processor execution, {@link #DEFAULT_PROCESSOR_TIMEOUT} if not set.
     */
    public EventryBuilder processorTimeout(final long processorTimeout) {
        this.processorTimeout = processorTimeout;
        return this;
    }

    public EventryBuilder projectionStore(final ProjectionStore projectionStore) {
        this.projectionStore = projectionStore;
        return this;
    }

    /**
     * The default batch size used by {@link Eventry#retryFailed()}, {@link #DEFAULT_RETRY_BATCH_SIZE} if not set.
     */
    public EventryBuilder retryBatchSize(final int retryBatchSize) {
        this.retryBatchSize = retryBatchSize;
        return this;
    }

    /**
     * Use a custom broadcast channel for signals.
     *
     * @param signalChannel The channel.
     * @return The builder to allow further chaining.
     */
    public EventryBuilder signals(final SignalChannel signalChannel) {
        this.signalChannel = signalChannel;
        return this;
    }

    /**
     * Create the Eventry-instance using a custom event store.
     *
     * @param eventStore The event store.
     * @return The builder to allow further chaining.
     */
    public EventryBuilder store(final EventStore eventStore) {
        this.eventStore = eventStore;
        return this;
    }

    /**
     * Resolves the JDBC url of the H2 database when Eventry is built.
     *
     * @param storeLocator The locator.
     * @return The builder to allow further chaining.
     * @see StoreLocator#systemProperty(String, String)
     */
    public EventryBuilder storeLocator(final StoreLocator storeLocator) {
        this.storeLocator = storeLocator;
        return this;
    }

    public EventryBuilder subscriptionStore(final SubscriptionStore subscriptionStore) {
        this.subscriptionStore = subscriptionStore;
        return this;
    }

    /**
     * Set the name of the Hazelcast-topic to use. This is only required if multiple Eventry-instances share the same
     * Hazelcast instance. The default name is {@link HazelcastSignalChannel#DEFAULT_TOPIC}.
     *
     * @param name The name of the topic to use.
     * @return The builder to allow further chaining.
     */
    public EventryBuilder topic(final String name) {
        this.topic = name;
        return this;
    }

    /**
     * Sets the number of concurrent processing workers, {@link #DEFAULT_WORKERS} if not set.
     */
    public EventryBuilder workers(final int workers) {
        this.workers = workers;
        return this;
    }

    private CategoryRules categoryRules() {
        if (categoryRules == null) {
            categoryRules = CategoryRules.defaults();
        }
        return categoryRules;
    }

    private EventDelivery delivery() {
        if (delivery == null) {
            delivery = new WebhookDelivery(Duration.ofMillis(deliveryTimeout()));
        }
        return delivery;
    }

    private ExecutorService deliveryExecutor() {
        if (deliveryExecutor == null) {
            deliveryExecutor = Executors.newCachedThreadPool();
        }
        return deliveryExecutor;
    }

    private long deliveryTimeout() {
        if (deliveryTimeout <= 0) {
            deliveryTimeout = DEFAULT_DELIVERY_TIMEOUT;
        }
        return deliveryTimeout;
    }

    private EventStore eventStore(final String jdbcUrl) {
        if (eventStore == null) {
            eventStore = jdbcUrl == null ? new InMemoryEventStore() : new H2EventStore(jdbcUrl);
        }
        return eventStore;
    }

    private ExecutorService executorService() {
        if (executorService == null) {
            executorService = Executors.newFixedThreadPool(5);
        }
        return executorService;
    }

    /**
     * The url of the database, null when only in-memory stores are used.
     */
    private String jdbcUrl() {
        if (inMemory) {
            return null;
        }
        if (storeLocator == null) {
            if (eventStore != null && subscriptionStore != null && projectionStore != null) {
                return null;
            }
            logger.warn("The default store is being used. " +
                    "This is a non-durable in-memory database so events may disappear when the instance is rebooted. " +
                    "It is strongly recommended that you use a durable database.");
            storeLocator = () -> "jdbc:h2:mem:eventry-" + UUID.randomUUID();
        }
        return storeLocator.locate();
    }

    private int maxRetries() {
        if (maxRetries == null) {
            maxRetries = DEFAULT_MAX_RETRIES;
        }
        if (maxRetries < 0) {
            throw new ValidationException(String.format("Max retries must not be negative [maxRetries=%d]", maxRetries));
        }
        return maxRetries;
    }

    private long pollTimeout() {
        if (pollTimeout <= 0) {
            pollTimeout = DEFAULT_POLL_TIMEOUT;
        }
        return pollTimeout;
    }

    private List<ProcessorDefinition> processors() {
        final Set<String> names = new HashSet<>();
        for (final ProcessorDefinition definition : processors) {
            if (!names.add(definition.name())) {
                throw new ValidationException(String.format("Duplicate processor name [name=%s]", definition.name()));
            }
        }
        return processors;
    }

    private long processorTimeout() {
        if (processorTimeout <= 0) {
            processorTimeout = DEFAULT_PROCESSOR_TIMEOUT;
        }
        return processorTimeout;
    }

    private ProjectionStore projectionStore(final String jdbcUrl) {
        if (projectionStore == null) {
            projectionStore = jdbcUrl == null ? new InMemoryProjectionStore() : new JdbcProjectionStore(jdbcUrl);
        }
        return projectionStore;
    }

    private int retryBatchSize() {
        if (retryBatchSize <= 0) {
            retryBatchSize = DEFAULT_RETRY_BATCH_SIZE;
        }
        return retryBatchSize;
    }

    private SignalChannel signalChannel() {
        if (signalChannel == null) {
            if (hz != null) {
                signalChannel = new HazelcastSignalChannel(hz, topic());
            } else if (hazelcastConfig != null) {
                signalChannel = HazelcastSignalChannel.create(hazelcastConfig, topic());
            } else {
                signalChannel = SignalChannel.discard();
            }
        }
        return signalChannel;
    }

    private SubscriptionStore subscriptionStore(final String jdbcUrl) {
        if (subscriptionStore == null) {
            subscriptionStore = jdbcUrl == null ? new InMemorySubscriptionStore() : new JdbcSubscriptionStore(jdbcUrl);
        }
        return subscriptionStore;
    }

    private String topic() {
        if (topic == null || topic.length() == 0) {
            topic = HazelcastSignalChannel.DEFAULT_TOPIC;
        }
        return topic;
    }

    private int workers() {
        if (workers <= 0) {
            workers = DEFAULT_WORKERS;
        }
        return workers;
    }
}
