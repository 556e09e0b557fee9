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
import org.eventry.core.EventStatus;
import org.eventry.core.EventStore;
import org.eventry.core.NotFoundException;
import org.eventry.core.ProcessingException;
import org.eventry.core.ProcessingResult;
import org.eventry.core.ProcessingStatus;
import org.eventry.core.ProcessorDefinition;
import org.eventry.core.SignalType;
import org.eventry.core.Startable;
import org.eventry.core.StatusChange;
import org.eventry.core.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The processing queue drains the ids of stored events with a fixed number of workers. Every worker claims the event
 * (pending to processing) before it runs the processors so that an event is never processed twice at the same time, a worker
 * that loses the claim simply skips the event.
 *
 * <p>Workers poll the queue with a timeout and check for shutdown between polls, an event that has been taken from the queue
 * is always processed to the end.</p>
 */
public class ProcessingQueue implements Startable<ProcessingQueue>, AutoCloseable {
    private static final int RECOVERY_LIMIT = 10_000;

    private final EventStore eventStore;
    private final List<ProcessedEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final long pollTimeout;
    private final ExecutorService processorExecutor;
    private final long processorTimeout;
    private final List<ProcessorDefinition> processors;
    private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();
    private volatile boolean running;
    private final SignalEmitter signals;
    private final ExecutorService workerExecutor;
    private final int workers;

    public ProcessingQueue(
            final EventStore eventStore,
            final Collection<ProcessorDefinition> processors,
            final SignalEmitter signals,
            final ExecutorService workerExecutor,
            final ExecutorService processorExecutor,
            final int workers,
            final long pollTimeout,
            final long processorTimeout) {

        this.eventStore = eventStore;
        this.processors = List.copyOf(processors);
        this.signals = signals;
        this.workerExecutor = workerExecutor;
        this.processorExecutor = processorExecutor;
        this.workers = workers;
        this.pollTimeout = pollTimeout;
        this.processorTimeout = processorTimeout;
    }

    /**
     * Archives a processed or failed event.
     */
    public void archive(final String eventId) {
        final Event event = eventStore.get(eventId)
                .orElseThrow(() -> new NotFoundException(String.format("Event not found [id=%s]", eventId)));

        if (event.status() != EventStatus.PROCESSED && event.status() != EventStatus.FAILED) {
            throw new ValidationException(String.format("Only processed or failed events can be archived [id=%s, status=%s]",
                    eventId, event.status()));
        }
        if (!eventStore.claimAndMark(eventId, event.status(), StatusChange.to(EventStatus.ARCHIVED).errorMessage(event.errorMessage()))) {
            throw new ValidationException(String.format("Event changed status while archiving [id=%s]", eventId));
        }
        log.info("Event archived [id={}]", eventId);
    }

    /**
     * Stops the workers. Each worker finishes the event it is currently processing, waiting at most one poll timeout plus one
     * processor timeout.
     */
    @Override
    public void close() {
        running = false;
        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(pollTimeout * 2 + processorTimeout * Math.max(1, processors.size()), TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not stop in time, interrupting");
                workerExecutor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        processorExecutor.shutdownNow();
        log.debug("Processing queue stopped [remaining={}]", queue.size());
    }

    public void enqueue(final String eventId) {
        queue.add(eventId);
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Processes one event on the calling thread, this is what the workers do for every id they take from the queue.
     *
     * @return true if this caller claimed and processed the event, false if the event was not pending.
     */
    public boolean process(final String eventId) {
        try (EventMdcContext mdc = new EventMdcContext(eventId)) {
            if (!eventStore.claimAndMark(eventId, EventStatus.PENDING, StatusChange.to(EventStatus.PROCESSING))) {
                log.debug("Event not claimed, skipping");
                return false;
            }

            try {
                final Optional<Event> claimed = eventStore.get(eventId);
                if (claimed.isEmpty()) {
                    log.warn("Claimed event disappeared");
                    return false;
                }
                final Event event = claimed.get();
                mdc.enrich(event);

                final List<ProcessingResult> results = runProcessors(event);
                final List<String> names = new ArrayList<>();
                results.forEach(result -> names.add(result.processorName()));

                final Optional<ProcessingResult> failure = results.stream()
                        .filter(result -> !result.status().isSatisfied())
                        .findFirst();

                final Instant now = Instant.now();
                final StatusChange change = failure.isPresent()
                        ? StatusChange.to(EventStatus.FAILED).processors(names).errorMessage(errorMessage(failure.get()))
                        : StatusChange.to(EventStatus.PROCESSED).processors(names).processedAt(now);

                if (!eventStore.claimAndMark(eventId, EventStatus.PROCESSING, change)) {
                    log.warn("Event left the processing status while it was processed");
                    return true;
                }

                final Event outcome = eventStore.get(eventId).orElse(event);
                if (failure.isPresent()) {
                    log.info("Event processing failed [retryCount={}, error={}]", outcome.retryCount(), outcome.errorMessage());
                    signalFailure(outcome, failure.get());
                } else {
                    log.debug("Event processed [processors={}]", names);
                    signals.emit(SignalType.EVENT_PROCESSED_SUCCESS, EventryHelper.signalData(outcome));
                    notifyListeners(outcome);
                }
                return true;
            } catch (final RuntimeException e) {
                log.error("Processing aborted, marking the event as failed", e);
                markAborted(eventId, e);
                return true;
            }
        }
    }

    /**
     * Moves failed events that have been retried fewer than maxRetries times back to pending and enqueues them again. Events
     * that reached maxRetries stay failed and need manual intervention.
     *
     * @return The number of events that were enqueued again.
     */
    public int retryFailed(final int maxRetries, final int batchSize) {
        if (maxRetries < 0) {
            throw new ValidationException(String.format("Max retries must not be negative [maxRetries=%d]", maxRetries));
        }
        if (batchSize < 1) {
            throw new ValidationException(String.format("Batch size must be positive [batchSize=%d]", batchSize));
        }

        int count = 0;
        for (final Event event : eventStore.retryCandidates(maxRetries, batchSize)) {
            final StatusChange change = StatusChange.to(EventStatus.PENDING)
                    .errorMessage(event.errorMessage())
                    .incrementRetry(maxRetries);

            if (eventStore.claimAndMark(event.id(), EventStatus.FAILED, change)) {
                enqueue(event.id());
                count++;
            }
        }

        log.info("Failed events enqueued for retry [count={}, maxRetries={}]", count, maxRetries);
        return count;
    }

    /**
     * Starts the workers. Events left pending by a previous run are enqueued again, events that were left in processing
     * (the previous run stopped while processing them) are moved back to pending first.
     */
    @Override
    public ProcessingQueue start() {
        running = true;
        final List<Event> pending = eventStore.unprocessed(RECOVERY_LIMIT);
        for (final Event event : pending) {
            if (event.status() == EventStatus.PROCESSING) {
                eventStore.claimAndMark(event.id(), EventStatus.PROCESSING, StatusChange.to(EventStatus.PENDING));
                log.info("Stale event moved back to pending [id={}]", event.id());
            }
            enqueue(event.id());
        }

        for (int i = 0; i < workers; i++) {
            workerExecutor.submit(this::work);
        }
        log.debug("Processing queue started [workers={}, recovered={}]", workers, pending.size());
        return this;
    }

    void addListener(final ProcessedEventListener listener) {
        listeners.add(listener);
    }

    private String errorMessage(final ProcessingResult result) {
        if (result.message() != null) {
            return result.message();
        }
        return String.format("Processor %s returned %s", result.processorName(), result.status());
    }

    private ProcessingResult execute(final ProcessorDefinition definition, final Event event) {
        final long start = System.currentTimeMillis();
        final Future<ProcessingStatus> future = processorExecutor.submit(() -> definition.processor().process(event));

        ProcessingStatus status;
        String message = null;
        try {
            status = future.get(processorTimeout, TimeUnit.MILLISECONDS);
            if (status == null) {
                status = ProcessingStatus.SUCCESS;
            }
        } catch (final TimeoutException e) {
            future.cancel(true);
            status = ProcessingStatus.FAILED;
            message = String.format("Processor %s timed out after %dms", definition.name(), processorTimeout);
        } catch (final ExecutionException e) {
            final ProcessingException failure = new ProcessingException(
                    String.format("Processor %s failed: %s", definition.name(), e.getCause().getMessage()), e.getCause());
            log.warn("Processor failed [processor={}]", definition.name(), failure);
            status = ProcessingStatus.FAILED;
            message = failure.getMessage();
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            status = ProcessingStatus.FAILED;
            message = String.format("Processor %s interrupted", definition.name());
        }

        final ProcessingResult result = new ProcessingResult(
                event.id(), definition.name(), status, System.currentTimeMillis() - start, message, Instant.now());
        eventStore.record(result);
        return result;
    }

    /**
     * Moves an event whose processing was aborted by a store failure to failed, so that it can be retried.
     */
    private void markAborted(final String eventId, final RuntimeException cause) {
        final String message = String.format("Processing aborted: %s", cause.getMessage());
        try {
            eventStore.claimAndMark(eventId, EventStatus.PROCESSING, StatusChange.to(EventStatus.FAILED).errorMessage(message));
        } catch (final RuntimeException e) {
            log.error("Unable to mark aborted event as failed, it is recovered on the next start", e);
        }
    }

    private void notifyListeners(final Event event) {
        for (final ProcessedEventListener listener : listeners) {
            try {
                listener.onProcessed(event);
            } catch (final RuntimeException e) {
                log.error("Processed-event listener failed [listener={}]", listener.getClass().getSimpleName(), e);
            }
        }
    }

    private List<ProcessingResult> runProcessors(final Event event) {
        final List<ProcessingResult> results = new ArrayList<>();
        for (final ProcessorDefinition definition : processors) {
            if (definition.appliesTo(event)) {
                results.add(execute(definition, event));
            }
        }
        return results;
    }

    private void signalFailure(final Event event, final ProcessingResult failure) {
        final Map<String, Object> data = EventryHelper.signalData(event);
        data.put("processor_name", failure.processorName());
        data.put("error_message", event.errorMessage());
        data.put("retry_count", event.retryCount());
        signals.emit(SignalType.EVENT_PROCESSED_FAILED, data);
    }

    private void work() {
        while (running) {
            try {
                final String eventId = queue.poll(pollTimeout, TimeUnit.MILLISECONDS);
                if (eventId != null) {
                    process(eventId);
                }
            } catch (final InterruptedException e) {
                log.debug("Worker interrupted, stopping");
                Thread.currentThread().interrupt();
                return;
            } catch (final RuntimeException e) {
                log.error("Unable to process event", e);
            }
        }
        log.debug("Worker stopping");
    }
}
