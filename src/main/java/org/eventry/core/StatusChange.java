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

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Describes a transition of the mutable processing state of an event. Used together with
 * {@link EventStore#claimAndMark(String, EventStatus, StatusChange)}.
 *
 * <p>The error message is always replaced (null clears it), the processor list is only replaced when one is given and the
 * processed time is only set when one is given.</p>
 *
 * <p>A retry limit makes the transition conditional on the current retry count being below the limit, the store checks it in
 * the same atomic step as the expected status.</p>
 */
public final class StatusChange {
    private final String errorMessage;
    private final boolean incrementRetry;
    private final Instant processedAt;
    private final List<String> processors;
    private final Integer retryLimit;
    private final EventStatus status;

    private StatusChange(
            final EventStatus status,
            final List<String> processors,
            final String errorMessage,
            final Instant processedAt,
            final boolean incrementRetry,
            final Integer retryLimit) {

        this.status = requireNonNull(status, "Status must not be null");
        this.processors = processors;
        this.errorMessage = errorMessage;
        this.processedAt = processedAt;
        this.incrementRetry = incrementRetry;
        this.retryLimit = retryLimit;
    }

    public static StatusChange to(final EventStatus status) {
        return new StatusChange(status, null, null, null, false, null);
    }

    public String errorMessage() {
        return errorMessage;
    }

    public StatusChange errorMessage(final String errorMessage) {
        return new StatusChange(status, processors, errorMessage, processedAt, incrementRetry, retryLimit);
    }

    public StatusChange incrementRetry() {
        return new StatusChange(status, processors, errorMessage, processedAt, true, retryLimit);
    }

    /**
     * Increments the retry count, the transition only applies while the retry count is below maxRetries.
     */
    public StatusChange incrementRetry(final int maxRetries) {
        return new StatusChange(status, processors, errorMessage, processedAt, true, maxRetries);
    }

    /**
     * Whether the retry limit (if any) allows the transition for the provided retry count.
     */
    public boolean permitsRetryCount(final int retryCount) {
        return retryLimit == null || retryCount < retryLimit;
    }

    public boolean isRetryIncrement() {
        return incrementRetry;
    }

    public Instant processedAt() {
        return processedAt;
    }

    public StatusChange processedAt(final Instant processedAt) {
        return new StatusChange(status, processors, errorMessage, processedAt, incrementRetry, retryLimit);
    }

    public List<String> processors() {
        return processors;
    }

    public StatusChange processors(final List<String> processors) {
        return new StatusChange(status, Collections.unmodifiableList(processors), errorMessage, processedAt, incrementRetry, retryLimit);
    }

    public Integer retryLimit() {
        return retryLimit;
    }

    public EventStatus status() {
        return status;
    }

    @Override
    public String toString() {
        return "StatusChange[status=" + status + ", retry=" + incrementRetry + "]";
    }
}
