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

import static java.util.Objects.requireNonNull;

/**
 * The outcome of one processor for one event.
 */
public final class ProcessingResult {
    private final long durationMillis;
    private final String eventId;
    private final String message;
    private final Instant processedAt;
    private final String processorName;
    private final ProcessingStatus status;

    public ProcessingResult(
            final String eventId,
            final String processorName,
            final ProcessingStatus status,
            final long durationMillis,
            final String message,
            final Instant processedAt) {

        this.eventId = requireNonNull(eventId, "Event id must not be null");
        this.processorName = requireNonNull(processorName, "Processor name must not be null");
        this.status = requireNonNull(status, "Status must not be null");
        this.durationMillis = durationMillis;
        this.message = message;
        this.processedAt = processedAt;
    }

    public long durationMillis() {
        return durationMillis;
    }

    public String eventId() {
        return eventId;
    }

    public String message() {
        return message;
    }

    public Instant processedAt() {
        return processedAt;
    }

    public String processorName() {
        return processorName;
    }

    public ProcessingStatus status() {
        return status;
    }

    @Override
    public String toString() {
        return "ProcessingResult[eventId=" + eventId + ", processor=" + processorName + ", status=" + status + "]";
    }
}
