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
import org.slf4j.MDC;

/**
 * Auto-closeable context that populates the MDC with the identity of the event being processed. Use with try-with-resources
 * so that the keys are removed when the processing is done.
 */
class EventMdcContext implements AutoCloseable {
    static final String CORRELATION_ID = "correlationId";
    static final String EVENT_ID = "eventId";
    static final String EVENT_TYPE = "eventType";

    EventMdcContext(final String eventId) {
        MDC.put(EVENT_ID, eventId);
    }

    EventMdcContext(final Event event) {
        this(event.id());
        enrich(event);
    }

    @Override
    public void close() {
        MDC.remove(EVENT_ID);
        MDC.remove(EVENT_TYPE);
        MDC.remove(CORRELATION_ID);
    }

    void enrich(final Event event) {
        MDC.put(EVENT_TYPE, event.type());
        if (event.correlationId() != null) {
            MDC.put(CORRELATION_ID, event.correlationId());
        }
    }
}
