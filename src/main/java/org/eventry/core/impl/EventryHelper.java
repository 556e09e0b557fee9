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
import org.eventry.core.ValidationException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Various helper functions.
 */
class EventryHelper {
    private EventryHelper() {
        // empty
    }

    static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }

    /**
     * Parses an ISO-8601 timestamp. Values without offset are treated as UTC, a missing value means "now".
     */
    static Instant parseTimestamp(final String value) {
        if (isBlank(value)) {
            return Instant.now();
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (final DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (final DateTimeParseException nested) {
                throw new ValidationException(String.format("Invalid timestamp [timestamp=%s]", value));
            }
        }
    }

    /**
     * The data carried by signals describing a single event.
     */
    static Map<String, Object> signalData(final Event event) {
        final Map<String, Object> data = new LinkedHashMap<>();
        data.put("event_id", event.id());
        data.put("event_type", event.type());
        data.put("event_source", event.source().value());
        data.put("event_category", event.category().value());
        data.put("stream_id", event.streamId());
        data.put("user_id", event.userId());
        data.put("timestamp", String.valueOf(event.timestamp()));
        return data;
    }
}
