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

import java.util.Collections;
import java.util.List;

/**
 * The ordered events of one entity. The version of a stream is the number of events it contains, also when only a suffix
 * of the stream was requested.
 */
public final class EventStream {
    private final String entityId;
    private final String entityType;
    private final List<Event> events;
    private final String streamId;
    private final long version;

    public EventStream(final String streamId, final List<Event> events, final long version) {
        this.streamId = streamId;
        this.events = Collections.unmodifiableList(events);
        this.version = version;

        final String[] parts = parse(streamId);
        this.entityType = parts[0];
        this.entityId = parts[1];
    }

    /**
     * Splits a stream id into entity type and entity id. The entity id may itself contain the separator.
     */
    public static String[] parse(final String streamId) {
        if (streamId == null || streamId.isBlank()) {
            throw new ValidationException("Stream id must not be empty");
        }
        final int index = streamId.indexOf(Event.STREAM_SEPARATOR);
        if (index <= 0 || index == streamId.length() - 1) {
            throw new ValidationException(String.format("Stream id must be entityType:entityId [streamId=%s]", streamId));
        }
        return new String[]{streamId.substring(0, index), streamId.substring(index + 1)};
    }

    public static String streamId(final String entityType, final String entityId) {
        return entityType + Event.STREAM_SEPARATOR + entityId;
    }

    public String entityId() {
        return entityId;
    }

    public String entityType() {
        return entityType;
    }

    public List<Event> events() {
        return events;
    }

    public String streamId() {
        return streamId;
    }

    public long version() {
        return version;
    }
}
