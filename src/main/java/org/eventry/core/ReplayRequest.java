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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Selects the events to replay (exactly one of: an id list, a stream or a time range) and where to send them. Without a
 * target the events are redelivered to every matching subscription. A dry run only resolves the selection.
 */
public final class ReplayRequest {
    public enum SelectorType {
        EVENT_IDS, STREAM, TIME_RANGE
    }

    private final boolean dryRun;
    private final Instant endTime;
    private final List<String> eventIds;
    private final SelectorType selectorType;
    private final Instant startTime;
    private final String streamId;
    private final String target;

    private ReplayRequest(
            final SelectorType selectorType,
            final List<String> eventIds,
            final String streamId,
            final Instant startTime,
            final Instant endTime,
            final String target,
            final boolean dryRun) {

        this.selectorType = selectorType;
        this.eventIds = eventIds;
        this.streamId = streamId;
        this.startTime = startTime;
        this.endTime = endTime;
        this.target = target;
        this.dryRun = dryRun;
    }

    public static ReplayRequest events(final List<String> eventIds) {
        if (eventIds == null || eventIds.isEmpty()) {
            throw new ValidationException("Replay by id requires at least one event id");
        }
        return new ReplayRequest(SelectorType.EVENT_IDS, Collections.unmodifiableList(new ArrayList<>(eventIds)), null, null, null, null, false);
    }

    public static ReplayRequest stream(final String streamId) {
        EventStream.parse(streamId);
        return new ReplayRequest(SelectorType.STREAM, null, streamId, null, null, null, false);
    }

    public static ReplayRequest timeRange(final Instant startTime, final Instant endTime) {
        if (startTime == null || endTime == null) {
            throw new ValidationException("Replay by time range requires both start and end time");
        }
        if (startTime.isAfter(endTime)) {
            throw new ValidationException("Replay start time must not be after end time");
        }
        return new ReplayRequest(SelectorType.TIME_RANGE, null, null, startTime, endTime, null, false);
    }

    public ReplayRequest dryRun() {
        return new ReplayRequest(selectorType, eventIds, streamId, startTime, endTime, target, true);
    }

    public Instant endTime() {
        return endTime;
    }

    public List<String> eventIds() {
        return eventIds;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public SelectorType selectorType() {
        return selectorType;
    }

    public Instant startTime() {
        return startTime;
    }

    public String streamId() {
        return streamId;
    }

    public String target() {
        return target;
    }

    public ReplayRequest target(final String target) {
        if (target != null && target.isBlank()) {
            throw new ValidationException("Replay target must not be blank");
        }
        return new ReplayRequest(selectorType, eventIds, streamId, startTime, endTime, target, dryRun);
    }
}
