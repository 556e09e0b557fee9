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

import java.util.Map;

/**
 * A front-end analytics call as sent by tracking SDKs. The message type is "track", "page", "identify" and so on, the event
 * is the name of what was tracked. Timestamps are ISO-8601 strings as received.
 */
public final class TrackingEvent {
    private String anonymousId;
    private Map<String, Object> context;
    private String event;
    private String originalTimestamp;
    private Map<String, Object> properties;
    private String receivedAt;
    private String sentAt;
    private String timestamp;
    private String type;
    private String userId;

    public String anonymousId() {
        return anonymousId;
    }

    public TrackingEvent anonymousId(final String anonymousId) {
        this.anonymousId = anonymousId;
        return this;
    }

    public Map<String, Object> context() {
        return context;
    }

    public TrackingEvent context(final Map<String, Object> context) {
        this.context = context;
        return this;
    }

    public String event() {
        return event;
    }

    public TrackingEvent event(final String event) {
        this.event = event;
        return this;
    }

    public String originalTimestamp() {
        return originalTimestamp;
    }

    public TrackingEvent originalTimestamp(final String originalTimestamp) {
        this.originalTimestamp = originalTimestamp;
        return this;
    }

    public Map<String, Object> properties() {
        return properties;
    }

    public TrackingEvent properties(final Map<String, Object> properties) {
        this.properties = properties;
        return this;
    }

    public String receivedAt() {
        return receivedAt;
    }

    public TrackingEvent receivedAt(final String receivedAt) {
        this.receivedAt = receivedAt;
        return this;
    }

    public String sentAt() {
        return sentAt;
    }

    public TrackingEvent sentAt(final String sentAt) {
        this.sentAt = sentAt;
        return this;
    }

    public String timestamp() {
        return timestamp;
    }

    public TrackingEvent timestamp(final String timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    public String type() {
        return type;
    }

    public TrackingEvent type(final String type) {
        this.type = type;
        return this;
    }

    public String userId() {
        return userId;
    }

    public TrackingEvent userId(final String userId) {
        this.userId = userId;
        return this;
    }
}
