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

/**
 * The notifications that are broadcast when something noteworthy has happened.
 */
public enum SignalType {
    EVENT_STORED("event.stored"),
    EVENT_PROCESSED_SUCCESS("event.processed.success"),
    EVENT_PROCESSED_FAILED("event.processed.failed"),
    SUBSCRIPTION_CREATED("event.subscription.created"),
    REPLAY_STARTED("event.replay.started"),
    PROJECTION_CREATED("event.projection.created");

    private final String value;

    SignalType(final String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
