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

import java.util.Arrays;

/**
 * Semantic grouping of events, either supplied by the submitter or derived from the event type.
 */
public enum EventCategory {
    // User behaviour
    USER_ACTION("user_action"),
    PAGE_VIEW("page_view"),
    FORM_SUBMIT("form_submit"),
    CLICK("click"),

    // Business
    USER_LIFECYCLE("user_lifecycle"),
    PAYMENT("payment"),
    ORDER("order"),
    TASK("task"),

    // System
    SYSTEM("system"),
    SECURITY("security"),
    PERFORMANCE("performance"),
    ERROR("error"),

    // Devices
    DEVICE("device"),
    DEVICE_STATUS("device_status"),
    TELEMETRY("telemetry"),
    COMMAND("command"),
    ALERT("alert");

    private final String value;

    EventCategory(final String value) {
        this.value = value;
    }

    public static EventCategory fromValue(final String value) {
        return Arrays.stream(values())
                .filter(category -> category.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new ValidationException(String.format("Unknown event category [category=%s]", value)));
    }

    public String value() {
        return value;
    }
}
