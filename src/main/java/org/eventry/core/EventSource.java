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
 * Where an event originated. The source selects the category rules used during ingestion.
 */
public enum EventSource {
    FRONTEND("frontend"),
    BACKEND("backend"),
    SYSTEM("system"),
    IOT_DEVICE("iot_device"),
    EXTERNAL_API("external_api"),
    SCHEDULED("scheduled");

    private final String value;

    EventSource(final String value) {
        this.value = value;
    }

    public static EventSource fromValue(final String value) {
        return Arrays.stream(values())
                .filter(source -> source.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new ValidationException(String.format("Unknown event source [source=%s]", value)));
    }

    public String value() {
        return value;
    }
}
