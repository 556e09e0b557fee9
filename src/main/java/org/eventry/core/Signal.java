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

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A fire-and-forget notification. Signals are serializable since they travel over the broadcast channel, the data should
 * therefore only contain simple values (strings, numbers, booleans and lists of those).
 */
public final class Signal implements Serializable {
    private static final long serialVersionUID = 1L;

    private final LinkedHashMap<String, Object> data;
    private final long timestamp;
    private final SignalType type;

    public Signal(final SignalType type, final Map<String, Object> data) {
        this.type = requireNonNull(type, "Signal type must not be null");
        this.data = new LinkedHashMap<>(data);
        this.timestamp = System.currentTimeMillis();
    }

    public Map<String, Object> data() {
        return Collections.unmodifiableMap(data);
    }

    public long timestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "Signal[type=" + type.value() + ", data=" + data + "]";
    }

    public SignalType type() {
        return type;
    }
}
