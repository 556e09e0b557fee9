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
 * Restricts a processor to an event type and/or an event source, a missing value matches everything.
 */
public final class ProcessorFilter {
    private static final ProcessorFilter ALL = new ProcessorFilter(null, null);

    private final EventSource source;
    private final String type;

    private ProcessorFilter(final String type, final EventSource source) {
        this.type = type;
        this.source = source;
    }

    public static ProcessorFilter all() {
        return ALL;
    }

    public static ProcessorFilter of(final String type, final EventSource source) {
        return new ProcessorFilter(type, source);
    }

    public static ProcessorFilter source(final EventSource source) {
        return new ProcessorFilter(null, source);
    }

    public static ProcessorFilter type(final String type) {
        return new ProcessorFilter(type, null);
    }

    public boolean matches(final Event event) {
        return (type == null || type.equals(event.type())) && (source == null || source == event.source());
    }
}
