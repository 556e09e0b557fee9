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

import static java.util.Objects.requireNonNull;

/**
 * A named, filtered and possibly disabled {@link EventProcessor}. Processors run in the order they were registered.
 */
public final class ProcessorDefinition {
    private final boolean enabled;
    private final ProcessorFilter filter;
    private final String name;
    private final EventProcessor processor;

    public ProcessorDefinition(final String name, final ProcessorFilter filter, final EventProcessor processor, final boolean enabled) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Processor name must not be empty");
        }
        this.name = name;
        this.filter = filter == null ? ProcessorFilter.all() : filter;
        this.processor = requireNonNull(processor, "Processor must not be null");
        this.enabled = enabled;
    }

    public static ProcessorDefinition of(final String name, final EventProcessor processor) {
        return new ProcessorDefinition(name, ProcessorFilter.all(), processor, true);
    }

    public static ProcessorDefinition of(final String name, final ProcessorFilter filter, final EventProcessor processor) {
        return new ProcessorDefinition(name, filter, processor, true);
    }

    /**
     * True if the processor is enabled and its filter matches the event.
     */
    public boolean appliesTo(final Event event) {
        return enabled && filter.matches(event);
    }

    public String name() {
        return name;
    }

    public EventProcessor processor() {
        return processor;
    }
}
