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
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A standing registration that triggers delivery to a target whenever a processed event matches the criteria. The event
 * types are required, sources and categories are optional and act as wildcards when empty.
 */
public final class Subscription {
    public static final class Builder {
        private Instant createdAt;
        private boolean enabled = true;
        private final Set<EventCategory> eventCategories = EnumSet.noneOf(EventCategory.class);
        private final Set<EventSource> eventSources = EnumSet.noneOf(EventSource.class);
        private final Set<String> eventTypes = new LinkedHashSet<>();
        private String id;
        private String name;
        private String target;
        private Instant updatedAt;

        private Builder() {
            // empty
        }

        /**
         * @throws ValidationException if no event type or no target has been provided.
         */
        public Subscription build() {
            if (eventTypes.isEmpty()) {
                throw new ValidationException("A subscription requires at least one event type");
            }
            if (eventTypes.stream().anyMatch(type -> type == null || type.isBlank())) {
                throw new ValidationException("Subscription event types must not be empty");
            }
            if (target == null || target.isBlank()) {
                throw new ValidationException("A subscription requires a delivery target");
            }
            if (id == null) {
                id = UUID.randomUUID().toString();
            }
            if (name == null) {
                name = id;
            }
            final Instant now = Instant.now();
            if (createdAt == null) {
                createdAt = now;
            }
            if (updatedAt == null) {
                updatedAt = createdAt;
            }
            return new Subscription(this);
        }

        public Builder createdAt(final Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder enabled(final boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder eventCategories(final EventCategory... categories) {
            return eventCategories(new LinkedHashSet<>(Arrays.asList(categories)));
        }

        public Builder eventCategories(final Set<EventCategory> categories) {
            this.eventCategories.addAll(categories);
            return this;
        }

        public Builder eventSources(final EventSource... sources) {
            return eventSources(new LinkedHashSet<>(Arrays.asList(sources)));
        }

        public Builder eventSources(final Set<EventSource> sources) {
            this.eventSources.addAll(sources);
            return this;
        }

        public Builder eventTypes(final String... types) {
            return eventTypes(new LinkedHashSet<>(Arrays.asList(types)));
        }

        public Builder eventTypes(final Set<String> types) {
            this.eventTypes.addAll(types);
            return this;
        }

        public Builder id(final String id) {
            this.id = id;
            return this;
        }

        public Builder name(final String name) {
            this.name = name;
            return this;
        }

        public Builder target(final String target) {
            this.target = target;
            return this;
        }

        public Builder updatedAt(final Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }
    }

    private final Instant createdAt;
    private final boolean enabled;
    private final Set<EventCategory> eventCategories;
    private final Set<EventSource> eventSources;
    private final Set<String> eventTypes;
    private final String id;
    private final String name;
    private final String target;
    private final Instant updatedAt;

    private Subscription(final Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.eventTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.eventTypes));
        this.eventSources = Collections.unmodifiableSet(EnumSet.copyOf(builder.eventSources));
        this.eventCategories = Collections.unmodifiableSet(EnumSet.copyOf(builder.eventCategories));
        this.target = builder.target;
        this.enabled = builder.enabled;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Set<EventCategory> eventCategories() {
        return eventCategories;
    }

    public Set<EventSource> eventSources() {
        return eventSources;
    }

    public Set<String> eventTypes() {
        return eventTypes;
    }

    public String id() {
        return id;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Checks whether the event satisfies every populated criterion. A disabled subscription never matches.
     */
    public boolean matches(final Event event) {
        return enabled
                && eventTypes.contains(event.type())
                && (eventSources.isEmpty() || eventSources.contains(event.source()))
                && (eventCategories.isEmpty() || eventCategories.contains(event.category()));
    }

    public String name() {
        return name;
    }

    public String target() {
        return target;
    }

    @Override
    public String toString() {
        return "Subscription[id=" + id + ", name=" + name + ", types=" + eventTypes + ", enabled=" + enabled + "]";
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /**
     * Returns a copy with the enabled flag changed.
     */
    public Subscription withEnabled(final boolean enabled) {
        return builder()
                .id(id)
                .name(name)
                .eventTypes(eventTypes)
                .eventSources(eventSources)
                .eventCategories(eventCategories)
                .target(target)
                .enabled(enabled)
                .createdAt(createdAt)
                .updatedAt(Instant.now())
                .build();
    }
}
