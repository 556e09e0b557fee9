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

package org.eventry.core.impl;

import org.eventry.core.EventCategory;
import org.eventry.core.EventSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Derives the category of an event from its type. Every origin has an ordered table of (predicate, category) rules which is
 * evaluated top to bottom, the first matching rule wins and the fallback of the origin is used when no rule matches. Types are
 * lower-cased before they are matched.
 *
 * <pre>
 *     CategoryRules rules = CategoryRules.builder()
 *         .rule(EventSource.BACKEND, CategoryRules.contains("refund"), EventCategory.PAYMENT)
 *         .fallback(EventSource.BACKEND, EventCategory.SYSTEM)
 *         .build();
 * </pre>
 */
public final class CategoryRules {
    private static final class Rule {
        private final EventCategory category;
        private final Predicate<String> predicate;

        private Rule(final Predicate<String> predicate, final EventCategory category) {
            this.predicate = predicate;
            this.category = category;
        }
    }

    public static final class Builder {
        private EventCategory defaultFallback = EventCategory.SYSTEM;
        private final Map<EventSource, EventCategory> fallbacks = new EnumMap<>(EventSource.class);
        private final Map<EventSource, List<Rule>> rules = new EnumMap<>(EventSource.class);

        private Builder() {
            // empty
        }

        public CategoryRules build() {
            return new CategoryRules(rules, fallbacks, defaultFallback);
        }

        /**
         * The category used for origins without a fallback of their own.
         */
        public Builder defaultFallback(final EventCategory category) {
            this.defaultFallback = category;
            return this;
        }

        public Builder fallback(final EventSource source, final EventCategory category) {
            fallbacks.put(source, category);
            return this;
        }

        /**
         * Appends a rule to the table of the origin, rules are evaluated in the order they are added.
         */
        public Builder rule(final EventSource source, final Predicate<String> predicate, final EventCategory category) {
            rules.computeIfAbsent(source, s -> new ArrayList<>()).add(new Rule(predicate, category));
            return this;
        }
    }

    private static final CategoryRules DEFAULTS = builder()
            .rule(EventSource.FRONTEND, equalTo("page"), EventCategory.PAGE_VIEW)
            .rule(EventSource.FRONTEND, contains("form"), EventCategory.FORM_SUBMIT)
            .rule(EventSource.FRONTEND, contains("click"), EventCategory.CLICK)
            .fallback(EventSource.FRONTEND, EventCategory.USER_ACTION)
            .rule(EventSource.BACKEND, contains("user"), EventCategory.USER_LIFECYCLE)
            .rule(EventSource.BACKEND, contains("payment"), EventCategory.PAYMENT)
            .rule(EventSource.BACKEND, contains("order"), EventCategory.ORDER)
            .rule(EventSource.BACKEND, contains("task"), EventCategory.TASK)
            .rule(EventSource.BACKEND, contains("device"), EventCategory.DEVICE_STATUS)
            .fallback(EventSource.BACKEND, EventCategory.SYSTEM)
            .fallback(EventSource.IOT_DEVICE, EventCategory.DEVICE_STATUS)
            .build();

    private final EventCategory defaultFallback;
    private final Map<EventSource, EventCategory> fallbacks;
    private final Map<EventSource, List<Rule>> rules;

    private CategoryRules(
            final Map<EventSource, List<Rule>> rules,
            final Map<EventSource, EventCategory> fallbacks,
            final EventCategory defaultFallback) {

        final Map<EventSource, List<Rule>> copy = new EnumMap<>(EventSource.class);
        rules.forEach((source, table) -> copy.put(source, Collections.unmodifiableList(new ArrayList<>(table))));
        this.rules = copy;
        this.fallbacks = new EnumMap<>(fallbacks);
        this.defaultFallback = defaultFallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Predicate<String> contains(final String fragment) {
        return type -> type.contains(fragment);
    }

    /**
     * The built-in tables for front-end and back-end events.
     */
    public static CategoryRules defaults() {
        return DEFAULTS;
    }

    public static Predicate<String> equalTo(final String value) {
        return type -> type.equals(value);
    }

    public EventCategory classify(final EventSource source, final String type) {
        final String normalized = type == null ? "" : type.toLowerCase(Locale.ROOT);
        for (final Rule rule : rules.getOrDefault(source, Collections.emptyList())) {
            if (rule.predicate.test(normalized)) {
                return rule.category;
            }
        }
        return fallbacks.getOrDefault(source, defaultFallback);
    }
}
