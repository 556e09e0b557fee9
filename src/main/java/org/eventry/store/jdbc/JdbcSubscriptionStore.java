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

package org.eventry.store.jdbc;

import org.eventry.core.EventCategory;
import org.eventry.core.EventSource;
import org.eventry.core.InfrastructureException;
import org.eventry.core.Startable;
import org.eventry.core.Subscription;
import org.eventry.core.SubscriptionStore;
import org.eventry.core.support.Resources;
import org.skife.jdbi.v2.DBI;
import org.skife.jdbi.v2.Handle;
import org.skife.jdbi.v2.exceptions.DBIException;
import org.skife.jdbi.v2.tweak.HandleCallback;
import org.skife.jdbi.v2.tweak.ResultSetMapper;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Stores subscriptions in an H2 database, the type, source and category filters are stored as JSON lists.
 */
public class JdbcSubscriptionStore implements SubscriptionStore, AutoCloseable, Startable<SubscriptionStore> {
    private final JsonCodec codec = new JsonCodec();
    private final DBI dbi;
    private final ResultSetMapper<Subscription> subscriptionResultSetMapper = (index, rs, ctx) -> Subscription.builder()
            .id(rs.getString("SUBSCRIPTION_ID"))
            .name(rs.getString("NAME"))
            .eventTypes(new LinkedHashSet<>(codec.list(rs.getString("EVENT_TYPES"))))
            .eventSources(codec.list(rs.getString("EVENT_SOURCES")).stream()
                    .map(EventSource::fromValue)
                    .collect(Collectors.toSet()))
            .eventCategories(codec.list(rs.getString("EVENT_CATEGORIES")).stream()
                    .map(EventCategory::fromValue)
                    .collect(Collectors.toSet()))
            .target(rs.getString("TARGET"))
            .enabled(rs.getBoolean("ENABLED"))
            .createdAt(Instant.ofEpochMilli(rs.getLong("CREATED_AT")))
            .updatedAt(Instant.ofEpochMilli(rs.getLong("UPDATED_AT")))
            .build();
    private Handle writeHandle;

    public JdbcSubscriptionStore(final String jdbcUrl) {
        this.dbi = new DBI(jdbcUrl);
    }

    @Override
    public List<Subscription> all() {
        return withHandle(handle -> handle.createQuery(
                "SELECT * FROM EVENTRY_SUBSCRIPTIONS ORDER BY CREATED_AT ASC, SUBSCRIPTION_ID ASC")
                .map(subscriptionResultSetMapper)
                .list());
    }

    @Override
    public void close() {
        Resources.close(writeHandle);
    }

    @Override
    public Optional<Subscription> get(final String subscriptionId) {
        return withHandle(handle -> Optional.ofNullable(handle.createQuery(
                "SELECT * FROM EVENTRY_SUBSCRIPTIONS WHERE SUBSCRIPTION_ID = :id")
                .bind("id", subscriptionId)
                .map(subscriptionResultSetMapper)
                .first()));
    }

    @Override
    public void save(final Subscription subscription) {
        withHandle(handle -> handle.createStatement(
                "MERGE INTO EVENTRY_SUBSCRIPTIONS(SUBSCRIPTION_ID, NAME, EVENT_TYPES, EVENT_SOURCES, EVENT_CATEGORIES, " +
                        "TARGET, ENABLED, CREATED_AT, UPDATED_AT) KEY(SUBSCRIPTION_ID) VALUES(" +
                        ":id, :name, :eventTypes, :eventSources, :eventCategories, :target, :enabled, :createdAt, :updatedAt)")
                .bind("id", subscription.id())
                .bind("name", subscription.name())
                .bind("eventTypes", codec.encode(subscription.eventTypes()))
                .bind("eventSources", codec.encode(subscription.eventSources().stream()
                        .map(EventSource::value)
                        .collect(Collectors.toList())))
                .bind("eventCategories", codec.encode(subscription.eventCategories().stream()
                        .map(EventCategory::value)
                        .collect(Collectors.toList())))
                .bind("target", subscription.target())
                .bind("enabled", subscription.isEnabled())
                .bind("createdAt", subscription.createdAt().toEpochMilli())
                .bind("updatedAt", subscription.updatedAt().toEpochMilli())
                .execute());
    }

    @Override
    public SubscriptionStore start() {
        try {
            writeHandle = dbi.open();
            writeHandle.execute("CREATE TABLE IF NOT EXISTS " +
                    "EVENTRY_SUBSCRIPTIONS(" +
                    "SUBSCRIPTION_ID VARCHAR(255) PRIMARY KEY NOT NULL, " +
                    "NAME VARCHAR(255), " +
                    "EVENT_TYPES CLOB NOT NULL, " +
                    "EVENT_SOURCES CLOB, " +
                    "EVENT_CATEGORIES CLOB, " +
                    "TARGET VARCHAR(2048) NOT NULL, " +
                    "ENABLED BOOLEAN NOT NULL, " +
                    "CREATED_AT BIGINT NOT NULL, " +
                    "UPDATED_AT BIGINT NOT NULL)");
        } catch (final DBIException e) {
            throw new InfrastructureException("Unable to start the subscription store", e);
        }
        return this;
    }

    private <T> T withHandle(final HandleCallback<T> callback) {
        try {
            return dbi.withHandle(callback);
        } catch (final DBIException e) {
            throw new InfrastructureException("Subscription store operation failed", e);
        }
    }
}
