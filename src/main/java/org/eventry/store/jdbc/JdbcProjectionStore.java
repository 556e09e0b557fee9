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

import org.eventry.core.InfrastructureException;
import org.eventry.core.Projection;
import org.eventry.core.ProjectionStore;
import org.eventry.core.Startable;
import org.eventry.core.support.Resources;
import org.skife.jdbi.v2.DBI;
import org.skife.jdbi.v2.Handle;
import org.skife.jdbi.v2.exceptions.DBIException;
import org.skife.jdbi.v2.tweak.HandleCallback;
import org.skife.jdbi.v2.tweak.ResultSetMapper;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Stores projections in an H2 database with the materialized state as a JSON document.
 */
public class JdbcProjectionStore implements ProjectionStore, AutoCloseable, Startable<ProjectionStore> {
    private final JsonCodec codec = new JsonCodec();
    private final DBI dbi;
    private final ResultSetMapper<Projection> projectionResultSetMapper = (index, rs, ctx) -> new Projection(
            rs.getString("PROJECTION_ID"),
            rs.getString("NAME"),
            rs.getString("ENTITY_TYPE"),
            rs.getString("ENTITY_ID"),
            codec.map(rs.getString("STATE")),
            rs.getLong("PROJECTION_VERSION"),
            rs.getString("LAST_APPLIED_EVENT_ID"),
            Instant.ofEpochMilli(rs.getLong("UPDATED_AT")));
    private Handle writeHandle;

    public JdbcProjectionStore(final String jdbcUrl) {
        this.dbi = new DBI(jdbcUrl);
    }

    @Override
    public void close() {
        Resources.close(writeHandle);
    }

    @Override
    public List<Projection> forStream(final String entityType, final String entityId) {
        return withHandle(handle -> handle.createQuery(
                "SELECT * FROM EVENTRY_PROJECTIONS WHERE ENTITY_TYPE = :entityType AND ENTITY_ID = :entityId")
                .bind("entityType", entityType)
                .bind("entityId", entityId)
                .map(projectionResultSetMapper)
                .list());
    }

    @Override
    public Optional<Projection> get(final String projectionId) {
        return withHandle(handle -> Optional.ofNullable(handle.createQuery(
                "SELECT * FROM EVENTRY_PROJECTIONS WHERE PROJECTION_ID = :id")
                .bind("id", projectionId)
                .map(projectionResultSetMapper)
                .first()));
    }

    @Override
    public void save(final Projection projection) {
        withHandle(handle -> handle.createStatement(
                "MERGE INTO EVENTRY_PROJECTIONS(PROJECTION_ID, NAME, ENTITY_TYPE, ENTITY_ID, STATE, PROJECTION_VERSION, " +
                        "LAST_APPLIED_EVENT_ID, UPDATED_AT) KEY(PROJECTION_ID) VALUES(" +
                        ":id, :name, :entityType, :entityId, :state, :version, :lastAppliedEventId, :updatedAt)")
                .bind("id", projection.id())
                .bind("name", projection.name())
                .bind("entityType", projection.entityType())
                .bind("entityId", projection.entityId())
                .bind("state", codec.encode(projection.state()))
                .bind("version", projection.version())
                .bind("lastAppliedEventId", projection.lastAppliedEventId())
                .bind("updatedAt", projection.updatedAt().toEpochMilli())
                .execute());
    }

    @Override
    public ProjectionStore start() {
        try {
            writeHandle = dbi.open();
            writeHandle.execute("CREATE TABLE IF NOT EXISTS " +
                    "EVENTRY_PROJECTIONS(" +
                    "PROJECTION_ID VARCHAR(1024) PRIMARY KEY NOT NULL, " +
                    "NAME VARCHAR(255) NOT NULL, " +
                    "ENTITY_TYPE VARCHAR(255) NOT NULL, " +
                    "ENTITY_ID VARCHAR(255) NOT NULL, " +
                    "STATE CLOB, " +
                    "PROJECTION_VERSION BIGINT NOT NULL, " +
                    "LAST_APPLIED_EVENT_ID VARCHAR(255), " +
                    "UPDATED_AT BIGINT NOT NULL)");
            writeHandle.execute("CREATE INDEX IF NOT EXISTS EVENTRY_PROJECTIONS_STREAM " +
                    "ON EVENTRY_PROJECTIONS(ENTITY_TYPE, ENTITY_ID)");
        } catch (final DBIException e) {
            throw new InfrastructureException("Unable to start the projection store", e);
        }
        return this;
    }

    private <T> T withHandle(final HandleCallback<T> callback) {
        try {
            return dbi.withHandle(callback);
        } catch (final DBIException e) {
            throw new InfrastructureException("Projection store operation failed", e);
        }
    }
}
