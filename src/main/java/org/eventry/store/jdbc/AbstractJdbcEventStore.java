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

import org.eventry.core.Event;
import org.eventry.core.EventCategory;
import org.eventry.core.EventPage;
import org.eventry.core.EventQuery;
import org.eventry.core.EventSource;
import org.eventry.core.EventStatistics;
import org.eventry.core.EventStatus;
import org.eventry.core.EventStore;
import org.eventry.core.EventStream;
import org.eventry.core.InfrastructureException;
import org.eventry.core.ProcessingResult;
import org.eventry.core.ProcessingStatus;
import org.eventry.core.StatusChange;
import org.eventry.core.Startable;
import org.eventry.core.support.DefaultEvent;
import org.eventry.core.support.Resources;
import org.skife.jdbi.v2.DBI;
import org.skife.jdbi.v2.Handle;
import org.skife.jdbi.v2.exceptions.DBIException;
import org.skife.jdbi.v2.tweak.HandleCallback;
import org.skife.jdbi.v2.tweak.ResultSetMapper;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.AbstractMap.SimpleEntry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Base class for JDBC-based EventStores. The statements are provided by protected methods so that dialects can override them,
 * the table layout is created by the subclass in {@link #doCreate(Handle)}. Timestamps are stored as epoch millis.
 */
public abstract class AbstractJdbcEventStore implements EventStore, AutoCloseable, Startable<EventStore> {
    private static final String EVENT_COLUMNS = "ID, EVENT_ID, EVENT_TYPE, EVENT_SOURCE, EVENT_CATEGORY, ENTITY_TYPE, ENTITY_ID, " +
            "CORRELATION_ID, USER_ID, PAYLOAD, METADATA, CONTEXT, STATUS, RETRY_COUNT, PROCESSORS, ERROR_MESSAGE, " +
            "EVENT_TIMESTAMP, CREATED_AT, UPDATED_AT, PROCESSED_AT, EVENT_VERSION, SCHEMA_VERSION";

    private final JsonCodec codec = new JsonCodec();
    private final boolean create;
    private final DBI dbi;
    private final ResultSetMapper<Event> eventResultSetMapper = (index, rs, ctx) -> DefaultEvent.builder()
            .sequence(rs.getLong("ID"))
            .id(rs.getString("EVENT_ID"))
            .type(rs.getString("EVENT_TYPE"))
            .source(EventSource.fromValue(rs.getString("EVENT_SOURCE")))
            .category(EventCategory.fromValue(rs.getString("EVENT_CATEGORY")))
            .entity(rs.getString("ENTITY_TYPE"), rs.getString("ENTITY_ID"))
            .correlationId(rs.getString("CORRELATION_ID"))
            .userId(rs.getString("USER_ID"))
            .payload(codec.map(rs.getString("PAYLOAD")))
            .metadata(codec.map(rs.getString("METADATA")))
            .context(codec.map(rs.getString("CONTEXT")))
            .status(EventStatus.valueOf(rs.getString("STATUS")))
            .retryCount(rs.getInt("RETRY_COUNT"))
            .processors(codec.list(rs.getString("PROCESSORS")))
            .errorMessage(rs.getString("ERROR_MESSAGE"))
            .timestamp(instant(rs.getObject("EVENT_TIMESTAMP", Long.class)))
            .createdAt(instant(rs.getObject("CREATED_AT", Long.class)))
            .updatedAt(instant(rs.getObject("UPDATED_AT", Long.class)))
            .processedAt(instant(rs.getObject("PROCESSED_AT", Long.class)))
            .version(rs.getString("EVENT_VERSION"))
            .schemaVersion(rs.getString("SCHEMA_VERSION"))
            .build();
    private final ResultSetMapper<ProcessingResult> resultResultSetMapper = (index, rs, ctx) -> new ProcessingResult(
            rs.getString("EVENT_ID"),
            rs.getString("PROCESSOR_NAME"),
            ProcessingStatus.valueOf(rs.getString("STATUS")),
            rs.getLong("DURATION_MILLIS"),
            rs.getString("MESSAGE"),
            instant(rs.getObject("PROCESSED_AT", Long.class)));
    private Handle writeHandle;

    protected AbstractJdbcEventStore(final String jdbcUrl, final boolean create) {
        this.dbi = new DBI(jdbcUrl);
        this.create = create;
    }

    private static Instant instant(final Long millis) {
        return millis == null ? null : Instant.ofEpochMilli(millis);
    }

    private static Long millis(final Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    @Override
    public Event append(final Event event) {
        final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        final Event stored = DefaultEvent.from(event)
                .id(event.id() == null ? UUID.randomUUID().toString() : event.id())
                .timestamp(event.timestamp() == null ? now : event.timestamp().truncatedTo(ChronoUnit.MILLIS))
                .createdAt(now)
                .updatedAt(now)
                .build();

        return withHandle(handle -> {
            final int numberOfRecords = handle.createStatement(sqlInsertEvent())
                    .bind("eventId", stored.id())
                    .bind("eventType", stored.type())
                    .bind("eventSource", stored.source().value())
                    .bind("eventCategory", stored.category().value())
                    .bind("entityType", stored.entityType())
                    .bind("entityId", stored.entityId())
                    .bind("streamId", stored.streamId())
                    .bind("correlationId", stored.correlationId())
                    .bind("userId", stored.userId())
                    .bind("payload", codec.encode(stored.payload()))
                    .bind("metadata", codec.encode(stored.metadata()))
                    .bind("context", codec.encode(stored.context()))
                    .bind("status", stored.status().name())
                    .bind("retryCount", stored.retryCount())
                    .bind("processors", codec.encode(stored.processors()))
                    .bind("errorMessage", stored.errorMessage())
                    .bind("eventTimestamp", millis(stored.timestamp()))
                    .bind("createdAt", millis(stored.createdAt()))
                    .bind("updatedAt", millis(stored.updatedAt()))
                    .bind("processedAt", millis(stored.processedAt()))
                    .bind("eventVersion", stored.version())
                    .bind("schemaVersion", stored.schemaVersion())
                    .execute();

            if (numberOfRecords != 1) {
                throw new InfrastructureException(String.format("Unable to insert event in event store [id=%s]", stored.id()));
            }
            return find(handle, stored.id())
                    .orElseThrow(() -> new InfrastructureException(String.format("Inserted event not found [id=%s]", stored.id())));
        });
    }

    /**
     * The update only matches rows that are still in the expected status (and below the retry limit of the change), so
     * exactly one concurrent caller observes a single updated row.
     */
    @Override
    public boolean claimAndMark(final String eventId, final EventStatus expectedStatus, final StatusChange change) {
        return withHandle(handle -> {
            final Optional<Event> current = find(handle, eventId);
            if (current.isEmpty() || current.get().status() != expectedStatus
                    || !change.permitsRetryCount(current.get().retryCount())) {
                return false;
            }
            final Event next = DefaultEvent.apply(current.get(), change, Instant.now().truncatedTo(ChronoUnit.MILLIS));

            return handle.createStatement(sqlClaimAndMark())
                    .bind("status", next.status().name())
                    .bind("errorMessage", next.errorMessage())
                    .bind("processors", codec.encode(next.processors()))
                    .bind("processedAt", millis(next.processedAt()))
                    .bind("updatedAt", millis(next.updatedAt()))
                    .bind("retryIncrement", change.isRetryIncrement() ? 1 : 0)
                    .bind("eventId", eventId)
                    .bind("expectedStatus", expectedStatus.name())
                    .bind("retryLimit", change.retryLimit() == null ? Integer.MAX_VALUE : change.retryLimit())
                    .execute() == 1;
        });
    }

    @Override
    public void close() {
        Resources.close(writeHandle);
    }

    @Override
    public Optional<Event> get(final String eventId) {
        return withHandle(handle -> find(handle, eventId));
    }

    @Override
    public EventPage query(final EventQuery query) {
        final Where where = new Where()
                .and("USER_ID = :userId", "userId", query.userId())
                .and("ENTITY_TYPE = :entityType", "entityType", query.entityType())
                .and("ENTITY_ID = :entityId", "entityId", query.entityId())
                .and("EVENT_TYPE = :eventType", "eventType", query.type())
                .and("EVENT_SOURCE = :eventSource", "eventSource", query.source() == null ? null : query.source().value())
                .and("EVENT_CATEGORY = :eventCategory", "eventCategory", query.category() == null ? null : query.category().value())
                .and("STATUS = :status", "status", query.status() == null ? null : query.status().name())
                .and("CORRELATION_ID = :correlationId", "correlationId", query.correlationId())
                .and("EVENT_TIMESTAMP >= :startTime", "startTime", millis(query.startTime()))
                .and("EVENT_TIMESTAMP <= :endTime", "endTime", millis(query.endTime()));

        return withHandle(handle -> {
            final long total = handle.createQuery(sqlCountEvents(where.sql()))
                    .bindFromMap(where.params())
                    .map((index, rs, ctx) -> rs.getLong(1))
                    .first();

            final List<Event> items = handle.createQuery(sqlQueryEvents(where.sql()))
                    .bindFromMap(where.params())
                    .bind("limit", query.limit())
                    .bind("offset", query.offset())
                    .map(eventResultSetMapper)
                    .list();

            return new EventPage(items, total, query.limit(), query.offset());
        });
    }

    @Override
    public List<Event> range(final Instant start, final Instant end) {
        return withHandle(handle -> handle.createQuery(sqlSelectRange())
                .bind("startTime", millis(start))
                .bind("endTime", millis(end))
                .map(eventResultSetMapper)
                .list());
    }

    @Override
    public EventStream readStream(final String streamId, final Long fromVersion) {
        EventStream.parse(streamId);
        final long skip = fromVersion == null ? 0 : Math.max(0, fromVersion);

        return withHandle(handle -> {
            final long version = handle.createQuery(sqlCountStream())
                    .bind("streamId", streamId)
                    .map((index, rs, ctx) -> rs.getLong(1))
                    .first();

            final List<Event> events = handle.createQuery(sqlSelectStream())
                    .bind("streamId", streamId)
                    .bind("skip", skip)
                    .map(eventResultSetMapper)
                    .list();

            return new EventStream(streamId, events, version);
        });
    }

    @Override
    public void record(final ProcessingResult result) {
        withHandle(handle -> handle.createStatement(sqlInsertResult())
                .bind("eventId", result.eventId())
                .bind("processorName", result.processorName())
                .bind("status", result.status().name())
                .bind("durationMillis", result.durationMillis())
                .bind("message", result.message())
                .bind("processedAt", millis(result.processedAt()))
                .execute());
    }

    @Override
    public List<ProcessingResult> results(final String eventId) {
        return withHandle(handle -> handle.createQuery(sqlSelectResults())
                .bind("eventId", eventId)
                .map(resultResultSetMapper)
                .list());
    }

    @Override
    public List<Event> retryCandidates(final int maxRetries, final int batchSize) {
        return withHandle(handle -> handle.createQuery(sqlSelectRetryCandidates())
                .bind("status", EventStatus.FAILED.name())
                .bind("maxRetries", maxRetries)
                .bind("limit", batchSize)
                .map(eventResultSetMapper)
                .list());
    }

    @Override
    public EventStore start() {
        try {
            writeHandle = dbi.open();
            if (create) {
                doCreate(writeHandle);
            }
        } catch (final DBIException e) {
            throw new InfrastructureException("Unable to start the event store", e);
        }
        return this;
    }

    @Override
    public EventStatistics statistics(final String userId) {
        final Where where = new Where().and("USER_ID = :userId", "userId", userId);

        return withHandle(handle -> {
            final Map<String, Long> byStatus = group(handle, "STATUS", where);
            return new EventStatistics(
                    byStatus.values().stream().mapToLong(Long::longValue).sum(),
                    byStatus.getOrDefault(EventStatus.PENDING.name(), 0L),
                    byStatus.getOrDefault(EventStatus.PROCESSING.name(), 0L),
                    byStatus.getOrDefault(EventStatus.PROCESSED.name(), 0L),
                    byStatus.getOrDefault(EventStatus.FAILED.name(), 0L),
                    group(handle, "EVENT_SOURCE", where),
                    group(handle, "EVENT_CATEGORY", where),
                    group(handle, "EVENT_TYPE", where));
        });
    }

    @Override
    public List<Event> unprocessed(final int limit) {
        return withHandle(handle -> handle.createQuery(sqlSelectUnprocessed())
                .bind("pending", EventStatus.PENDING.name())
                .bind("processing", EventStatus.PROCESSING.name())
                .bind("limit", limit)
                .map(eventResultSetMapper)
                .list());
    }

    protected void doCreate(final Handle writeHandle) {
        // Default to nothing
    }

    protected String sqlClaimAndMark() {
        return "UPDATE EVENTRY_EVENTS SET " +
                "STATUS = :status, ERROR_MESSAGE = :errorMessage, PROCESSORS = :processors, PROCESSED_AT = :processedAt, " +
                "UPDATED_AT = :updatedAt, RETRY_COUNT = RETRY_COUNT + :retryIncrement " +
                "WHERE EVENT_ID = :eventId AND STATUS = :expectedStatus AND RETRY_COUNT < :retryLimit";
    }

    protected String sqlCountEvents(final String where) {
        return "SELECT COUNT(*) FROM EVENTRY_EVENTS" + where;
    }

    protected String sqlCountStream() {
        return "SELECT COUNT(*) FROM EVENTRY_EVENTS WHERE STREAM_ID = :streamId";
    }

    protected String sqlGroupEvents(final String column, final String where) {
        return "SELECT " + column + " AS GROUP_KEY, COUNT(*) AS GROUP_COUNT FROM EVENTRY_EVENTS" + where +
                " GROUP BY " + column + " ORDER BY " + column;
    }

    protected String sqlInsertEvent() {
        return "INSERT INTO EVENTRY_EVENTS(" +
                "EVENT_ID, EVENT_TYPE, EVENT_SOURCE, EVENT_CATEGORY, ENTITY_TYPE, ENTITY_ID, STREAM_ID, CORRELATION_ID, " +
                "USER_ID, PAYLOAD, METADATA, CONTEXT, STATUS, RETRY_COUNT, PROCESSORS, ERROR_MESSAGE, EVENT_TIMESTAMP, " +
                "CREATED_AT, UPDATED_AT, PROCESSED_AT, EVENT_VERSION, SCHEMA_VERSION) VALUES(" +
                ":eventId, :eventType, :eventSource, :eventCategory, :entityType, :entityId, :streamId, :correlationId, " +
                ":userId, :payload, :metadata, :context, :status, :retryCount, :processors, :errorMessage, :eventTimestamp, " +
                ":createdAt, :updatedAt, :processedAt, :eventVersion, :schemaVersion)";
    }

    protected String sqlInsertResult() {
        return "INSERT INTO EVENTRY_RESULTS(EVENT_ID, PROCESSOR_NAME, STATUS, DURATION_MILLIS, MESSAGE, PROCESSED_AT) " +
                "VALUES(:eventId, :processorName, :status, :durationMillis, :message, :processedAt)";
    }

    protected String sqlQueryEvents(final String where) {
        return "SELECT " + EVENT_COLUMNS + " FROM EVENTRY_EVENTS" + where +
                " ORDER BY EVENT_TIMESTAMP DESC, ID DESC LIMIT :limit OFFSET :offset";
    }

    protected String sqlSelectOneEvent() {
        return "SELECT " + EVENT_COLUMNS + " FROM EVENTRY_EVENTS WHERE EVENT_ID = :eventId";
    }

    protected String sqlSelectRange() {
        return "SELECT " + EVENT_COLUMNS + " FROM EVENTRY_EVENTS " +
                "WHERE EVENT_TIMESTAMP >= :startTime AND EVENT_TIMESTAMP <= :endTime " +
                "ORDER BY EVENT_TIMESTAMP ASC, ID ASC";
    }

    protected String sqlSelectResults() {
        return "SELECT EVENT_ID, PROCESSOR_NAME, STATUS, DURATION_MILLIS, MESSAGE, PROCESSED_AT " +
                "FROM EVENTRY_RESULTS WHERE EVENT_ID = :eventId ORDER BY ID ASC";
    }

    protected String sqlSelectRetryCandidates() {
        return "SELECT " + EVENT_COLUMNS + " FROM EVENTRY_EVENTS " +
                "WHERE STATUS = :status AND RETRY_COUNT < :maxRetries ORDER BY ID ASC LIMIT :limit";
    }

    protected String sqlSelectUnprocessed() {
        return "SELECT " + EVENT_COLUMNS + " FROM EVENTRY_EVENTS " +
                "WHERE STATUS IN (:pending, :processing) ORDER BY ID ASC LIMIT :limit";
    }

    protected String sqlSelectStream() {
        return "SELECT " + EVENT_COLUMNS + " FROM EVENTRY_EVENTS WHERE STREAM_ID = :streamId ORDER BY ID ASC OFFSET :skip ROWS";
    }

    private Optional<Event> find(final Handle handle, final String eventId) {
        return Optional.ofNullable(handle.createQuery(sqlSelectOneEvent())
                .bind("eventId", eventId)
                .map(eventResultSetMapper)
                .first());
    }

    private Map<String, Long> group(final Handle handle, final String column, final Where where) {
        final Map<String, Long> groups = new LinkedHashMap<>();
        handle.createQuery(sqlGroupEvents(column, where.sql()))
                .bindFromMap(where.params())
                .map((index, rs, ctx) -> new SimpleEntry<>(rs.getString("GROUP_KEY"), rs.getLong("GROUP_COUNT")))
                .list()
                .forEach(entry -> groups.put(entry.getKey(), entry.getValue()));
        return groups;
    }

    private <T> T withHandle(final HandleCallback<T> callback) {
        try {
            return dbi.withHandle(callback);
        } catch (final DBIException e) {
            throw new InfrastructureException("Event store operation failed", e);
        }
    }

    /**
     * Collects the conditions of a dynamic WHERE clause, conditions with a null value are left out.
     */
    private static final class Where {
        private final Map<String, Object> params = new LinkedHashMap<>();
        private final StringBuilder sql = new StringBuilder();

        Where and(final String condition, final String name, final Object value) {
            if (value != null) {
                sql.append(sql.length() == 0 ? " WHERE " : " AND ").append(condition);
                params.put(name, value);
            }
            return this;
        }

        Map<String, Object> params() {
            return params;
        }

        String sql() {
            return sql.toString();
        }
    }
}
