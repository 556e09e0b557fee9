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

import org.skife.jdbi.v2.Handle;

public class H2EventStore extends AbstractJdbcEventStore {
    public H2EventStore(final String jdbcUrl) {
        this(jdbcUrl, true);
    }

    public H2EventStore(final String jdbcUrl, final boolean create) {
        super(jdbcUrl, create);
    }

    @Override
    protected void doCreate(final Handle handle) {
        handle.execute("CREATE TABLE IF NOT EXISTS " +
                "EVENTRY_EVENTS(" +
                "ID BIGINT PRIMARY KEY AUTO_INCREMENT NOT NULL, " +
                "EVENT_ID VARCHAR(255) NOT NULL UNIQUE, " +
                "EVENT_TYPE VARCHAR(255) NOT NULL, " +
                "EVENT_SOURCE VARCHAR(32) NOT NULL, " +
                "EVENT_CATEGORY VARCHAR(32) NOT NULL, " +
                "ENTITY_TYPE VARCHAR(255), " +
                "ENTITY_ID VARCHAR(255), " +
                "STREAM_ID VARCHAR(511), " +
                "CORRELATION_ID VARCHAR(255), " +
                "USER_ID VARCHAR(255), " +
                "PAYLOAD CLOB, " +
                "METADATA CLOB, " +
                "CONTEXT CLOB, " +
                "STATUS VARCHAR(32) NOT NULL, " +
                "RETRY_COUNT INT DEFAULT 0 NOT NULL, " +
                "PROCESSORS CLOB, " +
                "ERROR_MESSAGE CLOB, " +
                "EVENT_TIMESTAMP BIGINT NOT NULL, " +
                "CREATED_AT BIGINT NOT NULL, " +
                "UPDATED_AT BIGINT NOT NULL, " +
                "PROCESSED_AT BIGINT, " +
                "EVENT_VERSION VARCHAR(32), " +
                "SCHEMA_VERSION VARCHAR(32))");

        handle.execute("CREATE INDEX IF NOT EXISTS EVENTRY_EVENTS_STREAM ON EVENTRY_EVENTS(STREAM_ID, ID)");
        handle.execute("CREATE INDEX IF NOT EXISTS EVENTRY_EVENTS_STATUS ON EVENTRY_EVENTS(STATUS, ID)");
        handle.execute("CREATE INDEX IF NOT EXISTS EVENTRY_EVENTS_TIMESTAMP ON EVENTRY_EVENTS(EVENT_TIMESTAMP, ID)");
        handle.execute("CREATE INDEX IF NOT EXISTS EVENTRY_EVENTS_CORRELATION ON EVENTRY_EVENTS(CORRELATION_ID)");

        handle.execute("CREATE TABLE IF NOT EXISTS " +
                "EVENTRY_RESULTS(" +
                "ID BIGINT PRIMARY KEY AUTO_INCREMENT NOT NULL, " +
                "EVENT_ID VARCHAR(255) NOT NULL, " +
                "PROCESSOR_NAME VARCHAR(255) NOT NULL, " +
                "STATUS VARCHAR(32) NOT NULL, " +
                "DURATION_MILLIS BIGINT NOT NULL, " +
                "MESSAGE CLOB, " +
                "PROCESSED_AT BIGINT)");

        handle.execute("CREATE INDEX IF NOT EXISTS EVENTRY_RESULTS_EVENT ON EVENTRY_RESULTS(EVENT_ID, ID)");
    }
}
