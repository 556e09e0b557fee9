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

import java.util.Map;

/**
 * A message published by another back-end service. The type doubles as event type, the data becomes the payload.
 */
public final class BackendMessage {
    private String correlationId;
    private Map<String, Object> data;
    private String id;
    private String source;
    private String subject;
    private String timestamp;
    private String type;
    private String version;

    public String correlationId() {
        return correlationId;
    }

    public BackendMessage correlationId(final String correlationId) {
        this.correlationId = correlationId;
        return this;
    }

    public Map<String, Object> data() {
        return data;
    }

    public BackendMessage data(final Map<String, Object> data) {
        this.data = data;
        return this;
    }

    public String id() {
        return id;
    }

    public BackendMessage id(final String id) {
        this.id = id;
        return this;
    }

    /**
     * The name of the service that published the message.
     */
    public String source() {
        return source;
    }

    public BackendMessage source(final String source) {
        this.source = source;
        return this;
    }

    public String subject() {
        return subject;
    }

    public BackendMessage subject(final String subject) {
        this.subject = subject;
        return this;
    }

    public String timestamp() {
        return timestamp;
    }

    public BackendMessage timestamp(final String timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    public String type() {
        return type;
    }

    public BackendMessage type(final String type) {
        this.type = type;
        return this;
    }

    public String version() {
        return version;
    }

    public BackendMessage version(final String version) {
        this.version = version;
        return this;
    }
}
