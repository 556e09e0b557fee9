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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventry.core.InfrastructureException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes the free-form columns (payload, metadata, context, processor lists and subscription filters) as JSON text.
 */
class JsonCodec {
    private static final TypeReference<List<String>> LIST = new TypeReference<List<String>>() {
    };
    private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<LinkedHashMap<String, Object>>() {
    };

    private final ObjectMapper mapper;

    JsonCodec() {
        this(new ObjectMapper());
    }

    JsonCodec(final ObjectMapper mapper) {
        this.mapper = mapper;
    }

    String encode(final Object value) {
        if (value == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(value);
        } catch (final JsonProcessingException e) {
            throw new InfrastructureException("Unable to encode value as JSON", e);
        }
    }

    List<String> list(final String json) {
        if (json == null) {
            return Collections.emptyList();
        }
        return read(json, LIST);
    }

    Map<String, Object> map(final String json) {
        if (json == null) {
            return Collections.emptyMap();
        }
        return read(json, MAP);
    }

    private <T> T read(final String json, final TypeReference<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (final JsonProcessingException e) {
            throw new InfrastructureException("Unable to decode JSON column", e);
        }
    }
}
