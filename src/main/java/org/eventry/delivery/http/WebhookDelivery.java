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

package org.eventry.delivery.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eventry.core.DeliveryException;
import org.eventry.core.Event;
import org.eventry.core.EventDelivery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Delivers events by POSTing them as JSON to an http(s) URL. Any response outside the 2xx range is treated as a failed
 * delivery.
 */
public class WebhookDelivery implements EventDelivery {
    private final HttpClient client;
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final ObjectMapper mapper;
    private final Duration timeout;

    public WebhookDelivery(final Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), new ObjectMapper(), timeout);
    }

    public WebhookDelivery(final HttpClient client, final ObjectMapper mapper, final Duration timeout) {
        this.client = client;
        this.mapper = mapper;
        this.timeout = timeout;
    }

    /**
     * The JSON document that is posted for an event.
     */
    static Map<String, Object> document(final Event event) {
        final Map<String, Object> document = new LinkedHashMap<>();
        document.put("event_id", event.id());
        document.put("event_type", event.type());
        document.put("event_source", event.source().value());
        document.put("event_category", event.category().value());
        document.put("entity_type", event.entityType());
        document.put("entity_id", event.entityId());
        document.put("stream_id", event.streamId());
        document.put("correlation_id", event.correlationId());
        document.put("user_id", event.userId());
        document.put("payload", event.payload());
        document.put("metadata", event.metadata());
        document.put("context", event.context());
        document.put("status", event.status().name().toLowerCase(Locale.ROOT));
        document.put("timestamp", String.valueOf(event.timestamp()));
        document.put("version", event.version());
        document.put("schema_version", event.schemaVersion());
        return document;
    }

    @Override
    public void deliver(final Event event, final String target) throws IOException, InterruptedException {
        final URI uri = uri(target);
        final HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("X-Event-Id", event.id())
                .header("X-Event-Type", event.type())
                .POST(HttpRequest.BodyPublishers.ofString(body(event)))
                .build();

        final HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new DeliveryException(
                    String.format("Webhook rejected event [eventId=%s, status=%d]", event.id(), response.statusCode()));
        }
        log.debug("Webhook delivered [eventId={}, target={}, status={}]", event.id(), target, response.statusCode());
    }

    private String body(final Event event) {
        try {
            return mapper.writeValueAsString(document(event));
        } catch (final JsonProcessingException e) {
            throw new DeliveryException(String.format("Unable to serialize event [eventId=%s]", event.id()), e);
        }
    }

    private URI uri(final String target) {
        final URI uri;
        try {
            uri = URI.create(target);
        } catch (final IllegalArgumentException e) {
            throw new DeliveryException(String.format("Invalid webhook target [target=%s]", target), e);
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            throw new DeliveryException(String.format("Unsupported webhook target [target=%s]", target));
        }
        return uri;
    }
}
