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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.eventry.core.DeliveryException;
import org.eventry.core.Event;
import org.eventry.core.EventCategory;
import org.eventry.core.EventSource;
import org.eventry.core.support.DefaultEvent;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.InputStream;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertEquals;

public class WebhookDeliveryTest {
    private final AtomicReference<String> body = new AtomicReference<>();
    private final AtomicReference<String> eventIdHeader = new AtomicReference<>();
    private HttpServer server;
    private final AtomicInteger status = new AtomicInteger(204);
    private WebhookDelivery webhook;

    @Test
    public void eventIsPostedAsJson() throws Exception {
        // When
        webhook.deliver(event(), target());

        // Then
        assertEquals("evt-1", eventIdHeader.get());
        final Map<?, ?> document = new ObjectMapper().readValue(body.get(), Map.class);
        assertEquals("evt-1", document.get("event_id"));
        assertEquals("order.created", document.get("event_type"));
        assertEquals("order:42", document.get("stream_id"));
        assertEquals("pending", document.get("status"));
        assertEquals(Map.of("amount", 10), document.get("payload"));
    }

    @Test(expected = DeliveryException.class)
    public void errorResponsesFailTheDelivery() throws Exception {
        // Given
        status.set(500);

        // When
        webhook.deliver(event(), target());
    }

    @Test(expected = DeliveryException.class)
    public void onlyHttpTargetsAreAccepted() throws Exception {
        webhook.deliver(event(), "ftp://localhost/hook");
    }

    @Before
    public void setUp() throws Exception {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/hook", exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                body.set(new String(in.readAllBytes(), "UTF-8"));
            }
            eventIdHeader.set(exchange.getRequestHeaders().getFirst("X-Event-Id"));
            exchange.sendResponseHeaders(status.get(), -1);
            exchange.close();
        });
        server.start();
        webhook = new WebhookDelivery(Duration.ofSeconds(5));
    }

    @After
    public void tearDown() {
        server.stop(0);
    }

    private Event event() {
        return DefaultEvent.builder()
                .id("evt-1")
                .type("order.created")
                .source(EventSource.BACKEND)
                .category(EventCategory.ORDER)
                .entity("order", "42")
                .payload(Map.of("amount", 10))
                .timestamp(Instant.now())
                .build();
    }

    private String target() {
        return "http://localhost:" + server.getAddress().getPort() + "/hook";
    }
}
