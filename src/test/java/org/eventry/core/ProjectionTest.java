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

import org.eventry.core.support.DefaultEvent;
import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ProjectionTest {
    @Test
    public void applyKeepsTheLastPayloadPerType() {
        // Given
        final Projection empty = Projection.empty(null, "device", "9");

        // When
        final Projection projection = empty
                .apply(event("e1", "status", Map.of("value", "on")))
                .apply(event("e2", "battery", Map.of("level", 80)))
                .apply(event("e3", "status", Map.of("value", "off")));

        // Then
        assertEquals(Projection.DEFAULT_NAME, projection.name());
        assertEquals(3, projection.version());
        assertEquals("e3", projection.lastAppliedEventId());
        assertEquals(Map.of("value", "off"), projection.state().get("status"));
        assertEquals(Map.of("level", 80), projection.state().get("battery"));
        assertEquals("device:9", projection.streamId());
        assertEquals(0, empty.version());
    }

    @Test
    public void resetKeepsIdentity() {
        // Given
        final Projection projection = Projection.empty("summary", "device", "9")
                .apply(event("e1", "status", Map.of("value", "on")));

        // When
        final Projection reset = projection.reset();

        // Then
        assertEquals(projection.id(), reset.id());
        assertEquals("summary", reset.name());
        assertEquals(0, reset.version());
        assertNull(reset.lastAppliedEventId());
        assertTrue(reset.state().isEmpty());
    }

    private Event event(final String id, final String type, final Map<String, Object> payload) {
        return DefaultEvent.builder()
                .id(id)
                .type(type)
                .source(EventSource.IOT_DEVICE)
                .category(EventCategory.DEVICE_STATUS)
                .entity("device", "9")
                .payload(payload)
                .build();
    }
}
