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

import org.junit.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class EventQueryTest {
    @Test
    public void defaultsToFirstHundred() {
        final EventQuery query = EventQuery.builder().build();

        assertEquals(EventQuery.DEFAULT_LIMIT, query.limit());
        assertEquals(0, query.offset());
    }

    @Test(expected = ValidationException.class)
    public void limitAboveMaximumIsRejected() {
        EventQuery.builder().limit(1001).build();
    }

    @Test(expected = ValidationException.class)
    public void limitZeroIsRejected() {
        EventQuery.builder().limit(0).build();
    }

    @Test(expected = ValidationException.class)
    public void negativeOffsetIsRejected() {
        EventQuery.builder().offset(-1).build();
    }

    @Test(expected = ValidationException.class)
    public void reversedTimeRangeIsRejected() {
        final Instant now = Instant.now();
        EventQuery.builder().timeRange(now, now.minusSeconds(1)).build();
    }

    @Test
    public void boundaryLimitsAreAccepted() {
        assertEquals(1, EventQuery.builder().limit(1).build().limit());
        assertEquals(1000, EventQuery.builder().limit(1000).build().limit());
    }

    @Test
    public void hasMoreFollowsOffsetPlusLimit() {
        assertTrue(new EventPage(List.of(), 11, 5, 5).hasMore());
        assertFalse(new EventPage(List.of(), 10, 5, 5).hasMore());
        assertFalse(new EventPage(List.of(), 3, 100, 0).hasMore());
    }
}
