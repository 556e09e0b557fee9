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

import java.util.Collections;
import java.util.List;

/**
 * One page of query results together with the total number of matching events.
 */
public final class EventPage {
    private final List<Event> items;
    private final int limit;
    private final int offset;
    private final long total;

    public EventPage(final List<Event> items, final long total, final int limit, final int offset) {
        this.items = Collections.unmodifiableList(items);
        this.total = total;
        this.limit = limit;
        this.offset = offset;
    }

    public boolean hasMore() {
        return (long) offset + limit < total;
    }

    public List<Event> items() {
        return items;
    }

    public int limit() {
        return limit;
    }

    public int offset() {
        return offset;
    }

    public long total() {
        return total;
    }
}
