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
import java.util.Map;

/**
 * Aggregated counts over the stored events.
 */
public final class EventStatistics {
    private final Map<String, Long> byCategory;
    private final Map<String, Long> bySource;
    private final Map<String, Long> byType;
    private final long failed;
    private final long pending;
    private final long processed;
    private final long processing;
    private final long total;

    public EventStatistics(
            final long total,
            final long pending,
            final long processing,
            final long processed,
            final long failed,
            final Map<String, Long> bySource,
            final Map<String, Long> byCategory,
            final Map<String, Long> byType) {

        this.total = total;
        this.pending = pending;
        this.processing = processing;
        this.processed = processed;
        this.failed = failed;
        this.bySource = Collections.unmodifiableMap(bySource);
        this.byCategory = Collections.unmodifiableMap(byCategory);
        this.byType = Collections.unmodifiableMap(byType);
    }

    public Map<String, Long> byCategory() {
        return byCategory;
    }

    public Map<String, Long> bySource() {
        return bySource;
    }

    public Map<String, Long> byType() {
        return byType;
    }

    /**
     * Failed events as a percentage of all events.
     */
    public double errorRate() {
        return total == 0 ? 0.0 : (failed * 100.0) / total;
    }

    public long failed() {
        return failed;
    }

    public long pending() {
        return pending;
    }

    public long processed() {
        return processed;
    }

    public long processing() {
        return processing;
    }

    /**
     * Processed events as a percentage of all events.
     */
    public double processingRate() {
        return total == 0 ? 0.0 : (processed * 100.0) / total;
    }

    public long total() {
        return total;
    }
}
