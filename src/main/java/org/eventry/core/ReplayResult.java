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
 * The outcome of a replay. A dry run reports the selected event ids, a real replay reports how many events were delivered and
 * how many deliveries failed.
 */
public final class ReplayResult {
    private final boolean dryRun;
    private final List<String> eventIds;
    private final int failed;
    private final int replayed;
    private final int total;

    private ReplayResult(final boolean dryRun, final List<String> eventIds, final int total, final int replayed, final int failed) {
        this.dryRun = dryRun;
        this.eventIds = Collections.unmodifiableList(eventIds);
        this.total = total;
        this.replayed = replayed;
        this.failed = failed;
    }

    public static ReplayResult completed(final List<String> eventIds, final int replayed, final int failed) {
        return new ReplayResult(false, eventIds, eventIds.size(), replayed, failed);
    }

    public static ReplayResult preview(final List<String> eventIds) {
        return new ReplayResult(true, eventIds, eventIds.size(), 0, 0);
    }

    public List<String> eventIds() {
        return eventIds;
    }

    public int failed() {
        return failed;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public int replayed() {
        return replayed;
    }

    @Override
    public String toString() {
        return "ReplayResult[dryRun=" + dryRun + ", total=" + total + ", replayed=" + replayed + ", failed=" + failed + "]";
    }

    public int total() {
        return total;
    }
}
