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

/**
 * A unit of logic that is applied to an event by the processing workers. Returning {@link ProcessingStatus#RETRY} or throwing
 * an exception marks the event as failed and eligible for retry, {@link ProcessingStatus#SKIPPED} is not retried.
 */
@FunctionalInterface
public interface EventProcessor {
    /**
     * Invoked once per event and processing attempt.
     *
     * @param event The event being processed.
     * @return The outcome of the processing.
     * @throws Exception Any exception is captured as a failed processing result.
     */
    ProcessingStatus process(Event event) throws Exception;
}
