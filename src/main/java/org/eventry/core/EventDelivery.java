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
 * Transport used to push events to subscription and replay targets. The target is the opaque string stored with the
 * subscription, for instance a webhook URL.
 */
@FunctionalInterface
public interface EventDelivery {
    /**
     * Delivers the event, blocking until the target has accepted it.
     *
     * @throws Exception If the target could not be reached or rejected the event.
     */
    void deliver(Event event, String target) throws Exception;
}
