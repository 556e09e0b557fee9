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
 * Processing status of a stored event. The normal path is {@code PENDING -> PROCESSING -> PROCESSED|FAILED}, a failed event
 * may go back to {@code PENDING} when it is retried and finished events can be {@code ARCHIVED}.
 */
public enum EventStatus {
    PENDING, PROCESSING, PROCESSED, FAILED, ARCHIVED
}
