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
 * A processor failed for an event. The failure is recorded as a failed processing result and the event becomes eligible for
 * retry, the submitter never sees this exception.
 */
public class ProcessingException extends EventryException {
    private static final long serialVersionUID = 1L;

    public ProcessingException(final String message) {
        super(ErrorCode.PROCESSING, message);
    }

    public ProcessingException(final String message, final Throwable cause) {
        super(ErrorCode.PROCESSING, message, cause);
    }
}
