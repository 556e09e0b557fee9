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
 * Delivery of an event to a subscription target or replay target failed.
 */
public class DeliveryException extends EventryException {
    private static final long serialVersionUID = 1L;

    public DeliveryException(final String message) {
        super(ErrorCode.DELIVERY, message);
    }

    public DeliveryException(final String message, final Throwable cause) {
        super(ErrorCode.DELIVERY, message, cause);
    }
}
