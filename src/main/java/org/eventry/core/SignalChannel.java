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
 * A best-effort broadcast channel. Emitting may fail, callers never let such failures affect the operation that triggered the
 * signal.
 */
@FunctionalInterface
public interface SignalChannel {
    /**
     * A channel that drops all signals, used when no broadcast channel has been configured.
     */
    static SignalChannel discard() {
        return signal -> {
            // Dropped
        };
    }

    void emit(Signal signal);
}
