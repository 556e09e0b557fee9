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

package org.eventry.core.impl;

import org.eventry.core.Signal;
import org.eventry.core.SignalChannel;
import org.eventry.core.SignalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

import static java.util.concurrent.CompletableFuture.runAsync;

/**
 * Emits signals on the broadcast channel without blocking the caller. The signal is handed to a background executor, failures
 * are logged and never reach the operation that triggered the signal.
 */
public class SignalEmitter {
    private final SignalChannel channel;
    private final ExecutorService executorService;
    private final Logger log = LoggerFactory.getLogger(getClass());

    public SignalEmitter(final SignalChannel channel, final ExecutorService executorService) {
        this.channel = channel;
        this.executorService = executorService;
    }

    /**
     * Fire and forget, the returned future completes when the signal has been emitted (or emitting failed) and is only useful
     * for tests.
     */
    public CompletableFuture<Void> emit(final SignalType type, final Map<String, Object> data) {
        final Signal signal = new Signal(type, data);
        try {
            return runAsync(() -> channel.emit(signal), executorService)
                    .handle((ignored, throwable) -> {
                        if (throwable != null) {
                            log.warn("Unable to emit signal [type={}]", type.value(), throwable);
                        } else {
                            log.trace("Signal emitted [type={}]", type.value());
                        }
                        return null;
                    });
        } catch (final RejectedExecutionException e) {
            log.warn("Signal dropped, emitter is shut down [type={}]", type.value());
            return CompletableFuture.completedFuture(null);
        }
    }
}
