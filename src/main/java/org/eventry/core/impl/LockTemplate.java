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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Internal abstraction/template for working with one lock per key (to avoid boilerplate code). Callbacks for the same key
 * are serialized, callbacks for different keys run in parallel.
 */
class LockTemplate {
    private final Map<String, Lock> locks = new ConcurrentHashMap<>();
    private final Logger log = LoggerFactory.getLogger(getClass());

    <T> T lock(final String key, final Supplier<T> callback) {
        final Lock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        log.trace("Obtaining lock [key={}]", key);
        lock.lock();

        try {
            return callback.get();
        } finally {
            log.trace("Unlocking [key={}]", key);
            lock.unlock();
        }
    }
}
