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
 * Resolves the location (JDBC url) of the storage backend, invoked once when Eventry is built.
 */
@FunctionalInterface
public interface StoreLocator {
    /**
     * Reads the url from a system property, falling back to the default url when the property is not set.
     */
    static StoreLocator systemProperty(final String property, final String defaultUrl) {
        return () -> System.getProperty(property, defaultUrl);
    }

    String locate();
}
