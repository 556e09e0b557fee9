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

package org.eventry.signal.hazelcast;

import com.hazelcast.config.Config;
import com.hazelcast.config.TopicConfig;
import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.topic.ITopic;
import org.eventry.core.InfrastructureException;
import org.eventry.core.Signal;
import org.eventry.core.SignalChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Broadcasts signals on a Hazelcast topic so that every member of the cluster (and any listener registered via {@link
 * #addListener(Consumer)}) receives them in the same order.
 */
public class HazelcastSignalChannel implements SignalChannel, AutoCloseable {
    public static final String DEFAULT_TOPIC = "eventry.signals";

    private final HazelcastInstance hz;
    private final Logger log = LoggerFactory.getLogger(getClass());
    private final boolean ownsInstance;
    private final String topic;

    /**
     * Uses an existing Hazelcast instance, the instance is not shut down when the channel is closed.
     */
    public HazelcastSignalChannel(final HazelcastInstance hz, final String topic) {
        this(hz, topic, false);
        hz.getConfig().addTopicConfig(topicConfig(topic));
    }

    private HazelcastSignalChannel(final HazelcastInstance hz, final String topic, final boolean ownsInstance) {
        this.hz = hz;
        this.topic = topic;
        this.ownsInstance = ownsInstance;
    }

    /**
     * Creates a new Hazelcast instance from the provided configuration, the instance is shut down with the channel.
     */
    public static HazelcastSignalChannel create(final Config config, final String topic) {
        config.addTopicConfig(topicConfig(topic));
        return new HazelcastSignalChannel(Hazelcast.newHazelcastInstance(config), topic, true);
    }

    /**
     * Creates the topic configuration that enables global ordering.
     */
    static TopicConfig topicConfig(final String topic) {
        final TopicConfig topicConfig = new TopicConfig();
        topicConfig.setGlobalOrderingEnabled(true);
        topicConfig.setName(topic);
        return topicConfig;
    }

    public UUID addListener(final Consumer<Signal> listener) {
        return topic().addMessageListener(message -> listener.accept(message.getMessageObject()));
    }

    @Override
    public void close() {
        if (ownsInstance) {
            hz.getLifecycleService().shutdown();
        }
    }

    @Override
    public void emit(final Signal signal) {
        try {
            topic().publish(signal);
            log.debug("Signal published [type={}, topic={}]", signal.type().value(), topic);
        } catch (final RuntimeException e) {
            throw new InfrastructureException(String.format("Unable to publish signal [type=%s]", signal.type().value()), e);
        }
    }

    public boolean removeListener(final UUID registrationId) {
        return topic().removeMessageListener(registrationId);
    }

    private ITopic<Signal> topic() {
        return hz.getTopic(topic);
    }
}
