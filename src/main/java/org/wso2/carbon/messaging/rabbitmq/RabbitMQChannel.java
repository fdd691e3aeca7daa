/*
 *  Copyright (c) 2025, WSO2 LLC. (https://www.wso2.com).
 *
 *  WSO2 LLC. licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except
 *  in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing,
 *  software distributed under the License is distributed on an
 *  "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 *  KIND, either express or implied.  See the License for the
 *  specific language governing permissions and limitations
 *  under the License.
 */
package org.wso2.carbon.messaging.rabbitmq;

import com.rabbitmq.client.amqp.Connection;
import com.rabbitmq.client.amqp.Consumer;
import com.rabbitmq.client.amqp.ConsumerBuilder;
import com.rabbitmq.client.amqp.Management;
import com.rabbitmq.client.amqp.Publisher;
import com.rabbitmq.client.amqp.PublisherBuilder;
import org.apache.commons.lang.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A handle for one unit of work over a shared connection. Every publisher and consumer opened
 * through the handle is owned by it and released by {@link #close()}, so concurrent operations
 * never share links. Instances are handed out by {@link RabbitMQConnectionManager#acquireChannel()}.
 */
public class RabbitMQChannel implements AutoCloseable {
    private static final Log log = LogFactory.getLog(RabbitMQChannel.class);

    private final String name;
    private final Connection connection;
    private final RabbitMQConnectionStateListener connectionStateListener;
    private final Deque<AutoCloseable> ownedResources = new ArrayDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    RabbitMQChannel(String name, Connection connection, RabbitMQConnectionStateListener connectionStateListener) {
        this.name = name;
        this.connection = connection;
        this.connectionStateListener = connectionStateListener;
    }

    /**
     * Opens a management session for topology declarations. The caller closes it.
     *
     * @return The management session.
     */
    public Management management() {
        ensureOpen();
        return connection.management();
    }

    /**
     * Creates a publisher sending to a queue address, the AMQP 1.0 form of publishing to the
     * default exchange with the queue name as routing key.
     *
     * @param queueName      The target queue.
     * @param publishTimeout How long the broker has to settle each message.
     * @return The publisher, closed together with this channel.
     */
    public Publisher createQueuePublisher(String queueName, Duration publishTimeout) {
        ensureOpen();
        PublisherBuilder builder = connection.publisherBuilder().publishTimeout(publishTimeout);
        builder.queue(queueName);
        return own(builder.build());
    }

    /**
     * Creates a publisher sending to an exchange, optionally with a fixed routing key.
     *
     * @param exchangeName   The target exchange.
     * @param routingKey     The routing key, or null to leave it unset.
     * @param publishTimeout How long the broker has to settle each message.
     * @return The publisher, closed together with this channel.
     */
    public Publisher createExchangePublisher(String exchangeName, String routingKey, Duration publishTimeout) {
        ensureOpen();
        PublisherBuilder builder = connection.publisherBuilder().publishTimeout(publishTimeout);
        builder.exchange(exchangeName);
        if (StringUtils.isNotEmpty(routingKey)) {
            builder.key(routingKey);
        }
        return own(builder.build());
    }

    /**
     * Subscribes to a queue. Deliveries stay unsettled until the handler settles them.
     *
     * @param queueName      The queue to consume.
     * @param messageHandler The handler receiving deliveries.
     * @param initialCredits The number of deliveries the broker may push ahead of settlement.
     * @return The consumer, closed together with this channel.
     */
    public Consumer createConsumer(String queueName, Consumer.MessageHandler messageHandler, int initialCredits) {
        ensureOpen();
        ConsumerBuilder consumerBuilder = connection.consumerBuilder();
        consumerBuilder.queue(queueName);
        consumerBuilder.messageHandler(messageHandler);
        consumerBuilder.initialCredits(initialCredits);
        return own(consumerBuilder.build());
    }

    /**
     * @return True until the channel is closed or its connection goes away.
     */
    public boolean isOpen() {
        return !closed.get() && !connectionStateListener.isClosed();
    }

    /**
     * Closes every publisher and consumer opened through this channel, newest first.
     * The shared connection stays open.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (ownedResources) {
            while (!ownedResources.isEmpty()) {
                AutoCloseable resource = ownedResources.pop();
                try {
                    resource.close();
                } catch (Exception e) {
                    log.warn("[" + name + "] Error while closing RabbitMQ resource " + resource + ".", e);
                }
            }
        }
    }

    /**
     * Closes one publisher or consumer opened through this channel ahead of the channel itself.
     *
     * @param resource The resource to close. Resources this channel does not own are ignored.
     */
    public void release(AutoCloseable resource) {
        boolean owned;
        synchronized (ownedResources) {
            owned = ownedResources.remove(resource);
        }
        if (!owned) {
            return;
        }
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("[" + name + "] Error while closing RabbitMQ resource " + resource + ".", e);
        }
    }

    private <T extends AutoCloseable> T own(T resource) {
        synchronized (ownedResources) {
            ownedResources.push(resource);
        }
        return resource;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("[" + name + "] Channel is already closed.");
        }
    }
}
