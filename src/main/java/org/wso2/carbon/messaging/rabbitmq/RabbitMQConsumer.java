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

import com.rabbitmq.client.amqp.AmqpException;
import com.rabbitmq.client.amqp.Consumer;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.wso2.carbon.messaging.rabbitmq.config.DeadLetterConfig;
import org.wso2.carbon.messaging.rabbitmq.config.RetryPolicy;
import org.wso2.carbon.messaging.rabbitmq.config.SubscriptionConfig;
import org.wso2.carbon.messaging.rabbitmq.deadletter.DeadLetterRouter;
import org.wso2.carbon.messaging.rabbitmq.health.HealthSnapshot;
import org.wso2.carbon.messaging.rabbitmq.health.HealthStatus;
import org.wso2.carbon.messaging.rabbitmq.health.HealthTracker;
import org.wso2.carbon.messaging.rabbitmq.message.handler.RabbitMQMessageHandler;
import org.wso2.carbon.messaging.rabbitmq.message.handler.RetryingMessageHandler;
import org.wso2.carbon.messaging.rabbitmq.retry.RetryExecutor;
import org.wso2.carbon.messaging.rabbitmq.retry.ShutdownSignal;

import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A long-running subscription to one queue. Connection, topology, retry, dead-lettering and health
 * tracking are composed around a business {@link RabbitMQMessageHandler}.
 * <p>
 * Lifecycle: {@code INITIALIZING -> TOPOLOGY_SETUP -> CONSUMING -> STOPPING -> STOPPED}. A consumer is
 * obtained from {@link #create}, which returns only once the topology is declared and the subscription
 * is active; any failure on the way is thrown from the factory and leaves nothing open. Deliveries are
 * handled one at a time on the consumer's dispatcher thread, each settled exactly once.
 */
public class RabbitMQConsumer {
    private static final Log log = LogFactory.getLog(RabbitMQConsumer.class);

    /**
     * Lifecycle states of a consumer.
     */
    public enum State {
        INITIALIZING,
        TOPOLOGY_SETUP,
        CONSUMING,
        STOPPING,
        STOPPED
    }

    private final String name;
    private final SubscriptionConfig subscription;
    private final RetryPolicy retryPolicy;
    private final DeadLetterConfig deadLetterConfig;
    private final RabbitMQMessageHandler messageHandler;
    private final Properties rabbitMQProperties;
    private final RabbitMQConnectionManager connectionManager;
    private final RabbitMQTopologyBuilder topologyBuilder;
    private final HealthTracker healthTracker;
    private final ShutdownSignal shutdownSignal = new ShutdownSignal();
    private final AtomicReference<State> state = new AtomicReference<>(State.INITIALIZING);
    private volatile RabbitMQChannel channel;
    private volatile Consumer rabbitMQConsumer;

    private RabbitMQConsumer(String name, SubscriptionConfig subscription, RetryPolicy retryPolicy,
                             DeadLetterConfig deadLetterConfig, RabbitMQMessageHandler messageHandler,
                             Properties rabbitMQProperties, RabbitMQConnectionManager connectionManager,
                             RabbitMQTopologyBuilder topologyBuilder) {
        this.name = name;
        this.subscription = subscription;
        this.retryPolicy = retryPolicy;
        this.deadLetterConfig = deadLetterConfig;
        this.messageHandler = messageHandler;
        this.rabbitMQProperties = rabbitMQProperties;
        this.connectionManager = connectionManager;
        this.topologyBuilder = topologyBuilder;
        this.healthTracker = new HealthTracker(name, subscription, deadLetterConfig, retryPolicy);
    }

    /**
     * Creates and starts a consumer configured entirely from properties: the subscription, the retry
     * policy, dead-lettering and the broker connection.
     *
     * @param name           Consumer name, used in logs, thread names and failure envelopes.
     * @param properties     The configuration properties.
     * @param messageHandler The business handler.
     * @return A consumer in the {@code CONSUMING} state.
     * @throws RabbitMQConfigurationException If the configuration is invalid.
     * @throws RabbitMQConnectionException    If the broker cannot be reached.
     * @throws RabbitMQException              If the topology cannot be declared or the subscription fails.
     */
    public static RabbitMQConsumer create(String name, Properties properties, RabbitMQMessageHandler messageHandler)
            throws RabbitMQException {
        SubscriptionConfig subscription = SubscriptionConfig.fromProperties(properties);
        RetryPolicy retryPolicy = RetryPolicy.fromProperties(properties, "[" + name + "]");
        DeadLetterConfig deadLetterConfig = DeadLetterConfig.fromProperties(subscription, properties);
        return create(name, subscription, retryPolicy, deadLetterConfig, messageHandler, properties);
    }

    /**
     * Creates and starts a consumer from explicit settings. Connection properties are still read from
     * {@code properties}.
     *
     * @param name             Consumer name.
     * @param subscription     What to consume.
     * @param retryPolicy      How to retry failed messages.
     * @param deadLetterConfig What to do with messages that exhaust their retries.
     * @param messageHandler   The business handler.
     * @param properties       Connection and tuning properties.
     * @return A consumer in the {@code CONSUMING} state.
     * @throws RabbitMQException If the consumer cannot be started.
     */
    public static RabbitMQConsumer create(String name, SubscriptionConfig subscription, RetryPolicy retryPolicy,
                                          DeadLetterConfig deadLetterConfig, RabbitMQMessageHandler messageHandler,
                                          Properties properties) throws RabbitMQException {
        return create(name, subscription, retryPolicy, deadLetterConfig, messageHandler, properties,
                new RabbitMQConnectionManager(name, properties), new RabbitMQTopologyBuilder(name));
    }

    static RabbitMQConsumer create(String name, SubscriptionConfig subscription, RetryPolicy retryPolicy,
                                   DeadLetterConfig deadLetterConfig, RabbitMQMessageHandler messageHandler,
                                   Properties properties, RabbitMQConnectionManager connectionManager,
                                   RabbitMQTopologyBuilder topologyBuilder) throws RabbitMQException {
        RabbitMQConsumer consumer = new RabbitMQConsumer(name, subscription, retryPolicy, deadLetterConfig,
                messageHandler, properties, connectionManager, topologyBuilder);
        consumer.start();
        return consumer;
    }

    /**
     * Acquires a channel, declares the topology and subscribes. On failure every resource opened so far
     * is released and the consumer ends up {@code STOPPED}.
     *
     * @throws RabbitMQException If any step fails.
     */
    private void start() throws RabbitMQException {
        log.info("[" + name + "] Starting RabbitMQ consumer for " + subscription + " with " + retryPolicy
                + " and " + deadLetterConfig);
        try {
            channel = connectionManager.acquireChannel();

            state.set(State.TOPOLOGY_SETUP);
            topologyBuilder.ensureConsumerTopology(channel, subscription, deadLetterConfig);

            long publisherAckWaitTime = RabbitMQUtils.getLongProperty(rabbitMQProperties,
                    RabbitMQConstants.PUBLISHER_ACK_WAIT_TIME, RabbitMQConstants.DEFAULT_PUBLISHER_ACK_WAIT_TIME,
                    "[" + name + "]");
            int initialCredits = RabbitMQUtils.getIntProperty(rabbitMQProperties,
                    RabbitMQConstants.CONSUMER_INITIAL_CREDIT, RabbitMQConstants.DEFAULT_CONSUMER_INITIAL_CREDIT,
                    "[" + name + "]");

            RetryingMessageHandler retryingMessageHandler = new RetryingMessageHandler(name,
                    subscription.getEffectiveRoutingKey(), messageHandler,
                    new RetryExecutor(name, retryPolicy, shutdownSignal),
                    new DeadLetterRouter(name, channel, deadLetterConfig, RabbitMQUtils.createObjectMapper(),
                            publisherAckWaitTime),
                    healthTracker);
            rabbitMQConsumer = subscribe(retryingMessageHandler, initialCredits);

            state.set(State.CONSUMING);
            healthTracker.evaluate(connectionManager.isConnectionOpen(), channel.isOpen());
            log.info("[" + name + "] Started consuming from the RabbitMQ queue: " + subscription.getQueueName());
        } catch (RabbitMQException e) {
            log.error("[" + name + "] Could not start RabbitMQ consumer in state " + state.get() + ".", e);
            releaseResources();
            throw e;
        }
    }

    private Consumer subscribe(RetryingMessageHandler retryingMessageHandler, int initialCredits)
            throws RabbitMQException {
        try {
            return channel.createConsumer(subscription.getQueueName(), retryingMessageHandler, initialCredits);
        } catch (AmqpException e) {
            throw new RabbitMQException("[" + name + "] Could not subscribe to the RabbitMQ queue: "
                    + subscription.getQueueName(), e);
        }
    }

    /**
     * Stops the consumer. No new deliveries are accepted, pending retry waits end early and their
     * messages are requeued, and a handler that is already running is allowed to finish. Resources are
     * released once in-flight deliveries are settled or the maximum wait time has passed.
     */
    public void shutdown() {
        State previous = state.getAndUpdate(current ->
                current == State.STOPPING || current == State.STOPPED ? current : State.STOPPING);
        if (previous == State.STOPPING || previous == State.STOPPED) {
            return;
        }
        log.info("[" + name + "] Shutting down RabbitMQ consumer.");

        long maxWaitTimeMillis = RabbitMQUtils.getLongProperty(rabbitMQProperties,
                RabbitMQConstants.MAX_WAIT_TIME_MILLIS, RabbitMQConstants.DEFAULT_MAX_WAIT_TIME_MILLIS,
                "[" + name + "]");

        Consumer consumer = rabbitMQConsumer;
        if (consumer != null) {
            try {
                consumer.pause();
            } catch (AmqpException e) {
                log.warn("[" + name + "] Could not pause the RabbitMQ consumer before shutdown.", e);
            }
        }
        shutdownSignal.signal();

        // Wait for unsettled messages to clear
        if (consumer != null) {
            long startTime = System.currentTimeMillis();
            while (System.currentTimeMillis() - startTime < maxWaitTimeMillis) {
                if (consumer.unsettledMessageCount() <= 0) {
                    break;
                }
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    log.warn("[" + name + "] Interrupted while waiting for unsettled messages to clear.", e);
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            if (consumer.unsettledMessageCount() > 0) {
                log.warn("[" + name + "] " + consumer.unsettledMessageCount() + " message(s) still unsettled after "
                        + maxWaitTimeMillis + "ms. They will be redelivered by the broker.");
            }
        }

        releaseResources();
        log.info("[" + name + "] RabbitMQ consumer stopped.");
    }

    private void releaseResources() {
        // the channel owns the subscription and closes it
        rabbitMQConsumer = null;
        if (channel != null) {
            channel.close();
        }
        connectionManager.close();
        state.set(State.STOPPED);
    }

    /**
     * Evaluates the consumer's health against its live connection and channel.
     *
     * @return The current status.
     */
    public HealthStatus checkHealth() {
        RabbitMQChannel currentChannel = channel;
        return healthTracker.evaluate(connectionManager.isConnectionOpen(),
                currentChannel != null && currentChannel.isOpen());
    }

    /**
     * Evaluates and returns the consumer's health. Intended to be polled by health-check endpoints.
     *
     * @return A snapshot of counters and status.
     */
    public HealthSnapshot getHealthSnapshot() {
        checkHealth();
        return healthTracker.snapshot();
    }

    public State getState() {
        return state.get();
    }

    public String getName() {
        return name;
    }

    public SubscriptionConfig getSubscription() {
        return subscription;
    }
}
