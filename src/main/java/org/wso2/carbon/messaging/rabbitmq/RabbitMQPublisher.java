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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.amqp.AmqpException;
import com.rabbitmq.client.amqp.Message;
import com.rabbitmq.client.amqp.Publisher;
import org.apache.commons.lang.StringUtils;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.wso2.carbon.messaging.rabbitmq.config.DeadLetterConfig;
import org.wso2.carbon.messaging.rabbitmq.config.QueueBinding;
import org.wso2.carbon.messaging.rabbitmq.config.SubscriptionConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;

/**
 * Sends JSON messages to a single queue, or fans one message out to several queues bound to a direct
 * exchange. Every call works on its own channel and declares the target topology before publishing.
 * Failures are logged and thrown to the caller; the publisher never retries.
 */
public class RabbitMQPublisher implements AutoCloseable {
    private static final Log log = LogFactory.getLog(RabbitMQPublisher.class);

    private final String name;
    private final RabbitMQConnectionManager connectionManager;
    private final RabbitMQTopologyBuilder topologyBuilder;
    private final ObjectMapper objectMapper;
    private final long publisherAckWaitTime;
    private final boolean deadLetterEnabled;

    /**
     * Creates a publisher. The broker connection is opened by the first publish.
     *
     * @param name       Publisher name, used in log output.
     * @param properties Connection properties, plus the dead-letter flag applied to declared queues.
     */
    public RabbitMQPublisher(String name, Properties properties) {
        this(name, properties, new RabbitMQConnectionManager(name, properties), new RabbitMQTopologyBuilder(name));
    }

    RabbitMQPublisher(String name, Properties properties, RabbitMQConnectionManager connectionManager,
                      RabbitMQTopologyBuilder topologyBuilder) {
        this.name = name;
        this.connectionManager = connectionManager;
        this.topologyBuilder = topologyBuilder;
        this.objectMapper = RabbitMQUtils.createObjectMapper();
        this.publisherAckWaitTime = RabbitMQUtils.getLongProperty(properties,
                RabbitMQConstants.PUBLISHER_ACK_WAIT_TIME, RabbitMQConstants.DEFAULT_PUBLISHER_ACK_WAIT_TIME,
                "[" + name + "]");
        this.deadLetterEnabled = RabbitMQUtils.getBooleanProperty(properties,
                RabbitMQConstants.DEAD_LETTER_QUEUE_ENABLED, RabbitMQConstants.DEFAULT_DEAD_LETTER_QUEUE_ENABLED);
    }

    public void publishToQueue(Object message, String queueName) throws RabbitMQException {
        publishToQueue(message, queueName, null);
    }

    /**
     * Publishes a message to a queue, declaring the queue first.
     *
     * @param message       The message, serialized to JSON.
     * @param queueName     The target queue.
     * @param correlationId Correlation id to set, or null to generate one.
     * @throws RabbitMQConnectionException If the broker cannot be reached.
     * @throws RabbitMQTopologyException   If the queue cannot be declared.
     * @throws RabbitMQPublishException    If the message cannot be serialized or is not accepted.
     */
    public void publishToQueue(Object message, String queueName, String correlationId) throws RabbitMQException {
        SubscriptionConfig target = SubscriptionConfig.forQueue(queueName);
        byte[] payload = serialize(message);

        try (RabbitMQChannel channel = connectionManager.acquireChannel()) {
            topologyBuilder.ensurePublishTopology(channel, target, DeadLetterConfig.of(target, deadLetterEnabled));
            Publisher publisher = channel.createQueuePublisher(queueName, Duration.ofMillis(publisherAckWaitTime));
            RabbitMQPublisherCallBack callBack = publish(publisher, payload, correlationId);
            callBack.awaitAccepted(publisherAckWaitTime);
        } catch (RabbitMQPublishException e) {
            log.error("[" + name + "] Error while publishing message to the queue: " + queueName, e);
            throw e;
        } catch (AmqpException e) {
            log.error("[" + name + "] Error while publishing message to the queue: " + queueName, e);
            throw new RabbitMQPublishException("[" + name + "] Could not publish message to the queue: "
                    + queueName, e);
        }
        if (log.isDebugEnabled()) {
            log.debug("[" + name + "] Published message to the queue: " + queueName);
        }
    }

    /**
     * Publishes a message once per entry, in the map's iteration order. Use an ordered map such as
     * {@link LinkedHashMap} for a deterministic declaration order.
     *
     * @param message           The message, serialized to JSON once.
     * @param exchangeName      The direct exchange.
     * @param routingKeyToQueue Routing key to queue pairs.
     * @throws RabbitMQException If the publish fails.
     */
    public void publishToExchange(Object message, String exchangeName, Map<String, String> routingKeyToQueue)
            throws RabbitMQException {
        List<QueueBinding> bindings = new ArrayList<>();
        for (Map.Entry<String, String> entry : routingKeyToQueue.entrySet()) {
            bindings.add(new QueueBinding(entry.getKey(), entry.getValue()));
        }
        publishToExchange(message, exchangeName, bindings);
    }

    /**
     * Declares the exchange, declares and binds each queue on its routing key, then publishes the message
     * once per binding. All publishes are attempted; the failed bindings are reported together.
     *
     * @param message      The message, serialized to JSON once.
     * @param exchangeName The direct exchange.
     * @param bindings     Routing key to queue pairs, declared and published in list order.
     * @throws RabbitMQConfigurationException If no binding is given.
     * @throws RabbitMQConnectionException    If the broker cannot be reached.
     * @throws RabbitMQTopologyException      If a declaration fails.
     * @throws RabbitMQPublishException       If serialization fails or a message is not accepted.
     */
    public void publishToExchange(Object message, String exchangeName, List<QueueBinding> bindings)
            throws RabbitMQException {
        if (bindings == null || bindings.isEmpty()) {
            throw new RabbitMQConfigurationException("[" + name + "] At least one routing key and queue pair is "
                    + "required to publish to the exchange: " + exchangeName);
        }
        List<SubscriptionConfig> targets = new ArrayList<>();
        for (QueueBinding binding : bindings) {
            targets.add(SubscriptionConfig.forExchange(exchangeName, binding.getRoutingKey(),
                    binding.getQueueName()));
        }
        byte[] payload = serialize(message);

        // one callback per binding, in binding order; routing keys may repeat
        List<RabbitMQPublisherCallBack> callBacks = new ArrayList<>(targets.size());
        List<String> failedBindings = new ArrayList<>();
        RabbitMQPublishException lastFailure = null;

        try (RabbitMQChannel channel = connectionManager.acquireChannel()) {
            for (SubscriptionConfig target : targets) {
                topologyBuilder.ensurePublishTopology(channel, target, DeadLetterConfig.of(target, deadLetterEnabled));
            }
            for (SubscriptionConfig target : targets) {
                Publisher publisher = channel.createExchangePublisher(exchangeName, target.getRoutingKey(),
                        Duration.ofMillis(publisherAckWaitTime));
                callBacks.add(publish(publisher, payload, null));
            }
            for (int i = 0; i < callBacks.size(); i++) {
                SubscriptionConfig target = targets.get(i);
                try {
                    callBacks.get(i).awaitAccepted(publisherAckWaitTime);
                } catch (RabbitMQPublishException e) {
                    log.error("[" + name + "] Message to the exchange: " + exchangeName + " with routing key: "
                            + target.getRoutingKey() + " for queue: " + target.getQueueName()
                            + " was not accepted.", e);
                    failedBindings.add(target.getRoutingKey() + " -> " + target.getQueueName());
                    lastFailure = e;
                }
            }
        } catch (AmqpException e) {
            log.error("[" + name + "] Error while publishing message to the exchange: " + exchangeName, e);
            throw new RabbitMQPublishException("[" + name + "] Could not publish message to the exchange: "
                    + exchangeName, e);
        }

        if (!failedBindings.isEmpty()) {
            throw new RabbitMQPublishException("[" + name + "] Message to the exchange: " + exchangeName
                    + " was not accepted for binding(s): " + StringUtils.join(failedBindings, ", "),
                    lastFailure);
        }
        if (log.isDebugEnabled()) {
            log.debug("[" + name + "] Published message to the exchange: " + exchangeName + " for " + bindings);
        }
    }

    private RabbitMQPublisherCallBack publish(Publisher publisher, byte[] payload, String correlationId) {
        String messageId = UUID.randomUUID().toString();
        Message message = publisher.message(payload)
                .messageId(messageId)
                .correlationId(StringUtils.isEmpty(correlationId) ? UUID.randomUUID().toString() : correlationId)
                .contentType(RabbitMQConstants.JSON_CONTENT_TYPE)
                .contentEncoding(RabbitMQConstants.UTF_8_ENCODING);
        RabbitMQPublisherCallBack callBack = new RabbitMQPublisherCallBack(messageId);
        publisher.publish(message, callBack);
        return callBack;
    }

    private byte[] serialize(Object message) throws RabbitMQPublishException {
        Objects.requireNonNull(message, "message");
        try {
            return objectMapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            log.error("[" + name + "] Could not serialize message of type " + message.getClass().getName(), e);
            throw new RabbitMQPublishException("[" + name + "] Could not serialize message of type "
                    + message.getClass().getName(), e);
        }
    }

    /**
     * Closes the publisher's connection.
     */
    @Override
    public void close() {
        connectionManager.close();
    }
}
