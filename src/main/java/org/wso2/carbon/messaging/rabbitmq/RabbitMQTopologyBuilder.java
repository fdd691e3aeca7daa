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
import com.rabbitmq.client.amqp.Management;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.wso2.carbon.messaging.rabbitmq.config.DeadLetterConfig;
import org.wso2.carbon.messaging.rabbitmq.config.SubscriptionConfig;

/**
 * Declares the exchanges, queues and bindings a consumer or a publish call relies on.
 * Every declaration is idempotent, so the same topology can be ensured any number of times.
 * <p>
 * Queues are classic, non-exclusive and never auto-deleted. Exchanges are direct. When
 * dead-lettering is enabled the queue carries the dead-letter exchange and routing key as
 * arguments, and the dead-letter exchange and queue are declared and bound on the
 * {@code .failed} routing key.
 */
public class RabbitMQTopologyBuilder {
    private static final Log log = LogFactory.getLog(RabbitMQTopologyBuilder.class);

    private final String name;

    public RabbitMQTopologyBuilder(String name) {
        this.name = name;
    }

    /**
     * Declares everything a consumer needs before it subscribes.
     *
     * @param channel            The channel to declare through.
     * @param subscription       The subscription to be consumed.
     * @param deadLetterConfig   The dead-letter settings of the subscription.
     * @throws RabbitMQTopologyException If the broker rejects a declaration.
     */
    public void ensureConsumerTopology(RabbitMQChannel channel, SubscriptionConfig subscription,
                                       DeadLetterConfig deadLetterConfig) throws RabbitMQTopologyException {
        declare(channel, subscription, deadLetterConfig);
        log.info("[" + name + "] Consumer topology declared for " + subscription
                + (deadLetterConfig.isEnabled() ? " with dead-letter queue " + deadLetterConfig.getDeadLetterQueue()
                : " without dead-lettering"));
    }

    /**
     * Declares the target of a publish call. The target queue is declared with the same arguments a
     * consumer of it would use, so publisher and consumer declarations stay equivalent.
     *
     * @param channel          The channel to declare through.
     * @param target           The queue, or exchange binding, being published to.
     * @param deadLetterConfig The dead-letter settings of the target.
     * @throws RabbitMQTopologyException If the broker rejects a declaration.
     */
    public void ensurePublishTopology(RabbitMQChannel channel, SubscriptionConfig target,
                                      DeadLetterConfig deadLetterConfig) throws RabbitMQTopologyException {
        declare(channel, target, deadLetterConfig);
        if (log.isDebugEnabled()) {
            log.debug("[" + name + "] Publish topology declared for " + target);
        }
    }

    private void declare(RabbitMQChannel channel, SubscriptionConfig subscription,
                         DeadLetterConfig deadLetterConfig) throws RabbitMQTopologyException {
        try (Management management = channel.management()) {
            if (deadLetterConfig.isEnabled()) {
                declareDeadLetterTopology(management, deadLetterConfig);
            }
            if (subscription.isExchangeMode()) {
                declareExchange(management, subscription.getExchangeName());
            }
            declareQueue(management, subscription.getQueueName(), deadLetterConfig);
            if (subscription.isExchangeMode()) {
                bindQueueToExchange(management, subscription.getQueueName(), subscription.getExchangeName(),
                        subscription.getRoutingKey());
            }
        } catch (AmqpException e) {
            log.error("[" + name + "] Error while declaring RabbitMQ topology for " + subscription, e);
            throw new RabbitMQTopologyException("[" + name + "] Could not declare RabbitMQ topology for "
                    + subscription, e);
        }
    }

    /**
     * Declares the dead-letter exchange and queue and binds them on the dead-letter routing key.
     *
     * @param management       The management session.
     * @param deadLetterConfig The dead-letter settings.
     */
    private void declareDeadLetterTopology(Management management, DeadLetterConfig deadLetterConfig) {
        declareExchange(management, deadLetterConfig.getDeadLetterExchange());
        declareQueue(management, deadLetterConfig.getDeadLetterQueue(), null);
        bindQueueToExchange(management, deadLetterConfig.getDeadLetterQueue(),
                deadLetterConfig.getDeadLetterExchange(), deadLetterConfig.getDeadLetterRoutingKey());
    }

    /**
     * Declares a classic queue, pointing it at the dead-letter exchange when dead-lettering is enabled.
     *
     * @param management       The management session.
     * @param queueName        The queue to declare.
     * @param deadLetterConfig The dead-letter settings, or null for a queue without dead-lettering.
     */
    private void declareQueue(Management management, String queueName, DeadLetterConfig deadLetterConfig) {
        Management.QueueSpecification queueSpecification = management.queue()
                .name(queueName)
                .type(Management.QueueType.CLASSIC)
                .exclusive(false)
                .autoDelete(false);

        if (deadLetterConfig != null && deadLetterConfig.isEnabled()) {
            queueSpecification
                    .deadLetterExchange(deadLetterConfig.getDeadLetterExchange())
                    .deadLetterRoutingKey(deadLetterConfig.getDeadLetterRoutingKey());
        }
        queueSpecification.declare();
    }

    /**
     * Declares a direct exchange. Broker-defined {@code amq.*} exchanges are left untouched.
     *
     * @param management   The management session.
     * @param exchangeName The exchange to declare.
     */
    private void declareExchange(Management management, String exchangeName) {
        if (exchangeName.startsWith("amq.")) {
            return;
        }
        management.exchange(exchangeName)
                .type(Management.ExchangeType.DIRECT)
                .autoDelete(false)
                .declare();
    }

    private void bindQueueToExchange(Management management, String queueName, String exchangeName,
                                     String routingKey) {
        management.binding()
                .sourceExchange(exchangeName)
                .destinationQueue(queueName)
                .key(routingKey)
                .bind();
    }
}
