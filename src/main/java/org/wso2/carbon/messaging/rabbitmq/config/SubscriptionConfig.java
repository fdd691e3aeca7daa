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
package org.wso2.carbon.messaging.rabbitmq.config;

import org.apache.commons.lang.StringUtils;
import org.wso2.carbon.messaging.rabbitmq.RabbitMQConfigurationException;
import org.wso2.carbon.messaging.rabbitmq.RabbitMQConstants;

import java.util.Objects;
import java.util.Properties;

/**
 * Describes where a consumer receives messages from. Exactly one of two forms is valid:
 * <ul>
 *     <li>simple queue mode: only a queue name, the queue is consumed directly;</li>
 *     <li>exchange mode: an exchange, a routing key and a queue, the queue is bound to the
 *     direct exchange on the routing key.</li>
 * </ul>
 * Instances are immutable and can only be created through the factory methods, which reject
 * any other combination.
 */
public final class SubscriptionConfig {

    private final String queueName;
    private final String exchangeName;
    private final String routingKey;

    private SubscriptionConfig(String queueName, String exchangeName, String routingKey) {
        this.queueName = queueName;
        this.exchangeName = exchangeName;
        this.routingKey = routingKey;
    }

    /**
     * Creates a simple queue mode subscription.
     *
     * @param queueName The queue to consume from.
     * @return The subscription.
     * @throws RabbitMQConfigurationException If the queue name is empty.
     */
    public static SubscriptionConfig forQueue(String queueName) throws RabbitMQConfigurationException {
        if (StringUtils.isBlank(queueName)) {
            throw new RabbitMQConfigurationException("A queue name is required for a simple queue subscription.");
        }
        return new SubscriptionConfig(queueName.trim(), null, null);
    }

    /**
     * Creates an exchange mode subscription.
     *
     * @param exchangeName The direct exchange to bind to.
     * @param routingKey   The routing key of the binding.
     * @param queueName    The queue bound to the exchange and consumed from.
     * @return The subscription.
     * @throws RabbitMQConfigurationException If any of the three names is empty.
     */
    public static SubscriptionConfig forExchange(String exchangeName, String routingKey, String queueName)
            throws RabbitMQConfigurationException {
        if (StringUtils.isBlank(exchangeName) || StringUtils.isBlank(routingKey) || StringUtils.isBlank(queueName)) {
            throw new RabbitMQConfigurationException("Exchange mode requires an exchange name, a routing key and "
                    + "a queue name. Provided exchange: '" + exchangeName + "', routing key: '" + routingKey
                    + "', queue: '" + queueName + "'.");
        }
        return new SubscriptionConfig(queueName.trim(), exchangeName.trim(), routingKey.trim());
    }

    /**
     * Resolves the subscription from configuration properties. The presence of an exchange name or
     * a routing key selects exchange mode, in which case all three names must be present; otherwise
     * the queue name alone selects simple queue mode.
     *
     * @param properties The configuration properties.
     * @return The subscription.
     * @throws RabbitMQConfigurationException If neither mode is fully configured, or both are mixed.
     */
    public static SubscriptionConfig fromProperties(Properties properties) throws RabbitMQConfigurationException {
        String queueName = properties.getProperty(RabbitMQConstants.QUEUE_NAME);
        String exchangeName = properties.getProperty(RabbitMQConstants.EXCHANGE_NAME);
        String routingKey = properties.getProperty(RabbitMQConstants.ROUTING_KEY);

        if (StringUtils.isNotBlank(exchangeName) || StringUtils.isNotBlank(routingKey)) {
            return forExchange(exchangeName, routingKey, queueName);
        }
        if (StringUtils.isNotBlank(queueName)) {
            return forQueue(queueName);
        }
        throw new RabbitMQConfigurationException("No subscription configured. Provide either "
                + RabbitMQConstants.QUEUE_NAME + ", or " + RabbitMQConstants.EXCHANGE_NAME + ", "
                + RabbitMQConstants.ROUTING_KEY + " and " + RabbitMQConstants.QUEUE_NAME + ".");
    }

    public boolean isExchangeMode() {
        return exchangeName != null;
    }

    public String getQueueName() {
        return queueName;
    }

    /**
     * @return The exchange name, or null in simple queue mode.
     */
    public String getExchangeName() {
        return exchangeName;
    }

    /**
     * @return The routing key, or null in simple queue mode.
     */
    public String getRoutingKey() {
        return routingKey;
    }

    /**
     * The routing key messages on this subscription are addressed with. In simple queue mode
     * messages are addressed by queue name.
     *
     * @return The routing key in exchange mode, the queue name otherwise.
     */
    public String getEffectiveRoutingKey() {
        return isExchangeMode() ? routingKey : queueName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SubscriptionConfig)) {
            return false;
        }
        SubscriptionConfig that = (SubscriptionConfig) o;
        return queueName.equals(that.queueName)
                && Objects.equals(exchangeName, that.exchangeName)
                && Objects.equals(routingKey, that.routingKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(queueName, exchangeName, routingKey);
    }

    @Override
    public String toString() {
        if (isExchangeMode()) {
            return "exchange '" + exchangeName + "' -> queue '" + queueName + "' (routing key '" + routingKey + "')";
        }
        return "queue '" + queueName + "'";
    }
}
