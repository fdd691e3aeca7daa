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

import org.wso2.carbon.messaging.rabbitmq.RabbitMQConstants;
import org.wso2.carbon.messaging.rabbitmq.RabbitMQUtils;

import java.util.Properties;

/**
 * Dead-letter settings of a subscription. The names are derived from the subscription:
 * <ul>
 *     <li>exchange: the exchange name (exchange mode) or queue name (simple mode) plus {@code .dlx};</li>
 *     <li>queue: the queue name plus {@code .dlq};</li>
 *     <li>routing key: the subscription routing key (queue name in simple mode) plus {@code .failed}.</li>
 * </ul>
 */
public final class DeadLetterConfig {

    private final boolean enabled;
    private final String deadLetterExchange;
    private final String deadLetterQueue;
    private final String deadLetterRoutingKey;

    private DeadLetterConfig(boolean enabled, String deadLetterExchange, String deadLetterQueue,
                             String deadLetterRoutingKey) {
        this.enabled = enabled;
        this.deadLetterExchange = deadLetterExchange;
        this.deadLetterQueue = deadLetterQueue;
        this.deadLetterRoutingKey = deadLetterRoutingKey;
    }

    public static DeadLetterConfig of(SubscriptionConfig subscription, boolean enabled) {
        String exchangeBase = subscription.isExchangeMode()
                ? subscription.getExchangeName() : subscription.getQueueName();
        return new DeadLetterConfig(enabled,
                exchangeBase + RabbitMQConstants.DEAD_LETTER_EXCHANGE_SUFFIX,
                subscription.getQueueName() + RabbitMQConstants.DEAD_LETTER_QUEUE_SUFFIX,
                subscription.getEffectiveRoutingKey() + RabbitMQConstants.DEAD_LETTER_ROUTING_KEY_SUFFIX);
    }

    public static DeadLetterConfig fromProperties(SubscriptionConfig subscription, Properties properties) {
        return of(subscription, RabbitMQUtils.getBooleanProperty(properties,
                RabbitMQConstants.DEAD_LETTER_QUEUE_ENABLED, RabbitMQConstants.DEFAULT_DEAD_LETTER_QUEUE_ENABLED));
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getDeadLetterExchange() {
        return deadLetterExchange;
    }

    public String getDeadLetterQueue() {
        return deadLetterQueue;
    }

    public String getDeadLetterRoutingKey() {
        return deadLetterRoutingKey;
    }

    @Override
    public String toString() {
        return "DeadLetterConfig{enabled=" + enabled + ", exchange='" + deadLetterExchange + "', queue='"
                + deadLetterQueue + "', routingKey='" + deadLetterRoutingKey + "'}";
    }
}
