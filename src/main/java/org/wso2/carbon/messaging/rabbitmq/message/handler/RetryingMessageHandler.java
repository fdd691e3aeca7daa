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
package org.wso2.carbon.messaging.rabbitmq.message.handler;

import com.rabbitmq.client.amqp.AmqpException;
import com.rabbitmq.client.amqp.Consumer;
import com.rabbitmq.client.amqp.Message;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.wso2.carbon.messaging.rabbitmq.RabbitMQAcknowledgementMode;
import org.wso2.carbon.messaging.rabbitmq.RabbitMQConstants;
import org.wso2.carbon.messaging.rabbitmq.deadletter.DeadLetterRouter;
import org.wso2.carbon.messaging.rabbitmq.health.HealthTracker;
import org.wso2.carbon.messaging.rabbitmq.retry.RetryExecutor;
import org.wso2.carbon.messaging.rabbitmq.retry.RetryOutcome;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Handles deliveries of one consumer. Each message runs through the retry executor; the outcome is
 * recorded in the health tracker and turned into exactly one settlement of the delivery:
 * <ul>
 *     <li>success: accepted;</li>
 *     <li>retries exhausted: whatever the dead-letter router decides;</li>
 *     <li>retry cancelled by shutdown: requeued for another consumer, without counting as a failure.</li>
 * </ul>
 */
public class RetryingMessageHandler implements Consumer.MessageHandler {
    private static final Log log = LogFactory.getLog(RetryingMessageHandler.class);

    private final String consumerName;
    private final String defaultRoutingKey;
    private final RabbitMQMessageHandler messageHandler;
    private final RetryExecutor retryExecutor;
    private final DeadLetterRouter deadLetterRouter;
    private final HealthTracker healthTracker;

    /**
     * @param consumerName      Name of the owning consumer.
     * @param defaultRoutingKey Routing key assumed when a delivery does not carry one.
     * @param messageHandler    The business handler.
     * @param retryExecutor     Runs the business handler with back-off.
     * @param deadLetterRouter  Decides the fate of exhausted messages.
     * @param healthTracker     Records processing outcomes.
     */
    public RetryingMessageHandler(String consumerName, String defaultRoutingKey,
                                  RabbitMQMessageHandler messageHandler, RetryExecutor retryExecutor,
                                  DeadLetterRouter deadLetterRouter, HealthTracker healthTracker) {
        this.consumerName = consumerName;
        this.defaultRoutingKey = defaultRoutingKey;
        this.messageHandler = messageHandler;
        this.retryExecutor = retryExecutor;
        this.deadLetterRouter = deadLetterRouter;
        this.healthTracker = healthTracker;
    }

    @Override
    public void handle(Consumer.Context context, Message message) {
        byte[] body = message.body();
        String routingKey = getRoutingKey(message);
        String messageId = message.messageIdAsString();

        if (log.isDebugEnabled()) {
            log.debug("[" + consumerName + "] Received message with message id: " + messageId
                    + " and routing key: " + routingKey);
        }

        RetryOutcome outcome = retryExecutor.run(messageHandler, body, routingKey);
        RabbitMQAcknowledgementMode acknowledgementMode;
        switch (outcome.getResult()) {
            case SUCCESS:
                healthTracker.recordSuccess();
                acknowledgementMode = RabbitMQAcknowledgementMode.ACCEPTED;
                break;
            case EXHAUSTED:
                healthTracker.recordFailure();
                acknowledgementMode = deadLetterRouter.handleExhausted(body, routingKey, outcome.getLastError(),
                        consumerName, outcome.getAttempts() - 1);
                break;
            case CANCELLED:
            default:
                acknowledgementMode = RabbitMQAcknowledgementMode.REQUEUE;
                break;
        }

        handleAcknowledgement(context, messageId, acknowledgementMode);
    }

    /**
     * Settles the delivery according to the acknowledgement mode.
     *
     * @param context             The delivery context.
     * @param messageId           The message id, for logging.
     * @param acknowledgementMode The settlement to apply.
     */
    private void handleAcknowledgement(Consumer.Context context, String messageId,
                                       RabbitMQAcknowledgementMode acknowledgementMode) {
        try {
            switch (Objects.requireNonNull(acknowledgementMode)) {
                case ACCEPTED:
                    context.accept();
                    break;
                case REQUEUE:
                    context.requeue();
                    log.info("[" + consumerName + "] The message with message id: " + messageId
                            + " will be requeued.");
                    break;
                case DISCARDED:
                    context.discard();
                    log.info("[" + consumerName + "] The message with message id: " + messageId
                            + " was discarded.");
                    break;
                default:
                    log.warn("[" + consumerName + "] Unknown AcknowledgementMode: " + acknowledgementMode);
            }
        } catch (AmqpException e) {
            // an unsettled delivery is redelivered by the broker once the link is gone
            log.error("[" + consumerName + "] Could not settle message with message id: " + messageId
                    + " as " + acknowledgementMode + ". The broker will redeliver it.", e);
        }
    }

    private String getRoutingKey(Message message) {
        if (message.hasAnnotations()) {
            Map<String, Object> annotations = new HashMap<>();
            message.forEachAnnotation(annotations::put);
            Object routingKey = annotations.get(RabbitMQConstants.ROUTING_KEY_ANNOTATION);
            if (routingKey != null) {
                return routingKey.toString();
            }
        }
        return defaultRoutingKey;
    }
}
