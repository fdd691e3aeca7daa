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
package org.wso2.carbon.messaging.rabbitmq.deadletter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.amqp.AmqpException;
import com.rabbitmq.client.amqp.Message;
import com.rabbitmq.client.amqp.Publisher;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.wso2.carbon.messaging.rabbitmq.RabbitMQAcknowledgementMode;
import org.wso2.carbon.messaging.rabbitmq.RabbitMQChannel;
import org.wso2.carbon.messaging.rabbitmq.RabbitMQConstants;
import org.wso2.carbon.messaging.rabbitmq.RabbitMQPublishException;
import org.wso2.carbon.messaging.rabbitmq.RabbitMQPublisherCallBack;
import org.wso2.carbon.messaging.rabbitmq.config.DeadLetterConfig;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Decides what happens to a message whose retries are exhausted.
 * <ul>
 *     <li>Dead-lettering enabled: a {@link FailureEnvelope} is published to the dead-letter exchange on the
 *     {@code .failed} routing key and the original is accepted, since it has been moved rather than lost.</li>
 *     <li>Dead-lettering disabled: the original is discarded, so it is not redelivered forever.</li>
 *     <li>The dead-letter publish fails: the original is discarded as a last resort.</li>
 * </ul>
 * The router is used from the consumer's dispatcher thread only.
 */
public class DeadLetterRouter {
    private static final Log log = LogFactory.getLog(DeadLetterRouter.class);

    private final String name;
    private final RabbitMQChannel channel;
    private final DeadLetterConfig deadLetterConfig;
    private final ObjectMapper objectMapper;
    private final long publisherAckWaitTime;
    private final Clock clock;
    private Publisher deadLetterPublisher;

    public DeadLetterRouter(String name, RabbitMQChannel channel, DeadLetterConfig deadLetterConfig,
                            ObjectMapper objectMapper, long publisherAckWaitTime) {
        this(name, channel, deadLetterConfig, objectMapper, publisherAckWaitTime, Clock.systemUTC());
    }

    public DeadLetterRouter(String name, RabbitMQChannel channel, DeadLetterConfig deadLetterConfig,
                            ObjectMapper objectMapper, long publisherAckWaitTime, Clock clock) {
        this.name = name;
        this.channel = channel;
        this.deadLetterConfig = deadLetterConfig;
        this.objectMapper = objectMapper;
        this.publisherAckWaitTime = publisherAckWaitTime;
        this.clock = clock;
    }

    /**
     * Handles a message that failed every attempt.
     *
     * @param body              The original message body.
     * @param routingKey        The routing key the message arrived with.
     * @param error             The error of the last attempt.
     * @param consumerName      The consumer giving up on the message.
     * @param retryAttemptsMade The number of retries made after the first attempt.
     * @return The settlement to apply to the original delivery.
     */
    public RabbitMQAcknowledgementMode handleExhausted(byte[] body, String routingKey, Exception error,
                                                       String consumerName, int retryAttemptsMade) {
        if (!deadLetterConfig.isEnabled()) {
            log.warn("[" + name + "] Dead-lettering is disabled. Message with routing key: " + routingKey
                    + " will be discarded after " + retryAttemptsMade + " retries.");
            return RabbitMQAcknowledgementMode.DISCARDED;
        }

        FailureEnvelope envelope = FailureEnvelope.of(body, routingKey, error, retryAttemptsMade, consumerName,
                clock.instant());
        try {
            publish(envelope);
        } catch (DeadLetterPublishException e) {
            log.error("[" + name + "] Could not move failed message with routing key: " + routingKey
                    + " to dead-letter exchange: " + deadLetterConfig.getDeadLetterExchange()
                    + ". The message will be discarded. Original failure: " + envelope.getFailureReason(), e);
            return RabbitMQAcknowledgementMode.DISCARDED;
        }

        log.warn("[" + name + "] Message with routing key: " + routingKey + " moved to dead-letter queue: "
                + deadLetterConfig.getDeadLetterQueue() + " after " + retryAttemptsMade + " retries. Reason: "
                + envelope.getFailureReason());
        return RabbitMQAcknowledgementMode.ACCEPTED;
    }

    /**
     * Publishes the envelope and waits for the broker to accept it.
     *
     * @param envelope The envelope.
     * @throws DeadLetterPublishException If serialization, publishing or the broker confirmation fails.
     */
    void publish(FailureEnvelope envelope) throws DeadLetterPublishException {
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new DeadLetterPublishException("[" + name + "] Could not serialize failure envelope.", e);
        }

        String messageId = UUID.randomUUID().toString();
        try {
            Publisher publisher = getDeadLetterPublisher();
            Message message = publisher.message(payload)
                    .messageId(messageId)
                    .contentType(RabbitMQConstants.JSON_CONTENT_TYPE)
                    .contentEncoding(RabbitMQConstants.UTF_8_ENCODING);
            RabbitMQPublisherCallBack callBack = new RabbitMQPublisherCallBack(messageId);
            publisher.publish(message, callBack);
            callBack.awaitAccepted(publisherAckWaitTime);
        } catch (AmqpException | IllegalStateException e) {
            // the link may be unusable now, open a new one for the next envelope
            Publisher brokenPublisher = deadLetterPublisher;
            deadLetterPublisher = null;
            if (brokenPublisher != null) {
                channel.release(brokenPublisher);
            }
            throw new DeadLetterPublishException("[" + name + "] Error while publishing failure envelope "
                    + messageId + " to " + deadLetterConfig.getDeadLetterExchange(), e);
        } catch (RabbitMQPublishException e) {
            throw new DeadLetterPublishException("[" + name + "] Failure envelope " + messageId
                    + " was not accepted by " + deadLetterConfig.getDeadLetterExchange(), e);
        }
    }

    private Publisher getDeadLetterPublisher() {
        if (deadLetterPublisher == null) {
            deadLetterPublisher = channel.createExchangePublisher(deadLetterConfig.getDeadLetterExchange(),
                    deadLetterConfig.getDeadLetterRoutingKey(), Duration.ofMillis(publisherAckWaitTime));
        }
        return deadLetterPublisher;
    }
}
