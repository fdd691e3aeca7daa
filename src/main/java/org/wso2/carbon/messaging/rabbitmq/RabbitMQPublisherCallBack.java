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

import com.rabbitmq.client.amqp.Publisher;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * This class implements the RabbitMQ {@code Publisher.Callback} interface to track the outcome of
 * one published message. The broker settlement completes {@link #result}; anything but
 * {@code ACCEPTED} completes it exceptionally.
 */
public class RabbitMQPublisherCallBack implements Publisher.Callback {

    private final String messageId;

    // Completed once the broker settles the message
    public final CompletableFuture<Publisher.Status> result = new CompletableFuture<>();

    /**
     * @param messageId The id of the message this callback tracks, used in failure messages.
     */
    public RabbitMQPublisherCallBack(String messageId) {
        this.messageId = messageId;
    }

    /**
     * Handles the status of the published message.
     *
     * @param context The context of the message publishing operation.
     */
    @Override
    public void handle(Publisher.Context context) {
        if (context.status() == Publisher.Status.ACCEPTED) {
            result.complete(Publisher.Status.ACCEPTED);
        } else {
            result.completeExceptionally(new RabbitMQPublishException("Message with message id: " + messageId
                    + " not accepted: " + context.status(), context.failureCause()));
        }
    }

    /**
     * Waits for the broker outcome.
     *
     * @param timeoutMillis Maximum time to wait.
     * @throws RabbitMQPublishException If the message was not accepted, the wait timed out, or the
     *                                  thread was interrupted while waiting.
     */
    public void awaitAccepted(long timeoutMillis) throws RabbitMQPublishException {
        try {
            result.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RabbitMQPublishException) {
                throw (RabbitMQPublishException) cause;
            }
            throw new RabbitMQPublishException("Error while publishing message with message id: " + messageId, cause);
        } catch (TimeoutException e) {
            throw new RabbitMQPublishException("Timed out after " + timeoutMillis
                    + "ms waiting for the broker to accept message with message id: " + messageId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RabbitMQPublishException("Interrupted while waiting for the broker to accept message "
                    + "with message id: " + messageId, e);
        }
    }
}
