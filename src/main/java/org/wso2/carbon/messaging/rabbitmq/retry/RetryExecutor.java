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
package org.wso2.carbon.messaging.rabbitmq.retry;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.wso2.carbon.messaging.rabbitmq.config.RetryPolicy;
import org.wso2.carbon.messaging.rabbitmq.message.handler.RabbitMQMessageHandler;

import java.time.Duration;

/**
 * Runs a message handler with bounded exponential back-off.
 * <p>
 * The handler is invoked at most {@code maxAttempts + 1} times. Every exception it throws counts as
 * a retryable failure; a payload that can never be processed is retried like a transient outage.
 * Back-off waits end early when the {@link ShutdownSignal} fires, but a handler invocation that has
 * started always runs to completion.
 */
public class RetryExecutor {
    private static final Log log = LogFactory.getLog(RetryExecutor.class);

    private final String name;
    private final RetryPolicy retryPolicy;
    private final ShutdownSignal shutdownSignal;

    public RetryExecutor(String name, RetryPolicy retryPolicy, ShutdownSignal shutdownSignal) {
        this.name = name;
        this.retryPolicy = retryPolicy;
        this.shutdownSignal = shutdownSignal;
    }

    public RetryOutcome run(RabbitMQMessageHandler handler, byte[] body) {
        return run(handler, body, null);
    }

    /**
     * Invokes the handler until it succeeds, the attempts run out, or a shutdown cancels a back-off wait.
     *
     * @param handler    The business handler.
     * @param body       The message body.
     * @param routingKey The routing key the message arrived with, carried into the outcome.
     * @return The outcome, holding the last error when the handler never succeeded.
     */
    public RetryOutcome run(RabbitMQMessageHandler handler, byte[] body, String routingKey) {
        int totalAttempts = retryPolicy.getTotalAttempts();
        Exception lastError = null;

        for (int attempt = 1; attempt <= totalAttempts; attempt++) {
            try {
                handler.handle(body);
                if (attempt > 1) {
                    log.info("[" + name + "] Message processed successfully on attempt " + attempt + " of "
                            + totalAttempts + ".");
                }
                return RetryOutcome.success(attempt, body, routingKey);
            } catch (Exception e) {
                lastError = e;
                if (attempt == totalAttempts) {
                    break;
                }
                Duration delay = retryPolicy.delayForAttempt(attempt);
                log.warn("[" + name + "] Message processing failed on attempt " + attempt + " of " + totalAttempts
                        + ": " + e.getMessage() + ". Retrying in " + delay.toMillis() + "ms.");
                if (log.isDebugEnabled()) {
                    log.debug("[" + name + "] Failure of attempt " + attempt, e);
                }
                if (waitForRetry(delay)) {
                    log.info("[" + name + "] Retry of message cancelled by shutdown after " + attempt
                            + " attempt(s).");
                    return RetryOutcome.cancelled(attempt, lastError, body, routingKey);
                }
            }
        }

        log.error("[" + name + "] Message processing failed after " + totalAttempts + " attempt(s).", lastError);
        return RetryOutcome.exhausted(totalAttempts, lastError, body, routingKey);
    }

    /**
     * @param delay The back-off delay.
     * @return True if the wait was cut short by a shutdown or an interrupt.
     */
    private boolean waitForRetry(Duration delay) {
        try {
            return shutdownSignal.await(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[" + name + "] Interrupted while waiting to retry message processing.");
            return true;
        }
    }
}
