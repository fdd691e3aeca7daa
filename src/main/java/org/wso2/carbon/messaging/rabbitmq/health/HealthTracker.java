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
package org.wso2.carbon.messaging.rabbitmq.health;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.wso2.carbon.messaging.rabbitmq.RabbitMQConstants;
import org.wso2.carbon.messaging.rabbitmq.config.DeadLetterConfig;
import org.wso2.carbon.messaging.rabbitmq.config.RetryPolicy;
import org.wso2.carbon.messaging.rabbitmq.config.SubscriptionConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Processing counters and health status of one consumer.
 * <p>
 * Concurrency contract: every mutation and read goes through a single lock owned by the tracker.
 * Only the owning consumer records outcomes; health-check callers only read snapshots.
 * <p>
 * Status rules:
 * <ul>
 *     <li>a success makes the consumer healthy, provided its connection and channel were open when
 *     last evaluated;</li>
 *     <li>a failure that pushes the failure rate above 20% makes it unhealthy, above 10% degraded;</li>
 *     <li>{@link #evaluate(boolean, boolean)} reports unhealthy whenever the connection or channel is
 *     closed, and otherwise applies the failure rate thresholds.</li>
 * </ul>
 */
public class HealthTracker {
    private static final Log log = LogFactory.getLog(HealthTracker.class);

    private final ConsumerDescriptor descriptor;
    private final Clock clock;
    private final Object lock = new Object();

    private HealthStatus status = HealthStatus.HEALTHY;
    private boolean connectionOpen = true;
    private boolean channelOpen = true;
    private long successCount;
    private long failureCount;
    private Instant lastSuccessTimestamp;

    public HealthTracker(String consumerName, SubscriptionConfig subscription, DeadLetterConfig deadLetterConfig,
                         RetryPolicy retryPolicy) {
        this(consumerName, subscription, deadLetterConfig, retryPolicy, Clock.systemUTC());
    }

    public HealthTracker(String consumerName, SubscriptionConfig subscription, DeadLetterConfig deadLetterConfig,
                         RetryPolicy retryPolicy, Clock clock) {
        this.descriptor = new ConsumerDescriptor(consumerName, subscription.getQueueName(),
                subscription.getExchangeName(), deadLetterConfig.isEnabled(), retryPolicy.getMaxAttempts(),
                retryPolicy.getBaseDelay());
        this.clock = clock;
    }

    public void recordSuccess() {
        synchronized (lock) {
            successCount++;
            lastSuccessTimestamp = clock.instant();
            if (connectionOpen && channelOpen) {
                status = HealthStatus.HEALTHY;
            }
        }
    }

    public void recordFailure() {
        synchronized (lock) {
            failureCount++;
            HealthStatus rated = rateStatus();
            if (rated != HealthStatus.HEALTHY) {
                if (rated != status) {
                    log.warn("[" + descriptor.consumerName + "] Consumer health changed to " + rated
                            + ". Failure rate: " + HealthSnapshot.failureRate(successCount, failureCount));
                }
                status = rated;
            }
        }
    }

    /**
     * Re-evaluates the status against the live state of the connection and channel.
     *
     * @param connectionOpen Whether the consumer's connection is open.
     * @param channelOpen    Whether the consumer's channel is open.
     * @return The new status.
     */
    public HealthStatus evaluate(boolean connectionOpen, boolean channelOpen) {
        synchronized (lock) {
            this.connectionOpen = connectionOpen;
            this.channelOpen = channelOpen;
            status = (!connectionOpen || !channelOpen) ? HealthStatus.UNHEALTHY : rateStatus();
            return status;
        }
    }

    public HealthSnapshot snapshot() {
        synchronized (lock) {
            return new HealthSnapshot(descriptor, status, connectionOpen, channelOpen, successCount, failureCount,
                    lastSuccessTimestamp, clock.instant());
        }
    }

    // caller holds the lock
    private HealthStatus rateStatus() {
        double failureRate = HealthSnapshot.failureRate(successCount, failureCount);
        if (failureRate > RabbitMQConstants.UNHEALTHY_FAILURE_RATE_THRESHOLD) {
            return HealthStatus.UNHEALTHY;
        }
        if (failureRate > RabbitMQConstants.DEGRADED_FAILURE_RATE_THRESHOLD) {
            return HealthStatus.DEGRADED;
        }
        return HealthStatus.HEALTHY;
    }

    /**
     * Static description of the consumer a tracker belongs to.
     */
    static final class ConsumerDescriptor {
        final String consumerName;
        final String queueName;
        final String exchangeName;
        final boolean deadLetterEnabled;
        final int maxRetryAttempts;
        final Duration retryDelay;

        ConsumerDescriptor(String consumerName, String queueName, String exchangeName, boolean deadLetterEnabled,
                           int maxRetryAttempts, Duration retryDelay) {
            this.consumerName = consumerName;
            this.queueName = queueName;
            this.exchangeName = exchangeName;
            this.deadLetterEnabled = deadLetterEnabled;
            this.maxRetryAttempts = maxRetryAttempts;
            this.retryDelay = retryDelay;
        }
    }
}
