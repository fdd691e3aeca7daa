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

import org.wso2.carbon.messaging.rabbitmq.RabbitMQConstants;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Immutable view of a consumer's health at the moment it was taken.
 * Produced by {@link HealthTracker#snapshot()}.
 */
public final class HealthSnapshot {

    private final String consumerName;
    private final String queueName;
    private final String exchangeName;
    private final boolean deadLetterEnabled;
    private final int maxRetryAttempts;
    private final Duration retryDelay;
    private final HealthStatus status;
    private final boolean connectionOpen;
    private final boolean channelOpen;
    private final long successCount;
    private final long failureCount;
    private final Instant lastSuccessTimestamp;
    private final Instant lastCheckTimestamp;

    HealthSnapshot(HealthTracker.ConsumerDescriptor descriptor, HealthStatus status, boolean connectionOpen,
                   boolean channelOpen, long successCount, long failureCount, Instant lastSuccessTimestamp,
                   Instant lastCheckTimestamp) {
        this.consumerName = descriptor.consumerName;
        this.queueName = descriptor.queueName;
        this.exchangeName = descriptor.exchangeName;
        this.deadLetterEnabled = descriptor.deadLetterEnabled;
        this.maxRetryAttempts = descriptor.maxRetryAttempts;
        this.retryDelay = descriptor.retryDelay;
        this.status = status;
        this.connectionOpen = connectionOpen;
        this.channelOpen = channelOpen;
        this.successCount = successCount;
        this.failureCount = failureCount;
        this.lastSuccessTimestamp = lastSuccessTimestamp;
        this.lastCheckTimestamp = lastCheckTimestamp;
    }

    public String getConsumerName() {
        return consumerName;
    }

    public String getQueueName() {
        return queueName;
    }

    /**
     * @return The exchange name, or null for a simple queue consumer.
     */
    public String getExchangeName() {
        return exchangeName;
    }

    public boolean isDeadLetterEnabled() {
        return deadLetterEnabled;
    }

    public int getMaxRetryAttempts() {
        return maxRetryAttempts;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public HealthStatus getStatus() {
        return status;
    }

    public boolean isConnectionOpen() {
        return connectionOpen;
    }

    public boolean isChannelOpen() {
        return channelOpen;
    }

    public long getSuccessCount() {
        return successCount;
    }

    public long getFailureCount() {
        return failureCount;
    }

    /**
     * @return When a message was last handled successfully, or null if none has been.
     */
    public Instant getLastSuccessTimestamp() {
        return lastSuccessTimestamp;
    }

    public Instant getLastCheckTimestamp() {
        return lastCheckTimestamp;
    }

    /**
     * @return {@code failureCount / (successCount + failureCount)}, or 0 when nothing was processed.
     */
    public double getFailureRate() {
        return failureRate(successCount, failureCount);
    }

    public double getFailureRatePercentage() {
        return getFailureRate() * 100;
    }

    /**
     * @param now The evaluation time.
     * @return True when a message succeeded within the active processing window before {@code now}.
     */
    public boolean isActivelyProcessing(Instant now) {
        return lastSuccessTimestamp != null && lastSuccessTimestamp.isAfter(
                now.minus(Duration.ofMinutes(RabbitMQConstants.ACTIVE_PROCESSING_WINDOW_MINUTES)));
    }

    /**
     * @return Whether the consumer was actively processing when the snapshot was taken.
     */
    public boolean isActivelyProcessing() {
        return isActivelyProcessing(lastCheckTimestamp);
    }

    /**
     * Human readable list of the problems found, or {@code "All systems operational"}.
     *
     * @return The summary.
     */
    public String getHealthSummary() {
        List<String> issues = new ArrayList<>();
        if (!connectionOpen) {
            issues.add("Connection closed");
        }
        if (!channelOpen) {
            issues.add("Channel closed");
        }
        if (getFailureRate() > RabbitMQConstants.DEGRADED_FAILURE_RATE_THRESHOLD) {
            issues.add(String.format(Locale.ROOT, "High failure rate: %.1f%%", getFailureRatePercentage()));
        }
        if (!isActivelyProcessing() && successCount == 0) {
            issues.add("No messages processed");
        }
        return issues.isEmpty() ? "All systems operational" : String.join(", ", issues);
    }

    static double failureRate(long successCount, long failureCount) {
        long total = successCount + failureCount;
        return total > 0 ? (double) failureCount / total : 0;
    }

    @Override
    public String toString() {
        return "HealthSnapshot{consumer='" + consumerName + "', status=" + status + ", connectionOpen="
                + connectionOpen + ", channelOpen=" + channelOpen + ", success=" + successCount + ", failure="
                + failureCount + ", lastSuccess=" + lastSuccessTimestamp + ", lastCheck=" + lastCheckTimestamp + "}";
    }
}
