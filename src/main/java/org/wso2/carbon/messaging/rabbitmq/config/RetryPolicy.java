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

import org.wso2.carbon.messaging.rabbitmq.RabbitMQConfigurationException;
import org.wso2.carbon.messaging.rabbitmq.RabbitMQConstants;
import org.wso2.carbon.messaging.rabbitmq.RabbitMQUtils;

import java.time.Duration;
import java.util.Properties;

/**
 * Bounded exponential back-off. A message is attempted once and then retried up to
 * {@code maxAttempts} times; retry {@code n} (1-indexed) waits {@code baseDelay * 2^(n-1)}.
 */
public final class RetryPolicy {

    /**
     * Upper bound on retries. The back-off doubles per retry and a {@code long} multiplier stops at 2^62.
     */
    public static final int MAX_RETRY_ATTEMPTS = 62;

    private final int maxAttempts;
    private final Duration baseDelay;

    private RetryPolicy(int maxAttempts, Duration baseDelay) {
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
    }

    /**
     * @param maxAttempts Number of retries after the first attempt, between 0 and {@link #MAX_RETRY_ATTEMPTS}.
     * @param baseDelay   Delay before the first retry, not negative.
     * @return The policy.
     * @throws RabbitMQConfigurationException If either value is out of range.
     */
    public static RetryPolicy of(int maxAttempts, Duration baseDelay) throws RabbitMQConfigurationException {
        if (maxAttempts < 0) {
            throw new RabbitMQConfigurationException("Maximum retry attempts must not be negative: " + maxAttempts);
        }
        if (maxAttempts > MAX_RETRY_ATTEMPTS) {
            throw new RabbitMQConfigurationException("Maximum retry attempts must not exceed "
                    + MAX_RETRY_ATTEMPTS + ": " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new RabbitMQConfigurationException("Retry base delay must not be negative: " + baseDelay);
        }
        return new RetryPolicy(maxAttempts, baseDelay);
    }

    /**
     * Reads {@link RabbitMQConstants#RETRY_MAX_ATTEMPTS} and {@link RabbitMQConstants#RETRY_BASE_DELAY}.
     *
     * @param properties The configuration properties.
     * @param logPrefix  Prefix identifying the consumer in log output.
     * @return The policy.
     * @throws RabbitMQConfigurationException If a configured value is out of range.
     */
    public static RetryPolicy fromProperties(Properties properties, String logPrefix)
            throws RabbitMQConfigurationException {
        int maxAttempts = RabbitMQUtils.getIntProperty(properties, RabbitMQConstants.RETRY_MAX_ATTEMPTS,
                RabbitMQConstants.DEFAULT_RETRY_MAX_ATTEMPTS, logPrefix);
        long baseDelay = RabbitMQUtils.getLongProperty(properties, RabbitMQConstants.RETRY_BASE_DELAY,
                RabbitMQConstants.DEFAULT_RETRY_BASE_DELAY, logPrefix);
        return of(maxAttempts, Duration.ofMillis(baseDelay));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    /**
     * @return The total number of handler invocations allowed: the first attempt plus every retry.
     */
    public int getTotalAttempts() {
        return maxAttempts + 1;
    }

    /**
     * Computes the wait before a retry.
     *
     * @param retryAttempt The retry number, starting at 1.
     * @return {@code baseDelay * 2^(retryAttempt-1)}.
     */
    public Duration delayForAttempt(int retryAttempt) {
        if (retryAttempt < 1) {
            throw new IllegalArgumentException("Retry attempts are numbered from 1: " + retryAttempt);
        }
        int shift = Math.min(retryAttempt - 1, MAX_RETRY_ATTEMPTS);
        return baseDelay.multipliedBy(1L << shift);
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", baseDelay=" + baseDelay.toMillis() + "ms}";
    }
}
