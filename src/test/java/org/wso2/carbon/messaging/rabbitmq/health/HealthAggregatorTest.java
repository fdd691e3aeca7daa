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

import org.junit.jupiter.api.Test;
import org.wso2.carbon.messaging.rabbitmq.config.DeadLetterConfig;
import org.wso2.carbon.messaging.rabbitmq.config.RetryPolicy;
import org.wso2.carbon.messaging.rabbitmq.config.SubscriptionConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

public class HealthAggregatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T10:00:00Z"), ZoneOffset.UTC);

    private final HealthAggregator aggregator = new HealthAggregator(CLOCK);

    @Test
    void allHealthyConsumers() throws Exception {
        HealthTracker orders = tracker("orders");
        HealthTracker payments = tracker("payments");
        orders.recordSuccess();
        payments.recordSuccess();

        AggregatedHealth health = aggregator.aggregate(Arrays.asList(orders.snapshot(), payments.snapshot()));

        assertThat(health.getStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(health.getDescription()).isEqualTo("All 2 consumers are healthy");
        assertThat(health.getHealthyCount()).isEqualTo(2);
        assertThat(health.getTotalConsumers()).isEqualTo(2);
        assertThat(health.getTimestamp()).isEqualTo(CLOCK.instant());
    }

    @Test
    void worstStatusWins() throws Exception {
        HealthTracker healthy = tracker("orders");
        healthy.recordSuccess();
        HealthTracker degraded = tracker("payments");
        for (int i = 0; i < 8; i++) {
            degraded.recordSuccess();
        }
        degraded.recordFailure();
        degraded.recordFailure();
        HealthTracker unhealthy = tracker("invoices");
        unhealthy.recordSuccess();
        unhealthy.evaluate(false, true);

        AggregatedHealth health = aggregator.aggregate(Arrays.asList(healthy.snapshot(), degraded.snapshot(),
                unhealthy.snapshot()));

        assertThat(health.getStatus()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(health.getHealthyCount()).isEqualTo(1);
        assertThat(health.getDegradedCount()).isEqualTo(1);
        assertThat(health.getUnhealthyCount()).isEqualTo(1);
        assertThat(health.getDescription()).isEqualTo("Issues detected: payments: High failure rate: 20.0%; "
                + "invoices: Connection closed");
    }

    @Test
    void degradedWithoutUnhealthy() throws Exception {
        HealthTracker degraded = tracker("payments");
        for (int i = 0; i < 8; i++) {
            degraded.recordSuccess();
        }
        degraded.recordFailure();
        degraded.recordFailure();

        assertThat(aggregator.aggregate(Collections.singletonList(degraded.snapshot())).getStatus())
                .isEqualTo(HealthStatus.DEGRADED);
    }

    @Test
    void noConsumersIsHealthy() {
        AggregatedHealth health = aggregator.aggregate(Collections.emptyList());

        assertThat(health.getStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(health.getTotalConsumers()).isZero();
    }

    private HealthTracker tracker(String name) throws Exception {
        SubscriptionConfig subscription = SubscriptionConfig.forQueue(name);
        return new HealthTracker(name, subscription, DeadLetterConfig.of(subscription, true),
                RetryPolicy.of(3, Duration.ofSeconds(5)), CLOCK);
    }
}
