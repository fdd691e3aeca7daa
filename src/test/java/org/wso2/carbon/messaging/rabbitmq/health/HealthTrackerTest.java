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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.wso2.carbon.messaging.rabbitmq.config.DeadLetterConfig;
import org.wso2.carbon.messaging.rabbitmq.config.RetryPolicy;
import org.wso2.carbon.messaging.rabbitmq.config.SubscriptionConfig;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

public class HealthTrackerTest {

    private MutableClock clock;
    private HealthTracker tracker;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2025-01-01T10:00:00Z"));
        SubscriptionConfig subscription = SubscriptionConfig.forExchange("orders.exchange", "order.created",
                "orders");
        tracker = new HealthTracker("orders-consumer", subscription, DeadLetterConfig.of(subscription, true),
                RetryPolicy.of(3, Duration.ofSeconds(5)), clock);
    }

    @Test
    void newConsumerIsHealthyButIdle() {
        HealthSnapshot snapshot = tracker.snapshot();

        assertThat(snapshot.getStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(snapshot.getFailureRate()).isZero();
        assertThat(snapshot.getLastSuccessTimestamp()).isNull();
        assertThat(snapshot.getHealthSummary()).isEqualTo("No messages processed");
        assertThat(snapshot.getConsumerName()).isEqualTo("orders-consumer");
        assertThat(snapshot.getQueueName()).isEqualTo("orders");
        assertThat(snapshot.getExchangeName()).isEqualTo("orders.exchange");
        assertThat(snapshot.isDeadLetterEnabled()).isTrue();
        assertThat(snapshot.getMaxRetryAttempts()).isEqualTo(3);
        assertThat(snapshot.getRetryDelay()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void failureRateThresholdsDriveTheStatus() {
        for (int i = 0; i < 9; i++) {
            tracker.recordSuccess();
        }

        tracker.recordFailure();
        // 1 of 10 is not above 10%
        assertThat(tracker.snapshot().getStatus()).isEqualTo(HealthStatus.HEALTHY);

        tracker.recordFailure();
        assertThat(tracker.snapshot().getStatus()).isEqualTo(HealthStatus.DEGRADED);

        tracker.recordFailure();
        HealthSnapshot snapshot = tracker.snapshot();
        assertThat(snapshot.getStatus()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(snapshot.getFailureCount()).isEqualTo(3);
        assertThat(snapshot.getSuccessCount()).isEqualTo(9);
        assertThat(snapshot.getFailureRatePercentage()).isEqualTo(25.0);
        assertThat(snapshot.getHealthSummary()).isEqualTo("High failure rate: 25.0%");
    }

    @Test
    void successRestoresHealthWhileResourcesAreOpen() {
        tracker.recordFailure();
        assertThat(tracker.snapshot().getStatus()).isEqualTo(HealthStatus.UNHEALTHY);

        tracker.recordSuccess();

        assertThat(tracker.snapshot().getStatus()).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    void closedConnectionOrChannelIsUnhealthy() {
        tracker.recordSuccess();

        assertThat(tracker.evaluate(false, true)).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(tracker.snapshot().getHealthSummary()).isEqualTo("Connection closed");

        assertThat(tracker.evaluate(true, false)).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(tracker.snapshot().getHealthSummary()).isEqualTo("Channel closed");

        // a success does not hide a closed channel
        tracker.recordSuccess();
        assertThat(tracker.snapshot().getStatus()).isEqualTo(HealthStatus.UNHEALTHY);

        assertThat(tracker.evaluate(true, true)).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    void summaryListsEveryIssue() {
        tracker.recordFailure();
        tracker.evaluate(false, false);

        assertThat(tracker.snapshot().getHealthSummary())
                .isEqualTo("Connection closed, Channel closed, High failure rate: 100.0%, No messages processed");
    }

    @Test
    void activelyProcessingWithinFiveMinutesOfTheLastSuccess() {
        tracker.recordSuccess();

        clock.advance(Duration.ofMinutes(4));
        HealthSnapshot recent = tracker.snapshot();
        assertThat(recent.isActivelyProcessing()).isTrue();
        assertThat(recent.getHealthSummary()).isEqualTo("All systems operational");

        clock.advance(Duration.ofMinutes(2));
        HealthSnapshot stale = tracker.snapshot();
        assertThat(stale.isActivelyProcessing()).isFalse();
        // it has processed messages before, so idleness alone is not an issue
        assertThat(stale.getHealthSummary()).isEqualTo("All systems operational");
        assertThat(stale.getLastCheckTimestamp()).isEqualTo(Instant.parse("2025-01-01T10:06:00Z"));
    }

    static final class MutableClock extends Clock {
        private Instant instant;

        MutableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
