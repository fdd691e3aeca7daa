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

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Combines consumer snapshots into one view. The combined status is the worst individual status:
 * any unhealthy consumer makes the fleet unhealthy, otherwise any degraded one makes it degraded.
 */
public class HealthAggregator {

    private final Clock clock;

    public HealthAggregator() {
        this(Clock.systemUTC());
    }

    public HealthAggregator(Clock clock) {
        this.clock = clock;
    }

    public AggregatedHealth aggregate(Collection<HealthSnapshot> snapshots) {
        HealthStatus overall = HealthStatus.HEALTHY;
        int healthy = 0;
        int degraded = 0;
        int unhealthy = 0;
        List<String> issues = new ArrayList<>();

        for (HealthSnapshot snapshot : snapshots) {
            switch (snapshot.getStatus()) {
                case UNHEALTHY:
                    unhealthy++;
                    break;
                case DEGRADED:
                    degraded++;
                    break;
                default:
                    healthy++;
                    break;
            }
            if (snapshot.getStatus() != HealthStatus.HEALTHY) {
                issues.add(snapshot.getConsumerName() + ": " + snapshot.getHealthSummary());
            }
            overall = overall.worst(snapshot.getStatus());
        }

        String description = issues.isEmpty()
                ? "All " + snapshots.size() + " consumers are healthy"
                : "Issues detected: " + String.join("; ", issues);
        return new AggregatedHealth(overall, description, healthy, degraded, unhealthy,
                new ArrayList<>(snapshots), clock.instant());
    }
}
