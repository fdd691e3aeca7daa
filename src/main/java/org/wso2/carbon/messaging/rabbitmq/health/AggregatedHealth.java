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

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * Fleet-wide health combined from several consumer snapshots by {@link HealthAggregator}.
 */
public final class AggregatedHealth {

    private final HealthStatus status;
    private final String description;
    private final int healthyCount;
    private final int degradedCount;
    private final int unhealthyCount;
    private final List<HealthSnapshot> consumers;
    private final Instant timestamp;

    AggregatedHealth(HealthStatus status, String description, int healthyCount, int degradedCount,
                     int unhealthyCount, List<HealthSnapshot> consumers, Instant timestamp) {
        this.status = status;
        this.description = description;
        this.healthyCount = healthyCount;
        this.degradedCount = degradedCount;
        this.unhealthyCount = unhealthyCount;
        this.consumers = Collections.unmodifiableList(consumers);
        this.timestamp = timestamp;
    }

    public HealthStatus getStatus() {
        return status;
    }

    public String getDescription() {
        return description;
    }

    public int getHealthyCount() {
        return healthyCount;
    }

    public int getDegradedCount() {
        return degradedCount;
    }

    public int getUnhealthyCount() {
        return unhealthyCount;
    }

    public int getTotalConsumers() {
        return consumers.size();
    }

    public List<HealthSnapshot> getConsumers() {
        return consumers;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
