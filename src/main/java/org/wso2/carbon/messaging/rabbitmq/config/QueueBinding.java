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

import org.apache.commons.lang.StringUtils;

import java.util.Objects;

/**
 * One routing key to queue pair of an exchange publish.
 */
public final class QueueBinding {

    private final String routingKey;
    private final String queueName;

    public QueueBinding(String routingKey, String queueName) {
        if (StringUtils.isBlank(routingKey) || StringUtils.isBlank(queueName)) {
            throw new IllegalArgumentException("Routing key and queue name are required. Routing key: '"
                    + routingKey + "', queue: '" + queueName + "'");
        }
        this.routingKey = routingKey;
        this.queueName = queueName;
    }

    public String getRoutingKey() {
        return routingKey;
    }

    public String getQueueName() {
        return queueName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueueBinding)) {
            return false;
        }
        QueueBinding that = (QueueBinding) o;
        return routingKey.equals(that.routingKey) && queueName.equals(that.queueName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(routingKey, queueName);
    }

    @Override
    public String toString() {
        return routingKey + " -> " + queueName;
    }
}
