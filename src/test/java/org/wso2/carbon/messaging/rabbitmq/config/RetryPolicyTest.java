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

import org.junit.jupiter.api.Test;
import org.wso2.carbon.messaging.rabbitmq.RabbitMQConfigurationException;
import org.wso2.carbon.messaging.rabbitmq.RabbitMQConstants;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RetryPolicyTest {

    @Test
    void delaysDoubleFromTheBaseDelay() throws Exception {
        RetryPolicy policy = RetryPolicy.of(3, Duration.ofMillis(100));

        assertThat(policy.delayForAttempt(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delayForAttempt(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.delayForAttempt(3)).isEqualTo(Duration.ofMillis(400));
        assertThat(policy.getTotalAttempts()).isEqualTo(4);
    }

    @Test
    void zeroRetriesMeansASingleAttempt() throws Exception {
        assertThat(RetryPolicy.of(0, Duration.ZERO).getTotalAttempts()).isEqualTo(1);
    }

    @Test
    void rejectsNegativeValues() {
        assertThatThrownBy(() -> RetryPolicy.of(-1, Duration.ofMillis(100)))
                .isInstanceOf(RabbitMQConfigurationException.class);
        assertThatThrownBy(() -> RetryPolicy.of(1, Duration.ofMillis(-1)))
                .isInstanceOf(RabbitMQConfigurationException.class);
    }

    @Test
    void rejectsRetryCountsBeyondTheBackOffRange() throws Exception {
        assertThat(RetryPolicy.of(RetryPolicy.MAX_RETRY_ATTEMPTS, Duration.ZERO).getTotalAttempts())
                .isEqualTo(RetryPolicy.MAX_RETRY_ATTEMPTS + 1);
        assertThatThrownBy(() -> RetryPolicy.of(RetryPolicy.MAX_RETRY_ATTEMPTS + 1, Duration.ZERO))
                .isInstanceOf(RabbitMQConfigurationException.class);
        assertThatThrownBy(() -> RetryPolicy.of(Integer.MAX_VALUE, Duration.ofMillis(1)))
                .isInstanceOf(RabbitMQConfigurationException.class)
                .hasMessageContaining(String.valueOf(Integer.MAX_VALUE));
    }

    @Test
    void retryNumbersStartAtOne() throws Exception {
        RetryPolicy policy = RetryPolicy.of(3, Duration.ofMillis(100));

        assertThatThrownBy(() -> policy.delayForAttempt(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readsDefaultsAndOverridesFromProperties() throws Exception {
        RetryPolicy defaults = RetryPolicy.fromProperties(new Properties(), "[test]");
        assertThat(defaults.getMaxAttempts()).isEqualTo(3);
        assertThat(defaults.getBaseDelay()).isEqualTo(Duration.ofSeconds(5));

        Properties properties = new Properties();
        properties.setProperty(RabbitMQConstants.RETRY_MAX_ATTEMPTS, "5");
        properties.setProperty(RabbitMQConstants.RETRY_BASE_DELAY, "250");
        RetryPolicy configured = RetryPolicy.fromProperties(properties, "[test]");
        assertThat(configured.getMaxAttempts()).isEqualTo(5);
        assertThat(configured.getBaseDelay()).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    void invalidNumbersFallBackToDefaults() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(RabbitMQConstants.RETRY_MAX_ATTEMPTS, "many");

        assertThat(RetryPolicy.fromProperties(properties, "[test]").getMaxAttempts())
                .isEqualTo(RabbitMQConstants.DEFAULT_RETRY_MAX_ATTEMPTS);
    }

    @Test
    void fractionalRetryCountsFallBackToDefaults() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(RabbitMQConstants.RETRY_MAX_ATTEMPTS, "2.5");

        assertThat(RetryPolicy.fromProperties(properties, "[test]").getMaxAttempts())
                .isEqualTo(RabbitMQConstants.DEFAULT_RETRY_MAX_ATTEMPTS);
    }
}
