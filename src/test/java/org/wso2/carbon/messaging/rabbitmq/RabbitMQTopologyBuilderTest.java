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
package org.wso2.carbon.messaging.rabbitmq;

import com.rabbitmq.client.amqp.AmqpException;
import com.rabbitmq.client.amqp.Connection;
import com.rabbitmq.client.amqp.Management;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.wso2.carbon.messaging.rabbitmq.config.DeadLetterConfig;
import org.wso2.carbon.messaging.rabbitmq.config.SubscriptionConfig;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class RabbitMQTopologyBuilderTest {

    private Management management;
    private Management.QueueSpecification queueSpecification;
    private Management.ExchangeSpecification exchangeSpecification;
    private Management.BindingSpecification bindingSpecification;
    private RabbitMQChannel channel;
    private final RabbitMQTopologyBuilder topologyBuilder = new RabbitMQTopologyBuilder("test");

    @BeforeEach
    void setUp() {
        Connection connection = mock(Connection.class);
        management = mock(Management.class);
        queueSpecification = mock(Management.QueueSpecification.class, RETURNS_SELF);
        exchangeSpecification = mock(Management.ExchangeSpecification.class, RETURNS_SELF);
        bindingSpecification = mock(Management.BindingSpecification.class, RETURNS_SELF);
        when(connection.management()).thenReturn(management);
        when(management.queue()).thenReturn(queueSpecification);
        when(management.exchange(anyString())).thenReturn(exchangeSpecification);
        when(management.binding()).thenReturn(bindingSpecification);
        channel = new RabbitMQChannel("test", connection, new RabbitMQConnectionStateListener("test"));
    }

    @Test
    void declaresDeadLetterTopologyBeforeTheMainQueue() throws Exception {
        SubscriptionConfig subscription = SubscriptionConfig.forExchange("orders.exchange", "order.created",
                "orders");

        topologyBuilder.ensureConsumerTopology(channel, subscription, DeadLetterConfig.of(subscription, true));

        InOrder order = inOrder(management, queueSpecification, bindingSpecification);
        order.verify(management).exchange("orders.exchange.dlx");
        order.verify(queueSpecification).name("orders.dlq");
        order.verify(bindingSpecification).sourceExchange("orders.exchange.dlx");
        order.verify(bindingSpecification).destinationQueue("orders.dlq");
        order.verify(bindingSpecification).key("order.created.failed");
        order.verify(management).exchange("orders.exchange");
        order.verify(queueSpecification).name("orders");
        order.verify(queueSpecification).deadLetterExchange("orders.exchange.dlx");
        order.verify(queueSpecification).deadLetterRoutingKey("order.created.failed");
        order.verify(bindingSpecification).sourceExchange("orders.exchange");
        order.verify(bindingSpecification).destinationQueue("orders");
        order.verify(bindingSpecification).key("order.created");
        order.verify(management).close();

        verify(exchangeSpecification, times(2)).type(Management.ExchangeType.DIRECT);
        verify(queueSpecification, times(2)).type(Management.QueueType.CLASSIC);
        verify(queueSpecification, times(2)).declare();
        verify(bindingSpecification, times(2)).bind();
    }

    @Test
    void simpleQueueWithoutDeadLetteringDeclaresOnlyTheQueue() throws Exception {
        SubscriptionConfig subscription = SubscriptionConfig.forQueue("payments");

        topologyBuilder.ensureConsumerTopology(channel, subscription, DeadLetterConfig.of(subscription, false));

        verify(queueSpecification).name("payments");
        verify(queueSpecification).declare();
        verify(queueSpecification, never()).deadLetterExchange(anyString());
        verify(management, never()).exchange(anyString());
        verify(management, never()).binding();
    }

    @Test
    void brokerFailureIsReportedAsTopologyError() throws Exception {
        when(queueSpecification.declare()).thenThrow(new AmqpException("PRECONDITION_FAILED"));
        SubscriptionConfig subscription = SubscriptionConfig.forQueue("payments");

        assertThatThrownBy(() -> topologyBuilder.ensurePublishTopology(channel, subscription,
                DeadLetterConfig.of(subscription, false)))
                .isInstanceOf(RabbitMQTopologyException.class)
                .hasCauseInstanceOf(AmqpException.class);
        verify(management).close();
    }
}
