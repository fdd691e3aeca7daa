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

import com.rabbitmq.client.amqp.Connection;
import com.rabbitmq.client.amqp.Consumer;
import com.rabbitmq.client.amqp.ConsumerBuilder;
import com.rabbitmq.client.amqp.Message;
import com.rabbitmq.client.amqp.Publisher;
import com.rabbitmq.client.amqp.PublisherBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.wso2.carbon.messaging.rabbitmq.config.DeadLetterConfig;
import org.wso2.carbon.messaging.rabbitmq.config.RetryPolicy;
import org.wso2.carbon.messaging.rabbitmq.config.SubscriptionConfig;
import org.wso2.carbon.messaging.rabbitmq.message.handler.JsonMessageHandler;

import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Publishes through {@link RabbitMQPublisher} and hands the published body to the message handler
 * that {@link RabbitMQConsumer} registers on the same queue.
 */
public class RabbitMQRoundTripTest {

    private Connection connection;
    private ConsumerBuilder consumerBuilder;
    private final AtomicReference<byte[]> published = new AtomicReference<>();
    private RabbitMQConnectionManager connectionManager;
    private RabbitMQTopologyBuilder topologyBuilder;
    private Properties properties;

    @BeforeEach
    void setUp() throws Exception {
        connection = mock(Connection.class);
        consumerBuilder = mock(ConsumerBuilder.class, RETURNS_SELF);
        when(connection.consumerBuilder()).thenReturn(consumerBuilder);
        when(consumerBuilder.build()).thenReturn(mock(Consumer.class));

        PublisherBuilder publisherBuilder = mock(PublisherBuilder.class, RETURNS_SELF);
        Publisher publisher = mock(Publisher.class);
        when(connection.publisherBuilder()).thenReturn(publisherBuilder);
        when(publisherBuilder.build()).thenReturn(publisher);
        when(publisher.message(any(byte[].class))).thenAnswer(invocation -> {
            published.set(invocation.getArgument(0));
            return mock(Message.class, RETURNS_SELF);
        });
        Publisher.Context accepted = mock(Publisher.Context.class);
        when(accepted.status()).thenReturn(Publisher.Status.ACCEPTED);
        doAnswer(invocation -> {
            Publisher.Callback callback = invocation.getArgument(1);
            callback.handle(accepted);
            return null;
        }).when(publisher).publish(any(Message.class), any(Publisher.Callback.class));

        connectionManager = mock(RabbitMQConnectionManager.class);
        when(connectionManager.acquireChannel()).thenAnswer(invocation ->
                new RabbitMQChannel("orders", connection, new RabbitMQConnectionStateListener("test")));
        when(connectionManager.isConnectionOpen()).thenReturn(true);
        topologyBuilder = mock(RabbitMQTopologyBuilder.class);

        properties = new Properties();
        properties.setProperty(RabbitMQConstants.PUBLISHER_ACK_WAIT_TIME, "1000");
        properties.setProperty(RabbitMQConstants.MAX_WAIT_TIME_MILLIS, "500");
    }

    @Test
    void consumerReceivesTheBytesThePublisherSent() throws Exception {
        AtomicReference<byte[]> received = new AtomicReference<>();
        SubscriptionConfig subscription = SubscriptionConfig.forQueue("orders");
        RabbitMQConsumer consumer = RabbitMQConsumer.create("orders-consumer", subscription,
                RetryPolicy.of(0, Duration.ZERO), DeadLetterConfig.of(subscription, false), received::set,
                properties, connectionManager, topologyBuilder);
        RabbitMQPublisher publisher = new RabbitMQPublisher("orders-publisher", properties, connectionManager,
                topologyBuilder);

        publisher.publishToQueue(new RabbitMQPublisherTest.OrderCreated("R-1", 4), "orders");
        Consumer.Context context = deliver(published.get());

        assertThat(received.get()).isNotNull().isEqualTo(published.get());
        verify(context).accept();
        consumer.shutdown();
    }

    @Test
    void jsonHandlerDecodesWhatThePublisherSerialized() throws Exception {
        AtomicReference<RabbitMQPublisherTest.OrderCreated> received = new AtomicReference<>();
        SubscriptionConfig subscription = SubscriptionConfig.forQueue("orders");
        RabbitMQConsumer consumer = RabbitMQConsumer.create("orders-consumer", subscription,
                RetryPolicy.of(0, Duration.ZERO), DeadLetterConfig.of(subscription, false),
                new JsonMessageHandler<>(RabbitMQPublisherTest.OrderCreated.class, received::set),
                properties, connectionManager, topologyBuilder);
        RabbitMQPublisher publisher = new RabbitMQPublisher("orders-publisher", properties, connectionManager,
                topologyBuilder);

        publisher.publishToQueue(new RabbitMQPublisherTest.OrderCreated("R-2", 7), "orders");
        deliver(published.get());

        assertThat(received.get().getOrderId()).isEqualTo("R-2");
        assertThat(received.get().getQuantity()).isEqualTo(7);
        consumer.shutdown();
    }

    private Consumer.Context deliver(byte[] body) {
        ArgumentCaptor<Consumer.MessageHandler> handler = ArgumentCaptor.forClass(Consumer.MessageHandler.class);
        verify(consumerBuilder).messageHandler(handler.capture());
        Message message = mock(Message.class);
        when(message.body()).thenReturn(body);
        when(message.messageIdAsString()).thenReturn("round-trip-1");
        Consumer.Context context = mock(Consumer.Context.class);
        handler.getValue().handle(context, message);
        return context;
    }
}
