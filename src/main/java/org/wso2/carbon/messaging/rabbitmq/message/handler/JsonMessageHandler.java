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
package org.wso2.carbon.messaging.rabbitmq.message.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.wso2.carbon.messaging.rabbitmq.RabbitMQUtils;

/**
 * Adapts a typed handler to {@link RabbitMQMessageHandler} by reading the JSON body into {@code T}.
 * A body that cannot be read fails the attempt like any other handler error.
 *
 * @param <T> The message type.
 */
public class JsonMessageHandler<T> implements RabbitMQMessageHandler {

    /**
     * Typed business logic.
     *
     * @param <T> The message type.
     */
    @FunctionalInterface
    public interface TypedHandler<T> {
        void handle(T message) throws Exception;
    }

    private final Class<T> messageType;
    private final TypedHandler<T> delegate;
    private final ObjectMapper objectMapper;

    public JsonMessageHandler(Class<T> messageType, TypedHandler<T> delegate) {
        this(messageType, delegate, RabbitMQUtils.createObjectMapper());
    }

    public JsonMessageHandler(Class<T> messageType, TypedHandler<T> delegate, ObjectMapper objectMapper) {
        this.messageType = messageType;
        this.delegate = delegate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void handle(byte[] body) throws Exception {
        delegate.handle(objectMapper.readValue(body, messageType));
    }
}
