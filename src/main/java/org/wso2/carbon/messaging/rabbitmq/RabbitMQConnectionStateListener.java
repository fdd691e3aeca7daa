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

import com.rabbitmq.client.amqp.Resource;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Listener monitoring the state of one RabbitMQ connection.
 * Logs state transitions and remembers the latest state so that liveness can be queried
 * without touching the connection.
 */
public class RabbitMQConnectionStateListener implements Resource.StateListener {

    private static final Log log = LogFactory.getLog(RabbitMQConnectionStateListener.class);

    private final String name;
    private final AtomicReference<Resource.State> currentState = new AtomicReference<>();

    /**
     * @param name The name of the consumer or publisher owning the connection.
     */
    public RabbitMQConnectionStateListener(String name) {
        this.name = name;
    }

    /**
     * Handles state transitions of the RabbitMQ connection.
     *
     * @param context The context containing the current and previous states of the connection.
     */
    @Override
    public void handle(Resource.Context context) {
        Resource.State current = context.currentState();
        Resource.State previous = context.previousState();
        currentState.set(current);

        if (current == Resource.State.RECOVERING && previous == Resource.State.OPEN) {
            log.warn("[" + name + "] connection to the RabbitMQ broker started to recover.");
        } else if (current == Resource.State.OPEN && previous == Resource.State.RECOVERING) {
            log.info("[" + name + "] connection to the RabbitMQ broker was recovered.");
        } else if (current == Resource.State.OPENING && previous == null) {
            if (log.isDebugEnabled()) {
                log.debug("[" + name + "] connection to the RabbitMQ broker is opening.");
            }
        } else if (current == Resource.State.OPEN && previous == Resource.State.OPENING) {
            log.info("[" + name + "] connection to the RabbitMQ broker is established.");
        } else if (current == Resource.State.CLOSING) {
            if (context.failureCause() != null) {
                log.warn("[" + name + "] connection to the RabbitMQ broker is closing due to: "
                        + context.failureCause());
            } else {
                log.info("[" + name + "] connection to the RabbitMQ broker is closing.");
            }
        } else if (current == Resource.State.CLOSED) {
            if (context.failureCause() == null) {
                log.info("[" + name + "] connection to the RabbitMQ broker is closed.");
            } else {
                log.warn("[" + name + "] connection to the RabbitMQ broker is closed due to: "
                        + context.failureCause());
            }
        }
    }

    /**
     * @return The latest reported state, or null before the first transition.
     */
    public Resource.State getCurrentState() {
        return currentState.get();
    }

    /**
     * @return True when the connection last reported being open.
     */
    public boolean isOpen() {
        return currentState.get() == Resource.State.OPEN;
    }

    /**
     * A closing or closed connection cannot be reused. A recovering one is still owned by the client.
     *
     * @return True when the connection is closing or closed.
     */
    public boolean isClosed() {
        Resource.State state = currentState.get();
        return state == Resource.State.CLOSING || state == Resource.State.CLOSED;
    }
}
