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
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.util.Properties;

/**
 * Owns at most one live broker connection for a consumer or publisher. The connection is created
 * lazily on the first {@link #acquireChannel()} and recreated on demand once it reports closed;
 * each call hands out a fresh {@link RabbitMQChannel} over it.
 */
public class RabbitMQConnectionManager {
    private static final Log log = LogFactory.getLog(RabbitMQConnectionManager.class);

    private final String name;
    private final RabbitMQEnvironment environment;
    private final Object connectionLock = new Object();
    private volatile ConnectionHolder current;
    private volatile boolean closed = false;

    /**
     * Creates a manager with its own AMQP environment built from the given properties.
     *
     * @param name       Name of the owning consumer or publisher, used in log output.
     * @param properties The RabbitMQ connection properties.
     */
    public RabbitMQConnectionManager(String name, Properties properties) {
        this(name, new RabbitMQEnvironment(name, properties));
    }

    public RabbitMQConnectionManager(String name, RabbitMQEnvironment environment) {
        this.name = name;
        this.environment = environment;
    }

    /**
     * Returns a fresh channel over the current connection, connecting first when there is no live
     * connection. Only one connection attempt runs at a time; callers arriving during an attempt
     * reuse its result.
     *
     * @return A new channel.
     * @throws RabbitMQConnectionException If a connection is needed and cannot be established.
     */
    public RabbitMQChannel acquireChannel() throws RabbitMQConnectionException {
        ConnectionHolder holder = current;
        if (holder == null || holder.stateListener.isClosed()) {
            synchronized (connectionLock) {
                if (closed) {
                    throw new RabbitMQConnectionException("[" + name + "] Connection manager is closed.");
                }
                // another caller may have reconnected while this one waited for the lock
                holder = current;
                if (holder == null || holder.stateListener.isClosed()) {
                    if (holder != null) {
                        log.warn("[" + name + "] Cached RabbitMQ connection is closed. Reconnecting.");
                        closeConnection(holder.connection);
                    }
                    RabbitMQConnectionStateListener stateListener = new RabbitMQConnectionStateListener(name);
                    holder = new ConnectionHolder(environment.createConnection(stateListener), stateListener);
                    current = holder;
                }
            }
        }
        return new RabbitMQChannel(name, holder.connection, holder.stateListener);
    }

    /**
     * @return True when a connection exists and is not closing or closed.
     */
    public boolean isConnectionOpen() {
        ConnectionHolder holder = current;
        return holder != null && !holder.stateListener.isClosed();
    }

    /**
     * Closes the connection and the underlying environment. Later calls to {@link #acquireChannel()} fail.
     */
    public void close() {
        synchronized (connectionLock) {
            closed = true;
            if (current != null) {
                closeConnection(current.connection);
                current = null;
            }
            environment.close();
        }
        log.info("[" + name + "] RabbitMQ connection manager closed.");
    }

    private void closeConnection(Connection connectionToClose) {
        try {
            connectionToClose.close();
        } catch (Exception e) {
            log.warn("[" + name + "] Error while closing RabbitMQ connection.", e);
        }
    }

    private static final class ConnectionHolder {
        private final Connection connection;
        private final RabbitMQConnectionStateListener stateListener;

        private ConnectionHolder(Connection connection, RabbitMQConnectionStateListener stateListener) {
            this.connection = connection;
            this.stateListener = stateListener;
        }
    }
}
