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
import com.rabbitmq.client.amqp.BackOffDelayPolicy;
import com.rabbitmq.client.amqp.Connection;
import com.rabbitmq.client.amqp.ConnectionSettings;
import com.rabbitmq.client.amqp.Environment;
import com.rabbitmq.client.amqp.impl.AmqpEnvironmentBuilder;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/**
 * This class holds the AMQP environment of one consumer or publisher and builds connections from it.
 * Broker address, credentials and recovery settings are read from the configuration properties,
 * falling back to the defaults in {@link RabbitMQConstants}. Deliveries are dispatched on a single
 * named thread so that messages of one consumer are handled sequentially.
 */
public class RabbitMQEnvironment {
    private static final Log log = LogFactory.getLog(RabbitMQEnvironment.class);
    private final Properties rabbitMQProperties;
    private final String name;
    private final String logPrefix;
    private final AtomicLong count = new AtomicLong(0);
    private ExecutorService dispatchingExecutor;
    private Environment environment;

    /**
     * Constructs a {@code RabbitMQEnvironment} for the named consumer or publisher.
     *
     * @param name       Name used for thread names and log output.
     * @param properties The RabbitMQ configuration properties.
     */
    public RabbitMQEnvironment(String name, Properties properties) {
        this.name = name;
        this.rabbitMQProperties = properties;
        this.logPrefix = "Initializing RabbitMQ environment: [" + name + "]";
        initAmqpEnvironment();
    }

    /**
     * Initializes the AMQP environment with the broker address, virtual host, credentials and idle timeout.
     * No connection is opened here.
     */
    private void initAmqpEnvironment() {
        String host = RabbitMQUtils.getStringProperty(rabbitMQProperties, RabbitMQConstants.SERVER_HOST_NAME,
                RabbitMQConstants.DEFAULT_HOST, logPrefix);
        int port = RabbitMQUtils.getIntProperty(rabbitMQProperties, RabbitMQConstants.SERVER_PORT,
                RabbitMQConstants.DEFAULT_PORT, logPrefix);
        String virtualHost = RabbitMQUtils.getStringProperty(rabbitMQProperties,
                RabbitMQConstants.SERVER_VIRTUAL_HOST, RabbitMQConstants.DEFAULT_VIRTUAL_HOST, logPrefix);
        String username = RabbitMQUtils.getStringProperty(rabbitMQProperties, RabbitMQConstants.SERVER_USER_NAME,
                RabbitMQConstants.DEFAULT_USER, logPrefix);
        String password = rabbitMQProperties.getProperty(RabbitMQConstants.SERVER_PASSWORD);
        if (password == null) {
            log.warn(logPrefix + " - " + RabbitMQConstants.SERVER_PASSWORD + " is not provided. Using default.");
            password = RabbitMQConstants.DEFAULT_PASSWORD;
        }
        int idleTimeout = RabbitMQUtils.getIntProperty(rabbitMQProperties, RabbitMQConstants.IDLE_TIMEOUT,
                RabbitMQConstants.DEFAULT_IDLE_TIMEOUT, logPrefix);

        AmqpEnvironmentBuilder environmentBuilder = new AmqpEnvironmentBuilder();
        environmentBuilder.dispatchingExecutor(getDispatchingExecutor());

        AmqpEnvironmentBuilder.EnvironmentConnectionSettings connectionSettings =
                environmentBuilder.connectionSettings();
        connectionSettings.uris("amqp://" + host + ":" + port);
        connectionSettings.virtualHost(virtualHost);
        connectionSettings.saslMechanism(ConnectionSettings.SASL_MECHANISM_PLAIN);
        connectionSettings.username(username);
        connectionSettings.password(password);
        connectionSettings.idleTimeout(Duration.ofMillis(idleTimeout));

        this.environment = environmentBuilder.build();
    }

    /**
     * Creates the single-threaded executor that dispatches deliveries to message handlers.
     *
     * @return The dispatching executor.
     */
    private ExecutorService getDispatchingExecutor() {
        if (dispatchingExecutor == null) {
            dispatchingExecutor = Executors.newSingleThreadExecutor(createThreadFactory());
        }
        return dispatchingExecutor;
    }

    /**
     * Creates a thread factory naming dispatcher threads after the owning consumer or publisher.
     *
     * @return The thread factory.
     */
    private ThreadFactory createThreadFactory() {
        return r -> {
            Thread thread = Executors.defaultThreadFactory().newThread(r);
            thread.setName(name + RabbitMQConstants.MESSAGE_DISPATCHER_THREAD_NAME_PREFIX + count.getAndIncrement());
            return thread;
        };
    }

    /**
     * Opens a new connection to the broker. The attempt is made once; a failure is reported to the
     * caller, which decides whether it is fatal.
     *
     * @param stateListener Listener receiving the state transitions of the new connection.
     * @return An open connection.
     * @throws RabbitMQConnectionException If the broker cannot be reached or refuses the connection.
     */
    public Connection createConnection(RabbitMQConnectionStateListener stateListener)
            throws RabbitMQConnectionException {
        if (environment == null) {
            throw new RabbitMQConnectionException("[" + name + "] RabbitMQ environment is already closed.");
        }
        try {
            Connection connection = environment.connectionBuilder()
                    .recovery().backOffDelayPolicy(getRecoveryPolicy())
                    .connectionBuilder()
                    .listeners(stateListener)
                    .build();
            if (connection == null) {
                throw new RabbitMQConnectionException("[" + name + "] Could not connect to RabbitMQ broker.");
            }
            log.info("[" + name + "] Successfully connected to RabbitMQ broker.");
            return connection;
        } catch (AmqpException e) {
            log.error("[" + name + "] Error creating connection to RabbitMQ broker.", e);
            throw new RabbitMQConnectionException("[" + name + "] Could not connect to RabbitMQ broker.", e);
        }
    }

    /**
     * Retrieves the policy the client uses to recover an established connection after a network failure.
     *
     * @return A {@code BackOffDelayPolicy} built from the configured recovery policy.
     */
    BackOffDelayPolicy getRecoveryPolicy() {
        String policyType = rabbitMQProperties.getProperty(RabbitMQConstants.CONNECTION_RECOVERY_POLICY,
                String.valueOf(RabbitMQConstants.ConnectionRecoveryPolicy.FIXED_WITH_INITIAL_DELAY_AND_TIMEOUT));

        Duration initialDelay = Duration.ofMillis(RabbitMQUtils.getLongProperty(rabbitMQProperties,
                RabbitMQConstants.CONNECTION_RECOVERY_INITIAL_DELAY,
                RabbitMQConstants.DEFAULT_CONNECTION_RECOVERY_INITIAL_DELAY, logPrefix));
        Duration delay = Duration.ofMillis(RabbitMQUtils.getLongProperty(rabbitMQProperties,
                RabbitMQConstants.CONNECTION_RECOVERY_RETRY_INTERVAL,
                RabbitMQConstants.DEFAULT_CONNECTION_RECOVERY_RETRY_INTERVAL, logPrefix));
        Duration timeout = Duration.ofMillis(RabbitMQUtils.getLongProperty(rabbitMQProperties,
                RabbitMQConstants.CONNECTION_RECOVERY_RETRY_TIMEOUT,
                RabbitMQConstants.DEFAULT_CONNECTION_RECOVERY_RETRY_TIMEOUT, logPrefix));

        RabbitMQConstants.ConnectionRecoveryPolicy policy;
        try {
            policy = RabbitMQConstants.ConnectionRecoveryPolicy.valueOf(policyType.trim());
        } catch (IllegalArgumentException e) {
            log.warn(logPrefix + " - Unknown " + RabbitMQConstants.CONNECTION_RECOVERY_POLICY + " : '" + policyType
                    + "'. Using default: " + RabbitMQConstants.ConnectionRecoveryPolicy.FIXED_WITH_INITIAL_DELAY_AND_TIMEOUT);
            policy = RabbitMQConstants.ConnectionRecoveryPolicy.FIXED_WITH_INITIAL_DELAY_AND_TIMEOUT;
        }

        switch (policy) {
            case FIXED:
                return BackOffDelayPolicy.fixed(delay);
            case FIXED_WITH_INITIAL_DELAY:
                return BackOffDelayPolicy.fixedWithInitialDelay(initialDelay, delay);
            case FIXED_WITH_INITIAL_DELAY_AND_TIMEOUT:
            default:
                return BackOffDelayPolicy.fixedWithInitialDelay(initialDelay, delay, timeout);
        }
    }

    /**
     * Closes the AMQP environment and shuts down the dispatching executor.
     */
    public void close() {
        if (environment != null) {
            environment.close();
            environment = null;
        }
        if (dispatchingExecutor != null) {
            dispatchingExecutor.shutdown();
            dispatchingExecutor = null;
        }
    }
}
