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

/**
 * This class defines the configuration keys and default values used by the RabbitMQ consumer
 * and publisher framework. Keys are looked up in the {@link java.util.Properties} handed to
 * {@link RabbitMQEnvironment}, {@link RabbitMQConsumer} and {@link RabbitMQPublisher}.
 */
public class RabbitMQConstants {

    // --- Threading ---
    // -----------------

    /**
     * Prefix for the names of the message dispatcher threads.
     */
    public static final String MESSAGE_DISPATCHER_THREAD_NAME_PREFIX = "-rabbitmq-consumer-dispatcher-";

    /**
     * Property key for the maximum time (in milliseconds) to wait for in-flight deliveries during shutdown.
     */
    public static final String MAX_WAIT_TIME_MILLIS = "rabbitmq.shutdown.max.wait.time.millis";
    public static final long DEFAULT_MAX_WAIT_TIME_MILLIS = 30000; // 30 seconds

    // --- Connection Properties ---
    // -----------------------------

    public static final String SERVER_HOST_NAME = "rabbitmq.server.host.name";
    public static final String DEFAULT_HOST = "localhost";

    public static final String SERVER_PORT = "rabbitmq.server.port";
    public static final int DEFAULT_PORT = 5672;

    public static final String SERVER_VIRTUAL_HOST = "rabbitmq.server.virtual.host";
    public static final String DEFAULT_VIRTUAL_HOST = "/";

    public static final String SERVER_USER_NAME = "rabbitmq.server.user.name";
    public static final String DEFAULT_USER = "guest";

    public static final String SERVER_PASSWORD = "rabbitmq.server.password";
    public static final String DEFAULT_PASSWORD = "guest";

    /**
     * Connection idle timeout (in milliseconds).
     */
    public static final String IDLE_TIMEOUT = "rabbitmq.connection.idle.timeout";
    public static final int DEFAULT_IDLE_TIMEOUT = 60000; // 60 seconds

    // --- Connection Recovery Properties ---
    // --------------------------------------

    /**
     * The policy used by the client to recover an established connection. Maps to {@link ConnectionRecoveryPolicy}.
     */
    public static final String CONNECTION_RECOVERY_POLICY = "rabbitmq.connection.recovery.policy.type";

    public static final String CONNECTION_RECOVERY_INITIAL_DELAY = "rabbitmq.connection.recovery.initial.delay";
    public static final long DEFAULT_CONNECTION_RECOVERY_INITIAL_DELAY = 10000; // 10 seconds

    public static final String CONNECTION_RECOVERY_RETRY_INTERVAL = "rabbitmq.connection.recovery.retry.interval";
    public static final long DEFAULT_CONNECTION_RECOVERY_RETRY_INTERVAL = 10000; // 10 seconds

    public static final String CONNECTION_RECOVERY_RETRY_TIMEOUT = "rabbitmq.connection.recovery.retry.timeout";
    public static final long DEFAULT_CONNECTION_RECOVERY_RETRY_TIMEOUT = 60000; // 60 seconds

    // --- Subscription Properties ---
    // -------------------------------

    public static final String QUEUE_NAME = "rabbitmq.queue.name";
    public static final String EXCHANGE_NAME = "rabbitmq.exchange.name";
    public static final String ROUTING_KEY = "rabbitmq.routing.key";

    /**
     * Number of credits granted to the consumer link.
     */
    public static final String CONSUMER_INITIAL_CREDIT = "rabbitmq.consumer.initial.credit";
    public static final int DEFAULT_CONSUMER_INITIAL_CREDIT = 1;

    // --- Retry and Dead Letter Properties ---
    // ----------------------------------------

    public static final String DEAD_LETTER_QUEUE_ENABLED = "rabbitmq.dead.letter.queue.enabled";
    public static final boolean DEFAULT_DEAD_LETTER_QUEUE_ENABLED = true;

    public static final String RETRY_MAX_ATTEMPTS = "rabbitmq.retry.max.attempts";
    public static final int DEFAULT_RETRY_MAX_ATTEMPTS = 3;

    /**
     * Base delay (in milliseconds) of the exponential retry back-off.
     */
    public static final String RETRY_BASE_DELAY = "rabbitmq.retry.base.delay";
    public static final long DEFAULT_RETRY_BASE_DELAY = 5000; // 5 seconds

    public static final String DEAD_LETTER_EXCHANGE_SUFFIX = ".dlx";
    public static final String DEAD_LETTER_QUEUE_SUFFIX = ".dlq";
    public static final String DEAD_LETTER_ROUTING_KEY_SUFFIX = ".failed";

    // --- Publisher Properties ---
    // ----------------------------

    /**
     * Time (in milliseconds) a publish waits for the broker to settle the message.
     */
    public static final String PUBLISHER_ACK_WAIT_TIME = "rabbitmq.publisher.ack.wait.time";
    public static final long DEFAULT_PUBLISHER_ACK_WAIT_TIME = 30000; // 30 seconds

    public static final String JSON_CONTENT_TYPE = "application/json";
    public static final String UTF_8_ENCODING = "UTF-8";

    /**
     * Message annotation carrying the routing key a message was published with.
     */
    public static final String ROUTING_KEY_ANNOTATION = "x-routing-key";

    // --- Health Properties ---
    // -------------------------

    public static final double DEGRADED_FAILURE_RATE_THRESHOLD = 0.10;
    public static final double UNHEALTHY_FAILURE_RATE_THRESHOLD = 0.20;
    public static final long ACTIVE_PROCESSING_WINDOW_MINUTES = 5;

    // --- Enums for Configuration ---
    // -------------------------------

    /**
     * Defines the available connection recovery policies.
     */
    public enum ConnectionRecoveryPolicy {
        FIXED_WITH_INITIAL_DELAY_AND_TIMEOUT,
        FIXED_WITH_INITIAL_DELAY,
        FIXED
    }

    private RabbitMQConstants() {
    }
}
