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
package org.wso2.carbon.messaging.rabbitmq.retry;

import org.junit.jupiter.api.Test;
import org.wso2.carbon.messaging.rabbitmq.config.RetryPolicy;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

public class RetryExecutorTest {

    private static final byte[] BODY = "{\"id\":1}".getBytes(StandardCharsets.UTF_8);

    @Test
    void successOnFirstAttemptInvokesHandlerOnce() throws Exception {
        AtomicInteger invocations = new AtomicInteger();
        RetryExecutor executor = new RetryExecutor("test", RetryPolicy.of(3, Duration.ofMillis(1)),
                new ShutdownSignal());

        RetryOutcome outcome = executor.run(body -> invocations.incrementAndGet(), BODY, "order.created");

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getAttempts()).isEqualTo(1);
        assertThat(outcome.getRoutingKey()).isEqualTo("order.created");
        assertThat(outcome.getBody()).isSameAs(BODY);
        assertThat(invocations).hasValue(1);
    }

    @Test
    void recoversOnALaterAttempt() throws Exception {
        AtomicInteger invocations = new AtomicInteger();
        RetryExecutor executor = new RetryExecutor("test", RetryPolicy.of(3, Duration.ofMillis(1)),
                new ShutdownSignal());

        RetryOutcome outcome = executor.run(body -> {
            if (invocations.incrementAndGet() < 3) {
                throw new IllegalStateException("database unavailable");
            }
        }, BODY);

        assertThat(outcome.getResult()).isEqualTo(RetryOutcome.Result.SUCCESS);
        assertThat(outcome.getAttempts()).isEqualTo(3);
        assertThat(outcome.getLastError()).isNull();
    }

    @Test
    void givesUpAfterMaxAttemptsPlusOneInvocations() throws Exception {
        AtomicInteger invocations = new AtomicInteger();
        RetryExecutor executor = new RetryExecutor("test", RetryPolicy.of(2, Duration.ofMillis(1)),
                new ShutdownSignal());

        RetryOutcome outcome = executor.run(body -> {
            invocations.incrementAndGet();
            throw new IllegalStateException("always fails");
        }, BODY);

        assertThat(outcome.getResult()).isEqualTo(RetryOutcome.Result.EXHAUSTED);
        assertThat(outcome.getAttempts()).isEqualTo(3);
        assertThat(outcome.getLastError()).hasMessage("always fails");
        assertThat(invocations).hasValue(3);
    }

    @Test
    void shutdownCancelsTheBackOffWait() throws Exception {
        AtomicInteger invocations = new AtomicInteger();
        ShutdownSignal shutdownSignal = new ShutdownSignal();
        shutdownSignal.signal();
        assertThat(shutdownSignal.isSignalled()).isTrue();
        RetryExecutor executor = new RetryExecutor("test", RetryPolicy.of(3, Duration.ofMinutes(10)),
                shutdownSignal);

        long start = System.nanoTime();
        RetryOutcome outcome = executor.run(body -> {
            invocations.incrementAndGet();
            throw new IllegalStateException("fails");
        }, BODY);

        assertThat(outcome.getResult()).isEqualTo(RetryOutcome.Result.CANCELLED);
        assertThat(outcome.getAttempts()).isEqualTo(1);
        assertThat(invocations).hasValue(1);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    void waitsBetweenAttempts() throws Exception {
        RetryExecutor executor = new RetryExecutor("test", RetryPolicy.of(2, Duration.ofMillis(50)),
                new ShutdownSignal());

        long start = System.nanoTime();
        executor.run(body -> {
            throw new IllegalStateException("fails");
        }, BODY);

        // 50ms + 100ms of back-off
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(150));
    }
}
