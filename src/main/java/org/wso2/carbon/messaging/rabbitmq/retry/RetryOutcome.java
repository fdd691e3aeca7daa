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

/**
 * Result of running a handler under a {@link RetryExecutor}.
 */
public final class RetryOutcome {

    /**
     * How the retry sequence ended.
     */
    public enum Result {
        /** An attempt succeeded. */
        SUCCESS,
        /** Every allowed attempt failed. */
        EXHAUSTED,
        /** A shutdown cancelled a back-off wait before the attempts ran out. */
        CANCELLED
    }

    private final Result result;
    private final int attempts;
    private final Exception lastError;
    private final byte[] body;
    private final String routingKey;

    private RetryOutcome(Result result, int attempts, Exception lastError, byte[] body, String routingKey) {
        this.result = result;
        this.attempts = attempts;
        this.lastError = lastError;
        this.body = body;
        this.routingKey = routingKey;
    }

    static RetryOutcome success(int attempts, byte[] body, String routingKey) {
        return new RetryOutcome(Result.SUCCESS, attempts, null, body, routingKey);
    }

    static RetryOutcome exhausted(int attempts, Exception lastError, byte[] body, String routingKey) {
        return new RetryOutcome(Result.EXHAUSTED, attempts, lastError, body, routingKey);
    }

    static RetryOutcome cancelled(int attempts, Exception lastError, byte[] body, String routingKey) {
        return new RetryOutcome(Result.CANCELLED, attempts, lastError, body, routingKey);
    }

    public Result getResult() {
        return result;
    }

    public boolean isSuccess() {
        return result == Result.SUCCESS;
    }

    /**
     * @return The number of handler invocations made.
     */
    public int getAttempts() {
        return attempts;
    }

    /**
     * @return The error of the last failed attempt, or null on success.
     */
    public Exception getLastError() {
        return lastError;
    }

    public byte[] getBody() {
        return body;
    }

    public String getRoutingKey() {
        return routingKey;
    }
}
