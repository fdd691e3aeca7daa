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
package org.wso2.carbon.messaging.rabbitmq.deadletter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.lang.exception.ExceptionUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * A message that exhausted its retries, together with why and when it failed. Published as JSON to
 * the dead-letter exchange. Immutable once created.
 */
public final class FailureEnvelope {

    private final String originalBody;
    private final String originalRoutingKey;
    private final String failureReason;
    private final String failureDetail;
    private final Instant failedAtTimestamp;
    private final int retryAttemptsMade;
    private final String consumerIdentifier;

    @JsonCreator
    public FailureEnvelope(@JsonProperty("originalBody") String originalBody,
                           @JsonProperty("originalRoutingKey") String originalRoutingKey,
                           @JsonProperty("failureReason") String failureReason,
                           @JsonProperty("failureDetail") String failureDetail,
                           @JsonProperty("failedAtTimestamp") Instant failedAtTimestamp,
                           @JsonProperty("retryAttemptsMade") int retryAttemptsMade,
                           @JsonProperty("consumerIdentifier") String consumerIdentifier) {
        this.originalBody = originalBody;
        this.originalRoutingKey = originalRoutingKey;
        this.failureReason = failureReason;
        this.failureDetail = failureDetail;
        this.failedAtTimestamp = failedAtTimestamp;
        this.retryAttemptsMade = retryAttemptsMade;
        this.consumerIdentifier = consumerIdentifier;
    }

    /**
     * Builds the envelope for a failed message. The reason is the error message, falling back to the
     * error type when there is none; the detail is the full stack trace.
     *
     * @param body              The original message body.
     * @param routingKey        The routing key the message arrived with.
     * @param error             The error of the last attempt.
     * @param retryAttemptsMade The number of retries made after the first attempt.
     * @param consumerName      The consumer that gave up on the message.
     * @param failedAt          When the last attempt failed.
     * @return The envelope.
     */
    public static FailureEnvelope of(byte[] body, String routingKey, Exception error, int retryAttemptsMade,
                                     String consumerName, Instant failedAt) {
        String reason = error == null ? "Unknown failure"
                : error.getMessage() != null ? error.getMessage() : error.getClass().getName();
        String detail = error == null ? null : ExceptionUtils.getStackTrace(error);
        return new FailureEnvelope(new String(body, StandardCharsets.UTF_8), routingKey, reason, detail,
                failedAt, retryAttemptsMade, consumerName);
    }

    public String getOriginalBody() {
        return originalBody;
    }

    public String getOriginalRoutingKey() {
        return originalRoutingKey;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public String getFailureDetail() {
        return failureDetail;
    }

    public Instant getFailedAtTimestamp() {
        return failedAtTimestamp;
    }

    public int getRetryAttemptsMade() {
        return retryAttemptsMade;
    }

    public String getConsumerIdentifier() {
        return consumerIdentifier;
    }
}
