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

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cooperative cancellation signal. Retry waits block on it so that a shutdown ends them early.
 */
public class ShutdownSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void signal() {
        latch.countDown();
    }

    public boolean isSignalled() {
        return latch.getCount() == 0;
    }

    /**
     * Waits for the given time unless the signal fires first.
     *
     * @param timeout How long to wait.
     * @return True if the signal fired before the time elapsed.
     * @throws InterruptedException If the waiting thread is interrupted.
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
}
