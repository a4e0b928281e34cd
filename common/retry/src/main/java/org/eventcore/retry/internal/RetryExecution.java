/*
 * Copyright 2026 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventcore.retry.internal;

import org.eventcore.retry.RetryInfo;
import org.eventcore.retry.RetryStrategy;
import org.eventcore.retry.RetryStrategy.DontRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Internal class for executing functions with retry capability. Never use this class directly from your own code!
 */
public class RetryExecution {
    private static final Logger log = LoggerFactory.getLogger(RetryExecution.class);

    public static <T> T executeWithRetry(Supplier<T> supplier, RetryStrategy retryStrategy) {
        if (retryStrategy instanceof DontRetry) {
            return supplier.get();
        } else if (!(retryStrategy instanceof RetryImpl retry)) {
            throw new IllegalArgumentException("Unsupported retry strategy: " + retryStrategy.getClass().getName());
        } else {
            return executeWithRetry(supplier, retry);
        }
    }

    private static <T> T executeWithRetry(Supplier<T> supplier, RetryImpl retry) {
        int attempt = 1;
        Duration previousBackoff = Duration.ZERO;
        RuntimeException lastError = null;
        while (true) {
            if (lastError != null) {
                retry.onBeforeRetryListener.accept(new RetryInfo(attempt, retry.maxAttempts, previousBackoff), lastError);
            }

            try {
                return supplier.get();
            } catch (RuntimeException e) {
                Duration backoff = retry.backoff.delayBeforeRetry(attempt);
                boolean retryable = !retry.maxAttempts.isExhaustedAfter(attempt) && retry.retryPredicate.test(e);
                retry.errorListener.accept(new RetryInfo(attempt, retry.maxAttempts, retryable ? backoff : Duration.ZERO), e);
                if (!retryable) {
                    throw e;
                }

                log.debug("Attempt {} failed with {}, will retry in {} ms.", attempt, e.getClass().getSimpleName(), backoff.toMillis());
                sleep(backoff, e);
                attempt++;
                previousBackoff = backoff;
                lastError = e;
            }
        }
    }

    private static void sleep(Duration backoff, RuntimeException cause) {
        long backoffMillis = backoff.toMillis();
        if (backoffMillis <= 0) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(backoffMillis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cause.addSuppressed(ie);
            throw cause;
        }
    }
}
