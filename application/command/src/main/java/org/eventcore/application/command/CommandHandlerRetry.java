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

package org.eventcore.application.command;

import org.eventcore.errors.ConcurrencyException;
import org.eventcore.retry.RetryStrategy;
import org.eventcore.retry.RetryStrategy.Retry;

import java.time.Duration;

/**
 * Retry strategies suitable for command handlers. Only {@link ConcurrencyException}s are retried, business rule
 * violations and other errors are rethrown immediately.
 */
public final class CommandHandlerRetry {
    public static final int DEFAULT_RETRIES_ON_VERSION_CONFLICT = 3;

    private CommandHandlerRetry() {
    }

    /**
     * Retry {@value #DEFAULT_RETRIES_ON_VERSION_CONFLICT} times on version conflict with exponential backoff starting with 100 ms,
     * multiplied by 1.5 for each retry and capped at 2 seconds.
     */
    public static Retry onVersionConflict() {
        return onVersionConflict(DEFAULT_RETRIES_ON_VERSION_CONFLICT);
    }

    public static Retry onVersionConflict(int retries) {
        return RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(2), 1.5)
                .maxRetries(retries)
                .retryIf(ConcurrencyException.class::isInstance);
    }
}
