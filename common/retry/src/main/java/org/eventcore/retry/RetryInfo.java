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

package org.eventcore.retry;

import java.time.Duration;

/**
 * Information about the current attempt of a {@link RetryStrategy}.
 *
 * @param attemptNumber The attempt number, starting at 1 for the first (non-retry) attempt
 * @param maxAttempts   The configured max attempts
 * @param backoff       The backoff that applies before the next attempt, {@link Duration#ZERO} if none
 */
public record RetryInfo(int attemptNumber, MaxAttempts maxAttempts, Duration backoff) {

    public int numberOfPreviousRetries() {
        return attemptNumber - 1;
    }

    public boolean isFirstAttempt() {
        return attemptNumber == 1;
    }

    public boolean isLastAttempt() {
        return maxAttempts.isExhaustedAfter(attemptNumber);
    }
}
