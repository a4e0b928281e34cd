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

import org.eventcore.retry.internal.RetryImpl;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.eventcore.retry.internal.RetryExecution.executeWithRetry;

/**
 * Retry strategy to use if an action throws an exception.
 * <p>
 * A {@code RetryStrategy} is thread-safe and immutable, every configuration method returns a new instance:
 * <pre>
 * RetryStrategy retryStrategy = RetryStrategy.fixed(Duration.ofMillis(200)).maxAttempts(5);
 * retryStrategy.execute(() -> something());
 * // 600 ms fixed delay, the original instance is unaffected
 * retryStrategy.backoff(Backoff.fixed(Duration.ofMillis(600))).execute(() -> somethingElse());
 * </pre>
 */
public interface RetryStrategy {

    /**
     * Create a retry strategy that performs retries if exceptions are caught. By default, it retries an
     * infinite number of times, without backoff, for all exceptions.
     */
    static Retry retry() {
        return new RetryImpl();
    }

    /**
     * @return A retry strategy that doesn't retry at all.
     */
    static DontRetry none() {
        return DontRetry.INSTANCE;
    }

    /**
     * Shortcut for {@code RetryStrategy.retry().backoff(Backoff.exponential(initial, max, multiplier))}.
     */
    static Retry exponentialBackoff(Duration initial, Duration max, double multiplier) {
        return retry().backoff(Backoff.exponential(initial, max, multiplier));
    }

    /**
     * Shortcut for {@code RetryStrategy.retry().backoff(Backoff.fixed(duration))}.
     */
    static Retry fixed(Duration duration) {
        return retry().backoff(Backoff.fixed(duration));
    }

    /**
     * Execute a {@link Supplier} with the configured retry settings.
     * Rethrows the exception from the supplier if the retry strategy is exhausted or if the exception is not retryable.
     *
     * @param supplier The supplier to execute
     * @return The result of the supplier, if successful.
     */
    default <T> T execute(Supplier<T> supplier) {
        Objects.requireNonNull(supplier, Supplier.class.getSimpleName() + " cannot be null");
        return executeWithRetry(supplier, this);
    }

    /**
     * Execute a {@link Runnable} with the configured retry settings.
     *
     * @param runnable The runnable to execute
     */
    default void execute(Runnable runnable) {
        Objects.requireNonNull(runnable, Runnable.class.getSimpleName() + " cannot be null");
        executeWithRetry(() -> {
            runnable.run();
            return null;
        }, this);
    }

    /**
     * A retry strategy that doesn't retry at all, it just rethrows the exception.
     */
    final class DontRetry implements RetryStrategy {
        private static final DontRetry INSTANCE = new DontRetry();

        private DontRetry() {
        }

        @Override
        public String toString() {
            return DontRetry.class.getSimpleName();
        }
    }

    interface Retry extends RetryStrategy {
        /**
         * Configure the backoff settings for the retry strategy.
         *
         * @param backoff The backoff to use.
         * @return A new instance of {@link Retry} with the backoff settings applied.
         */
        Retry backoff(Backoff backoff);

        /**
         * Retry an infinite number of times (this is default).
         */
        Retry infiniteAttempts();

        /**
         * Specify the max number of times the action should be invoked before failing, including the first attempt.
         */
        Retry maxAttempts(int maxAttempts);

        /**
         * Specify the max number of retries, i.e. the number of attempts <i>after</i> the first one.
         * This is the same as {@code maxAttempts(maxRetries + 1)}.
         */
        default Retry maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries cannot be negative");
            }
            return maxAttempts(maxRetries + 1);
        }

        /**
         * Only retry if the specified predicate is {@code true}. Will override previous retry predicate.
         */
        Retry retryIf(Predicate<Throwable> retryPredicate);

        /**
         * Specify a listener that will be invoked <i>before</i> each retry takes place.
         */
        Retry onBeforeRetry(BiConsumer<RetryInfo, Throwable> onBeforeRetryListener);

        /**
         * Specify a listener that will be invoked for every error that happens during the execution, retryable or not.
         */
        Retry onError(BiConsumer<RetryInfo, Throwable> errorListener);
    }
}
