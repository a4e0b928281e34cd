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

import org.eventcore.retry.Backoff;
import org.eventcore.retry.MaxAttempts;
import org.eventcore.retry.RetryInfo;
import org.eventcore.retry.RetryStrategy.Retry;
import org.jspecify.annotations.NullMarked;

import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

/**
 * Immutable {@link Retry} implementation, every configuration method returns a new instance.
 * Never use this class directly from your own code, use {@link org.eventcore.retry.RetryStrategy#retry()}.
 */
@NullMarked
public final class RetryImpl implements Retry {
    private static final Predicate<Throwable> ALWAYS_RETRY = __ -> true;
    // @formatter:off
    private static final BiConsumer<RetryInfo, Throwable> NOOP_LISTENER = (__, ___) -> {};
    // @formatter:on

    final Backoff backoff;
    final MaxAttempts maxAttempts;
    final Predicate<Throwable> retryPredicate;
    final BiConsumer<RetryInfo, Throwable> onBeforeRetryListener;
    final BiConsumer<RetryInfo, Throwable> errorListener;

    public RetryImpl() {
        this(Backoff.none(), MaxAttempts.Infinite.infinite(), ALWAYS_RETRY, NOOP_LISTENER, NOOP_LISTENER);
    }

    private RetryImpl(Backoff backoff, MaxAttempts maxAttempts, Predicate<Throwable> retryPredicate,
                      BiConsumer<RetryInfo, Throwable> onBeforeRetryListener, BiConsumer<RetryInfo, Throwable> errorListener) {
        this.backoff = backoff;
        this.maxAttempts = maxAttempts;
        this.retryPredicate = retryPredicate;
        this.onBeforeRetryListener = onBeforeRetryListener;
        this.errorListener = errorListener;
    }

    @Override
    public Retry backoff(Backoff backoff) {
        Objects.requireNonNull(backoff, Backoff.class.getSimpleName() + " cannot be null");
        return new RetryImpl(backoff, maxAttempts, retryPredicate, onBeforeRetryListener, errorListener);
    }

    @Override
    public Retry infiniteAttempts() {
        return new RetryImpl(backoff, MaxAttempts.Infinite.infinite(), retryPredicate, onBeforeRetryListener, errorListener);
    }

    @Override
    public Retry maxAttempts(int maxAttempts) {
        return new RetryImpl(backoff, new MaxAttempts.Limit(maxAttempts), retryPredicate, onBeforeRetryListener, errorListener);
    }

    @Override
    public Retry retryIf(Predicate<Throwable> retryPredicate) {
        Objects.requireNonNull(retryPredicate, "retryPredicate cannot be null");
        return new RetryImpl(backoff, maxAttempts, retryPredicate, onBeforeRetryListener, errorListener);
    }

    @Override
    public Retry onBeforeRetry(BiConsumer<RetryInfo, Throwable> onBeforeRetryListener) {
        Objects.requireNonNull(onBeforeRetryListener, "onBeforeRetryListener cannot be null");
        return new RetryImpl(backoff, maxAttempts, retryPredicate, this.onBeforeRetryListener.andThen(onBeforeRetryListener), errorListener);
    }

    @Override
    public Retry onError(BiConsumer<RetryInfo, Throwable> errorListener) {
        Objects.requireNonNull(errorListener, "errorListener cannot be null");
        return new RetryImpl(backoff, maxAttempts, retryPredicate, onBeforeRetryListener, this.errorListener.andThen(errorListener));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RetryImpl)) return false;
        RetryImpl retry = (RetryImpl) o;
        return Objects.equals(backoff, retry.backoff) && Objects.equals(maxAttempts, retry.maxAttempts) && Objects.equals(retryPredicate, retry.retryPredicate)
                && Objects.equals(onBeforeRetryListener, retry.onBeforeRetryListener) && Objects.equals(errorListener, retry.errorListener);
    }

    @Override
    public int hashCode() {
        return Objects.hash(backoff, maxAttempts, retryPredicate, onBeforeRetryListener, errorListener);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", RetryImpl.class.getSimpleName() + "[", "]")
                .add("backoff=" + backoff)
                .add("maxAttempts=" + maxAttempts)
                .toString();
    }
}
