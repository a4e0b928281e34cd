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
import java.util.Objects;

/**
 * Specifies how long to wait between retry attempts.
 */
public sealed interface Backoff {

    static Backoff none() {
        return None.INSTANCE;
    }

    static Backoff fixed(Duration duration) {
        return new Fixed(duration);
    }

    static Backoff exponential(Duration initial, Duration max, double multiplier) {
        return new Exponential(initial, max, multiplier);
    }

    /**
     * The backoff to use before retry number {@code retryNumber} (1-based).
     */
    Duration delayBeforeRetry(int retryNumber);

    final class None implements Backoff {
        private static final None INSTANCE = new None();

        private None() {
        }

        @Override
        public Duration delayBeforeRetry(int retryNumber) {
            return Duration.ZERO;
        }

        @Override
        public String toString() {
            return None.class.getSimpleName();
        }
    }

    record Fixed(Duration duration) implements Backoff {
        public Fixed {
            Objects.requireNonNull(duration, "duration cannot be null");
            if (duration.isNegative()) {
                throw new IllegalArgumentException("duration cannot be negative");
            }
        }

        @Override
        public Duration delayBeforeRetry(int retryNumber) {
            return duration;
        }
    }

    record Exponential(Duration initial, Duration max, double multiplier) implements Backoff {
        public Exponential {
            Objects.requireNonNull(initial, "initial cannot be null");
            Objects.requireNonNull(max, "max cannot be null");
            if (initial.isNegative()) {
                throw new IllegalArgumentException("initial cannot be negative");
            } else if (max.compareTo(initial) < 0) {
                throw new IllegalArgumentException("max cannot be less than initial");
            } else if (multiplier < 1.0d) {
                throw new IllegalArgumentException("multiplier must be greater than or equal to 1");
            }
        }

        @Override
        public Duration delayBeforeRetry(int retryNumber) {
            double millis = initial.toMillis() * Math.pow(multiplier, Math.max(0, retryNumber - 1));
            return Duration.ofMillis(Math.min(max.toMillis(), Math.round(millis)));
        }
    }
}
