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

package org.eventcore.messagebus;

import java.time.Duration;
import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * When a scheduled message should be delivered.
 */
public sealed interface ScheduleOptions {

    static ScheduleOptions after(Duration delay) {
        return new After(delay);
    }

    static ScheduleOptions at(Instant instant) {
        return new At(instant);
    }

    record After(Duration delay) implements ScheduleOptions {
        public After {
            requireNonNull(delay, "delay cannot be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay cannot be negative");
            }
        }
    }

    record At(Instant instant) implements ScheduleOptions {
        public At {
            requireNonNull(instant, Instant.class.getSimpleName() + " cannot be null");
        }
    }
}
