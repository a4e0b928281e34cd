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

package org.eventcore.eventstore.api;

/**
 * The stream version that a caller expects when appending to (or reading) a stream. If the expectation
 * is not met the operation fails with an {@link ExpectedVersionConflictException} and nothing is written.
 */
public sealed interface ExpectedStreamVersion {

    /**
     * The stream must have exactly {@code version} messages.
     */
    static ExpectedStreamVersion exactly(long version) {
        return new Exactly(version);
    }

    /**
     * The stream must exist, regardless of its version.
     */
    static ExpectedStreamVersion streamExists() {
        return StreamExists.INSTANCE;
    }

    /**
     * The stream must not exist, typically used when creating a new stream.
     */
    static ExpectedStreamVersion streamDoesNotExist() {
        return StreamDoesNotExist.INSTANCE;
    }

    /**
     * Stream version doesn't matter, essentially the same as an unconditional write.
     */
    static ExpectedStreamVersion noConcurrencyCheck() {
        return NoConcurrencyCheck.INSTANCE;
    }

    default boolean isNoConcurrencyCheck() {
        return this instanceof NoConcurrencyCheck;
    }

    record Exactly(long version) implements ExpectedStreamVersion {
        public Exactly {
            if (version < 0) {
                throw new IllegalArgumentException("Expected stream version cannot be negative");
            }
        }

        @Override
        public String toString() {
            return String.valueOf(version);
        }
    }

    final class StreamExists implements ExpectedStreamVersion {
        private static final StreamExists INSTANCE = new StreamExists();

        private StreamExists() {
        }

        @Override
        public String toString() {
            return "STREAM_EXISTS";
        }
    }

    final class StreamDoesNotExist implements ExpectedStreamVersion {
        private static final StreamDoesNotExist INSTANCE = new StreamDoesNotExist();

        private StreamDoesNotExist() {
        }

        @Override
        public String toString() {
            return "STREAM_DOES_NOT_EXIST";
        }
    }

    final class NoConcurrencyCheck implements ExpectedStreamVersion {
        private static final NoConcurrencyCheck INSTANCE = new NoConcurrencyCheck();

        private NoConcurrencyCheck() {
        }

        @Override
        public String toString() {
            return "NO_CONCURRENCY_CHECK";
        }
    }
}
