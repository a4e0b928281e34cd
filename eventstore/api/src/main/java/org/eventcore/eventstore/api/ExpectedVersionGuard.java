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

import org.eventcore.eventstore.api.ExpectedStreamVersion.Exactly;
import org.eventcore.eventstore.api.ExpectedStreamVersion.NoConcurrencyCheck;
import org.eventcore.eventstore.api.ExpectedStreamVersion.StreamDoesNotExist;
import org.eventcore.eventstore.api.ExpectedStreamVersion.StreamExists;

import static java.util.Objects.requireNonNull;

/**
 * Compares the current version of a stream with the version a caller expects. Event store implementations
 * call this both when reading (to fail fast) and when appending (to gate the write).
 */
public class ExpectedVersionGuard {
    /**
     * The version of a stream that doesn't exist, for stores that count messages.
     */
    public static final long STREAM_DOES_NOT_EXIST_VERSION = 0;

    private ExpectedVersionGuard() {
    }

    public static boolean matches(long currentStreamVersion, ExpectedStreamVersion expected) {
        return matches(currentStreamVersion, expected, STREAM_DOES_NOT_EXIST_VERSION);
    }

    /**
     * @param currentStreamVersion      The current version of the stream
     * @param expected                  The expected version
     * @param streamDoesNotExistVersion The value that the store uses to represent a stream that doesn't exist
     * @return {@code true} if {@code currentStreamVersion} satisfies {@code expected}
     */
    public static boolean matches(long currentStreamVersion, ExpectedStreamVersion expected, long streamDoesNotExistVersion) {
        requireNonNull(expected, ExpectedStreamVersion.class.getSimpleName() + " cannot be null");
        if (expected instanceof NoConcurrencyCheck) {
            return true;
        } else if (expected instanceof StreamDoesNotExist) {
            return currentStreamVersion == streamDoesNotExistVersion;
        } else if (expected instanceof StreamExists) {
            return currentStreamVersion != streamDoesNotExistVersion;
        } else if (expected instanceof Exactly exactly) {
            return currentStreamVersion == exactly.version();
        } else {
            throw new IllegalStateException("Unsupported expected stream version: " + expected.getClass().getName());
        }
    }

    public static void assertMatches(String streamName, long currentStreamVersion, ExpectedStreamVersion expected) {
        assertMatches(streamName, currentStreamVersion, expected, STREAM_DOES_NOT_EXIST_VERSION);
    }

    /**
     * @throws ExpectedVersionConflictException If {@code currentStreamVersion} doesn't satisfy {@code expected}
     */
    public static void assertMatches(String streamName, long currentStreamVersion, ExpectedStreamVersion expected, long streamDoesNotExistVersion) {
        if (!matches(currentStreamVersion, expected, streamDoesNotExistVersion)) {
            throw new ExpectedVersionConflictException(streamName, currentStreamVersion, expected);
        }
    }
}
