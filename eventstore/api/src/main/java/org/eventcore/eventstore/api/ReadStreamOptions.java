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

import static java.util.Objects.requireNonNull;

/**
 * Bounds and checks to apply when reading a stream. Positions are 1-based stream positions and both bounds are inclusive.
 * <pre>
 * ReadStreamOptions.all().from(3).to(10);
 * ReadStreamOptions.all().maxCount(5).expectedStreamVersion(ExpectedStreamVersion.streamExists());
 * </pre>
 *
 * @param from                  The first stream position to include, 1 (the beginning of the stream) by default
 * @param to                    The last stream position to include, {@link Long#MAX_VALUE} (the end of the stream) by default
 * @param maxCount              The max number of messages to return, {@link Long#MAX_VALUE} by default
 * @param expectedStreamVersion The version the stream is expected to have before it's read, no check by default
 */
public record ReadStreamOptions(long from, long to, long maxCount, ExpectedStreamVersion expectedStreamVersion) {
    private static final ReadStreamOptions ALL = new ReadStreamOptions(1, Long.MAX_VALUE, Long.MAX_VALUE, ExpectedStreamVersion.noConcurrencyCheck());

    public ReadStreamOptions {
        requireNonNull(expectedStreamVersion, ExpectedStreamVersion.class.getSimpleName() + " cannot be null");
        if (from < 1) {
            throw new IllegalArgumentException("from must be greater than zero");
        } else if (to < 0) {
            throw new IllegalArgumentException("to cannot be negative");
        } else if (maxCount < 0) {
            throw new IllegalArgumentException("maxCount cannot be negative");
        }
    }

    /**
     * Read the whole stream without checking its version.
     */
    public static ReadStreamOptions all() {
        return ALL;
    }

    public ReadStreamOptions from(long from) {
        return new ReadStreamOptions(from, to, maxCount, expectedStreamVersion);
    }

    public ReadStreamOptions to(long to) {
        return new ReadStreamOptions(from, to, maxCount, expectedStreamVersion);
    }

    public ReadStreamOptions maxCount(long maxCount) {
        return new ReadStreamOptions(from, to, maxCount, expectedStreamVersion);
    }

    public ReadStreamOptions expectedStreamVersion(ExpectedStreamVersion expectedStreamVersion) {
        return new ReadStreamOptions(from, to, maxCount, expectedStreamVersion);
    }

    /**
     * @return The number of messages to skip from the beginning of the stream.
     */
    public long skip() {
        return from - 1;
    }

    /**
     * @param currentStreamVersion The number of messages in the stream
     * @return The (exclusive) index after the last message to include.
     */
    public long endExclusive(long currentStreamVersion) {
        long end = Math.min(to, currentStreamVersion);
        long maxEnd = maxCount > Long.MAX_VALUE - skip() ? Long.MAX_VALUE : skip() + maxCount;
        return Math.max(skip(), Math.min(end, maxEnd));
    }
}
