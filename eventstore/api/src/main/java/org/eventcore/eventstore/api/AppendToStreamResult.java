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

import java.util.Objects;
import java.util.StringJoiner;

/**
 * The result of an append.
 */
public class AppendToStreamResult {
    public final String streamName;
    public final long nextExpectedStreamVersion;
    public final boolean createdNewStream;
    public final long lastGlobalPosition;

    /**
     * @param streamName                The name of the stream that was appended to
     * @param nextExpectedStreamVersion The version of the stream after the append, use it as expected version for the next append
     * @param createdNewStream          {@code true} if the append created the stream
     * @param lastGlobalPosition        The global position of the last appended message, or the last position of the store if nothing was appended
     */
    public AppendToStreamResult(String streamName, long nextExpectedStreamVersion, boolean createdNewStream, long lastGlobalPosition) {
        this.streamName = streamName;
        this.nextExpectedStreamVersion = nextExpectedStreamVersion;
        this.createdNewStream = createdNewStream;
        this.lastGlobalPosition = lastGlobalPosition;
    }

    public String streamName() {
        return streamName;
    }

    public long nextExpectedStreamVersion() {
        return nextExpectedStreamVersion;
    }

    public boolean createdNewStream() {
        return createdNewStream;
    }

    public long lastGlobalPosition() {
        return lastGlobalPosition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AppendToStreamResult)) return false;
        AppendToStreamResult that = (AppendToStreamResult) o;
        return nextExpectedStreamVersion == that.nextExpectedStreamVersion && createdNewStream == that.createdNewStream
                && lastGlobalPosition == that.lastGlobalPosition && Objects.equals(streamName, that.streamName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamName, nextExpectedStreamVersion, createdNewStream, lastGlobalPosition);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", AppendToStreamResult.class.getSimpleName() + "[", "]")
                .add("streamName='" + streamName + "'")
                .add("nextExpectedStreamVersion=" + nextExpectedStreamVersion)
                .add("createdNewStream=" + createdNewStream)
                .add("lastGlobalPosition=" + lastGlobalPosition)
                .toString();
    }
}
