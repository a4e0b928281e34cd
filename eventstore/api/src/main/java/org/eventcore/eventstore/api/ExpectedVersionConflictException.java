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

import org.eventcore.errors.ConcurrencyException;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * The expected stream version was not matched so nothing has been written to the event store.
 * In a typical scenario, if an application reads and writes stream A from two different places at the same time,
 * this is effectively an optimistic locking failure and a retry is appropriate.
 */
public class ExpectedVersionConflictException extends ConcurrencyException {
    public final String streamName;
    public final long currentStreamVersion;
    public final ExpectedStreamVersion expectedStreamVersion;

    public ExpectedVersionConflictException(String streamName, long currentStreamVersion, ExpectedStreamVersion expectedStreamVersion) {
        super(String.valueOf(currentStreamVersion), expectedStreamVersion.toString());
        this.streamName = streamName;
        this.currentStreamVersion = currentStreamVersion;
        this.expectedStreamVersion = expectedStreamVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExpectedVersionConflictException)) return false;
        ExpectedVersionConflictException that = (ExpectedVersionConflictException) o;
        return currentStreamVersion == that.currentStreamVersion && Objects.equals(streamName, that.streamName) && Objects.equals(expectedStreamVersion, that.expectedStreamVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamName, currentStreamVersion, expectedStreamVersion);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ExpectedVersionConflictException.class.getSimpleName() + "[", "]")
                .add("streamName='" + streamName + "'")
                .add("currentStreamVersion=" + currentStreamVersion)
                .add("expectedStreamVersion=" + expectedStreamVersion)
                .add("message=" + getMessage())
                .toString();
    }
}
