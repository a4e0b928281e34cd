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

import org.eventcore.message.Message;

import java.util.List;

/**
 * An interface that should be implemented by event stores that supports appending messages to a stream.
 */
public interface AppendToStream {

    /**
     * Append messages to a stream, the stream is created if it doesn't exist. All messages are appended atomically,
     * either all of them are written or none of them are.
     * <p>
     * An empty list of messages will only check the {@code expectedStreamVersion}, nothing is written.
     *
     * @param streamName            The name of the stream
     * @param expectedStreamVersion The version the stream must have for the append to take place
     * @param messages              The messages to append, in order
     * @return The version of the stream after the append
     * @throws ExpectedVersionConflictException If the stream doesn't have the {@code expectedStreamVersion}
     */
    AppendToStreamResult appendToStream(String streamName, ExpectedStreamVersion expectedStreamVersion, List<? extends Message> messages);

    /**
     * Append messages to a stream without any concurrency check.
     */
    default AppendToStreamResult appendToStream(String streamName, List<? extends Message> messages) {
        return appendToStream(streamName, ExpectedStreamVersion.noConcurrencyCheck(), messages);
    }
}
