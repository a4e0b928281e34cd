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

/**
 * An interface that should be implemented by event stores that supports reading a stream.
 */
public interface ReadStream {

    /**
     * Read all messages from a particular stream
     *
     * @param streamName The name of the stream to read.
     * @return A {@link ReadStreamResult} containing the messages of the stream. Will return a result with version {@code 0} and {@code streamExists == false} if the stream doesn't exist.
     */
    default <M extends Message> ReadStreamResult<M> readStream(String streamName) {
        return readStream(streamName, ReadStreamOptions.all());
    }

    /**
     * Read messages from a particular stream.
     *
     * @param streamName The name of the stream to read.
     * @param options    The range to read and the version the stream is expected to have
     * @return A {@link ReadStreamResult} containing the messages in the range. Will return a result with version {@code 0} and {@code streamExists == false} if the stream doesn't exist.
     * @throws ExpectedVersionConflictException If the stream doesn't have the version specified by {@link ReadStreamOptions#expectedStreamVersion()}
     */
    <M extends Message> ReadStreamResult<M> readStream(String streamName, ReadStreamOptions options);
}
