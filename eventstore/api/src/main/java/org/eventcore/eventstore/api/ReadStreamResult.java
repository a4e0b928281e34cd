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
import org.eventcore.message.RecordedMessage;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * The result of reading a stream. A stream that doesn't exist is represented by {@link #notFound(String)}, which
 * allows callers to tell it apart from a stream that exists but where the requested range is empty.
 *
 * @param streamName           The name of the stream
 * @param messages             The messages in the requested range, in stream order
 * @param currentStreamVersion The version of the whole stream (not only the range that was read)
 * @param streamExists         Whether the stream exists
 */
public record ReadStreamResult<M extends Message>(String streamName, List<RecordedMessage<M>> messages, long currentStreamVersion, boolean streamExists) {

    public ReadStreamResult {
        requireNonNull(streamName, "streamName cannot be null");
        requireNonNull(messages, "messages cannot be null");
        messages = List.copyOf(messages);
    }

    public static <M extends Message> ReadStreamResult<M> notFound(String streamName) {
        return new ReadStreamResult<>(streamName, List.of(), ExpectedVersionGuard.STREAM_DOES_NOT_EXIST_VERSION, false);
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }
}
