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

package org.eventcore.message;

import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Message} that has been committed to a stream, together with the metadata assigned by the event store.
 *
 * @param message        The message as written by the caller
 * @param messageId      Unique id assigned by the event store
 * @param streamName     The name of the stream that the message belongs to
 * @param streamPosition The 1-based position of the message in its stream
 * @param globalPosition The position of the message across all streams, {@link #NO_GLOBAL_POSITION} if the store doesn't assign one
 * @param <M>            The type of the message
 */
public record RecordedMessage<M extends Message>(M message, String messageId, String streamName, long streamPosition, long globalPosition) {
    public static final long NO_GLOBAL_POSITION = 0;

    public RecordedMessage {
        requireNonNull(message, Message.class.getSimpleName() + " cannot be null");
        requireNonNull(messageId, "messageId cannot be null");
        requireNonNull(streamName, "streamName cannot be null");
        if (streamPosition < 1) {
            throw new IllegalArgumentException("streamPosition must be greater than zero");
        }
    }

    public String type() {
        return message.type();
    }

    public MessageKind kind() {
        return message.kind();
    }

    public boolean hasGlobalPosition() {
        return globalPosition != NO_GLOBAL_POSITION;
    }

    /**
     * The caller assigned metadata merged with the store assigned metadata ({@code messageId}, {@code streamName},
     * {@code streamPosition} and {@code globalPosition}).
     */
    public Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>(message.metadata());
        metadata.put("messageId", messageId);
        metadata.put("streamName", streamName);
        metadata.put("streamPosition", streamPosition);
        if (hasGlobalPosition()) {
            metadata.put("globalPosition", globalPosition);
        }
        return metadata;
    }

    /**
     * Create a copy of this recorded message that carries another message but keeps the store assigned metadata,
     * for example when upcasting an old version of an event.
     */
    public <N extends Message> RecordedMessage<N> withMessage(N newMessage) {
        return new RecordedMessage<>(newMessage, messageId, streamName, streamPosition, globalPosition);
    }

    @SuppressWarnings("unchecked")
    public <N extends Message> RecordedMessage<N> cast() {
        return (RecordedMessage<N>) (RecordedMessage<?>) this;
    }
}
