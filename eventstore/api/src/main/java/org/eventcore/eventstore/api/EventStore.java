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

import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * An event store that supports reading, appending and aggregating streams.
 */
public interface EventStore extends ReadStream, AppendToStream, AggregateStream {

    @Override
    default <S, M extends Message> AggregateStreamResult<S> aggregateStream(String streamName, Supplier<S> initialState, BiFunction<S, M, S> evolve, ReadStreamOptions options) {
        ReadStreamResult<M> result = readStream(streamName, options);
        S state = initialState.get();
        for (RecordedMessage<M> recordedMessage : result.messages()) {
            state = evolve.apply(state, recordedMessage.message());
        }
        return new AggregateStreamResult<>(state, result.currentStreamVersion(), result.streamExists());
    }
}
