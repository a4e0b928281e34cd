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

import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Read a stream and fold its messages into a state.
 */
public interface AggregateStream {

    default <S, M extends Message> AggregateStreamResult<S> aggregateStream(String streamName, Supplier<S> initialState, BiFunction<S, M, S> evolve) {
        return aggregateStream(streamName, initialState, evolve, ReadStreamOptions.all());
    }

    /**
     * @param streamName   The name of the stream
     * @param initialState The state to start from, also returned as is if the stream doesn't exist
     * @param evolve       Apply a message to the state
     * @param options      The range to read and the version the stream is expected to have
     * @return The state after all messages in the range have been applied
     */
    <S, M extends Message> AggregateStreamResult<S> aggregateStream(String streamName, Supplier<S> initialState, BiFunction<S, M, S> evolve, ReadStreamOptions options);
}
