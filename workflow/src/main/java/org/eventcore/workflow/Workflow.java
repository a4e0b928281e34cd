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

package org.eventcore.workflow;

import org.eventcore.message.Message;

import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * A workflow coordinates a process that spans several messages, for example a saga or a process manager. It's a
 * decider that accepts commands and/or events as input and that may produce both commands and events as output.
 * The state of a workflow instance is built from its own stream, which contains both the inputs and the outputs.
 *
 * @param <I> The type of input messages
 * @param <S> The state
 * @param <O> The type of output messages
 */
public interface Workflow<I extends Message, S, O extends Message> {

    default String name() {
        return getClass().getSimpleName();
    }

    S initialState();

    /**
     * @param input The message to react to
     * @param state The current state of the workflow instance
     * @return What the workflow wants to do, an empty list means nothing
     */
    List<WorkflowOutput<O>> decide(I input, S state);

    /**
     * @param state   The current state
     * @param message A message from the stream of the workflow instance, either an input or an output
     * @return The new state
     */
    S evolve(S state, Message message);

    static <I extends Message, S, O extends Message> Workflow<I, S, O> create(String name, Supplier<S> initialState, BiFunction<I, S, List<WorkflowOutput<O>>> decide,
                                                                               BiFunction<S, Message, S> evolve) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(initialState, "initialState cannot be null");
        Objects.requireNonNull(decide, "decide cannot be null");
        Objects.requireNonNull(evolve, "evolve cannot be null");
        return new Workflow<>() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public S initialState() {
                return initialState.get();
            }

            @Override
            public List<WorkflowOutput<O>> decide(I input, S state) {
                return decide.apply(input, state);
            }

            @Override
            public S evolve(S state, Message message) {
                return evolve.apply(state, message);
            }
        };
    }
}
