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

package org.eventcore.dsl.decider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * A decider is a model that can be implemented to get a structured way to implement decision logic for a business entity (typically aggregate) or use case.
 * <p>
 * {@code decide} must be pure: it may only look at the command and the state and either return new events or throw
 * (typically an {@code IllegalDomainStateException}) when a business rule is violated.
 *
 * @param <C> The type of commands that the decider can handle
 * @param <S> The state that the decider works on
 * @param <E> The type of events that the decider returns
 */
public interface Decider<C, S, E> {
    S initialState();

    List<E> decide(C command, S state);

    S evolve(S state, E event);

    default boolean isTerminal(S state) {
        return false;
    }

    /**
     * Fold {@code events} into the state and decide on the commands, in order. Each command sees the state produced by the
     * events of the previous commands.
     *
     * @return A decision containing the state after the commands and only the new events
     */
    @SuppressWarnings("unchecked")
    default Decision<S, E> decideOnEvents(List<E> events, C command, C... additionalCommands) {
        return decideOnEvents(events, toList(command, additionalCommands));
    }

    default Decision<S, E> decideOnEvents(List<E> events, List<C> commands) {
        return decideOnState(fold(initialState(), events), commands);
    }

    @SuppressWarnings("unchecked")
    default Decision<S, E> decideOnState(S state, C command, C... additionalCommands) {
        return decideOnState(state, toList(command, additionalCommands));
    }

    default Decision<S, E> decideOnState(S state, List<C> commands) {
        requireNonNull(commands, "commands cannot be null");
        S currentState = state;
        List<E> newEvents = new ArrayList<>();
        for (C command : commands) {
            List<E> eventsFromCommand = decide(command, currentState);
            currentState = fold(currentState, eventsFromCommand);
            newEvents.addAll(eventsFromCommand);
        }
        return new Decision<>(currentState, Collections.unmodifiableList(newEvents));
    }

    /**
     * Apply the {@code events} to {@code state}, stops early if the state becomes terminal.
     */
    default S fold(S state, List<E> events) {
        S currentState = state;
        for (E event : events) {
            currentState = evolve(currentState, event);
            if (isTerminal(currentState)) {
                break;
            }
        }
        return currentState;
    }

    private static <C> List<C> toList(C command, C[] additionalCommands) {
        List<C> commands = new ArrayList<>();
        commands.add(command);
        if (additionalCommands != null && additionalCommands.length != 0) {
            Collections.addAll(commands, additionalCommands);
        }
        return commands;
    }

    /**
     * @param state  The state after all new events have been applied
     * @param events The new events
     */
    record Decision<S, E>(S state, List<E> events) {

        public boolean hasEvents() {
            return !events.isEmpty();
        }
    }

    static <C, S, E> Decider<C, S, E> create(Supplier<S> initialState, BiFunction<C, S, List<E>> decide, BiFunction<S, E, S> evolve) {
        return create(initialState, decide, evolve, __ -> false);
    }

    static <C, S, E> Decider<C, S, E> create(Supplier<S> initialState, BiFunction<C, S, List<E>> decide, BiFunction<S, E, S> evolve,
                                             Predicate<S> isTerminal) {
        requireNonNull(initialState, "initialState cannot be null");
        requireNonNull(decide, "decide cannot be null");
        requireNonNull(evolve, "evolve cannot be null");
        requireNonNull(isTerminal, "isTerminal cannot be null");
        return new Decider<>() {
            @Override
            public S initialState() {
                return initialState.get();
            }

            @Override
            public List<E> decide(C command, S state) {
                return decide.apply(command, state);
            }

            @Override
            public S evolve(S state, E event) {
                return evolve.apply(state, event);
            }

            @Override
            public boolean isTerminal(S state) {
                return isTerminal.test(state);
            }
        };
    }
}
