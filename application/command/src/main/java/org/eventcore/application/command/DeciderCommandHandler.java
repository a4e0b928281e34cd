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

package org.eventcore.application.command;

import org.eventcore.dsl.decider.Decider;
import org.eventcore.eventstore.api.EventStore;
import org.eventcore.message.Event;
import org.eventcore.retry.RetryStrategy;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A {@link CommandHandler} driven by a {@link Decider}. When handling more than one command, each command sees the
 * state produced by the events of the previous ones, and all events are appended at once.
 *
 * @param <C> The type of commands
 * @param <S> The state
 * @param <E> The type of events
 */
public class DeciderCommandHandler<C, S, E extends Event> {
    private final Decider<C, S, E> decider;
    private final CommandHandler<S, E> commandHandler;

    public DeciderCommandHandler(EventStore eventStore, Decider<C, S, E> decider) {
        this(eventStore, decider, Function.identity(), RetryStrategy.none());
    }

    public DeciderCommandHandler(EventStore eventStore, Decider<C, S, E> decider, Function<String, String> mapToStreamId, RetryStrategy retryStrategy) {
        this.decider = Objects.requireNonNull(decider, Decider.class.getSimpleName() + " cannot be null");
        CommandHandlerOptions<S, E> options = CommandHandlerOptions.<S, E>of(decider::evolve, decider::initialState)
                .mapToStreamId(mapToStreamId)
                .retryStrategy(retryStrategy);
        this.commandHandler = new CommandHandler<>(eventStore, options);
    }

    public CommandHandlerResult<S, E> handle(String id, C command) {
        return handle(id, List.of(command), HandleOptions.defaults());
    }

    public CommandHandlerResult<S, E> handle(String id, C command, HandleOptions handleOptions) {
        return handle(id, List.of(command), handleOptions);
    }

    public CommandHandlerResult<S, E> handle(String id, List<C> commands, HandleOptions handleOptions) {
        Objects.requireNonNull(commands, "commands cannot be null");
        return commandHandler.handle(id, state -> decider.decideOnState(state, commands).events(), handleOptions);
    }
}
