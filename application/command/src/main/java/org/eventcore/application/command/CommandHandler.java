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

import org.eventcore.eventstore.api.AggregateStreamResult;
import org.eventcore.eventstore.api.AppendToStreamResult;
import org.eventcore.eventstore.api.EventStore;
import org.eventcore.eventstore.api.ExpectedStreamVersion;
import org.eventcore.eventstore.api.ReadStreamOptions;
import org.eventcore.message.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Handles a command by reading the state of a stream, calling a pure function from the domain model with the state and
 * appending the events it returns. If the stream is changed between the read and the append an
 * {@link org.eventcore.eventstore.api.ExpectedVersionConflictException} is thrown, which is retried if the configured
 * {@link org.eventcore.retry.RetryStrategy} says so. Each retry reads the stream from scratch.
 * <pre>
 * CommandHandler&lt;ShoppingCart, ShoppingCartEvent&gt; handler = new CommandHandler&lt;&gt;(eventStore, CommandHandlerOptions.of(ShoppingCart::evolve, ShoppingCart::initial));
 * handler.handle("shopping_cart-1", state -&gt; ShoppingCartDecider.addProductItem(command, state));
 * </pre>
 *
 * @param <S> The state
 * @param <E> The type of events
 */
public class CommandHandler<S, E extends Event> {
    private static final Logger log = LoggerFactory.getLogger(CommandHandler.class);

    private final EventStore eventStore;
    private final CommandHandlerOptions<S, E> options;

    public CommandHandler(EventStore eventStore, CommandHandlerOptions<S, E> options) {
        if (eventStore == null) throw new IllegalArgumentException(EventStore.class.getSimpleName() + " cannot be null");
        if (options == null) throw new IllegalArgumentException(CommandHandlerOptions.class.getSimpleName() + " cannot be null");
        this.eventStore = eventStore;
        this.options = options;
    }

    public CommandHandlerResult<S, E> handle(String id, Function<S, List<E>> decide) {
        return handle(id, decide, HandleOptions.defaults());
    }

    /**
     * @param id            The id of the entity, mapped to a stream name by {@link CommandHandlerOptions#mapToStreamId}
     * @param decide        A pure function that returns the new events, an empty list means that nothing should be appended
     * @param handleOptions Options for this invocation
     * @return The new state and the new events
     */
    public CommandHandlerResult<S, E> handle(String id, Function<S, List<E>> decide, HandleOptions handleOptions) {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(decide, "decide cannot be null");
        Objects.requireNonNull(handleOptions, HandleOptions.class.getSimpleName() + " cannot be null");
        String streamName = options.mapToStreamId.apply(id);

        return options.retryStrategy.execute(() -> handleOnce(streamName, decide, handleOptions.expectedStreamVersion()));
    }

    private CommandHandlerResult<S, E> handleOnce(String streamName, Function<S, List<E>> decide, ExpectedStreamVersion requestedStreamVersion) {
        ReadStreamOptions readOptions = requestedStreamVersion == null ? ReadStreamOptions.all() : ReadStreamOptions.all().expectedStreamVersion(requestedStreamVersion);
        AggregateStreamResult<S> aggregated = eventStore.aggregateStream(streamName, options.initialState, options.evolve, readOptions);
        S state = aggregated.state();

        List<E> newEvents = decide.apply(state);
        if (newEvents == null || newEvents.isEmpty()) {
            return new CommandHandlerResult<>(state, List.of(), aggregated.currentStreamVersion(), false);
        }

        ExpectedStreamVersion expectedStreamVersion = requestedStreamVersion != null ? requestedStreamVersion
                : aggregated.streamExists() ? ExpectedStreamVersion.exactly(aggregated.currentStreamVersion()) : ExpectedStreamVersion.streamDoesNotExist();
        AppendToStreamResult appendResult = eventStore.appendToStream(streamName, expectedStreamVersion, newEvents);
        log.debug("Appended {} event(s) to {}, next expected version is {}", newEvents.size(), streamName, appendResult.nextExpectedStreamVersion);

        S newState = state;
        for (E event : newEvents) {
            newState = options.evolve.apply(newState, event);
        }
        return new CommandHandlerResult<>(newState, newEvents, appendResult.nextExpectedStreamVersion, appendResult.createdNewStream);
    }
}
