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

import org.eventcore.message.Event;
import org.eventcore.retry.RetryStrategy;
import org.jspecify.annotations.NullMarked;

import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Configures a {@link CommandHandler}. By default the id passed to the handler is used as stream name and version
 * conflicts are not retried.
 * <pre>
 * CommandHandlerOptions.of(ShoppingCart::evolve, ShoppingCart::initial)
 *         .mapToStreamId(id -&gt; "shopping_cart-" + id)
 *         .retryStrategy(CommandHandlerRetry.onVersionConflict());
 * </pre>
 *
 * @param <S> The state
 * @param <E> The type of events
 */
@NullMarked
public final class CommandHandlerOptions<S, E extends Event> {
    public final BiFunction<S, E, S> evolve;
    public final Supplier<S> initialState;
    public final Function<String, String> mapToStreamId;
    public final RetryStrategy retryStrategy;

    private CommandHandlerOptions(BiFunction<S, E, S> evolve, Supplier<S> initialState, Function<String, String> mapToStreamId, RetryStrategy retryStrategy) {
        this.evolve = Objects.requireNonNull(evolve, "evolve cannot be null");
        this.initialState = Objects.requireNonNull(initialState, "initialState cannot be null");
        this.mapToStreamId = Objects.requireNonNull(mapToStreamId, "mapToStreamId cannot be null");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
    }

    public static <S, E extends Event> CommandHandlerOptions<S, E> of(BiFunction<S, E, S> evolve, Supplier<S> initialState) {
        return new CommandHandlerOptions<>(evolve, initialState, Function.identity(), RetryStrategy.none());
    }

    /**
     * @param mapToStreamId Map the id passed to {@link CommandHandler#handle(String, Function)} to a stream name
     * @return A new instance of {@link CommandHandlerOptions}
     */
    public CommandHandlerOptions<S, E> mapToStreamId(Function<String, String> mapToStreamId) {
        return new CommandHandlerOptions<>(evolve, initialState, mapToStreamId, retryStrategy);
    }

    /**
     * @param retryStrategy The retry strategy to run each command within, see {@link CommandHandlerRetry}
     * @return A new instance of {@link CommandHandlerOptions}
     */
    public CommandHandlerOptions<S, E> retryStrategy(RetryStrategy retryStrategy) {
        return new CommandHandlerOptions<>(evolve, initialState, mapToStreamId, retryStrategy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CommandHandlerOptions)) return false;
        CommandHandlerOptions<?, ?> that = (CommandHandlerOptions<?, ?>) o;
        return Objects.equals(evolve, that.evolve) && Objects.equals(initialState, that.initialState) && Objects.equals(mapToStreamId, that.mapToStreamId) && Objects.equals(retryStrategy, that.retryStrategy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(evolve, initialState, mapToStreamId, retryStrategy);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", CommandHandlerOptions.class.getSimpleName() + "[", "]")
                .add("evolve=" + evolve)
                .add("initialState=" + initialState)
                .add("mapToStreamId=" + mapToStreamId)
                .add("retryStrategy=" + retryStrategy)
                .toString();
    }
}
