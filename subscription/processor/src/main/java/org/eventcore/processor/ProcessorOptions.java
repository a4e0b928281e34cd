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

package org.eventcore.processor;

import org.eventcore.message.Message;
import org.eventcore.message.RecordedMessage;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * Configures a {@link MessageProcessor}. Defaults:
 * <ul>
 *     <li>{@code startFrom}: {@link StartFrom#current()}</li>
 *     <li>{@code canHandle}: empty, meaning that all message types are handled</li>
 *     <li>{@code upcast}: {@link Upcaster#identity()}</li>
 *     <li>{@code checkpointer}: none, the checkpoint is only kept in memory</li>
 *     <li>{@code stopAfter}: never</li>
 * </ul>
 * <pre>
 * ProcessorOptions.&lt;ShoppingCartEvent&gt;create("cart-notifications")
 *         .canHandle("ProductItemAdded", "ShoppingCartConfirmed")
 *         .checkpointer(new InMemoryCheckpointer(documentStore));
 * </pre>
 *
 * @param <M> The type of messages that the processor handles
 */
@NullMarked
public final class ProcessorOptions<M extends Message> {
    public static final int DEFAULT_VERSION = 1;

    public final @Nullable String processorId;
    public final @Nullable String partition;
    public final int version;
    public final StartFrom startFrom;
    public final Predicate<RecordedMessage<Message>> stopAfter;
    public final Set<String> canHandle;
    public final Upcaster<M> upcast;
    public final @Nullable Checkpointer checkpointer;
    public final ProcessorHooks hooks;

    private ProcessorOptions(@Nullable String processorId, @Nullable String partition, int version, StartFrom startFrom, Predicate<RecordedMessage<Message>> stopAfter,
                             Set<String> canHandle, Upcaster<M> upcast, @Nullable Checkpointer checkpointer, ProcessorHooks hooks) {
        if (version < 1) {
            throw new IllegalArgumentException("version must be greater than zero");
        }
        this.processorId = processorId;
        this.partition = partition;
        this.version = version;
        this.startFrom = requireNonNull(startFrom, StartFrom.class.getSimpleName() + " cannot be null");
        this.stopAfter = requireNonNull(stopAfter, "stopAfter cannot be null");
        this.canHandle = Set.copyOf(requireNonNull(canHandle, "canHandle cannot be null"));
        this.upcast = requireNonNull(upcast, Upcaster.class.getSimpleName() + " cannot be null");
        this.checkpointer = checkpointer;
        this.hooks = requireNonNull(hooks, ProcessorHooks.class.getSimpleName() + " cannot be null");
    }

    public static <M extends Message> ProcessorOptions<M> create(String processorId) {
        requireNonNull(processorId, "processorId cannot be null");
        return ProcessorOptions.<M>create().processorId(processorId);
    }

    /**
     * Create options without a processor id. Only useful for processors that derive their id themselves, such as
     * {@link Projector}.
     */
    public static <M extends Message> ProcessorOptions<M> create() {
        return new ProcessorOptions<>(null, null, DEFAULT_VERSION, StartFrom.current(), __ -> false, Set.of(), Upcaster.identity(), null, ProcessorHooks.none());
    }

    public ProcessorOptions<M> processorId(String processorId) {
        return new ProcessorOptions<>(processorId, partition, version, startFrom, stopAfter, canHandle, upcast, checkpointer, hooks);
    }

    public ProcessorOptions<M> partition(@Nullable String partition) {
        return new ProcessorOptions<>(processorId, partition, version, startFrom, stopAfter, canHandle, upcast, checkpointer, hooks);
    }

    public ProcessorOptions<M> version(int version) {
        return new ProcessorOptions<>(processorId, partition, version, startFrom, stopAfter, canHandle, upcast, checkpointer, hooks);
    }

    public ProcessorOptions<M> startFrom(StartFrom startFrom) {
        return new ProcessorOptions<>(processorId, partition, version, startFrom, stopAfter, canHandle, upcast, checkpointer, hooks);
    }

    /**
     * @param stopAfter Deactivate the processor after it has processed the first message matching this predicate
     */
    public ProcessorOptions<M> stopAfter(Predicate<RecordedMessage<Message>> stopAfter) {
        return new ProcessorOptions<>(processorId, partition, version, startFrom, stopAfter, canHandle, upcast, checkpointer, hooks);
    }

    public ProcessorOptions<M> canHandle(Set<String> canHandle) {
        return new ProcessorOptions<>(processorId, partition, version, startFrom, stopAfter, canHandle, upcast, checkpointer, hooks);
    }

    public ProcessorOptions<M> canHandle(String... canHandle) {
        return canHandle(Set.of(canHandle));
    }

    public ProcessorOptions<M> upcast(Upcaster<M> upcast) {
        return new ProcessorOptions<>(processorId, partition, version, startFrom, stopAfter, canHandle, upcast, checkpointer, hooks);
    }

    public ProcessorOptions<M> checkpointer(@Nullable Checkpointer checkpointer) {
        return new ProcessorOptions<>(processorId, partition, version, startFrom, stopAfter, canHandle, upcast, checkpointer, hooks);
    }

    public ProcessorOptions<M> hooks(ProcessorHooks hooks) {
        return new ProcessorOptions<>(processorId, partition, version, startFrom, stopAfter, canHandle, upcast, checkpointer, hooks);
    }

    public boolean handles(String messageType) {
        return canHandle.isEmpty() || canHandle.contains(messageType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProcessorOptions)) return false;
        ProcessorOptions<?> that = (ProcessorOptions<?>) o;
        return version == that.version && Objects.equals(processorId, that.processorId) && Objects.equals(partition, that.partition)
                && Objects.equals(startFrom, that.startFrom) && Objects.equals(stopAfter, that.stopAfter) && Objects.equals(canHandle, that.canHandle)
                && Objects.equals(upcast, that.upcast) && Objects.equals(checkpointer, that.checkpointer) && Objects.equals(hooks, that.hooks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(processorId, partition, version, startFrom, stopAfter, canHandle, upcast, checkpointer, hooks);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", ProcessorOptions.class.getSimpleName() + "[", "]")
                .add("processorId='" + processorId + "'")
                .add("partition='" + partition + "'")
                .add("version=" + version)
                .add("startFrom=" + startFrom)
                .add("canHandle=" + canHandle)
                .add("checkpointer=" + checkpointer)
                .toString();
    }
}
