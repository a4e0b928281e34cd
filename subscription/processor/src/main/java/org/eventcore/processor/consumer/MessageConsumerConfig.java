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

package org.eventcore.processor.consumer;

import org.eventcore.processor.MessageProcessor;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Configuration for the {@link MessageConsumer}. Defaults:
 * <ul>
 *     <li>{@code consumerId}: a random UUID</li>
 *     <li>{@code batchSize}: {@value #DEFAULT_BATCH_SIZE}</li>
 *     <li>{@code pollInterval}: {@value #DEFAULT_POLL_INTERVAL_MILLIS} millis, how long to wait before polling again when there are no new messages</li>
 *     <li>{@code executor}: a cached thread pool owned (and shut down) by the consumer</li>
 * </ul>
 */
@NullMarked
public class MessageConsumerConfig {
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final long DEFAULT_POLL_INTERVAL_MILLIS = 100;

    public final String consumerId;
    public final List<MessageProcessor<?>> processors;
    public final int batchSize;
    public final Duration pollInterval;
    public final @Nullable ExecutorService executor;

    private MessageConsumerConfig(String consumerId, List<MessageProcessor<?>> processors, int batchSize, Duration pollInterval, @Nullable ExecutorService executor) {
        Objects.requireNonNull(consumerId, "consumerId cannot be null");
        Objects.requireNonNull(pollInterval, "pollInterval cannot be null");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be greater than zero");
        } else if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        Set<String> processorIds = new HashSet<>();
        for (MessageProcessor<?> processor : processors) {
            if (!processorIds.add(processor.id())) {
                throw new IllegalArgumentException("Processor " + processor.id() + " is registered more than once in consumer " + consumerId);
            }
        }
        this.consumerId = consumerId;
        this.processors = List.copyOf(processors);
        this.batchSize = batchSize;
        this.pollInterval = pollInterval;
        this.executor = executor;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageConsumerConfig)) return false;
        MessageConsumerConfig that = (MessageConsumerConfig) o;
        return batchSize == that.batchSize && Objects.equals(consumerId, that.consumerId) && Objects.equals(processors, that.processors)
                && Objects.equals(pollInterval, that.pollInterval) && Objects.equals(executor, that.executor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(consumerId, processors, batchSize, pollInterval, executor);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", MessageConsumerConfig.class.getSimpleName() + "[", "]")
                .add("consumerId='" + consumerId + "'")
                .add("processors=" + processors.size())
                .add("batchSize=" + batchSize)
                .add("pollInterval=" + pollInterval)
                .add("executor=" + executor)
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private final List<MessageProcessor<?>> processors = new ArrayList<>();
        private String consumerId = UUID.randomUUID().toString();
        private int batchSize = DEFAULT_BATCH_SIZE;
        private Duration pollInterval = Duration.ofMillis(DEFAULT_POLL_INTERVAL_MILLIS);
        private ExecutorService executor;

        @NullMarked
        public Builder consumerId(String consumerId) {
            this.consumerId = consumerId;
            return this;
        }

        @NullMarked
        public Builder processor(MessageProcessor<?> processor) {
            Objects.requireNonNull(processor, MessageProcessor.class.getSimpleName() + " cannot be null");
            this.processors.add(processor);
            return this;
        }

        @NullMarked
        public Builder processors(List<? extends MessageProcessor<?>> processors) {
            Objects.requireNonNull(processors, "processors cannot be null");
            processors.forEach(this::processor);
            return this;
        }

        @NullMarked
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        @NullMarked
        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        /**
         * @param executor The executor that processors are invoked on. It's not shut down by the consumer.
         * @return The builder instance
         */
        @NullMarked
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        @NullMarked
        public MessageConsumerConfig build() {
            return new MessageConsumerConfig(consumerId, processors, batchSize, pollInterval, executor);
        }
    }
}
