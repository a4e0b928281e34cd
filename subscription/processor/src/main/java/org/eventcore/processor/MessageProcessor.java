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
import org.eventcore.processor.StoreCheckpointResult.Ignored;
import org.eventcore.processor.StoreCheckpointResult.Mismatch;
import org.eventcore.processor.StoreCheckpointResult.Stored;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Processes batches of recorded messages, in global position order, and keeps track of how far it has come by
 * storing a checkpoint after each handled message (or batch). Delivery is at-least-once: a message whose checkpoint
 * couldn't be stored may be delivered again after a restart, so handlers should be idempotent. Messages at or before
 * the position the processor started from are skipped.
 * <p>
 * A processor is created by {@link Reactor} or {@link Projector} and is typically driven by a
 * {@link org.eventcore.processor.consumer.MessageConsumer}. A single instance must not be driven by several threads
 * at the same time.
 *
 * @param <M> The type of messages that the processor handles
 */
public class MessageProcessor<M extends Message> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MessageProcessor.class);

    private final String id;
    private final ProcessorOptions<M> options;
    private final @Nullable EachMessageHandler<M> eachMessage;
    private final @Nullable EachBatchHandler<M> eachBatch;

    private volatile boolean active = false;
    // The checkpoint that we believe is stored
    private volatile @Nullable Long lastCheckpoint;
    // The position of the last message that was handled, may be ahead of lastCheckpoint if storing a checkpoint failed
    private volatile long lastHandledPosition;

    MessageProcessor(ProcessorOptions<M> options, @Nullable EachMessageHandler<M> eachMessage, @Nullable EachBatchHandler<M> eachBatch) {
        requireNonNull(options, ProcessorOptions.class.getSimpleName() + " cannot be null");
        if (options.processorId == null) {
            throw new IllegalArgumentException("processorId cannot be null");
        } else if ((eachMessage == null) == (eachBatch == null)) {
            throw new IllegalArgumentException("Exactly one of eachMessage and eachBatch must be defined");
        }
        this.id = options.processorId;
        this.options = options;
        this.eachMessage = eachMessage;
        this.eachBatch = eachBatch;
    }

    public String id() {
        return id;
    }

    public ProcessorOptions<M> options() {
        return options;
    }

    public boolean isActive() {
        return active;
    }

    public @Nullable Long lastCheckpoint() {
        return lastCheckpoint;
    }

    /**
     * Activate the processor and resolve where it should start. An explicit start position is returned as is, while
     * {@link StartFrom#current()} is resolved from the stored checkpoint ({@link StartFrom#beginning()} if there's none).
     * The stored checkpoint is read in both cases so that new checkpoints are stored on top of it. Starting before the
     * stored checkpoint replays the messages in between, the stored checkpoint is only moved once the replay has passed it.
     *
     * @return The position to start from, a consumer should deliver messages after this position.
     */
    public synchronized CurrentPosition start() {
        active = true;
        options.hooks.onStart().run();

        Checkpointer checkpointer = options.checkpointer;
        Long storedCheckpoint = checkpointer == null ? null : checkpointer.read(id, options.partition, options.version);

        final CurrentPosition position;
        if (options.startFrom instanceof CurrentPosition explicitPosition) {
            position = explicitPosition;
        } else {
            position = storedCheckpoint == null ? StartFrom.beginning() : StartFrom.checkpoint(storedCheckpoint);
        }

        if (position instanceof CurrentPosition.Checkpoint checkpoint) {
            lastHandledPosition = checkpoint.lastCheckpoint();
        } else if (position instanceof CurrentPosition.End) {
            // The consumer starts after the last message in the store
            lastHandledPosition = storedCheckpoint == null ? 0 : storedCheckpoint;
        } else {
            lastHandledPosition = 0;
        }

        if (checkpointer != null) {
            lastCheckpoint = storedCheckpoint;
        } else {
            lastCheckpoint = position instanceof CurrentPosition.Checkpoint checkpoint ? checkpoint.lastCheckpoint() : null;
        }
        log.info("Started processor {} (version {}) from {}, stored checkpoint is {}", id, options.version, position, storedCheckpoint);
        return position;
    }

    /**
     * Handle a batch of messages sequentially. Messages already covered by the checkpoint and messages of types that
     * the processor can't handle are skipped (but still checkpointed). An exception thrown by the handler propagates
     * and aborts the rest of the batch.
     *
     * @return {@link MessageHandlerResult#stop(String)} if the processor stopped during this batch, otherwise {@link MessageHandlerResult#ack()}.
     */
    public synchronized MessageHandlerResult handle(List<RecordedMessage<Message>> batch) {
        requireNonNull(batch, "batch cannot be null");
        if (!active) {
            return MessageHandlerResult.skip("Processor " + id + " is not active");
        }
        return eachMessage != null ? handleEachMessage(eachMessage, batch) : handleAsBatch(requireNonNull(eachBatch), batch);
    }

    private MessageHandlerResult handleEachMessage(EachMessageHandler<M> handler, List<RecordedMessage<Message>> batch) {
        for (RecordedMessage<Message> message : batch) {
            if (isAlreadyHandled(message)) {
                continue;
            }

            MessageHandlerResult result = options.handles(message.type()) ? handler.handle(upcast(message)) : MessageHandlerResult.skip("Unhandled message type " + message.type());

            MessageHandlerResult checkpointResult = storeCheckpoint(message);
            if (checkpointResult.isStop()) {
                return checkpointResult;
            } else if (result.isStop()) {
                active = false;
                return result;
            } else if (options.stopAfter.test(message)) {
                active = false;
                return MessageHandlerResult.stop("Stop condition reached");
            }
        }
        return MessageHandlerResult.ack();
    }

    private MessageHandlerResult handleAsBatch(EachBatchHandler<M> handler, List<RecordedMessage<Message>> batch) {
        List<RecordedMessage<Message>> messagesToCheckpoint = new ArrayList<>();
        List<RecordedMessage<M>> messagesToHandle = new ArrayList<>();
        boolean stopConditionReached = false;
        for (RecordedMessage<Message> message : batch) {
            if (isAlreadyHandled(message)) {
                continue;
            }
            messagesToCheckpoint.add(message);
            if (options.handles(message.type())) {
                messagesToHandle.add(upcast(message));
            }
            if (options.stopAfter.test(message)) {
                stopConditionReached = true;
                break;
            }
        }

        if (messagesToCheckpoint.isEmpty()) {
            return MessageHandlerResult.ack();
        }

        MessageHandlerResult result = messagesToHandle.isEmpty() ? MessageHandlerResult.ack() : handler.handle(messagesToHandle);

        MessageHandlerResult checkpointResult = storeCheckpoint(messagesToCheckpoint.get(messagesToCheckpoint.size() - 1));
        if (checkpointResult.isStop()) {
            return checkpointResult;
        } else if (result.isStop()) {
            active = false;
            return result;
        } else if (stopConditionReached) {
            active = false;
            return MessageHandlerResult.stop("Stop condition reached");
        }
        return MessageHandlerResult.ack();
    }

    private boolean isAlreadyHandled(RecordedMessage<Message> message) {
        return message.globalPosition() <= lastHandledPosition;
    }

    private RecordedMessage<M> upcast(RecordedMessage<Message> message) {
        M upcasted = options.upcast.upcast(message.message());
        return message.withMessage(upcasted);
    }

    private MessageHandlerResult storeCheckpoint(RecordedMessage<Message> message) {
        long newCheckpoint = message.globalPosition();
        lastHandledPosition = Math.max(lastHandledPosition, newCheckpoint);

        Checkpointer checkpointer = options.checkpointer;
        if (checkpointer == null) {
            lastCheckpoint = newCheckpoint;
            return MessageHandlerResult.ack();
        }

        final StoreCheckpointResult result;
        try {
            result = checkpointer.store(id, options.partition, options.version, lastCheckpoint, newCheckpoint);
        } catch (RuntimeException e) {
            // The message has been handled, it'll be checkpointed together with the next one
            log.error("Failed to store checkpoint {} for processor {}", newCheckpoint, id, e);
            return MessageHandlerResult.ack();
        }

        if (result instanceof Stored stored) {
            lastCheckpoint = stored.newCheckpoint();
        } else if (result instanceof Ignored ignored) {
            log.debug("Checkpoint {} for processor {} was ignored, stored checkpoint is {}", newCheckpoint, id, ignored.currentCheckpoint());
            Long currentCheckpoint = ignored.currentCheckpoint();
            // An unchanged checkpoint means that we're replaying messages before it, otherwise another instance has moved ahead
            if (currentCheckpoint != null && !currentCheckpoint.equals(lastCheckpoint)) {
                lastHandledPosition = Math.max(lastHandledPosition, currentCheckpoint);
            }
            lastCheckpoint = currentCheckpoint;
        } else if (result instanceof Mismatch mismatch) {
            log.warn("Checkpoint mismatch for processor {}, expected {} but stored checkpoint is {}. Stopping processor.", id, lastCheckpoint, mismatch.currentCheckpoint());
            active = false;
            return MessageHandlerResult.stop("Checkpoint mismatch for processor " + id + ", expected " + lastCheckpoint + " but was " + mismatch.currentCheckpoint());
        }
        return MessageHandlerResult.ack();
    }

    /**
     * Deactivate the processor and invoke the {@code onClose} hook.
     */
    @Override
    public synchronized void close() {
        active = false;
        options.hooks.onClose().run();
        log.info("Closed processor {}", id);
    }
}
