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

package org.eventcore.eventstore.inmemory;

import org.eventcore.eventstore.api.AfterCommitHook;
import org.eventcore.eventstore.api.AppendToStreamResult;
import org.eventcore.eventstore.api.EventStore;
import org.eventcore.eventstore.api.ExpectedStreamVersion;
import org.eventcore.eventstore.api.ExpectedVersionGuard;
import org.eventcore.eventstore.api.ReadAll;
import org.eventcore.eventstore.api.ReadStreamOptions;
import org.eventcore.eventstore.api.ReadStreamResult;
import org.eventcore.message.Event;
import org.eventcore.message.Message;
import org.eventcore.message.RecordedMessage;
import org.eventcore.projection.InlineProjectionHandler;
import org.eventcore.projection.ProjectionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * This is an {@link EventStore} that stores messages in-memory. This is mainly useful for testing
 * and/or demo purposes. It also implements {@link ReadAll} so that processors can consume the messages of all streams
 * in global position order.
 * <p>
 * Appends are atomic: the expected version check, the inline projections and the write all happen while holding
 * the lock of the stream map. After-commit hooks are invoked synchronously, still holding the lock, so every hook
 * sees the commits in global position order even when appending from several threads. A hook that appends to the
 * store itself (from the same thread) has its own append dispatched before the remaining hooks of the outer append.
 */
public class InMemoryEventStore implements EventStore, ReadAll {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    // We cannot use ConcurrentMap since it doesn't maintain insertion order
    private final Map<String, List<RecordedMessage<Message>>> state = Collections.synchronizedMap(new LinkedHashMap<>());
    // Guarded by the lock of "state"
    private final List<RecordedMessage<Message>> globalLog = new ArrayList<>();

    private final InMemoryEventStoreConfig config;
    private final ProjectionContext projectionContext;

    /**
     * Create an instance of {@link InMemoryEventStore} without projections and hooks
     */
    public InMemoryEventStore() {
        this(InMemoryEventStoreConfig.defaultConfig());
    }

    public InMemoryEventStore(InMemoryEventStoreConfig config) {
        requireNonNull(config, InMemoryEventStoreConfig.class.getSimpleName() + " cannot be null");
        this.config = config;
        this.projectionContext = new ProjectionContext(config.documentStore);
    }

    @Override
    public <M extends Message> ReadStreamResult<M> readStream(String streamName, ReadStreamOptions options) {
        requireNonNull(streamName, "streamName cannot be null");
        requireNonNull(options, ReadStreamOptions.class.getSimpleName() + " cannot be null");

        List<RecordedMessage<Message>> messages;
        synchronized (state) {
            List<RecordedMessage<Message>> current = state.get(streamName);
            messages = current == null ? null : List.copyOf(current);
        }

        long currentStreamVersion = calculateStreamVersion(messages);
        ExpectedVersionGuard.assertMatches(streamName, currentStreamVersion, options.expectedStreamVersion());
        if (messages == null) {
            return ReadStreamResult.notFound(streamName);
        }

        int fromIndex = (int) Math.min(options.skip(), messages.size());
        int toIndex = (int) options.endExclusive(currentStreamVersion);
        List<RecordedMessage<M>> slice = messages.subList(fromIndex, Math.max(fromIndex, toIndex)).stream()
                .map(recordedMessage -> recordedMessage.<M>cast())
                .collect(Collectors.toList());
        return new ReadStreamResult<>(streamName, slice, currentStreamVersion, true);
    }

    @Override
    public AppendToStreamResult appendToStream(String streamName, ExpectedStreamVersion expectedStreamVersion, List<? extends Message> messages) {
        requireNonNull(streamName, "streamName cannot be null");
        requireNonNull(expectedStreamVersion, ExpectedStreamVersion.class.getSimpleName() + " cannot be null");
        requireNonNull(messages, "messages cannot be null");

        final AtomicReference<List<RecordedMessage<Message>>> newMessages = new AtomicReference<>(List.of());
        final AtomicLong streamVersionAfterAppend = new AtomicLong();
        final AtomicBoolean createdNewStream = new AtomicBoolean();
        final AtomicLong lastGlobalPosition = new AtomicLong();

        // Hooks are invoked while holding the lock so that they observe commits in global position order
        synchronized (state) {
            state.compute(streamName, (__, currentMessages) -> {
                long currentStreamVersion = calculateStreamVersion(currentMessages);
                ExpectedVersionGuard.assertMatches(streamName, currentStreamVersion, expectedStreamVersion);

                if (messages.isEmpty()) {
                    streamVersionAfterAppend.set(currentStreamVersion);
                    lastGlobalPosition.set(globalLog.size());
                    return currentMessages;
                }

                List<RecordedMessage<Message>> recordedMessages = record(streamName, currentStreamVersion, messages);
                // Throws if an inline projection fails, neither the messages nor any projected document are written then
                InlineProjectionHandler.handle(config.inlineProjections, eventsOf(recordedMessages), projectionContext);

                globalLog.addAll(recordedMessages);
                newMessages.set(recordedMessages);
                streamVersionAfterAppend.set(currentStreamVersion + recordedMessages.size());
                createdNewStream.set(currentMessages == null);
                lastGlobalPosition.set(globalLog.size());

                List<RecordedMessage<Message>> allMessages = currentMessages == null ? new ArrayList<>() : new ArrayList<>(currentMessages);
                allMessages.addAll(recordedMessages);
                return allMessages;
            });

            List<RecordedMessage<Message>> committedMessages = newMessages.get();
            if (!committedMessages.isEmpty()) {
                log.debug("Appended {} message(s) to stream {}, stream version is now {}", committedMessages.size(), streamName, streamVersionAfterAppend.get());
                invokeAfterCommitHooks(committedMessages);
            }
        }
        return new AppendToStreamResult(streamName, streamVersionAfterAppend.get(), createdNewStream.get(), lastGlobalPosition.get());
    }

    @Override
    public List<RecordedMessage<Message>> readAll(long afterGlobalPosition, int maxCount) {
        if (afterGlobalPosition < 0) {
            throw new IllegalArgumentException("afterGlobalPosition cannot be negative");
        } else if (maxCount < 0) {
            throw new IllegalArgumentException("maxCount cannot be negative");
        }
        synchronized (state) {
            // Global position n is stored at index n - 1
            int fromIndex = (int) Math.min(afterGlobalPosition, globalLog.size());
            int toIndex = (int) Math.min((long) fromIndex + maxCount, globalLog.size());
            return List.copyOf(globalLog.subList(fromIndex, toIndex));
        }
    }

    @Override
    public long lastGlobalPosition() {
        synchronized (state) {
            return globalLog.size();
        }
    }

    public boolean exists(String streamName) {
        return state.containsKey(streamName);
    }

    private List<RecordedMessage<Message>> record(String streamName, long currentStreamVersion, List<? extends Message> messages) {
        long nextGlobalPosition = globalLog.size() + 1;
        List<RecordedMessage<Message>> recordedMessages = new ArrayList<>(messages.size());
        for (int i = 0; i < messages.size(); i++) {
            Message message = requireNonNull(messages.get(i), Message.class.getSimpleName() + " cannot be null");
            recordedMessages.add(new RecordedMessage<>(message, UUID.randomUUID().toString(), streamName, currentStreamVersion + i + 1, nextGlobalPosition + i));
        }
        return Collections.unmodifiableList(recordedMessages);
    }

    private void invokeAfterCommitHooks(List<RecordedMessage<Message>> committedMessages) {
        for (AfterCommitHook afterCommitHook : config.afterCommitHooks) {
            try {
                afterCommitHook.afterCommit(committedMessages);
            } catch (RuntimeException e) {
                // The messages are already committed so the append must not fail
                log.error("After commit hook {} failed for {} message(s) in stream {}", afterCommitHook, committedMessages.size(), committedMessages.get(0).streamName(), e);
            }
        }
    }

    private static List<RecordedMessage<Event>> eventsOf(List<RecordedMessage<Message>> recordedMessages) {
        return recordedMessages.stream()
                .filter(recordedMessage -> recordedMessage.message() instanceof Event)
                .map(recordedMessage -> recordedMessage.<Event>cast())
                .collect(Collectors.toList());
    }

    private static long calculateStreamVersion(List<RecordedMessage<Message>> messages) {
        if (messages == null || messages.isEmpty()) {
            return ExpectedVersionGuard.STREAM_DOES_NOT_EXIST_VERSION;
        }
        return messages.get(messages.size() - 1).streamPosition();
    }
}
