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

package org.eventcore.subscription.streaming;

import org.eventcore.eventstore.api.AfterCommitHook;
import org.eventcore.message.Message;
import org.eventcore.message.RecordedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * Fans out the messages it's notified about to any number of {@link CaughtUpStream}s, each of which starts with a
 * replay of everything the coordinator has been notified about so far. Register it as an {@link AfterCommitHook} of
 * an event store to get a live, caught-up view of the store, e.g. for dashboards or tests.
 * <p>
 * Each listener has a bounded queue for live messages. A listener whose queue is full is considered abandoned
 * and is closed and deregistered.
 */
public class StreamingCoordinator implements AfterCommitHook {
    private static final Logger log = LoggerFactory.getLogger(StreamingCoordinator.class);

    public static final int DEFAULT_LISTENER_QUEUE_CAPACITY = 10_000;

    private final int listenerQueueCapacity;
    // Guarded by "this"
    private final List<RecordedMessage<Message>> history = new ArrayList<>();
    private final Map<String, CaughtUpStream> listeners = new ConcurrentHashMap<>();

    private volatile boolean shutdown = false;

    public StreamingCoordinator() {
        this(DEFAULT_LISTENER_QUEUE_CAPACITY);
    }

    /**
     * @param listenerQueueCapacity The max number of unread live items per listener
     */
    public StreamingCoordinator(int listenerQueueCapacity) {
        if (listenerQueueCapacity < 1) {
            throw new IllegalArgumentException("listenerQueueCapacity must be greater than zero");
        }
        this.listenerQueueCapacity = listenerQueueCapacity;
    }

    /**
     * Add the messages to the history and push them to all listeners. Does nothing if {@code messages} is empty.
     */
    public synchronized void notify(List<RecordedMessage<Message>> messages) {
        requireNonNull(messages, "messages cannot be null");
        if (messages.isEmpty() || shutdown) {
            return;
        }

        history.addAll(messages);
        long highWaterMark = messages.get(messages.size() - 1).globalPosition();
        for (CaughtUpStream listener : listeners.values()) {
            listener.highWaterMark(highWaterMark);
            for (RecordedMessage<Message> message : messages) {
                if (!listener.deliver(message)) {
                    log.warn("Listener {} is not keeping up (more than {} unread items), deregistering it", listener.id(), listenerQueueCapacity);
                    listeners.remove(listener.id());
                    listener.markClosed();
                    break;
                }
            }
        }
    }

    @Override
    public void afterCommit(List<RecordedMessage<Message>> messages) {
        notify(messages);
    }

    /**
     * Create a new listener, seeded with the full history followed by a caught-up marker.
     */
    public synchronized CaughtUpStream stream() {
        if (shutdown) {
            throw new IllegalStateException("Cannot create a stream when shutdown");
        }
        CaughtUpStream stream = new CaughtUpStream(UUID.randomUUID().toString(), history, listenerQueueCapacity, this::deregister);
        listeners.put(stream.id(), stream);
        log.debug("Registered listener {}, replaying {} message(s)", stream.id(), history.size());
        return stream;
    }

    public int listenerCount() {
        return listeners.size();
    }

    @PreDestroy
    public synchronized void shutdown() {
        shutdown = true;
        listeners.values().forEach(CaughtUpStream::markClosed);
        listeners.clear();
        history.clear();
    }

    private void deregister(CaughtUpStream stream) {
        if (listeners.remove(stream.id()) != null) {
            log.debug("Deregistered listener {}", stream.id());
        }
    }
}
