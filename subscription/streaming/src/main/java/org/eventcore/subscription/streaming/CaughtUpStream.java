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

import org.eventcore.message.Message;
import org.eventcore.message.RecordedMessage;
import org.eventcore.subscription.streaming.StreamItem.CaughtUp;
import org.eventcore.subscription.streaming.StreamItem.Delivered;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * A listener created by {@link StreamingCoordinator#stream()}. It starts with a replay of the coordinator's history
 * followed by a {@link CaughtUp} marker and then receives live messages as {@link Delivered} items. After a live
 * message a new marker is only emitted once the listener has received everything up to the high-water mark, i.e. the
 * last message of the latest notification.
 * <p>
 * Close the stream when it's no longer needed, this deregisters it from the coordinator right away.
 */
public class CaughtUpStream implements AutoCloseable {
    private static final Duration TAKE_CHECK_INTERVAL = Duration.ofMillis(100);

    private final String id;
    private final BlockingQueue<StreamItem> queue;
    private final Consumer<CaughtUpStream> onClose;

    private volatile long currentPosition;
    private volatile long highWaterMark;
    private volatile boolean closed = false;

    CaughtUpStream(String id, List<RecordedMessage<Message>> history, int capacity, Consumer<CaughtUpStream> onClose) {
        this.id = id;
        this.onClose = onClose;
        // The replayed history doesn't count against the capacity, one extra slot is kept free for a caught-up marker
        this.queue = new LinkedBlockingQueue<>(capacity + history.size() + 2);

        long lastPosition = 0;
        for (RecordedMessage<Message> message : history) {
            queue.add(new Delivered(message));
            lastPosition = message.globalPosition();
        }
        queue.add(new CaughtUp(lastPosition));
        this.currentPosition = lastPosition;
        this.highWaterMark = lastPosition;
    }

    public String id() {
        return id;
    }

    public long highWaterMark() {
        return highWaterMark;
    }

    void highWaterMark(long highWaterMark) {
        this.highWaterMark = highWaterMark;
    }

    /**
     * Queue the message, followed by a caught-up marker if it's at the high-water mark. The last free slot is
     * reserved for the marker, so a message is only accepted if a marker is guaranteed to fit after it.
     *
     * @return {@code false} if the message couldn't be queued because the queue is full
     */
    boolean deliver(RecordedMessage<Message> message) {
        if (closed) {
            return true;
        } else if (queue.remainingCapacity() <= 1 || !queue.offer(new Delivered(message))) {
            return false;
        }
        currentPosition = message.globalPosition();
        if (currentPosition >= highWaterMark) {
            queue.add(new CaughtUp(currentPosition));
        }
        return true;
    }

    /**
     * Wait at most {@code timeout} for the next item.
     *
     * @return The next item or {@code null} if none arrived in time
     */
    public @Nullable StreamItem poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Wait for the next item.
     *
     * @throws IllegalStateException If the stream is closed and all items have been read
     */
    public StreamItem take() throws InterruptedException {
        while (true) {
            StreamItem item = queue.poll(TAKE_CHECK_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
            if (item != null) {
                return item;
            } else if (closed) {
                throw new IllegalStateException("Stream " + id + " is closed");
            }
        }
    }

    /**
     * @return All items that are available right now, without waiting.
     */
    public List<StreamItem> drain() {
        List<StreamItem> items = new ArrayList<>();
        queue.drainTo(items);
        return items;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stop receiving live messages and deregister from the coordinator. Items already queued can still be read.
     */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            onClose.accept(this);
        }
    }

    void markClosed() {
        closed = true;
    }
}
