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

import static java.util.Objects.requireNonNull;

/**
 * An item read from a {@link CaughtUpStream}.
 */
public sealed interface StreamItem {

    /**
     * A message, either replayed from the history or delivered live.
     */
    record Delivered(RecordedMessage<Message> message) implements StreamItem {
        public Delivered {
            requireNonNull(message, RecordedMessage.class.getSimpleName() + " cannot be null");
        }
    }

    /**
     * Marks that the listener has received everything the coordinator knew about when the marker was emitted.
     *
     * @param globalPosition The global position of the last delivered message, {@code 0} if nothing has been delivered
     */
    record CaughtUp(long globalPosition) implements StreamItem {
    }
}
