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

package org.eventcore.messagebus;

import org.eventcore.eventstore.api.AfterCommitHook;
import org.eventcore.message.Event;
import org.eventcore.message.Message;
import org.eventcore.message.RecordedMessage;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An {@link AfterCommitHook} that publishes every committed event to an {@link EventsPublisher}. Commands stored in
 * a stream (by workflows) are not forwarded.
 */
public class ForwardToMessageBus implements AfterCommitHook {
    private final EventsPublisher eventsPublisher;

    private ForwardToMessageBus(EventsPublisher eventsPublisher) {
        this.eventsPublisher = requireNonNull(eventsPublisher, EventsPublisher.class.getSimpleName() + " cannot be null");
    }

    public static AfterCommitHook forwardToMessageBus(EventsPublisher eventsPublisher) {
        return new ForwardToMessageBus(eventsPublisher);
    }

    @Override
    public void afterCommit(List<RecordedMessage<Message>> committedMessages) {
        for (RecordedMessage<Message> committedMessage : committedMessages) {
            if (committedMessage.message() instanceof Event event) {
                eventsPublisher.publish(event);
            }
        }
    }
}
