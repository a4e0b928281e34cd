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

package org.eventcore.cloudevents;

import io.cloudevents.CloudEvent;
import org.eventcore.eventstore.api.AfterCommitHook;
import org.eventcore.message.Event;
import org.eventcore.message.Message;
import org.eventcore.message.RecordedMessage;
import org.eventcore.messagebus.EventsPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Publishes events as cloud events, for example to a message broker. Register it as an {@link AfterCommitHook} to
 * publish every committed event including its stream metadata, or use it as an {@link EventsPublisher}.
 * Commands are never published.
 */
public class CloudEventPublisher implements EventsPublisher, AfterCommitHook {
    private static final Logger log = LoggerFactory.getLogger(CloudEventPublisher.class);

    private final CloudEventMessageConverter converter;
    private final Consumer<CloudEvent> cloudEventConsumer;

    public CloudEventPublisher(CloudEventMessageConverter converter, Consumer<CloudEvent> cloudEventConsumer) {
        this.converter = requireNonNull(converter, CloudEventMessageConverter.class.getSimpleName() + " cannot be null");
        this.cloudEventConsumer = requireNonNull(cloudEventConsumer, "cloudEventConsumer cannot be null");
    }

    @Override
    public <E extends Event> void publish(E event) {
        requireNonNull(event, Event.class.getSimpleName() + " cannot be null");
        cloudEventConsumer.accept(converter.toCloudEvent(event));
    }

    @Override
    public void afterCommit(List<RecordedMessage<Message>> committedMessages) {
        for (RecordedMessage<Message> committedMessage : committedMessages) {
            if (committedMessage.message() instanceof Event) {
                CloudEvent cloudEvent = converter.toCloudEvent(committedMessage);
                log.debug("Publishing cloud event {} of type {} from {}", cloudEvent.getId(), cloudEvent.getType(), committedMessage.streamName());
                cloudEventConsumer.accept(cloudEvent);
            }
        }
    }
}
