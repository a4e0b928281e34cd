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

import org.eventcore.errors.EventCoreException;
import org.eventcore.message.Command;
import org.eventcore.message.Event;
import org.eventcore.message.Message;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * A message bus that dispatches synchronously, on the calling thread, to handlers registered in memory.
 * Scheduled messages are queued until {@link #dequeue()} is called.
 */
public class InMemoryMessageBus implements MessageBus, CommandProcessor, EventSubscription, ScheduledMessageProcessor {
    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private final Map<String, MessageHandler<? extends Command>> commandHandlers = new ConcurrentHashMap<>();
    private final Map<String, List<MessageHandler<? extends Event>>> eventHandlers = new ConcurrentHashMap<>();
    private final List<ScheduledMessage> pendingMessages = new ArrayList<>();

    @SuppressWarnings("unchecked")
    @Override
    public <C extends Command> void send(C command) {
        requireNonNull(command, Command.class.getSimpleName() + " cannot be null");
        MessageHandler<C> handler = (MessageHandler<C>) commandHandlers.get(command.type());
        if (handler == null) {
            throw new EventCoreException("No handler registered for command " + command.type() + "!");
        }
        log.debug("Sending command {}", command.type());
        handler.handle(command);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <E extends Event> void publish(E event) {
        requireNonNull(event, Event.class.getSimpleName() + " cannot be null");
        List<MessageHandler<? extends Event>> handlers = eventHandlers.getOrDefault(event.type(), List.of());
        log.debug("Publishing event {} to {} subscriber(s)", event.type(), handlers.size());
        for (MessageHandler<? extends Event> handler : handlers) {
            ((MessageHandler<E>) handler).handle(event);
        }
    }

    @Override
    public void schedule(Message message, @Nullable ScheduleOptions when) {
        synchronized (pendingMessages) {
            pendingMessages.add(new ScheduledMessage(message, when));
        }
    }

    @Override
    public synchronized <C extends Command> void handle(MessageHandler<C> commandHandler, String... commandTypes) {
        requireNonNull(commandHandler, MessageHandler.class.getSimpleName() + " cannot be null");
        List<String> alreadyRegistered = Stream.of(commandTypes).filter(commandHandlers::containsKey).collect(Collectors.toList());
        if (!alreadyRegistered.isEmpty()) {
            throw new EventCoreException("Cannot register handler for commands " + String.join(", ", alreadyRegistered) + " as they're already registered!");
        }
        for (String commandType : commandTypes) {
            commandHandlers.put(commandType, commandHandler);
        }
    }

    @Override
    public <E extends Event> void subscribe(MessageHandler<E> eventHandler, String... eventTypes) {
        requireNonNull(eventHandler, MessageHandler.class.getSimpleName() + " cannot be null");
        for (String eventType : eventTypes) {
            eventHandlers.computeIfAbsent(eventType, __ -> new CopyOnWriteArrayList<>()).add(eventHandler);
        }
    }

    @Override
    public List<ScheduledMessage> dequeue() {
        synchronized (pendingMessages) {
            List<ScheduledMessage> pending = List.copyOf(pendingMessages);
            pendingMessages.clear();
            return pending;
        }
    }
}
