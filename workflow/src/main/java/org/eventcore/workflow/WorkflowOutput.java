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

package org.eventcore.workflow;

import org.eventcore.message.Command;
import org.eventcore.message.Event;
import org.eventcore.message.Message;
import org.eventcore.messagebus.ScheduleOptions;
import org.jspecify.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Something that a {@link Workflow} wants to happen as a result of an input. Outputs that carry a message
 * ({@link Reply}, {@link Send}, {@link Publish} and {@link Schedule}) are stored in the workflow stream and dispatched
 * by the {@link WorkflowProcessor}.
 *
 * @param <O> The type of output messages
 */
public sealed interface WorkflowOutput<O extends Message> {

    static <O extends Message> WorkflowOutput<O> reply(O message) {
        return new Reply<>(message);
    }

    static <O extends Message> WorkflowOutput<O> send(O command) {
        return new Send<>(command);
    }

    static <O extends Message> WorkflowOutput<O> publish(O event) {
        return new Publish<>(event);
    }

    static <O extends Message> WorkflowOutput<O> schedule(O message, ScheduleOptions when) {
        return new Schedule<>(message, when);
    }

    @SuppressWarnings("unchecked")
    static <O extends Message> WorkflowOutput<O> complete() {
        return (WorkflowOutput<O>) Complete.INSTANCE;
    }

    @SuppressWarnings("unchecked")
    static <O extends Message> WorkflowOutput<O> accept() {
        return (WorkflowOutput<O>) Accept.INSTANCE;
    }

    static <O extends Message> WorkflowOutput<O> ignore(String reason) {
        return new Ignore<>(reason);
    }

    static <O extends Message> WorkflowOutput<O> error(String reason) {
        return new Error<>(reason);
    }

    /**
     * @return The message carried by this output, or {@code null} if it doesn't carry one.
     */
    default @Nullable O message() {
        return null;
    }

    /**
     * A response to the input, e.g. the result of a command.
     */
    record Reply<O extends Message>(O message) implements WorkflowOutput<O> {
        public Reply {
            requireNonNull(message, Message.class.getSimpleName() + " cannot be null");
        }
    }

    record Send<O extends Message>(O message) implements WorkflowOutput<O> {
        public Send {
            requireNonNull(message, Command.class.getSimpleName() + " cannot be null");
            if (!(message instanceof Command)) {
                throw new IllegalArgumentException("Only commands can be sent, " + message.type() + " is not a command");
            }
        }
    }

    record Publish<O extends Message>(O message) implements WorkflowOutput<O> {
        public Publish {
            requireNonNull(message, Event.class.getSimpleName() + " cannot be null");
            if (!(message instanceof Event)) {
                throw new IllegalArgumentException("Only events can be published, " + message.type() + " is not an event");
            }
        }
    }

    record Schedule<O extends Message>(O message, ScheduleOptions when) implements WorkflowOutput<O> {
        public Schedule {
            requireNonNull(message, Message.class.getSimpleName() + " cannot be null");
            requireNonNull(when, ScheduleOptions.class.getSimpleName() + " cannot be null");
        }
    }

    /**
     * The workflow instance is done.
     */
    final class Complete<O extends Message> implements WorkflowOutput<O> {
        private static final Complete<?> INSTANCE = new Complete<>();

        private Complete() {
        }

        @Override
        public String toString() {
            return "COMPLETE";
        }
    }

    /**
     * The input was accepted without any further action.
     */
    final class Accept<O extends Message> implements WorkflowOutput<O> {
        private static final Accept<?> INSTANCE = new Accept<>();

        private Accept() {
        }

        @Override
        public String toString() {
            return "ACCEPT";
        }
    }

    record Ignore<O extends Message>(String reason) implements WorkflowOutput<O> {
        public Ignore {
            requireNonNull(reason, "reason cannot be null");
        }
    }

    record Error<O extends Message>(String reason) implements WorkflowOutput<O> {
        public Error {
            requireNonNull(reason, "reason cannot be null");
        }
    }
}
