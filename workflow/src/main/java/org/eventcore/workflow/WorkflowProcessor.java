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

import org.eventcore.eventstore.api.EventStore;
import org.eventcore.message.Command;
import org.eventcore.message.Event;
import org.eventcore.message.Message;
import org.eventcore.message.RecordedMessage;
import org.eventcore.messagebus.CommandSender;
import org.eventcore.messagebus.EventsPublisher;
import org.eventcore.messagebus.MessageBus;
import org.eventcore.messagebus.MessageScheduler;
import org.eventcore.processor.MessageHandlerResult;
import org.eventcore.processor.MessageProcessor;
import org.eventcore.processor.ProcessorOptions;
import org.eventcore.processor.Reactor;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Runs a {@link Workflow} as a {@link MessageProcessor}. Each input is handled by a {@link WorkflowHandler}, and the
 * outputs are then dispatched according to the declared output types of the workflow: commands are sent with the
 * {@link CommandSender}, events are published with the {@link EventsPublisher} and scheduled messages are handed to the
 * {@link MessageScheduler}. Outputs of a type that isn't declared are stored but not dispatched.
 * <p>
 * Messages read from the workflow's own streams are skipped, since they are the inputs and outputs that the workflow
 * has already stored.
 */
public final class WorkflowProcessor {
    private static final Logger log = LoggerFactory.getLogger(WorkflowProcessor.class);

    private WorkflowProcessor() {
    }

    public static <I extends Message, S, O extends Message> MessageProcessor<I> of(WorkflowOptions<I, S, O> workflowOptions, EventStore eventStore, MessageBus messageBus) {
        return of(workflowOptions, ProcessorOptions.create(), eventStore, messageBus, messageBus, messageBus);
    }

    public static <I extends Message, S, O extends Message> MessageProcessor<I> of(WorkflowOptions<I, S, O> workflowOptions, ProcessorOptions<I> processorOptions,
                                                                                   EventStore eventStore, MessageBus messageBus) {
        return of(workflowOptions, processorOptions, eventStore, messageBus, messageBus, messageBus);
    }

    /**
     * @param workflowOptions  The workflow to run
     * @param processorOptions Where to start, how to checkpoint etc. The processor id and the handled message types are taken from {@code workflowOptions}.
     * @param eventStore       The event store that holds the workflow streams
     * @param commandSender    Sends the command outputs
     * @param eventsPublisher  Publishes the event outputs
     * @param messageScheduler Schedules the scheduled outputs, {@code null} if the workflow doesn't schedule anything
     */
    public static <I extends Message, S, O extends Message> MessageProcessor<I> of(WorkflowOptions<I, S, O> workflowOptions, ProcessorOptions<I> processorOptions,
                                                                                   EventStore eventStore, CommandSender commandSender, EventsPublisher eventsPublisher,
                                                                                   @Nullable MessageScheduler messageScheduler) {
        requireNonNull(workflowOptions, WorkflowOptions.class.getSimpleName() + " cannot be null");
        requireNonNull(processorOptions, ProcessorOptions.class.getSimpleName() + " cannot be null");
        requireNonNull(eventStore, EventStore.class.getSimpleName() + " cannot be null");
        requireNonNull(commandSender, CommandSender.class.getSimpleName() + " cannot be null");
        requireNonNull(eventsPublisher, EventsPublisher.class.getSimpleName() + " cannot be null");

        WorkflowHandler<I, S, O> handler = new WorkflowHandler<>(workflowOptions);
        OutputDispatcher<O> dispatcher = new OutputDispatcher<>(workflowOptions, commandSender, eventsPublisher, messageScheduler);
        String ownStreamPrefix = workflowOptions.streamNamePrefix();

        ProcessorOptions<I> options = processorOptions
                .processorId(workflowOptions.resolveProcessorId())
                .canHandle(workflowOptions.inputs.all());

        return Reactor.of(options, (RecordedMessage<I> input) -> {
            if (input.streamName().startsWith(ownStreamPrefix)) {
                return MessageHandlerResult.skip("Message belongs to the stream of workflow " + workflowOptions.workflow.name());
            }
            WorkflowHandlerResult<O> result = handler.handle(eventStore, input);
            for (WorkflowOutput<O> output : result.outputs()) {
                dispatcher.dispatch(output);
            }
            return MessageHandlerResult.ack();
        });
    }

    private static class OutputDispatcher<O extends Message> {
        private final WorkflowOptions<?, ?, O> options;
        private final CommandSender commandSender;
        private final EventsPublisher eventsPublisher;
        private final @Nullable MessageScheduler messageScheduler;

        private OutputDispatcher(WorkflowOptions<?, ?, O> options, CommandSender commandSender, EventsPublisher eventsPublisher, @Nullable MessageScheduler messageScheduler) {
            this.options = options;
            this.commandSender = commandSender;
            this.eventsPublisher = eventsPublisher;
            this.messageScheduler = messageScheduler;
        }

        void dispatch(WorkflowOutput<O> output) {
            if (output instanceof WorkflowOutput.Schedule<O> schedule) {
                if (messageScheduler == null) {
                    log.warn("Workflow {} scheduled {} but no scheduler is configured, the message is not scheduled", options.workflow.name(), schedule.message().type());
                } else {
                    messageScheduler.schedule(schedule.message(), schedule.when());
                }
            } else if (output instanceof WorkflowOutput.Error<O> error) {
                log.warn("Workflow {} reported an error: {}", options.workflow.name(), error.reason());
            } else if (output instanceof WorkflowOutput.Ignore<O> ignore) {
                log.debug("Workflow {} ignored input: {}", options.workflow.name(), ignore.reason());
            } else {
                O message = output.message();
                if (message != null) {
                    route(message);
                }
            }
        }

        private void route(Message message) {
            String type = message.type();
            if (message instanceof Command command && options.outputs.commands().contains(type)) {
                commandSender.send(command);
            } else if (message instanceof Event event && options.outputs.events().contains(type)) {
                eventsPublisher.publish(event);
            } else {
                log.debug("{} is not a declared output of workflow {}, it's stored but not dispatched", type, options.workflow.name());
            }
        }
    }
}
