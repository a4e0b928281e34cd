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

import org.eventcore.eventstore.api.AggregateStreamResult;
import org.eventcore.eventstore.api.AppendToStreamResult;
import org.eventcore.eventstore.api.EventStore;
import org.eventcore.eventstore.api.ExpectedStreamVersion;
import org.eventcore.eventstore.api.ReadStreamOptions;
import org.eventcore.message.Message;
import org.eventcore.message.RecordedMessage;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Handles an input of a {@link Workflow}. Each workflow instance has its own stream,
 * {@code workflow-<processorId>-<workflowId>}, which is aggregated to the current state before the workflow decides.
 * The input and the output messages are then appended to the stream, in that order, so that the stream is a complete
 * log of what the instance has seen and done. The same expected version rules as for command handlers apply, and the
 * configured {@link org.eventcore.retry.RetryStrategy} decides whether version conflicts are retried.
 *
 * @param <I> The type of input messages
 * @param <S> The state of the workflow
 * @param <O> The type of output messages
 */
public class WorkflowHandler<I extends Message, S, O extends Message> {
    private static final Logger log = LoggerFactory.getLogger(WorkflowHandler.class);

    private final WorkflowOptions<I, S, O> options;

    public WorkflowHandler(WorkflowOptions<I, S, O> options) {
        if (options == null) throw new IllegalArgumentException(WorkflowOptions.class.getSimpleName() + " cannot be null");
        this.options = options;
    }

    public WorkflowHandlerResult<O> handle(EventStore eventStore, RecordedMessage<I> input) {
        return handle(eventStore, input, null);
    }

    /**
     * @param eventStore            The event store that holds the workflow streams
     * @param input                 The input
     * @param expectedStreamVersion The expected version of the workflow stream, {@code null} to derive it from the stream
     * @return The outputs, or an empty result if the input doesn't belong to any workflow instance
     */
    public WorkflowHandlerResult<O> handle(EventStore eventStore, RecordedMessage<I> input, @Nullable ExpectedStreamVersion expectedStreamVersion) {
        Objects.requireNonNull(eventStore, EventStore.class.getSimpleName() + " cannot be null");
        Objects.requireNonNull(input, "input cannot be null");

        String workflowId = options.getWorkflowId.apply(input);
        if (workflowId == null) {
            log.debug("Input {} ({}) doesn't belong to any instance of workflow {}", input.messageId(), input.type(), options.workflow.name());
            return WorkflowHandlerResult.notApplicable();
        }
        String streamName = options.streamName(workflowId);
        return options.retryStrategy.execute(() -> handleOnce(eventStore, streamName, input, expectedStreamVersion));
    }

    private WorkflowHandlerResult<O> handleOnce(EventStore eventStore, String streamName, RecordedMessage<I> input, @Nullable ExpectedStreamVersion requestedStreamVersion) {
        Workflow<I, S, O> workflow = options.workflow;
        ReadStreamOptions readOptions = requestedStreamVersion == null ? ReadStreamOptions.all() : ReadStreamOptions.all().expectedStreamVersion(requestedStreamVersion);
        AggregateStreamResult<S> aggregated = eventStore.aggregateStream(streamName, workflow::initialState, (S state, Message message) -> workflow.evolve(state, message), readOptions);

        List<WorkflowOutput<O>> outputs = workflow.decide(input.message(), aggregated.state());
        List<O> newMessages = messagesOf(outputs == null ? List.of() : outputs);

        List<Message> messagesToAppend = new ArrayList<>(newMessages.size() + 1);
        messagesToAppend.add(input.message());
        messagesToAppend.addAll(newMessages);

        ExpectedStreamVersion expectedStreamVersion = requestedStreamVersion != null ? requestedStreamVersion
                : aggregated.streamExists() ? ExpectedStreamVersion.exactly(aggregated.currentStreamVersion()) : ExpectedStreamVersion.streamDoesNotExist();
        AppendToStreamResult appendResult = eventStore.appendToStream(streamName, expectedStreamVersion, messagesToAppend);
        log.debug("Workflow {} handled {} in {}, {} output message(s)", workflow.name(), input.type(), streamName, newMessages.size());

        return new WorkflowHandlerResult<>(outputs == null ? List.of() : outputs, newMessages, appendResult.nextExpectedStreamVersion, appendResult.createdNewStream);
    }

    private static <O extends Message> List<O> messagesOf(List<WorkflowOutput<O>> outputs) {
        List<O> messages = new ArrayList<>();
        for (WorkflowOutput<O> output : outputs) {
            O message = output.message();
            if (message != null) {
                messages.add(message);
            }
        }
        return messages;
    }
}
