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

import org.eventcore.message.Message;
import org.eventcore.message.RecordedMessage;
import org.eventcore.retry.RetryStrategy;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Configures a {@link WorkflowHandler} and a {@link WorkflowProcessor}.
 * <pre>
 * WorkflowOptions.of(orderFulfillment, input -&gt; input.message().orderId())
 *         .inputs(WorkflowMessageTypes.events("OrderPlaced", "PaymentReceived"))
 *         .outputs(WorkflowMessageTypes.commands("ShipOrder").withEvents("OrderFulfilled"));
 * </pre>
 *
 * @param <I> The type of input messages
 * @param <S> The state of the workflow
 * @param <O> The type of output messages
 */
@NullMarked
public final class WorkflowOptions<I extends Message, S, O extends Message> {
    public static final String PROCESSOR_ID_PREFIX = "emt:processor:workflow:";

    public final Workflow<I, S, O> workflow;
    public final Function<RecordedMessage<I>, @Nullable String> getWorkflowId;
    public final WorkflowMessageTypes inputs;
    public final WorkflowMessageTypes outputs;
    public final @Nullable String processorId;
    public final RetryStrategy retryStrategy;

    private WorkflowOptions(Workflow<I, S, O> workflow, Function<RecordedMessage<I>, @Nullable String> getWorkflowId, WorkflowMessageTypes inputs,
                            WorkflowMessageTypes outputs, @Nullable String processorId, RetryStrategy retryStrategy) {
        this.workflow = requireNonNull(workflow, Workflow.class.getSimpleName() + " cannot be null");
        this.getWorkflowId = requireNonNull(getWorkflowId, "getWorkflowId cannot be null");
        this.inputs = requireNonNull(inputs, "inputs cannot be null");
        this.outputs = requireNonNull(outputs, "outputs cannot be null");
        this.processorId = processorId;
        this.retryStrategy = requireNonNull(retryStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
    }

    /**
     * @param workflow      The workflow
     * @param getWorkflowId Get the id of the workflow instance that an input belongs to, {@code null} if it doesn't belong to any
     */
    public static <I extends Message, S, O extends Message> WorkflowOptions<I, S, O> of(Workflow<I, S, O> workflow, Function<RecordedMessage<I>, @Nullable String> getWorkflowId) {
        return new WorkflowOptions<>(workflow, getWorkflowId, WorkflowMessageTypes.none(), WorkflowMessageTypes.none(), null, RetryStrategy.none());
    }

    public WorkflowOptions<I, S, O> inputs(WorkflowMessageTypes inputs) {
        return new WorkflowOptions<>(workflow, getWorkflowId, inputs, outputs, processorId, retryStrategy);
    }

    public WorkflowOptions<I, S, O> outputs(WorkflowMessageTypes outputs) {
        return new WorkflowOptions<>(workflow, getWorkflowId, inputs, outputs, processorId, retryStrategy);
    }

    public WorkflowOptions<I, S, O> processorId(String processorId) {
        return new WorkflowOptions<>(workflow, getWorkflowId, inputs, outputs, processorId, retryStrategy);
    }

    /**
     * @param retryStrategy The retry strategy that each input is handled within, typically retrying on version conflicts
     */
    public WorkflowOptions<I, S, O> retryStrategy(RetryStrategy retryStrategy) {
        return new WorkflowOptions<>(workflow, getWorkflowId, inputs, outputs, processorId, retryStrategy);
    }

    /**
     * @return The configured processor id, or {@code emt:processor:workflow:<name of the workflow>}
     */
    public String resolveProcessorId() {
        return processorId == null ? PROCESSOR_ID_PREFIX + workflow.name() : processorId;
    }

    public String streamName(String workflowId) {
        return streamNamePrefix() + workflowId;
    }

    String streamNamePrefix() {
        return "workflow-" + resolveProcessorId() + "-";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowOptions)) return false;
        WorkflowOptions<?, ?, ?> that = (WorkflowOptions<?, ?, ?>) o;
        return Objects.equals(workflow, that.workflow) && Objects.equals(getWorkflowId, that.getWorkflowId) && Objects.equals(inputs, that.inputs)
                && Objects.equals(outputs, that.outputs) && Objects.equals(processorId, that.processorId) && Objects.equals(retryStrategy, that.retryStrategy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workflow, getWorkflowId, inputs, outputs, processorId, retryStrategy);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", WorkflowOptions.class.getSimpleName() + "[", "]")
                .add("workflow=" + workflow.name())
                .add("inputs=" + inputs)
                .add("outputs=" + outputs)
                .add("processorId='" + resolveProcessorId() + "'")
                .add("retryStrategy=" + retryStrategy)
                .toString();
    }
}
