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

import java.util.List;

/**
 * @param outputs                   The outputs decided by the workflow
 * @param newMessages               The output messages that were appended to the workflow stream, after the input
 * @param nextExpectedStreamVersion The version of the workflow stream after the append
 * @param createdNewStream          {@code true} if the input started a new workflow instance
 */
public record WorkflowHandlerResult<O extends Message>(List<WorkflowOutput<O>> outputs, List<O> newMessages, long nextExpectedStreamVersion, boolean createdNewStream) {

    public WorkflowHandlerResult {
        outputs = List.copyOf(outputs);
        newMessages = List.copyOf(newMessages);
    }

    static <O extends Message> WorkflowHandlerResult<O> notApplicable() {
        return new WorkflowHandlerResult<>(List.of(), List.of(), 0, false);
    }
}
