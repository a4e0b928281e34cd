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

import java.util.HashSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * The command and event types that a workflow accepts as input or produces as output.
 */
public record WorkflowMessageTypes(Set<String> commands, Set<String> events) {

    public WorkflowMessageTypes {
        requireNonNull(commands, "commands cannot be null");
        requireNonNull(events, "events cannot be null");
        commands = Set.copyOf(commands);
        events = Set.copyOf(events);
    }

    public static WorkflowMessageTypes none() {
        return new WorkflowMessageTypes(Set.of(), Set.of());
    }

    public static WorkflowMessageTypes commands(String... commands) {
        return none().withCommands(commands);
    }

    public static WorkflowMessageTypes events(String... events) {
        return none().withEvents(events);
    }

    public WorkflowMessageTypes withCommands(String... commands) {
        return new WorkflowMessageTypes(Set.of(commands), events);
    }

    public WorkflowMessageTypes withEvents(String... events) {
        return new WorkflowMessageTypes(commands, Set.of(events));
    }

    public Set<String> all() {
        Set<String> all = new HashSet<>(commands);
        all.addAll(events);
        return Set.copyOf(all);
    }
}
