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

package org.eventcore.application.command;

import java.util.List;

/**
 * @param newState                  The state after the new events have been applied
 * @param newEvents                 The events returned by the decision, empty if nothing was appended
 * @param nextExpectedStreamVersion The version of the stream after the append
 * @param createdNewStream          Whether the append created the stream
 */
public record CommandHandlerResult<S, E>(S newState, List<E> newEvents, long nextExpectedStreamVersion, boolean createdNewStream) {
    public CommandHandlerResult {
        newEvents = List.copyOf(newEvents);
    }
}
