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

package org.eventcore.projection;

import org.eventcore.message.Event;
import org.eventcore.message.RecordedMessage;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Set;

/**
 * Turns events into a read model. The same definition can be run inline (inside the append) or asynchronously
 * (by a projector), see {@link Projections}.
 */
public interface ProjectionDefinition {

    /**
     * @return The name of the projection, or {@code null} if it's anonymous
     */
    default @Nullable String name() {
        return null;
    }

    /**
     * @return The event types that this projection handles
     */
    Set<String> canHandle();

    void handle(List<RecordedMessage<Event>> events, ProjectionContext context);

    /**
     * Remove everything that the projection has written, used before rebuilding it. Does nothing by default.
     */
    default void truncate(ProjectionContext context) {
    }

    default boolean canHandleAnyOf(List<? extends RecordedMessage<?>> events) {
        Set<String> canHandle = canHandle();
        return events.stream().anyMatch(event -> canHandle.contains(event.type()));
    }
}
