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

package org.eventcore.message;

import java.util.Map;

/**
 * A message is either a {@link Command} or an {@link Event}. The payload of a message is the implementing
 * object itself, typically a record. The {@link #type()} is what the event store, projections and processors
 * use to route and filter messages.
 */
public interface Message {

    /**
     * @return The type of the message, defaults to the simple name of the implementing class.
     */
    default String type() {
        return getClass().getSimpleName();
    }

    MessageKind kind();

    /**
     * @return Caller assigned metadata, empty by default.
     */
    default Map<String, Object> metadata() {
        return Map.of();
    }
}
