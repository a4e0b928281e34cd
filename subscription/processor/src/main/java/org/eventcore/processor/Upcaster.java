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

package org.eventcore.processor;

import org.eventcore.message.Message;

/**
 * Transforms a message as it was stored into the type that a processor handles, for example to migrate an old
 * version of an event.
 *
 * @param <M> The type of message that the processor handles
 */
@FunctionalInterface
public interface Upcaster<M extends Message> {

    M upcast(Message message);

    /**
     * Pass messages as they are. Only safe when all messages that the processor can handle are of type {@code M}.
     */
    @SuppressWarnings("unchecked")
    static <M extends Message> Upcaster<M> identity() {
        return message -> (M) message;
    }
}
