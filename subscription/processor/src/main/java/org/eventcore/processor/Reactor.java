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
 * Create {@link MessageProcessor}s that react to messages, e.g. by sending commands or calling external systems.
 */
public final class Reactor {

    private Reactor() {
    }

    /**
     * Create a processor that invokes {@code eachMessage} once per message that it can handle.
     */
    public static <M extends Message> MessageProcessor<M> of(ProcessorOptions<M> options, EachMessageHandler<M> eachMessage) {
        if (eachMessage == null) {
            throw new IllegalArgumentException(EachMessageHandler.class.getSimpleName() + " cannot be null");
        }
        return new MessageProcessor<>(options, eachMessage, null);
    }

    /**
     * Create a processor that invokes {@code eachBatch} once per batch, with the messages of the batch that it can
     * handle. The checkpoint is stored once the whole batch has been handled.
     */
    public static <M extends Message> MessageProcessor<M> batch(ProcessorOptions<M> options, EachBatchHandler<M> eachBatch) {
        if (eachBatch == null) {
            throw new IllegalArgumentException(EachBatchHandler.class.getSimpleName() + " cannot be null");
        }
        return new MessageProcessor<>(options, null, eachBatch);
    }
}
