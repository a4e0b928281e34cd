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

import static java.util.Objects.requireNonNull;

/**
 * Callbacks invoked when a {@link MessageProcessor} is started and closed.
 *
 * @param onStart Invoked by {@link MessageProcessor#start()} before the start position is resolved
 * @param onClose Invoked by {@link MessageProcessor#close()}
 */
public record ProcessorHooks(Runnable onStart, Runnable onClose) {
    private static final Runnable NOOP = () -> {
    };
    private static final ProcessorHooks NONE = new ProcessorHooks(NOOP, NOOP);

    public ProcessorHooks {
        requireNonNull(onStart, "onStart cannot be null");
        requireNonNull(onClose, "onClose cannot be null");
    }

    public static ProcessorHooks none() {
        return NONE;
    }

    public ProcessorHooks onStart(Runnable onStart) {
        return new ProcessorHooks(onStart, onClose);
    }

    public ProcessorHooks onClose(Runnable onClose) {
        return new ProcessorHooks(onStart, onClose);
    }
}
