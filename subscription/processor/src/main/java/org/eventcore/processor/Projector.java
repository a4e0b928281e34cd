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

import org.eventcore.message.Event;
import org.eventcore.projection.ProjectionContext;
import org.eventcore.projection.ProjectionDefinition;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * Create {@link MessageProcessor}s that run a {@link ProjectionDefinition} asynchronously, as opposed to inline
 * projections that run inside the append.
 */
public final class Projector {
    public static final String PROCESSOR_ID_PREFIX = "projection:";

    private Projector() {
    }

    public static MessageProcessor<Event> of(ProjectionDefinition projection, ProjectionContext context) {
        return of(ProcessorOptions.create(), projection, context);
    }

    public static MessageProcessor<Event> of(ProcessorOptions<Event> options, ProjectionDefinition projection, ProjectionContext context) {
        return of(options, projection, context, false);
    }

    /**
     * @param options         The processor options. The processor id defaults to {@code projection:<name of the projection>}
     *                        and the handled types are always the ones of the projection.
     * @param projection      The projection to run
     * @param context         The context passed to the projection
     * @param truncateOnStart Truncate the projection once, the first time the processor is started. Typically combined
     *                        with {@link StartFrom#beginning()} to rebuild the projection.
     */
    public static MessageProcessor<Event> of(ProcessorOptions<Event> options, ProjectionDefinition projection, ProjectionContext context, boolean truncateOnStart) {
        requireNonNull(options, ProcessorOptions.class.getSimpleName() + " cannot be null");
        requireNonNull(projection, ProjectionDefinition.class.getSimpleName() + " cannot be null");
        requireNonNull(context, ProjectionContext.class.getSimpleName() + " cannot be null");

        String processorId = options.processorId;
        if (processorId == null) {
            if (projection.name() == null) {
                throw new IllegalArgumentException("processorId must be defined for projections without name");
            }
            processorId = PROCESSOR_ID_PREFIX + projection.name();
        }

        ProcessorHooks hooks = options.hooks;
        if (truncateOnStart) {
            AtomicBoolean truncated = new AtomicBoolean();
            Runnable onStart = hooks.onStart();
            hooks = hooks.onStart(() -> {
                if (truncated.compareAndSet(false, true)) {
                    projection.truncate(context);
                }
                onStart.run();
            });
        }

        ProcessorOptions<Event> projectorOptions = options.processorId(processorId)
                .canHandle(projection.canHandle())
                .hooks(hooks);
        return Reactor.of(projectorOptions, event -> {
            projection.handle(List.of(event), context);
            return MessageHandlerResult.ack();
        });
    }
}
