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

import org.jspecify.annotations.Nullable;

/**
 * Reads and writes the checkpoint (the global position of the last handled message) of a processor, so that it can
 * continue where it left off after a restart.
 */
public interface Checkpointer {

    /**
     * @param processorId The id of the processor
     * @param partition   The partition, or {@code null} if the processor isn't partitioned
     * @param version     The version of the processor, each version has its own checkpoint
     * @return The stored checkpoint or {@code null} if the processor hasn't stored any checkpoint yet
     */
    @Nullable
    Long read(String processorId, @Nullable String partition, int version);

    /**
     * Read the checkpoint of version {@value ProcessorOptions#DEFAULT_VERSION} of the processor.
     */
    @Nullable
    default Long read(String processorId, @Nullable String partition) {
        return read(processorId, partition, ProcessorOptions.DEFAULT_VERSION);
    }

    /**
     * Store {@code newCheckpoint} if the stored checkpoint is still {@code lastCheckpoint} (compare-and-swap).
     *
     * @param processorId    The id of the processor
     * @param partition      The partition, or {@code null} if the processor isn't partitioned
     * @param version        The version of the processor, each version has its own checkpoint
     * @param lastCheckpoint The checkpoint that the processor believes is stored, {@code null} if none
     * @param newCheckpoint  The global position of the message that was just handled
     */
    StoreCheckpointResult store(String processorId, @Nullable String partition, int version, @Nullable Long lastCheckpoint, long newCheckpoint);

    /**
     * Store a checkpoint for version {@value ProcessorOptions#DEFAULT_VERSION} of the processor.
     */
    default StoreCheckpointResult store(String processorId, @Nullable String partition, @Nullable Long lastCheckpoint, long newCheckpoint) {
        return store(processorId, partition, ProcessorOptions.DEFAULT_VERSION, lastCheckpoint, newCheckpoint);
    }
}
