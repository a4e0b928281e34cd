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

import static java.util.Objects.requireNonNull;

/**
 * The document that {@link InMemoryCheckpointer} stores for each processor, partition and processor version.
 * Bumping the version of a processor gives it a fresh checkpoint, so it starts over.
 */
public record CheckpointDocument(String processorId, @Nullable String partition, int version, long lastCheckpoint) {

    public CheckpointDocument {
        requireNonNull(processorId, "processorId cannot be null");
        if (version < 1) {
            throw new IllegalArgumentException("version must be greater than zero");
        }
    }

    static String idOf(String processorId, @Nullable String partition, int version) {
        String id = partition == null ? processorId : processorId + ":" + partition;
        return id + "@v" + version;
    }

    public String id() {
        return idOf(processorId, partition, version);
    }
}
