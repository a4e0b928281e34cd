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

import org.eventcore.processor.StoreCheckpointResult.Ignored;
import org.eventcore.processor.StoreCheckpointResult.Mismatch;
import org.eventcore.processor.StoreCheckpointResult.Stored;
import org.eventcore.projection.document.DocumentCollection;
import org.eventcore.projection.document.DocumentStore;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Checkpointer} that stores a {@link CheckpointDocument} per processor id, partition and version in the
 * {@value #COLLECTION_NAME} collection of a {@link DocumentStore}.
 */
public class InMemoryCheckpointer implements Checkpointer {
    public static final String COLLECTION_NAME = "emt_processor_checkpoints";

    private final DocumentCollection<CheckpointDocument> checkpoints;

    public InMemoryCheckpointer(DocumentStore documentStore) {
        requireNonNull(documentStore, DocumentStore.class.getSimpleName() + " cannot be null");
        this.checkpoints = documentStore.collection(COLLECTION_NAME, CheckpointDocument.class);
    }

    @Override
    public @Nullable Long read(String processorId, @Nullable String partition, int version) {
        requireNonNull(processorId, "processorId cannot be null");
        return checkpoints.findById(CheckpointDocument.idOf(processorId, partition, version))
                .map(CheckpointDocument::lastCheckpoint)
                .orElse(null);
    }

    @Override
    public StoreCheckpointResult store(String processorId, @Nullable String partition, int version, @Nullable Long lastCheckpoint, long newCheckpoint) {
        requireNonNull(processorId, "processorId cannot be null");
        AtomicReference<StoreCheckpointResult> result = new AtomicReference<>();
        checkpoints.handle(CheckpointDocument.idOf(processorId, partition, version), current -> {
            Long currentCheckpoint = current == null ? null : current.lastCheckpoint();
            if (currentCheckpoint != null && currentCheckpoint >= newCheckpoint) {
                result.set(new Ignored(currentCheckpoint));
                return current;
            } else if (!Objects.equals(currentCheckpoint, lastCheckpoint)) {
                result.set(new Mismatch(currentCheckpoint));
                return current;
            }
            result.set(new Stored(newCheckpoint));
            return new CheckpointDocument(processorId, partition, version, newCheckpoint);
        });
        return result.get();
    }
}
