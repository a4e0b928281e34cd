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
import org.eventcore.projection.document.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayNameGeneration(ReplaceUnderscores.class)
class InMemoryCheckpointerTest {

    private InMemoryDocumentStore documentStore;
    private InMemoryCheckpointer checkpointer;

    @BeforeEach
    void create_checkpointer() {
        documentStore = new InMemoryDocumentStore();
        checkpointer = new InMemoryCheckpointer(documentStore);
    }

    @Test
    void reading_a_checkpoint_that_was_never_stored_returns_null() {
        assertThat(checkpointer.read("processor", null)).isNull();
    }

    @Test
    void first_checkpoint_is_stored_when_the_caller_has_no_previous_checkpoint() {
        // When
        StoreCheckpointResult result = checkpointer.store("processor", null, null, 1);

        // Then
        assertThat(result).isEqualTo(new Stored(1));
        assertThat(checkpointer.read("processor", null)).isEqualTo(1L);
        assertThat(documentStore.collection(InMemoryCheckpointer.COLLECTION_NAME, CheckpointDocument.class).findById("processor@v1"))
                .contains(new CheckpointDocument("processor", null, 1, 1));
    }

    @Test
    void storing_the_same_checkpoint_again_is_ignored() {
        // Given
        checkpointer.store("processor", null, null, 1);

        // When
        StoreCheckpointResult result = checkpointer.store("processor", null, null, 1);

        // Then
        assertThat(result).isEqualTo(new Ignored(1L));
        assertThat(checkpointer.read("processor", null)).isEqualTo(1L);
    }

    @Test
    void storing_an_older_checkpoint_is_ignored() {
        // Given
        checkpointer.store("processor", null, null, 5);

        // When
        StoreCheckpointResult result = checkpointer.store("processor", null, 2L, 3);

        // Then
        assertThat(result).isEqualTo(new Ignored(5L));
        assertThat(checkpointer.read("processor", null)).isEqualTo(5L);
    }

    @Test
    void storing_a_checkpoint_when_the_stored_one_is_not_the_expected_one_is_a_mismatch() {
        // Given
        checkpointer.store("processor", null, null, 2);

        // When
        StoreCheckpointResult result = checkpointer.store("processor", null, 1L, 3);

        // Then
        assertThat(result).isEqualTo(new Mismatch(2L));
        assertThat(checkpointer.read("processor", null)).isEqualTo(2L);
    }

    @Test
    void checkpoint_advances_when_the_caller_knows_the_stored_checkpoint() {
        // Given
        checkpointer.store("processor", null, null, 2);

        // When
        StoreCheckpointResult result = checkpointer.store("processor", null, 2L, 7);

        // Then
        assertThat(result).isEqualTo(new Stored(7));
        assertThat(checkpointer.read("processor", null)).isEqualTo(7L);
    }

    @Test
    void checkpoints_are_kept_per_processor_and_partition() {
        // When
        checkpointer.store("processor", null, null, 1);
        checkpointer.store("processor", "tenant-a", null, 4);
        checkpointer.store("other", null, null, 9);

        // Then
        assertThat(checkpointer.read("processor", null)).isEqualTo(1L);
        assertThat(checkpointer.read("processor", "tenant-a")).isEqualTo(4L);
        assertThat(checkpointer.read("processor", "tenant-b")).isNull();
        assertThat(checkpointer.read("other", null)).isEqualTo(9L);
    }

    @Test
    void checkpoints_are_kept_per_processor_version() {
        // Given
        checkpointer.store("processor", null, null, 5);

        // When
        StoreCheckpointResult result = checkpointer.store("processor", null, 2, null, 1);

        // Then
        assertThat(result).isEqualTo(new Stored(1));
        assertThat(checkpointer.read("processor", null, 1)).isEqualTo(5L);
        assertThat(checkpointer.read("processor", null, 2)).isEqualTo(1L);
        assertThat(checkpointer.read("processor", null, 3)).isNull();
    }

    @Test
    void second_processor_instance_storing_an_already_stored_checkpoint_is_ignored() {
        // Given
        InMemoryCheckpointer firstInstance = new InMemoryCheckpointer(documentStore);
        InMemoryCheckpointer secondInstance = new InMemoryCheckpointer(documentStore);
        firstInstance.store("processor", null, null, 1);

        // When
        StoreCheckpointResult result = secondInstance.store("processor", null, null, 1);

        // Then
        assertThat(result).isInstanceOf(Ignored.class);
    }
}
