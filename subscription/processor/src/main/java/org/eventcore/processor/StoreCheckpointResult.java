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
 * The outcome of {@link Checkpointer#store(String, String, Long, long)}.
 */
public sealed interface StoreCheckpointResult {

    /**
     * The checkpoint was written.
     */
    record Stored(long newCheckpoint) implements StoreCheckpointResult {
    }

    /**
     * The stored checkpoint is already at (or past) the new checkpoint, nothing was written.
     */
    record Ignored(@Nullable Long currentCheckpoint) implements StoreCheckpointResult {
    }

    /**
     * The stored checkpoint is not the one the caller expected, typically because another instance of the same
     * processor has moved it. Nothing was written.
     */
    record Mismatch(@Nullable Long currentCheckpoint) implements StoreCheckpointResult {
    }
}
