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

/**
 * Where a {@link MessageProcessor} should start processing from. All positions except {@link #current()} are also
 * {@link CurrentPosition}s, which is what {@link MessageProcessor#start()} resolves to.
 */
public sealed interface StartFrom permits CurrentPosition, StartFrom.Current {

    /**
     * Start from the first message in the store.
     */
    static CurrentPosition beginning() {
        return CurrentPosition.Beginning.INSTANCE;
    }

    /**
     * Start after the last message in the store, i.e. only process new messages.
     */
    static CurrentPosition end() {
        return CurrentPosition.End.INSTANCE;
    }

    /**
     * Continue from the checkpoint stored by the processor's {@link Checkpointer}, or from the beginning if
     * there's no checkpoint.
     */
    static StartFrom current() {
        return Current.INSTANCE;
    }

    /**
     * Start after the message with the given global position.
     */
    static CurrentPosition checkpoint(long lastCheckpoint) {
        return new CurrentPosition.Checkpoint(lastCheckpoint);
    }

    final class Current implements StartFrom {
        private static final Current INSTANCE = new Current();

        private Current() {
        }

        @Override
        public String toString() {
            return "CURRENT";
        }
    }
}
