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
 * The resolved position that a {@link MessageProcessor} starts from.
 */
public sealed interface CurrentPosition extends StartFrom permits CurrentPosition.Beginning, CurrentPosition.End, CurrentPosition.Checkpoint {

    record Checkpoint(long lastCheckpoint) implements CurrentPosition {
        public Checkpoint {
            if (lastCheckpoint < 0) {
                throw new IllegalArgumentException("lastCheckpoint cannot be negative");
            }
        }
    }

    final class Beginning implements CurrentPosition {
        static final Beginning INSTANCE = new Beginning();

        private Beginning() {
        }

        @Override
        public String toString() {
            return "BEGINNING";
        }
    }

    final class End implements CurrentPosition {
        static final End INSTANCE = new End();

        private End() {
        }

        @Override
        public String toString() {
            return "END";
        }
    }
}
