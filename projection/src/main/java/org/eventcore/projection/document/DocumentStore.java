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

package org.eventcore.projection.document;

/**
 * Gives access to named collections of read model documents.
 */
public interface DocumentStore {

    /**
     * Get (or create) the collection with the given name.
     *
     * @param name The name of the collection
     * @param type The type of the documents in the collection
     * @throws IllegalArgumentException If a collection with the same name has already been created for another document type
     */
    <D> DocumentCollection<D> collection(String name, Class<D> type);
}
