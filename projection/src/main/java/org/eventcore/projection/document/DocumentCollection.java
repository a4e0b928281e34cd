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

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * A collection of documents of type {@code D}, each identified by a unique string id.
 *
 * @param <D> The type of the documents
 */
public interface DocumentCollection<D> {

    String name();

    Optional<D> findById(String id);

    /**
     * @return The first document, in insertion order, that matches the {@code predicate}.
     */
    Optional<D> findOne(Predicate<D> predicate);

    List<D> find(Predicate<D> predicate);

    default List<D> findAll() {
        return find(__ -> true);
    }

    /**
     * @return A copy of all documents keyed by id, in insertion order.
     */
    Map<String, D> entries();

    /**
     * Load the document with the given id (or {@code null} if it doesn't exist), mutate it and write the result back
     * atomically. If {@code mutate} returns {@code null} the document is deleted, otherwise it's inserted or replaced.
     *
     * @return The document after the mutation, or {@code null} if it was deleted.
     */
    @Nullable
    D handle(String id, UnaryOperator<@Nullable D> mutate);

    /**
     * @return {@code true} if a document matching the {@code predicate} was deleted
     */
    boolean deleteOne(Predicate<D> predicate);

    void deleteAll();

    long count();
}
