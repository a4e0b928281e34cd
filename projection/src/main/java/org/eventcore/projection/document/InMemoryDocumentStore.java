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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import static java.util.Objects.requireNonNull;

/**
 * A thread-safe {@link DocumentStore} that keeps all documents in memory. Documents are returned in insertion order.
 */
public class InMemoryDocumentStore implements DocumentStore {
    private final ConcurrentHashMap<String, InMemoryDocumentCollection<?>> collections = new ConcurrentHashMap<>();

    @SuppressWarnings("unchecked")
    @Override
    public <D> DocumentCollection<D> collection(String name, Class<D> type) {
        requireNonNull(name, "Collection name cannot be null");
        requireNonNull(type, "Document type cannot be null");
        InMemoryDocumentCollection<?> collection = collections.computeIfAbsent(name, __ -> new InMemoryDocumentCollection<>(name, type));
        if (!collection.type.equals(type)) {
            throw new IllegalArgumentException("Collection " + name + " stores documents of type " + collection.type.getName() + " and not " + type.getName());
        }
        return (DocumentCollection<D>) collection;
    }

    private static class InMemoryDocumentCollection<D> implements DocumentCollection<D> {
        private final String name;
        private final Class<D> type;
        private final Map<String, D> documents = Collections.synchronizedMap(new LinkedHashMap<>());

        private InMemoryDocumentCollection(String name, Class<D> type) {
            this.name = name;
            this.type = type;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Optional<D> findById(String id) {
            requireNonNull(id, "Document id cannot be null");
            return Optional.ofNullable(documents.get(id));
        }

        @Override
        public Optional<D> findOne(Predicate<D> predicate) {
            return find(predicate).stream().findFirst();
        }

        @Override
        public List<D> find(Predicate<D> predicate) {
            requireNonNull(predicate, Predicate.class.getSimpleName() + " cannot be null");
            List<D> result = new ArrayList<>();
            synchronized (documents) {
                for (D document : documents.values()) {
                    if (predicate.test(document)) {
                        result.add(document);
                    }
                }
            }
            return Collections.unmodifiableList(result);
        }

        @Override
        public Map<String, D> entries() {
            synchronized (documents) {
                return Collections.unmodifiableMap(new LinkedHashMap<>(documents));
            }
        }

        @Override
        public @Nullable D handle(String id, UnaryOperator<@Nullable D> mutate) {
            requireNonNull(id, "Document id cannot be null");
            requireNonNull(mutate, UnaryOperator.class.getSimpleName() + " cannot be null");
            // compute removes the entry when the function returns null
            return documents.compute(id, (__, existing) -> mutate.apply(existing));
        }

        @Override
        public boolean deleteOne(Predicate<D> predicate) {
            requireNonNull(predicate, Predicate.class.getSimpleName() + " cannot be null");
            synchronized (documents) {
                Iterator<D> iterator = documents.values().iterator();
                while (iterator.hasNext()) {
                    if (predicate.test(iterator.next())) {
                        iterator.remove();
                        return true;
                    }
                }
            }
            return false;
        }

        @Override
        public void deleteAll() {
            documents.clear();
        }

        @Override
        public long count() {
            return documents.size();
        }
    }
}
