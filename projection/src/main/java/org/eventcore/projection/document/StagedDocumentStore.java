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
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import static java.util.Objects.requireNonNull;

/**
 * A {@link DocumentStore} that buffers all changes on top of another store. Reads see the buffered changes, but
 * nothing reaches the underlying store until {@link #commit()} is called. Discarding the instance discards the
 * changes. Used to make inline projections part of the append that triggered them.
 * <p>
 * Not thread-safe, an instance is meant to be used by a single append.
 */
public class StagedDocumentStore implements DocumentStore {
    private final DocumentStore delegate;
    private final Map<String, StagedCollection<?>> collections = new LinkedHashMap<>();

    public StagedDocumentStore(DocumentStore delegate) {
        this.delegate = requireNonNull(delegate, DocumentStore.class.getSimpleName() + " cannot be null");
    }

    @SuppressWarnings("unchecked")
    @Override
    public <D> DocumentCollection<D> collection(String name, Class<D> type) {
        StagedCollection<?> staged = collections.get(name);
        if (staged == null) {
            staged = new StagedCollection<>(delegate.collection(name, type), type);
            collections.put(name, staged);
        } else if (!staged.type.equals(type)) {
            // Let the underlying store report the type mismatch
            delegate.collection(name, type);
        }
        return (DocumentCollection<D>) staged;
    }

    /**
     * Apply the buffered changes to the underlying store, in the order they were made.
     */
    public void commit() {
        for (StagedCollection<?> collection : collections.values()) {
            collection.commit();
        }
        collections.clear();
    }

    public boolean hasChanges() {
        return collections.values().stream().anyMatch(collection -> !collection.changes.isEmpty());
    }

    private static class StagedCollection<D> implements DocumentCollection<D> {
        private final DocumentCollection<D> target;
        private final Class<?> type;
        private final List<Change<D>> changes = new ArrayList<>();
        private @Nullable Map<String, D> working;

        private StagedCollection(DocumentCollection<D> target, Class<D> type) {
            this.target = target;
            this.type = type;
        }

        @Override
        public String name() {
            return target.name();
        }

        @Override
        public Optional<D> findById(String id) {
            requireNonNull(id, "Document id cannot be null");
            return Optional.ofNullable(working().get(id));
        }

        @Override
        public Optional<D> findOne(Predicate<D> predicate) {
            return find(predicate).stream().findFirst();
        }

        @Override
        public List<D> find(Predicate<D> predicate) {
            requireNonNull(predicate, Predicate.class.getSimpleName() + " cannot be null");
            List<D> result = new ArrayList<>();
            for (D document : working().values()) {
                if (predicate.test(document)) {
                    result.add(document);
                }
            }
            return Collections.unmodifiableList(result);
        }

        @Override
        public Map<String, D> entries() {
            return Collections.unmodifiableMap(new LinkedHashMap<>(working()));
        }

        @Override
        public @Nullable D handle(String id, UnaryOperator<@Nullable D> mutate) {
            requireNonNull(id, "Document id cannot be null");
            requireNonNull(mutate, UnaryOperator.class.getSimpleName() + " cannot be null");
            D result = working().compute(id, (__, existing) -> mutate.apply(existing));
            changes.add(result == null ? Change.delete(id) : Change.upsert(id, result));
            return result;
        }

        @Override
        public boolean deleteOne(Predicate<D> predicate) {
            requireNonNull(predicate, Predicate.class.getSimpleName() + " cannot be null");
            Iterator<Map.Entry<String, D>> iterator = working().entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<String, D> entry = iterator.next();
                if (predicate.test(entry.getValue())) {
                    iterator.remove();
                    changes.add(Change.delete(entry.getKey()));
                    return true;
                }
            }
            return false;
        }

        @Override
        public void deleteAll() {
            working().clear();
            changes.add(Change.deleteAll());
        }

        @Override
        public long count() {
            return working().size();
        }

        private Map<String, D> working() {
            if (working == null) {
                working = new LinkedHashMap<>(target.entries());
            }
            return working;
        }

        private void commit() {
            for (Change<D> change : changes) {
                if (change.id == null) {
                    target.deleteAll();
                } else {
                    D document = change.document;
                    target.handle(change.id, __ -> document);
                }
            }
            changes.clear();
            working = null;
        }
    }

    private static class Change<D> {
        // null id means all documents
        private final @Nullable String id;
        private final @Nullable D document;

        private Change(@Nullable String id, @Nullable D document) {
            this.id = id;
            this.document = document;
        }

        static <D> Change<D> upsert(String id, D document) {
            return new Change<>(id, document);
        }

        static <D> Change<D> delete(String id) {
            return new Change<>(id, null);
        }

        static <D> Change<D> deleteAll() {
            return new Change<>(null, null);
        }
    }
}
