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

package org.eventcore.eventstore.inmemory;

import org.eventcore.eventstore.api.AfterCommitHook;
import org.eventcore.projection.ProjectionDefinition;
import org.eventcore.projection.ProjectionHandlingType;
import org.eventcore.projection.ProjectionRegistration;
import org.eventcore.projection.Projections;
import org.eventcore.projection.document.DocumentStore;
import org.eventcore.projection.document.InMemoryDocumentStore;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.NullUnmarked;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Configuration for the {@link InMemoryEventStore}. By default there are no projections and no hooks, and inline
 * projections write to a new {@link InMemoryDocumentStore}.
 */
@NullMarked
public class InMemoryEventStoreConfig {
    public final List<ProjectionDefinition> inlineProjections;
    public final DocumentStore documentStore;
    public final List<AfterCommitHook> afterCommitHooks;

    private InMemoryEventStoreConfig(List<ProjectionRegistration> projections, DocumentStore documentStore, List<AfterCommitHook> afterCommitHooks) {
        Objects.requireNonNull(documentStore, DocumentStore.class.getSimpleName() + " cannot be null");
        // Validates that projection names are unique
        this.inlineProjections = Collections.unmodifiableList(Projections.filter(ProjectionHandlingType.INLINE, projections));
        this.documentStore = documentStore;
        this.afterCommitHooks = List.copyOf(afterCommitHooks);
    }

    public static InMemoryEventStoreConfig defaultConfig() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InMemoryEventStoreConfig)) return false;
        InMemoryEventStoreConfig that = (InMemoryEventStoreConfig) o;
        return Objects.equals(inlineProjections, that.inlineProjections) && Objects.equals(documentStore, that.documentStore) && Objects.equals(afterCommitHooks, that.afterCommitHooks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inlineProjections, documentStore, afterCommitHooks);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", InMemoryEventStoreConfig.class.getSimpleName() + "[", "]")
                .add("inlineProjections=" + inlineProjections)
                .add("documentStore=" + documentStore)
                .add("afterCommitHooks=" + afterCommitHooks)
                .toString();
    }

    @NullUnmarked
    public static final class Builder {
        private final List<ProjectionRegistration> projections = new ArrayList<>();
        private final List<AfterCommitHook> afterCommitHooks = new ArrayList<>();
        private DocumentStore documentStore = new InMemoryDocumentStore();

        /**
         * Register projections. Only {@link ProjectionHandlingType#INLINE} projections are run by the event store, the others are ignored.
         *
         * @return The builder instance
         */
        @NullMarked
        public Builder projections(List<ProjectionRegistration> projections) {
            Objects.requireNonNull(projections, "projections cannot be null");
            this.projections.addAll(projections);
            return this;
        }

        @NullMarked
        public Builder projections(ProjectionRegistration... projections) {
            return projections(List.of(projections));
        }

        /**
         * @param documentStore The document store that inline projections write to
         * @return The builder instance
         */
        @NullMarked
        public Builder documentStore(DocumentStore documentStore) {
            this.documentStore = documentStore;
            return this;
        }

        /**
         * Add a hook that is invoked after each append that wrote at least one message. Hooks are invoked in the order they were added.
         *
         * @return The builder instance
         */
        @NullMarked
        public Builder afterCommitHook(AfterCommitHook afterCommitHook) {
            Objects.requireNonNull(afterCommitHook, AfterCommitHook.class.getSimpleName() + " cannot be null");
            this.afterCommitHooks.add(afterCommitHook);
            return this;
        }

        @NullMarked
        public InMemoryEventStoreConfig build() {
            return new InMemoryEventStoreConfig(projections, documentStore, afterCommitHooks);
        }
    }
}
