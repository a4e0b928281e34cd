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

package org.eventcore.projection;

import org.eventcore.message.Event;
import org.eventcore.message.RecordedMessage;
import org.eventcore.projection.document.DocumentCollection;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Projections that keep one document per id in a {@link DocumentCollection}. The projection is named after its collection.
 * <pre>
 * ProjectionDefinition details = DocumentProjections.singleStream("shoppingCartDetails", ShoppingCartDetails.class,
 *                                     Set.of("ProductItemAdded", "ShoppingCartConfirmed"), ShoppingCartDetails::evolve, ShoppingCartDetails::initial);
 * </pre>
 */
public final class DocumentProjections {

    private DocumentProjections() {
    }

    /**
     * A projection where events from many streams update the same document.
     *
     * @param collectionName The name of the collection to write documents to
     * @param documentType   The type of the documents
     * @param canHandle      The event types to handle
     * @param documentId     Get the id of the document to update from an event
     * @param evolve         Apply an event to the document ({@code null} if it doesn't exist). Return {@code null} to delete it.
     */
    public static <D, E extends Event> ProjectionDefinition multiStream(String collectionName, Class<D> documentType, Set<String> canHandle,
                                                                        Function<RecordedMessage<E>, String> documentId,
                                                                        BiFunction<@Nullable D, E, @Nullable D> evolve) {
        return new DocumentProjection<>(collectionName, documentType, canHandle, documentId, evolve);
    }

    /**
     * Same as {@link #multiStream(String, Class, Set, Function, BiFunction)} but {@code evolve} gets {@code initialState} when the document doesn't exist.
     */
    public static <D, E extends Event> ProjectionDefinition multiStream(String collectionName, Class<D> documentType, Set<String> canHandle,
                                                                        Function<RecordedMessage<E>, String> documentId,
                                                                        BiFunction<D, E, @Nullable D> evolve, Supplier<D> initialState) {
        requireNonNull(initialState, "initialState cannot be null");
        requireNonNull(evolve, "evolve cannot be null");
        return multiStream(collectionName, documentType, canHandle, documentId,
                (D document, E event) -> evolve.apply(document == null ? initialState.get() : document, event));
    }

    /**
     * A projection with one document per stream, the id of the document is the stream name.
     */
    public static <D, E extends Event> ProjectionDefinition singleStream(String collectionName, Class<D> documentType, Set<String> canHandle,
                                                                         BiFunction<@Nullable D, E, @Nullable D> evolve) {
        return multiStream(collectionName, documentType, canHandle, RecordedMessage::streamName, evolve);
    }

    public static <D, E extends Event> ProjectionDefinition singleStream(String collectionName, Class<D> documentType, Set<String> canHandle,
                                                                         BiFunction<D, E, @Nullable D> evolve, Supplier<D> initialState) {
        return multiStream(collectionName, documentType, canHandle, RecordedMessage::streamName, evolve, initialState);
    }

    private static class DocumentProjection<D, E extends Event> implements ProjectionDefinition {
        private final String collectionName;
        private final Class<D> documentType;
        private final Set<String> canHandle;
        private final Function<RecordedMessage<E>, String> documentId;
        private final BiFunction<@Nullable D, E, @Nullable D> evolve;

        private DocumentProjection(String collectionName, Class<D> documentType, Set<String> canHandle,
                                   Function<RecordedMessage<E>, String> documentId, BiFunction<@Nullable D, E, @Nullable D> evolve) {
            this.collectionName = requireNonNull(collectionName, "collectionName cannot be null");
            this.documentType = requireNonNull(documentType, "documentType cannot be null");
            this.canHandle = Set.copyOf(requireNonNull(canHandle, "canHandle cannot be null"));
            this.documentId = requireNonNull(documentId, "documentId cannot be null");
            this.evolve = requireNonNull(evolve, "evolve cannot be null");
        }

        @Override
        public String name() {
            return collectionName;
        }

        @Override
        public Set<String> canHandle() {
            return canHandle;
        }

        @Override
        public void handle(List<RecordedMessage<Event>> events, ProjectionContext context) {
            DocumentCollection<D> collection = context.documents().collection(collectionName, documentType);
            for (RecordedMessage<Event> recordedEvent : events) {
                if (!canHandle.contains(recordedEvent.type())) {
                    continue;
                }
                RecordedMessage<E> event = recordedEvent.cast();
                collection.handle(documentId.apply(event), document -> evolve.apply(document, event.message()));
            }
        }

        @Override
        public void truncate(ProjectionContext context) {
            context.documents().collection(collectionName, documentType).deleteAll();
        }
    }
}
