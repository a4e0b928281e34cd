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

import org.eventcore.domain.shoppingcart.PricedProductItem;
import org.eventcore.domain.shoppingcart.ShoppingCartDetails;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent.ProductItemAdded;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent.ShoppingCartConfirmed;
import org.eventcore.domain.shoppingcart.ShoppingCartStatus;
import org.eventcore.eventstore.inmemory.InMemoryEventStore;
import org.eventcore.message.Event;
import org.eventcore.message.RecordedMessage;
import org.eventcore.projection.DocumentProjections;
import org.eventcore.projection.ProjectionContext;
import org.eventcore.projection.ProjectionDefinition;
import org.eventcore.projection.document.DocumentCollection;
import org.eventcore.projection.document.InMemoryDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ProjectorTest {

    private InMemoryEventStore eventStore;
    private InMemoryDocumentStore documentStore;
    private ProjectionContext context;
    private ProjectionDefinition shoppingCartDetails;

    @BeforeEach
    void create_event_store_and_projection() {
        eventStore = new InMemoryEventStore();
        documentStore = new InMemoryDocumentStore();
        context = new ProjectionContext(documentStore);
        shoppingCartDetails = DocumentProjections.singleStream(ShoppingCartDetails.COLLECTION_NAME, ShoppingCartDetails.class, ShoppingCartDetails.HANDLED_EVENT_TYPES,
                (ShoppingCartDetails document, ShoppingCartEvent event) -> ShoppingCartDetails.evolve(document, event), ShoppingCartDetails::initial);
    }

    @Test
    void processor_id_defaults_to_the_name_of_the_projection() {
        // When
        MessageProcessor<Event> projector = Projector.of(shoppingCartDetails, context);

        // Then
        assertThat(projector.id()).isEqualTo("projection:shoppingCartDetails");
        assertThat(projector.options().canHandle).isEqualTo(ShoppingCartDetails.HANDLED_EVENT_TYPES);
    }

    @Test
    void projection_without_name_requires_a_processor_id() {
        // Given
        ProjectionDefinition anonymous = new ProjectionDefinition() {
            @Override
            public Set<String> canHandle() {
                return Set.of("ProductItemAdded");
            }

            @Override
            public void handle(List<RecordedMessage<Event>> events, ProjectionContext context) {
            }
        };

        // When
        Throwable throwable = catchThrowable(() -> Projector.of(anonymous, context));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("processorId must be defined for projections without name");
    }

    @Test
    void projector_builds_the_read_model_asynchronously_from_the_global_log() {
        // Given
        eventStore.appendToStream("shopping_cart-1", List.of(new ProductItemAdded(new PricedProductItem("shoes", 2, 100)), new ShoppingCartConfirmed(Instant.now())));
        eventStore.appendToStream("shopping_cart-2", List.of(new ProductItemAdded(new PricedProductItem("socks", 3, 10))));
        MessageProcessor<Event> projector = Projector.of(ProcessorOptions.<Event>create().checkpointer(new InMemoryCheckpointer(documentStore)), shoppingCartDetails, context);
        projector.start();

        // When
        projector.handle(eventStore.readAll(0, 100));

        // Then
        DocumentCollection<ShoppingCartDetails> details = documentStore.collection(ShoppingCartDetails.COLLECTION_NAME, ShoppingCartDetails.class);
        assertThat(details.findById("shopping_cart-1")).contains(new ShoppingCartDetails(2, 200, ShoppingCartStatus.CONFIRMED));
        assertThat(details.findById("shopping_cart-2")).contains(new ShoppingCartDetails(3, 30, ShoppingCartStatus.OPENED));
        assertThat(new InMemoryCheckpointer(documentStore).read("projection:shoppingCartDetails", null)).isEqualTo(3L);
    }

    @Test
    void projection_is_truncated_once_when_the_projector_is_started_for_the_first_time() {
        // Given
        DocumentCollection<ShoppingCartDetails> details = documentStore.collection(ShoppingCartDetails.COLLECTION_NAME, ShoppingCartDetails.class);
        details.handle("stale", __ -> new ShoppingCartDetails(1, 1, ShoppingCartStatus.OPENED));
        MessageProcessor<Event> projector = Projector.of(ProcessorOptions.<Event>create().startFrom(StartFrom.beginning()), shoppingCartDetails, context, true);

        // When
        projector.start();
        details.handle("added-after-start", __ -> new ShoppingCartDetails(1, 1, ShoppingCartStatus.OPENED));
        projector.close();
        projector.start();

        // Then
        assertThat(details.findAll()).containsExactly(new ShoppingCartDetails(1, 1, ShoppingCartStatus.OPENED));
        assertThat(details.findById("stale")).isEmpty();
    }
}
