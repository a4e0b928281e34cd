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

package org.eventcore.cloudevents;

import io.cloudevents.CloudEvent;
import org.eventcore.domain.shoppingcart.PricedProductItem;
import org.eventcore.domain.shoppingcart.ShoppingCartCommand.ConfirmShoppingCart;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent.ProductItemAdded;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent.ShoppingCartConfirmed;
import org.eventcore.eventstore.inmemory.InMemoryEventStore;
import org.eventcore.eventstore.inmemory.InMemoryEventStoreConfig;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayNameGeneration(ReplaceUnderscores.class)
class CloudEventPublisherTest {

    private final CloudEventMessageConverter converter = CloudEventMessageConverter.builder(URI.create("urn:eventcore:shopping-carts"))
            .type(ProductItemAdded.class)
            .type(ShoppingCartConfirmed.class)
            .build();

    @Test
    void committed_events_are_published_as_cloud_events_with_stream_metadata() {
        // Given
        List<CloudEvent> published = new CopyOnWriteArrayList<>();
        CloudEventPublisher publisher = new CloudEventPublisher(converter, published::add);
        InMemoryEventStore eventStore = new InMemoryEventStore(InMemoryEventStoreConfig.builder().afterCommitHook(publisher).build());

        // When
        eventStore.appendToStream("shopping_cart-1", List.of(new ProductItemAdded(new PricedProductItem("shoes", 1, 100)), new ConfirmShoppingCart(Instant.now())));
        eventStore.appendToStream("shopping_cart-1", List.of(new ShoppingCartConfirmed(Instant.now())));

        // Then
        assertThat(published).extracting(CloudEvent::getType).containsExactly("ProductItemAdded", "ShoppingCartConfirmed");
        assertThat(published).extracting(CloudEvent::getSubject).containsOnly("shopping_cart-1");
        assertThat(published).extracting(cloudEvent -> cloudEvent.getExtension(CloudEventMessageConverter.STREAM_POSITION)).containsExactly(1L, 3L);
    }

    @Test
    void published_event_is_converted_without_stream_metadata() {
        // Given
        List<CloudEvent> published = new CopyOnWriteArrayList<>();
        CloudEventPublisher publisher = new CloudEventPublisher(converter, published::add);

        // When
        publisher.publish(new ShoppingCartConfirmed(Instant.now()));

        // Then
        assertThat(published).singleElement().satisfies(cloudEvent -> {
            assertThat(cloudEvent.getType()).isEqualTo("ShoppingCartConfirmed");
            assertThat(cloudEvent.getSubject()).isNull();
        });
    }
}
