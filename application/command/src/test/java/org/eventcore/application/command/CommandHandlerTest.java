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

package org.eventcore.application.command;

import org.eventcore.domain.shoppingcart.PricedProductItem;
import org.eventcore.domain.shoppingcart.ShoppingCart;
import org.eventcore.domain.shoppingcart.ShoppingCartCommand;
import org.eventcore.domain.shoppingcart.ShoppingCartCommand.AddProductItem;
import org.eventcore.domain.shoppingcart.ShoppingCartCommand.ConfirmShoppingCart;
import org.eventcore.domain.shoppingcart.ShoppingCartDecider;
import org.eventcore.domain.shoppingcart.ShoppingCartDetails;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent.DiscountApplied;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent.ProductItemAdded;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent.ShoppingCartConfirmed;
import org.eventcore.errors.IllegalDomainStateException;
import org.eventcore.eventstore.api.AggregateStreamResult;
import org.eventcore.eventstore.api.ExpectedVersionConflictException;
import org.eventcore.eventstore.api.ReadStreamOptions;
import org.eventcore.eventstore.inmemory.InMemoryEventStore;
import org.eventcore.eventstore.inmemory.InMemoryEventStoreConfig;
import org.eventcore.message.Message;
import org.eventcore.projection.DocumentProjections;
import org.eventcore.projection.Projections;
import org.eventcore.projection.document.InMemoryDocumentStore;
import org.eventcore.retry.RetryStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.eventcore.eventstore.api.ExpectedStreamVersion.exactly;

@DisplayNameGeneration(ReplaceUnderscores.class)
class CommandHandlerTest {
    private static final PricedProductItem SHOES = new PricedProductItem("shoes", 2, 100);
    private static final PricedProductItem SOCKS = new PricedProductItem("socks", 1, 10);

    private InMemoryDocumentStore documentStore;
    private InMemoryEventStore eventStore;

    @BeforeEach
    void create_event_store() {
        documentStore = new InMemoryDocumentStore();
        eventStore = new InMemoryEventStore(InMemoryEventStoreConfig.builder()
                .documentStore(documentStore)
                .projections(Projections.inline(DocumentProjections.singleStream(ShoppingCartDetails.COLLECTION_NAME, ShoppingCartDetails.class, ShoppingCartDetails.HANDLED_EVENT_TYPES,
                        (ShoppingCartDetails document, ShoppingCartEvent event) -> ShoppingCartDetails.evolve(document, event), ShoppingCartDetails::initial)))
                .build());
    }

    @Test
    void adding_a_product_to_an_empty_cart_appends_one_event_and_updates_the_read_model() {
        // Given
        CommandHandler<ShoppingCart, ShoppingCartEvent> commandHandler = new CommandHandler<>(eventStore, CommandHandlerOptions.of(ShoppingCart::evolve, ShoppingCart::initial));

        // When
        CommandHandlerResult<ShoppingCart, ShoppingCartEvent> result = commandHandler.handle("shopping_cart-1", state -> List.of(new ProductItemAdded(SHOES)));

        // Then
        assertThat(result.newEvents()).containsExactly(new ProductItemAdded(SHOES));
        assertThat(result.nextExpectedStreamVersion()).isEqualTo(1);
        assertThat(result.createdNewStream()).isTrue();
        assertThat(result.newState().totalAmount()).isEqualTo(200.0);

        ShoppingCartDetails details = documentStore.collection(ShoppingCartDetails.COLLECTION_NAME, ShoppingCartDetails.class).findById("shopping_cart-1").orElseThrow();
        assertThat(details.totalAmount()).isEqualTo(200.0);
        assertThat(details.productItemsCount()).isEqualTo(2);
    }

    @Test
    void decision_without_events_does_not_append() {
        // Given
        eventStore.appendToStream("shopping_cart-1", List.of(new ProductItemAdded(SHOES)));
        CommandHandler<ShoppingCart, ShoppingCartEvent> commandHandler = new CommandHandler<>(eventStore, CommandHandlerOptions.of(ShoppingCart::evolve, ShoppingCart::initial));

        // When
        CommandHandlerResult<ShoppingCart, ShoppingCartEvent> result = commandHandler.handle("shopping_cart-1", state -> List.of());

        // Then
        assertThat(result.newEvents()).isEmpty();
        assertThat(result.nextExpectedStreamVersion()).isEqualTo(1);
        assertThat(result.createdNewStream()).isFalse();
        assertThat(result.newState().productItemsCount()).isEqualTo(2);
        assertThat(eventStore.lastGlobalPosition()).isEqualTo(1);
    }

    @Test
    void stream_id_is_mapped_to_a_stream_name() {
        // Given
        CommandHandler<ShoppingCart, ShoppingCartEvent> commandHandler = new CommandHandler<>(eventStore,
                CommandHandlerOptions.<ShoppingCart, ShoppingCartEvent>of(ShoppingCart::evolve, ShoppingCart::initial).mapToStreamId(id -> "shopping_cart-" + id));

        // When
        commandHandler.handle("42", state -> List.of(new ProductItemAdded(SHOES)));

        // Then
        assertThat(eventStore.exists("shopping_cart-42")).isTrue();
    }

    @Test
    void new_state_folds_the_new_events_onto_the_current_state() {
        // Given
        CommandHandler<ShoppingCart, ShoppingCartEvent> commandHandler = new CommandHandler<>(eventStore, CommandHandlerOptions.of(ShoppingCart::evolve, ShoppingCart::initial));
        commandHandler.handle("shopping_cart-1", state -> List.of(new ProductItemAdded(SHOES)));

        // When
        CommandHandlerResult<ShoppingCart, ShoppingCartEvent> result = commandHandler.handle("shopping_cart-1", state -> List.of(new ProductItemAdded(SOCKS), new DiscountApplied(10, "ten")));

        // Then
        assertThat(result.nextExpectedStreamVersion()).isEqualTo(3);
        assertThat(result.createdNewStream()).isFalse();
        assertThat(result.newState().totalAmount()).isEqualTo(189.0);
        AggregateStreamResult<ShoppingCart> stored = eventStore.aggregateStream("shopping_cart-1", ShoppingCart::initial, ShoppingCart::evolve);
        assertThat(stored.state()).isEqualTo(result.newState());
    }

    @Nested
    @DisplayName("expected stream version")
    class ExpectedStreamVersionTest {

        @Test
        void uses_the_expected_stream_version_passed_by_the_caller() {
            // Given
            CommandHandler<ShoppingCart, ShoppingCartEvent> commandHandler = new CommandHandler<>(eventStore, CommandHandlerOptions.of(ShoppingCart::evolve, ShoppingCart::initial));
            commandHandler.handle("shopping_cart-1", state -> List.of(new ProductItemAdded(SHOES)));
            commandHandler.handle("shopping_cart-1", state -> List.of(new ProductItemAdded(SOCKS)));

            // When
            Throwable throwable = catchThrowable(() -> commandHandler.handle("shopping_cart-1", state -> List.of(new ShoppingCartConfirmed(Instant.now())), HandleOptions.expectedStreamVersion(exactly(1))));

            // Then
            assertThat(throwable).isExactlyInstanceOf(ExpectedVersionConflictException.class).hasMessage("Expected version 1 does not match current 2");
            assertThat(eventStore.readStream("shopping_cart-1").currentStreamVersion()).isEqualTo(2);
        }

        @Test
        void concurrent_append_between_read_and_append_fails_without_retry() {
            // Given
            ConcurrentWriteOnFirstRead concurrentWriter = new ConcurrentWriteOnFirstRead(eventStore, 1);
            CommandHandler<ShoppingCart, ShoppingCartEvent> commandHandler = new CommandHandler<>(concurrentWriter, CommandHandlerOptions.of(ShoppingCart::evolve, ShoppingCart::initial));

            // When
            Throwable throwable = catchThrowable(() -> commandHandler.handle("shopping_cart-1", state -> List.of(new ProductItemAdded(SHOES))));

            // Then
            assertThat(throwable).isInstanceOfSatisfying(ExpectedVersionConflictException.class, e -> {
                assertThat(e.currentStreamVersion).isEqualTo(1);
                assertThat(e.expectedStreamVersion.toString()).isEqualTo("STREAM_DOES_NOT_EXIST");
            });
        }

        @Test
        void version_conflict_is_retried_from_scratch_when_configured() {
            // Given
            ConcurrentWriteOnFirstRead concurrentWriter = new ConcurrentWriteOnFirstRead(eventStore, 1);
            AtomicInteger decisions = new AtomicInteger();
            CommandHandler<ShoppingCart, ShoppingCartEvent> commandHandler = new CommandHandler<>(concurrentWriter,
                    CommandHandlerOptions.<ShoppingCart, ShoppingCartEvent>of(ShoppingCart::evolve, ShoppingCart::initial).retryStrategy(CommandHandlerRetry.onVersionConflict()));

            // When
            CommandHandlerResult<ShoppingCart, ShoppingCartEvent> result = commandHandler.handle("shopping_cart-1", state -> {
                decisions.incrementAndGet();
                return List.of(new ProductItemAdded(SHOES));
            });

            // Then
            assertThat(decisions).hasValue(2);
            assertThat(result.nextExpectedStreamVersion()).isEqualTo(2);
            assertThat(result.newState().productItemsCount()).isEqualTo(3);
        }

        @Test
        void business_rule_violations_are_not_retried() {
            // Given
            AtomicInteger decisions = new AtomicInteger();
            CommandHandler<ShoppingCart, ShoppingCartEvent> commandHandler = new CommandHandler<>(eventStore,
                    CommandHandlerOptions.<ShoppingCart, ShoppingCartEvent>of(ShoppingCart::evolve, ShoppingCart::initial)
                            .retryStrategy(RetryStrategy.retry().maxRetries(5).retryIf(ExpectedVersionConflictException.class::isInstance)));

            // When
            Throwable throwable = catchThrowable(() -> commandHandler.handle("shopping_cart-1", state -> {
                decisions.incrementAndGet();
                throw new IllegalDomainStateException("nope");
            }));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalDomainStateException.class);
            assertThat(decisions).hasValue(1);
        }
    }

    @Nested
    @DisplayName("decider")
    class DeciderCommandHandlerTest {

        @Test
        void adding_a_product_to_a_confirmed_cart_is_rejected_and_nothing_is_appended() {
            // Given
            eventStore.appendToStream("shopping_cart-1", List.of(new ProductItemAdded(SHOES), new ShoppingCartConfirmed(Instant.now())));
            DeciderCommandHandler<ShoppingCartCommand, ShoppingCart, ShoppingCartEvent> commandHandler =
                    new DeciderCommandHandler<>(eventStore, new ShoppingCartDecider());

            // When
            Throwable throwable = catchThrowable(() -> commandHandler.handle("shopping_cart-1", new AddProductItem(SOCKS)));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalDomainStateException.class);
            assertThat(eventStore.readStream("shopping_cart-1").currentStreamVersion()).isEqualTo(2);
            assertThat(eventStore.lastGlobalPosition()).isEqualTo(2);
        }

        @Test
        void multiple_commands_are_decided_in_order_and_appended_at_once() {
            // Given
            DeciderCommandHandler<ShoppingCartCommand, ShoppingCart, ShoppingCartEvent> commandHandler =
                    new DeciderCommandHandler<>(eventStore, new ShoppingCartDecider());
            Instant now = Instant.now();

            // When
            CommandHandlerResult<ShoppingCart, ShoppingCartEvent> result = commandHandler.handle("shopping_cart-1",
                    List.of(new AddProductItem(SHOES), new ConfirmShoppingCart(now)), HandleOptions.defaults());

            // Then
            assertThat(result.newEvents()).containsExactly(new ProductItemAdded(SHOES), new ShoppingCartConfirmed(now));
            assertThat(result.nextExpectedStreamVersion()).isEqualTo(2);
            assertThat(result.newState().isConfirmed()).isTrue();
        }
    }

    /**
     * Appends {@code numberOfEvents} events to the stream right after the first aggregation, simulating a concurrent writer.
     */
    private static class ConcurrentWriteOnFirstRead extends InMemoryEventStoreDelegate {
        private final int numberOfEvents;
        private boolean written;

        ConcurrentWriteOnFirstRead(InMemoryEventStore delegate, int numberOfEvents) {
            super(delegate);
            this.numberOfEvents = numberOfEvents;
        }

        @Override
        public <S, M extends Message> AggregateStreamResult<S> aggregateStream(String streamName, Supplier<S> initialState, BiFunction<S, M, S> evolve, ReadStreamOptions options) {
            AggregateStreamResult<S> result = super.aggregateStream(streamName, initialState, evolve, options);
            if (!written) {
                written = true;
                for (int i = 0; i < numberOfEvents; i++) {
                    delegate.appendToStream(streamName, List.of(new ProductItemAdded(new PricedProductItem("concurrent", 1, 1))));
                }
            }
            return result;
        }
    }
}
