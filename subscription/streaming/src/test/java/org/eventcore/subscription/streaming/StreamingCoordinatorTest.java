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

package org.eventcore.subscription.streaming;

import org.eventcore.domain.shoppingcart.PricedProductItem;
import org.eventcore.domain.shoppingcart.ShoppingCartEvent.ProductItemAdded;
import org.eventcore.eventstore.inmemory.InMemoryEventStore;
import org.eventcore.eventstore.inmemory.InMemoryEventStoreConfig;
import org.eventcore.message.Message;
import org.eventcore.message.RecordedMessage;
import org.eventcore.subscription.streaming.StreamItem.CaughtUp;
import org.eventcore.subscription.streaming.StreamItem.Delivered;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.awaitility.Awaitility.await;

@DisplayNameGeneration(ReplaceUnderscores.class)
class StreamingCoordinatorTest {

    private StreamingCoordinator coordinator;

    @BeforeEach
    void create_coordinator() {
        coordinator = new StreamingCoordinator();
    }

    @AfterEach
    void shutdown_coordinator() {
        coordinator.shutdown();
    }

    @Nested
    @DisplayName("replay")
    class Replay {

        @Test
        void stream_of_an_empty_coordinator_starts_with_a_caught_up_marker_at_position_zero() {
            // When
            CaughtUpStream stream = coordinator.stream();

            // Then
            assertThat(stream.drain()).containsExactly(new CaughtUp(0));
        }

        @Test
        void stream_replays_the_full_history_followed_by_a_caught_up_marker() {
            // Given
            List<RecordedMessage<Message>> history = messages(1, 3);
            coordinator.notify(history);

            // When
            CaughtUpStream stream = coordinator.stream();

            // Then
            assertThat(stream.drain()).containsExactly(new Delivered(history.get(0)), new Delivered(history.get(1)), new Delivered(history.get(2)), new CaughtUp(3));
        }

        @Test
        void empty_notification_is_ignored() {
            // Given
            CaughtUpStream stream = coordinator.stream();
            stream.drain();

            // When
            coordinator.notify(List.of());

            // Then
            assertThat(stream.drain()).isEmpty();
            assertThat(coordinator.stream().drain()).containsExactly(new CaughtUp(0));
        }
    }

    @Nested
    @DisplayName("live messages")
    class LiveMessages {

        @Test
        void caught_up_marker_is_emitted_after_the_last_message_of_each_notification() {
            // Given
            CaughtUpStream stream = coordinator.stream();
            stream.drain();
            List<RecordedMessage<Message>> first = messages(1, 2);
            List<RecordedMessage<Message>> second = messages(3, 3);

            // When
            coordinator.notify(first);
            coordinator.notify(second);

            // Then
            assertThat(stream.drain()).containsExactly(new Delivered(first.get(0)), new Delivered(first.get(1)), new CaughtUp(2),
                    new Delivered(second.get(0)), new CaughtUp(3));
            assertThat(stream.highWaterMark()).isEqualTo(3);
        }

        @Test
        void every_listener_receives_the_live_messages() {
            // Given
            CaughtUpStream first = coordinator.stream();
            CaughtUpStream second = coordinator.stream();
            List<RecordedMessage<Message>> messages = messages(1, 1);

            // When
            coordinator.notify(messages);

            // Then
            assertThat(first.drain()).containsExactly(new CaughtUp(0), new Delivered(messages.get(0)), new CaughtUp(1));
            assertThat(second.drain()).containsExactly(new CaughtUp(0), new Delivered(messages.get(0)), new CaughtUp(1));
        }

        @Test
        void listener_reading_on_another_thread_receives_everything_in_order() throws InterruptedException {
            // Given
            CaughtUpStream stream = coordinator.stream();
            List<StreamItem> received = new CopyOnWriteArrayList<>();
            Thread reader = new Thread(() -> {
                try {
                    while (true) {
                        received.add(stream.take());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (IllegalStateException e) {
                    // Stream closed
                }
            });
            reader.start();

            // When
            for (long position = 1; position <= 5; position++) {
                coordinator.notify(messages(position, position));
            }

            // Then
            await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> assertThat(received).hasSize(11));
            assertThat(received.get(received.size() - 1)).isEqualTo(new CaughtUp(5));
            stream.close();
            reader.join(2000);
            assertThat(reader.isAlive()).isFalse();
        }
    }

    @Nested
    @DisplayName("listener lifetime")
    class ListenerLifetime {

        @Test
        void closing_a_stream_deregisters_it_right_away() {
            // Given
            CaughtUpStream stream = coordinator.stream();
            stream.drain();

            // When
            stream.close();
            coordinator.notify(messages(1, 1));

            // Then
            assertThat(stream.isClosed()).isTrue();
            assertThat(coordinator.listenerCount()).isZero();
            assertThat(stream.drain()).isEmpty();
        }

        @Test
        void take_on_a_closed_and_drained_stream_throws() {
            // Given
            CaughtUpStream stream = coordinator.stream();
            stream.drain();
            stream.close();

            // When
            Throwable throwable = catchThrowable(stream::take);

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class).hasMessage("Stream " + stream.id() + " is closed");
        }

        @Test
        void listener_that_is_not_keeping_up_is_deregistered() {
            // Given
            coordinator = new StreamingCoordinator(3);
            CaughtUpStream slow = coordinator.stream();
            CaughtUpStream fast = coordinator.stream();

            // When
            coordinator.notify(messages(1, 2));
            fast.drain();
            coordinator.notify(messages(3, 4));

            // Then
            assertThat(slow.isClosed()).isTrue();
            assertThat(fast.isClosed()).isFalse();
            assertThat(coordinator.listenerCount()).isEqualTo(1);
        }

        @Test
        void listener_is_kept_when_the_last_message_of_a_notification_fills_its_queue() {
            // Given
            coordinator = new StreamingCoordinator(2);
            CaughtUpStream stream = coordinator.stream();

            // When
            coordinator.notify(messages(1, 2));

            // Then
            assertThat(stream.isClosed()).isFalse();
            assertThat(coordinator.listenerCount()).isEqualTo(1);
            List<StreamItem> items = stream.drain();
            assertThat(items).hasSize(4);
            assertThat(items.get(0)).isEqualTo(new CaughtUp(0));
            assertThat(items.get(3)).isEqualTo(new CaughtUp(2));
        }

        @Test
        void history_does_not_count_against_the_capacity_of_a_listener() {
            // Given
            coordinator = new StreamingCoordinator(1);
            coordinator.notify(messages(1, 10));

            // When
            CaughtUpStream stream = coordinator.stream();

            // Then
            assertThat(stream.drain()).hasSize(11);
            assertThat(coordinator.listenerCount()).isEqualTo(1);
        }

        @Test
        void stream_cannot_be_created_after_shutdown() {
            // Given
            CaughtUpStream stream = coordinator.stream();
            coordinator.shutdown();

            // When
            Throwable throwable = catchThrowable(coordinator::stream);

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class);
            assertThat(stream.isClosed()).isTrue();
            assertThat(coordinator.listenerCount()).isZero();
        }
    }

    @Test
    void coordinator_registered_as_after_commit_hook_streams_the_messages_appended_to_the_event_store() {
        // Given
        InMemoryEventStore eventStore = new InMemoryEventStore(InMemoryEventStoreConfig.builder().afterCommitHook(coordinator).build());
        eventStore.appendToStream("shopping_cart-1", List.of(new ProductItemAdded(new PricedProductItem("shoes", 2, 100))));
        CaughtUpStream stream = coordinator.stream();

        // When
        eventStore.appendToStream("shopping_cart-2", List.of(new ProductItemAdded(new PricedProductItem("socks", 1, 10))));

        // Then
        List<StreamItem> items = stream.drain();
        assertThat(items).hasSize(4);
        assertThat(items.get(1)).isEqualTo(new CaughtUp(1));
        assertThat(((Delivered) items.get(2)).message().streamName()).isEqualTo("shopping_cart-2");
        assertThat(items.get(3)).isEqualTo(new CaughtUp(2));
    }

    @Test
    void stream_receives_concurrently_appended_messages_in_global_position_order() throws Exception {
        // Given
        InMemoryEventStore eventStore = new InMemoryEventStore(InMemoryEventStoreConfig.builder().afterCommitHook(coordinator).build());
        CaughtUpStream stream = coordinator.stream();
        int numberOfThreads = 8;
        int appendsPerThread = 200;
        ExecutorService executor = Executors.newFixedThreadPool(numberOfThreads);
        CountDownLatch start = new CountDownLatch(1);

        // When
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int thread = 0; thread < numberOfThreads; thread++) {
                String streamName = "shopping_cart-" + thread;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < appendsPerThread; i++) {
                        eventStore.appendToStream(streamName, List.of(new ProductItemAdded(new PricedProductItem("socks", 1, 10))));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        List<Long> globalPositions = stream.drain().stream()
                .filter(item -> item instanceof Delivered)
                .map(item -> ((Delivered) item).message().globalPosition())
                .collect(Collectors.toList());
        assertThat(stream.isClosed()).isFalse();
        assertThat(globalPositions).hasSize(numberOfThreads * appendsPerThread).isSorted().doesNotHaveDuplicates();
    }

    private static List<RecordedMessage<Message>> messages(long fromGlobalPosition, long toGlobalPosition) {
        return LongStream.rangeClosed(fromGlobalPosition, toGlobalPosition)
                .mapToObj(position -> new RecordedMessage<Message>(new ProductItemAdded(new PricedProductItem("product-" + position, 1, 10)),
                        UUID.randomUUID().toString(), "shopping_cart-" + position, 1, position))
                .collect(Collectors.toList());
    }
}
