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

package org.eventcore.testsupport;

import org.eventcore.dsl.decider.Decider;

import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * Given/when/then style testing of a {@link Decider}.
 * <pre>
 * DeciderSpecification.forDecider(new ShoppingCartDecider())
 *         .given(new ProductItemAdded(shoes))
 *         .when(new AddProductItem(socks))
 *         .then(new ProductItemAdded(socks));
 * </pre>
 */
public class DeciderSpecification<C, S, E> {
    private final Decider<C, S, E> decider;

    private DeciderSpecification(Decider<C, S, E> decider) {
        this.decider = requireNonNull(decider, Decider.class.getSimpleName() + " cannot be null");
    }

    public static <C, S, E> DeciderSpecification<C, S, E> forDecider(Decider<C, S, E> decider) {
        return new DeciderSpecification<>(decider);
    }

    @SafeVarargs
    public final Given given(E... events) {
        return new Given(Arrays.asList(events));
    }

    public Given given(List<E> events) {
        return new Given(events);
    }

    public class Given {
        private final List<E> givenEvents;

        private Given(List<E> givenEvents) {
            this.givenEvents = List.copyOf(givenEvents);
        }

        public When when(C command) {
            return new When(givenEvents, command);
        }
    }

    public class When {
        private final List<E> givenEvents;
        private final C command;

        private When(List<E> givenEvents, C command) {
            this.givenEvents = givenEvents;
            this.command = command;
        }

        @SafeVarargs
        public final void then(E... expectedEvents) {
            then(Arrays.asList(expectedEvents));
        }

        public void then(List<E> expectedEvents) {
            List<E> events = decide();
            assertThat(events).containsExactlyElementsOf(expectedEvents);
        }

        /**
         * Assert that the decider rejects the command with an exception of the given type.
         */
        public <T extends Throwable> T thenThrows(Class<T> expectedType) {
            Throwable throwable = catchThrowable(this::decide);
            assertThat(throwable).as("Decider was expected to throw %s", expectedType.getSimpleName()).isInstanceOf(expectedType);
            return expectedType.cast(throwable);
        }

        public <T extends Throwable> T thenThrows(Class<T> expectedType, Predicate<T> errorCheck) {
            T throwable = thenThrows(expectedType);
            assertThat(errorCheck.test(throwable)).as("Error didn't match the error condition: %s", throwable).isTrue();
            return throwable;
        }

        private List<E> decide() {
            S state = decider.fold(decider.initialState(), givenEvents);
            return decider.decide(command, state);
        }
    }
}
