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

import org.eventcore.errors.EventCoreException;
import org.eventcore.message.Event;
import org.eventcore.message.RecordedMessage;
import org.eventcore.projection.document.InMemoryDocumentStore;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ProjectionsTest {

    @Test
    void filter_returns_projections_of_the_requested_type_in_registration_order() {
        // Given
        ProjectionDefinition first = named("first");
        ProjectionDefinition second = named("second");
        ProjectionDefinition third = named("third");

        // When
        List<ProjectionDefinition> inline = Projections.filter(ProjectionHandlingType.INLINE,
                List.of(Projections.inline(first), Projections.async(second), Projections.inline(third)));

        // Then
        assertThat(inline).containsExactly(first, third);
    }

    @Test
    void filter_throws_when_two_projections_of_the_same_type_share_a_name() {
        // Given
        List<ProjectionRegistration> registrations = Projections.inline(named("details"), named("details"));

        // Then
        assertThatThrownBy(() -> Projections.filter(ProjectionHandlingType.INLINE, registrations))
                .isExactlyInstanceOf(EventCoreException.class)
                .hasMessageStartingWith("You cannot register multiple projections with the same name");
    }

    @Test
    void filter_throws_when_two_projections_of_the_same_type_are_anonymous() {
        // Given
        List<ProjectionRegistration> registrations = Projections.inline(named(null), named(null));

        // Then
        assertThatThrownBy(() -> Projections.filter(ProjectionHandlingType.INLINE, registrations))
                .isExactlyInstanceOf(EventCoreException.class);
    }

    @Test
    void anonymous_and_empty_named_projections_do_not_clash() {
        // Given
        List<ProjectionRegistration> registrations = Projections.inline(named(null), named(""));

        // When
        List<ProjectionDefinition> inline = Projections.filter(ProjectionHandlingType.INLINE, registrations);

        // Then
        assertThat(inline).hasSize(2);
    }

    @Test
    void same_name_is_allowed_for_different_handling_types() {
        // Given
        List<ProjectionRegistration> registrations = List.of(Projections.inline(named("details")), Projections.async(named("details")));

        // When
        List<ProjectionDefinition> async = Projections.filter(ProjectionHandlingType.ASYNC, registrations);

        // Then
        assertThat(async).hasSize(1);
    }

    @Test
    void inline_projection_handler_only_invokes_projections_handling_any_of_the_event_types() {
        // Given
        List<String> invoked = new ArrayList<>();
        ProjectionDefinition handlesAdded = recording("added", Set.of("ItemAdded"), invoked);
        ProjectionDefinition handlesRemoved = recording("removed", Set.of("ItemRemoved"), invoked);
        List<RecordedMessage<Event>> events = List.of(new RecordedMessage<>(new ItemAdded("x"), "1", "items-1", 1, 1));

        // When
        InlineProjectionHandler.handle(List.of(handlesAdded, handlesRemoved), events, new ProjectionContext(new InMemoryDocumentStore()));

        // Then
        assertThat(invoked).containsExactly("added");
    }

    record ItemAdded(String id) implements Event {
    }

    private static ProjectionDefinition named(@Nullable String name) {
        return new ProjectionDefinition() {
            @Override
            public @Nullable String name() {
                return name;
            }

            @Override
            public Set<String> canHandle() {
                return Set.of();
            }

            @Override
            public void handle(List<RecordedMessage<Event>> events, ProjectionContext context) {
            }
        };
    }

    private static ProjectionDefinition recording(String name, Set<String> canHandle, List<String> invoked) {
        return new ProjectionDefinition() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Set<String> canHandle() {
                return canHandle;
            }

            @Override
            public void handle(List<RecordedMessage<Event>> events, ProjectionContext context) {
                invoked.add(name);
            }
        };
    }
}
