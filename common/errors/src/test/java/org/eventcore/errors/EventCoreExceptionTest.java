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

package org.eventcore.errors;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class EventCoreExceptionTest {

    @Test
    void error_codes_follow_the_error_taxonomy() {
        assertAll(
                () -> assertThat(new EventCoreException("boom").errorCode).isEqualTo(500),
                () -> assertThat(new ValidationException().errorCode).isEqualTo(400),
                () -> assertThat(new IllegalDomainStateException("closed").errorCode).isEqualTo(403),
                () -> assertThat(new NotFoundException().errorCode).isEqualTo(404),
                () -> assertThat(new ConcurrencyException("1", "2").errorCode).isEqualTo(412)
        );
    }

    @Test
    void concurrency_exception_describes_current_and_expected_version() {
        // When
        ConcurrencyException exception = new ConcurrencyException("3", "2");

        // Then
        assertAll(
                () -> assertThat(exception).hasMessage("Expected version 2 does not match current 3"),
                () -> assertThat(exception.current).isEqualTo("3"),
                () -> assertThat(exception.expected).isEqualTo("2")
        );
    }

    @Test
    void not_found_exception_generates_message_from_id_and_type() {
        assertAll(
                () -> assertThat(new NotFoundException("123", "ShoppingCart")).hasMessage("ShoppingCart with 123 was not found"),
                () -> assertThat(new NotFoundException(null, "ShoppingCart")).hasMessage("ShoppingCart was not found"),
                () -> assertThat(new NotFoundException("123", null)).hasMessage("State with 123 was not found"),
                () -> assertThat(new NotFoundException()).hasMessage("State was not found")
        );
    }

    @Test
    void default_error_code_message_contains_status_code() {
        assertThat(new EventCoreException(418)).hasMessage("Error with status code '418' occurred during event processing");
    }
}
