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

package org.eventcore.eventstore.api;

import org.eventcore.errors.ConcurrencyException;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.eventcore.eventstore.api.ExpectedStreamVersion.exactly;
import static org.eventcore.eventstore.api.ExpectedStreamVersion.noConcurrencyCheck;
import static org.eventcore.eventstore.api.ExpectedStreamVersion.streamDoesNotExist;
import static org.eventcore.eventstore.api.ExpectedStreamVersion.streamExists;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ExpectedVersionGuardTest {

    @Nested
    class Matches {

        @Test
        void no_concurrency_check_matches_any_version() {
            assertThat(ExpectedVersionGuard.matches(0, noConcurrencyCheck())).isTrue();
            assertThat(ExpectedVersionGuard.matches(42, noConcurrencyCheck())).isTrue();
        }

        @Test
        void stream_does_not_exist_only_matches_the_version_of_a_missing_stream() {
            assertThat(ExpectedVersionGuard.matches(0, streamDoesNotExist())).isTrue();
            assertThat(ExpectedVersionGuard.matches(1, streamDoesNotExist())).isFalse();
        }

        @Test
        void stream_exists_matches_every_version_but_the_version_of_a_missing_stream() {
            assertThat(ExpectedVersionGuard.matches(0, streamExists())).isFalse();
            assertThat(ExpectedVersionGuard.matches(1, streamExists())).isTrue();
            assertThat(ExpectedVersionGuard.matches(100, streamExists())).isTrue();
        }

        @Test
        void exactly_only_matches_the_same_version() {
            assertThat(ExpectedVersionGuard.matches(3, exactly(3))).isTrue();
            assertThat(ExpectedVersionGuard.matches(2, exactly(3))).isFalse();
            assertThat(ExpectedVersionGuard.matches(4, exactly(3))).isFalse();
        }

        @Test
        void exactly_zero_is_the_same_as_expecting_a_missing_stream() {
            assertThat(ExpectedVersionGuard.matches(0, exactly(0))).isTrue();
        }

        @Test
        void uses_the_supplied_value_to_represent_a_missing_stream() {
            assertThat(ExpectedVersionGuard.matches(-1, streamDoesNotExist(), -1)).isTrue();
            assertThat(ExpectedVersionGuard.matches(0, streamDoesNotExist(), -1)).isFalse();
            assertThat(ExpectedVersionGuard.matches(0, streamExists(), -1)).isTrue();
        }
    }

    @Nested
    class AssertMatches {

        @Test
        void does_nothing_when_version_matches() {
            ExpectedVersionGuard.assertMatches("stream", 2, exactly(2));
        }

        @Test
        void throws_expected_version_conflict_exception_with_context_when_version_does_not_match() {
            // When
            ExpectedVersionConflictException exception = catchThrowableOfType(() -> ExpectedVersionGuard.assertMatches("cart-1", 3, exactly(2)), ExpectedVersionConflictException.class);

            // Then
            assertThat(exception.streamName).isEqualTo("cart-1");
            assertThat(exception.currentStreamVersion).isEqualTo(3);
            assertThat(exception.expectedStreamVersion).isEqualTo(exactly(2));
            assertThat(exception.current).isEqualTo("3");
            assertThat(exception.expected).isEqualTo("2");
            assertThat(exception.errorCode).isEqualTo(ConcurrencyException.ERROR_CODE);
            assertThat(exception).hasMessage("Expected version 2 does not match current 3");
        }

        @Test
        void conflict_is_a_concurrency_exception() {
            assertThatThrownBy(() -> ExpectedVersionGuard.assertMatches("cart-1", 0, streamExists()))
                    .isInstanceOf(ConcurrencyException.class)
                    .hasMessage("Expected version STREAM_EXISTS does not match current 0");
        }
    }

    @Test
    void exactly_cannot_be_negative() {
        assertThatThrownBy(() -> exactly(-1)).isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
