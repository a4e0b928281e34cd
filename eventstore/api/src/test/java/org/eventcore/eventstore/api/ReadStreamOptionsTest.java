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

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ReadStreamOptionsTest {

    @Test
    void all_reads_the_whole_stream() {
        // When
        ReadStreamOptions options = ReadStreamOptions.all();

        // Then
        assertThat(options.skip()).isZero();
        assertThat(options.endExclusive(7)).isEqualTo(7);
        assertThat(options.expectedStreamVersion().isNoConcurrencyCheck()).isTrue();
    }

    @Test
    void from_and_to_are_inclusive() {
        // When
        ReadStreamOptions options = ReadStreamOptions.all().from(2).to(4);

        // Then
        assertThat(options.skip()).isEqualTo(1);
        assertThat(options.endExclusive(10)).isEqualTo(4);
    }

    @Test
    void max_count_limits_the_range_counted_from_the_first_position() {
        // When
        ReadStreamOptions options = ReadStreamOptions.all().from(3).maxCount(2);

        // Then
        assertThat(options.endExclusive(10)).isEqualTo(4);
    }

    @Test
    void range_beyond_the_end_of_the_stream_is_empty() {
        // When
        ReadStreamOptions options = ReadStreamOptions.all().from(5);

        // Then
        assertThat(options.endExclusive(2)).isEqualTo(options.skip());
    }

    @Test
    void from_must_be_positive() {
        assertThatThrownBy(() -> ReadStreamOptions.all().from(0))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("from must be greater than zero");
    }
}
