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

import org.jspecify.annotations.Nullable;

/**
 * Thrown when an optimistic concurrency check fails. This is the only kind of error that command handlers
 * retry (and only if they're configured to do so).
 */
public class ConcurrencyException extends EventCoreException {
    public static final int ERROR_CODE = 412;

    public final @Nullable String current;
    public final String expected;

    public ConcurrencyException(@Nullable String current, String expected) {
        this(current, expected, "Expected version " + expected + " does not match current " + current);
    }

    public ConcurrencyException(@Nullable String current, String expected, String message) {
        super(ERROR_CODE, message);
        this.current = current;
        this.expected = expected;
    }
}
