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

import org.eventcore.eventstore.api.ExpectedStreamVersion;
import org.jspecify.annotations.Nullable;

/**
 * Options for a single invocation of a command handler.
 *
 * @param expectedStreamVersion The version the stream must have, typically taken from an {@code If-Match} header.
 *                              If {@code null} the version read by the handler is used.
 */
public record HandleOptions(@Nullable ExpectedStreamVersion expectedStreamVersion) {
    private static final HandleOptions DEFAULTS = new HandleOptions(null);

    public static HandleOptions defaults() {
        return DEFAULTS;
    }

    public static HandleOptions expectedStreamVersion(ExpectedStreamVersion expectedStreamVersion) {
        return new HandleOptions(expectedStreamVersion);
    }
}
