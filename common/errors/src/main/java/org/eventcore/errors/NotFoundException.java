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
 * Thrown when an entity that an operation depends on doesn't exist.
 */
public class NotFoundException extends EventCoreException {
    public static final int ERROR_CODE = 404;

    public final @Nullable String id;
    public final @Nullable String type;

    public NotFoundException() {
        this(null, null);
    }

    public NotFoundException(@Nullable String id, @Nullable String type) {
        this(id, type, generateMessage(id, type));
    }

    public NotFoundException(@Nullable String id, @Nullable String type, String message) {
        super(ERROR_CODE, message);
        this.id = id;
        this.type = type;
    }

    private static String generateMessage(@Nullable String id, @Nullable String type) {
        if (id != null) {
            return (type == null ? "State" : type) + " with " + id + " was not found";
        }
        return (type == null ? "State" : type) + " was not found";
    }
}
