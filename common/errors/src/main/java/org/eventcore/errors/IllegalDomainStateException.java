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

/**
 * Thrown by domain logic when a command violates a business rule given the current state,
 * for example when adding a product to a shopping cart that is already confirmed.
 */
public class IllegalDomainStateException extends EventCoreException {
    public static final int ERROR_CODE = 403;

    public IllegalDomainStateException() {
        this("Illegal state occurred during event processing");
    }

    public IllegalDomainStateException(String message) {
        super(ERROR_CODE, message);
    }
}
