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
 * Base class of all exceptions raised by the event sourcing core. Each exception carries an {@link #errorCode}
 * that mirrors the HTTP status code an outer layer would typically map it to.
 */
public class EventCoreException extends RuntimeException {
    public static final int INTERNAL_SERVER_ERROR = 500;

    public final int errorCode;

    public EventCoreException(String message) {
        this(INTERNAL_SERVER_ERROR, message);
    }

    public EventCoreException(int errorCode) {
        this(errorCode, "Error with status code '" + errorCode + "' occurred during event processing");
    }

    public EventCoreException(int errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public EventCoreException(int errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public int getErrorCode() {
        return errorCode;
    }
}
