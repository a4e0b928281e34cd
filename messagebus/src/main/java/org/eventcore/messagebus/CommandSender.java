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

package org.eventcore.messagebus;

import org.eventcore.message.Command;

public interface CommandSender {
    /**
     * Send a command to its (single) handler.
     *
     * @throws org.eventcore.errors.EventCoreException If no handler is registered for the command type
     */
    <C extends Command> void send(C command);
}
