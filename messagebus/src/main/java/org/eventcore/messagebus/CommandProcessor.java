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

public interface CommandProcessor {
    /**
     * Register the handler of the given command types. A command type can only have one handler.
     *
     * @throws org.eventcore.errors.EventCoreException If any of the command types already has a handler
     */
    <C extends Command> void handle(MessageHandler<C> commandHandler, String... commandTypes);
}
