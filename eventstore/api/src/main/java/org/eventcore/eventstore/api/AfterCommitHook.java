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

import org.eventcore.message.Message;
import org.eventcore.message.RecordedMessage;

import java.util.List;

/**
 * Invoked by an event store after messages have been committed. The messages are already durable when the hook
 * is invoked so a failing hook never fails the append, the store logs the error and carries on.
 */
@FunctionalInterface
public interface AfterCommitHook {

    void afterCommit(List<RecordedMessage<Message>> committedMessages);
}
