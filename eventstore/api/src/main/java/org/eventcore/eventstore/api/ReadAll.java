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
 * Read messages from all streams in global position order. This is what message consumers poll.
 */
public interface ReadAll {

    /**
     * @param afterGlobalPosition Only messages with a global position greater than this are returned, use {@code 0} to read from the beginning
     * @param maxCount            The max number of messages to return
     * @return The messages in global position order
     */
    List<RecordedMessage<Message>> readAll(long afterGlobalPosition, int maxCount);

    /**
     * @return The global position of the last message in the store, {@code 0} if the store is empty.
     */
    long lastGlobalPosition();
}
