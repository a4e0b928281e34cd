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

package org.eventcore.processor;

import org.eventcore.message.Message;
import org.eventcore.message.RecordedMessage;

import java.util.List;

@FunctionalInterface
public interface EachBatchHandler<M extends Message> {

    /**
     * @param messages The messages of the batch that the processor can handle, never empty
     */
    MessageHandlerResult handle(List<RecordedMessage<M>> messages);
}
