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

import org.eventcore.eventstore.api.AppendToStreamResult;
import org.eventcore.eventstore.api.EventStore;
import org.eventcore.eventstore.api.ExpectedStreamVersion;
import org.eventcore.eventstore.api.ReadStreamOptions;
import org.eventcore.eventstore.api.ReadStreamResult;
import org.eventcore.message.Message;

import java.util.List;

class InMemoryEventStoreDelegate implements EventStore {
    protected final EventStore delegate;

    InMemoryEventStoreDelegate(EventStore delegate) {
        this.delegate = delegate;
    }

    @Override
    public <M extends Message> ReadStreamResult<M> readStream(String streamName, ReadStreamOptions options) {
        return delegate.readStream(streamName, options);
    }

    @Override
    public AppendToStreamResult appendToStream(String streamName, ExpectedStreamVersion expectedStreamVersion, List<? extends Message> messages) {
        return delegate.appendToStream(streamName, expectedStreamVersion, messages);
    }
}
