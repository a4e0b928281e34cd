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

package org.eventcore.projection;

import org.eventcore.message.Event;
import org.eventcore.message.RecordedMessage;
import org.eventcore.projection.document.StagedDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs inline projections for the events of a single append. The document changes of all projections are staged
 * and only written once every projection has succeeded. Any exception thrown by a projection propagates to
 * the caller, which is expected to abort the append, and no document is changed.
 */
public class InlineProjectionHandler {
    private static final Logger log = LoggerFactory.getLogger(InlineProjectionHandler.class);

    private InlineProjectionHandler() {
    }

    public static void handle(List<ProjectionDefinition> projections, List<RecordedMessage<Event>> events, ProjectionContext context) {
        if (events.isEmpty()) {
            return;
        }
        StagedDocumentStore staged = new StagedDocumentStore(context.documents());
        ProjectionContext stagedContext = new ProjectionContext(staged);
        for (ProjectionDefinition projection : projections) {
            if (projection.canHandleAnyOf(events)) {
                log.trace("Running inline projection {} for {} events", projection.name(), events.size());
                projection.handle(events, stagedContext);
            }
        }
        staged.commit();
    }
}
