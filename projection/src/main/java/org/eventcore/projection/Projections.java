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

import org.eventcore.errors.EventCoreException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Register projections and select the ones of a specific {@link ProjectionHandlingType}.
 * <pre>
 * List&lt;ProjectionRegistration&gt; projections = List.of(Projections.inline(shoppingCartDetails), Projections.async(shoppingCartSummary));
 * List&lt;ProjectionDefinition&gt; inline = Projections.filter(ProjectionHandlingType.INLINE, projections);
 * </pre>
 */
public final class Projections {

    private Projections() {
    }

    public static ProjectionRegistration inline(ProjectionDefinition projection) {
        return new ProjectionRegistration(ProjectionHandlingType.INLINE, projection);
    }

    public static List<ProjectionRegistration> inline(ProjectionDefinition... projections) {
        return register(ProjectionHandlingType.INLINE, projections);
    }

    public static ProjectionRegistration async(ProjectionDefinition projection) {
        return new ProjectionRegistration(ProjectionHandlingType.ASYNC, projection);
    }

    public static List<ProjectionRegistration> async(ProjectionDefinition... projections) {
        return register(ProjectionHandlingType.ASYNC, projections);
    }

    /**
     * @param type          The handling type to select
     * @param registrations All registrations
     * @return The projections registered with {@code type}, in registration order
     * @throws EventCoreException If two projections of {@code type} share the same name
     */
    public static List<ProjectionDefinition> filter(ProjectionHandlingType type, List<ProjectionRegistration> registrations) {
        requireNonNull(type, ProjectionHandlingType.class.getSimpleName() + " cannot be null");
        requireNonNull(registrations, "registrations cannot be null");
        List<ProjectionDefinition> projections = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (ProjectionRegistration registration : registrations) {
            if (registration.type() != type) {
                continue;
            }
            ProjectionDefinition projection = registration.projection();
            if (!names.add(projection.name())) {
                throw new EventCoreException("You cannot register multiple projections with the same name (or without the name). Ensure that:\n"
                        + "- your projections have unique names,\n"
                        + "- you don't register the same projection twice.\n"
                        + "Duplicated projection name: " + projection.name());
            }
            projections.add(projection);
        }
        return projections;
    }

    private static List<ProjectionRegistration> register(ProjectionHandlingType type, ProjectionDefinition... projections) {
        List<ProjectionRegistration> registrations = new ArrayList<>(projections.length);
        for (ProjectionDefinition projection : projections) {
            registrations.add(new ProjectionRegistration(type, projection));
        }
        return registrations;
    }
}
