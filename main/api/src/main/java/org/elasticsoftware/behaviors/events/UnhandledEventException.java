/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.behaviors.events;

import org.elasticsoftware.behaviors.BehaviorsException;

/**
 * An event could not be folded because no event sourcing handler matches it. This means the event
 * history does not belong to the behavior it is replayed with and is treated as a data integrity
 * problem, not as a per command failure.
 */
public class UnhandledEventException extends BehaviorsException {
    private final Class<? extends DomainEvent> eventClass;

    public UnhandledEventException(String aggregateName, DomainEvent event) {
        super("No creation event sourcing handler for " + event.getClass().getSimpleName() + " in " + aggregateName,
                aggregateName,
                event.getAggregateId());
        this.eventClass = event.getClass();
    }

    public Class<? extends DomainEvent> getEventClass() {
        return eventClass;
    }
}
