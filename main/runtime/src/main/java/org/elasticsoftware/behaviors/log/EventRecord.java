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

package org.elasticsoftware.behaviors.log;

import org.elasticsoftware.behaviors.events.DomainEvent;

/**
 * An event as stored in the {@link EventLog}. Sequence numbers start at 1 for every aggregate and
 * increase by one for each appended event.
 */
public record EventRecord<E extends DomainEvent>(String aggregateId, long sequenceNumber, E event) {
}
