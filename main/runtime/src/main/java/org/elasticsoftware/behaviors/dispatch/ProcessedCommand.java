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

package org.elasticsoftware.behaviors.dispatch;

import org.elasticsoftware.behaviors.aggregate.AggregateState;
import org.elasticsoftware.behaviors.events.DomainEvent;
import org.elasticsoftware.behaviors.log.EventRecord;

import java.util.List;

/**
 * An accepted command: the events as they were appended and the state after folding them.
 */
public record ProcessedCommand<E extends DomainEvent, S extends AggregateState>(String aggregateId,
                                                                                List<EventRecord<E>> events,
                                                                                S state) {
}
