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

import java.util.List;

/**
 * Append only store of the events of one kind of aggregate, keyed by aggregate id.
 */
public interface EventLog<E extends DomainEvent> {
    /**
     * Appends events after the given sequence number.
     *
     * @param expectedSequenceNumber the last sequence number the caller has seen for the aggregate,
     *                               {@code 0} when it expects the aggregate not to exist
     * @return the appended records, in order
     * @throws SequenceMismatchException when other events were appended in the meantime
     */
    List<EventRecord<E>> append(String aggregateId, long expectedSequenceNumber, List<E> events);

    List<EventRecord<E>> read(String aggregateId);

    /**
     * @return the last sequence number of the aggregate, {@code 0} if it has no events
     */
    long lastSequenceNumber(String aggregateId);
}
