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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryEventLog<E extends DomainEvent> implements EventLog<E> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventLog.class);
    private final String aggregateName;
    private final ConcurrentHashMap<String, List<EventRecord<E>>> records = new ConcurrentHashMap<>();

    public InMemoryEventLog(String aggregateName) {
        this.aggregateName = aggregateName;
    }

    @Override
    public List<EventRecord<E>> append(String aggregateId, long expectedSequenceNumber, List<E> events) {
        for (E event : events) {
            if (!aggregateId.equals(event.getAggregateId())) {
                throw new IllegalArgumentException("Event " + event.getClass().getSimpleName() + " belongs to aggregate "
                        + event.getAggregateId() + ", not to " + aggregateId);
            }
        }
        List<EventRecord<E>> appended = new ArrayList<>(events.size());
        records.compute(aggregateId, (id, existing) -> {
            List<EventRecord<E>> current = existing != null ? existing : new ArrayList<>();
            long lastSequenceNumber = current.size();
            if (lastSequenceNumber != expectedSequenceNumber) {
                throw new SequenceMismatchException(aggregateName, aggregateId, expectedSequenceNumber, lastSequenceNumber);
            }
            for (E event : events) {
                EventRecord<E> record = new EventRecord<>(aggregateId, ++lastSequenceNumber, event);
                current.add(record);
                appended.add(record);
            }
            return current;
        });
        log.trace("Appended {} events to {} {}", appended.size(), aggregateName, aggregateId);
        return Collections.unmodifiableList(appended);
    }

    @Override
    public List<EventRecord<E>> read(String aggregateId) {
        List<EventRecord<E>> result = new ArrayList<>();
        records.computeIfPresent(aggregateId, (id, existing) -> {
            result.addAll(existing);
            return existing;
        });
        return Collections.unmodifiableList(result);
    }

    @Override
    public long lastSequenceNumber(String aggregateId) {
        return read(aggregateId).size();
    }
}
