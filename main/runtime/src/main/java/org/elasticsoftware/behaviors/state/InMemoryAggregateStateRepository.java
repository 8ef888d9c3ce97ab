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

package org.elasticsoftware.behaviors.state;

import org.elasticsoftware.behaviors.aggregate.AggregateState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAggregateStateRepository<S extends AggregateState> implements AggregateStateRepository<S> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryAggregateStateRepository.class);
    private final Map<String, AggregateStateRecord<S>> stateRecordMap = new ConcurrentHashMap<>();

    @Override
    public AggregateStateRecord<S> get(String aggregateId) {
        return stateRecordMap.get(aggregateId);
    }

    @Override
    public void put(AggregateStateRecord<S> record) {
        // generations only move forward, an older snapshot never replaces a newer one
        stateRecordMap.merge(record.aggregateId(), record, (current, candidate) ->
                candidate.generation() >= current.generation() ? candidate : current);
        log.trace("Stored snapshot of {} at generation {}", record.aggregateId(), record.generation());
    }

    @Override
    public void remove(String aggregateId) {
        stateRecordMap.remove(aggregateId);
    }

    @Override
    public void close() {
        stateRecordMap.clear();
    }
}
