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
import org.elasticsoftware.behaviors.aggregate.Behavior;
import org.elasticsoftware.behaviors.events.DomainEvent;
import org.elasticsoftware.behaviors.events.UnhandledEventException;
import org.elasticsoftware.behaviors.log.EventRecord;
import org.elasticsoftware.behaviors.state.AggregateStateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Rebuilds aggregate state from its event history: the first event goes through the creation
 * fold, every following event through the update fold, in log order.
 */
public final class EventReplayer {
    private static final Logger logger = LoggerFactory.getLogger(EventReplayer.class);

    private EventReplayer() {
    }

    public static <E extends DomainEvent, S extends AggregateState> S replay(Behavior<?, E, S> behavior,
                                                                             List<? extends E> events) {
        if (events.isEmpty()) {
            throw new IllegalArgumentException("Cannot replay an empty event history of " + behavior.getName());
        }
        E first = events.get(0);
        S state;
        try {
            state = behavior.applyCreation(first);
        } catch (UnhandledEventException e) {
            logger.error("Event history of {} {} starts with {}, which does not create the aggregate",
                    behavior.getName(), first.getAggregateId(), first.getClass().getSimpleName(), e);
            throw e;
        }
        for (E event : events.subList(1, events.size())) {
            if (!behavior.isUpdateEventDefined(state, event)) {
                logger.debug("Ignoring {} while replaying {} {}",
                        event.getClass().getSimpleName(), behavior.getName(), state.getAggregateId());
            }
            state = behavior.applyUpdate(state, event);
        }
        return state;
    }

    /**
     * Replays the records of one aggregate.
     *
     * @return the rebuilt snapshot, empty when there is no history
     * @throws IllegalStateException when the sequence numbers are not 1, 2, 3...
     */
    public static <E extends DomainEvent, S extends AggregateState> Optional<AggregateStateRecord<S>> replay(Behavior<?, E, S> behavior,
                                                                                                             String aggregateId,
                                                                                                             List<EventRecord<E>> history) {
        if (history.isEmpty()) {
            return Optional.empty();
        }
        long expectedSequenceNumber = 1L;
        for (EventRecord<E> record : history) {
            if (record.sequenceNumber() != expectedSequenceNumber) {
                throw new IllegalStateException("Event history of " + behavior.getName() + " " + aggregateId
                        + " has sequence number " + record.sequenceNumber() + " where " + expectedSequenceNumber + " was expected");
            }
            expectedSequenceNumber++;
        }
        S state = replay(behavior, history.stream().map(EventRecord::event).toList());
        logger.debug("Replayed {} events of {} {}", history.size(), behavior.getName(), aggregateId);
        return Optional.of(new AggregateStateRecord<>(aggregateId, history.size(), state));
    }
}
