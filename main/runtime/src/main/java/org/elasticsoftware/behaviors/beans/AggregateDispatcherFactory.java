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

package org.elasticsoftware.behaviors.beans;

import org.elasticsoftware.behaviors.aggregate.AggregateState;
import org.elasticsoftware.behaviors.aggregate.Behavior;
import org.elasticsoftware.behaviors.commands.Command;
import org.elasticsoftware.behaviors.dispatch.AggregateDispatcher;
import org.elasticsoftware.behaviors.events.DomainEvent;
import org.elasticsoftware.behaviors.log.EventLog;
import org.elasticsoftware.behaviors.log.InMemoryEventLog;
import org.elasticsoftware.behaviors.state.InMemoryAggregateStateRepository;

import java.time.Duration;

public class AggregateDispatcherFactory {
    private final int partitions;
    private final Duration validationTimeout;
    private final Duration shutdownTimeout;

    public AggregateDispatcherFactory(int partitions, Duration validationTimeout, Duration shutdownTimeout) {
        this.partitions = partitions;
        this.validationTimeout = validationTimeout;
        this.shutdownTimeout = shutdownTimeout;
    }

    public <C extends Command, E extends DomainEvent, S extends AggregateState> AggregateDispatcher<C, E, S> create(Behavior<C, E, S> behavior) {
        return create(behavior, new InMemoryEventLog<>(behavior.getName()));
    }

    public <C extends Command, E extends DomainEvent, S extends AggregateState> AggregateDispatcher<C, E, S> create(Behavior<C, E, S> behavior,
                                                                                                                     EventLog<E> eventLog) {
        return new AggregateDispatcher<>(behavior,
                eventLog,
                new InMemoryAggregateStateRepository<>(),
                partitions,
                validationTimeout,
                shutdownTimeout);
    }

    public int getPartitions() {
        return partitions;
    }

    public Duration getValidationTimeout() {
        return validationTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }
}
