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
import org.elasticsoftware.behaviors.commands.Command;
import org.elasticsoftware.behaviors.commands.CommandResult;
import org.elasticsoftware.behaviors.commands.Rejection;
import org.elasticsoftware.behaviors.events.DomainEvent;
import org.elasticsoftware.behaviors.events.UnhandledEventException;
import org.elasticsoftware.behaviors.log.EventLog;
import org.elasticsoftware.behaviors.log.EventRecord;
import org.elasticsoftware.behaviors.state.AggregateStateRecord;
import org.elasticsoftware.behaviors.state.AggregateStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs commands against a {@link Behavior}. For every command it loads the current snapshot (or
 * rebuilds it from the {@link EventLog}), validates the command, appends the resulting events to
 * the log and only then folds them into the next snapshot.
 *
 * <p>Aggregate ids are spread over a fixed number of {@link AggregatePartition}s. Commands for the
 * same aggregate id are processed strictly one after the other, so a command is never validated
 * against a snapshot that is about to be replaced.
 *
 * <p>A validation that does not complete within the configured timeout is answered with a
 * {@link Rejection.Kind#TIMED_OUT} rejection; whatever it produces later is dropped.
 */
public class AggregateDispatcher<C extends Command, E extends DomainEvent, S extends AggregateState> implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AggregateDispatcher.class);
    private final Behavior<C, E, S> behavior;
    private final EventLog<E> eventLog;
    private final AggregateStateRepository<S> stateRepository;
    private final Duration validationTimeout;
    private final List<AggregatePartition> partitions;

    public AggregateDispatcher(Behavior<C, E, S> behavior,
                               EventLog<E> eventLog,
                               AggregateStateRepository<S> stateRepository,
                               int numberOfPartitions,
                               Duration validationTimeout,
                               Duration shutdownTimeout) {
        this.behavior = Objects.requireNonNull(behavior, "behavior");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
        this.stateRepository = Objects.requireNonNull(stateRepository, "stateRepository");
        this.validationTimeout = Objects.requireNonNull(validationTimeout, "validationTimeout");
        if (numberOfPartitions <= 0) {
            throw new IllegalArgumentException("Number of partitions must be positive, got " + numberOfPartitions);
        }
        List<AggregatePartition> created = new ArrayList<>(numberOfPartitions);
        for (int i = 0; i < numberOfPartitions; i++) {
            created.add(new AggregatePartition(behavior.getName(), i, shutdownTimeout));
        }
        this.partitions = List.copyOf(created);
    }

    public String getAggregateName() {
        return behavior.getName();
    }

    public Behavior<C, E, S> getBehavior() {
        return behavior;
    }

    public CompletableFuture<CommandResult<ProcessedCommand<E, S>>> submit(C command) {
        Objects.requireNonNull(command, "command");
        String aggregateId = Objects.requireNonNull(command.getAggregateId(), "aggregateId");
        AggregatePartition partition = partitionFor(aggregateId);
        return partition.submit(aggregateId, () -> process(partition, aggregateId, command));
    }

    /**
     * The current state of an aggregate, read in turn with the commands for that aggregate.
     */
    public CompletableFuture<Optional<S>> getState(String aggregateId) {
        Objects.requireNonNull(aggregateId, "aggregateId");
        AggregatePartition partition = partitionFor(aggregateId);
        return partition.submit(aggregateId, () ->
                CompletableFuture.completedFuture(Optional.ofNullable(loadState(aggregateId)).map(AggregateStateRecord::state)));
    }

    private AggregatePartition partitionFor(String aggregateId) {
        return partitions.get(PartitionUtils.partitionFor(aggregateId, partitions.size()));
    }

    private CompletableFuture<CommandResult<ProcessedCommand<E, S>>> process(AggregatePartition partition,
                                                                             String aggregateId,
                                                                             C command) {
        final AggregateStateRecord<S> current;
        final CompletableFuture<CommandResult<List<E>>> validation;
        try {
            current = loadState(aggregateId);
            validation = current == null
                    ? behavior.validateCreation(command).thenApply(result -> result.<List<E>>map(List::of))
                    : behavior.validateUpdate(command, current.state());
        } catch (RuntimeException e) {
            logger.error("Unable to validate {} for {} {}", command.getClass().getSimpleName(), behavior.getName(), aggregateId, e);
            return CompletableFuture.failedFuture(e);
        }
        return validation
                .orTimeout(validationTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .<CommandResult<ProcessedCommand<E, S>>>handleAsync((result, throwable) -> {
                    if (throwable != null) {
                        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                                ? throwable.getCause() : throwable;
                        if (cause instanceof TimeoutException) {
                            logger.warn("Validation of {} for {} {} timed out after {}ms",
                                    command.getClass().getSimpleName(), behavior.getName(), aggregateId, validationTimeout.toMillis());
                            return CommandResult.rejected(Rejection.timedOut(behavior.getName(), command,
                                    current != null ? aggregateId : null, validationTimeout));
                        }
                        throw new CompletionException(cause);
                    }
                    return result.map(events -> commit(aggregateId, current, events));
                }, partition.executor());
    }

    private ProcessedCommand<E, S> commit(String aggregateId, AggregateStateRecord<S> current, List<E> events) {
        long generation = current != null ? current.generation() : 0L;
        List<EventRecord<E>> records = eventLog.append(aggregateId, generation, events);
        S state = current != null ? current.state() : null;
        try {
            for (EventRecord<E> record : records) {
                state = state == null ? behavior.applyCreation(record.event()) : behavior.applyUpdate(state, record.event());
            }
        } catch (UnhandledEventException e) {
            logger.error("Appended events of {} {} cannot be folded, the aggregate needs attention",
                    behavior.getName(), aggregateId, e);
            stateRepository.remove(aggregateId);
            throw e;
        } catch (RuntimeException e) {
            // the log already holds the events, the next turn rebuilds the snapshot from it
            logger.error("Folding appended events of {} {} failed", behavior.getName(), aggregateId, e);
            stateRepository.remove(aggregateId);
            throw e;
        }
        long lastSequenceNumber = records.get(records.size() - 1).sequenceNumber();
        stateRepository.put(new AggregateStateRecord<>(aggregateId, lastSequenceNumber, state));
        return new ProcessedCommand<>(aggregateId, records, state);
    }

    private AggregateStateRecord<S> loadState(String aggregateId) {
        AggregateStateRecord<S> record = stateRepository.get(aggregateId);
        if (record == null) {
            record = EventReplayer.replay(behavior, aggregateId, eventLog.read(aggregateId)).orElse(null);
            if (record != null) {
                stateRepository.put(record);
            }
        }
        return record;
    }

    @Override
    public void close() {
        logger.info("Closing {} partitions of {}Aggregate", partitions.size(), behavior.getName());
        partitions.forEach(AggregatePartition::close);
        stateRepository.close();
    }
}
